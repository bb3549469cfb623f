package org.docsmith.model;

/**
 * A module: a namespace that cannot be instantiated.
 */
public class ModuleObject extends NamespaceObject {

    public ModuleObject(Reference namespace, String name) {
        super(namespace, name);
    }

    @Override
    public String type() {
        return "module";
    }
}
