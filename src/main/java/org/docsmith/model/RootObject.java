package org.docsmith.model;

/**
 * The top-level namespace. Its path is the empty string.
 */
public final class RootObject extends NamespaceObject {

    public RootObject() {
        super(null, "");
    }

    @Override
    public String type() {
        return "root";
    }

    @Override
    public String path() {
        return "";
    }
}
