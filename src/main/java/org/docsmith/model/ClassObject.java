package org.docsmith.model;

import java.util.Map;

/**
 * A class, optionally pointing at its superclass.
 */
public class ClassObject extends NamespaceObject {

    private Reference superclass;

    public ClassObject(Reference namespace, String name) {
        this(namespace, name, null);
    }

    /**
     * @param namespace  Reference to the enclosing namespace.
     * @param name       The class name.
     * @param superclass Reference to the superclass, or {@code null} if none was written.
     */
    public ClassObject(Reference namespace, String name, Reference superclass) {
        super(namespace, name);
        this.superclass = superclass;
    }

    @Override
    public String type() {
        return "class";
    }

    public Reference superclass() {
        return superclass;
    }

    @Override
    public Map<ReferenceRole, Reference> references() {
        Map<ReferenceRole, Reference> refs = super.references();
        if (superclass != null) {
            refs.put(ReferenceRole.SUPERCLASS, superclass);
        }
        return refs;
    }

    @Override
    public void rewriteReference(ReferenceRole role, Reference reference) {
        if (role == ReferenceRole.SUPERCLASS) {
            this.superclass = reference;
        } else {
            super.rewriteReference(role, reference);
        }
    }
}
