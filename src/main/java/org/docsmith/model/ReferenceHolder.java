package org.docsmith.model;

import java.util.Map;

/**
 * Capability of objects that point at other documentation objects. The forward
 * reference resolver walks these references before an object is registered.
 */
public interface ReferenceHolder {

    /**
     * The role a reference plays for its holder.
     */
    enum ReferenceRole {
        /** The lexical container of the holder. */
        NAMESPACE,
        /** The parent class of a class. */
        SUPERCLASS
    }

    /**
     * @return The references held, in a stable order. Absent roles are omitted.
     */
    Map<ReferenceRole, Reference> references();

    /**
     * Replaces the reference held for a role.
     * @param role      The role to rewrite.
     * @param reference The new reference.
     */
    void rewriteReference(ReferenceRole role, Reference reference);
}
