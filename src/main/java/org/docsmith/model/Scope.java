package org.docsmith.model;

/**
 * Whether a member belongs to instances of its namespace or to the namespace itself.
 */
public enum Scope {
    INSTANCE,
    CLASS
}
