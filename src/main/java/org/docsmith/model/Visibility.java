package org.docsmith.model;

/**
 * Visibility of a documented member.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE
}
