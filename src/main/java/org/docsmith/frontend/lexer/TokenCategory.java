package org.docsmith.frontend.lexer;

/**
 * Coarse grouping of {@link TokenKind}s used by kind filters.
 */
public enum TokenCategory {
    /** Commas, brackets and block delimiters. */
    PUNCTUATION,
    /** Spaces, tabs and line continuations. */
    WHITESPACE,
    /** Reserved words such as {@code if}, {@code def} or {@code class}. */
    KEYWORD,
    /** Tokens that denote a literal value on their own. */
    VALUE,
    /** Tokens that name or build a value: identifiers, variables, interpolated strings. */
    NODE,
    /** Operators and anything the lexer could not classify. */
    OTHER
}
