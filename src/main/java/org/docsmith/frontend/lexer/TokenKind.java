package org.docsmith.frontend.lexer;

/**
 * Defines the kinds of tokens the external lexer hands to the handler layer.
 * Every kind carries its {@link TokenCategory} and whether it is a keyword.
 */
public enum TokenKind {
    // Punctuation.
    /** The ',' separator. */
    COMMA(TokenCategory.PUNCTUATION),
    /** The '(' character. */
    LPAREN(TokenCategory.PUNCTUATION),
    /** The ')' character. */
    RPAREN(TokenCategory.PUNCTUATION),
    /** The '{' character. */
    LBRACE(TokenCategory.PUNCTUATION),
    /** The '}' character. */
    RBRACE(TokenCategory.PUNCTUATION),
    /** The '[' character. */
    LBRACK(TokenCategory.PUNCTUATION),
    /** The ']' character. */
    RBRACK(TokenCategory.PUNCTUATION),

    // Block keywords, handled as delimiters.
    /** The {@code do} keyword opening a block. */
    DO(TokenCategory.KEYWORD, true, false),
    /** The {@code end} keyword closing a block. */
    END(TokenCategory.KEYWORD, true, false),

    /** Spaces, tabs and escaped newlines. */
    WHITESPACE(TokenCategory.WHITESPACE),

    // Keywords.
    /** Any statement keyword (if, unless, def, class, ...). */
    KEYWORD(TokenCategory.KEYWORD, true, false),
    /** The literal keyword {@code true}. */
    TRUE(TokenCategory.VALUE, true, true),
    /** The literal keyword {@code false}. */
    FALSE(TokenCategory.VALUE, true, true),
    /** The literal keyword {@code nil}. */
    NIL(TokenCategory.VALUE, true, true),
    /** The literal keyword {@code self}. */
    SELF(TokenCategory.NODE, true, true),
    /** The literal keyword {@code super}. */
    SUPER(TokenCategory.NODE, true, true),

    // Literals.
    /** A plain quoted string. */
    STRING(TokenCategory.VALUE),
    /** A string with interpolation. */
    DSTRING(TokenCategory.NODE),
    /** A shell (backtick) string. */
    XSTRING(TokenCategory.VALUE),
    /** A shell string with interpolation. */
    DXSTRING(TokenCategory.NODE),
    /** A symbol such as {@code :name}. */
    SYMBOL(TokenCategory.VALUE),
    /** A floating point number. */
    FLOAT(TokenCategory.VALUE),
    /** An integer number. */
    INTEGER(TokenCategory.VALUE),
    /** A regular expression literal such as {@code /ab+c/i}. */
    REGEXP(TokenCategory.VALUE),

    // Names.
    /** A local identifier or method name. */
    IDENTIFIER(TokenCategory.NODE),
    /** A constant name. */
    CONSTANT(TokenCategory.NODE),
    /** A method identifier ending in '?' or '!'. */
    FID(TokenCategory.NODE),
    /** A global variable. */
    GVAR(TokenCategory.NODE),
    /** An instance variable. */
    IVAR(TokenCategory.NODE),
    /** A class variable. */
    CVAR(TokenCategory.NODE),

    // Miscellaneous.
    /** An operator such as '+', '==' or '=>'. */
    OPERATOR(TokenCategory.OTHER),
    /** Anything else. */
    OTHER(TokenCategory.OTHER);

    private final TokenCategory category;
    private final boolean keyword;
    private final boolean literalKeyword;

    TokenKind(TokenCategory category) {
        this(category, false, false);
    }

    TokenKind(TokenCategory category, boolean keyword, boolean literalKeyword) {
        this.category = category;
        this.keyword = keyword;
        this.literalKeyword = literalKeyword;
    }

    /**
     * @return The category this kind belongs to.
     */
    public TokenCategory category() {
        return category;
    }

    /**
     * @return {@code true} if the kind is a reserved word.
     */
    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Literal keywords (true, false, nil, self, super) are keywords that may appear
     * inside a value list without ending the statement.
     * @return {@code true} for literal keywords.
     */
    public boolean isLiteralKeyword() {
        return literalKeyword;
    }

    /**
     * @return {@code true} if a token of this kind ends the value region of a statement.
     */
    public boolean terminatesStatement() {
        return keyword && !literalKeyword;
    }
}
