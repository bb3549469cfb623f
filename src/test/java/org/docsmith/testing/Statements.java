package org.docsmith.testing;

import org.docsmith.frontend.parser.Statement;

import java.util.List;

/**
 * Builds {@link Statement}s from source snippets for tests.
 */
public final class Statements {

    private Statements() {}

    /** @return A statement without block or comment. */
    public static Statement stmt(int line, String source) {
        return Statement.of(Tokens.lex(source, line));
    }

    /** @return A statement opening a block with the given body. */
    public static Statement block(int line, String source, Statement... body) {
        return new Statement(Tokens.lex(source, line), List.of(body), null);
    }

    /** @return A commented statement opening a block with the given body. */
    public static Statement documented(String docstring, int line, String source, Statement... body) {
        return new Statement(Tokens.lex(source, line), List.of(body), docstring);
    }

    /** @return A commented statement without block. */
    public static Statement documentedStmt(String docstring, int line, String source) {
        return new Statement(Tokens.lex(source, line), null, docstring);
    }
}
