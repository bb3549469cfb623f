package org.docsmith.frontend.parser;

import org.docsmith.frontend.lexer.Token;

import java.util.List;

/**
 * One parsed statement as delivered by the external parser: its tokens, the
 * statements of its nested block (if it opens one) and the comment attached to it.
 *
 * @param tokens    The tokens of the statement header, in source order.
 * @param block     The statements of the nested block, or {@code null} if there is none.
 * @param docstring The narrative comment preceding the statement, or {@code null}.
 */
public record Statement(
        List<Token> tokens,
        List<Statement> block,
        String docstring
) {

    /**
     * Normalizes the token list and copies the block.
     */
    public Statement {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        block = block == null ? null : List.copyOf(block);
    }

    /**
     * Creates a statement without block or comment.
     * @param tokens The tokens.
     * @return A new statement.
     */
    public static Statement of(List<Token> tokens) {
        return new Statement(tokens, null, null);
    }

    /**
     * @return The first token, or {@code null} for an empty statement.
     */
    public Token firstToken() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    /**
     * @return The line of the first token, or 0 for an empty statement.
     */
    public int line() {
        Token first = firstToken();
        return first == null ? 0 : first.line();
    }

    /**
     * @return The statement rendered back to source text.
     */
    public String text() {
        return Token.render(tokens);
    }

    /**
     * @return {@code true} if the statement opens a nested block.
     */
    public boolean hasBlock() {
        return block != null;
    }

    /**
     * @return {@code true} if a comment is attached to the statement.
     */
    public boolean hasDocstring() {
        return docstring != null;
    }

    @Override
    public String toString() {
        return text();
    }
}
