package org.docsmith.frontend.lexer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a single token produced by the external lexer.
 *
 * @param kind The kind of the token (e.g. string, comma, keyword).
 * @param text The exact text of the token from the source code.
 * @param line The line number where the token was found.
 */
public record Token(
        TokenKind kind,
        String text,
        int line
) {

    /**
     * Renders a token sequence back into source text by concatenating the token texts.
     * @param tokens The tokens to render.
     * @return The concatenated text, empty for {@code null} or empty input.
     */
    public static String render(List<Token> tokens) {
        if (tokens == null) {
            return "";
        }
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }
}
