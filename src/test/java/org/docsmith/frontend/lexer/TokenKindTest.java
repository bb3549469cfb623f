package org.docsmith.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the flags of {@link TokenKind}.
 */
public class TokenKindTest {

    /**
     * Verifies that literal keywords are keywords that do not terminate a statement,
     * while every other keyword does.
     */
    @Test
    @Tag("unit")
    void testStatementTermination() {
        assertThat(Arrays.stream(TokenKind.values()).filter(TokenKind::isLiteralKeyword))
                .containsExactlyInAnyOrder(TokenKind.TRUE, TokenKind.FALSE, TokenKind.NIL, TokenKind.SELF, TokenKind.SUPER);
        assertThat(Arrays.stream(TokenKind.values()).filter(TokenKind::terminatesStatement))
                .containsExactlyInAnyOrder(TokenKind.KEYWORD, TokenKind.DO, TokenKind.END);
        assertThat(TokenKind.TRUE.isKeyword()).isTrue();
        assertThat(TokenKind.IDENTIFIER.isKeyword()).isFalse();
    }

    /**
     * Verifies the categories of interpolated and plain strings.
     */
    @Test
    @Tag("unit")
    void testCategories() {
        assertThat(TokenKind.STRING.category()).isEqualTo(TokenCategory.VALUE);
        assertThat(TokenKind.DSTRING.category()).isEqualTo(TokenCategory.NODE);
        assertThat(TokenKind.COMMA.category()).isEqualTo(TokenCategory.PUNCTUATION);
        assertThat(Token.render(null)).isEmpty();
    }
}
