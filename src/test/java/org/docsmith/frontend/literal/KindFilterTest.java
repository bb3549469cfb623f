package org.docsmith.frontend.literal;

import org.docsmith.frontend.lexer.TokenKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the group filters of {@link KindFilter}.
 */
public class KindFilterTest {

    /**
     * Verifies that the default filter covers values and names but no punctuation or keywords.
     */
    @Test
    @Tag("unit")
    void testValueFilterCoversValuesAndNodes() {
        assertThat(KindFilter.VALUE.kinds()).contains(
                TokenKind.STRING, TokenKind.SYMBOL, TokenKind.INTEGER, TokenKind.TRUE, TokenKind.NIL,
                TokenKind.IDENTIFIER, TokenKind.CONSTANT, TokenKind.DSTRING, TokenKind.SELF);
        assertThat(KindFilter.VALUE.kinds()).doesNotContain(
                TokenKind.COMMA, TokenKind.LPAREN, TokenKind.KEYWORD, TokenKind.WHITESPACE, TokenKind.OPERATOR, TokenKind.DO);
    }

    /**
     * Verifies that no filters expand to the default filter and several filters to their union.
     */
    @Test
    @Tag("unit")
    void testExpand() {
        assertThat(KindFilter.expand()).isEqualTo(KindFilter.VALUE.kinds());
        assertThat(KindFilter.expand(KindFilter.ATTRIBUTE, KindFilter.NUMBER))
                .containsExactlyInAnyOrder(TokenKind.SYMBOL, TokenKind.STRING, TokenKind.FLOAT, TokenKind.INTEGER);
    }

    /**
     * Verifies that a filter built from individual kinds accepts exactly those kinds.
     */
    @Test
    @Tag("unit")
    void testIndividualKinds() {
        KindFilter filter = KindFilter.of(TokenKind.GVAR, TokenKind.CVAR);

        assertThat(filter.accepts(TokenKind.GVAR)).isTrue();
        assertThat(filter.accepts(TokenKind.CVAR)).isTrue();
        assertThat(filter.accepts(TokenKind.IVAR)).isFalse();
        assertThat(KindFilter.IDENTIFIER.accepts(TokenKind.FID)).isTrue();
        assertThat(KindFilter.NODE.accepts(TokenKind.STRING)).isFalse();
    }
}
