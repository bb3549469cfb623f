package org.docsmith.frontend.parser;

import org.docsmith.testing.Tokens;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Statement}.
 */
public class StatementTest {

    /**
     * Verifies line, text, block and docstring accessors, including the empty statement.
     */
    @Test
    @Tag("unit")
    void testAccessors() {
        Statement def = new Statement(Tokens.lex("def area", 12), List.of(), "Computes the area.");

        assertThat(def.line()).isEqualTo(12);
        assertThat(def.text()).isEqualTo("def area");
        assertThat(def.firstToken().text()).isEqualTo("def");
        assertThat(def.hasBlock()).isTrue();
        assertThat(def.hasDocstring()).isTrue();

        Statement empty = new Statement(null, null, null);
        assertThat(empty.tokens()).isEmpty();
        assertThat(empty.firstToken()).isNull();
        assertThat(empty.line()).isZero();
        assertThat(empty.text()).isEmpty();
        assertThat(empty.hasBlock()).isFalse();
        assertThat(empty.hasDocstring()).isFalse();
    }

    /**
     * Verifies that later changes to the lists passed in do not leak into the statement.
     */
    @Test
    @Tag("unit")
    void testListsAreCopied() {
        List<Statement> body = new ArrayList<>();
        Statement klass = new Statement(Tokens.lex("class Shape"), body, null);

        body.add(Statement.of(Tokens.lex("def area")));

        assertThat(klass.block()).isEmpty();
    }
}
