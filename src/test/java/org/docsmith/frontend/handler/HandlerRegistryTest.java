package org.docsmith.frontend.handler;

import org.docsmith.frontend.lexer.TokenKind;
import org.docsmith.frontend.parser.Statement;
import org.docsmith.testing.SampleHandlerProvider;
import org.docsmith.testing.SampleHandlers;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.docsmith.testing.Statements.stmt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Contains unit tests for the {@link HandlerRegistry} and the {@link MatchRule}s it selects with.
 */
public class HandlerRegistryTest {

    private static final IStatementHandler NOOP = ctx -> List.of();

    /**
     * Verifies that a text rule compares the first token's text exactly and case-sensitively.
     */
    @Test
    @Tag("unit")
    void testTextRule() {
        MatchRule rule = MatchRule.text("class");

        assertThat(rule.matches(stmt(1, "class Foo"))).isTrue();
        assertThat(rule.matches(stmt(1, "Class Foo"))).isFalse();
        assertThat(rule.matches(stmt(1, "classify x"))).isFalse();
        assertThat(rule.matches(stmt(1, ""))).isFalse();
    }

    /**
     * Verifies that a kind rule tests the first token's kind and a pattern rule
     * searches anywhere in the statement text.
     */
    @Test
    @Tag("unit")
    void testKindAndPatternRules() {
        assertThat(MatchRule.kind(TokenKind.CONSTANT).matches(stmt(1, "VERSION = 1"))).isTrue();
        assertThat(MatchRule.kind(TokenKind.CONSTANT).matches(stmt(1, "version = 1"))).isFalse();

        MatchRule attr = MatchRule.pattern("attr_\\w+");
        assertThat(attr.matches(stmt(1, "self.attr_reader :a"))).isTrue();
        assertThat(attr.matches(stmt(1, "def reader"))).isFalse();
    }

    /**
     * Verifies that every matching handler is selected, in registration order, and
     * that unrelated statements select nothing.
     */
    @Test
    @Tag("unit")
    void testSelectReturnsAllMatchesInRegistrationOrder() {
        HandlerRegistry registry = new HandlerRegistry();
        HandlerDescriptor byText = HandlerDescriptor.of("ByText", MatchRule.text("attr_reader"), NOOP);
        HandlerDescriptor byPattern = HandlerDescriptor.of("ByPattern", MatchRule.pattern("\\Aattr_"), NOOP);
        HandlerDescriptor other = HandlerDescriptor.of("Other", MatchRule.text("def"), NOOP);
        registry.register(byText);
        registry.register(other);
        registry.register(byPattern);

        assertThat(registry.select(stmt(1, "attr_reader :a"))).containsExactly(byText, byPattern);
        assertThat(registry.select(stmt(1, "puts 'x'"))).isEmpty();
    }

    /**
     * Verifies that families are kept apart and can be cleared independently.
     */
    @Test
    @Tag("unit")
    void testFamilies() {
        HandlerRegistry registry = new HandlerRegistry();
        HandlerDescriptor legacy = HandlerDescriptor.of("Legacy", MatchRule.text("def"), NOOP);
        HandlerDescriptor modern = HandlerDescriptor.of("Modern", MatchRule.text("def"), NOOP);
        registry.register("legacy", legacy);
        registry.register(modern);

        Statement def = stmt(1, "def foo");
        assertThat(registry.select("legacy", def)).containsExactly(legacy);
        assertThat(registry.select(def)).containsExactly(modern);

        registry.clear("legacy");
        assertThat(registry.handlers("legacy")).isEmpty();
        assertThat(registry.handlers(HandlerRegistry.DEFAULT_FAMILY)).containsExactly(modern);

        registry.clear();
        assertThat(registry.select(def)).isEmpty();
    }

    /**
     * Verifies that providers listed as services on the classpath are discovered.
     */
    @Test
    @Tag("unit")
    void testDiscoverLoadsServiceProviders() {
        HandlerRegistry registry = HandlerRegistry.discover(SampleHandlerProvider.class.getClassLoader());

        assertThat(registry.handlers(HandlerRegistry.DEFAULT_FAMILY)).containsAll(SampleHandlers.all());
        assertThat(registry.select(stmt(1, "module Foo"))).containsExactly(SampleHandlers.MODULE);
    }

    /**
     * Verifies that a declared handler without routine fails with the handler's name,
     * and that a {@code null} result is normalized to an empty list.
     */
    @Test
    @Tag("unit")
    void testDescriptorProcessing() throws Exception {
        HandlerContext context = mock(HandlerContext.class);

        HandlerDescriptor declared = HandlerDescriptor.declare("YieldHandler", MatchRule.text("yield"));
        assertThatThrownBy(() -> declared.process(context))
                .isInstanceOf(UnimplementedHandlerException.class)
                .hasMessage("YieldHandler did not implement a process routine for handling.")
                .extracting(e -> ((UnimplementedHandlerException) e).getHandlerName())
                .isEqualTo("YieldHandler");

        HandlerDescriptor lazy = HandlerDescriptor.of("Lazy", MatchRule.text("x"), ctx -> null);
        assertThat(lazy.process(context)).isEmpty();
        verifyNoInteractions(context);
    }
}
