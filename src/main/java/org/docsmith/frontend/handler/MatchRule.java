package org.docsmith.frontend.handler;

import org.docsmith.frontend.lexer.Token;
import org.docsmith.frontend.lexer.TokenKind;
import org.docsmith.frontend.parser.Statement;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether a handler applies to a statement. Each handler declares exactly one rule.
 */
public sealed interface MatchRule permits MatchRule.KindRule, MatchRule.TextRule, MatchRule.PatternRule {

	/**
	 * @param statement The statement to test.
	 * @return {@code true} if the handler should process the statement.
	 */
	boolean matches(Statement statement);

	/**
	 * Matches statements whose first token has the given kind.
	 * @param kind The expected kind.
	 */
	record KindRule(TokenKind kind) implements MatchRule {
		public KindRule {
			Objects.requireNonNull(kind, "kind");
		}

		@Override
		public boolean matches(Statement statement) {
			Token first = statement.firstToken();
			return first != null && first.kind() == kind;
		}
	}

	/**
	 * Matches statements whose first token has exactly the given text (case-sensitive).
	 * @param text The expected text.
	 */
	record TextRule(String text) implements MatchRule {
		public TextRule {
			Objects.requireNonNull(text, "text");
		}

		@Override
		public boolean matches(Statement statement) {
			Token first = statement.firstToken();
			return first != null && first.text().equals(text);
		}
	}

	/**
	 * Matches statements whose rendered text contains a match of the pattern.
	 * @param pattern The pattern searched anywhere in the statement text.
	 */
	record PatternRule(Pattern pattern) implements MatchRule {
		public PatternRule {
			Objects.requireNonNull(pattern, "pattern");
		}

		@Override
		public boolean matches(Statement statement) {
			return pattern.matcher(statement.text()).find();
		}
	}

	/** @return A rule matching the kind of the first token. */
	static MatchRule kind(TokenKind kind) {
		return new KindRule(kind);
	}

	/** @return A rule matching the text of the first token. */
	static MatchRule text(String text) {
		return new TextRule(text);
	}

	/** @return A rule searching the statement text for the regular expression. */
	static MatchRule pattern(String regex) {
		return new PatternRule(Pattern.compile(regex));
	}
}
