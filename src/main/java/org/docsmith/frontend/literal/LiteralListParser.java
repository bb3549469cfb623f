package org.docsmith.frontend.literal;

import org.docsmith.frontend.lexer.Token;
import org.docsmith.frontend.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns the comma separated value region of a statement into an ordered list of
 * {@link LiteralValue}s, e.g. the arguments of {@code attr_reader :a, :b}.
 * <p>
 * The parser makes a single pass over the tokens. Nested parentheses, braces,
 * brackets and {@code do..end} spans are collected as text into the entry they
 * belong to. A parenthesis directly after a comma (or at the start) wraps the
 * entry and is ignored. The first statement keyword such as a trailing
 * {@code if} ends the list, as does an unbalanced closing delimiter.
 * <p>
 * Malformed input never raises; the result is simply shorter.
 */
public final class LiteralListParser {

    private LiteralListParser() {}

    /**
     * Parses a token sequence into literal values.
     * @param tokens  The tokens, may be {@code null}.
     * @param filters Accepted kind filters; none means {@link KindFilter#VALUE}.
     * @return The extracted values in source order, never {@code null}.
     */
    public static List<LiteralValue> parse(List<Token> tokens, KindFilter... filters) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        Set<TokenKind> accepted = KindFilter.expand(filters);

        List<List<LiteralValue>> groups = new ArrayList<>();
        groups.add(new ArrayList<>());
        int depth = 0;
        int leadingParenDepth = 0;
        boolean needComma = false;
        boolean afterComma = true;

        for (Token token : tokens) {
            Optional<LiteralValue> value = LiteralExtractor.extract(token, accepted);
            List<LiteralValue> current = groups.get(groups.size() - 1);
            boolean nestedAppend = !current.isEmpty() && value.isPresent();

            switch (token.kind()) {
                case COMMA -> {
                    if (depth == 0) {
                        if (!current.isEmpty()) {
                            groups.add(new ArrayList<>());
                        }
                        needComma = false;
                        afterComma = true;
                    } else if (nestedAppend) {
                        current.add(textOf(token));
                    }
                }
                case LPAREN -> {
                    if (afterComma) {
                        leadingParenDepth++;
                    } else {
                        depth++;
                        if (nestedAppend) {
                            current.add(textOf(token));
                        }
                    }
                }
                case RPAREN -> {
                    if (leadingParenDepth > 0) {
                        leadingParenDepth--;
                    } else {
                        if (depth > 0 && value.isPresent()) {
                            current.add(textOf(token));
                        }
                        depth--;
                    }
                }
                case LBRACE, LBRACK, DO -> {
                    depth++;
                    if (value.isPresent()) {
                        current.add(textOf(token));
                    }
                }
                case RBRACE, RBRACK, END -> {
                    if (value.isPresent()) {
                        current.add(textOf(token));
                    }
                    depth--;
                }
                default -> {
                    if (token.kind().terminatesStatement()) {
                        return collapse(groups);
                    }
                    boolean whitespace = token.kind() == TokenKind.WHITESPACE;
                    if (!whitespace) {
                        afterComma = false;
                    }
                    if (depth == 0) {
                        if (needComma || whitespace) {
                            continue;
                        }
                        if (value.isPresent()) {
                            current.add(value.get());
                        } else {
                            // Entry rejected: drop what it had and wait for the next comma.
                            current.clear();
                            needComma = true;
                        }
                    } else if (nestedAppend) {
                        needComma = true;
                        current.add(textOf(token));
                    }
                }
            }

            if (leadingParenDepth == 0 && depth < 0) {
                break;
            }
        }
        return collapse(groups);
    }

    private static LiteralValue textOf(Token token) {
        return new LiteralValue.Raw(token.text());
    }

    private static List<LiteralValue> collapse(List<List<LiteralValue>> groups) {
        List<LiteralValue> result = new ArrayList<>();
        for (List<LiteralValue> group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            if (group.size() == 1) {
                result.add(group.get(0));
            } else {
                result.add(new LiteralValue.Raw(group.stream().map(LiteralValue::render).collect(Collectors.joining())));
            }
        }
        return result;
    }
}
