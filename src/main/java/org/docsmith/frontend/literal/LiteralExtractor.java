package org.docsmith.frontend.literal;

import org.docsmith.frontend.lexer.Token;
import org.docsmith.frontend.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps a single token to a typed {@link LiteralValue}, provided its kind is accepted
 * by the given filters. Never throws: malformed numbers and patterns fall back to raw text.
 */
public final class LiteralExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralExtractor.class);
    private static final Pattern REGEXP_LITERAL = Pattern.compile("\\A/(.+)/([a-z]*)\\z", Pattern.DOTALL);

    private LiteralExtractor() {}

    /**
     * Extracts the value of a token.
     * @param token   The token, may be {@code null}.
     * @param filters Accepted kind filters; none means {@link KindFilter#VALUE}.
     * @return The value, or empty if the token's kind is not accepted.
     */
    public static Optional<LiteralValue> extract(Token token, KindFilter... filters) {
        return extract(token, KindFilter.expand(filters));
    }

    /**
     * Extracts the value of a token against an already expanded set of kinds.
     * @param token    The token, may be {@code null}.
     * @param accepted The accepted kinds.
     * @return The value, or empty if the token's kind is not accepted.
     */
    public static Optional<LiteralValue> extract(Token token, Set<TokenKind> accepted) {
        if (token == null || !accepted.contains(token.kind())) {
            return Optional.empty();
        }
        String text = token.text();
        LiteralValue value = switch (token.kind()) {
            case STRING, DSTRING, XSTRING, DXSTRING -> new LiteralValue.Str(unquote(text));
            case SYMBOL -> new LiteralValue.Sym(text.startsWith(":") ? text.substring(1) : text);
            case FLOAT -> parseFloat(text);
            case INTEGER -> parseInteger(text);
            case REGEXP -> parseRegexp(text);
            case TRUE -> new LiteralValue.Bool(true);
            case FALSE -> new LiteralValue.Bool(false);
            case NIL -> new LiteralValue.Nil();
            default -> new LiteralValue.Raw(text);
        };
        return Optional.of(value);
    }

    private static String unquote(String text) {
        return text.length() < 2 ? "" : text.substring(1, text.length() - 1);
    }

    private static LiteralValue parseFloat(String text) {
        try {
            return new LiteralValue.Flt(Double.parseDouble(text.replace("_", "")));
        } catch (NumberFormatException e) {
            LOG.debug("Keeping malformed float literal '{}' as raw text", text);
            return new LiteralValue.Raw(text);
        }
    }

    private static LiteralValue parseInteger(String text) {
        String digits = text.replace("_", "");
        boolean negative = digits.startsWith("-");
        if (negative || digits.startsWith("+")) {
            digits = digits.substring(1);
        }
        int radix = 10;
        String lower = digits.toLowerCase();
        if (lower.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (lower.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (lower.startsWith("0o")) {
            radix = 8;
            digits = digits.substring(2);
        }
        try {
            BigInteger value = new BigInteger(digits, radix);
            return new LiteralValue.Int(negative ? value.negate() : value);
        } catch (NumberFormatException e) {
            LOG.debug("Keeping malformed integer literal '{}' as raw text", text);
            return new LiteralValue.Raw(text);
        }
    }

    private static LiteralValue parseRegexp(String text) {
        Matcher matcher = REGEXP_LITERAL.matcher(text);
        if (!matcher.matches()) {
            return new LiteralValue.Raw(text);
        }
        LiteralValue.Regex regex = new LiteralValue.Regex(matcher.group(1), matcher.group(2));
        try {
            regex.compile();
            return regex;
        } catch (PatternSyntaxException e) {
            LOG.debug("Keeping regexp literal '{}' as raw text: {}", text, e.getDescription());
            return new LiteralValue.Raw(text);
        }
    }
}
