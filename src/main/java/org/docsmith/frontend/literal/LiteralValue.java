package org.docsmith.frontend.literal;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Typed value extracted from a single token. Handlers read these to learn the
 * names, defaults and options written in a statement.
 */
public sealed interface LiteralValue permits LiteralValue.Str, LiteralValue.Sym, LiteralValue.Int, LiteralValue.Flt,
        LiteralValue.Regex, LiteralValue.Bool, LiteralValue.Nil, LiteralValue.Raw {

    /**
     * Textual form used when several values and punctuation are joined into one entry.
     * @return The rendered text.
     */
    String render();

    /**
     * A string with its delimiters removed.
     * @param value The inner text.
     */
    record Str(String value) implements LiteralValue {
        @Override
        public String render() {
            return value;
        }
    }

    /**
     * A symbolic atom, stored without its leading sigil.
     * @param name The symbol name.
     */
    record Sym(String name) implements LiteralValue {
        @Override
        public String render() {
            return name;
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    /**
     * A whole number.
     * @param value The numeric value.
     */
    record Int(BigInteger value) implements LiteralValue {
        @Override
        public String render() {
            return value.toString();
        }
    }

    /**
     * A decimal number.
     * @param value The numeric value.
     */
    record Flt(double value) implements LiteralValue {
        @Override
        public String render() {
            return Double.toString(value);
        }
    }

    /**
     * A regular expression, kept as source and flag letters.
     * @param source The pattern between the slashes.
     * @param flags  Trailing flag letters, possibly empty.
     */
    record Regex(String source, String flags) implements LiteralValue {

        /**
         * Compiles the expression. {@code i} maps to case-insensitive, {@code m} to dot-all
         * and {@code x} to comments mode.
         * @return The compiled pattern.
         * @throws java.util.regex.PatternSyntaxException if the source is not a valid Java pattern.
         */
        public Pattern compile() {
            int bits = 0;
            for (char flag : flags.toCharArray()) {
                switch (flag) {
                    case 'i' -> bits |= Pattern.CASE_INSENSITIVE;
                    case 'm' -> bits |= Pattern.DOTALL;
                    case 'x' -> bits |= Pattern.COMMENTS;
                    default -> { }
                }
            }
            return Pattern.compile(source, bits);
        }

        @Override
        public String render() {
            return source;
        }
    }

    /**
     * A boolean literal.
     * @param value The value.
     */
    record Bool(boolean value) implements LiteralValue {
        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    /**
     * The nil literal.
     */
    record Nil() implements LiteralValue {
        @Override
        public String render() {
            return "";
        }
    }

    /**
     * Unreduced token text, used for identifiers, constants and joined spans.
     * @param text The raw text.
     */
    record Raw(String text) implements LiteralValue {
        @Override
        public String render() {
            return text;
        }
    }

    /** @return A string value. */
    static LiteralValue str(String value) {
        return new Str(value);
    }

    /** @return A symbol value. */
    static LiteralValue sym(String name) {
        return new Sym(name);
    }

    /** @return An integer value. */
    static LiteralValue integer(long value) {
        return new Int(BigInteger.valueOf(value));
    }

    /** @return A raw text value. */
    static LiteralValue raw(String text) {
        return new Raw(text);
    }
}
