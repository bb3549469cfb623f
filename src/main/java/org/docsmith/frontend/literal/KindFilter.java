package org.docsmith.frontend.literal;

import org.docsmith.frontend.lexer.TokenCategory;
import org.docsmith.frontend.lexer.TokenKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A named set of token kinds accepted by the literal extractor. Group filters
 * expand to several kinds; {@link #of(TokenKind...)} accepts individual kinds.
 */
public final class KindFilter {

    /** Every value-like kind, plus every node-like kind. This is the default filter. */
    public static final KindFilter VALUE = new KindFilter("value", kindsIn(TokenCategory.VALUE, TokenCategory.NODE));

    /** Node-like kinds: identifiers, constants, variables, interpolated strings, self and super. */
    public static final KindFilter NODE = new KindFilter("node", kindsIn(TokenCategory.NODE));

    /** Plain, interpolated, shell and interpolated shell strings. */
    public static final KindFilter STRING = new KindFilter("string",
            EnumSet.of(TokenKind.STRING, TokenKind.DSTRING, TokenKind.XSTRING, TokenKind.DXSTRING));

    /** Attribute names: symbols and plain strings. */
    public static final KindFilter ATTRIBUTE = new KindFilter("attribute",
            EnumSet.of(TokenKind.SYMBOL, TokenKind.STRING));

    /** Identifiers, method identifiers and global variables. */
    public static final KindFilter IDENTIFIER = new KindFilter("identifier",
            EnumSet.of(TokenKind.IDENTIFIER, TokenKind.FID, TokenKind.GVAR));

    /** Floats and integers. */
    public static final KindFilter NUMBER = new KindFilter("number",
            EnumSet.of(TokenKind.FLOAT, TokenKind.INTEGER));

    private final String name;
    private final Set<TokenKind> kinds;

    private KindFilter(String name, Set<TokenKind> kinds) {
        this.name = name;
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    /**
     * Creates a filter accepting exactly the given kinds.
     * @param kinds The accepted kinds.
     * @return A new filter.
     */
    public static KindFilter of(TokenKind... kinds) {
        EnumSet<TokenKind> set = EnumSet.noneOf(TokenKind.class);
        set.addAll(Arrays.asList(kinds));
        return new KindFilter(set.toString(), set);
    }

    /**
     * Expands a list of filters into the set of accepted kinds. No filters means {@link #VALUE}.
     * @param filters The filters to combine.
     * @return The union of all accepted kinds.
     */
    public static Set<TokenKind> expand(KindFilter... filters) {
        if (filters == null || filters.length == 0) {
            return VALUE.kinds;
        }
        EnumSet<TokenKind> accepted = EnumSet.noneOf(TokenKind.class);
        for (KindFilter filter : filters) {
            accepted.addAll(filter.kinds);
        }
        return accepted;
    }

    /**
     * @param kind The kind to test.
     * @return {@code true} if this filter accepts the kind.
     */
    public boolean accepts(TokenKind kind) {
        return kinds.contains(kind);
    }

    /**
     * @return The accepted kinds.
     */
    public Set<TokenKind> kinds() {
        return kinds;
    }

    @Override
    public String toString() {
        return "KindFilter[" + name + "]";
    }

    private static EnumSet<TokenKind> kindsIn(TokenCategory... categories) {
        EnumSet<TokenKind> set = EnumSet.noneOf(TokenKind.class);
        for (TokenKind kind : TokenKind.values()) {
            for (TokenCategory category : categories) {
                if (kind.category() == category) {
                    set.add(kind);
                }
            }
        }
        return set;
    }
}
