package io.specwatch.core.watch;

import java.util.Collection;
import java.util.StringJoiner;

/**
 * Builds anchored rerun filters over display names. Names are matched literally, so
 * {@code Calc > adds} becomes {@code ^(Calc\ >\ adds)$}.
 */
public final class FilterPatternBuilder {

    /** Compiles, but matches no input at all. */
    public static final String MATCH_NOTHING = "(?!)";

    private static final String SPECIAL = "\\^$.|?*+()[]{}= #-";

    private FilterPatternBuilder() {
        // utility class
    }

    public static String build(Collection<String> names) {
        if (names.isEmpty()) {
            return MATCH_NOTHING;
        }
        StringJoiner alternatives = new StringJoiner("|", "^(", ")$");
        for (String name : names) {
            alternatives.add(escape(name));
        }
        return alternatives.toString();
    }

    /** Escapes every character with a meaning in regular expressions. */
    public static String escape(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (SPECIAL.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
