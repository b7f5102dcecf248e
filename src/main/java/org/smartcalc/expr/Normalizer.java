package org.smartcalc.expr;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Rewrites validated input into raw sub-tokens. Unary minus becomes {@code ~} here so that the
 * converter can treat it as an ordinary right-associative prefix operator.
 */
final class Normalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // '+' at the start, after an operator or '(', or directly before a '-'
    private static final Pattern UNARY_PLUS = Pattern.compile("(?<=[-+*/^(])\\++|^\\++|\\++(?=-)");
    // '-' at the start or after an operator or '('
    private static final Pattern UNARY_MINUS = Pattern.compile("(?<=[-+*/^(])-|^-");
    private static final Pattern SYMBOL = Pattern.compile("\\W");

    private Normalizer() {}

    static List<String> normalize(String input) {
        String s = WHITESPACE.matcher(input).replaceAll("");
        s = collapseDoubleNegation(s);
        s = UNARY_PLUS.matcher(s).replaceAll("");
        s = UNARY_MINUS.matcher(s).replaceAll(Operator.NEGATE.symbol());
        s = SYMBOL.matcher(s).replaceAll(" $0 ").trim();
        if (s.isEmpty()) return Collections.emptyList();
        return Arrays.asList(WHITESPACE.split(s));
    }

    /**
     * Left-to-right: an even run becomes pluses, an odd run becomes pluses followed by one
     * minus (e.g. {@code ---} to {@code +-}). The leftover plus is removed as unary plus.
     */
    static String collapseDoubleNegation(String s) {
        return s.replace("--", "+");
    }
}
