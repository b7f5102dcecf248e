package org.smartcalc.expr;

import java.util.regex.Pattern;

/**
 * Character-set check run before normalization. Structure is not checked here.
 */
final class Validator {
    private static final Pattern ALLOWED = Pattern.compile("[" + userSymbols() + "()a-zA-Z0-9\\s]+");

    private Validator() {}

    // every operator symbol except the internal negate, escaped for a character class
    private static String userSymbols() {
        StringBuilder sb = new StringBuilder();
        for (String symbol : Operator.symbols()) {
            if (symbol.equals(Operator.NEGATE.symbol())) continue;
            for (char c : symbol.toCharArray()) sb.append('\\').append(c);
        }
        return sb.toString();
    }

    static boolean isValid(String input) {
        return input != null && ALLOWED.matcher(input).matches();
    }

    static void validate(String input) {
        if (!isValid(input)) throw new EvalException(ErrorKind.INVALID_EXPRESSION);
    }
}
