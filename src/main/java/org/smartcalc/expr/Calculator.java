package org.smartcalc.expr;

import java.math.BigInteger;
import java.util.*;

/**
 * Entry point of the expression engine: validate, normalize, convert to postfix, evaluate.
 * <p>
 * The variable map is only read. Callers that store the result do so after this method
 * returns, so a failed evaluation never changes their state.
 */
public final class Calculator {

    private Calculator() {}

    /**
     * Evaluates {@code expression} over arbitrary-precision integers.
     *
     * @param expression raw user text, e.g. {@code "2 ^ (x - 1)"}
     * @param variables  bindings for identifiers; never modified
     * @return the value of the expression
     * @throws EvalException with the {@link ErrorKind} describing the failure
     */
    public static BigInteger evaluate(String expression, Map<String, BigInteger> variables) {
        Objects.requireNonNull(variables, "variables");
        return evaluatePostfix(toPostfix(expression), variables);
    }

    /** Evaluates an already converted postfix sequence. */
    public static BigInteger evaluatePostfix(List<Token> postfix, Map<String, BigInteger> variables) {
        return Evaluator.evaluate(postfix, Collections.unmodifiableMap(variables));
    }

    /**
     * Runs the front half of the pipeline.
     *
     * @throws EvalException {@link ErrorKind#INVALID_EXPRESSION} on a bad character or structure
     */
    public static List<Token> toPostfix(String expression) {
        Validator.validate(expression);
        List<String> infix = Normalizer.normalize(expression);
        return InfixToPostfix.convert(infix)
                .orElseThrow(() -> new EvalException(ErrorKind.INVALID_EXPRESSION));
    }
}
