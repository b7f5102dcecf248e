package org.smartcalc.expr;

import java.math.BigInteger;
import java.util.*;

/**
 * Stack evaluation of a postfix sequence against a read-only variable environment.
 */
final class Evaluator {

    private Evaluator() {}

    static BigInteger evaluate(List<Token> postfix, Map<String, BigInteger> variables) {
        Deque<BigInteger> stack = new ArrayDeque<>();
        for (Token t : postfix) {
            switch (t.type()) {
                case OPERATOR: {
                    Operator op = t.operator();
                    if (op.isUnary()) {
                        require(!stack.isEmpty());
                        stack.push(op.apply(stack.pop()));
                    } else {
                        require(stack.size() >= 2);
                        BigInteger right = stack.pop();
                        BigInteger left = stack.pop();
                        stack.push(op.apply(left, right));
                    }
                    break;
                }
                case NUMBER:
                    stack.push(t.magnitude());
                    break;
                case IDENT: {
                    BigInteger value = variables.get(t.text());
                    if (value == null) throw new EvalException(ErrorKind.UNKNOWN_VARIABLE);
                    stack.push(value);
                    break;
                }
                default:
                    // parentheses never reach the postfix form
                    throw new EvalException(ErrorKind.INVALID_EXPRESSION);
            }
        }
        require(stack.size() == 1);
        return stack.pop();
    }

    private static void require(boolean condition) {
        if (!condition) throw new EvalException(ErrorKind.INVALID_EXPRESSION);
    }
}
