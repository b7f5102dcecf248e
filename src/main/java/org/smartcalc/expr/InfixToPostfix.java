package org.smartcalc.expr;

import java.util.*;

/**
 * Shunting-yard conversion of normalized sub-tokens into postfix order.
 * <p>
 * The result is empty whenever the expression is structurally invalid: unbalanced
 * parentheses, an operator without the operands its arity needs, two values in a row,
 * or a sub-token that is neither a number, an identifier, an operator nor a parenthesis.
 * Which rule failed is not reported.
 */
final class InfixToPostfix {

    private InfixToPostfix() {}

    static Optional<List<Token>> convert(List<String> infix) {
        if (infix.isEmpty()) return Optional.empty();
        try {
            return Optional.of(shunt(infix));
        } catch (Malformed e) {
            return Optional.empty();
        }
    }

    private static List<Token> shunt(List<String> infix) {
        List<Token> out = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();
        Token prev = null;

        for (String s : infix) {
            Token t = Token.classify(s);
            require(t != null);
            // a value or ')' just before means a left operand is available
            boolean hasLeftOperand = prev != null && !prev.is(Token.Type.OPERATOR) && !prev.is(Token.Type.LPAREN);

            switch (t.type()) {
                case LPAREN:
                    require(!hasLeftOperand);
                    stack.push(t);
                    break;
                case RPAREN:
                    require(hasLeftOperand);
                    while (!stack.isEmpty() && !stack.peek().is(Token.Type.LPAREN)) out.add(stack.pop());
                    require(!stack.isEmpty());
                    stack.pop();
                    break;
                case OPERATOR: {
                    Operator cur = t.operator();
                    require(cur.isUnary() ^ hasLeftOperand);
                    while (!stack.isEmpty() && !stack.peek().is(Token.Type.LPAREN)) {
                        Operator top = stack.peek().operator();
                        if (top.precedence() < cur.precedence()) break;
                        if (top.precedence() == cur.precedence() && cur.isRightAssociative()) break;
                        out.add(stack.pop());
                    }
                    stack.push(t);
                    break;
                }
                default: // NUMBER, IDENT
                    require(!hasLeftOperand);
                    out.add(t);
            }
            prev = t;
        }

        while (!stack.isEmpty()) {
            Token t = stack.pop();
            require(!t.is(Token.Type.LPAREN));
            out.add(t);
        }
        return out;
    }

    private static void require(boolean condition) {
        if (!condition) throw new Malformed();
    }

    /** Internal signal; never escapes {@link #convert}. */
    private static final class Malformed extends RuntimeException {
        Malformed() { super(null, null, false, false); }
    }
}
