package org.smartcalc.expr;

import java.math.BigInteger;
import java.util.*;
import java.util.function.BinaryOperator;

/**
 * Closed set of operators with their parsing metadata and semantics.
 * {@code ~} is the internal unary minus produced by {@link Normalizer}; users never type it.
 */
public enum Operator {
    MINUS("-", 0, Associativity.LEFT, Arity.BINARY, BigInteger::subtract),
    PLUS("+", 0, Associativity.LEFT, Arity.BINARY, BigInteger::add),
    TIMES("*", 1, Associativity.LEFT, Arity.BINARY, BigInteger::multiply),
    DIVIDE("/", 1, Associativity.LEFT, Arity.BINARY, (a, b) -> {
        if (b.signum() == 0) throw new EvalException(ErrorKind.DIVISION_BY_ZERO);
        return a.divide(b);
    }),
    POWER("^", 2, Associativity.RIGHT, Arity.BINARY, Operator::power),
    NEGATE("~", 2, Associativity.RIGHT, Arity.UNARY, (a, ignored) -> a.negate());

    public enum Associativity { LEFT, RIGHT }
    public enum Arity { UNARY, BINARY }

    /** Exclusive ceiling for the right operand of {@code ^}. */
    static final BigInteger MAX_EXPONENT = BigInteger.valueOf(Integer.MAX_VALUE);

    private static final Map<String, Operator> BY_SYMBOL;
    private static final List<String> SYMBOLS;

    static {
        Map<String, Operator> map = new HashMap<>();
        List<String> symbols = new ArrayList<>();
        for (Operator op : values()) {
            map.put(op.symbol, op);
            symbols.add(op.symbol);
        }
        BY_SYMBOL = Collections.unmodifiableMap(map);
        SYMBOLS = Collections.unmodifiableList(symbols);
    }

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;
    private final Arity arity;
    private final BinaryOperator<BigInteger> perform;

    Operator(String symbol, int precedence, Associativity associativity, Arity arity, BinaryOperator<BigInteger> perform) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
        this.arity = arity;
        this.perform = perform;
    }

    public String symbol() { return symbol; }
    public int precedence() { return precedence; }
    public Associativity associativity() { return associativity; }
    public Arity arity() { return arity; }
    public boolean isUnary() { return arity == Arity.UNARY; }
    public boolean isRightAssociative() { return associativity == Associativity.RIGHT; }

    /** Applies a binary operator. */
    public BigInteger apply(BigInteger left, BigInteger right) {
        if (isUnary()) throw new IllegalStateException(symbol + " is unary");
        return perform.apply(left, right);
    }

    /** Applies a unary operator. */
    public BigInteger apply(BigInteger operand) {
        if (!isUnary()) throw new IllegalStateException(symbol + " is binary");
        return perform.apply(operand, BigInteger.ZERO);
    }

    private static BigInteger power(BigInteger base, BigInteger exponent) {
        if (exponent.signum() < 0) throw new EvalException(ErrorKind.NEGATIVE_EXPONENT);
        if (exponent.compareTo(MAX_EXPONENT) >= 0) throw new EvalException(ErrorKind.EXPONENT_TOO_LARGE);
        try {
            return base.pow(exponent.intValueExact());
        } catch (ArithmeticException e) {
            // result larger than BigInteger can hold
            throw new EvalException(ErrorKind.EXPONENT_TOO_LARGE, e);
        }
    }

    public static Optional<Operator> bySymbol(String s) {
        return Optional.ofNullable(BY_SYMBOL.get(s));
    }

    /** All recognised symbols, including the internal {@code ~}. */
    public static List<String> symbols() {
        return SYMBOLS;
    }
}
