package org.smartcalc.expr;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A classified sub-token. Numbers never carry a sign; negation is the {@code ~} operator.
 */
public final class Token {
    public enum Type { NUMBER, IDENT, OPERATOR, LPAREN, RPAREN }

    static final Pattern NUMBER_PATTERN = Pattern.compile("[0-9]+");
    static final Pattern IDENT_PATTERN = Pattern.compile("[a-zA-Z]+");

    private final Type type;
    private final String text;

    private Token(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    public static Token number(String digits) {
        if (!NUMBER_PATTERN.matcher(digits).matches()) throw new IllegalArgumentException("not a number literal: " + digits);
        return new Token(Type.NUMBER, digits);
    }

    public static Token ident(String name) {
        if (!IDENT_PATTERN.matcher(name).matches()) throw new IllegalArgumentException("not an identifier: " + name);
        return new Token(Type.IDENT, name);
    }

    public static Token operator(Operator op) {
        return new Token(Type.OPERATOR, op.symbol());
    }

    public static Token leftParen() { return new Token(Type.LPAREN, "("); }
    public static Token rightParen() { return new Token(Type.RPAREN, ")"); }

    /**
     * Classifies a normalized sub-token, or returns null when it is none of the known shapes
     * (for instance a mixed run such as {@code 2x}).
     */
    static Token classify(String s) {
        if ("(".equals(s)) return leftParen();
        if (")".equals(s)) return rightParen();
        Operator op = Operator.bySymbol(s).orElse(null);
        if (op != null) return operator(op);
        if (NUMBER_PATTERN.matcher(s).matches()) return new Token(Type.NUMBER, s);
        if (IDENT_PATTERN.matcher(s).matches()) return new Token(Type.IDENT, s);
        return null;
    }

    public Type type() { return type; }
    public String text() { return text; }

    public boolean is(Type t) { return type == t; }

    public BigInteger magnitude() {
        if (type != Type.NUMBER) throw new IllegalStateException("not a number: " + this);
        return new BigInteger(text);
    }

    public Operator operator() {
        if (type != Type.OPERATOR) throw new IllegalStateException("not an operator: " + this);
        return Operator.bySymbol(text).orElseThrow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
