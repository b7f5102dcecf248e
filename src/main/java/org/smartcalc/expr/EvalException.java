package org.smartcalc.expr;

public final class EvalException extends RuntimeException {
    private final ErrorKind kind;

    public EvalException(ErrorKind kind) {
        super(kind.message());
        this.kind = kind;
    }

    public EvalException(ErrorKind kind, Throwable cause) {
        super(kind.message(), cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
