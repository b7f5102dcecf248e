package org.smartcalc.expr;

/**
 * Failure categories surfaced to the user. The message is printed verbatim.
 */
public enum ErrorKind {
    INVALID_EXPRESSION("Invalid expression"),
    UNKNOWN_VARIABLE("Unknown variable"),
    DIVISION_BY_ZERO("Division by zero"),
    NEGATIVE_EXPONENT("Negative exponent"),
    EXPONENT_TOO_LARGE("Exponent is too big"),
    // assignment and command paths only
    INVALID_IDENTIFIER("Invalid identifier"),
    INVALID_ASSIGNMENT("Invalid assignment"),
    UNKNOWN_COMMAND("Unknown command");

    private final String message;

    ErrorKind(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
