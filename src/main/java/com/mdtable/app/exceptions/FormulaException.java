package com.mdtable.app.exceptions;

import com.mdtable.app.models.Span;

/**
 * Thrown when a formula cannot be parsed, evaluated or applied.
 * Carries the error kind and, when known, the span of the expression part at fault.
 */
public class FormulaException extends RuntimeException {
    private final FormulaErrorKind kind;
    private Span span;

    public FormulaException(FormulaErrorKind kind, String message) {
        this(kind, message, null);
    }

    public FormulaException(FormulaErrorKind kind, String message, Span span) {
        super(message);
        this.kind = kind;
        this.span = span;
    }

    public FormulaErrorKind getKind() {
        return kind;
    }

    public Span getSpan() {
        return span;
    }

    public boolean hasSpan() {
        return span != null;
    }

    /**
     * Sets the span if none is known yet. The innermost failing node gets there first.
     */
    public FormulaException attachSpan(Span span) {
        if (this.span == null) {
            this.span = span;
        }
        return this;
    }

    /**
     * Renders the message, the expression and a caret line under the failing part:
     * <pre>
     * division by zero in scalar operation: 5 / 0
     * A1 / 0
     * ^^^^^^
     * </pre>
     * Without a span only the message is returned.
     */
    public String withContext(String expression) {
        if (span == null) {
            return getMessage();
        }
        int start = Math.min(span.getStart(), expression.length());
        int width = Math.max(1, span.getEnd() - span.getStart());
        return getMessage() + "\n" + expression + "\n" + " ".repeat(start) + "^".repeat(width);
    }

    // Factories for the kinds raised from more than one place

    public static FormulaException cellOutOfBounds(String cell, String reason) {
        return new FormulaException(FormulaErrorKind.CELL_OUT_OF_BOUNDS,
                "cell " + cell + " is out of bounds: " + reason);
    }

    public static FormulaException rangeOutOfBounds(String range, String reason) {
        return new FormulaException(FormulaErrorKind.RANGE_OUT_OF_BOUNDS,
                "range " + range + " is out of bounds: " + reason);
    }

    public static FormulaException columnOutOfBounds(String column, String reason) {
        return new FormulaException(FormulaErrorKind.COLUMN_OUT_OF_BOUNDS,
                "column " + column + " is out of bounds: " + reason);
    }

    public static FormulaException rowOutOfBounds(String row, String reason) {
        return new FormulaException(FormulaErrorKind.ROW_OUT_OF_BOUNDS,
                "row " + row + " is out of bounds: " + reason);
    }

    public static FormulaException divisionByZero(String detail) {
        return new FormulaException(FormulaErrorKind.DIVISION_BY_ZERO, "division by zero " + detail);
    }

    public static FormulaException runtime(String message) {
        return new FormulaException(FormulaErrorKind.RUNTIME, message);
    }
}
