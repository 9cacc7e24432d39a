package com.mdtable.app.models;

/**
 * One parsed formula: either a variable binding ("let x = ...") or a cell assignment,
 * together with the right-hand side expression text it applies to.
 */
public final class Statement {

    public enum Type {
        LET,
        ASSIGNMENT
    }

    private final Type type;
    // Only for LET
    private final String name;
    private final Span span;
    // Only for ASSIGNMENT
    private final Assignment assignment;
    private final String expression;

    private Statement(Type type, String name, Span span, Assignment assignment, String expression) {
        this.type = type;
        this.name = name;
        this.span = span;
        this.assignment = assignment;
        this.expression = expression;
    }

    public static Statement let(String name, Span span, String expression) {
        return new Statement(Type.LET, name, span, null, expression);
    }

    public static Statement assignment(Assignment assignment, String expression) {
        return new Statement(Type.ASSIGNMENT, null, null, assignment, expression);
    }

    public boolean isLet() {
        return type == Type.LET;
    }

    public String getName() {
        return name;
    }

    /**
     * Position of the variable name within the trimmed formula; null for assignments.
     */
    public Span getSpan() {
        return span;
    }

    public Assignment getAssignment() {
        return assignment;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return isLet() ? "let " + name + " = " + expression : assignment + " = " + expression;
    }
}
