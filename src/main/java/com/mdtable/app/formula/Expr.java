package com.mdtable.app.formula;

import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.Span;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression tree produced by {@link Parser}. Every node remembers the part of the
 * source text it was built from; a parent's span covers all of its children.
 */
public abstract class Expr {
    private final Span span;

    private Expr(Span span) {
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }

    public static final class Literal extends Expr {
        private final BigDecimal value;

        public Literal(BigDecimal value, Span span) {
            super(span);
            this.value = value;
        }

        public BigDecimal getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    /** Quoted text; only meaningful as a function argument, e.g. from("sales"). */
    public static final class StringLiteral extends Expr {
        private final String text;

        public StringLiteral(String text, Span span) {
            super(span);
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "\"" + text + "\"";
        }
    }

    public static final class Variable extends Expr {
        private final String name;

        public Variable(String name, Span span) {
            super(span);
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class CellRef extends Expr {
        private final CellReference reference;

        public CellRef(CellReference reference, Span span) {
            super(span);
            this.reference = reference;
        }

        public CellReference getReference() {
            return reference;
        }

        @Override
        public String toString() {
            return reference.toText();
        }
    }

    public static final class BinaryOp extends Expr {
        private final Expr left;
        private final BinaryOperator operator;
        private final Expr right;

        public BinaryOp(Expr left, BinaryOperator operator, Expr right) {
            super(left.getSpan().merge(right.getSpan()));
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public Expr getLeft() {
            return left;
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public Expr getRight() {
            return right;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    public static final class Transpose extends Expr {
        private final Expr inner;

        public Transpose(Expr inner, Span span) {
            super(span);
            this.inner = inner;
        }

        public Expr getInner() {
            return inner;
        }

        @Override
        public String toString() {
            return inner + ".T";
        }
    }

    public static final class FunctionCall extends Expr {
        private final String name;
        private final List<Expr> args;

        public FunctionCall(String name, List<Expr> args, Span span) {
            super(span);
            this.name = name;
            this.args = Collections.unmodifiableList(args);
        }

        public String getName() {
            return name;
        }

        public List<Expr> getArgs() {
            return args;
        }

        @Override
        public String toString() {
            return name + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
