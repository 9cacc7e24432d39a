package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;

/**
 * Reduces an expression tree to a {@link Value}.
 *
 * Cell references are resolved against the current table, {@code from(...)} reads other
 * tables or matrix variables, and variables come from earlier {@code let} statements.
 * Shapes are never widened implicitly: a scalar stays a scalar and matrices must agree
 * in dimensions, otherwise the evaluation fails with a shape error.
 */
public class Evaluator {

    private static final String FROM = "from";
    // Largest exponent BigDecimal.pow accepts
    private static final BigDecimal MAX_EXPONENT = BigDecimal.valueOf(999_999_999);
    // Exact powers longer than this many digits are rounded to the math context
    private static final long MAX_EXACT_POWER_DIGITS = 10_000;
    // Bound on the decimal exponent of a power result
    private static final long MAX_POWER_MAGNITUDE = 100_000;

    private final MathContext mathContext;

    public Evaluator(MathContext mathContext) {
        if (mathContext.getPrecision() <= 0) {
            throw new IllegalArgumentException("math context needs a positive precision, got " + mathContext);
        }
        this.mathContext = mathContext;
    }

    public MathContext getMathContext() {
        return mathContext;
    }

    /**
     * @param expr      parsed expression
     * @param rows      current table (header, separator, data rows)
     * @param tables    other tables by id, for from()
     * @param variables variables bound so far in this batch
     */
    public Value evaluate(Expr expr, List<List<String>> rows,
                          Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        try {
            return evaluateNode(expr, rows, tables, variables);
        } catch (FormulaException e) {
            // Innermost node wins; outer nodes only fill in a missing span
            throw e.attachSpan(expr.getSpan());
        }
    }

    private Value evaluateNode(Expr expr, List<List<String>> rows,
                               Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        if (expr instanceof Expr.Literal) {
            return Value.scalar(((Expr.Literal) expr).getValue());
        }
        if (expr instanceof Expr.StringLiteral) {
            throw FormulaException.runtime(
                    "string literals can only be used as arguments to functions like from()");
        }
        if (expr instanceof Expr.Variable) {
            return lookupVariable(((Expr.Variable) expr).getName(), variables);
        }
        if (expr instanceof Expr.CellRef) {
            return References.resolve(((Expr.CellRef) expr).getReference(), rows);
        }
        if (expr instanceof Expr.BinaryOp) {
            Expr.BinaryOp op = (Expr.BinaryOp) expr;
            Value left = evaluate(op.getLeft(), rows, tables, variables);
            Value right = evaluate(op.getRight(), rows, tables, variables);
            return applyOperator(op.getOperator(), left, right);
        }
        if (expr instanceof Expr.Transpose) {
            Value value = evaluate(((Expr.Transpose) expr).getInner(), rows, tables, variables);
            Value.Matrix transposed = value.transpose();
            if (transposed == null) {
                throw new FormulaException(FormulaErrorKind.TRANSPOSE_SCALAR,
                        "cannot transpose a scalar value - only matrices can be transposed");
            }
            return transposed;
        }
        if (expr instanceof Expr.FunctionCall) {
            return callFunction((Expr.FunctionCall) expr, rows, tables, variables);
        }
        throw new IllegalStateException("Unknown expression node: " + expr.getClass().getSimpleName());
    }

    private static Value lookupVariable(String name, Map<String, Value> variables) {
        Value value = variables.get(name);
        if (value == null) {
            throw new FormulaException(FormulaErrorKind.UNDEFINED_VARIABLE, "undefined variable: '" + name + "'");
        }
        return value;
    }

    // ----------------------------------------------------------------
    // Functions
    // ----------------------------------------------------------------

    private Value callFunction(Expr.FunctionCall call, List<List<String>> rows,
                               Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        String name = call.getName();
        List<Expr> args = call.getArgs();

        if (FROM.equalsIgnoreCase(name)) {
            return callFrom(args, tables, variables);
        }

        AggregateFunction function = AggregateFunction.forName(name);
        if (function == null) {
            throw new FormulaException(FormulaErrorKind.UNKNOWN_FUNCTION, String.format(
                    "unknown function: '%s' (supported functions: %s, %s)", name, AggregateFunction.names(), FROM));
        }
        if (args.size() != 1) {
            throw new FormulaException(FormulaErrorKind.FUNCTION_ARGUMENT, String.format(
                    "function '%s' expects exactly 1 argument, got %d", name, args.size()));
        }
        Value arg = evaluate(args.get(0), rows, tables, variables);
        return function.apply(arg, mathContext);
    }

    /**
     * from("id"), from("id", range), from(variable), from(variable, range).
     * The range is resolved against the other table (or the variable's matrix),
     * never against the current one.
     */
    private Value callFrom(List<Expr> args, Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        if (args.isEmpty() || args.size() > 2) {
            throw new FormulaException(FormulaErrorKind.FUNCTION_ARGUMENT,
                    "function 'from' expects 1 or 2 arguments, got " + args.size());
        }

        Expr source = args.get(0);
        List<List<String>> sourceRows;
        if (source instanceof Expr.StringLiteral) {
            String tableId = ((Expr.StringLiteral) source).getText();
            sourceRows = tables.get(tableId);
            if (sourceRows == null) {
                throw new FormulaException(FormulaErrorKind.TABLE_NOT_FOUND,
                        "table '" + tableId + "' not found", source.getSpan());
            }
            if (args.size() == 1) {
                return References.tableToMatrix(sourceRows);
            }
        } else if (source instanceof Expr.Variable) {
            String varName = ((Expr.Variable) source).getName();
            Value value;
            try {
                value = lookupVariable(varName, variables);
            } catch (FormulaException e) {
                throw e.attachSpan(source.getSpan());
            }
            if (!(value instanceof Value.Matrix)) {
                throw new FormulaException(FormulaErrorKind.FUNCTION_ARGUMENT,
                        "cannot use from() with scalar variable '" + varName + "' - expected matrix", source.getSpan());
            }
            if (args.size() == 1) {
                return value;
            }
            sourceRows = References.matrixToGrid((Value.Matrix) value);
        } else {
            throw new FormulaException(FormulaErrorKind.FUNCTION_ARGUMENT,
                    "from() first argument must be a string literal (table ID) or variable reference", source.getSpan());
        }

        Expr range = args.get(1);
        if (!(range instanceof Expr.CellRef)) {
            throw new FormulaException(FormulaErrorKind.FUNCTION_ARGUMENT,
                    "from() second argument must be a cell reference or range", range.getSpan());
        }
        try {
            return References.resolve(((Expr.CellRef) range).getReference(), sourceRows);
        } catch (FormulaException e) {
            throw e.attachSpan(range.getSpan());
        }
    }

    // ----------------------------------------------------------------
    // Operators
    // ----------------------------------------------------------------

    /**
     * Applies a binary operator with broadcasting:
     * - scalar op scalar: plain arithmetic
     * - matrix op matrix: element-wise, dimensions must be equal
     * - matrix op scalar, scalar op matrix: the scalar is applied to every element
     * - @ is matrix multiplication and only accepts two matrices
     */
    public Value applyOperator(BinaryOperator op, Value left, Value right) {
        if (op == BinaryOperator.MATRIX_MULTIPLY) {
            return matrixMultiply(left, right);
        }

        if (left instanceof Value.Scalar && right instanceof Value.Scalar) {
            BigDecimal l = left.asScalar();
            BigDecimal r = right.asScalar();
            return Value.scalar(applyScalar(op, l, r,
                    "in scalar operation: " + l.toPlainString() + " " + op + " " + r.toPlainString()));
        }

        if (left instanceof Value.Matrix && right instanceof Value.Matrix) {
            Value.Matrix a = (Value.Matrix) left;
            Value.Matrix b = (Value.Matrix) right;
            if (a.getRows() != b.getRows() || a.getCols() != b.getCols()) {
                throw new FormulaException(FormulaErrorKind.DIMENSION_MISMATCH, String.format(
                        "element-wise operation '%s' requires matching dimensions: got %s and %s",
                        op, a.shape(), b.shape()));
            }
            BigDecimal[] result = new BigDecimal[a.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = applyScalar(op, a.get(i), b.get(i),
                        "in element-wise operation at position " + i);
            }
            return Value.matrix(a.getRows(), a.getCols(), result);
        }

        if (left instanceof Value.Matrix) {
            Value.Matrix m = (Value.Matrix) left;
            BigDecimal s = right.asScalar();
            BigDecimal[] result = new BigDecimal[m.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = applyScalar(op, m.get(i), s,
                        "when broadcasting scalar to matrix at position " + i);
            }
            return Value.matrix(m.getRows(), m.getCols(), result);
        }

        Value.Matrix m = (Value.Matrix) right;
        BigDecimal s = left.asScalar();
        BigDecimal[] result = new BigDecimal[m.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = applyScalar(op, s, m.get(i),
                    "when broadcasting scalar to matrix at position " + i);
        }
        return Value.matrix(m.getRows(), m.getCols(), result);
    }

    private Value matrixMultiply(Value left, Value right) {
        if (left instanceof Value.Scalar || right instanceof Value.Scalar) {
            String hint = left instanceof Value.Scalar && right instanceof Value.Scalar
                    ? " - use * for scalar multiplication" : "";
            throw new FormulaException(FormulaErrorKind.SCALAR_MATMUL, String.format(
                    "cannot use matrix multiplication (@) with %s on left side and %s on right side%s",
                    describe(left), describe(right), hint));
        }

        Value.Matrix a = (Value.Matrix) left;
        Value.Matrix b = (Value.Matrix) right;
        int m = a.getRows();
        int n = a.getCols();
        int p = b.getCols();
        if (n != b.getRows()) {
            throw new FormulaException(FormulaErrorKind.MATMUL_DIMENSION_MISMATCH, String.format(
                    "matrix multiplication dimension mismatch: cannot multiply %s @ %s - inner dimensions %d and %d must match",
                    a.shape(), b.shape(), n, b.getRows()));
        }

        BigDecimal[] result = new BigDecimal[m * p];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < p; j++) {
                BigDecimal sum = BigDecimal.ZERO;
                for (int k = 0; k < n; k++) {
                    sum = sum.add(a.get(i, k).multiply(b.get(k, j)));
                }
                result[i * p + j] = sum;
            }
        }
        return Value.matrix(m, p, result);
    }

    private static String describe(Value value) {
        return value instanceof Value.Scalar ? "scalar" : value.shape() + " matrix";
    }

    private BigDecimal applyScalar(BinaryOperator op, BigDecimal left, BigDecimal right, String where) {
        switch (op) {
            case ADD:
                return left.add(right);
            case SUBTRACT:
                return left.subtract(right);
            case MULTIPLY:
                return left.multiply(right);
            case DIVIDE:
                if (right.signum() == 0) {
                    throw FormulaException.divisionByZero(where);
                }
                return left.divide(right, mathContext);
            case POWER:
                return power(left, right, where);
            default:
                throw new IllegalArgumentException("Not an element-wise operator: " + op);
        }
    }

    /**
     * Integer exponents are computed exactly (negative ones as a reciprocal) unless the exact
     * result would run past {@value #MAX_EXACT_POWER_DIGITS} digits, in which case the power is
     * rounded to the math context. Results beyond 10^{@value #MAX_POWER_MAGNITUDE} in either
     * direction are rejected. Other exponents go through double and lose precision.
     */
    BigDecimal power(BigDecimal base, BigDecimal exponent, String where) {
        if (exponent.signum() == 0 || exponent.stripTrailingZeros().scale() <= 0) {
            if (exponent.abs().compareTo(MAX_EXPONENT) > 0) {
                throw FormulaException.runtime("exponent " + exponent.toPlainString() + " is too large");
            }
            int n = exponent.intValue();
            if (n == 0) {
                return BigDecimal.ONE;
            }
            if (base.signum() == 0) {
                if (n < 0) {
                    throw FormulaException.divisionByZero(where);
                }
                return BigDecimal.ZERO;
            }
            if (base.abs().compareTo(BigDecimal.ONE) == 0) {
                return n % 2 == 0 ? BigDecimal.ONE : base;
            }

            long steps = Math.abs((long) n);
            // Adjusted exponent of the base: 0 for 3, 2 for 250, -2 for 0.01
            long adjusted = (long) base.precision() - base.scale() - 1;
            if ((Math.abs(adjusted) + 1) * steps > MAX_POWER_MAGNITUDE) {
                throw FormulaException.runtime(String.format("%s ^ %d is too large (result beyond 10^%d)",
                        base.toPlainString(), n, MAX_POWER_MAGNITUDE));
            }
            if ((long) base.precision() * steps > MAX_EXACT_POWER_DIGITS) {
                return base.pow(n, mathContext);
            }
            BigDecimal raised = base.pow((int) steps);
            if (n > 0) {
                return raised;
            }
            return BigDecimal.ONE.divide(raised, mathContext);
        }

        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw FormulaException.runtime(String.format("%s ^ %s is not a finite number",
                    base.toPlainString(), exponent.toPlainString()));
        }
        return BigDecimal.valueOf(result);
    }
}
