package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.FormulaResult;
import com.mdtable.app.models.Statement;
import com.mdtable.app.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a batch of formulas against one table grid, in order.
 *
 * - "let" statements bind variables visible to later formulas of the same batch
 * - assignments evaluate their expression and write the result into the grid
 * - a failing formula is reported in its {@link FormulaResult} and leaves the grid untouched;
 *   the remaining formulas still run
 *
 * The grid is modified in place, so every row must be a mutable list.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    public static final MathContext DEFAULT_MATH_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);

    private final Evaluator evaluator;

    public FormulaEngine() {
        this(DEFAULT_MATH_CONTEXT);
    }

    public FormulaEngine(MathContext mathContext) {
        this.evaluator = new Evaluator(mathContext);
    }

    public MathContext getMathContext() {
        return evaluator.getMathContext();
    }

    public List<FormulaResult> apply(List<List<String>> rows, List<String> formulas) {
        return apply(rows, formulas, Collections.emptyMap());
    }

    /**
     * @param rows     table grid: header row, separator row, then data rows
     * @param formulas formulas in execution order
     * @param tables   other tables by id, reachable through from("id")
     * @return one result per formula, in the same order
     */
    public List<FormulaResult> apply(List<List<String>> rows, List<String> formulas,
                                     Map<String, List<List<String>>> tables) {
        Map<String, Value> variables = new HashMap<>();
        List<FormulaResult> results = new ArrayList<>(formulas.size());
        int failed = 0;

        for (String formula : formulas) {
            try {
                execute(formula, rows, tables, variables);
                results.add(FormulaResult.success(formula));
            } catch (FormulaException e) {
                log.debug("Formula '{}' failed [{}]: {}", formula, e.getKind(), e.getMessage());
                results.add(FormulaResult.failure(formula, e.getKind(), e.getMessage()));
                failed++;
            }
        }

        log.debug("Applied {} formulas, {} failed", formulas.size(), failed);
        return results;
    }

    /**
     * Parses and evaluates a bare expression without touching the grid.
     */
    public Value evaluate(String expression, List<List<String>> rows,
                          Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        Expr expr = Parser.parse(expression);
        return evaluator.evaluate(expr, rows, tables, variables);
    }

    private void execute(String formula, List<List<String>> rows,
                         Map<String, List<List<String>>> tables, Map<String, Value> variables) {
        Statement statement;
        try {
            statement = StatementParser.parse(formula);
        } catch (FormulaException e) {
            throw new FormulaException(e.getKind(),
                    "Failed to parse statement '" + formula.trim() + "': " + e.getMessage());
        }

        String expression = statement.getExpression();
        Value value;
        try {
            value = evaluate(expression, rows, tables, variables);
        } catch (FormulaException e) {
            String subject = statement.isLet()
                    ? "Failed to evaluate expression for variable '" + statement.getName() + "'"
                    : "Failed to evaluate expression";
            if (e.hasSpan()) {
                throw new FormulaException(e.getKind(), subject + ":\n" + e.withContext(expression), e.getSpan());
            }
            throw new FormulaException(e.getKind(), subject + " '" + expression + "': " + e.getMessage());
        }

        if (statement.isLet()) {
            variables.put(statement.getName(), value);
            return;
        }

        try {
            write(statement.getAssignment().getTarget(), value, rows);
        } catch (FormulaException e) {
            throw new FormulaException(e.getKind(),
                    "Assignment failed for '" + formula.trim() + "': " + e.getMessage());
        }
    }

    /**
     * Writes a value into the grid. Every check runs before the first cell is written,
     * so a rejected assignment never leaves a partial write behind.
     */
    static void write(CellReference target, Value value, List<List<String>> rows) {
        switch (target.getKind()) {
            case SCALAR:
                writeCell(target, value, rows);
                break;
            case COLUMN_VECTOR:
                writeColumns(target, value, rows, true);
                break;
            case COLUMN_RANGE:
                writeColumns(target, value, rows, false);
                break;
            case ROW_VECTOR:
                writeRows(target, value, rows, true);
                break;
            case ROW_RANGE:
                writeRows(target, value, rows, false);
                break;
            case RANGE:
                writeRange(target, value, rows);
                break;
            default:
                throw new IllegalStateException("Unknown reference kind: " + target.getKind());
        }
    }

    private static void writeCell(CellReference target, Value value, List<List<String>> rows) {
        BigDecimal scalar = value.asScalar();
        if (scalar == null) {
            throw invalid("cannot assign " + value.shape() + " matrix to single cell " + target.toText());
        }
        int row = target.getRow();
        int col = target.getCol();
        if (row >= rows.size() || col >= rows.get(row).size()) {
            throw invalid("cell " + target.toText() + " is out of bounds");
        }
        rows.get(row).set(col, format(scalar));
    }

    private static void writeColumns(CellReference target, Value value, List<List<String>> rows, boolean vector) {
        if (!(value instanceof Value.Matrix)) {
            throw invalid("expected a matrix for " + target.toText() + " but got a scalar result");
        }
        Value.Matrix matrix = (Value.Matrix) value;
        int startCol = target.getStartCol();
        int width = target.getEndCol() - startCol + 1;
        if (vector && matrix.getCols() != 1) {
            throw invalid("expected a column vector (n×1) for " + target.toText() + " but got " + matrix.shape());
        }
        if (!vector && matrix.getCols() != width) {
            throw invalid(String.format("column range %s has %d columns but value has %d",
                    target.toText(), width, matrix.getCols()));
        }
        if (rows.isEmpty() || target.getEndCol() >= rows.get(0).size()) {
            throw invalid("column " + target.toText() + " is out of bounds");
        }

        // Values beyond the last data row are dropped
        for (int i = 0; i < matrix.getRows(); i++) {
            int r = CellReference.FIRST_DATA_ROW_INDEX + i;
            if (r >= rows.size()) {
                break;
            }
            List<String> row = rows.get(r);
            for (int c = 0; c < width; c++) {
                if (startCol + c < row.size()) {
                    row.set(startCol + c, format(matrix.get(i, c)));
                }
            }
        }
    }

    private static void writeRows(CellReference target, Value value, List<List<String>> rows, boolean vector) {
        if (!(value instanceof Value.Matrix)) {
            throw invalid("expected a matrix for " + target.toText() + " but got a scalar result");
        }
        Value.Matrix matrix = (Value.Matrix) value;
        int startIndex = CellReference.toGridRow(target.getStartRow());
        int height = target.getEndRow() - target.getStartRow() + 1;
        if (vector && matrix.getRows() != 1) {
            throw invalid("expected a row vector (1×n) for " + target.toText() + " but got " + matrix.shape());
        }
        if (!vector && matrix.getRows() != height) {
            throw invalid(String.format("row range %s has %d rows but value has %d",
                    target.toText(), height, matrix.getRows()));
        }
        if (startIndex + height - 1 >= rows.size()) {
            throw invalid("row " + target.toText() + " is out of bounds");
        }

        // Values beyond the end of a row are dropped
        for (int i = 0; i < height; i++) {
            List<String> row = rows.get(startIndex + i);
            for (int c = 0; c < matrix.getCols() && c < row.size(); c++) {
                row.set(c, format(matrix.get(i, c)));
            }
        }
    }

    private static void writeRange(CellReference target, Value value, List<List<String>> rows) {
        int height = target.getEndRow() - target.getStartRow() + 1;
        int width = target.getEndCol() - target.getStartCol() + 1;
        if (height == 1 && width == 1) {
            writeCell(CellReference.scalar(target.getStartRow(), target.getStartCol()), value, rows);
            return;
        }
        if (!(value instanceof Value.Matrix)) {
            throw invalid("expected a matrix for " + target.toText() + " but got a scalar result");
        }
        Value.Matrix matrix = (Value.Matrix) value;
        if (matrix.getRows() != height || matrix.getCols() != width) {
            throw invalid(String.format("range %s is (%d×%d) but value is %s",
                    target.toText(), height, width, matrix.shape()));
        }
        if (target.getEndRow() >= rows.size()) {
            throw invalid("range " + target.toText() + " is out of bounds");
        }
        for (int r = target.getStartRow(); r <= target.getEndRow(); r++) {
            if (target.getEndCol() >= rows.get(r).size()) {
                throw invalid("range " + target.toText() + " is out of bounds");
            }
        }

        for (int i = 0; i < height; i++) {
            List<String> row = rows.get(target.getStartRow() + i);
            for (int c = 0; c < width; c++) {
                row.set(target.getStartCol() + c, format(matrix.get(i, c)));
            }
        }
    }

    static String format(BigDecimal value) {
        return value.toPlainString();
    }

    private static FormulaException invalid(String message) {
        return new FormulaException(FormulaErrorKind.INVALID_ASSIGNMENT, message);
    }
}
