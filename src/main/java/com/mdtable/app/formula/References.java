package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.mdtable.app.models.CellReference.FIRST_DATA_ROW_INDEX;
import static com.mdtable.app.models.CellReference.columnLetter;
import static com.mdtable.app.models.CellReference.toGridRow;

/**
 * Reading and resolving cell references ("A1", "B_", "_3", "A1:C5", ...) against a table grid.
 *
 * The grid is a list of rows of cell strings: row 0 is the header, row 1 the
 * separator, everything below is data. Cells that are not numbers (blank cells,
 * labels) read as zero so formulas work on sparsely filled tables.
 */
public final class References {

    // Longest row number accepted, keeps int arithmetic safe
    private static final int MAX_ROW_DIGITS = 9;
    // Same shape as a numeric literal, so exponent notation never reaches BigDecimal
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    private References() {
    }

    /**
     * Parses a single reference token, case-insensitively:
     * "_N" is a row vector, "L_" a column vector, "L" followed by digits a scalar cell.
     *
     * @return the reference, or null when the token is not a reference
     */
    public static CellReference parse(String token) {
        if (token == null) {
            return null;
        }
        String ref = token.trim().toUpperCase(Locale.ROOT);
        if (ref.isEmpty()) {
            return null;
        }

        if (ref.charAt(0) == '_') {
            int row = parseRowNumber(ref.substring(1));
            return row > 0 ? CellReference.rowVector(row) : null;
        }

        char first = ref.charAt(0);
        if (first < 'A' || first > 'Z') {
            return null;
        }
        int col = first - 'A';
        String rest = ref.substring(1);

        if (rest.equals("_")) {
            return CellReference.columnVector(col);
        }
        int row = parseRowNumber(rest);
        return row > 0 ? CellReference.scalar(toGridRow(row), col) : null;
    }

    /**
     * Same as {@link #parse(String)} but also accepts "REF:REF" ranges.
     * Returns null for anything else, including ranges with mixed endpoint shapes.
     */
    public static CellReference parseWithRange(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return parse(text);
        }
        if (text.indexOf(':', colon + 1) >= 0) {
            return null;
        }
        CellReference start = parse(text.substring(0, colon));
        CellReference end = parse(text.substring(colon + 1));
        if (start == null || end == null) {
            return null;
        }
        return CellReference.between(start, end);
    }

    /**
     * Resolves a reference to the numbers it points at.
     * A single-cell range gives a Scalar, not a 1x1 matrix.
     */
    public static Value resolve(CellReference ref, List<List<String>> rows) {
        switch (ref.getKind()) {
            case SCALAR:
                return resolveScalar(ref, rows);
            case COLUMN_VECTOR:
                return resolveColumns(ref, ref.getCol(), ref.getCol(), rows);
            case ROW_VECTOR:
                return resolveRows(ref, ref.getRow(), ref.getRow(), rows);
            case RANGE:
                return resolveRange(ref, rows);
            case COLUMN_RANGE:
                return resolveColumns(ref, ref.getStartCol(), ref.getEndCol(), rows);
            case ROW_RANGE:
                return resolveRows(ref, ref.getStartRow(), ref.getEndRow(), rows);
            default:
                throw new IllegalStateException("Unknown reference kind: " + ref.getKind());
        }
    }

    /**
     * The whole data region of a table (header and separator excluded) as one matrix.
     * Rows shorter than the widest row are padded with zeros.
     */
    public static Value.Matrix tableToMatrix(List<List<String>> rows) {
        if (rows.size() < FIRST_DATA_ROW_INDEX) {
            throw FormulaException.runtime("table has no data rows");
        }
        int numRows = rows.size() - FIRST_DATA_ROW_INDEX;
        int numCols = widest(rows, FIRST_DATA_ROW_INDEX, rows.size() - 1);
        if (numRows == 0) {
            return Value.matrix(0, 0, new BigDecimal[0]);
        }

        BigDecimal[] data = new BigDecimal[numRows * numCols];
        int i = 0;
        for (int r = FIRST_DATA_ROW_INDEX; r < rows.size(); r++) {
            for (int c = 0; c < numCols; c++) {
                data[i++] = cellValue(rows.get(r), c);
            }
        }
        return Value.matrix(numRows, numCols, data);
    }

    /**
     * Lays a matrix out as a grid with an empty header and separator on top,
     * so references can be resolved against it like against a table.
     */
    public static List<List<String>> matrixToGrid(Value.Matrix matrix) {
        List<List<String>> grid = new ArrayList<>();
        grid.add(new ArrayList<>(Collections.nCopies(matrix.getCols(), "")));
        grid.add(new ArrayList<>(Collections.nCopies(matrix.getCols(), "---")));
        for (int r = 0; r < matrix.getRows(); r++) {
            List<String> row = new ArrayList<>(matrix.getCols());
            for (int c = 0; c < matrix.getCols(); c++) {
                row.add(matrix.get(r, c).toPlainString());
            }
            grid.add(row);
        }
        return grid;
    }

    /**
     * Decimal value of a cell string. Only plain decimals such as "12", "-3" or "0.25"
     * are numbers; blank cells, labels and exponent notation ("1e3") count as zero.
     */
    public static BigDecimal parseCell(String cell) {
        if (cell == null) {
            return BigDecimal.ZERO;
        }
        String text = cell.trim();
        if (text.isEmpty()) {
            return BigDecimal.ZERO;
        }
        if (!PLAIN_DECIMAL.matcher(text).matches()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(text);
    }

    private static Value resolveScalar(CellReference ref, List<List<String>> rows) {
        int row = ref.getRow();
        int col = ref.getCol();
        if (row >= rows.size()) {
            throw FormulaException.cellOutOfBounds(ref.toText(), String.format(
                    "row %d does not exist (table has %d data rows)",
                    CellReference.toFormulaRow(row), dataRowCount(rows)));
        }
        List<String> cells = rows.get(row);
        if (col >= cells.size()) {
            throw FormulaException.cellOutOfBounds(ref.toText(), String.format(
                    "column %s does not exist (row has %d columns)", columnLetter(col), cells.size()));
        }
        return Value.scalar(parseCell(cells.get(col)));
    }

    private static Value resolveRange(CellReference ref, List<List<String>> rows) {
        if (ref.getEndRow() >= rows.size()) {
            throw FormulaException.rangeOutOfBounds(ref.toText(), String.format(
                    "end row %d does not exist (table has %d data rows)",
                    CellReference.toFormulaRow(ref.getEndRow()), dataRowCount(rows)));
        }
        for (int r = ref.getStartRow(); r <= ref.getEndRow(); r++) {
            if (ref.getEndCol() >= rows.get(r).size()) {
                throw FormulaException.rangeOutOfBounds(ref.toText(), String.format(
                        "column %s does not exist in row %d (row has %d columns)",
                        columnLetter(ref.getEndCol()), CellReference.toFormulaRow(r), rows.get(r).size()));
            }
        }

        int numRows = ref.getEndRow() - ref.getStartRow() + 1;
        int numCols = ref.getEndCol() - ref.getStartCol() + 1;
        BigDecimal[] data = new BigDecimal[numRows * numCols];
        int i = 0;
        for (int r = ref.getStartRow(); r <= ref.getEndRow(); r++) {
            for (int c = ref.getStartCol(); c <= ref.getEndCol(); c++) {
                data[i++] = parseCell(rows.get(r).get(c));
            }
        }

        if (numRows == 1 && numCols == 1) {
            return Value.scalar(data[0]);
        }
        return Value.matrix(numRows, numCols, data);
    }

    /**
     * Column vector or column range: every data row, columns startCol..endCol.
     */
    private static Value resolveColumns(CellReference ref, int startCol, int endCol, List<List<String>> rows) {
        if (rows.size() <= FIRST_DATA_ROW_INDEX) {
            throw FormulaException.columnOutOfBounds(ref.toText(), String.format(
                    "table has no data rows (only %d rows total)", rows.size()));
        }
        int width = rows.get(FIRST_DATA_ROW_INDEX).size();
        if (endCol >= width) {
            throw FormulaException.columnOutOfBounds(ref.toText(), String.format(
                    "column %s does not exist (table has %d columns)", columnLetter(endCol), width));
        }

        int numRows = rows.size() - FIRST_DATA_ROW_INDEX;
        int numCols = endCol - startCol + 1;
        BigDecimal[] data = new BigDecimal[numRows * numCols];
        int i = 0;
        for (int r = FIRST_DATA_ROW_INDEX; r < rows.size(); r++) {
            for (int c = startCol; c <= endCol; c++) {
                data[i++] = cellValue(rows.get(r), c);
            }
        }
        return Value.matrix(numRows, numCols, data);
    }

    /**
     * Row vector or row range: formula rows startRow..endRow, every column.
     */
    private static Value resolveRows(CellReference ref, int startRow, int endRow, List<List<String>> rows) {
        int startIndex = toGridRow(startRow);
        int endIndex = toGridRow(endRow);
        if (endIndex >= rows.size()) {
            throw FormulaException.rowOutOfBounds(ref.toText(), String.format(
                    "row %d does not exist (table has %d data rows)", endRow, dataRowCount(rows)));
        }

        int numRows = endIndex - startIndex + 1;
        int numCols = widest(rows, startIndex, endIndex);
        BigDecimal[] data = new BigDecimal[numRows * numCols];
        int i = 0;
        for (int r = startIndex; r <= endIndex; r++) {
            for (int c = 0; c < numCols; c++) {
                data[i++] = cellValue(rows.get(r), c);
            }
        }
        return Value.matrix(numRows, numCols, data);
    }

    private static BigDecimal cellValue(List<String> row, int col) {
        return col < row.size() ? parseCell(row.get(col)) : BigDecimal.ZERO;
    }

    private static int widest(List<List<String>> rows, int from, int to) {
        int width = 0;
        for (int r = from; r <= to && r < rows.size(); r++) {
            width = Math.max(width, rows.get(r).size());
        }
        return width;
    }

    private static int dataRowCount(List<List<String>> rows) {
        return Math.max(0, rows.size() - FIRST_DATA_ROW_INDEX);
    }

    private static int parseRowNumber(String digits) {
        if (digits.isEmpty() || digits.length() > MAX_ROW_DIGITS) {
            return -1;
        }
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }
}
