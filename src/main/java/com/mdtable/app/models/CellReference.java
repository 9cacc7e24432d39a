package com.mdtable.app.models;

import java.util.Objects;

/**
 * A parsed, not yet resolved locator into a table grid.
 *
 * Row indices of SCALAR and RANGE references are zero-based grid indices
 * (grid row 0 is the header, row 1 the separator, so formula row 1 is grid row 2).
 * ROW_VECTOR and ROW_RANGE keep the 1-based formula row the user typed.
 * Columns are always zero-based (A=0, B=1, ...).
 */
public final class CellReference {

    /** Grid row holding the first data row; rows above it are header and separator. */
    public static final int FIRST_DATA_ROW_INDEX = 2;

    public enum Kind {
        SCALAR,         // A1
        COLUMN_VECTOR,  // A_
        ROW_VECTOR,     // _1
        RANGE,          // A1:C5
        COLUMN_RANGE,   // A_:C_
        ROW_RANGE       // _1:_5
    }

    private final Kind kind;
    private final int startRow;
    private final int startCol;
    private final int endRow;
    private final int endCol;

    private CellReference(Kind kind, int startRow, int startCol, int endRow, int endCol) {
        this.kind = kind;
        this.startRow = startRow;
        this.startCol = startCol;
        this.endRow = endRow;
        this.endCol = endCol;
    }

    public static CellReference scalar(int row, int col) {
        return new CellReference(Kind.SCALAR, row, col, row, col);
    }

    public static CellReference columnVector(int col) {
        return new CellReference(Kind.COLUMN_VECTOR, -1, col, -1, col);
    }

    public static CellReference rowVector(int formulaRow) {
        return new CellReference(Kind.ROW_VECTOR, formulaRow, -1, formulaRow, -1);
    }

    public static CellReference range(int startRow, int startCol, int endRow, int endCol) {
        return new CellReference(Kind.RANGE,
                Math.min(startRow, endRow), Math.min(startCol, endCol),
                Math.max(startRow, endRow), Math.max(startCol, endCol));
    }

    public static CellReference columnRange(int startCol, int endCol) {
        return new CellReference(Kind.COLUMN_RANGE, -1, Math.min(startCol, endCol), -1, Math.max(startCol, endCol));
    }

    public static CellReference rowRange(int startFormulaRow, int endFormulaRow) {
        return new CellReference(Kind.ROW_RANGE,
                Math.min(startFormulaRow, endFormulaRow), -1, Math.max(startFormulaRow, endFormulaRow), -1);
    }

    /**
     * Combines two single references into a range, or returns null when their shapes differ
     * (e.g. "A_:_5") or either side is already a range.
     */
    public static CellReference between(CellReference start, CellReference end) {
        if (start.kind != end.kind) {
            return null;
        }
        switch (start.kind) {
            case SCALAR:
                return range(start.startRow, start.startCol, end.startRow, end.startCol);
            case COLUMN_VECTOR:
                return columnRange(start.startCol, end.startCol);
            case ROW_VECTOR:
                return rowRange(start.startRow, end.startRow);
            default:
                return null;
        }
    }

    /** Formula row 1 -> grid row 2, and so on. */
    public static int toGridRow(int formulaRow) {
        return FIRST_DATA_ROW_INDEX + formulaRow - 1;
    }

    public static int toFormulaRow(int gridRow) {
        return gridRow - FIRST_DATA_ROW_INDEX + 1;
    }

    public static String columnLetter(int col) {
        return String.valueOf((char) ('A' + col));
    }

    public Kind getKind() {
        return kind;
    }

    public int getRow() {
        return startRow;
    }

    public int getCol() {
        return startCol;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndCol() {
        return endCol;
    }

    /**
     * Renders the reference back in formula syntax, e.g. "B3", "C_", "_2", "A1:C5".
     */
    public String toText() {
        switch (kind) {
            case SCALAR:
                return cellText(startRow, startCol);
            case COLUMN_VECTOR:
                return columnLetter(startCol) + "_";
            case ROW_VECTOR:
                return "_" + startRow;
            case RANGE:
                return cellText(startRow, startCol) + ":" + cellText(endRow, endCol);
            case COLUMN_RANGE:
                return columnLetter(startCol) + "_:" + columnLetter(endCol) + "_";
            case ROW_RANGE:
                return "_" + startRow + ":_" + endRow;
            default:
                throw new IllegalStateException("Unknown reference kind: " + kind);
        }
    }

    private static String cellText(int gridRow, int col) {
        return columnLetter(col) + toFormulaRow(gridRow);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return kind == that.kind && startRow == that.startRow && startCol == that.startCol
                && endRow == that.endRow && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, startRow, startCol, endRow, endCol);
    }

    @Override
    public String toString() {
        return kind + " " + toText();
    }
}
