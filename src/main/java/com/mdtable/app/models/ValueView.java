package com.mdtable.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link Value}. For example:
 * {
 *   "type": "MATRIX",
 *   "rows": 2,
 *   "cols": 1,
 *   "data": [["1"], ["2"]]
 * }
 * A scalar is reported as a 1x1 grid with type SCALAR.
 */
public class ValueView {

    public enum Type {
        SCALAR,
        MATRIX
    }

    private final Type type;
    private final int rows;
    private final int cols;
    private final List<List<String>> data;

    private ValueView(Type type, int rows, int cols, List<List<String>> data) {
        this.type = type;
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public static ValueView of(Value value) {
        if (value instanceof Value.Scalar) {
            String text = ((Value.Scalar) value).getValue().toPlainString();
            List<List<String>> data = new ArrayList<>();
            data.add(List.of(text));
            return new ValueView(Type.SCALAR, 1, 1, data);
        }
        Value.Matrix m = (Value.Matrix) value;
        List<List<String>> data = new ArrayList<>(m.getRows());
        for (int r = 0; r < m.getRows(); r++) {
            List<String> row = new ArrayList<>(m.getCols());
            for (int c = 0; c < m.getCols(); c++) {
                row.add(m.get(r, c).toPlainString());
            }
            data.add(row);
        }
        return new ValueView(Type.MATRIX, m.getRows(), m.getCols(), data);
    }

    public Type getType() {
        return type;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public List<List<String>> getData() {
        return data;
    }
}
