package com.mdtable.app.models;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runtime value of a formula expression. There are exactly two kinds:
 * - {@link Scalar}: a single decimal
 * - {@link Matrix}: a rows x cols block of decimals stored row-major
 *
 * A 1x1 matrix is numerically a scalar but stays a matrix until
 * {@link #asScalar()} is asked for its number.
 */
public abstract class Value {

    private Value() {
    }

    public static Scalar scalar(BigDecimal value) {
        return new Scalar(value);
    }

    public static Matrix matrix(int rows, int cols, BigDecimal[] data) {
        return new Matrix(rows, cols, data);
    }

    /**
     * n x 1 matrix.
     */
    public static Matrix columnVector(BigDecimal[] data) {
        return new Matrix(data.length, 1, data);
    }

    /**
     * 1 x n matrix.
     */
    public static Matrix rowVector(BigDecimal[] data) {
        return new Matrix(1, data.length, data);
    }

    /**
     * The number held by a scalar or a 1x1 matrix, otherwise null.
     */
    public abstract BigDecimal asScalar();

    /**
     * Swaps rows and columns. Scalars cannot be transposed and return null.
     */
    public abstract Matrix transpose();

    /**
     * Human readable shape used in error messages: "scalar" or "(m×n)".
     */
    public abstract String shape();

    public boolean isScalar() {
        return this instanceof Scalar;
    }

    public boolean isMatrix() {
        return this instanceof Matrix;
    }

    public boolean isColumnVector() {
        return this instanceof Matrix && ((Matrix) this).getCols() == 1;
    }

    public boolean isRowVector() {
        return this instanceof Matrix && ((Matrix) this).getRows() == 1;
    }

    public static final class Scalar extends Value {
        private final BigDecimal value;

        private Scalar(BigDecimal value) {
            if (value == null) {
                throw new IllegalArgumentException("Scalar value must not be null");
            }
            this.value = value;
        }

        public BigDecimal getValue() {
            return value;
        }

        @Override
        public BigDecimal asScalar() {
            return value;
        }

        @Override
        public Matrix transpose() {
            return null;
        }

        @Override
        public String shape() {
            return "scalar";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Scalar && value.equals(((Scalar) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    public static final class Matrix extends Value {
        private final int rows;
        private final int cols;
        private final BigDecimal[] data;

        private Matrix(int rows, int cols, BigDecimal[] data) {
            if (rows < 0 || cols < 0) {
                throw new IllegalArgumentException("Matrix dimensions must not be negative: " + rows + "x" + cols);
            }
            if (data.length != rows * cols) {
                throw new IllegalArgumentException(String.format(
                        "Matrix (%d×%d) needs %d elements, got %d", rows, cols, rows * cols, data.length));
            }
            this.rows = rows;
            this.cols = cols;
            this.data = data.clone();
        }

        public int getRows() {
            return rows;
        }

        public int getCols() {
            return cols;
        }

        public int size() {
            return data.length;
        }

        public BigDecimal get(int index) {
            return data[index];
        }

        public BigDecimal get(int row, int col) {
            return data[row * cols + col];
        }

        /**
         * Row-major view of the elements.
         */
        public List<BigDecimal> getData() {
            return Collections.unmodifiableList(Arrays.asList(data));
        }

        @Override
        public BigDecimal asScalar() {
            if (rows == 1 && cols == 1) {
                return data[0];
            }
            return null;
        }

        @Override
        public Matrix transpose() {
            // row-major -> column-major reindexing
            BigDecimal[] transposed = new BigDecimal[data.length];
            int i = 0;
            for (int c = 0; c < cols; c++) {
                for (int r = 0; r < rows; r++) {
                    transposed[i++] = data[r * cols + c];
                }
            }
            return new Matrix(cols, rows, transposed);
        }

        @Override
        public String shape() {
            return "(" + rows + "×" + cols + ")";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Matrix)) {
                return false;
            }
            Matrix other = (Matrix) o;
            return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * rows + cols) + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(shape()).append('[');
            for (int r = 0; r < rows; r++) {
                if (r > 0) {
                    sb.append("; ");
                }
                for (int c = 0; c < cols; c++) {
                    if (c > 0) {
                        sb.append(", ");
                    }
                    sb.append(get(r, c).toPlainString());
                }
            }
            return sb.append(']').toString();
        }
    }
}
