package com.mdtable.app.exceptions;

/**
 * Every way a formula can fail. Kinds are grouped into categories so callers
 * can tell syntax problems from evaluation problems.
 */
public enum FormulaErrorKind {
    // Parse / syntax
    UNEXPECTED_TOKEN(Category.PARSE),
    UNMATCHED_PARENTHESIS(Category.PARSE),
    INVALID_TOKEN(Category.PARSE),
    EMPTY_EXPRESSION(Category.PARSE),
    INVALID_RANGE(Category.PARSE),
    INVALID_STATEMENT(Category.PARSE),
    INVALID_VARIABLE_NAME(Category.PARSE),

    // References
    CELL_OUT_OF_BOUNDS(Category.REFERENCE),
    COLUMN_OUT_OF_BOUNDS(Category.REFERENCE),
    ROW_OUT_OF_BOUNDS(Category.REFERENCE),
    RANGE_OUT_OF_BOUNDS(Category.REFERENCE),
    TABLE_NOT_FOUND(Category.REFERENCE),

    // Shapes
    DIMENSION_MISMATCH(Category.SHAPE),
    MATMUL_DIMENSION_MISMATCH(Category.SHAPE),
    SCALAR_MATMUL(Category.SHAPE),
    TRANSPOSE_SCALAR(Category.SHAPE),

    // Arithmetic
    DIVISION_BY_ZERO(Category.ARITHMETIC),

    // Semantics
    UNKNOWN_FUNCTION(Category.SEMANTIC),
    UNDEFINED_VARIABLE(Category.SEMANTIC),
    FUNCTION_ARGUMENT(Category.SEMANTIC),
    INVALID_ASSIGNMENT(Category.SEMANTIC),
    RUNTIME(Category.SEMANTIC);

    public enum Category {
        PARSE,
        REFERENCE,
        SHAPE,
        ARITHMETIC,
        SEMANTIC
    }

    private final Category category;

    FormulaErrorKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
