package com.mdtable.app.exceptions;

/**
 * Error body written by {@link GlobalExceptionHandler}. The code is TABLE_NOT_FOUND,
 * INVALID_TABLE or SERVER_ERROR, or the {@link FormulaErrorKind} name when a formula
 * fails (DIVISION_BY_ZERO, UNMATCHED_PARENTHESIS, ...). For example:
 * {
 *   "code": "DIVISION_BY_ZERO",
 *   "message": "division by zero in scalar operation: 4 / 0"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
