package com.mdtable.app.exceptions;

/**
 * Thrown for a malformed table registration or evaluation request,
 * e.g. a missing id or a grid without its header and separator rows.
 */
public class InvalidTableException extends RuntimeException {
    public InvalidTableException(String message) {
        super(message);
    }
}
