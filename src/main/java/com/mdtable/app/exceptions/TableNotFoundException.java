package com.mdtable.app.exceptions;

/**
 * Thrown when a table id is not in the registry.
 */
public class TableNotFoundException extends RuntimeException {
    public TableNotFoundException(String message) {
        super(message);
    }
}
