package com.mdtable.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one registered markdown table:
 * - A unique id, chosen by the client
 * - The grid: header row, separator row, then data rows (cells as text)
 * - The formulas attached to it, in execution order
 * - A read/write lock for concurrency
 */
public class Table {

    private final String id;
    private final List<List<String>> rows;
    private final List<String> formulas;

    // Evaluation writes into rows, so writers take the write lock
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Table(String id, List<List<String>> rows, List<String> formulas) {
        this.id = id;
        this.rows = copyRows(rows);
        this.formulas = new ArrayList<>(formulas);
    }

    public String getId() {
        return id;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public List<String> getFormulas() {
        return formulas;
    }

    /**
     * Deep copy of the grid; callers must hold at least the read lock.
     */
    public List<List<String>> snapshotRows() {
        return copyRows(rows);
    }

    @JsonIgnore
    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    /**
     * Copies a grid into mutable lists so it can be written to.
     */
    public static List<List<String>> copyRows(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }
}
