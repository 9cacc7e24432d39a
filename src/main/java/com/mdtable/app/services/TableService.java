package com.mdtable.app.services;

import com.mdtable.app.exceptions.InvalidTableException;
import com.mdtable.app.exceptions.TableNotFoundException;
import com.mdtable.app.formula.FormulaDirective;
import com.mdtable.app.formula.FormulaEngine;
import com.mdtable.app.models.EvaluationResult;
import com.mdtable.app.models.FormulaResult;
import com.mdtable.app.models.Table;
import com.mdtable.app.models.Value;
import com.mdtable.app.models.ValueView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for registering tables and running their formulas.
 * Tables can reach each other through from("id"), so evaluation reads
 * a snapshot of every other registered table.
 */
@Service
public class TableService {

    private static final Logger log = LoggerFactory.getLogger(TableService.class);

    // Header row and separator row come before the data
    private static final int MIN_ROWS = 2;

    // All tables live here in memory; nothing is persisted
    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    private final FormulaEngine engine;

    public TableService(FormulaEngine engine) {
        this.engine = engine;
    }

    /**
     * Registers a table under the given id, replacing any table with the same id.
     */
    public Table registerTable(String id, List<List<String>> rows, List<String> formulas) {
        if (id == null || id.isBlank()) {
            throw new InvalidTableException("Table id is required");
        }
        validateRows(rows);
        Table table = new Table(id, rows, formulas == null ? Collections.emptyList() : formulas);
        Table previous = tables.put(id, table);
        log.info("{} table '{}' with {} rows and {} formulas", previous == null ? "Registered" : "Replaced",
                id, rows.size(), table.getFormulas().size());
        return table;
    }

    /**
     * Registers a table whose id and formulas come from a directive comment,
     * e.g. {@code <!-- md-table: id="sales"; C1 = A1 + B1 -->}.
     */
    public Table registerDirective(List<List<String>> rows, String directive) {
        FormulaDirective parsed = FormulaDirective.parse(directive);
        if (parsed.getId() == null) {
            throw new InvalidTableException("Directive has no id=\"...\" segment: " + directive);
        }
        return registerTable(parsed.getId(), rows, parsed.getFormulas());
    }

    /**
     * Retrieves a Table by id. Throws if not found.
     */
    public Table getTable(String id) {
        Table table = tables.get(id);
        if (table == null) {
            throw new TableNotFoundException("Table not found: " + id);
        }
        return table;
    }

    /**
     * A detached copy of a table, taken under its read lock so it never shows a
     * half-applied evaluation.
     */
    public Table getTableSnapshot(String id) {
        Table table = getTable(id);
        table.getLock().readLock().lock();
        try {
            return new Table(table.getId(), table.getRows(), table.getFormulas());
        } finally {
            table.getLock().readLock().unlock();
        }
    }

    public Set<String> getTableIds() {
        return new TreeSet<>(tables.keySet());
    }

    public void deleteTable(String id) {
        if (tables.remove(id) == null) {
            throw new TableNotFoundException("Table not found: " + id);
        }
        log.info("Deleted table '{}'", id);
    }

    /**
     * Runs a registered table's formulas against its own grid, in place:
     * 1) Snapshot every other table under its read lock.
     * 2) Take this table's write lock and apply the formulas.
     * 3) Return a copy of the resulting grid with the per-formula results.
     */
    public EvaluationResult evaluateTable(String id) {
        Table table = getTable(id);

        // 1) Other tables, one lock at a time, so no two locks are ever held together
        Map<String, List<List<String>>> others = snapshotTables(id);

        // 2) Prevent concurrent evaluations of the same table
        table.getLock().writeLock().lock();
        try {
            List<FormulaResult> results = engine.apply(table.getRows(), table.getFormulas(), others);
            long failed = results.stream().filter(r -> !r.isSuccess()).count();
            log.info("Evaluated table '{}': {} formulas, {} failed", id, results.size(), failed);

            // 3) Hand out a copy, the live grid stays behind the lock
            return new EvaluationResult(table.snapshotRows(), results);
        } finally {
            table.getLock().writeLock().unlock();
        }
    }

    /**
     * Stateless evaluation: the given grid is copied, never modified.
     */
    public EvaluationResult evaluate(List<List<String>> rows, List<String> formulas,
                                     Map<String, List<List<String>>> otherTables) {
        validateRows(rows);
        List<List<String>> grid = Table.copyRows(rows);
        Map<String, List<List<String>>> tableMap = otherTables == null ? Collections.emptyMap() : otherTables;
        List<FormulaResult> results = engine.apply(grid,
                formulas == null ? Collections.emptyList() : formulas, tableMap);
        return new EvaluationResult(grid, results);
    }

    /**
     * Evaluates one expression against a registered table without writing anything.
     * A failing expression throws its FormulaException.
     */
    public ValueView evaluateExpression(String id, String expression) {
        Table table = getTable(id);
        Map<String, List<List<String>>> others = snapshotTables(id);

        List<List<String>> rows;
        table.getLock().readLock().lock();
        try {
            rows = table.snapshotRows();
        } finally {
            table.getLock().readLock().unlock();
        }

        Value value = engine.evaluate(expression.trim(), rows, others, new HashMap<>());
        return ValueView.of(value);
    }

    private Map<String, List<List<String>>> snapshotTables(String excludedId) {
        Map<String, List<List<String>>> snapshot = new HashMap<>();
        for (Table other : new ArrayList<>(tables.values())) {
            if (other.getId().equals(excludedId)) {
                continue;
            }
            other.getLock().readLock().lock();
            try {
                snapshot.put(other.getId(), other.snapshotRows());
            } finally {
                other.getLock().readLock().unlock();
            }
        }
        return snapshot;
    }

    private static void validateRows(List<List<String>> rows) {
        if (rows == null || rows.size() < MIN_ROWS) {
            throw new InvalidTableException("A table needs at least a header row and a separator row");
        }
        for (List<String> row : rows) {
            if (row == null) {
                throw new InvalidTableException("Table rows must not be null");
            }
        }
    }
}
