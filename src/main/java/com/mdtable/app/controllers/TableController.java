package com.mdtable.app.controllers;

import com.mdtable.app.exceptions.InvalidTableException;
import com.mdtable.app.formula.FormulaDirective;
import com.mdtable.app.models.EvaluateRequest;
import com.mdtable.app.models.EvaluationResult;
import com.mdtable.app.models.Table;
import com.mdtable.app.models.TableRequest;
import com.mdtable.app.models.ValueView;
import com.mdtable.app.services.TableService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for markdown tables and their formulas.
 * "/tables" is the base path.
 */
@RestController
@RequestMapping("/tables")
public class TableController {

    @Autowired
    private TableService tableService;

    /**
     * POST /tables
     * Body: { "id", "rows", "formulas"?, "directive"? }.
     * Registers (or replaces) a table, returns { "id": ... }.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> registerTable(@RequestBody TableRequest request) {
        List<String> formulas = new ArrayList<>();
        if (request.getFormulas() != null) {
            formulas.addAll(request.getFormulas());
        }
        String id = request.getId();

        // A directive may carry both the id and more formulas
        if (request.getDirective() != null) {
            FormulaDirective directive = FormulaDirective.parse(request.getDirective());
            formulas.addAll(directive.getFormulas());
            if (id == null) {
                id = directive.getId();
            }
        }
        if (id == null) {
            throw new InvalidTableException("Table id is required, either as \"id\" or in the directive");
        }

        Table table = tableService.registerTable(id, request.getRows(), formulas);
        return ResponseEntity.ok(Collections.singletonMap("id", table.getId()));
    }

    /**
     * GET /tables
     * Returns the registered table ids, sorted.
     */
    @GetMapping
    public ResponseEntity<Set<String>> getTableIds() {
        return ResponseEntity.ok(tableService.getTableIds());
    }

    /**
     * GET /tables/{id}
     * Returns the table's id, current rows and formulas.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Table> getTable(@PathVariable String id) {
        return ResponseEntity.ok(tableService.getTableSnapshot(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTable(@PathVariable String id) {
        tableService.deleteTable(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /tables/{id}/evaluate
     * Runs the table's formulas and returns the updated rows with one result per formula.
     * Failed formulas are reported in the results, the response is still 200.
     */
    @PostMapping("/{id}/evaluate")
    public ResponseEntity<EvaluationResult> evaluateTable(@PathVariable String id) {
        return ResponseEntity.ok(tableService.evaluateTable(id));
    }

    /**
     * POST /tables/{id}/expression
     * Body: a bare expression, e.g. "sum(A_) / count(A_)".
     * Returns its value; an invalid expression gives a 400 with the error kind as code.
     */
    @PostMapping("/{id}/expression")
    public ResponseEntity<ValueView> evaluateExpression(@PathVariable String id, @RequestBody String expression) {
        return ResponseEntity.ok(tableService.evaluateExpression(id, expression));
    }

    /**
     * POST /tables/evaluate
     * Body: { "rows", "formulas", "tables"? }. Nothing is registered or stored.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResult> evaluate(@RequestBody EvaluateRequest request) {
        return ResponseEntity.ok(tableService.evaluate(request.getRows(), request.getFormulas(), request.getTables()));
    }
}
