package com.mdtable.app.models;

import java.util.List;
import java.util.Map;

/**
 * Body of POST /tables/evaluate: a grid, its formulas and, optionally,
 * other tables by id for from().
 */
public class EvaluateRequest {
    private List<List<String>> rows;
    private List<String> formulas;
    private Map<String, List<List<String>>> tables;

    public List<List<String>> getRows() {
        return rows;
    }

    public void setRows(List<List<String>> rows) {
        this.rows = rows;
    }

    public List<String> getFormulas() {
        return formulas;
    }

    public void setFormulas(List<String> formulas) {
        this.formulas = formulas;
    }

    public Map<String, List<List<String>>> getTables() {
        return tables;
    }

    public void setTables(Map<String, List<List<String>>> tables) {
        this.tables = tables;
    }
}
