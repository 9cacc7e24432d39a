package com.mdtable.app.models;

import java.util.List;

/**
 * Grid after a formula batch, plus one result per formula.
 */
public class EvaluationResult {
    private final List<List<String>> rows;
    private final List<FormulaResult> results;

    public EvaluationResult(List<List<String>> rows, List<FormulaResult> results) {
        this.rows = rows;
        this.results = results;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public List<FormulaResult> getResults() {
        return results;
    }

    public boolean isAllSucceeded() {
        return results.stream().allMatch(FormulaResult::isSuccess);
    }
}
