package com.mdtable.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mdtable.app.exceptions.FormulaErrorKind;

/**
 * Outcome of one formula in a batch. A failed formula never stops the batch;
 * it only carries its error here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormulaResult {
    private final String formula;
    private final String error;
    private final FormulaErrorKind kind;

    private FormulaResult(String formula, String error, FormulaErrorKind kind) {
        this.formula = formula;
        this.error = error;
        this.kind = kind;
    }

    public static FormulaResult success(String formula) {
        return new FormulaResult(formula, null, null);
    }

    public static FormulaResult failure(String formula, FormulaErrorKind kind, String error) {
        return new FormulaResult(formula, error, kind);
    }

    public String getFormula() {
        return formula;
    }

    public boolean isSuccess() {
        return error == null;
    }

    // Null on success
    public String getError() {
        return error;
    }

    public FormulaErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return isSuccess() ? formula + ": ok" : formula + ": " + error;
    }
}
