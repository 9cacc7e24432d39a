package com.mdtable.app.models;

import java.util.List;

/**
 * Body of POST /tables. Formulas come either as a list or as a directive comment;
 * when both are given the directive's formulas run after the listed ones.
 * The directive's id="..." is used when "id" is missing.
 */
public class TableRequest {
    private String id;
    private List<List<String>> rows;
    private List<String> formulas;
    private String directive;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

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

    public String getDirective() {
        return directive;
    }

    public void setDirective(String directive) {
        this.directive = directive;
    }
}
