package com.mdtable.app.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A formula directive comment placed under a markdown table, e.g.
 * <pre>
 * &lt;!-- md-table: id="sales"; C1 = A1 + B1; let x = sum(A_) --&gt;
 * </pre>
 * Segments are separated by ';'. An {@code id="..."} segment names the table,
 * every other non-blank segment is a formula.
 */
public final class FormulaDirective {

    private static final String COMMENT_START = "<!--";
    private static final String COMMENT_END = "-->";
    private static final String PREFIX = "md-table:";
    private static final Pattern ID_SEGMENT = Pattern.compile("^id\\s*=\\s*\"([^\"]*)\"$");

    private final String id;
    private final List<String> formulas;

    private FormulaDirective(String id, List<String> formulas) {
        this.id = id;
        this.formulas = Collections.unmodifiableList(formulas);
    }

    public static FormulaDirective parse(String directive) {
        String content = directive.trim();
        if (content.startsWith(COMMENT_START)) {
            content = content.substring(COMMENT_START.length());
        }
        if (content.endsWith(COMMENT_END)) {
            content = content.substring(0, content.length() - COMMENT_END.length());
        }
        content = content.trim();
        if (content.startsWith(PREFIX)) {
            content = content.substring(PREFIX.length()).trim();
        }

        String id = null;
        List<String> formulas = new ArrayList<>();
        for (String segment : content.split(";")) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher m = ID_SEGMENT.matcher(trimmed);
            if (m.matches()) {
                id = m.group(1);
            } else {
                formulas.add(trimmed);
            }
        }
        return new FormulaDirective(id, formulas);
    }

    // Null when the directive has no id="..." segment
    public String getId() {
        return id;
    }

    public List<String> getFormulas() {
        return formulas;
    }
}
