package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.Assignment;
import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.Span;
import com.mdtable.app.models.Statement;

/**
 * Splits one formula into its statement and right-hand side expression:
 * - "let NAME = EXPR" binds a variable
 * - "TARGET = EXPR" writes to a cell, vector or range
 */
public final class StatementParser {

    private static final String LET = "let ";
    private static final String EXPECTED_FORMAT =
            "expected format: 'let VAR = EXPRESSION' or 'TARGET = EXPRESSION'";

    private StatementParser() {
    }

    public static Statement parse(String formula) {
        String text = formula.trim();

        if (text.startsWith(LET)) {
            String rest = text.substring(LET.length());
            int eq = rest.indexOf('=');
            if (eq < 0) {
                throw new FormulaException(FormulaErrorKind.INVALID_STATEMENT,
                        "missing '=' in variable definition (" + EXPECTED_FORMAT + ")");
            }
            String name = rest.substring(0, eq).trim();
            validateVariableName(name);
            int nameStart = LET.length() + rest.indexOf(name);
            return Statement.let(name, new Span(nameStart, nameStart + name.length()),
                    rest.substring(eq + 1).trim());
        }

        int eq = text.indexOf('=');
        if (eq < 0) {
            throw new FormulaException(FormulaErrorKind.INVALID_STATEMENT,
                    "missing '=' (" + EXPECTED_FORMAT + ")");
        }
        String target = text.substring(0, eq).trim();
        CellReference ref = References.parseWithRange(target);
        if (ref == null) {
            throw new FormulaException(FormulaErrorKind.INVALID_STATEMENT, "invalid assignment target '" + target
                    + "' (expected A1, A_, _1, A1:C3, A_:C_ or _1:_3)");
        }
        return Statement.assignment(new Assignment(ref), text.substring(eq + 1).trim());
    }

    /**
     * A variable name must be an identifier and must not read as a cell reference,
     * otherwise "let A1 = 5" would be ambiguous with a cell write.
     */
    static void validateVariableName(String name) {
        if (name.isEmpty()) {
            throw new FormulaException(FormulaErrorKind.INVALID_VARIABLE_NAME, "variable name is empty");
        }
        if (References.parse(name) != null) {
            throw new FormulaException(FormulaErrorKind.INVALID_VARIABLE_NAME,
                    "variable name '" + name + "' looks like a cell reference");
        }
        if (!Parser.isValidName(name)) {
            throw new FormulaException(FormulaErrorKind.INVALID_VARIABLE_NAME,
                    "variable name '" + name + "' must start with a letter or '_' and contain only letters, digits and '_'");
        }
    }
}
