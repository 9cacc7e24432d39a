package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.Span;
import com.mdtable.app.models.Statement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementParserTest {

    private static FormulaErrorKind errorKind(String formula) {
        return assertThrows(FormulaException.class, () -> StatementParser.parse(formula)).getKind();
    }

    @Test
    void testLet() {
        Statement statement = StatementParser.parse("  let total = sum(A_) * 2 ");
        assertTrue(statement.isLet());
        assertEquals("total", statement.getName());
        assertEquals("sum(A_) * 2", statement.getExpression());
        // Offsets into the trimmed formula
        assertEquals(new Span(4, 9), statement.getSpan());
        assertNull(StatementParser.parse("C1 = 1").getSpan());
    }

    @Test
    void testAssignmentTargets() {
        Statement cell = StatementParser.parse("C1 = A1 + B1");
        assertFalse(cell.isLet());
        assertEquals(CellReference.Kind.SCALAR, cell.getAssignment().getKind());
        assertEquals("C1", cell.getAssignment().toString());
        assertEquals("A1 + B1", cell.getExpression());

        assertEquals(CellReference.Kind.COLUMN_VECTOR, StatementParser.parse("d_ = A_").getAssignment().getKind());
        assertEquals(CellReference.Kind.ROW_VECTOR, StatementParser.parse("_2 = _1").getAssignment().getKind());
        assertEquals(CellReference.Kind.RANGE, StatementParser.parse("A1:B2 = 0").getAssignment().getKind());
        assertEquals(CellReference.Kind.COLUMN_RANGE, StatementParser.parse("A_:B_ = 0").getAssignment().getKind());
        assertEquals(CellReference.Kind.ROW_RANGE, StatementParser.parse("_1:_2 = 0").getAssignment().getKind());
    }

    @Test
    void testOnlyFirstEqualsSplits() {
        Statement statement = StatementParser.parse("let x = 1 = 2");
        assertEquals("1 = 2", statement.getExpression());
    }

    @Test
    void testVariableNamesThatLookLikeReferencesAreRejected() {
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let A1 = 5"));
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let b_ = 5"));
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let _3 = 5"));
    }

    @Test
    void testInvalidVariableNames() {
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let = 5"));
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let 1x = 5"));
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, errorKind("let my var = 5"));
    }

    @Test
    void testInvalidStatements() {
        assertEquals(FormulaErrorKind.INVALID_STATEMENT, errorKind("let x 5"));
        assertEquals(FormulaErrorKind.INVALID_STATEMENT, errorKind("sum(A_)"));
        assertEquals(FormulaErrorKind.INVALID_STATEMENT, errorKind("total = 5"));
        assertEquals(FormulaErrorKind.INVALID_STATEMENT, errorKind("A_:_1 = 5"));
    }
}
