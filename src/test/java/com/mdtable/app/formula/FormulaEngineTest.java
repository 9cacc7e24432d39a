package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.models.FormulaResult;
import com.mdtable.app.models.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for running formula batches against a grid,
 * using the engine directly (no Spring context).
 */
class FormulaEngineTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
    }

    /**
     * Grid with header A, B, C and the given data rows.
     */
    private static List<List<String>> grid(String... dataRows) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(Arrays.asList("A", "B", "C")));
        rows.add(new ArrayList<>(Arrays.asList("---", "---", "---")));
        for (String row : dataRows) {
            rows.add(new ArrayList<>(Arrays.asList(row.split("\\|", -1))));
        }
        return rows;
    }

    private static List<String> column(List<List<String>> rows, int col) {
        List<String> values = new ArrayList<>();
        for (int r = 2; r < rows.size(); r++) {
            values.add(rows.get(r).get(col));
        }
        return values;
    }

    @Test
    void testDotProductOfTwoColumns() {
        List<List<String>> rows = grid("1|2|", "3|4|", "5|6|");

        List<FormulaResult> results = engine.apply(rows, Collections.singletonList("C1 = A_.T @ B_"));

        assertTrue(results.get(0).isSuccess());
        // 1*2 + 3*4 + 5*6
        assertEquals("44", rows.get(2).get(2));
    }

    @Test
    void testSumAndAverage() {
        List<List<String>> rows = grid("10||", "20||", "30||");

        engine.apply(rows, Collections.singletonList("B1 = sum(A_)"));
        assertEquals("60", rows.get(2).get(1));

        engine.apply(rows, Collections.singletonList("B1 = avg(A_)"));
        assertEquals("20", rows.get(2).get(1));
    }

    @Test
    void testColumnAssignment() {
        List<List<String>> rows = grid("1|2|", "4|5|", "7|8|");

        engine.apply(rows, Collections.singletonList("C_ = A_ + B_"));

        assertEquals(Arrays.asList("3", "9", "15"), column(rows, 2));
    }

    @Test
    void testFailedFormulaLeavesGridAndLaterFormulasRun() {
        List<List<String>> rows = grid("10|old|", "20||");

        List<FormulaResult> results = engine.apply(rows, Arrays.asList("B1 = A1 / 0", "B2 = A2 * 2"));

        FormulaResult failed = results.get(0);
        assertFalse(failed.isSuccess());
        assertEquals(FormulaErrorKind.DIVISION_BY_ZERO, failed.getKind());
        assertTrue(failed.getError().startsWith("Failed to evaluate expression:"), failed.getError());
        assertTrue(failed.getError().contains("A1 / 0\n^^^^^^"), failed.getError());
        assertEquals("old", rows.get(2).get(1));

        assertTrue(results.get(1).isSuccess());
        assertEquals("40", rows.get(3).get(1));
    }

    @Test
    void testLetBindsVariablesForLaterFormulas() {
        List<List<String>> rows = grid("1|2|", "3|4|");

        List<FormulaResult> results = engine.apply(rows, Arrays.asList(
                "let x = A1",
                "let A1 = 5",
                "let scale = sum(B_)",
                "C_ = A_ * scale + x"));

        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals(FormulaErrorKind.INVALID_VARIABLE_NAME, results.get(1).getKind());
        assertTrue(results.get(1).getError().startsWith("Failed to parse statement 'let A1 = 5'"));
        assertTrue(results.get(3).isSuccess());
        // A1 keeps its value, let never writes to the grid
        assertEquals("1", rows.get(2).get(0));
        assertEquals(Arrays.asList("7", "19"), column(rows, 2));
    }

    @Test
    void testVariablesDoNotLeakBetweenBatches() {
        List<List<String>> rows = grid("1|2|");
        engine.apply(rows, Collections.singletonList("let x = 5"));

        List<FormulaResult> results = engine.apply(rows, Collections.singletonList("C1 = x"));

        assertEquals(FormulaErrorKind.UNDEFINED_VARIABLE, results.get(0).getKind());
    }

    @Test
    void testFailedLetReportsVariable() {
        List<FormulaResult> results = engine.apply(grid("1|2|"), Collections.singletonList("let y = A9"));

        assertEquals(FormulaErrorKind.CELL_OUT_OF_BOUNDS, results.get(0).getKind());
        assertTrue(results.get(0).getError().startsWith("Failed to evaluate expression for variable 'y'"));
    }

    @Test
    void testReapplyingIsIdempotent() {
        List<String> formulas = Arrays.asList("C_ = A_ + B_", "C1 = sum(C_)");
        List<List<String>> once = grid("1|2|", "4|5|", "7|8|");
        engine.apply(once, formulas);
        List<List<String>> twice = Table.copyRows(once);

        engine.apply(twice, formulas);

        assertEquals(once, twice);
    }

    @Test
    void testRangeAndRowAssignments() {
        List<List<String>> rows = grid("1|2|3", "4|5|6", "7|8|9");

        List<FormulaResult> results = engine.apply(rows, Arrays.asList(
                "A1:B2 = A2:B3 * 10",
                "_3 = (_3.T).T - 1",
                "B_:C_ = A_:B_"));

        results.forEach(r -> assertTrue(r.isSuccess(), r.toString()));
        assertEquals(Arrays.asList("40", "70", "6"), column(rows, 0));
        assertEquals(Arrays.asList("40", "70", "6"), column(rows, 1));
        assertEquals(Arrays.asList("50", "80", "7"), column(rows, 2));
    }

    @Test
    void testAssignmentShapeMismatches() {
        List<List<String>> rows = grid("1|2|3", "4|5|6");
        List<List<String>> before = Table.copyRows(rows);

        List<FormulaResult> results = engine.apply(rows, Arrays.asList(
                "C1 = A_",
                "C_ = 5",
                "C_ = _1",
                "_1 = A_",
                "A1:B2 = A_",
                "A_:B_ = A_",
                "_1:_2 = _1",
                "D1 = 5",
                "Z_ = A_",
                "_5 = _1"));

        for (FormulaResult result : results) {
            assertFalse(result.isSuccess(), result.getFormula());
            assertEquals(FormulaErrorKind.INVALID_ASSIGNMENT, result.getKind(), result.getFormula());
            assertTrue(result.getError().startsWith("Assignment failed for '"), result.getError());
        }
        assertEquals(before, rows);
    }

    @Test
    void testOneByOneMatrixFitsSingleCell() {
        List<List<String>> rows = grid("1|2|", "3|4|");

        engine.apply(rows, Collections.singletonList("C2 = A_.T @ B_"));

        assertEquals("14", rows.get(3).get(2));
    }

    @Test
    void testParseErrorsAreReported() {
        List<FormulaResult> results = engine.apply(grid("1|2|"),
                Arrays.asList("C1 = (A1 + B1", "C1 = ", "sum(A_)"));

        assertEquals(FormulaErrorKind.UNMATCHED_PARENTHESIS, results.get(0).getKind());
        assertEquals(FormulaErrorKind.EMPTY_EXPRESSION, results.get(1).getKind());
        assertEquals(FormulaErrorKind.INVALID_STATEMENT, results.get(2).getKind());
    }

    @Test
    void testCrossTableReference() {
        Map<String, List<List<String>>> tables = new HashMap<>();
        tables.put("rates", grid("0.2||"));
        List<List<String>> rows = grid("100|0|", "250|0|");

        engine.apply(rows, Collections.singletonList("B_ = A_ * from(\"rates\", A1)"), tables);

        assertEquals(Arrays.asList("20.0", "50.0"), column(rows, 1));
    }

    @Test
    void testMathContextIsConfigurable() {
        FormulaEngine coarse = new FormulaEngine(new MathContext(4, RoundingMode.HALF_UP));
        List<List<String>> rows = grid("2|3|");

        coarse.apply(rows, Collections.singletonList("C1 = A1 / B1"));

        assertEquals("0.6667", rows.get(2).get(2));
    }

    @Test
    void testExponentNotationCellReadsAsZero() {
        List<List<String>> rows = grid("1e999999999||", "1e3||");

        List<FormulaResult> results = engine.apply(rows, Arrays.asList("B1 = A1 + 1", "B2 = A2"));

        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isSuccess());
        assertEquals(Arrays.asList("1", "0"), column(rows, 1));
        // Source cells are left as written
        assertEquals("1e999999999", rows.get(2).get(0));
    }
}
