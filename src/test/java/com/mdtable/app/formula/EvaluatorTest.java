package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.Span;
import com.mdtable.app.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluates parsed expressions against a fixed 3x3 table:
 * A = [1,4,7], B = [2,5,8], C = [3,6,9].
 */
class EvaluatorTest {

    private Evaluator evaluator;
    private List<List<String>> rows;
    private Map<String, List<List<String>>> tables;
    private Map<String, Value> variables;

    @BeforeEach
    void setUp() {
        evaluator = new Evaluator(new MathContext(28, RoundingMode.HALF_EVEN));
        rows = grid(new String[]{"1", "2", "3"}, new String[]{"4", "5", "6"}, new String[]{"7", "8", "9"});
        tables = new HashMap<>();
        tables.put("rates", grid(new String[]{"0.5", "10"}, new String[]{"0.25", "20"}));
        variables = new HashMap<>();
    }

    private static List<List<String>> grid(String[]... data) {
        List<List<String>> g = new ArrayList<>();
        int width = data[0].length;
        List<String> header = new ArrayList<>();
        List<String> separator = new ArrayList<>();
        for (int c = 0; c < width; c++) {
            header.add(String.valueOf((char) ('A' + c)));
            separator.add("---");
        }
        g.add(header);
        g.add(separator);
        for (String[] row : data) {
            g.add(new ArrayList<>(Arrays.asList(row)));
        }
        return g;
    }

    private Value eval(String expression) {
        return evaluator.evaluate(Parser.parse(expression), rows, tables, variables);
    }

    private BigDecimal scalar(String expression) {
        Value value = eval(expression);
        assertTrue(value.isScalar(), expression + " should be a scalar but was " + value.shape());
        return value.asScalar();
    }

    private FormulaException failure(String expression) {
        return assertThrows(FormulaException.class, () -> eval(expression));
    }

    private static Value.Matrix matrix(int r, int c, String... values) {
        return Value.matrix(r, c, Arrays.stream(values).map(BigDecimal::new).toArray(BigDecimal[]::new));
    }

    private static void assertNumber(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but got " + actual);
    }

    @Test
    void testScalarArithmetic() {
        assertNumber("7", scalar("1 + 2 * 3"));
        assertNumber("-4", scalar("A1 - B2"));
        assertNumber("1024", scalar("2 ^ 10"));
        assertNumber("512", scalar("2 ^ 3 ^ 2"));
        assertNumber("0.25", scalar("1 / 4"));
        assertNumber("0.5", scalar("2 ^ (0 - 1)"));
        assertNumber("2", scalar("4 ^ 0.5"));
    }

    @Test
    void testDivisionUsesMathContext() {
        assertEquals("0.3333333333333333333333333333", scalar("1 / 3").toPlainString());
        assertEquals("20", scalar("60 / 3").toPlainString());
    }

    @Test
    void testElementWiseAndBroadcasting() {
        assertEquals(matrix(3, 1, "3", "9", "15"), eval("A_ + B_"));
        assertEquals(matrix(3, 1, "2", "8", "14"), eval("A_ * 2"));
        assertEquals(matrix(1, 3, "0", "1", "2"), eval("_1 - 1"));
    }

    @Test
    void testBroadcastingCommutes() {
        assertEquals(eval("A_:C_ + 10"), eval("10 + A_:C_"));
        assertEquals(eval("A_ * B2"), eval("B2 * A_"));
    }

    @Test
    void testMatrixMultiply() {
        // 1*2 + 4*5 + 7*8
        assertEquals(matrix(1, 1, "78"), eval("A_.T @ B_"));

        Value outer = eval("A_ @ B_.T");
        assertTrue(outer.isMatrix());
        assertEquals("(3×3)", outer.shape());

        // (m×n) @ (n×p) is (m×p)
        assertEquals("(2×3)", eval("A1:C2 @ A_:C_").shape());
    }

    @Test
    void testTransposeIsAnInvolution() {
        assertEquals(eval("A1:C2"), eval("(A1:C2.T).T"));
        assertEquals(eval("_2"), eval("(_2.T).T"));
    }

    @Test
    void testShapeErrors() {
        assertEquals(FormulaErrorKind.DIMENSION_MISMATCH, failure("A_ + _1").getKind());
        assertEquals(FormulaErrorKind.MATMUL_DIMENSION_MISMATCH, failure("A_ @ B_").getKind());
        assertEquals(FormulaErrorKind.SCALAR_MATMUL, failure("2 @ A_").getKind());
        assertEquals(FormulaErrorKind.SCALAR_MATMUL, failure("A1 @ B1").getKind());
        assertEquals(FormulaErrorKind.TRANSPOSE_SCALAR, failure("A1.T").getKind());
    }

    @Test
    void testDivisionByZeroPointsAtOperation() {
        FormulaException e = failure("B1 + A1 / 0");
        assertEquals(FormulaErrorKind.DIVISION_BY_ZERO, e.getKind());
        assertEquals(new Span(5, 11), e.getSpan());
        assertTrue(e.getMessage().contains("1 / 0"), e.getMessage());

        assertEquals(FormulaErrorKind.DIVISION_BY_ZERO, failure("A_ / (B1 - 2)").getKind());
        assertEquals(FormulaErrorKind.DIVISION_BY_ZERO, failure("0 ^ (0 - 1)").getKind());
    }

    @Test
    void testNonFinitePowerIsRuntimeError() {
        assertEquals(FormulaErrorKind.RUNTIME, failure("(0 - 8) ^ 0.5").getKind());
    }

    @Test
    void testAggregates() {
        assertNumber("12", scalar("sum(A_)"));
        assertNumber("4", scalar("avg(A_)"));
        assertNumber("1", scalar("min(A_)"));
        assertNumber("9", scalar("max(A_:C_)"));
        assertNumber("9", scalar("count(A1:C3)"));
        assertNumber("28", scalar("prod(A_)"));
        assertNumber("45", scalar("SUM(A_:C_)"));
        // Scalars pass through, count of a scalar is 1
        assertNumber("5", scalar("sum(5)"));
        assertNumber("1", scalar("count(5)"));
    }

    @Test
    void testFunctionErrors() {
        assertEquals(FormulaErrorKind.UNKNOWN_FUNCTION, failure("median(A_)").getKind());
        assertEquals(FormulaErrorKind.FUNCTION_ARGUMENT, failure("sum(A_, B_)").getKind());
        assertEquals(FormulaErrorKind.RUNTIME, failure("\"text\"").getKind());
    }

    @Test
    void testVariables() {
        variables.put("rate", Value.scalar(new BigDecimal("2")));
        assertEquals(matrix(3, 1, "2", "8", "14"), eval("A_ * rate"));

        FormulaException e = failure("A1 + missing");
        assertEquals(FormulaErrorKind.UNDEFINED_VARIABLE, e.getKind());
        assertEquals(new Span(5, 12), e.getSpan());
    }

    @Test
    void testFromTable() {
        assertEquals(matrix(2, 2, "0.5", "10", "0.25", "20"), eval("from(\"rates\")"));
        assertNumber("30", scalar("sum(from(\"rates\", B_))"));
        assertNumber("0.25", scalar("from('rates', A2)"));
        assertEquals(matrix(3, 1, "0.5", "2.0", "3.5"), eval("A_ * from(\"rates\", A1)"));

        FormulaException missing = failure("from(\"nope\")");
        assertEquals(FormulaErrorKind.TABLE_NOT_FOUND, missing.getKind());

        // Ranges resolve against the other table, not the current one
        assertEquals(FormulaErrorKind.CELL_OUT_OF_BOUNDS, failure("from(\"rates\", A3)").getKind());
    }

    @Test
    void testFromVariable() {
        variables.put("m", matrix(2, 2, "1", "2", "3", "4"));
        variables.put("s", Value.scalar(BigDecimal.ONE));

        assertEquals(variables.get("m"), eval("from(m)"));
        assertNumber("3", scalar("from(m, A2)"));
        assertEquals(matrix(2, 1, "2", "4"), eval("from(m, B_)"));
        assertEquals(FormulaErrorKind.FUNCTION_ARGUMENT, failure("from(s)").getKind());
        assertEquals(FormulaErrorKind.FUNCTION_ARGUMENT, failure("from(1)").getKind());
        assertEquals(FormulaErrorKind.FUNCTION_ARGUMENT, failure("from(m, 2)").getKind());
    }

    @Test
    void testHugeIntegerExponentIsRejectedQuickly() {
        // 1. 3 ^ 900000000 is far past the magnitude bound
        FormulaException e = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> failure("C1 ^ 900000000"));
        assertEquals(FormulaErrorKind.RUNTIME, e.getKind());

        // 2. Tiny results are bounded the same way
        e = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> failure("B1 ^ (0 - 900000000)"));
        assertEquals(FormulaErrorKind.RUNTIME, e.getKind());

        // 3. Bases of magnitude one and zero need no work
        assertNumber("1", assertTimeoutPreemptively(Duration.ofSeconds(5), () -> scalar("A1 ^ 900000000")));
        assertNumber("-1", scalar("(0 - A1) ^ 900000001"));
        assertNumber("0", scalar("0 ^ 900000000"));
        assertEquals(FormulaErrorKind.DIVISION_BY_ZERO, failure("0 ^ (0 - 900000000)").getKind());
    }

    @Test
    void testLongIntegerPowersAreRounded() {
        MathContext mc = new MathContext(28, RoundingMode.HALF_EVEN);

        BigDecimal big = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> scalar("B1 ^ 20000"));
        assertEquals(new BigDecimal(2).pow(20000, mc), big);
        assertTrue(big.precision() <= 28);

        // Short powers stay exact
        assertEquals(new BigDecimal(2).pow(100), scalar("B1 ^ 100"));
    }
}
