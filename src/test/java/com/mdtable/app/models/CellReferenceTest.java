package com.mdtable.app.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellReferenceTest {

    @Test
    void testRowConversions() {
        // Formula row 1 is the first data row, right after header and separator
        assertEquals(2, CellReference.toGridRow(1));
        assertEquals(1, CellReference.toFormulaRow(2));
        assertEquals("C", CellReference.columnLetter(2));
    }

    @Test
    void testToText() {
        assertEquals("B3", CellReference.scalar(CellReference.toGridRow(3), 1).toText());
        assertEquals("C_", CellReference.columnVector(2).toText());
        assertEquals("_4", CellReference.rowVector(4).toText());
        assertEquals("A_:C_", CellReference.columnRange(2, 0).toText());
        assertEquals("_1:_5", CellReference.rowRange(5, 1).toText());
    }

    @Test
    void testBetweenRequiresSameShape() {
        CellReference a1 = CellReference.scalar(2, 0);
        CellReference c5 = CellReference.scalar(6, 2);

        CellReference range = CellReference.between(c5, a1);
        assertEquals(CellReference.Kind.RANGE, range.getKind());
        assertEquals(2, range.getStartRow());
        assertEquals(0, range.getStartCol());
        assertEquals(6, range.getEndRow());
        assertEquals(2, range.getEndCol());

        assertNull(CellReference.between(a1, CellReference.columnVector(1)));
        assertNull(CellReference.between(range, range));
    }
}
