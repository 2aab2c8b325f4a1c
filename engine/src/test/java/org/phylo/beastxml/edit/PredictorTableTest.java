package org.phylo.beastxml.edit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictorTableTest {

    @Test
    void parsesHeaderAndRows() {
        var table = PredictorTable.parse("""
                "state", "population"
                UK,67.0

                "FR",68.1
                """);

        assertEquals(List.of("population"), table.columns());
        assertEquals(List.of("UK", "FR"), table.rows());
        assertEquals(68.1, table.value("FR", "population"));
        assertTrue(table.isScalar());
        assertFalse(table.isMatrix());
    }

    @Test
    void matrixColumnsAreRows() {
        var table = PredictorTable.parse("""
                ,UK,FR
                FR,1,0
                UK,0,2
                """);

        assertTrue(table.isMatrix());
        assertFalse(table.isScalar());
        assertEquals(2.0, table.value("UK", "FR"));
    }

    @Test
    void raggedRowIsRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> PredictorTable.parse("state,x\nUK,1,2\n"));
        assertTrue(e.getMessage().contains("Row 1"), e.getMessage());
    }

    @Test
    void nonNumericValueIsRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> PredictorTable.parse("state,x\nUK,many\n"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void headerOnlyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PredictorTable.parse("state,x\n"));
    }

    @Test
    void unknownCell() {
        var table = PredictorTable.parse("state,x\nUK,1\n");
        assertThrows(IllegalArgumentException.class, () -> table.value("FR", "x"));
    }
}
