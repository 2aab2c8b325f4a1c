package org.phylo.beastxml.bind;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DecimalYearTest {

    @Test
    void midYearOfLeapYear() {
        assertEquals(2020.5, DecimalYear.of(LocalDate.of(2020, 7, 2)), 1e-12);
    }

    @Test
    void firstDayIsWholeYear() {
        assertEquals(2019.0, DecimalYear.parse("2019-01-01"), 1e-12);
    }

    @Test
    void decimalYearsPassThrough() {
        assertEquals(2019.25, DecimalYear.parse(" 2019.25 "), 1e-12);
    }

    @Test
    void invalidDatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DecimalYear.parse("2019-13-01"));
        assertThrows(IllegalArgumentException.class, () -> DecimalYear.parse("spring"));
    }
}
