package org.phylo.beastxml.bind;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Conversion of calendar dates to the decimal years BEAST uses for tip dates.
 */
public final class DecimalYear {

    private DecimalYear() {
        // Static utility class
    }

    /**
     * e.g. 2020-07-02 becomes 2020.5 (183 of 366 days elapsed)
     */
    public static double of(LocalDate date) {
        return date.getYear() + (date.getDayOfYear() - 1) / (double) date.lengthOfYear();
    }

    /**
     * Accepts either a decimal year ({@code 2019.25}) or an ISO date ({@code 2019-04-02}).
     *
     * @throws IllegalArgumentException if the text is neither
     */
    public static double parse(String text) {
        String value = text.trim();
        if (value.indexOf('-', 1) > 0) {
            try {
                return of(LocalDate.parse(value));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid date '" + text + "', expected YYYY-MM-DD", e);
            }
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid date '" + text + "', expected a decimal year or YYYY-MM-DD", e);
        }
    }
}
