package com.aadhaar.verifier.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Calendar-validated date of birth, independent of the textual form it was read from.
 */
public record CanonicalDate(int year, int month, int day) {

    public static final int MIN_YEAR = 1900;

    public CanonicalDate {
        if (year < MIN_YEAR) {
            throw new IllegalArgumentException("Year " + year + " is before " + MIN_YEAR);
        }
        try {
            LocalDate.of(year, month, day);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException(
                    "Not a calendar date: " + year + "-" + month + "-" + day, ex);
        }
    }

    public static CanonicalDate of(LocalDate date) {
        return new CanonicalDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    /**
     * @return the date as {@code dd-MM-yyyy}, the form printed in verification summaries
     */
    public String format() {
        return String.format(Locale.ROOT, "%02d-%02d-%04d", day, month, year);
    }

    @Override
    public String toString() {
        return format();
    }
}
