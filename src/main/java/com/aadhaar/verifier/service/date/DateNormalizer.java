package com.aadhaar.verifier.service.date;

import com.aadhaar.verifier.exception.DateParseException;
import com.aadhaar.verifier.model.CanonicalDate;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses the date representations found on identity documents and in reference records into a
 * {@link CanonicalDate}. Forms are tried in a fixed order: day-first numeric, year-first numeric,
 * then textual month names. Month names are matched against a fixed English table so the result
 * never depends on the default locale.
 */
@Component
public class DateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DateNormalizer.class);

    private static final List<String> MONTHS = List.of(
            "JANUARY", "FEBRUARY", "MARCH", "APRIL", "MAY", "JUNE",
            "JULY", "AUGUST", "SEPTEMBER", "OCTOBER", "NOVEMBER", "DECEMBER");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s:;,.\\-]+|[\\s:;,.\\-]+$");

    private static final List<DateForm> FORMS = List.of(
            new DateForm("day-first",
                    Pattern.compile("^(\\d{1,2}) ?[/\\-. ] ?(\\d{1,2}) ?[/\\-. ] ?(\\d{4})$"), 3, 2, 1, false),
            new DateForm("year-first",
                    Pattern.compile("^(\\d{4})[/\\-.](\\d{1,2})[/\\-.](\\d{1,2})$"), 1, 2, 3, false),
            new DateForm("day-month-name-year",
                    Pattern.compile("^(\\d{1,2})(?:st|nd|rd|th)?[ \\-/.,]+([A-Za-z]{3,9})\\.?[ \\-/.,]+(\\d{4})$",
                            Pattern.CASE_INSENSITIVE), 3, 2, 1, true),
            new DateForm("month-name-day-year",
                    Pattern.compile("^([A-Za-z]{3,9})\\.?[ \\-/]+(\\d{1,2})(?:st|nd|rd|th)?,? ?(\\d{4})$",
                            Pattern.CASE_INSENSITIVE), 3, 1, 2, true));

    private final Clock clock;

    public DateNormalizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param rawDate date text from the document or the reference record
     * @return the calendar date it denotes
     * @throws DateParseException if no supported form matches, the date does not exist, or its
     *                            year lies outside 1900 to the current year
     */
    public CanonicalDate normalize(String rawDate) {
        if (rawDate == null || rawDate.isBlank()) {
            throw new DateParseException(rawDate, "Date is empty");
        }
        String cleaned = EDGE_PUNCTUATION.matcher(WHITESPACE.matcher(rawDate.trim()).replaceAll(" "))
                .replaceAll("");
        int currentYear = Year.now(clock).getValue();

        String failure = "Unsupported date format: " + rawDate;
        for (DateForm form : FORMS) {
            Matcher matcher = form.pattern().matcher(cleaned);
            if (!matcher.matches()) {
                continue;
            }
            OptionalInt month = form.textualMonth()
                    ? monthFromName(matcher.group(form.monthGroup()))
                    : OptionalInt.of(Integer.parseInt(matcher.group(form.monthGroup())));
            if (month.isEmpty()) {
                failure = "Unknown month name in date: " + rawDate;
                continue;
            }
            int year = Integer.parseInt(matcher.group(form.yearGroup()));
            int day = Integer.parseInt(matcher.group(form.dayGroup()));
            LocalDate date;
            try {
                date = LocalDate.of(year, month.getAsInt(), day);
            } catch (DateTimeException ex) {
                failure = "Not a calendar date: " + rawDate;
                continue;
            }
            if (year < CanonicalDate.MIN_YEAR || year > currentYear) {
                failure = "Year " + year + " outside " + CanonicalDate.MIN_YEAR + "-" + currentYear + ": " + rawDate;
                continue;
            }
            log.trace("Parsed {} as {} using the {} form", rawDate, date, form.name());
            return CanonicalDate.of(date);
        }
        throw new DateParseException(rawDate, failure);
    }

    /**
     * Variant of {@link #normalize(String)} for callers that treat an unparseable date as absent.
     */
    public Optional<CanonicalDate> tryNormalize(String rawDate) {
        try {
            return Optional.of(normalize(rawDate));
        } catch (DateParseException ex) {
            log.debug("Date rejected: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private static OptionalInt monthFromName(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (int i = 0; i < MONTHS.size(); i++) {
            if (MONTHS.get(i).startsWith(upper)) {
                return OptionalInt.of(i + 1);
            }
        }
        return OptionalInt.empty();
    }

    private record DateForm(String name, Pattern pattern, int yearGroup, int monthGroup, int dayGroup,
            boolean textualMonth) {
    }
}
