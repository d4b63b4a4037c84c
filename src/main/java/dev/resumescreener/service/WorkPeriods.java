package dev.resumescreener.service;

import java.time.Clock;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of the loose date strings found in work histories and derivation of job durations.
 * Supported forms: {@code 2021-03}, {@code 2021/03}, {@code 03/2021}, {@code 2021},
 * {@code Mar 2021}, {@code March 2021} and "present"-like markers.
 */
public final class WorkPeriods {

    private static final Set<String> PRESENT_MARKERS = Set.of("present", "current", "now", "today", "ongoing");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})(?:[-/.]\\d{1,2})?$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/.](\\d{4})$");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern NAMED_MONTH_YEAR = Pattern.compile("^([a-z]+)\\.?,?\\s+(\\d{4})$");
    private static final Map<String, Month> MONTH_NAMES = new HashMap<>();

    static {
        for (Month m : Month.values()) {
            MONTH_NAMES.put(m.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), m);
            MONTH_NAMES.put(m.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), m);
        }
        MONTH_NAMES.put("sept", Month.SEPTEMBER);
    }

    private WorkPeriods() {
    }

    /**
     * @return true for null, blank or a "present"-like marker
     */
    public static boolean isPresent(String period) {
        return period == null || period.isBlank()
                || PRESENT_MARKERS.contains(period.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Parse a period as the month a job started. A bare year means January.
     */
    public static Optional<YearMonth> parseStart(String period) {
        return parse(period, Month.JANUARY);
    }

    /**
     * Parse a period as the month a job ended. A bare year means December.
     */
    public static Optional<YearMonth> parseEnd(String period) {
        return parse(period, Month.DECEMBER);
    }

    /**
     * Inclusive month count from start to end; an ongoing job runs to the current month of {@code clock}.
     * Returns empty when the start cannot be parsed, and 0 when the end precedes the start.
     */
    public static Optional<Integer> monthsBetween(String start, String end, Clock clock) {
        Optional<YearMonth> from = parseStart(start);
        if (from.isEmpty()) {
            return Optional.empty();
        }
        Optional<YearMonth> to = isPresent(end) ? Optional.of(YearMonth.now(clock)) : parseEnd(end);
        if (to.isEmpty()) {
            return Optional.empty();
        }
        long months = ChronoUnit.MONTHS.between(from.get(), to.get()) + 1;
        return Optional.of((int) Math.max(0, months));
    }

    /**
     * Use the reported duration when present, otherwise derive it from the dates, otherwise 0.
     */
    public static int resolveDuration(Integer reportedMonths, String start, String end, Clock clock) {
        if (reportedMonths != null && reportedMonths >= 0) {
            return reportedMonths;
        }
        return monthsBetween(start, end, clock).orElse(0);
    }

    private static Optional<YearMonth> parse(String period, Month yearOnlyMonth) {
        if (period == null || period.isBlank() || isPresent(period)) {
            return Optional.empty();
        }
        String p = period.trim().toLowerCase(Locale.ROOT);

        Matcher m = YEAR_MONTH.matcher(p);
        if (m.matches()) {
            return yearMonth(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }
        m = MONTH_YEAR.matcher(p);
        if (m.matches()) {
            return yearMonth(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
        }
        m = YEAR.matcher(p);
        if (m.matches()) {
            return Optional.of(YearMonth.of(Integer.parseInt(m.group(1)), yearOnlyMonth));
        }
        m = NAMED_MONTH_YEAR.matcher(p);
        if (m.matches()) {
            Month month = MONTH_NAMES.get(m.group(1));
            return month == null ? Optional.empty() : Optional.of(YearMonth.of(Integer.parseInt(m.group(2)), month));
        }
        return Optional.empty();
    }

    private static Optional<YearMonth> yearMonth(int year, int month) {
        if (month < 1 || month > 12) {
            return Optional.empty();
        }
        return Optional.of(YearMonth.of(year, month));
    }
}
