package com.dbmaster.scheduler;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Five-field CRON matcher: minute (0-59), hour (0-23), day of month (1-31), month (1-12) and
 * day of week (0-6, Sunday is 0). Each field accepts {@code *}, a single value, a range
 * {@code a-b}, a step {@code *}{@code /n} or {@code a/n}, or a comma list of those. All five fields
 * must match.
 */
public final class CronMatcher {

    private static final String[] FIELD_NAMES = {"minute", "hour", "day of month", "month", "day of week"};
    private static final int[] MIN = {0, 0, 1, 1, 0};
    private static final int[] MAX = {59, 23, 31, 12, 6};
    private static final long MAX_SEARCH_MINUTES = 366L * 24 * 60;

    private CronMatcher() {
    }

    /**
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static boolean matches(String expression, LocalDateTime dateTime) {
        return parse(expression).matches(dateTime);
    }

    /**
     * Checks the expression without evaluating it.
     *
     * @throws IllegalArgumentException with a message naming the offending field
     */
    public static void validate(String expression) {
        parse(expression);
    }

    /**
     * First minute strictly after {@code from} matching the expression, searched up to one year ahead.
     *
     * @return the match, or null if none within a year (for example {@code 0 0 31 2 *})
     */
    public static LocalDateTime nextMatch(String expression, LocalDateTime from) {
        Parsed parsed = parse(expression);
        LocalDateTime candidate = from.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        for (long i = 0; i < MAX_SEARCH_MINUTES; i++) {
            if (parsed.matches(candidate)) {
                return candidate;
            }
            candidate = candidate.plusMinutes(1);
        }
        return null;
    }

    static Parsed parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("CRON expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException("CRON expression must have 5 fields, got " + parts.length + ": " + expression);
        }
        List<List<Term>> fields = new ArrayList<>(5);
        for (int i = 0; i < 5; i++) {
            fields.add(parseField(parts[i], i));
        }
        return new Parsed(fields);
    }

    private static List<Term> parseField(String field, int index) {
        List<Term> terms = new ArrayList<>();
        for (String item : field.split(",", -1)) {
            terms.add(parseTerm(item.trim(), index));
        }
        return terms;
    }

    private static Term parseTerm(String item, int index) {
        int min = MIN[index];
        int max = MAX[index];
        String name = FIELD_NAMES[index];
        if (item.isEmpty()) {
            throw new IllegalArgumentException("Empty value in " + name);
        }
        if ("*".equals(item)) {
            return new Term(min, max, 1);
        }
        int slash = item.indexOf('/');
        if (slash >= 0) {
            String base = item.substring(0, slash);
            int step = parseNumber(item.substring(slash + 1), name);
            if (step <= 0) {
                throw new IllegalArgumentException("Invalid step value in " + name + ": " + item);
            }
            int start = "*".equals(base) ? min : checkBounds(parseNumber(base, name), min, max, name);
            return new Term(start, max, step);
        }
        int dash = item.indexOf('-');
        if (dash >= 0) {
            int start = checkBounds(parseNumber(item.substring(0, dash), name), min, max, name);
            int end = checkBounds(parseNumber(item.substring(dash + 1), name), min, max, name);
            if (start > end) {
                throw new IllegalArgumentException("Invalid range in " + name + ": start > end");
            }
            return new Term(start, end, 1);
        }
        int value = checkBounds(parseNumber(item, name), min, max, name);
        return new Term(value, value, 1);
    }

    private static int parseNumber(String raw, String name) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Invalid value in " + name + ": " + raw);
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value in " + name + ": " + raw, e);
        }
    }

    private static int checkBounds(int value, int min, int max, String name) {
        if (value < min || value > max) {
            throw new IllegalArgumentException("Value out of range in " + name + ": " + value);
        }
        return value;
    }

    /**
     * Values {@code start, start + step, ...} up to {@code end}.
     */
    private record Term(int start, int end, int step) {
        boolean matches(int value) {
            return value >= start && value <= end && (value - start) % step == 0;
        }
    }

    static final class Parsed {
        private final List<List<Term>> fields;

        private Parsed(List<List<Term>> fields) {
            this.fields = fields;
        }

        boolean matches(LocalDateTime t) {
            int dayOfWeek = t.getDayOfWeek().getValue() % 7;
            return fieldMatches(0, t.getMinute())
                    && fieldMatches(1, t.getHour())
                    && fieldMatches(2, t.getDayOfMonth())
                    && fieldMatches(3, t.getMonthValue())
                    && fieldMatches(4, dayOfWeek);
        }

        private boolean fieldMatches(int index, int value) {
            for (Term term : fields.get(index)) {
                if (term.matches(value)) {
                    return true;
                }
            }
            return false;
        }
    }
}
