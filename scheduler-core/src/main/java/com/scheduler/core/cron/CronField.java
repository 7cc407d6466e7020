package com.scheduler.core.cron;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;

/**
 * One parsed field of a five-field cron expression.
 *
 * Values are kept in a BitSet indexed by the calendar value (minute 0-59,
 * hour 0-23, day 1-31, month 1-12, weekday 0-6 with Sunday = 0).
 */
final class CronField {

    enum Type {
        MINUTE("minute", 0, 59, null),
        HOUR("hour", 0, 23, null),
        DAY_OF_MONTH("day-of-month", 1, 31, null),
        MONTH("month", 1, 12, List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec")),
        DAY_OF_WEEK("day-of-week", 0, 7, List.of(
            "sun", "mon", "tue", "wed", "thu", "fri", "sat"));

        private final String label;
        private final int min;
        private final int max;
        private final List<String> names;

        Type(String label, int min, int max, List<String> names) {
            this.label = label;
            this.min = min;
            this.max = max;
            this.names = names;
        }

        String label() {
            return label;
        }
    }

    private final Type type;
    private final BitSet values;
    private final boolean lastDayOfMonth;
    private final boolean restricted;

    private CronField(Type type, BitSet values, boolean lastDayOfMonth, boolean restricted) {
        this.type = type;
        this.values = values;
        this.lastDayOfMonth = lastDayOfMonth;
        this.restricted = restricted;
    }

    /**
     * Parse a single field. Only the literal {@code *} leaves the field unrestricted.
     */
    static CronField parse(String expression, String token, Type type) {
        BitSet values = new BitSet(type.max + 1);
        boolean lastDay = false;

        for (String item : token.split(",", -1)) {
            if (item.isEmpty()) {
                throw error(expression, type, "empty list item in '" + token + "'");
            }
            if (type == Type.DAY_OF_MONTH && item.equalsIgnoreCase("L")) {
                lastDay = true;
                continue;
            }
            parseItem(expression, item, type, values);
        }

        if (type == Type.DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }
        return new CronField(type, values, lastDay, !token.equals("*"));
    }

    boolean matches(int value) {
        return values.get(value);
    }

    /**
     * Smallest selected value >= from, or -1.
     */
    int nextValue(int from) {
        return values.nextSetBit(from);
    }

    boolean isRestricted() {
        return restricted;
    }

    boolean hasLastDayOfMonth() {
        return lastDayOfMonth;
    }

    BitSet values() {
        return (BitSet) values.clone();
    }

    Type type() {
        return type;
    }

    // ========== Helper Methods ==========

    private static void parseItem(String expression, String item, Type type, BitSet values) {
        String rangePart = item;
        int step = 1;
        boolean hasStep = false;

        int slash = item.indexOf('/');
        if (slash >= 0) {
            rangePart = item.substring(0, slash);
            String stepPart = item.substring(slash + 1);
            if (rangePart.isEmpty() || stepPart.isEmpty() || stepPart.indexOf('/') >= 0) {
                throw error(expression, type, "malformed step '" + item + "'");
            }
            step = parseNumber(expression, type, stepPart);
            if (step == 0) {
                throw error(expression, type, "step must be positive in '" + item + "'");
            }
            hasStep = true;
        }

        int start;
        int end;
        if (rangePart.equals("*")) {
            start = type.min;
            end = type == Type.DAY_OF_WEEK ? 6 : type.max;
        } else if (rangePart.startsWith("-")) {
            throw error(expression, type, "negative value in '" + item + "'");
        } else if (rangePart.indexOf('-') >= 0) {
            String[] bounds = rangePart.split("-", -1);
            if (bounds.length != 2 || bounds[0].isEmpty() || bounds[1].isEmpty()) {
                throw error(expression, type, "incomplete range '" + item + "'");
            }
            start = parseValue(expression, type, bounds[0]);
            end = parseValue(expression, type, bounds[1]);
        } else {
            start = parseValue(expression, type, rangePart);
            // "a/c" runs from a to the end of the field
            end = hasStep ? (type == Type.DAY_OF_WEEK ? 6 : type.max) : start;
        }

        if (start <= end) {
            for (int v = start; v <= end; v += step) {
                values.set(v);
            }
            return;
        }

        if (type != Type.DAY_OF_WEEK) {
            throw error(expression, type, "descending range '" + item + "'");
        }
        // Weekday ranges wrap through Saturday, e.g. fri-mon
        int span = (end + 7 - start) % 7;
        for (int offset = 0; offset <= span; offset += step) {
            values.set((start + offset) % 7);
        }
    }

    private static int parseValue(String expression, Type type, String text) {
        if (type.names != null) {
            int index = type.names.indexOf(text.toLowerCase(Locale.ROOT));
            if (index >= 0) {
                return type == Type.MONTH ? index + 1 : index;
            }
        }
        int value = parseNumber(expression, type, text);
        if (value < type.min || value > type.max) {
            throw error(expression, type,
                String.format("value %d out of range [%d, %d]", value, type.min, type.max));
        }
        return value;
    }

    private static int parseNumber(String expression, Type type, String text) {
        if (text.startsWith("-")) {
            throw error(expression, type, "negative value '" + text + "'");
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                throw error(expression, type, "unrecognized value '" + text + "'");
            }
        }
        if (text.length() > 4) {
            throw error(expression, type, "value '" + text + "' out of range");
        }
        return Integer.parseInt(text);
    }

    private static CronParseException error(String expression, Type type, String reason) {
        return new CronParseException(expression, type.label + " field: " + reason);
    }
}
