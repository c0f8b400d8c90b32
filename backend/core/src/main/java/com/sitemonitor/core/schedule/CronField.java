package com.sitemonitor.core.schedule;

import java.util.BitSet;
import java.util.Locale;
import java.util.Map;

/**
 * One field of a five-field cron expression: the set of values it admits within its bounds.
 * Accepts {@code *}, single values, {@code a-b} ranges, {@code /n} steps on either and
 * comma-separated lists of those. Names (JAN, MON, ...) are accepted where aliases are given.
 */
final class CronField {
    private final String name;
    private final String text;
    private final int min;
    private final int max;
    private final BitSet allowed;

    private CronField(String name, String text, int min, int max, BitSet allowed) {
        this.name = name;
        this.text = text;
        this.min = min;
        this.max = max;
        this.allowed = allowed;
    }

    static CronField parse(String name, String text, int min, int max, Map<String, Integer> aliases) {
        BitSet allowed = new BitSet(max + 1);
        for (String item : text.split(",", -1)) {
            if (item.isEmpty()) {
                throw new IllegalArgumentException(name + " has an empty list element");
            }
            parseItem(name, item, min, max, aliases, allowed);
        }
        return new CronField(name, text, min, max, allowed);
    }

    private static void parseItem(String name, String item, int min, int max, Map<String, Integer> aliases, BitSet allowed) {
        String range = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = parseNumber(name, item.substring(slash + 1), Integer.MAX_VALUE);
            if (step <= 0) {
                throw new IllegalArgumentException(name + " step must be positive: " + item);
            }
            if (step > max - min + 1) {
                throw new IllegalArgumentException(name + " step is larger than " + min + "-" + max + ": " + item);
            }
        }

        int low;
        int high;
        if (range.equals("*")) {
            low = min;
            high = max;
        } else {
            int dash = range.indexOf('-');
            if (dash > 0) {
                low = value(name, range.substring(0, dash), aliases);
                high = value(name, range.substring(dash + 1), aliases);
            } else {
                low = value(name, range, aliases);
                high = slash >= 0 ? max : low;
            }
        }

        if (low < min || high > max) {
            throw new IllegalArgumentException(name + " value out of range " + min + "-" + max + ": " + item);
        }
        if (low > high) {
            throw new IllegalArgumentException(name + " range is reversed: " + item);
        }
        for (int v = low; v <= high; v += step) {
            allowed.set(v);
        }
    }

    private static int value(String name, String token, Map<String, Integer> aliases) {
        Integer alias = aliases.get(token.toUpperCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }
        return parseNumber(name, token, Integer.MAX_VALUE);
    }

    private static int parseNumber(String name, String token, int ceiling) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException(name + " is not a number: '" + token + "'");
        }
        try {
            int parsed = Integer.parseInt(token);
            return Math.min(parsed, ceiling);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: '" + token + "'", e);
        }
    }

    /**
     * Folds {@code from} into {@code to}; used to treat day-of-week 7 as Sunday (0).
     */
    CronField alias(int from, int to) {
        if (!allowed.get(from)) {
            return this;
        }
        BitSet folded = (BitSet) allowed.clone();
        folded.clear(from);
        folded.set(to);
        return new CronField(name, text, min, max, folded);
    }

    boolean matches(int value) {
        return allowed.get(value);
    }

    /**
     * False for fields written as {@code *} or {@code *}{@code /n}; day-of-month and day-of-week
     * are OR-ed only when both are restricted.
     */
    boolean restricted() {
        return !text.startsWith("*");
    }

    String text() {
        return text;
    }

    @Override
    public String toString() {
        return name + "=" + text;
    }
}
