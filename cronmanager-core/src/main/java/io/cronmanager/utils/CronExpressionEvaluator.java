package io.cronmanager.utils;

import io.cronmanager.core.InvalidMaskException;
import org.quartz.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Evaluates cron masks.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Five fields: {@code minute hour day-of-month month day-of-week}</li>
 *   <li>Six fields: the five above followed by {@code year}</li>
 * </ul>
 * <p>
 * Day-of-week uses cron numbering (0-7, Sunday is 0 or 7) or names (MON..SUN).
 * Masks are normalized to Quartz syntax before evaluation. The time zone is applied to the
 * parsed expression only; the JVM default zone is never read or changed.
 */
public final class CronExpressionEvaluator {
    private CronExpressionEvaluator() {
    }

    /**
     * Returns the fire time of {@code mask} that follows {@code reference}.
     *
     * @param mask             cron mask (5 or 6 fields)
     * @param reference        instant to compute from; the result is strictly after it
     * @param occurrenceOffset 0 for the first fire time after {@code reference}, 1 for the one after that, ...
     * @param zone             zone the mask's calendar fields are interpreted in
     * @throws InvalidMaskException if the mask is malformed or has no further fire time
     */
    public static Instant nextFireTime(String mask, Instant reference, int occurrenceOffset, ZoneId zone) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (occurrenceOffset < 0) {
            throw new IllegalArgumentException("occurrenceOffset must not be negative: " + occurrenceOffset);
        }

        CronExpression exp = parse(mask, zone);

        Date cursor = Date.from(reference);
        for (int i = 0; i <= occurrenceOffset; i++) {
            Date next = exp.getNextValidTimeAfter(cursor);
            if (next == null) {
                throw new InvalidMaskException(mask, "Cron expression produced no next execution time: " + mask);
            }
            cursor = next;
        }
        return cursor.toInstant();
    }

    /**
     * Returns true if the mask can be parsed.
     */
    public static boolean isValid(String mask) {
        try {
            parse(mask, ZoneId.of("UTC"));
            return true;
        } catch (InvalidMaskException e) {
            return false;
        }
    }

    static CronExpression parse(String mask, ZoneId zone) {
        String quartz = toQuartzCron(mask);
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (Exception ex) {
            throw new InvalidMaskException(mask, "Invalid cron expression: " + mask, ex);
        }
    }

    /**
     * Normalize a cron mask to a Quartz expression:
     * - prepends a seconds field of "0"
     * - translates day-of-week numbers to Quartz numbering (SUN=1)
     * - puts "?" into whichever day field is unrestricted
     * - keeps an optional trailing year field
     */
    public static String toQuartzCron(String mask) {
        if (mask == null) {
            throw new InvalidMaskException(null, "mask must not be null");
        }
        String s = mask.trim();
        if (s.isEmpty()) {
            throw new InvalidMaskException(mask, "mask must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length != 5 && parts.length != 6) {
            throw new InvalidMaskException(mask,
                    "Expected 5 or 6 fields (minute hour day-of-month month day-of-week [year]) but got "
                            + parts.length + ": " + mask);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dom = parts[2];
        String month = parts[3];
        String dow = translateDayOfWeek(mask, parts[4]);

        boolean anyDom = isWildcard(dom);
        boolean anyDow = isWildcard(dow);
        if (anyDow) {
            dom = anyDom ? "*" : dom;
            dow = "?";
        } else if (anyDom) {
            dom = "?";
        } else {
            throw new InvalidMaskException(mask,
                    "Restricting both day-of-month and day-of-week is not supported: " + mask);
        }

        StringBuilder quartz = new StringBuilder()
                .append("0 ").append(minute)
                .append(' ').append(hour)
                .append(' ').append(dom)
                .append(' ').append(month)
                .append(' ').append(dow);
        if (parts.length == 6) {
            quartz.append(' ').append(parts[5]);
        }
        return quartz.toString();
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String translateDayOfWeek(String mask, String field) {
        if (isWildcard(field)) {
            return field;
        }

        String[] items = field.split(",", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String base = slash >= 0 ? item.substring(0, slash) : item;
            String step = slash >= 0 ? item.substring(slash) : "";

            out.append(translateDayRange(mask, base)).append(step);
        }
        return out.toString();
    }

    private static String translateDayRange(String mask, String base) {
        if ("*".equals(base)) {
            return base;
        }
        int dash = base.indexOf('-');
        if (dash > 0) {
            String start = base.substring(0, dash);
            String end = base.substring(dash + 1);
            // 0-7 is the whole week, not SUN-SUN
            if ("0".equals(start) && "7".equals(end)) {
                return "1-7";
            }
            return translateDay(mask, start) + "-" + translateDay(mask, end);
        }
        int hash = base.indexOf('#');
        if (hash > 0) {
            return translateDay(mask, base.substring(0, hash)) + base.substring(hash);
        }
        if (base.length() > 1 && (base.endsWith("L") || base.endsWith("l"))) {
            return translateDay(mask, base.substring(0, base.length() - 1)) + "L";
        }
        return translateDay(mask, base);
    }

    private static String translateDay(String mask, String token) {
        if (token.isEmpty()) {
            throw new InvalidMaskException(mask, "Empty day-of-week value in: " + mask);
        }
        if (!Character.isDigit(token.charAt(0))) {
            // names (MON, tue, ...) are validated by Quartz
            return token;
        }
        int day;
        try {
            day = Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw new InvalidMaskException(mask, "Invalid day-of-week value '" + token + "' in: " + mask, ex);
        }
        if (day < 0 || day > 7) {
            throw new InvalidMaskException(mask, "Day-of-week must be between 0 and 7 but was " + day + ": " + mask);
        }
        return String.valueOf(day % 7 + 1);
    }
}
