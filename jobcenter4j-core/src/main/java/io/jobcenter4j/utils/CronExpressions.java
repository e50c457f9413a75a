package io.jobcenter4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.ZoneId;
import java.util.TimeZone;

/**
 * Cron parsing on top of Quartz {@link CronExpression}.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>5 fields (minute hour day-of-month month day-of-week): seconds default to {@code 0}</li>
 *   <li>6 fields: seconds first</li>
 *   <li>7 fields: seconds first, year last</li>
 * </ul>
 * Day-of-week values follow Quartz numbering (1 = Sunday) or names ({@code MON-FRI}).
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    /**
     * Normalize to Quartz syntax. Quartz requires exactly one of day-of-month / day-of-week to be {@code ?};
     * a {@code *} in one of them is rewritten to {@code ?}.
     */
    public static String normalize(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
        }
        if (parts.length == 7) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
        }
        throw new IllegalArgumentException("cron expression must have 5, 6 or 7 fields: " + spec);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month,
                                       String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }

        String cron = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? cron : cron + " " + year;
    }

    public static boolean isValid(String spec) {
        try {
            return CronExpression.isValidExpression(normalize(spec));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException when the expression cannot be parsed
     */
    public static CronExpression parse(String spec, ZoneId zone) {
        String cron = normalize(spec);
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec + " (" + ex.getMessage() + ")", ex);
        }
    }
}
