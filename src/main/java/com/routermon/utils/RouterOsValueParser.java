package com.routermon.utils;

import java.util.regex.Pattern;

/**
 * Parsers for the string values RouterOS returns in command replies.

 * Handles:
 * - ping durations: "10ms", "956us", "1s", "12ms340us", bare "23"
 * - durations: "1w2d3h4m5s", "00:01:30", "1d02:03:04", bare seconds
 * - "true"/"yes" flags, integer and decimal fields
 */
public class RouterOsValueParser
{

    private static final Pattern LATENCY_TOKEN = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|us|s)");

    private static final Pattern PLAIN_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    private static final Pattern DURATION = Pattern.compile(
        "^(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m(?!s))?(?:(\\d+)s)?(?:(\\d+)ms)?$");

    private static final Pattern CLOCK_DURATION = Pattern.compile(
        "^(?:(\\d+)w)?(?:(\\d+)d)?(\\d{1,3}):(\\d{2}):(\\d{2})$");

    public static final int DEFAULT_INTERVAL_SECONDS = 10;

    /**
     * Converts a ping duration to whole milliseconds.

     * Rules:
     * - "us" → floor(us / 1000), never below 1
     * - "s" (not "ms") → seconds × 1000
     * - "ms" → rounded milliseconds
     * - compound "XmsYus" → X + floor(Y / 1000)
     * - bare number → milliseconds
     *
     * @param raw value from the reply, may be null
     * @return milliseconds, or null when absent or unparseable
     */
    public static Integer parseLatencyMs(String raw)
    {
        if (raw == null)
        {
            return null;
        }

        var value = raw.trim().toLowerCase().replace("µs", "us");

        if (value.isEmpty())
        {
            return null;
        }

        if (PLAIN_NUMBER.matcher(value).matches())
        {
            return (int) Math.round(Double.parseDouble(value));
        }

        var matcher = LATENCY_TOKEN.matcher(value);

        var milliseconds = 0.0;

        var microseconds = 0.0;

        var consumed = 0;

        while (matcher.find())
        {
            if (matcher.start() != consumed)
            {
                return null;
            }

            var amount = Double.parseDouble(matcher.group(1));

            var unit = matcher.group(2);

            if (unit.equals("us"))
            {
                microseconds += amount;
            }
            else if (unit.equals("ms"))
            {
                milliseconds += amount;
            }
            else
            {
                milliseconds += amount * 1000;
            }

            consumed = matcher.end();
        }

        if (consumed == 0 || consumed != value.length())
        {
            return null;
        }

        var result = Math.round(milliseconds) + (long) Math.floor(microseconds / 1000);

        if (result == 0 && microseconds > 0)
        {
            return 1;
        }

        return (int) result;
    }

    /**
     * Converts a RouterOS duration to seconds.
     *
     * @param raw duration string, may be null
     * @return seconds, or null when absent or unparseable
     */
    public static Long parseDurationSeconds(String raw)
    {
        if (raw == null || raw.isBlank())
        {
            return null;
        }

        var value = raw.trim().toLowerCase();

        if (value.chars().allMatch(Character::isDigit))
        {
            return Long.parseLong(value);
        }

        var clock = CLOCK_DURATION.matcher(value);

        if (clock.matches())
        {
            return group(clock.group(1)) * 604800
                + group(clock.group(2)) * 86400
                + group(clock.group(3)) * 3600
                + group(clock.group(4)) * 60
                + group(clock.group(5));
        }

        var duration = DURATION.matcher(value);

        if (duration.matches())
        {
            var total = group(duration.group(1)) * 604800
                + group(duration.group(2)) * 86400
                + group(duration.group(3)) * 3600
                + group(duration.group(4)) * 60
                + group(duration.group(5));

            var millis = group(duration.group(6));

            // a sub-second interval still counts as one second
            if (total == 0 && millis > 0)
            {
                return 1L;
            }

            return total;
        }

        return null;
    }

    /**
     * Netwatch interval in seconds.
     *
     * @param raw interval from the device
     * @return null when absent, DEFAULT_INTERVAL_SECONDS when unparseable
     */
    public static Integer parseIntervalSeconds(String raw)
    {
        if (raw == null || raw.isBlank())
        {
            return null;
        }

        var seconds = parseDurationSeconds(raw);

        if (seconds == null || seconds <= 0)
        {
            return DEFAULT_INTERVAL_SECONDS;
        }

        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }

    public static boolean parseBoolean(String raw)
    {
        if (raw == null)
        {
            return false;
        }

        var value = raw.trim();

        return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes");
    }

    public static long parseLong(String raw, long defaultValue)
    {
        if (raw == null || raw.isBlank())
        {
            return defaultValue;
        }

        try
        {
            return Long.parseLong(raw.trim());
        }
        catch (NumberFormatException exception)
        {
            var decimal = parseDouble(raw);

            return decimal != null ? Math.round(decimal) : defaultValue;
        }
    }

    public static int parseInt(String raw, int defaultValue)
    {
        return (int) parseLong(raw, defaultValue);
    }

    /**
     * Parses a decimal, tolerating a trailing unit such as "C" or "V".
     *
     * @param raw value from the reply
     * @return parsed value or null
     */
    public static Double parseDouble(String raw)
    {
        if (raw == null || raw.isBlank())
        {
            return null;
        }

        var value = raw.trim().replaceAll("[^0-9.+-]+$", "");

        try
        {
            return Double.parseDouble(value);
        }
        catch (NumberFormatException exception)
        {
            return null;
        }
    }

    private static long group(String value)
    {
        return value != null ? Long.parseLong(value) : 0;
    }

}
