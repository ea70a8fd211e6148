package com.routermon.utils;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.DateTimeException;

import java.time.Instant;

import java.time.LocalDateTime;

import java.time.OffsetDateTime;

import java.time.ZoneId;

import java.time.format.DateTimeFormatter;

import java.time.format.DateTimeParseException;

import java.util.Map;

import java.util.regex.Pattern;

/**
 * Parses timestamps reported by devices, which carry no zone.

 * Supported forms:
 * - "jan/15/2024 10:20:30" and "jan/15 10:20:30" (year defaults to the current year)
 * - "2024-01-15 10:20:30" (RouterOS 7)
 * - ISO-8601 with or without offset
 *
 * Zone-less values are interpreted in the configured device time zone.
 */
public class DeviceTimeParser
{

    private static final Logger logger = LoggerFactory.getLogger(DeviceTimeParser.class);

    private static final Pattern MONTH_FORM = Pattern.compile(
        "(\\w+)/(\\d+)(?:/(\\d+))?\\s+(\\d+):(\\d+):(\\d+)");

    private static final DateTimeFormatter SPACED_FORM = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3),
        Map.entry("apr", 4), Map.entry("may", 5), Map.entry("jun", 6),
        Map.entry("jul", 7), Map.entry("aug", 8), Map.entry("sep", 9),
        Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private final ZoneId zone;

    private final Clock clock;

    public DeviceTimeParser(ZoneId zone, Clock clock)
    {
        this.zone = zone;

        this.clock = clock;
    }

    /**
     * @param raw timestamp string from the device
     * @return Instant, or null when absent or unparseable
     */
    public Instant parse(String raw)
    {
        if (raw == null || raw.isBlank())
        {
            return null;
        }

        var value = raw.trim();

        var monthForm = MONTH_FORM.matcher(value);

        if (monthForm.matches())
        {
            var parsed = fromMonthForm(monthForm.group(1), monthForm.group(2), monthForm.group(3),
                monthForm.group(4), monthForm.group(5), monthForm.group(6));

            if (parsed != null)
            {
                return parsed;
            }
        }

        return fromGenericForm(value);
    }

    private Instant fromMonthForm(String monthName, String day, String year,
                                  String hour, String minute, String second)
    {
        var month = MONTHS.get(monthName.toLowerCase().substring(0, Math.min(3, monthName.length())));

        if (month == null)
        {
            return null;
        }

        try
        {
            var resolvedYear = year != null ? Integer.parseInt(year) : LocalDateTime.now(clock.withZone(zone)).getYear();

            return LocalDateTime.of(resolvedYear, month, Integer.parseInt(day),
                    Integer.parseInt(hour), Integer.parseInt(minute), Integer.parseInt(second))
                .atZone(zone)
                .toInstant();
        }
        catch (DateTimeException | NumberFormatException exception)
        {
            logger.debug("Invalid device timestamp components: {}", exception.getMessage());

            return null;
        }
    }

    private Instant fromGenericForm(String value)
    {
        try
        {
            return OffsetDateTime.parse(value).toInstant();
        }
        catch (DateTimeParseException ignored)
        {
            // zone-less forms below
        }

        try
        {
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        }
        catch (DateTimeParseException ignored)
        {
            // space separated form below
        }

        try
        {
            return LocalDateTime.parse(value, SPACED_FORM).atZone(zone).toInstant();
        }
        catch (DateTimeParseException exception)
        {
            logger.debug("Unparseable device timestamp '{}'", value);

            return null;
        }
    }

}
