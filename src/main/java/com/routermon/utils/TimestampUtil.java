package com.routermon.utils;

import java.time.Instant;

import java.time.OffsetDateTime;

import java.time.ZoneOffset;

import java.time.format.DateTimeParseException;

/**
 * Conversions between Instant, TIMESTAMPTZ values and the ISO-8601 strings carried in JSON.
 */
public class TimestampUtil
{

    public static String format(Instant instant)
    {
        return instant != null ? instant.toString() : null;
    }

    public static String format(OffsetDateTime dateTime)
    {
        return dateTime != null ? dateTime.toInstant().toString() : null;
    }

    public static OffsetDateTime toOffset(Instant instant)
    {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    public static OffsetDateTime toOffset(String iso)
    {
        return toOffset(parse(iso));
    }

    /**
     * Parses an ISO-8601 instant or offset date-time.
     *
     * @param iso timestamp string, may be null
     * @return Instant, or null when absent or unparseable
     */
    public static Instant parse(String iso)
    {
        if (iso == null || iso.isBlank())
        {
            return null;
        }

        try
        {
            return Instant.parse(iso);
        }
        catch (DateTimeParseException ignored)
        {
            // not in instant form, try with an explicit offset
        }

        try
        {
            return OffsetDateTime.parse(iso).toInstant();
        }
        catch (DateTimeParseException exception)
        {
            return null;
        }
    }

}
