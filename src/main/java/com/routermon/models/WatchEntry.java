package com.routermon.models;

import java.time.Instant;

/**
 * A netwatch entry as read from /tool/netwatch/print.
 * since and interval are null when the device omits them or they cannot be parsed.
 */
public class WatchEntry
{

    public String host;

    public String name;

    public String comment;

    public WatchStatus status = WatchStatus.UNKNOWN;

    public boolean disabled;

    public Instant since;

    public Integer intervalSeconds;

}
