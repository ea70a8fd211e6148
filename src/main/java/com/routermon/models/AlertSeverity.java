package com.routermon.models;

public enum AlertSeverity
{

    INFO("info"),

    WARNING("warning"),

    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value)
    {
        this.value = value;
    }

    public String value()
    {
        return value;
    }

}
