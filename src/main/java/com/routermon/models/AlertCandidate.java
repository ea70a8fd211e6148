package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * An alert the monitoring components would like to raise.
 * AlertEmitter decides whether it is persisted and dispatched.
 */
public class AlertCandidate
{

    public String deviceId;

    public String deviceName;

    public AlertType type;

    public String target;                // dedup target, e.g. watched host or device address

    public String targetName;

    public String state;                 // settled state that triggered the alert

    public AlertSeverity severity;

    public String title;

    public String message;

    public AlertCandidate(Device device, AlertType type, String target, String state)
    {
        this.deviceId = device.deviceId;

        this.deviceName = device.name;

        this.type = type;

        this.target = target;

        this.targetName = target;

        this.state = state;
    }

    public AlertCandidate severity(AlertSeverity severity)
    {
        this.severity = severity;

        return this;
    }

    public AlertCandidate targetName(String targetName)
    {
        if (targetName != null && !targetName.isBlank())
        {
            this.targetName = targetName;
        }

        return this;
    }

    public AlertCandidate text(String title, String message)
    {
        this.title = title;

        this.message = message;

        return this;
    }

    /**
     * @return alertCreate payload
     */
    public JsonObject toJson()
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("type", type.value())
            .put("target", target)
            .put("state", state)
            .put("severity", severity.value())
            .put("title", title)
            .put("message", message);
    }

    /**
     * @param timestamp ISO-8601 creation time
     * @return payload handed to the notification dispatcher
     */
    public JsonObject toNotificationJson(String timestamp)
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("device_name", deviceName)
            .put("target_host", target)
            .put("target_name", targetName)
            .put("type", type.value())
            .put("severity", severity.value())
            .put("message", message)
            .put("timestamp", timestamp);
    }

}
