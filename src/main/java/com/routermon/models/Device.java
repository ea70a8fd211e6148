package com.routermon.models;

import com.routermon.core.DeviceCredentials;

import com.routermon.utils.PasswordUtil;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Snapshot of a device record taken at the start of a refresh cycle.

 * Data Sources:
 * - Database: devices table (owned by the external device registry)
 * - Runtime: outcome of the current refresh cycle

 * The engine never writes the record back wholesale; status, last_seen and the
 * identity columns are updated through DeviceService.
 */
public class Device
{

    public String deviceId;              // devices.device_id

    public String name;                  // devices.name

    public String address;               // devices.address

    public int port;                     // devices.port (0 when not set)

    public String username;              // devices.username

    public String secretEncrypted;       // devices.secret_encrypted

    public DeviceStatus status;          // devices.status

    public Instant lastSeen;             // devices.last_seen

    public RefreshOutcome outcome = RefreshOutcome.NOT_PROCESSED;

    /**
     * Maps a row returned by DeviceService into a Device.
     *
     * @param deviceData device JSON (snake_case columns)
     * @return Device instance
     */
    public static Device fromJson(JsonObject deviceData)
    {
        var device = new Device();

        device.deviceId = deviceData.getString("device_id");

        device.name = deviceData.getString("name", deviceData.getString("address"));

        device.address = deviceData.getString("address");

        device.port = deviceData.getInteger("port", 0);

        device.username = deviceData.getString("username");

        device.secretEncrypted = deviceData.getString("secret_encrypted");

        device.status = DeviceStatus.fromValue(deviceData.getString("status"));

        device.lastSeen = TimestampUtil.parse(deviceData.getString("last_seen"));

        return device;
    }

    /**
     * Decrypts the stored secret and builds session credentials.
     *
     * @param secretKey shared key used by the registry to encrypt device secrets
     * @param defaultPort port used when the record carries none
     * @return credentials for DeviceClient.open
     * @throws IllegalStateException when the secret cannot be decrypted
     */
    public DeviceCredentials toCredentials(String secretKey, int defaultPort)
    {
        var password = PasswordUtil.decryptSecret(secretEncrypted, secretKey);

        if (password == null)
        {
            throw new IllegalStateException("Unable to decrypt secret for device " + name);
        }

        return new DeviceCredentials(address, port > 0 ? port : defaultPort, username, password);
    }

    public boolean isMaintenance()
    {
        return status == DeviceStatus.MAINTENANCE;
    }

}
