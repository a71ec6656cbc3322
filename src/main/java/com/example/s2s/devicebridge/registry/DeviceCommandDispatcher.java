/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */


package com.example.s2s.devicebridge.registry;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Pushes asset commands to devices from outside their sessions.
 *
 * The command channel is tried first; the primary session connection is the
 * fallback.
 */
public class DeviceCommandDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceCommandDispatcher.class);

    private final ConnectionRegistry registry;
    private final Clock clock;

    public DeviceCommandDispatcher(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * @param command play, pause, resume or stop
     * @param assetId optional asset id
     * @param url     optional asset URL
     * @return true if any connection accepted the command
     */
    public boolean sendAssetCommand(String deviceId, String command, String assetId, String url) {
        JsonObject message = new JsonObject();
        message.addProperty("type", "asset_command");
        message.addProperty("command", command);
        message.addProperty("timestamp", Instant.now(clock).toString());
        if (assetId != null) {
            message.addProperty("asset_id", assetId);
        }
        if (url != null) {
            message.addProperty("url", url);
        }

        if (registry.deliver(ConnectionKey.commandChannel(deviceId), message)) {
            LOG.info("Sent '{}' to {} on command channel", command, deviceId);
            return true;
        }
        if (registry.deliver(ConnectionKey.primary(deviceId), message)) {
            LOG.info("Sent '{}' to {} on primary channel", command, deviceId);
            return true;
        }
        LOG.warn("⚠ Device {} not connected on any channel, '{}' not delivered", deviceId, command);
        return false;
    }
}
