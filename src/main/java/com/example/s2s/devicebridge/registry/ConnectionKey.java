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

import java.util.Objects;

/**
 * Registry key: a device id plus the logical channel it names.
 */
public final class ConnectionKey {
    static final String COMMAND_SUFFIX = "-asset";

    private final String deviceId;
    private final boolean commandChannel;

    private ConnectionKey(String deviceId, boolean commandChannel) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("deviceId cannot be null or empty");
        }
        this.deviceId = deviceId;
        this.commandChannel = commandChannel;
    }

    /**
     * Key of the device's audio session connection.
     */
    public static ConnectionKey primary(String deviceId) {
        return new ConnectionKey(deviceId, false);
    }

    /**
     * Key of the device's secondary asset command connection.
     */
    public static ConnectionKey commandChannel(String deviceId) {
        return new ConnectionKey(deviceId, true);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isCommandChannel() {
        return commandChannel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionKey)) {
            return false;
        }
        ConnectionKey that = (ConnectionKey) o;
        return commandChannel == that.commandChannel && deviceId.equals(that.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, commandChannel);
    }

    @Override
    public String toString() {
        return commandChannel ? deviceId + COMMAND_SUFFIX : deviceId;
    }
}
