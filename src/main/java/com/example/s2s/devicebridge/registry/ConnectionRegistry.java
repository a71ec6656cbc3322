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

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live device connections by key, shared by every session in the process.
 *
 * One channel per key: registering again replaces the previous channel.
 */
public class ConnectionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<ConnectionKey, DeviceChannel> connections = new ConcurrentHashMap<>();

    public void register(ConnectionKey key, DeviceChannel channel) {
        DeviceChannel previous = connections.put(key, channel);
        if (previous != null && previous != channel) {
            LOG.info("Replaced connection {} ({} → {})", key, previous.id(), channel.id());
        } else {
            LOG.info("Registered connection {} ({})", key, channel.id());
        }
    }

    public void unregister(ConnectionKey key) {
        if (connections.remove(key) != null) {
            LOG.info("Unregistered connection {}", key);
        }
    }

    /**
     * Removes the entry only if it still maps to {@code channel}, so a closing
     * connection cannot evict the one that replaced it.
     *
     * @return true if the entry was removed
     */
    public boolean unregister(ConnectionKey key, DeviceChannel channel) {
        boolean removed = connections.remove(key, channel);
        if (removed) {
            LOG.info("Unregistered connection {} ({})", key, channel.id());
        }
        return removed;
    }

    public Optional<DeviceChannel> lookup(ConnectionKey key) {
        return Optional.ofNullable(connections.get(key));
    }

    /**
     * Serializes and writes {@code message} to the channel registered under {@code key}.
     *
     * @return true if a live channel accepted the write
     */
    public boolean deliver(ConnectionKey key, JsonObject message) {
        DeviceChannel channel = connections.get(key);
        if (channel == null) {
            LOG.debug("No connection for {}", key);
            return false;
        }
        try {
            if (!channel.isOpen()) {
                LOG.debug("Connection {} is not open", key);
                return false;
            }
            return channel.sendText(message.toString());
        } catch (RuntimeException e) {
            LOG.warn("Delivery to {} failed: {}", key, e.getMessage());
            return false;
        }
    }

    public int size() {
        return connections.size();
    }
}
