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


package com.example.s2s.devicebridge;

import com.example.s2s.devicebridge.registry.DeviceChannel;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeviceChannel} over a Java-WebSocket connection.
 */
public class WebSocketDeviceChannel implements DeviceChannel {
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketDeviceChannel.class);

    private final WebSocket socket;
    private final String id;

    public WebSocketDeviceChannel(WebSocket socket, String deviceId) {
        this.socket = socket;
        this.id = deviceId + "@" + socket.getRemoteSocketAddress();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean sendText(String text) {
        if (!socket.isOpen()) {
            return false;
        }
        try {
            socket.send(text);
            return true;
        } catch (WebsocketNotConnectedException e) {
            LOG.debug("Text send to {} failed: not connected", id);
            return false;
        }
    }

    @Override
    public boolean sendBinary(byte[] data) {
        if (!socket.isOpen()) {
            return false;
        }
        try {
            socket.send(data);
            return true;
        } catch (WebsocketNotConnectedException e) {
            LOG.debug("Binary send to {} failed: not connected", id);
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return socket.isOpen();
    }

    @Override
    public void close(int code, String reason) {
        socket.close(code, reason);
    }

    @Override
    public String toString() {
        return "WebSocketDeviceChannel{" + id + '}';
    }
}
