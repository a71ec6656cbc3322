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

import com.example.s2s.devicebridge.directory.AuthFailureException;
import com.example.s2s.devicebridge.directory.UserRecord;
import com.example.s2s.devicebridge.session.DeviceSession;
import com.example.s2s.devicebridge.session.SessionOrchestrator;
import org.java_websocket.WebSocket;
import org.java_websocket.WebSocketImpl;
import org.java_websocket.drafts.Draft;
import org.java_websocket.exceptions.InvalidDataException;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.handshake.ServerHandshakeBuilder;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Device-facing WebSocket server.
 *
 * Paths:
 * - {@code /}: primary session connection
 * - {@code /ws/device/{deviceId}/asset}: secondary asset command channel
 *
 * Both require {@code Authorization: Bearer <token>}; the token is checked
 * during the handshake so a refused upgrade never creates a session. Refusals
 * are answered with a plain HTTP status: 401 for a missing, unknown or foreign
 * token and 404 for any other path.
 */
public class DeviceBridgeServer extends WebSocketServer {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceBridgeServer.class);
    private static final Pattern COMMAND_PATH = Pattern.compile("^/ws/device/([^/]+)/asset/?$");
    private static final String RSSI_HEADER = "x-wifi-rssi";

    private final SessionOrchestrator orchestrator;

    public DeviceBridgeServer(InetSocketAddress address, SessionOrchestrator orchestrator) {
        super(address, Collections.singletonList(new DeviceHandshakeDraft()));
        this.orchestrator = orchestrator;
        setReuseAddr(true);
    }

    /**
     * @return the device id of a command channel path, or null for any other path
     */
    static String commandChannelDeviceId(String resourceDescriptor) {
        if (resourceDescriptor == null) {
            return null;
        }
        String path = stripQuery(resourceDescriptor);
        Matcher m = COMMAND_PATH.matcher(path);
        return m.matches() ? m.group(1) : null;
    }

    static boolean isPrimaryPath(String resourceDescriptor) {
        return resourceDescriptor == null || stripQuery(resourceDescriptor).equals("/");
    }

    private static String stripQuery(String resourceDescriptor) {
        int q = resourceDescriptor.indexOf('?');
        return q >= 0 ? resourceDescriptor.substring(0, q) : resourceDescriptor;
    }

    @Override
    public ServerHandshakeBuilder onWebsocketHandshakeReceivedAsServer(WebSocket conn, Draft draft,
                                                                      ClientHandshake request) throws InvalidDataException {
        ServerHandshakeBuilder builder = super.onWebsocketHandshakeReceivedAsServer(conn, draft, request);
        String resource = request.getResourceDescriptor();
        String commandDeviceId = commandChannelDeviceId(resource);
        if (commandDeviceId == null && !isPrimaryPath(resource)) {
            LOG.warn("⚠ Refusing upgrade for unknown path {}", resource);
            return refuse(conn, 404, "Not Found");
        }

        UserRecord user;
        try {
            user = orchestrator.authenticate(request.hasFieldValue("Authorization")
                ? request.getFieldValue("Authorization") : null);
        } catch (AuthFailureException e) {
            LOG.warn("⚠ Refusing upgrade from {}: {}", conn.getRemoteSocketAddress(), e.getMessage());
            return refuse(conn, 401, "Unauthorized");
        }

        if (commandDeviceId != null && !commandDeviceId.equals(user.getDevice().getDeviceId())) {
            LOG.warn("⚠ User {} may not open the command channel of {}", user.getUserId(), commandDeviceId);
            return refuse(conn, 401, "Unauthorized");
        }
        conn.setAttachment(new Handshake(user, commandDeviceId));
        return builder;
    }

    private static ServerHandshakeBuilder refuse(WebSocket conn, int status, String reason) {
        DeviceHandshakeDraft.Refusal refusal = DeviceHandshakeDraft.refuse(status, reason);
        conn.setAttachment(refusal);
        return refusal;
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof DeviceHandshakeDraft.Refusal) {
            DeviceHandshakeDraft.Refusal refusal = (DeviceHandshakeDraft.Refusal) attachment;
            if (conn instanceof WebSocketImpl) {
                ((WebSocketImpl) conn).flushAndClose(CloseFrame.POLICY_VALIDATION, refusal.getReason(), false);
            } else {
                conn.closeConnection(CloseFrame.POLICY_VALIDATION, refusal.getReason());
            }
            return;
        }
        if (!(attachment instanceof Handshake)) {
            LOG.error("❌ Connection from {} opened without authentication", conn.getRemoteSocketAddress());
            conn.close(CloseFrame.POLICY_VALIDATION, "Unauthorized");
            return;
        }
        Handshake accepted = (Handshake) attachment;
        String deviceId = accepted.user.getDevice().getDeviceId();
        WebSocketDeviceChannel channel = new WebSocketDeviceChannel(conn, deviceId);

        if (accepted.commandDeviceId != null) {
            orchestrator.openCommandChannel(deviceId, channel);
            conn.setAttachment(new CommandChannel(deviceId, channel));
            return;
        }

        String rssi = handshake.hasFieldValue(RSSI_HEADER) ? handshake.getFieldValue(RSSI_HEADER) : null;
        orchestrator.open(channel, accepted.user, rssi)
            .ifPresentOrElse(conn::setAttachment, () -> conn.setAttachment(null));
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof DeviceSession) {
            ((DeviceSession) attachment).onText(message);
        } else if (attachment instanceof CommandChannel) {
            orchestrator.onCommandMessage(((CommandChannel) attachment).deviceId, message);
        } else {
            LOG.debug("Text from {} without a session, ignored", conn.getRemoteSocketAddress());
        }
    }

    @Override
    public void onMessage(WebSocket conn, ByteBuffer bytes) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof DeviceSession) {
            byte[] data = new byte[bytes.remaining()];
            bytes.get(data);
            ((DeviceSession) attachment).onBinary(data);
        } else {
            LOG.debug("Binary from {} without a session, ignored", conn.getRemoteSocketAddress());
        }
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof DeviceSession) {
            ((DeviceSession) attachment).onDeviceClosed(code, reason);
        } else if (attachment instanceof CommandChannel) {
            CommandChannel command = (CommandChannel) attachment;
            orchestrator.closeCommandChannel(command.deviceId, command.channel);
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        if (conn == null) {
            LOG.error("❌ Device server error", ex);
            return;
        }
        LOG.error("❌ Error on connection {}", conn.getRemoteSocketAddress(), ex);
        Object attachment = conn.getAttachment();
        if (attachment instanceof DeviceSession) {
            ((DeviceSession) attachment).close("socket error: " + ex.getMessage());
        }
    }

    @Override
    public void onStart() {
        LOG.info("✓ Device bridge listening on {}", getAddress());
    }

    private static final class Handshake {
        private final UserRecord user;
        private final String commandDeviceId;

        private Handshake(UserRecord user, String commandDeviceId) {
            this.user = user;
            this.commandDeviceId = commandDeviceId;
        }
    }

    private static final class CommandChannel {
        private final String deviceId;
        private final WebSocketDeviceChannel channel;

        private CommandChannel(String deviceId, WebSocketDeviceChannel channel) {
            this.deviceId = deviceId;
            this.channel = channel;
        }
    }
}
