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

import org.java_websocket.drafts.Draft;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.handshake.HandshakeImpl1Server;
import org.java_websocket.handshake.Handshakedata;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * RFC 6455 draft that can answer an upgrade with a plain HTTP error.
 *
 * The stock draft always writes a 101 status line. A handshake built with
 * {@link #refuse(int, String)} is written as that status with an empty body
 * instead; the server then drops the connection once the response is flushed.
 */
class DeviceHandshakeDraft extends Draft_6455 {

    static Refusal refuse(int status, String reason) {
        return new Refusal(status, reason);
    }

    @Override
    public Draft copyInstance() {
        return new DeviceHandshakeDraft();
    }

    @Override
    public List<ByteBuffer> createHandshake(Handshakedata handshakedata, boolean withcontent) {
        if (handshakedata instanceof Refusal) {
            return Collections.singletonList(((Refusal) handshakedata).toHttpResponse());
        }
        return super.createHandshake(handshakedata, withcontent);
    }

    /**
     * Server handshake that carries a refusal status instead of 101.
     */
    static final class Refusal extends HandshakeImpl1Server {
        private final int status;
        private final String reason;

        private Refusal(int status, String reason) {
            this.status = status;
            this.reason = reason;
        }

        int getStatus() {
            return status;
        }

        String getReason() {
            return reason;
        }

        ByteBuffer toHttpResponse() {
            String response = "HTTP/1.1 " + status + " " + reason + "\r\n"
                + "Connection: close\r\n"
                + "Content-Length: 0\r\n"
                + "\r\n";
            return ByteBuffer.wrap(response.getBytes(StandardCharsets.US_ASCII));
        }
    }
}
