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


package com.example.s2s.devicebridge.provider;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Base for providers spoken to over a JSON text WebSocket.
 *
 * Handles the OkHttp socket lifecycle and JSON decoding; subclasses build the
 * upgrade request and map each upstream message in {@link #onJson}.
 */
public abstract class AbstractWebSocketProviderAdapter extends AbstractProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractWebSocketProviderAdapter.class);

    protected static final int NORMAL_CLOSURE = 1000;

    protected final OkHttpClient httpClient;
    private volatile WebSocket socket;
    private volatile String initialTurnText;
    private volatile String systemContext;

    protected AbstractWebSocketProviderAdapter(String name, Duration connectTimeout, OkHttpClient httpClient) {
        super(name, connectTimeout);
        this.httpClient = httpClient;
    }

    @Override
    protected void openUpstream(ProviderCredentials credentials, String initialTurnText, String systemContext) {
        this.initialTurnText = initialTurnText;
        this.systemContext = systemContext;
        dial(buildRequest(credentials));
    }

    /**
     * Starts the connection for {@code request}. Opens the socket directly
     * unless the provider needs a negotiation step first.
     */
    protected void dial(Request request) {
        openSocket(request);
    }

    /**
     * @return the first request of the connection, normally the WebSocket upgrade
     */
    protected abstract Request buildRequest(ProviderCredentials credentials);

    /**
     * One decoded upstream message.
     */
    protected abstract void onJson(JsonObject message);

    /**
     * Socket is open. Providers that are ready as soon as the socket opens
     * send their session setup here and call {@link #markReady()}.
     */
    protected void onSocketOpen() {
    }

    protected final void openSocket(Request request) {
        LOG.info("Opening {} WebSocket to {}", name(), request.url().host());
        socket = httpClient.newWebSocket(request, new UpstreamListener());
    }

    /**
     * Fire-and-forget send. Returns false if the socket is gone or its
     * outgoing buffer is full.
     */
    protected final boolean sendJson(JsonObject message) {
        WebSocket current = socket;
        if (current == null) {
            LOG.warn("{}: dropping {} message, socket not open", name(), type(message));
            return false;
        }
        boolean queued = current.send(message.toString());
        if (!queued) {
            LOG.warn("{}: failed to queue {} message", name(), type(message));
        }
        return queued;
    }

    @Override
    protected void closeUpstream() {
        WebSocket current = socket;
        socket = null;
        if (current != null && !current.close(NORMAL_CLOSURE, "session closed")) {
            current.cancel();
        }
    }

    protected final String initialTurnText() {
        return initialTurnText;
    }

    protected final String systemContext() {
        return systemContext;
    }

    // ---------------------------------------------------------------- JSON helpers

    protected static String type(JsonObject message) {
        return string(message, "type");
    }

    /**
     * @return the string member, or null when absent or not a primitive
     */
    protected static String string(JsonObject object, String member) {
        if (object == null) {
            return null;
        }
        JsonElement element = object.get(member);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    /**
     * @return the object member, or null when absent or not an object
     */
    protected static JsonObject object(JsonObject object, String member) {
        if (object == null) {
            return null;
        }
        JsonElement element = object.get(member);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private class UpstreamListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            LOG.info("✓ {} WebSocket open (HTTP {})", name(), response.code());
            try {
                onSocketOpen();
            } catch (RuntimeException e) {
                LOG.error("{}: session setup failed", name(), e);
                failConnect(new UpstreamUnavailableException(name() + " session setup failed", e));
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            JsonObject message;
            try {
                message = JsonParser.parseString(text).getAsJsonObject();
            } catch (JsonParseException | IllegalStateException e) {
                LOG.warn("{}: ignoring malformed message: {}", name(), e.getMessage());
                return;
            }
            try {
                onJson(message);
            } catch (RuntimeException e) {
                LOG.error("{}: error handling '{}' message", name(), type(message), e);
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            LOG.debug("{}: ignoring {} byte binary message", name(), bytes.size());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            LOG.info("{} WebSocket closing: {} {}", name(), code, reason);
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            upstreamClosed(code + " " + reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            String detail = response != null
                ? "HTTP " + response.code() + " " + response.message()
                : String.valueOf(t.getMessage());
            if (state() == AdapterState.CONNECTING) {
                failConnect(new UpstreamUnavailableException(name() + " connection failed: " + detail, t));
                return;
            }
            if (!isOpen()) {
                return;
            }
            LOG.error("❌ {} WebSocket failure: {}", name(), detail);
            emitError("connection_lost", detail);
            upstreamClosed(detail);
        }
    }
}
