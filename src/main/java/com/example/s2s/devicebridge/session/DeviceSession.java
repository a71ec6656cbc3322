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


package com.example.s2s.devicebridge.session;

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.audio.OutboundAudioStream;
import com.example.s2s.devicebridge.directory.UserDirectory;
import com.example.s2s.devicebridge.playback.AssetSource;
import com.example.s2s.devicebridge.playback.PlaybackController;
import com.example.s2s.devicebridge.provider.ProviderConnection;
import com.example.s2s.devicebridge.provider.ProviderEvent;
import com.example.s2s.devicebridge.provider.ProviderTimeoutException;
import com.example.s2s.devicebridge.registry.ConnectionKey;
import com.example.s2s.devicebridge.registry.ConnectionRegistry;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Optional;

/**
 * Runtime of one bridged device session.
 *
 * Audio flow:
 * - Device → Provider: binary PCM16 → ProviderConnection (queued until ready) → adapter
 * - Provider → Device: adapter audio → OutboundAudioStream → Opus frames → device
 *
 * Device JSON and provider events are translated here; everything that
 * ends the session goes through {@link #close}.
 */
public class DeviceSession {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceSession.class);

    private final Session session;
    private final ProviderConnection connection;
    private final ConnectionRegistry registry;
    private final PlaybackController playback;
    private final UserDirectory directory;
    private final Scheduler ioScheduler;
    private final int inputSampleRate;

    private volatile OutboundAudioStream outbound;
    private volatile UsageMeter meter;

    public DeviceSession(Session session, ProviderConnection connection, ConnectionRegistry registry,
                         PlaybackController playback, UserDirectory directory, Scheduler ioScheduler,
                         int inputSampleRate) {
        this.session = session;
        this.connection = connection;
        this.registry = registry;
        this.playback = playback;
        this.directory = directory;
        this.ioScheduler = ioScheduler;
        this.inputSampleRate = inputSampleRate;
    }

    public Session session() {
        return session;
    }

    public ProviderConnection connection() {
        return connection;
    }

    void attachOutbound(OutboundAudioStream outbound) {
        this.outbound = outbound;
    }

    void attachMeter(UsageMeter meter) {
        this.meter = meter;
    }

    // ---------------------------------------------------------------- device → bridge

    /**
     * Microphone audio from the device.
     */
    public void onBinary(byte[] data) {
        if (session.isClosing() || data.length == 0) {
            return;
        }
        connection.offer(AudioFrame.pcm16Mono(data, inputSampleRate));
    }

    /**
     * JSON control message from the device. Malformed input is logged and ignored.
     */
    public void onText(String text) {
        if (session.isClosing()) {
            return;
        }
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (!parsed.isJsonObject()) {
                LOG.warn("⚠ Ignoring non-object message from {}", session.getDeviceId());
                return;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            LOG.warn("⚠ Ignoring malformed message from {}: {}", session.getDeviceId(), e.getMessage());
            return;
        }

        String type = string(message, "type");
        if (type == null) {
            LOG.warn("⚠ Message without type from {}", session.getDeviceId());
            return;
        }
        switch (type) {
            case "instruction" -> handleInstruction(string(message, "msg"));
            case "action" -> handleAction(string(message, "action"), message);
            case "asset_status" -> handleAssetStatus(message);
            default -> LOG.debug("Unhandled device message type {} from {}", type, session.getDeviceId());
        }
    }

    /**
     * The device socket closed on its own.
     */
    public void onDeviceClosed(int code, String reason) {
        LOG.info("Device {} disconnected: {} {}", session.getDeviceId(), code, reason);
        close("device disconnected");
    }

    private void handleInstruction(String msg) {
        if (msg == null) {
            return;
        }
        LOG.info("Instruction from {}: {}", session.getDeviceId(), msg);
        switch (msg) {
            case "INTERRUPT" -> interrupt();
            case "END_SESSION" -> close("ended by device");
            default -> LOG.debug("Ignoring instruction {}", msg);
        }
    }

    private void handleAction(String action, JsonObject message) {
        if (action == null) {
            LOG.warn("⚠ Action message without action from {}", session.getDeviceId());
            return;
        }
        LOG.info("Action from {}: {}", session.getDeviceId(), action);
        switch (action) {
            case "play_asset" -> playAsset(string(message, "asset_id"), string(message, "url"));
            case "pause_asset" -> {
                if (!playback.pause(session)) {
                    LOG.debug("pause_asset from {} with nothing playing", session.getDeviceId());
                }
            }
            case "resume_asset" -> {
                interrupt();
                if (playback.resume(session) < 0) {
                    sendJson(DeviceMessages.error(DeviceMessages.ASSET_UNAVAILABLE, "Nothing paused to resume"));
                }
            }
            case "stop_asset" -> playback.stop(session);
            case "interrupt" -> interrupt();
            case "end_session" -> close("ended by device");
            default -> LOG.warn("⚠ Unknown action {} from {}", action, session.getDeviceId());
        }
    }

    private void playAsset(String assetId, String url) {
        if (assetId == null && url == null) {
            sendJson(DeviceMessages.error(DeviceMessages.ASSET_UNAVAILABLE, "play_asset needs asset_id or url"));
            return;
        }
        interrupt();
        playback.play(session, AssetSource.of(assetId, url));
    }

    private void handleAssetStatus(JsonObject message) {
        String status = string(message, "status");
        if (status == null) {
            return;
        }
        JsonElement position = message.get("position");
        Integer positionSeconds = position != null && position.isJsonPrimitive() && position.getAsJsonPrimitive().isNumber()
            ? position.getAsInt() : null;
        String deviceId = session.getDeviceId();
        offload("asset status", () -> directory.recordAssetStatus(deviceId, status, positionSeconds));
    }

    private void interrupt() {
        connection.adapter().interrupt();
        OutboundAudioStream stream = outbound;
        if (stream != null) {
            stream.clear();
        }
    }

    // ---------------------------------------------------------------- provider → device

    void onProviderReady() {
        if (!session.transition(SessionState.AWAITING_PROVIDER, SessionState.BRIDGING)) {
            LOG.debug("Provider ready after session {} left AWAITING_PROVIDER", session.getDeviceId());
            return;
        }
        int drained = connection.drainOnce();
        LOG.info("✓ Provider {} ready for {} ({} queued frames forwarded)",
            session.getProviderTag(), session.getDeviceId(), drained);
        sendJson(DeviceMessages.server(DeviceMessages.SESSION_CREATED));
    }

    void onProviderFailure(Throwable error) {
        if (session.isClosing()) {
            return;
        }
        String code = error instanceof ProviderTimeoutException
            ? DeviceMessages.PROVIDER_TIMEOUT : DeviceMessages.UPSTREAM_UNAVAILABLE;
        LOG.error("❌ Provider {} failed for {}: {}", session.getProviderTag(), session.getDeviceId(), error.getMessage());
        sendJson(DeviceMessages.error(code, error.getMessage()));
        close("provider failure");
    }

    void onProviderEvent(ProviderEvent event) {
        if (session.isClosing()) {
            return;
        }
        switch (event.type()) {
            case AUDIO_CHUNK_RECEIVED -> {
                OutboundAudioStream stream = outbound;
                if (stream != null) {
                    stream.write(event.audio());
                }
            }
            case TURN_STARTED -> sendJson(DeviceMessages.server(DeviceMessages.RESPONSE_CREATED));
            case TURN_COMPLETED -> completeTurn();
            case USER_UTTERANCE_TRANSCRIBED -> {
                LOG.info("🎤 User: {}", event.text());
                record("user", event.text());
            }
            case ASSISTANT_UTTERANCE_PRODUCED -> {
                LOG.info("🤖 Assistant: {}", event.text());
                record("assistant", event.text());
            }
            case SESSION_ENDED -> {
                sendJson(DeviceMessages.server(DeviceMessages.SESSION_END));
                close("provider ended session");
            }
            case UPSTREAM_ERROR -> {
                LOG.warn("⚠ Upstream error on {}: {} {}", session.getDeviceId(), event.code(), event.text());
                sendJson(DeviceMessages.responseError(event.text()));
            }
            default -> LOG.debug("Ignoring provider event {}", event);
        }
    }

    void onQuotaExceeded(long elapsedSeconds, long quotaSeconds) {
        sendJson(DeviceMessages.error(DeviceMessages.QUOTA_EXCEEDED,
            "Usage of " + elapsedSeconds + "s reached the limit of " + quotaSeconds + "s"));
        close("quota exceeded");
    }

    private void completeTurn() {
        OutboundAudioStream stream = outbound;
        if (stream != null) {
            stream.flush();
        }
        Mono.fromCallable(() -> directory.currentVolume(session.getUser()))
            .subscribeOn(ioScheduler)
            .onErrorResume(error -> {
                LOG.warn("⚠ Could not read volume for {}: {}", session.getDeviceId(), error.getMessage());
                return Mono.just(Optional.<Integer>empty());
            })
            .subscribe(volume -> sendJson(DeviceMessages.responseComplete(volume.orElse(null))));
    }

    private void record(String role, String text) {
        offload("conversation", () -> directory.recordConversation(session.getUser(), role, text));
    }

    private void offload(String what, Runnable task) {
        Mono.fromRunnable(task)
            .subscribeOn(ioScheduler)
            .subscribe(
                ignored -> { },
                error -> LOG.warn("⚠ Failed to persist {} for {}: {}", what, session.getDeviceId(), error.getMessage())
            );
    }

    // ---------------------------------------------------------------- teardown

    /**
     * Tears the session down. Only the first call has any effect.
     */
    public void close(String reason) {
        if (!session.beginClosing()) {
            return;
        }
        LOG.info("Closing session for {}: {}", session.getDeviceId(), reason);

        playback.cancel(session);
        UsageMeter usage = meter;
        if (usage != null) {
            usage.stop();
        }
        connection.close();
        OutboundAudioStream stream = outbound;
        if (stream != null) {
            stream.clear();
        }
        registry.unregister(ConnectionKey.primary(session.getDeviceId()), session.getChannel());
        if (session.getChannel().isOpen()) {
            session.getChannel().close(1000, reason);
        }
        session.markClosed();
        LOG.info("✓ Session closed for {}", session.getDeviceId());
    }

    boolean sendJson(JsonObject message) {
        boolean sent = session.getChannel().sendText(message.toString());
        if (!sent) {
            LOG.debug("Dropped message to closed device {}: {}", session.getDeviceId(), message);
        }
        return sent;
    }

    private static String string(JsonObject obj, String member) {
        JsonElement value = obj.get(member);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }
}
