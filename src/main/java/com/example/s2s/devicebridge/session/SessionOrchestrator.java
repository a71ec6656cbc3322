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

import com.example.s2s.devicebridge.BridgeConfig;
import com.example.s2s.devicebridge.audio.FrameEncoder;
import com.example.s2s.devicebridge.audio.OutboundAudioStream;
import com.example.s2s.devicebridge.audio.TranscodeException;
import com.example.s2s.devicebridge.directory.AuthFailureException;
import com.example.s2s.devicebridge.directory.DeviceRecord;
import com.example.s2s.devicebridge.directory.Personality;
import com.example.s2s.devicebridge.directory.PromptBuilder;
import com.example.s2s.devicebridge.directory.UserDirectory;
import com.example.s2s.devicebridge.directory.UserRecord;
import com.example.s2s.devicebridge.playback.PlaybackController;
import com.example.s2s.devicebridge.provider.ProviderAdapter;
import com.example.s2s.devicebridge.provider.ProviderConnection;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.ProviderDefinition;
import com.example.s2s.devicebridge.provider.ProviderRegistry;
import com.example.s2s.devicebridge.provider.UnknownProviderException;
import com.example.s2s.devicebridge.registry.ConnectionKey;
import com.example.s2s.devicebridge.registry.ConnectionRegistry;
import com.example.s2s.devicebridge.registry.DeviceChannel;
import com.example.s2s.devicebridge.registry.DeviceCommandDispatcher;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Optional;

/**
 * Creates and wires device sessions.
 *
 * Session flow: authenticate (during the upgrade) → quota check → auth message →
 * provider resolution → registry → usage meter → upstream connect → bridging.
 */
public class SessionOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(SessionOrchestrator.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final BridgeConfig config;
    private final UserDirectory directory;
    private final ProviderRegistry providers;
    private final ConnectionRegistry registry;
    private final PlaybackController playback;
    private final PromptBuilder prompts;
    private final FrameEncoder.Factory encoderFactory;
    private final Scheduler meterScheduler;
    private final Scheduler ioScheduler;
    private final Clock clock;
    private final DeviceCommandDispatcher commands;

    public SessionOrchestrator(BridgeConfig config, UserDirectory directory, ProviderRegistry providers,
                               ConnectionRegistry registry, PlaybackController playback, PromptBuilder prompts,
                               FrameEncoder.Factory encoderFactory, Scheduler meterScheduler,
                               Scheduler ioScheduler, Clock clock) {
        this.config = config;
        this.directory = directory;
        this.providers = providers;
        this.registry = registry;
        this.playback = playback;
        this.prompts = prompts;
        this.encoderFactory = encoderFactory;
        this.meterScheduler = meterScheduler;
        this.ioScheduler = ioScheduler;
        this.clock = clock;
        this.commands = new DeviceCommandDispatcher(registry, clock);
    }

    /**
     * Validates the upgrade's Authorization header. Runs before any session exists.
     *
     * @param authorizationHeader raw header value, may be null
     * @return the user, with a device
     * @throws AuthFailureException if the header is missing or the token is refused
     */
    public UserRecord authenticate(String authorizationHeader) throws AuthFailureException {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new AuthFailureException("Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthFailureException("Empty bearer token");
        }
        UserRecord user = directory.resolveUser(token);
        if (user.getDevice() == null) {
            throw new AuthFailureException("User " + user.getUserId() + " has no device");
        }
        return user;
    }

    /**
     * Starts a session on a freshly upgraded primary connection.
     *
     * @param signalStrength device-reported RSSI, logged only (may be null)
     * @return the running session, or empty if it was refused; the channel is closed then
     */
    public Optional<DeviceSession> open(DeviceChannel channel, UserRecord user, String signalStrength) {
        DeviceRecord device = user.getDevice();
        Personality personality = user.getPersonality();
        String deviceId = device.getDeviceId();
        String tag = personality != null ? personality.getProvider() : null;
        LOG.info("Device {} connected for user {} (rssi {}, provider {})", deviceId, user.getUserId(),
            signalStrength != null ? signalStrength : "n/a", tag);

        long quota = config.getQuotaPolicy().quotaFor(user);
        if (config.getQuotaPolicy().isExhausted(user)) {
            LOG.warn("⚠ Refusing {}: {}s used of {}s", deviceId, user.getSessionSeconds(), quota);
            refuse(channel, DeviceMessages.QUOTA_EXCEEDED,
                "Usage of " + user.getSessionSeconds() + "s reached the limit of " + quota + "s");
            return Optional.empty();
        }

        Session session = new Session(deviceId, user, tag, clock.instant(), quota, channel);
        channel.sendText(DeviceMessages.auth(device, personality).toString());
        session.transition(SessionState.AWAITING_AUTH, SessionState.AWAITING_PROVIDER);

        ProviderDefinition definition;
        try {
            definition = providers.resolve(tag);
        } catch (UnknownProviderException e) {
            LOG.error("❌ {} for device {}", e.getMessage(), deviceId);
            refuse(channel, DeviceMessages.UNKNOWN_PROVIDER, e.getMessage());
            return Optional.empty();
        }

        FrameEncoder encoder;
        try {
            encoder = encoderFactory.create();
        } catch (TranscodeException e) {
            LOG.error("❌ Encoder unavailable for {}", deviceId, e);
            refuse(channel, DeviceMessages.ENCODER_UNAVAILABLE, e.getMessage());
            return Optional.empty();
        }

        ProviderAdapter adapter = definition.newAdapter();
        ProviderConnection connection = new ProviderConnection(adapter, config.getPendingFrameLimit());
        DeviceSession deviceSession = new DeviceSession(session, connection, registry, playback, directory,
            ioScheduler, config.getAudioFormat().inputSampleRate());
        deviceSession.attachOutbound(new OutboundAudioStream(config.getAudioFormat(), definition.getOutputGain(),
            encoder, packet -> {
                if (!session.isClosing()) {
                    channel.sendBinary(packet);
                }
            }));

        registry.register(ConnectionKey.primary(deviceId), channel);
        adapter.onEvent(deviceSession::onProviderEvent);

        UsageMeter meter = new UsageMeter(user.getUserId(), session.getPriorSeconds(), quota, directory, clock,
            meterScheduler, config.getUsageTickInterval(), deviceSession::onQuotaExceeded);
        deviceSession.attachMeter(meter);
        meter.start();

        ProviderCredentials credentials = definition.getCredentials();
        if (personality != null && personality.getVoice() != null && !personality.getVoice().isEmpty()) {
            credentials = credentials.withResourceId(personality.getVoice());
        }
        LOG.info("Connecting {} to provider {}", deviceId, definition.getTag());
        adapter.connect(credentials, prompts.firstMessage(user), prompts.systemContext(user))
            .subscribe(
                ignored -> { },
                deviceSession::onProviderFailure,
                deviceSession::onProviderReady
            );
        return Optional.of(deviceSession);
    }

    /**
     * Registers a secondary command channel for a device.
     */
    public ConnectionKey openCommandChannel(String deviceId, DeviceChannel channel) {
        ConnectionKey key = ConnectionKey.commandChannel(deviceId);
        registry.register(key, channel);
        LOG.info("Command channel opened for {}", deviceId);
        return key;
    }

    public void closeCommandChannel(String deviceId, DeviceChannel channel) {
        if (registry.unregister(ConnectionKey.commandChannel(deviceId), channel)) {
            LOG.info("Command channel closed for {}", deviceId);
        }
    }

    /**
     * Handles a message received on a command channel: {@code asset_command}
     * messages are pushed to the device.
     */
    public void onCommandMessage(String deviceId, String text) {
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (!parsed.isJsonObject()) {
                return;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            LOG.warn("⚠ Malformed command for {}: {}", deviceId, e.getMessage());
            return;
        }
        if (!"asset_command".equals(string(message, "type"))) {
            LOG.debug("Ignoring command channel message for {}", deviceId);
            return;
        }
        String command = string(message, "command");
        if (command == null) {
            LOG.warn("⚠ asset_command without command for {}", deviceId);
            return;
        }
        commands.sendAssetCommand(deviceId, command, string(message, "asset_id"), string(message, "url"));
    }

    public DeviceCommandDispatcher commands() {
        return commands;
    }

    private void refuse(DeviceChannel channel, String code, String message) {
        channel.sendText(DeviceMessages.error(code, message).toString());
        channel.close(1000, code);
    }

    private static String string(JsonObject obj, String member) {
        JsonElement value = obj.get(member);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }
}
