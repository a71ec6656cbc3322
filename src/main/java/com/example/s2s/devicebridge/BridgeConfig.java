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

import com.example.s2s.devicebridge.audio.DeviceAudioFormat;
import com.example.s2s.devicebridge.session.QuotaPolicy;

import java.time.Duration;
import java.util.Map;

/**
 * Bridge-wide settings, read from environment variables.
 *
 * Every variable is optional:
 * - PORT: device WebSocket port (default: 8000)
 * - DEVICE_INPUT_SAMPLE_RATE / DEVICE_OUTPUT_SAMPLE_RATE: 16000 / 24000
 * - FRAME_DURATION_MS: outbound frame length (default: 60)
 * - OPUS_BITRATE: outbound Opus bitrate (default: 12000)
 * - PLAYBACK_SAFETY_MARGIN_MS: how early each asset frame is sent (default: 10)
 * - USAGE_TICK_SECONDS: usage persistence interval (default: 30)
 * - FREE_QUOTA_SECONDS / PREMIUM_QUOTA_SECONDS: 3600 / 36000
 * - PROVIDER_CONNECT_TIMEOUT_MS: upstream readiness timeout (default: 10000)
 * - PENDING_FRAME_LIMIT: device frames queued before readiness (default: 500)
 * - ASSET_BASE_URL: base for assets requested by id
 * - DIRECTORY_URL / DIRECTORY_API_KEY: user directory service
 * - SYSTEM_PROMPT: prompt for users without a personality
 */
public class BridgeConfig {
    private static final String DEFAULT_SYSTEM_PROMPT =
        "You are a friendly voice companion on a small speaker. Keep responses brief and warm.";

    private final int port;
    private final DeviceAudioFormat audioFormat;
    private final int opusBitrate;
    private final Duration playbackSafetyMargin;
    private final Duration usageTickInterval;
    private final QuotaPolicy quotaPolicy;
    private final Duration providerConnectTimeout;
    private final int pendingFrameLimit;
    private final String assetBaseUrl;
    private final String directoryUrl;
    private final String directoryApiKey;
    private final String systemPrompt;

    public BridgeConfig() {
        this(System.getenv());
    }

    /**
     * @param env variables to read, normally {@link System#getenv()}
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public BridgeConfig(Map<String, String> env) {
        this.port = getInt(env, "PORT", 8000);
        this.audioFormat = new DeviceAudioFormat(
            getInt(env, "DEVICE_INPUT_SAMPLE_RATE", 16000),
            getInt(env, "DEVICE_OUTPUT_SAMPLE_RATE", 24000),
            getInt(env, "FRAME_DURATION_MS", 60));
        this.opusBitrate = getInt(env, "OPUS_BITRATE", 12000);
        this.playbackSafetyMargin = Duration.ofMillis(getInt(env, "PLAYBACK_SAFETY_MARGIN_MS", 10));
        this.usageTickInterval = Duration.ofSeconds(getInt(env, "USAGE_TICK_SECONDS", 30));
        this.quotaPolicy = new QuotaPolicy(
            getInt(env, "FREE_QUOTA_SECONDS", 3600),
            getInt(env, "PREMIUM_QUOTA_SECONDS", 36000));
        this.providerConnectTimeout = Duration.ofMillis(getInt(env, "PROVIDER_CONNECT_TIMEOUT_MS", 10000));
        this.pendingFrameLimit = getInt(env, "PENDING_FRAME_LIMIT", 500);
        this.assetBaseUrl = emptyToNull(env.get("ASSET_BASE_URL"));
        this.directoryUrl = emptyToNull(env.get("DIRECTORY_URL"));
        this.directoryApiKey = emptyToNull(env.get("DIRECTORY_API_KEY"));
        String prompt = emptyToNull(env.get("SYSTEM_PROMPT"));
        this.systemPrompt = prompt != null ? prompt : DEFAULT_SYSTEM_PROMPT;

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("PORT out of range: " + port);
        }
        if (usageTickInterval.toMillis() <= 0 || providerConnectTimeout.toMillis() <= 0 || pendingFrameLimit <= 0) {
            throw new IllegalArgumentException("Tick interval, connect timeout and pending limit must be positive");
        }
    }

    public int getPort() {
        return port;
    }

    public DeviceAudioFormat getAudioFormat() {
        return audioFormat;
    }

    public int getOpusBitrate() {
        return opusBitrate;
    }

    public Duration getPlaybackSafetyMargin() {
        return playbackSafetyMargin;
    }

    public Duration getUsageTickInterval() {
        return usageTickInterval;
    }

    public QuotaPolicy getQuotaPolicy() {
        return quotaPolicy;
    }

    public Duration getProviderConnectTimeout() {
        return providerConnectTimeout;
    }

    public int getPendingFrameLimit() {
        return pendingFrameLimit;
    }

    public String getAssetBaseUrl() {
        return assetBaseUrl;
    }

    public String getDirectoryUrl() {
        return directoryUrl;
    }

    public String getDirectoryApiKey() {
        return directoryApiKey;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + key + " is not a number: " + value, e);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        return "BridgeConfig{" +
               "port=" + port +
               ", " + audioFormat +
               ", opusBitrate=" + opusBitrate +
               ", tick=" + usageTickInterval.toSeconds() + "s" +
               ", connectTimeout=" + providerConnectTimeout.toMillis() + "ms" +
               ", directoryUrl='" + directoryUrl + '\'' +
               ", directoryApiKey='***'" +
               '}';
    }
}
