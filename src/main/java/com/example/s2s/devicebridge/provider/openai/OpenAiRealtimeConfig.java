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


package com.example.s2s.devicebridge.provider.openai;

/**
 * Configuration for the OpenAI Realtime API.
 */
public class OpenAiRealtimeConfig {
    private static final String DEFAULT_URL = "wss://api.openai.com/v1/realtime";
    private static final String DEFAULT_MODEL = "gpt-4o-realtime-preview";
    private static final String DEFAULT_VOICE = "alloy";
    private static final String DEFAULT_TRANSCRIPTION_MODEL = "whisper-1";

    private final String url;
    private final String apiKey;
    private final String model;
    private final String voice;
    private final String transcriptionModel;

    /**
     * Creates an OpenAiRealtimeConfig from environment variables.
     *
     * Required environment variables:
     * - OPENAI_API_KEY: API key for authentication
     *
     * Optional:
     * - OPENAI_REALTIME_URL: WebSocket endpoint (default: wss://api.openai.com/v1/realtime)
     * - OPENAI_REALTIME_MODEL: Model to use (default: gpt-4o-realtime-preview)
     * - OPENAI_REALTIME_VOICE: Voice to use (default: alloy)
     * - OPENAI_TRANSCRIPTION_MODEL: Input transcription model (default: whisper-1)
     */
    public OpenAiRealtimeConfig() {
        this(System.getenv("OPENAI_REALTIME_URL"),
             getRequiredEnv("OPENAI_API_KEY"),
             System.getenv("OPENAI_REALTIME_MODEL"),
             System.getenv("OPENAI_REALTIME_VOICE"),
             System.getenv("OPENAI_TRANSCRIPTION_MODEL"));
    }

    /**
     * Creates an OpenAiRealtimeConfig with explicit values. Null optional values take defaults.
     */
    public OpenAiRealtimeConfig(String url, String apiKey, String model, String voice, String transcriptionModel) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        this.url = isConfigured(url) ? url : DEFAULT_URL;
        this.apiKey = apiKey;
        this.model = isConfigured(model) ? model : DEFAULT_MODEL;
        this.voice = isConfigured(voice) ? voice : DEFAULT_VOICE;
        this.transcriptionModel = isConfigured(transcriptionModel) ? transcriptionModel : DEFAULT_TRANSCRIPTION_MODEL;

        if (!this.url.startsWith("wss://") && !this.url.startsWith("ws://")) {
            throw new IllegalArgumentException("OPENAI_REALTIME_URL must start with wss:// or ws://");
        }
    }

    /**
     * @return true if OPENAI_API_KEY is set
     */
    public static boolean isAvailable() {
        return isConfigured(System.getenv("OPENAI_API_KEY"));
    }

    public String buildWebSocketUrl() {
        return url + (url.contains("?") ? "&" : "?") + "model=" + model;
    }

    public String getUrl() {
        return url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getModel() {
        return model;
    }

    public String getVoice() {
        return voice;
    }

    public String getTranscriptionModel() {
        return transcriptionModel;
    }

    private static boolean isConfigured(String str) {
        return str != null && !str.isEmpty();
    }

    private static String getRequiredEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Environment variable " + key + " is required but not set");
        }
        return value;
    }

    @Override
    public String toString() {
        return "OpenAiRealtimeConfig{" +
               "url='" + url + '\'' +
               ", model='" + model + '\'' +
               ", voice='" + voice + '\'' +
               ", apiKey='***'" +
               '}';
    }
}
