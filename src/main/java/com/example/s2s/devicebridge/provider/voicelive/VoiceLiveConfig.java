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


package com.example.s2s.devicebridge.provider.voicelive;

/**
 * Configuration for Azure Speech Voice Live API.
 * Supports both Azure AI Foundry and Azure AI Speech Services resources.
 */
public class VoiceLiveConfig {
    private static final String DEFAULT_INSTRUCTIONS =
        "You are a helpful AI voice assistant. Keep responses brief and concise.";

    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final String voice;
    private final String instructions;
    private final String transcriptionModel;
    private final String transcriptionLanguage;
    private final boolean proactiveGreetingEnabled;

    /**
     * Creates a VoiceLiveConfig from environment variables.
     *
     * Required environment variables:
     * - VOICE_LIVE_ENDPOINT: Azure AI endpoint (e.g., https://your-resource.services.ai.azure.com)
     * - VOICE_LIVE_API_KEY: API key for authentication
     * - VOICE_LIVE_MODEL: Model to use (e.g., gpt-realtime, gpt-4o, phi4-mm-realtime)
     * - VOICE_LIVE_VOICE: Voice to use (e.g., en-US-Ava:DragonHDLatestNeural)
     *
     * Optional:
     * - VOICE_LIVE_INSTRUCTIONS: Fallback system prompt when the user has no personality
     * - VOICE_LIVE_TRANSCRIPTION_MODEL: AZURE_SPEECH or WHISPER_1 (default: AZURE_SPEECH)
     * - VOICE_LIVE_TRANSCRIPTION_LANGUAGE: Azure Speech language (default: en-US)
     * - VOICE_LIVE_PROACTIVE_GREETING_ENABLED: Assistant speaks first (default: true)
     */
    public VoiceLiveConfig() {
        this(getRequiredEnv("VOICE_LIVE_ENDPOINT"),
             getRequiredEnv("VOICE_LIVE_API_KEY"),
             getRequiredEnv("VOICE_LIVE_MODEL"),
             getRequiredEnv("VOICE_LIVE_VOICE"),
             System.getenv("VOICE_LIVE_INSTRUCTIONS"),
             System.getenv("VOICE_LIVE_TRANSCRIPTION_MODEL"),
             System.getenv("VOICE_LIVE_TRANSCRIPTION_LANGUAGE"),
             Boolean.parseBoolean(System.getenv().getOrDefault("VOICE_LIVE_PROACTIVE_GREETING_ENABLED", "true")));
    }

    /**
     * Creates a VoiceLiveConfig with explicit values.
     */
    public VoiceLiveConfig(String endpoint, String apiKey, String model, String voice, String instructions,
                           String transcriptionModel, String transcriptionLanguage, boolean proactiveGreetingEnabled) {
        if (endpoint == null || endpoint.isEmpty()) {
            throw new IllegalArgumentException("endpoint cannot be null or empty");
        }
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        if (model == null || model.isEmpty()) {
            throw new IllegalArgumentException("model cannot be null or empty");
        }
        if (voice == null || voice.isEmpty()) {
            throw new IllegalArgumentException("voice cannot be null or empty");
        }
        if (!endpoint.startsWith("https://") && !endpoint.startsWith("wss://")) {
            throw new IllegalArgumentException("VOICE_LIVE_ENDPOINT must start with https:// or wss://");
        }

        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.voice = voice;
        this.instructions = instructions != null && !instructions.isEmpty() ? instructions : DEFAULT_INSTRUCTIONS;
        this.transcriptionModel = transcriptionModel != null ? transcriptionModel : "AZURE_SPEECH";
        this.transcriptionLanguage = transcriptionLanguage != null ? transcriptionLanguage : "en-US";
        this.proactiveGreetingEnabled = proactiveGreetingEnabled;
    }

    public static boolean isAvailable() {
        String endpoint = System.getenv("VOICE_LIVE_ENDPOINT");
        String key = System.getenv("VOICE_LIVE_API_KEY");
        return endpoint != null && !endpoint.isEmpty() && key != null && !key.isEmpty();
    }

    public String getEndpoint() {
        return endpoint;
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

    public String getInstructions() {
        return instructions;
    }

    public String getTranscriptionModel() {
        return transcriptionModel;
    }

    public String getTranscriptionLanguage() {
        return transcriptionLanguage;
    }

    public boolean isProactiveGreetingEnabled() {
        return proactiveGreetingEnabled;
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
        return "VoiceLiveConfig{" +
               "endpoint='" + endpoint + '\'' +
               ", model='" + model + '\'' +
               ", voice='" + voice + '\'' +
               ", apiKey='***'" +
               '}';
    }
}
