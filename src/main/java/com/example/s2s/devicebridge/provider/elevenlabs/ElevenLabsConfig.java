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


package com.example.s2s.devicebridge.provider.elevenlabs;

/**
 * Configuration for ElevenLabs Conversational AI agents.
 */
public class ElevenLabsConfig {
    private static final String DEFAULT_API_URL = "https://api.elevenlabs.io";

    private final String apiUrl;
    private final String apiKey;
    private final String agentId;

    /**
     * Creates an ElevenLabsConfig from environment variables.
     *
     * Required environment variables:
     * - ELEVENLABS_API_KEY: API key used to request signed conversation URLs
     * - ELEVENLABS_AGENT_ID: Agent used when the user's personality names none
     *
     * Optional:
     * - ELEVENLABS_API_URL: REST base URL (default: https://api.elevenlabs.io)
     */
    public ElevenLabsConfig() {
        this(System.getenv("ELEVENLABS_API_URL"),
             getRequiredEnv("ELEVENLABS_API_KEY"),
             getRequiredEnv("ELEVENLABS_AGENT_ID"));
    }

    /**
     * Creates an ElevenLabsConfig with explicit values.
     */
    public ElevenLabsConfig(String apiUrl, String apiKey, String agentId) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        if (agentId == null || agentId.isEmpty()) {
            throw new IllegalArgumentException("agentId cannot be null or empty");
        }
        String base = apiUrl != null && !apiUrl.isEmpty() ? apiUrl : DEFAULT_API_URL;
        this.apiUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.apiKey = apiKey;
        this.agentId = agentId;
    }

    public static boolean isAvailable() {
        String key = System.getenv("ELEVENLABS_API_KEY");
        String agent = System.getenv("ELEVENLABS_AGENT_ID");
        return key != null && !key.isEmpty() && agent != null && !agent.isEmpty();
    }

    /**
     * Format: https://api.elevenlabs.io/v1/convai/conversation/get-signed-url?agent_id=<agent>
     */
    public String buildSignedUrlEndpoint(String agentOverride) {
        String agent = agentOverride != null && !agentOverride.isEmpty() ? agentOverride : agentId;
        return apiUrl + "/v1/convai/conversation/get-signed-url?agent_id=" + agent;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getAgentId() {
        return agentId;
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
        return "ElevenLabsConfig{" +
               "apiUrl='" + apiUrl + '\'' +
               ", agentId='" + agentId + '\'' +
               ", apiKey='***'" +
               '}';
    }
}
