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


package com.example.s2s.devicebridge.provider.hume;

/**
 * Configuration for Hume EVI (Empathic Voice Interface).
 */
public class HumeConfig {
    private static final String DEFAULT_URL = "wss://api.hume.ai/v0/evi/chat";
    private static final double DEFAULT_OUTPUT_GAIN_DB = 6.0;
    private static final double DEFAULT_OUTPUT_CEILING = 0.89;

    private final String url;
    private final String apiKey;
    private final String configId;
    private final double outputGainDb;
    private final double outputCeiling;

    /**
     * Creates a HumeConfig from environment variables.
     *
     * Required environment variables:
     * - HUME_API_KEY: API key for authentication
     *
     * Optional:
     * - HUME_CONFIG_ID: EVI configuration used when the user's personality names none
     * - HUME_URL: WebSocket endpoint (default: wss://api.hume.ai/v0/evi/chat)
     * - HUME_OUTPUT_GAIN_DB: Gain applied to EVI speech (default: 6.0)
     * - HUME_OUTPUT_CEILING: Limiter ceiling as a fraction of full scale (default: 0.89)
     */
    public HumeConfig() {
        this.url = System.getenv().getOrDefault("HUME_URL", DEFAULT_URL);
        this.apiKey = getRequiredEnv("HUME_API_KEY");
        this.configId = System.getenv("HUME_CONFIG_ID");
        this.outputGainDb = Double.parseDouble(
            System.getenv().getOrDefault("HUME_OUTPUT_GAIN_DB", String.valueOf(DEFAULT_OUTPUT_GAIN_DB)));
        this.outputCeiling = Double.parseDouble(
            System.getenv().getOrDefault("HUME_OUTPUT_CEILING", String.valueOf(DEFAULT_OUTPUT_CEILING)));
    }

    /**
     * Creates a HumeConfig with explicit values and the default output gain.
     */
    public HumeConfig(String url, String apiKey, String configId) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        this.url = url != null && !url.isEmpty() ? url : DEFAULT_URL;
        this.apiKey = apiKey;
        this.configId = configId;
        this.outputGainDb = DEFAULT_OUTPUT_GAIN_DB;
        this.outputCeiling = DEFAULT_OUTPUT_CEILING;
    }

    public static boolean isAvailable() {
        String key = System.getenv("HUME_API_KEY");
        return key != null && !key.isEmpty();
    }

    /**
     * Format: wss://api.hume.ai/v0/evi/chat?api_key=<key>&config_id=<config>
     */
    public String buildWebSocketUrl(String key, String configOverride) {
        String config = configOverride != null && !configOverride.isEmpty() ? configOverride : configId;
        StringBuilder sb = new StringBuilder(url)
            .append(url.contains("?") ? '&' : '?')
            .append("api_key=").append(key);
        if (config != null && !config.isEmpty()) {
            sb.append("&config_id=").append(config);
        }
        return sb.toString();
    }

    public String getUrl() {
        return url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getConfigId() {
        return configId;
    }

    public double getOutputGainDb() {
        return outputGainDb;
    }

    public double getOutputCeiling() {
        return outputCeiling;
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
        return "HumeConfig{" +
               "url='" + url + '\'' +
               ", configId='" + configId + '\'' +
               ", apiKey='***'" +
               '}';
    }
}
