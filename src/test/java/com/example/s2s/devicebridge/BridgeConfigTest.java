package com.example.s2s.devicebridge;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeConfigTest {

    @Test
    void shouldApplyDefaults() {
        BridgeConfig config = new BridgeConfig(Map.of());

        assertThat(config.getPort()).isEqualTo(8000);
        assertThat(config.getAudioFormat().inputSampleRate()).isEqualTo(16000);
        assertThat(config.getAudioFormat().outputSampleRate()).isEqualTo(24000);
        assertThat(config.getAudioFormat().frameDurationMs()).isEqualTo(60);
        assertThat(config.getOpusBitrate()).isEqualTo(12000);
        assertThat(config.getPlaybackSafetyMargin()).isEqualTo(Duration.ofMillis(10));
        assertThat(config.getUsageTickInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getQuotaPolicy().getFreeSeconds()).isEqualTo(3600);
        assertThat(config.getQuotaPolicy().getPremiumSeconds()).isEqualTo(36000);
        assertThat(config.getProviderConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getPendingFrameLimit()).isEqualTo(500);
        assertThat(config.getAssetBaseUrl()).isNull();
        assertThat(config.getSystemPrompt()).isNotBlank();
    }

    @Test
    void shouldReadOverrides() {
        BridgeConfig config = new BridgeConfig(Map.of(
            "PORT", "9001",
            "FRAME_DURATION_MS", "20",
            "USAGE_TICK_SECONDS", "5",
            "ASSET_BASE_URL", "https://cdn.example/assets",
            "DIRECTORY_URL", "https://db.example",
            "DIRECTORY_API_KEY", "secret-service-key",
            "SYSTEM_PROMPT", "Be brief."));

        assertThat(config.getPort()).isEqualTo(9001);
        assertThat(config.getAudioFormat().frameDurationMs()).isEqualTo(20);
        assertThat(config.getUsageTickInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getAssetBaseUrl()).isEqualTo("https://cdn.example/assets");
        assertThat(config.getSystemPrompt()).isEqualTo("Be brief.");
        assertThat(config.toString()).doesNotContain("secret-service-key");
    }

    @Test
    void shouldRejectUnparseableNumbers() {
        assertThatThrownBy(() -> new BridgeConfig(Map.of("PORT", "eighty")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("PORT");
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> new BridgeConfig(Map.of("PORT", "70000")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BridgeConfig(Map.of("USAGE_TICK_SECONDS", "0")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BridgeConfig(Map.of("PENDING_FRAME_LIMIT", "-1")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
