/*
 * Copyright (c) 2024 Amazon.com, Inc. or its affiliates.
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

import com.example.s2s.devicebridge.audio.AssetTranscoder;
import com.example.s2s.devicebridge.audio.GainLimiter;
import com.example.s2s.devicebridge.audio.OpusFrameEncoder;
import com.example.s2s.devicebridge.directory.PromptBuilder;
import com.example.s2s.devicebridge.directory.RestUserDirectory;
import com.example.s2s.devicebridge.playback.HttpAssetResolver;
import com.example.s2s.devicebridge.playback.PlaybackController;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.ProviderDefinition;
import com.example.s2s.devicebridge.provider.ProviderRegistry;
import com.example.s2s.devicebridge.provider.elevenlabs.ElevenLabsAdapter;
import com.example.s2s.devicebridge.provider.elevenlabs.ElevenLabsConfig;
import com.example.s2s.devicebridge.provider.hume.HumeConfig;
import com.example.s2s.devicebridge.provider.hume.HumeEviAdapter;
import com.example.s2s.devicebridge.provider.openai.OpenAiRealtimeAdapter;
import com.example.s2s.devicebridge.provider.openai.OpenAiRealtimeConfig;
import com.example.s2s.devicebridge.provider.voicelive.VoiceLiveAdapter;
import com.example.s2s.devicebridge.provider.voicelive.VoiceLiveConfig;
import com.example.s2s.devicebridge.registry.ConnectionRegistry;
import com.example.s2s.devicebridge.session.SessionOrchestrator;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;

/**
 * Device voice bridge: ESP32-class devices ↔ realtime voice AI providers.
 */
public class DeviceBridgeGateway {
    private static final Logger LOG = LoggerFactory.getLogger(DeviceBridgeGateway.class);

    /**
     * Registers every provider whose credentials are present in the environment.
     */
    static ProviderRegistry createProviders(BridgeConfig config, OkHttpClient httpClient) {
        ProviderRegistry providers = new ProviderRegistry();
        Duration timeout = config.getProviderConnectTimeout();

        if (VoiceLiveConfig.isAvailable()) {
            VoiceLiveConfig voiceLive = new VoiceLiveConfig();
            LOG.info("Voice Live configuration: {}", voiceLive);
            providers.register(new ProviderDefinition(VoiceLiveAdapter.TAG,
                () -> new VoiceLiveAdapter(voiceLive, timeout),
                new ProviderCredentials(voiceLive.getApiKey(), voiceLive.getVoice())));
        }
        if (OpenAiRealtimeConfig.isAvailable()) {
            OpenAiRealtimeConfig openAi = new OpenAiRealtimeConfig();
            LOG.info("OpenAI Realtime configuration: {}", openAi);
            providers.register(new ProviderDefinition(OpenAiRealtimeAdapter.TAG,
                () -> new OpenAiRealtimeAdapter(openAi, httpClient, timeout),
                new ProviderCredentials(openAi.getApiKey(), openAi.getVoice())));
        }
        if (ElevenLabsConfig.isAvailable()) {
            ElevenLabsConfig elevenLabs = new ElevenLabsConfig();
            LOG.info("ElevenLabs configuration: {}", elevenLabs);
            providers.register(new ProviderDefinition(ElevenLabsAdapter.TAG,
                () -> new ElevenLabsAdapter(elevenLabs, httpClient, timeout),
                new ProviderCredentials(elevenLabs.getApiKey(), elevenLabs.getAgentId())));
        }
        if (HumeConfig.isAvailable()) {
            HumeConfig hume = new HumeConfig();
            LOG.info("Hume EVI configuration: {}", hume);
            int inputRate = config.getAudioFormat().inputSampleRate();
            providers.register(new ProviderDefinition(HumeEviAdapter.TAG,
                () -> new HumeEviAdapter(hume, httpClient, timeout, inputRate),
                new ProviderCredentials(hume.getApiKey(), hume.getConfigId()),
                new GainLimiter(hume.getOutputGainDb(), hume.getOutputCeiling())));
        }
        return providers;
    }

    /**
     * The main method.
     */
    public static void main(String[] args) {
        LOG.info("Starting device voice bridge");

        try {
            BridgeConfig config = new BridgeConfig();
            LOG.info("Bridge configuration: {}", config);
            if (config.getDirectoryUrl() == null || config.getDirectoryApiKey() == null) {
                throw new IllegalArgumentException("DIRECTORY_URL and DIRECTORY_API_KEY are required");
            }

            OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getProviderConnectTimeout())
                .pingInterval(Duration.ofSeconds(20))
                .build();

            ProviderRegistry providers = createProviders(config, httpClient);
            if (providers.isEmpty()) {
                throw new IllegalArgumentException("No provider configured");
            }
            LOG.info("✓ Providers available: {}", providers.tags());

            RestUserDirectory directory = new RestUserDirectory(httpClient, config.getDirectoryUrl(),
                config.getDirectoryApiKey());
            PlaybackController playback = new PlaybackController(
                new HttpAssetResolver(httpClient, config.getAssetBaseUrl()),
                new AssetTranscoder(config.getAudioFormat(), GainLimiter.unity()),
                OpusFrameEncoder.factory(config.getAudioFormat(), config.getOpusBitrate()),
                config.getAudioFormat(),
                config.getPlaybackSafetyMargin(),
                Schedulers.boundedElastic());

            SessionOrchestrator orchestrator = new SessionOrchestrator(
                config,
                directory,
                providers,
                new ConnectionRegistry(),
                playback,
                new PromptBuilder(config.getSystemPrompt()),
                OpusFrameEncoder.factory(config.getAudioFormat(), config.getOpusBitrate()),
                Schedulers.boundedElastic(),
                Schedulers.boundedElastic(),
                Clock.systemUTC());

            DeviceBridgeServer server = new DeviceBridgeServer(new InetSocketAddress(config.getPort()), orchestrator);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down device bridge");
                try {
                    server.stop(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "bridge-shutdown"));

            LOG.info("  - Audio flow: device (PCM16 {}Hz) → provider, provider → device (Opus {}Hz, {}ms frames)",
                config.getAudioFormat().inputSampleRate(), config.getAudioFormat().outputSampleRate(),
                config.getAudioFormat().frameDurationMs());
            server.run();

        } catch (IllegalArgumentException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            LOG.error("Failed to start device bridge", e);
            System.exit(1);
        }
    }
}
