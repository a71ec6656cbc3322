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

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.audio.Pcm16;
import com.example.s2s.devicebridge.audio.TranscodeException;
import com.example.s2s.devicebridge.audio.WavContainer;
import com.example.s2s.devicebridge.provider.AbstractWebSocketProviderAdapter;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.google.gson.JsonObject;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;

/**
 * Adapter for Hume EVI chat sessions.
 *
 * Audio flow: device PCM16 16kHz → audio_input (base64 linear16)
 *             audio_output (base64 WAV, typically 48kHz) → unwrap → device
 *
 * EVI accepts input as soon as the socket is open, so the adapter is ready on
 * open, after the session settings and the initial user text are sent.
 */
public class HumeEviAdapter extends AbstractWebSocketProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(HumeEviAdapter.class);

    public static final String TAG = "hume";

    private final HumeConfig config;
    private final int inputSampleRate;
    private long wavFailures = 0;

    /**
     * @param inputSampleRate rate announced to EVI for the device microphone audio
     */
    public HumeEviAdapter(HumeConfig config, OkHttpClient httpClient, Duration connectTimeout, int inputSampleRate) {
        super(TAG, connectTimeout, httpClient);
        this.config = config;
        this.inputSampleRate = inputSampleRate;
    }

    @Override
    protected Request buildRequest(ProviderCredentials credentials) {
        return new Request.Builder()
            .url(config.buildWebSocketUrl(credentials.getApiKey(), credentials.getResourceId()))
            .build();
    }

    @Override
    protected void onSocketOpen() {
        JsonObject audio = new JsonObject();
        audio.addProperty("encoding", "linear16");
        audio.addProperty("channels", 1);
        audio.addProperty("sample_rate", inputSampleRate);

        JsonObject settings = new JsonObject();
        settings.addProperty("type", "session_settings");
        settings.add("audio", audio);
        if (systemContext() != null) {
            settings.addProperty("system_prompt", systemContext());
        }
        sendJson(settings);

        String text = initialTurnText();
        if (text != null && !text.isBlank()) {
            JsonObject input = new JsonObject();
            input.addProperty("type", "user_input");
            input.addProperty("text", text);
            sendJson(input);
        }
        markReady();
    }

    @Override
    protected void onJson(JsonObject message) {
        String type = type(message);
        if (type == null) {
            LOG.debug("Ignoring untyped Hume message");
            return;
        }
        switch (type) {
            case "chat_metadata" ->
                LOG.info("✓ Hume chat {} (group {})", string(message, "chat_id"), string(message, "chat_group_id"));
            case "audio_output" ->
                handleAudioOutput(message);
            case "assistant_message" ->
                emitAssistantUtterance(content(message));
            case "user_message" ->
                emitUserUtterance(content(message));
            case "assistant_end" ->
                emitTurnCompleted();
            case "user_interruption" ->
                LOG.info("🎤 Hume assistant interrupted by user");
            case "error" -> {
                String code = string(message, "code");
                String text = string(message, "message");
                LOG.error("❌ Hume error {}: {}", code, text);
                emitError(code != null ? code : "hume_error", text != null ? text : "Unknown error");
            }
            default ->
                LOG.debug("Unhandled Hume event: {}", type);
        }
    }

    private static String content(JsonObject message) {
        return string(object(message, "message"), "content");
    }

    private void handleAudioOutput(JsonObject message) {
        String data = string(message, "data");
        if (data == null || data.isEmpty()) {
            return;
        }
        WavContainer wav;
        try {
            wav = WavContainer.parse(Base64.getDecoder().decode(data));
        } catch (TranscodeException | IllegalArgumentException e) {
            wavFailures++;
            LOG.warn("⚠ Skipping Hume audio chunk ({} so far): {}", wavFailures, e.getMessage());
            return;
        }
        short[] mono = Pcm16.downmix(wav.decodeSamples(), wav.channels());
        emitAudio(AudioFrame.pcm16Mono(Pcm16.toBytes(mono), wav.sampleRate()));
    }

    @Override
    protected void sendUpstream(AudioFrame frame) {
        JsonObject input = new JsonObject();
        input.addProperty("type", "audio_input");
        input.addProperty("data", Base64.getEncoder().encodeToString(toUpstreamPcm(frame, inputSampleRate)));
        sendJson(input);
    }
}
