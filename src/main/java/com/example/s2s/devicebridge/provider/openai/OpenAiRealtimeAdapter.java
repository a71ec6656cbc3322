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

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.provider.AbstractWebSocketProviderAdapter;
import com.example.s2s.devicebridge.provider.AdapterState;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;

/**
 * Adapter for the OpenAI Realtime WebSocket protocol.
 *
 * Audio flow: device PCM16 16kHz → resample → PCM16 24kHz (input_audio_buffer.append)
 *             response.audio.delta PCM16 24kHz → device
 *
 * Ready once {@code session.updated} confirms the session configuration; the
 * initial turn text is then posted as a user message followed by
 * {@code response.create}.
 */
public class OpenAiRealtimeAdapter extends AbstractWebSocketProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiRealtimeAdapter.class);

    public static final String TAG = "openai";
    static final int UPSTREAM_SAMPLE_RATE = 24000;

    private final OpenAiRealtimeConfig config;
    private volatile String voice;

    public OpenAiRealtimeAdapter(OpenAiRealtimeConfig config, OkHttpClient httpClient, Duration connectTimeout) {
        super(TAG, connectTimeout, httpClient);
        this.config = config;
    }

    @Override
    protected Request buildRequest(ProviderCredentials credentials) {
        String resource = credentials.getResourceId();
        voice = resource != null && !resource.isEmpty() ? resource : config.getVoice();
        return new Request.Builder()
            .url(config.buildWebSocketUrl())
            .addHeader("Authorization", "Bearer " + credentials.getApiKey())
            .addHeader("OpenAI-Beta", "realtime=v1")
            .build();
    }

    @Override
    protected void onSocketOpen() {
        sendJson(sessionUpdate());
    }

    private JsonObject sessionUpdate() {
        JsonObject turnDetection = new JsonObject();
        turnDetection.addProperty("type", "server_vad");

        JsonObject transcription = new JsonObject();
        transcription.addProperty("model", config.getTranscriptionModel());

        JsonArray modalities = new JsonArray();
        modalities.add("text");
        modalities.add("audio");

        JsonObject session = new JsonObject();
        session.add("modalities", modalities);
        session.addProperty("voice", voice);
        session.addProperty("input_audio_format", "pcm16");
        session.addProperty("output_audio_format", "pcm16");
        session.add("turn_detection", turnDetection);
        session.add("input_audio_transcription", transcription);
        if (systemContext() != null) {
            session.addProperty("instructions", systemContext());
        }

        JsonObject message = new JsonObject();
        message.addProperty("type", "session.update");
        message.add("session", session);
        return message;
    }

    @Override
    protected void onJson(JsonObject message) {
        String type = type(message);
        if (type == null) {
            LOG.debug("Ignoring untyped OpenAI message");
            return;
        }
        switch (type) {
            case "session.created" ->
                LOG.info("✓ OpenAI session created");
            case "session.updated" ->
                handleSessionUpdated();
            case "response.created" ->
                emitTurnStarted();
            case "response.audio.delta" ->
                handleAudioDelta(message);
            case "response.audio_transcript.done" ->
                emitAssistantUtterance(string(message, "transcript"));
            case "conversation.item.input_audio_transcription.completed" ->
                emitUserUtterance(string(message, "transcript"));
            case "input_audio_buffer.speech_started" ->
                LOG.debug("🎤 Speech detected");
            case "response.done" ->
                emitTurnCompleted();
            case "error" ->
                handleError(message);
            default ->
                LOG.debug("Unhandled OpenAI event: {}", type);
        }
    }

    private void handleSessionUpdated() {
        if (state() != AdapterState.CONNECTING) {
            LOG.debug("OpenAI session re-configured");
            return;
        }
        markReady();
        String text = initialTurnText();
        if (text != null && !text.isBlank()) {
            sendJson(userText(text));
        }
        JsonObject create = new JsonObject();
        create.addProperty("type", "response.create");
        sendJson(create);
    }

    private static JsonObject userText(String text) {
        JsonObject content = new JsonObject();
        content.addProperty("type", "input_text");
        content.addProperty("text", text);
        JsonArray contents = new JsonArray();
        contents.add(content);

        JsonObject item = new JsonObject();
        item.addProperty("type", "message");
        item.addProperty("role", "user");
        item.add("content", contents);

        JsonObject message = new JsonObject();
        message.addProperty("type", "conversation.item.create");
        message.add("item", item);
        return message;
    }

    private void handleAudioDelta(JsonObject message) {
        String delta = string(message, "delta");
        if (delta == null || delta.isEmpty()) {
            return;
        }
        byte[] pcm = Base64.getDecoder().decode(delta);
        emitAudio(AudioFrame.pcm16Mono(pcm, UPSTREAM_SAMPLE_RATE));
    }

    private void handleError(JsonObject message) {
        JsonObject error = object(message, "error");
        String code = error != null && string(error, "code") != null ? string(error, "code") : "openai_error";
        String text = error != null ? string(error, "message") : null;
        LOG.error("❌ OpenAI error {}: {}", code, text);
        emitError(code, text != null ? text : "Unknown error");
    }

    @Override
    protected void sendUpstream(AudioFrame frame) {
        byte[] pcm = toUpstreamPcm(frame, UPSTREAM_SAMPLE_RATE);
        JsonObject append = new JsonObject();
        append.addProperty("type", "input_audio_buffer.append");
        append.addProperty("audio", Base64.getEncoder().encodeToString(pcm));
        sendJson(append);
    }

    @Override
    public void interrupt() {
        if (!inTurn()) {
            return;
        }
        LOG.info("Cancelling OpenAI response in progress");
        JsonObject cancel = new JsonObject();
        cancel.addProperty("type", "response.cancel");
        sendJson(cancel);
    }
}
