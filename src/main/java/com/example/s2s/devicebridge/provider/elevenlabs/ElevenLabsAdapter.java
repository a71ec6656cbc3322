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

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.provider.AbstractWebSocketProviderAdapter;
import com.example.s2s.devicebridge.provider.AdapterState;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.UpstreamUnavailableException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter for ElevenLabs Conversational AI agents.
 *
 * Connecting is two steps: a signed conversation URL is requested over REST
 * with the API key, then the WebSocket is opened on that URL. The session is
 * ready when {@code conversation_initiation_metadata} arrives; it also names
 * the PCM rates the agent speaks and listens at.
 */
public class ElevenLabsAdapter extends AbstractWebSocketProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(ElevenLabsAdapter.class);

    public static final String TAG = "elevenlabs";
    static final int DEFAULT_SAMPLE_RATE = 16000;
    private static final Pattern PCM_FORMAT = Pattern.compile("pcm_(\\d+)");

    private final ElevenLabsConfig config;
    private volatile int outputSampleRate = DEFAULT_SAMPLE_RATE;
    private volatile int inputSampleRate = DEFAULT_SAMPLE_RATE;

    public ElevenLabsAdapter(ElevenLabsConfig config, OkHttpClient httpClient, Duration connectTimeout) {
        super(TAG, connectTimeout, httpClient);
        this.config = config;
    }

    /**
     * The signed URL request; the upgrade request itself is built from its answer.
     */
    @Override
    protected Request buildRequest(ProviderCredentials credentials) {
        return new Request.Builder()
            .url(config.buildSignedUrlEndpoint(credentials.getResourceId()))
            .addHeader("xi-api-key", credentials.getApiKey())
            .get()
            .build();
    }

    @Override
    protected void dial(Request signedUrlRequest) {
        requestSignedUrl(signedUrlRequest);
    }

    private void requestSignedUrl(Request request) {
        LOG.info("Requesting ElevenLabs signed URL");
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                failConnect(new UpstreamUnavailableException("ElevenLabs signed URL request failed", e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    if (!response.isSuccessful() || body == null) {
                        failConnect(new UpstreamUnavailableException(
                            "Failed to get signed URL: " + response.code() + " " + response.message()));
                        return;
                    }
                    String signedUrl = string(JsonParser.parseString(body.string()).getAsJsonObject(), "signed_url");
                    if (signedUrl == null || signedUrl.isEmpty()) {
                        failConnect(new UpstreamUnavailableException("Signed URL response had no signed_url"));
                        return;
                    }
                    if (!isOpen()) {
                        LOG.info("ElevenLabs adapter closed while negotiating, not opening socket");
                        return;
                    }
                    openSocket(new Request.Builder().url(signedUrl).build());
                } catch (IOException | JsonParseException | IllegalStateException e) {
                    failConnect(new UpstreamUnavailableException("Unreadable signed URL response", e));
                }
            }
        });
    }

    @Override
    protected void onSocketOpen() {
        JsonObject prompt = new JsonObject();
        if (systemContext() != null) {
            prompt.addProperty("prompt", systemContext());
        }
        JsonObject agent = new JsonObject();
        agent.add("prompt", prompt);
        if (initialTurnText() != null) {
            agent.addProperty("first_message", initialTurnText());
        }
        JsonObject override = new JsonObject();
        override.add("agent", agent);

        JsonObject initiation = new JsonObject();
        initiation.addProperty("type", "conversation_initiation_client_data");
        initiation.add("conversation_config_override", override);
        sendJson(initiation);
    }

    @Override
    protected void onJson(JsonObject message) {
        String type = type(message);
        if (type == null) {
            LOG.debug("Ignoring untyped ElevenLabs message");
            return;
        }
        switch (type) {
            case "conversation_initiation_metadata" ->
                handleInitiationMetadata(object(message, "conversation_initiation_metadata_event"));
            case "ping" ->
                handlePing(object(message, "ping_event"));
            case "audio" ->
                handleAudio(object(message, "audio_event"));
            case "user_transcript" ->
                handleUserTranscript(object(message, "user_transcription_event"));
            case "agent_response" ->
                handleAgentResponse(object(message, "agent_response_event"));
            case "interruption" ->
                LOG.info("🎤 ElevenLabs agent interrupted by user");
            case "vad_score", "internal_tentative_agent_response" ->
                LOG.trace("ElevenLabs {}", type);
            case "conversation_end" -> {
                LOG.info("ElevenLabs conversation ended");
                emitSessionEnded();
            }
            default ->
                LOG.debug("Unhandled ElevenLabs event: {}", type);
        }
    }

    private void handleInitiationMetadata(JsonObject event) {
        if (event != null) {
            outputSampleRate = parseRate(string(event, "agent_output_audio_format"), outputSampleRate);
            inputSampleRate = parseRate(string(event, "user_input_audio_format"), inputSampleRate);
            LOG.info("✓ ElevenLabs conversation {} (in {}Hz, out {}Hz)",
                string(event, "conversation_id"), inputSampleRate, outputSampleRate);
        }
        if (state() == AdapterState.CONNECTING) {
            markReady();
        }
    }

    static int parseRate(String format, int fallback) {
        if (format == null) {
            return fallback;
        }
        Matcher matcher = PCM_FORMAT.matcher(format);
        if (!matcher.find()) {
            LOG.warn("⚠ Unsupported ElevenLabs audio format '{}', assuming {}Hz PCM", format, fallback);
            return fallback;
        }
        return Integer.parseInt(matcher.group(1));
    }

    private void handlePing(JsonObject event) {
        String eventId = string(event, "event_id");
        if (eventId == null) {
            return;
        }
        JsonObject pong = new JsonObject();
        pong.addProperty("type", "pong");
        pong.addProperty("event_id", Long.parseLong(eventId));
        sendJson(pong);
    }

    private void handleAudio(JsonObject event) {
        String audio = string(event, "audio_base_64");
        if (audio == null || audio.isEmpty()) {
            return;
        }
        emitAudio(AudioFrame.pcm16Mono(Base64.getDecoder().decode(audio), outputSampleRate));
    }

    private void handleUserTranscript(JsonObject event) {
        String transcript = string(event, "user_transcript");
        if (transcript == null || transcript.isBlank()) {
            return;
        }
        emitUserUtterance(transcript);
        emitTurnStarted();
    }

    private void handleAgentResponse(JsonObject event) {
        String response = string(event, "agent_response");
        if (response == null || response.isBlank()) {
            return;
        }
        emitAssistantUtterance(response);
        emitTurnCompleted();
    }

    @Override
    protected void sendUpstream(AudioFrame frame) {
        JsonObject chunk = new JsonObject();
        chunk.addProperty("user_audio_chunk",
            Base64.getEncoder().encodeToString(toUpstreamPcm(frame, inputSampleRate)));
        sendJson(chunk);
    }

    @Override
    public void interrupt() {
        JsonObject activity = new JsonObject();
        activity.addProperty("type", "user_activity");
        sendJson(activity);
    }
}
