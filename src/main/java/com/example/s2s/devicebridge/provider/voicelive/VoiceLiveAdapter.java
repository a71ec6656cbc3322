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


package com.example.s2s.devicebridge.provider.voicelive;

import com.azure.ai.voicelive.VoiceLiveSessionAsyncClient;
import com.azure.ai.voicelive.models.AudioEchoCancellation;
import com.azure.ai.voicelive.models.AudioInputTranscriptionOptions;
import com.azure.ai.voicelive.models.AudioInputTranscriptionOptionsModel;
import com.azure.ai.voicelive.models.AudioNoiseReduction;
import com.azure.ai.voicelive.models.AudioNoiseReductionType;
import com.azure.ai.voicelive.models.AzureSemanticVadTurnDetection;
import com.azure.ai.voicelive.models.AzureStandardVoice;
import com.azure.ai.voicelive.models.ClientEventResponseCreate;
import com.azure.ai.voicelive.models.ClientEventSessionUpdate;
import com.azure.ai.voicelive.models.InputAudioFormat;
import com.azure.ai.voicelive.models.InteractionModality;
import com.azure.ai.voicelive.models.OutputAudioFormat;
import com.azure.ai.voicelive.models.SessionUpdate;
import com.azure.ai.voicelive.models.SessionUpdateConversationItemInputAudioTranscriptionCompleted;
import com.azure.ai.voicelive.models.SessionUpdateError;
import com.azure.ai.voicelive.models.SessionUpdateInputAudioBufferSpeechStarted;
import com.azure.ai.voicelive.models.SessionUpdateInputAudioBufferSpeechStopped;
import com.azure.ai.voicelive.models.SessionUpdateResponseAudioDelta;
import com.azure.ai.voicelive.models.SessionUpdateResponseAudioDone;
import com.azure.ai.voicelive.models.SessionUpdateResponseTextDelta;
import com.azure.ai.voicelive.models.SessionUpdateSessionCreated;
import com.azure.ai.voicelive.models.SessionUpdateSessionUpdated;
import com.azure.ai.voicelive.models.VoiceLiveSessionOptions;
import com.azure.core.util.BinaryData;
import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.provider.AbstractProviderAdapter;
import com.example.s2s.devicebridge.provider.AdapterState;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Arrays;
import java.util.function.Function;

/**
 * Handles audio streaming between the device (PCM16 16kHz) and Voice Live API (PCM16 24kHz).
 * Uses the official Azure SDK with its session-based API and typed event models.
 *
 * Connect sequence: start session → subscribe to events → session.update →
 * ready on session.updated → response.create (assistant speaks first).
 */
public class VoiceLiveAdapter extends AbstractProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(VoiceLiveAdapter.class);

    public static final String TAG = "voicelive";

    // Audio chunk buffering for smoother streaming
    private static final int MIN_CHUNK_SIZE_MS = 100;
    static final int SAMPLE_RATE = 24000;
    private static final int BYTES_PER_SAMPLE = 2;
    private static final int MIN_CHUNK_SIZE_BYTES = (MIN_CHUNK_SIZE_MS * SAMPLE_RATE * BYTES_PER_SAMPLE) / 1000;

    private final VoiceLiveConfig config;
    private final Function<ProviderCredentials, VoiceLiveClient> clientFactory;

    private volatile VoiceLiveSessionAsyncClient session;
    private volatile Disposable sessionStart;
    private volatile Disposable eventSubscription;
    private final StringBuilder responseText = new StringBuilder();
    private volatile boolean greetingSent = false;

    private final byte[] audioBuffer = new byte[MIN_CHUNK_SIZE_BYTES];
    private int bufferPos = 0;

    public VoiceLiveAdapter(VoiceLiveConfig config, Duration connectTimeout) {
        this(config, connectTimeout, credentials -> new VoiceLiveClient(config.getEndpoint(), credentials.getApiKey()));
    }

    VoiceLiveAdapter(VoiceLiveConfig config, Duration connectTimeout,
                     Function<ProviderCredentials, VoiceLiveClient> clientFactory) {
        super(TAG, connectTimeout);
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    protected void openUpstream(ProviderCredentials credentials, String initialTurnText, String systemContext) {
        String voice = credentials.getResourceId() != null && !credentials.getResourceId().isEmpty()
            ? credentials.getResourceId() : config.getVoice();
        VoiceLiveSessionOptions options = createSessionOptions(instructions(systemContext, initialTurnText), voice);

        sessionStart = clientFactory.apply(credentials)
            .startSession(config.getModel())
            .flatMap(started -> {
                this.session = started;
                if (!isOpen()) {
                    return Mono.<Void>empty();
                }
                // Subscribe to all session events with typed handlers
                eventSubscription = started.receiveEvents()
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(
                        this::handleEvent,
                        this::handleStreamError,
                        () -> upstreamClosed("Voice Live event stream completed")
                    );
                return started.sendEvent(new ClientEventSessionUpdate(options))
                    .doOnSuccess(v -> LOG.info("Session configuration sent successfully"));
            })
            .subscribe(
                v -> { },
                error -> failConnect(new UpstreamUnavailableException(
                    "Voice Live session failed: " + error.getMessage(), error))
            );
    }

    /**
     * Voice Live has no separate first-message channel; the opening line is
     * folded into the session instructions and triggered by response.create.
     */
    private String instructions(String systemContext, String initialTurnText) {
        String base = systemContext != null && !systemContext.isBlank() ? systemContext : config.getInstructions();
        if (initialTurnText == null || initialTurnText.isBlank()) {
            return base;
        }
        return base + "\n\nOpen the conversation by responding to: " + initialTurnText;
    }

    /**
     * Creates session options with Voice Live enhancements.
     */
    private VoiceLiveSessionOptions createSessionOptions(String instructions, String voice) {
        AzureSemanticVadTurnDetection vad = new AzureSemanticVadTurnDetection()
            .setThreshold(0.3)
            .setPrefixPaddingMs(300)
            .setSilenceDurationMs(500)
            .setInterruptResponse(true)
            .setAutoTruncate(true)
            .setCreateResponse(true);

        AudioInputTranscriptionOptionsModel transcriptionModelEnum =
            "WHISPER_1".equalsIgnoreCase(config.getTranscriptionModel())
                ? AudioInputTranscriptionOptionsModel.WHISPER_1
                : AudioInputTranscriptionOptionsModel.AZURE_SPEECH;
        AudioInputTranscriptionOptions transcription = new AudioInputTranscriptionOptions(transcriptionModelEnum);

        // Whisper auto-detects the language
        if (transcriptionModelEnum == AudioInputTranscriptionOptionsModel.AZURE_SPEECH) {
            transcription.setLanguage(config.getTranscriptionLanguage());
        }

        return new VoiceLiveSessionOptions()
            .setInstructions(instructions)
            .setModalities(Arrays.asList(InteractionModality.TEXT, InteractionModality.AUDIO))
            .setVoice(BinaryData.fromObject(new AzureStandardVoice(voice)))
            .setInputAudioFormat(InputAudioFormat.PCM16)
            .setOutputAudioFormat(OutputAudioFormat.PCM16)
            .setInputAudioSamplingRate(SAMPLE_RATE)
            .setTurnDetection(vad)
            .setInputAudioNoiseReduction(new AudioNoiseReduction(AudioNoiseReductionType.AZURE_DEEP_NOISE_SUPPRESSION))
            .setInputAudioEchoCancellation(new AudioEchoCancellation())
            .setInputAudioTranscription(transcription);
    }

    /**
     * Maps typed SDK events onto provider events.
     */
    void handleEvent(SessionUpdate event) {
        String type = String.valueOf(event.getType());
        LOG.debug("📩 Received event: {}", type);

        if (event instanceof SessionUpdateSessionCreated) {
            LOG.info("✓ Voice Live session created: {}", ((SessionUpdateSessionCreated) event).getSession().getId());
        } else if (event instanceof SessionUpdateSessionUpdated) {
            handleSessionUpdated();
        } else if (event instanceof SessionUpdateResponseAudioDelta) {
            handleResponseAudioDelta((SessionUpdateResponseAudioDelta) event);
        } else if (event instanceof SessionUpdateResponseAudioDone) {
            LOG.info("✓ Response audio complete");
            completeTurn();
        } else if (event instanceof SessionUpdateResponseTextDelta) {
            String delta = ((SessionUpdateResponseTextDelta) event).getDelta();
            if (delta != null && !delta.isEmpty()) {
                synchronized (responseText) {
                    responseText.append(delta);
                }
            }
        } else if (event instanceof SessionUpdateInputAudioBufferSpeechStarted) {
            // Voice Live handles interruptions server-side via setInterruptResponse(true)
            LOG.info("🎤 Speech detected");
        } else if (event instanceof SessionUpdateInputAudioBufferSpeechStopped) {
            LOG.info("🤔 Speech ended - processing...");
        } else if (event instanceof SessionUpdateConversationItemInputAudioTranscriptionCompleted) {
            String transcript = ((SessionUpdateConversationItemInputAudioTranscriptionCompleted) event).getTranscript();
            LOG.info("✓ User said: {}", transcript);
            emitUserUtterance(transcript);
        } else if (event instanceof SessionUpdateError) {
            var error = ((SessionUpdateError) event).getError();
            String message = error != null ? error.toString() : "Unknown error";
            LOG.error("❌ Voice Live error: {}", message);
            emitError("voicelive_error", message);
        } else if ("response.created".equals(type)) {
            emitTurnStarted();
        } else if ("response.done".equals(type)) {
            completeTurn();
        } else {
            LOG.debug("Unhandled event type: {}", type);
        }
    }

    private void handleSessionUpdated() {
        if (state() != AdapterState.CONNECTING) {
            return;
        }
        LOG.info("✓ Voice Live session configured successfully");
        markReady();

        if (config.isProactiveGreetingEnabled() && !greetingSent) {
            greetingSent = true;
            session.sendEvent(new ClientEventResponseCreate())
                .doOnSuccess(v -> LOG.info("✓ Proactive greeting request sent - assistant will speak first"))
                .doOnError(error -> LOG.error("❌ Failed to send proactive greeting request", error))
                .onErrorResume(error -> Mono.empty())
                .subscribe();
        }
    }

    private void handleResponseAudioDelta(SessionUpdateResponseAudioDelta event) {
        byte[] audioData = event.getDelta();
        if (audioData == null || audioData.length == 0) {
            return;
        }
        emitAudio(AudioFrame.pcm16Mono(audioData, SAMPLE_RATE));
    }

    /**
     * Audio done and response done both end a turn; the tracker keeps the second one silent.
     */
    private void completeTurn() {
        String text;
        synchronized (responseText) {
            text = responseText.toString();
            responseText.setLength(0);
        }
        emitAssistantUtterance(text);
        emitTurnCompleted();
    }

    private void handleStreamError(Throwable error) {
        LOG.error("Error receiving Voice Live events", error);
        if (state() == AdapterState.CONNECTING) {
            failConnect(new UpstreamUnavailableException("Voice Live event stream failed", error));
        } else {
            emitError("voicelive_stream_error", String.valueOf(error.getMessage()));
            upstreamClosed("event stream error");
        }
    }

    /**
     * Buffers device audio into 100ms chunks at 24kHz before sending.
     */
    @Override
    protected synchronized void sendUpstream(AudioFrame frame) {
        byte[] pcm = toUpstreamPcm(frame, SAMPLE_RATE);
        int remaining = pcm.length;
        int sourceOffset = 0;

        while (remaining > 0) {
            int bytesToCopy = Math.min(remaining, audioBuffer.length - bufferPos);
            System.arraycopy(pcm, sourceOffset, audioBuffer, bufferPos, bytesToCopy);
            bufferPos += bytesToCopy;
            sourceOffset += bytesToCopy;
            remaining -= bytesToCopy;

            if (bufferPos >= audioBuffer.length) {
                byte[] chunkToSend = audioBuffer.clone();
                bufferPos = 0;
                sendChunk(chunkToSend);
            }
        }
    }

    private void sendChunk(byte[] chunk) {
        VoiceLiveSessionAsyncClient current = session;
        if (current == null) {
            return;
        }
        current.sendInputAudio(BinaryData.fromBytes(chunk))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> LOG.trace("Sent audio chunk: {} bytes", chunk.length))
            .subscribe(
                v -> { },
                error -> LOG.warn("Error sending audio chunk: {}", error.getMessage())
            );
    }

    @Override
    protected void closeUpstream() {
        dispose(sessionStart);
        dispose(eventSubscription);
        Object current = session;
        session = null;
        if (current instanceof AutoCloseable) {
            try {
                ((AutoCloseable) current).close();
            } catch (Exception e) {
                LOG.warn("Error closing Voice Live session: {}", e.getMessage());
            }
        }
        synchronized (this) {
            bufferPos = 0;
        }
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null && !disposable.isDisposed()) {
            disposable.dispose();
        }
    }
}
