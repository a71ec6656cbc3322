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


package com.example.s2s.devicebridge.provider;

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.audio.AudioResampler;
import com.example.s2s.devicebridge.audio.Pcm16;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared lifecycle for adapters: state machine, listener dispatch, readiness
 * signal with a bounded wait, and turn bookkeeping.
 *
 * Subclasses implement {@link #openUpstream}, {@link #sendUpstream} and
 * {@link #closeUpstream}, and report upstream traffic through the
 * {@code emit*} and {@code markReady}/{@code failConnect} helpers.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractProviderAdapter.class);

    private final String name;
    private final Duration connectTimeout;
    private final AtomicReference<AdapterState> state = new AtomicReference<>(AdapterState.CONNECTING);
    private final Sinks.One<Void> ready = Sinks.one();
    private final TurnTracker turns = new TurnTracker();
    private volatile ProviderEventListener listener;

    protected AbstractProviderAdapter(String name, Duration connectTimeout) {
        this.name = name;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public final Mono<Void> connect(ProviderCredentials credentials, String initialTurnText, String systemContext) {
        return Mono.defer(() -> {
                LOG.info("Connecting to {} ({})", name, credentials);
                try {
                    openUpstream(credentials, initialTurnText, systemContext);
                } catch (ProviderException e) {
                    failConnect(e);
                } catch (RuntimeException e) {
                    failConnect(new UpstreamUnavailableException(name + " connect failed: " + e.getMessage(), e));
                }
                return ready.asMono();
            })
            .timeout(connectTimeout)
            .onErrorMap(TimeoutException.class, e -> new ProviderTimeoutException(name, connectTimeout))
            .doOnSuccess(v -> LOG.info("✓ {} ready", name))
            .doOnError(error -> {
                LOG.error("❌ {} connect failed: {}", name, error.getMessage());
                close();
            });
    }

    @Override
    public final void sendAudio(AudioFrame frame) {
        AdapterState current = state.get();
        if (!current.acceptsAudio()) {
            throw new IllegalStateException(name + " cannot accept audio in state " + current);
        }
        sendUpstream(frame);
    }

    @Override
    public final void onEvent(ProviderEventListener listener) {
        this.listener = listener;
    }

    @Override
    public final void close() {
        AdapterState previous = state.getAndUpdate(s -> s == AdapterState.CLOSED ? s : AdapterState.CLOSING);
        if (previous.isTerminal()) {
            return;
        }
        LOG.info("Closing {} adapter (was {})", name, previous);
        try {
            closeUpstream();
        } catch (RuntimeException e) {
            LOG.warn("Error releasing {} upstream: {}", name, e.getMessage());
        } finally {
            state.set(AdapterState.CLOSED);
            ready.tryEmitError(new UpstreamUnavailableException(name + " closed before ready"));
        }
    }

    @Override
    public final AdapterState state() {
        return state.get();
    }

    @Override
    public final String name() {
        return name;
    }

    protected abstract void openUpstream(ProviderCredentials credentials, String initialTurnText, String systemContext);

    protected abstract void sendUpstream(AudioFrame frame);

    protected abstract void closeUpstream();

    // ---------------------------------------------------------------- helpers

    /**
     * Readiness acknowledgment from the upstream. Only the first call counts.
     */
    protected final void markReady() {
        if (state.compareAndSet(AdapterState.CONNECTING, AdapterState.READY)) {
            ready.tryEmitEmpty();
        }
    }

    /**
     * Connect-phase failure: completes the pending connect with an error.
     */
    protected final void failConnect(ProviderException error) {
        if (state.get() == AdapterState.CONNECTING) {
            ready.tryEmitError(error);
        }
    }

    /**
     * Upstream went away. Fails a pending connect, or reports the loss to the
     * session once bridging.
     */
    protected final void upstreamClosed(String reason) {
        AdapterState current = state.get();
        if (current == AdapterState.CONNECTING) {
            failConnect(new UpstreamUnavailableException(name + " closed during connect: " + reason));
            return;
        }
        if (current.isTerminal()) {
            return;
        }
        LOG.info("{} upstream closed: {}", name, reason);
        state.set(AdapterState.CLOSED);
        dispatch(ProviderEvent.sessionEnded());
    }

    protected final void emitAudio(AudioFrame frame) {
        emitTurnStarted();
        dispatch(ProviderEvent.audioChunkReceived(frame));
    }

    protected final void emitTurnStarted() {
        if (turns.begin()) {
            state.compareAndSet(AdapterState.READY, AdapterState.ACTIVE);
            dispatch(ProviderEvent.turnStarted());
        }
    }

    protected final void emitTurnCompleted() {
        if (turns.end()) {
            state.compareAndSet(AdapterState.ACTIVE, AdapterState.READY);
            dispatch(ProviderEvent.turnCompleted());
        }
    }

    protected final void emitUserUtterance(String text) {
        if (text != null && !text.isBlank()) {
            dispatch(ProviderEvent.userUtteranceTranscribed(text));
        }
    }

    protected final void emitAssistantUtterance(String text) {
        if (text != null && !text.isBlank()) {
            dispatch(ProviderEvent.assistantUtteranceProduced(text));
        }
    }

    protected final void emitSessionEnded() {
        dispatch(ProviderEvent.sessionEnded());
    }

    /**
     * Upstream error. Before readiness this fails the connect instead.
     */
    protected final void emitError(String code, String message) {
        if (state.get() == AdapterState.CONNECTING) {
            failConnect(new UpstreamUnavailableException(name + " error " + code + ": " + message));
            return;
        }
        dispatch(ProviderEvent.upstreamError(code, message));
    }

    protected final boolean isOpen() {
        return !state.get().isTerminal();
    }

    protected final boolean inTurn() {
        return turns.inTurn();
    }

    /**
     * Mono PCM16 bytes of {@code frame} at {@code targetRate}.
     */
    protected static byte[] toUpstreamPcm(AudioFrame frame, int targetRate) {
        if (frame.channels() == 1 && frame.sampleRate() == targetRate) {
            return frame.data();
        }
        short[] mono = Pcm16.downmix(frame.samples(), frame.channels());
        return Pcm16.toBytes(AudioResampler.resample(mono, frame.sampleRate(), targetRate));
    }

    private void dispatch(ProviderEvent event) {
        ProviderEventListener current = listener;
        if (current == null) {
            LOG.debug("{}: no listener for {}", name, event);
            return;
        }
        try {
            current.onEvent(event);
        } catch (RuntimeException e) {
            LOG.error("{}: listener failed on {}", name, event.type(), e);
        }
    }
}
