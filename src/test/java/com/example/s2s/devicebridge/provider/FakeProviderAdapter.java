package com.example.s2s.devicebridge.provider;

import com.example.s2s.devicebridge.audio.AudioFrame;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Adapter driven by the test instead of an upstream.
 */
public class FakeProviderAdapter extends AbstractProviderAdapter {
    public final List<AudioFrame> sent = new CopyOnWriteArrayList<>();
    public volatile ProviderCredentials credentials;
    public volatile String initialTurnText;
    public volatile String systemContext;
    public volatile int openCalls = 0;
    public volatile int closeCalls = 0;
    public volatile int interrupts = 0;
    public volatile boolean readyOnOpen = false;
    public volatile RuntimeException sendFailure;

    public FakeProviderAdapter() {
        this(Duration.ofSeconds(10));
    }

    public FakeProviderAdapter(Duration connectTimeout) {
        super("fake", connectTimeout);
    }

    @Override
    protected void openUpstream(ProviderCredentials credentials, String initialTurnText, String systemContext) {
        openCalls++;
        this.credentials = credentials;
        this.initialTurnText = initialTurnText;
        this.systemContext = systemContext;
        if (readyOnOpen) {
            markReady();
        }
    }

    @Override
    protected void sendUpstream(AudioFrame frame) {
        if (sendFailure != null) {
            throw sendFailure;
        }
        sent.add(frame);
    }

    @Override
    protected void closeUpstream() {
        closeCalls++;
    }

    @Override
    public void interrupt() {
        interrupts++;
    }

    public void ready() {
        markReady();
    }

    public void fail(String message) {
        failConnect(new UpstreamUnavailableException(message));
    }

    public void audio(AudioFrame frame) {
        emitAudio(frame);
    }

    public void turnStarted() {
        emitTurnStarted();
    }

    public void turnCompleted() {
        emitTurnCompleted();
    }

    public void userSaid(String text) {
        emitUserUtterance(text);
    }

    public void assistantSaid(String text) {
        emitAssistantUtterance(text);
    }

    public void error(String code, String message) {
        emitError(code, message);
    }

    public void sessionEnded() {
        emitSessionEnded();
    }

    public void upstreamGone(String reason) {
        upstreamClosed(reason);
    }
}
