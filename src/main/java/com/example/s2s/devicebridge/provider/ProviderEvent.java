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


package com.example.s2s.devicebridge.provider;

import com.example.s2s.devicebridge.audio.AudioFrame;

import java.util.Objects;

/**
 * One upstream event, normalized to the closed set every adapter maps onto.
 */
public final class ProviderEvent {

    public enum Type {
        AUDIO_CHUNK_RECEIVED,
        USER_UTTERANCE_TRANSCRIBED,
        ASSISTANT_UTTERANCE_PRODUCED,
        TURN_STARTED,
        TURN_COMPLETED,
        SESSION_ENDED,
        UPSTREAM_ERROR
    }

    private static final ProviderEvent TURN_STARTED = new ProviderEvent(Type.TURN_STARTED, null, null, null);
    private static final ProviderEvent TURN_COMPLETED = new ProviderEvent(Type.TURN_COMPLETED, null, null, null);
    private static final ProviderEvent SESSION_ENDED = new ProviderEvent(Type.SESSION_ENDED, null, null, null);

    private final Type type;
    private final AudioFrame audio;
    private final String text;
    private final String code;

    private ProviderEvent(Type type, AudioFrame audio, String text, String code) {
        this.type = type;
        this.audio = audio;
        this.text = text;
        this.code = code;
    }

    public static ProviderEvent audioChunkReceived(AudioFrame frame) {
        return new ProviderEvent(Type.AUDIO_CHUNK_RECEIVED, Objects.requireNonNull(frame, "frame"), null, null);
    }

    public static ProviderEvent userUtteranceTranscribed(String text) {
        return new ProviderEvent(Type.USER_UTTERANCE_TRANSCRIBED, null, text, null);
    }

    public static ProviderEvent assistantUtteranceProduced(String text) {
        return new ProviderEvent(Type.ASSISTANT_UTTERANCE_PRODUCED, null, text, null);
    }

    public static ProviderEvent turnStarted() {
        return TURN_STARTED;
    }

    public static ProviderEvent turnCompleted() {
        return TURN_COMPLETED;
    }

    public static ProviderEvent sessionEnded() {
        return SESSION_ENDED;
    }

    public static ProviderEvent upstreamError(String code, String message) {
        return new ProviderEvent(Type.UPSTREAM_ERROR, null, message, code);
    }

    public Type type() {
        return type;
    }

    /**
     * @return the audio of an AUDIO_CHUNK_RECEIVED event, otherwise null
     */
    public AudioFrame audio() {
        return audio;
    }

    /**
     * @return utterance text, or the message of an UPSTREAM_ERROR
     */
    public String text() {
        return text;
    }

    /**
     * @return upstream error code of an UPSTREAM_ERROR, otherwise null
     */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return switch (type) {
            case AUDIO_CHUNK_RECEIVED -> "ProviderEvent{" + type + ", " + audio + "}";
            case UPSTREAM_ERROR -> "ProviderEvent{" + type + ", code=" + code + ", message=" + text + "}";
            case USER_UTTERANCE_TRANSCRIBED, ASSISTANT_UTTERANCE_PRODUCED ->
                "ProviderEvent{" + type + ", text=" + text + "}";
            default -> "ProviderEvent{" + type + "}";
        };
    }
}
