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
import reactor.core.publisher.Mono;

/**
 * One upstream realtime voice endpoint presented as a bidirectional
 * audio + event channel with an explicit readiness transition.
 *
 * Instances are single use: one {@link #connect} per adapter, then
 * {@link #close()}.
 */
public interface ProviderAdapter {

    /**
     * Opens the upstream session and completes once the upstream has
     * acknowledged readiness.
     *
     * @param credentials     upstream key and resource
     * @param initialTurnText text the assistant should answer first (may be null)
     * @param systemContext   system prompt for the session (may be null)
     * @return Mono completing on readiness, failing with
     *         {@link UpstreamUnavailableException} or {@link ProviderTimeoutException}
     */
    Mono<Void> connect(ProviderCredentials credentials, String initialTurnText, String systemContext);

    /**
     * Sends microphone audio upstream.
     *
     * @param frame device PCM16 audio
     * @throws IllegalStateException if the adapter is not ready
     */
    void sendAudio(AudioFrame frame);

    /**
     * Registers the single event handler. Events before registration are dropped.
     */
    void onEvent(ProviderEventListener listener);

    /**
     * Barge-in: asks the upstream to stop the response in progress.
     */
    default void interrupt() {
    }

    /**
     * Releases upstream resources. Safe to call more than once.
     */
    void close();

    AdapterState state();

    /**
     * @return short provider tag, used in logs and error codes
     */
    String name();
}
