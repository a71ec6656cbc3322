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

import com.azure.ai.voicelive.VoiceLiveAsyncClient;
import com.azure.ai.voicelive.VoiceLiveClientBuilder;
import com.azure.ai.voicelive.VoiceLiveServiceVersion;
import com.azure.ai.voicelive.VoiceLiveSessionAsyncClient;
import com.azure.core.credential.KeyCredential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Thin wrapper over the official Azure SDK client that opens Voice Live sessions.
 */
public class VoiceLiveClient {

    private static final Logger LOG = LoggerFactory.getLogger(VoiceLiveClient.class);

    private final VoiceLiveAsyncClient client;
    private final String endpoint;

    /**
     * Creates a Voice Live client with API key authentication.
     */
    public VoiceLiveClient(String endpoint, String apiKey) {
        this.endpoint = endpoint;
        this.client = new VoiceLiveClientBuilder()
            .endpoint(endpoint)
            .credential(new KeyCredential(apiKey))
            .serviceVersion(VoiceLiveServiceVersion.V2025_10_01)
            .buildAsyncClient();
    }

    /**
     * Starts a session with the specified model.
     *
     * @param model The model to use (e.g., "gpt-realtime")
     * @return Mono that emits the session client when the socket is open
     */
    public Mono<VoiceLiveSessionAsyncClient> startSession(String model) {
        LOG.info("Starting Voice Live session at {} with model: {}", endpoint, model);
        return client.startSession(model)
            .doOnSuccess(s -> LOG.info("Voice Live session started successfully"))
            .doOnError(error -> LOG.error("Failed to start Voice Live session", error));
    }
}
