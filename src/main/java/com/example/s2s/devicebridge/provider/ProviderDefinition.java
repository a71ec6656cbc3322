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

import com.example.s2s.devicebridge.audio.GainLimiter;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A configured provider: how to build a fresh adapter, the default
 * credentials, and the gain its output needs on the device.
 */
public final class ProviderDefinition {
    private final String tag;
    private final Supplier<ProviderAdapter> factory;
    private final ProviderCredentials credentials;
    private final GainLimiter outputGain;

    public ProviderDefinition(String tag, Supplier<ProviderAdapter> factory,
                              ProviderCredentials credentials, GainLimiter outputGain) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.outputGain = outputGain != null ? outputGain : GainLimiter.unity();
    }

    public ProviderDefinition(String tag, Supplier<ProviderAdapter> factory, ProviderCredentials credentials) {
        this(tag, factory, credentials, GainLimiter.unity());
    }

    public String getTag() {
        return tag;
    }

    /**
     * @return a new, unconnected adapter
     */
    public ProviderAdapter newAdapter() {
        return factory.get();
    }

    public ProviderCredentials getCredentials() {
        return credentials;
    }

    public GainLimiter getOutputGain() {
        return outputGain;
    }

    @Override
    public String toString() {
        return "ProviderDefinition{tag='" + tag + "', " + credentials + "}";
    }
}
