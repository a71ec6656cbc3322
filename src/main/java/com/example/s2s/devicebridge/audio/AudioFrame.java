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

package com.example.s2s.devicebridge.audio;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable chunk of audio tagged with its encoding.
 * The payload is copied on the way in and on the way out, so no stage can
 * mutate a frame another stage still holds.
 */
public final class AudioFrame {

    /**
     * Payload encodings that travel through the bridge.
     */
    public enum Codec {
        /** 16-bit signed little-endian linear PCM. */
        PCM16,
        /** One Opus packet. */
        OPUS
    }

    private final byte[] data;
    private final Codec codec;
    private final int sampleRate;
    private final int channels;

    private AudioFrame(byte[] data, Codec codec, int sampleRate, int channels) {
        Objects.requireNonNull(data, "data");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive");
        }
        this.data = data.clone();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    public static AudioFrame pcm16(byte[] data, int sampleRate, int channels) {
        return new AudioFrame(data, Codec.PCM16, sampleRate, channels);
    }

    public static AudioFrame pcm16Mono(byte[] data, int sampleRate) {
        return new AudioFrame(data, Codec.PCM16, sampleRate, 1);
    }

    public static AudioFrame opus(byte[] packet, int sampleRate, int channels) {
        return new AudioFrame(packet, Codec.OPUS, sampleRate, channels);
    }

    /**
     * @return a copy of the payload
     */
    public byte[] data() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    public Codec codec() {
        return codec;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int channels() {
        return channels;
    }

    public boolean isPcm() {
        return codec == Codec.PCM16;
    }

    /**
     * Decodes the payload as little-endian PCM16 samples.
     */
    public short[] samples() {
        if (codec != Codec.PCM16) {
            throw new IllegalStateException("Frame is " + codec + ", not PCM16");
        }
        return Pcm16.toSamples(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame)) {
            return false;
        }
        AudioFrame other = (AudioFrame) o;
        return sampleRate == other.sampleRate
            && channels == other.channels
            && codec == other.codec
            && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(codec, sampleRate, channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "AudioFrame{" + codec + ", " + sampleRate + "Hz, " + channels + "ch, " + data.length + " bytes}";
    }
}
