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

import java.time.Duration;

/**
 * Wire audio contract of the device: mono PCM16 microphone audio in, fixed
 * duration encoded frames out. Every stage that slices or paces audio reads
 * its frame size from here.
 */
public final class DeviceAudioFormat {

    private final int inputSampleRate;
    private final int outputSampleRate;
    private final int frameDurationMs;

    public DeviceAudioFormat(int inputSampleRate, int outputSampleRate, int frameDurationMs) {
        if (inputSampleRate <= 0 || outputSampleRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive");
        }
        if (frameDurationMs <= 0 || (outputSampleRate * frameDurationMs) % 1000 != 0) {
            throw new IllegalArgumentException("Frame duration " + frameDurationMs
                + "ms does not divide " + outputSampleRate + "Hz into whole samples");
        }
        this.inputSampleRate = inputSampleRate;
        this.outputSampleRate = outputSampleRate;
        this.frameDurationMs = frameDurationMs;
    }

    /**
     * 16kHz microphone, 24kHz speaker, 60ms frames.
     */
    public static DeviceAudioFormat defaults() {
        return new DeviceAudioFormat(16000, 24000, 60);
    }

    public int inputSampleRate() {
        return inputSampleRate;
    }

    public int outputSampleRate() {
        return outputSampleRate;
    }

    public int channels() {
        return 1;
    }

    public int frameDurationMs() {
        return frameDurationMs;
    }

    public Duration frameDuration() {
        return Duration.ofMillis(frameDurationMs);
    }

    /**
     * Samples per outbound frame.
     */
    public int frameSamples() {
        return outputSampleRate * frameDurationMs / 1000;
    }

    /**
     * Bytes per outbound linear PCM frame, before encoding.
     */
    public int frameBytes() {
        return frameSamples() * Pcm16.BYTES_PER_SAMPLE;
    }

    @Override
    public String toString() {
        return "DeviceAudioFormat{in=" + inputSampleRate + "Hz, out=" + outputSampleRate
            + "Hz, frame=" + frameDurationMs + "ms/" + frameBytes() + " bytes}";
    }
}
