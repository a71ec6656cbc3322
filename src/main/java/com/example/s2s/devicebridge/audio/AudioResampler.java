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

package com.example.s2s.devicebridge.audio;

/**
 * Audio resampling utility for converting PCM16 between arbitrary sample rates.
 *
 * Devices capture at 16kHz and play back at 24kHz, while providers speak
 * 16kHz, 24kHz or 48kHz depending on the backend. Every output sample sits at
 * the exact rational source position {@code i * sourceRate / targetRate};
 * positions between two source samples are linearly interpolated. For an
 * integer ratio such as 8kHz to 24kHz every output lands either on a source
 * sample or on one of the two points between it and its neighbour.
 */
public final class AudioResampler {

    private AudioResampler() {
    }

    /**
     * Number of output samples for {@code inputLength} source samples:
     * {@code round(inputLength * targetRate / sourceRate)}, half rounding up.
     */
    public static int outputLength(int inputLength, int sourceRate, int targetRate) {
        long scaled = (long) inputLength * targetRate;
        return (int) ((2 * scaled + sourceRate) / (2L * sourceRate));
    }

    /**
     * Resample 16-bit samples from {@code sourceRate} to {@code targetRate}.
     *
     * @param input      source samples, never modified
     * @param sourceRate source sample rate in Hz
     * @param targetRate target sample rate in Hz
     * @return a new array; the input itself when the rates match
     */
    public static short[] resample(short[] input, int sourceRate, int targetRate) {
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + sourceRate + " -> " + targetRate);
        }
        if (input.length == 0) {
            return new short[0];
        }
        if (sourceRate == targetRate) {
            return input.clone();
        }

        int outLength = outputLength(input.length, sourceRate, targetRate);
        short[] output = new short[outLength];
        int last = input.length - 1;

        for (int i = 0; i < outLength; i++) {
            long position = (long) i * sourceRate;
            int index = (int) (position / targetRate);
            long fraction = position % targetRate;

            if (index >= last) {
                // Past the final source sample: hold it
                output[i] = input[last];
            } else if (fraction == 0) {
                output[i] = input[index];
            } else {
                int current = input[index];
                int next = input[index + 1];
                output[i] = (short) (current + (next - current) * fraction / targetRate);
            }
        }
        return output;
    }

    /**
     * Resample little-endian PCM16 bytes.
     *
     * @param pcm        PCM16 data (little-endian, 2 bytes per sample)
     * @param sourceRate source sample rate in Hz
     * @param targetRate target sample rate in Hz
     * @return resampled PCM16 data
     */
    public static byte[] resample(byte[] pcm, int sourceRate, int targetRate) {
        if (pcm == null || pcm.length == 0) {
            return new byte[0];
        }
        return Pcm16.toBytes(resample(Pcm16.toSamples(pcm), sourceRate, targetRate));
    }
}
