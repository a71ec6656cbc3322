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

package com.example.s2s.devicebridge.audio.transcode;

/**
 * A utility for converting µ-law (G.711) encoded audio to Linear PCM.
 *
 * Input: 8-bit µ-law samples, 1 byte per sample
 * Output: 16-bit samples, 2 bytes per sample
 *
 * Expansion follows ITU-T G.711 exactly: 0xFF decodes to 0 and 0x00 to -32124.
 */
public final class UlawToPcmTranscoder {

    // BIAS value for u-law as defined in the G.711 standard
    private static final int BIAS = 0x84;

    // µ-law to linear conversion table
    private static final short[] ULAW_TO_LINEAR_TABLE = new short[256];

    // Initialize the conversion table
    static {
        for (int i = 0; i < 256; i++) {
            ULAW_TO_LINEAR_TABLE[i] = ulawToLinear((byte) i);
        }
    }

    private UlawToPcmTranscoder() {
    }

    /**
     * Converts a µ-law encoded byte to a 16-bit linear PCM sample.
     *
     * @param ulawByte The µ-law encoded byte
     * @return The 16-bit linear PCM sample
     */
    static short ulawToLinear(byte ulawByte) {
        // µ-law bytes are stored with every bit inverted
        int ulaw = ~ulawByte & 0xFF;

        int exponent = (ulaw & 0x70) >> 4;
        int mantissa = ulaw & 0x0F;

        int magnitude = ((mantissa << 3) + BIAS) << exponent;

        return (short) ((ulaw & 0x80) != 0 ? BIAS - magnitude : magnitude - BIAS);
    }

    /**
     * Table lookup of a single µ-law byte.
     */
    public static short decode(byte ulawByte) {
        return ULAW_TO_LINEAR_TABLE[ulawByte & 0xFF];
    }

    /**
     * Converts µ-law bytes to linear samples.
     */
    public static short[] decodeSamples(byte[] ulawData) {
        short[] samples = new short[ulawData.length];
        for (int i = 0; i < ulawData.length; i++) {
            samples[i] = ULAW_TO_LINEAR_TABLE[ulawData[i] & 0xFF];
        }
        return samples;
    }
}
