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
 * A utility for converting A-law (G.711) encoded audio to Linear PCM.
 *
 * Input: 8-bit A-law samples, 1 byte per sample
 * Output: 16-bit samples
 */
public final class AlawToPcmTranscoder {

    // Even bits are inverted on the wire
    private static final int EVEN_BIT_MASK = 0x55;

    private static final short[] ALAW_TO_LINEAR_TABLE = new short[256];

    static {
        for (int i = 0; i < 256; i++) {
            ALAW_TO_LINEAR_TABLE[i] = alawToLinear((byte) i);
        }
    }

    private AlawToPcmTranscoder() {
    }

    /**
     * Converts an A-law byte to a 16-bit linear sample per ITU-T G.711.
     */
    static short alawToLinear(byte alawByte) {
        int alaw = (alawByte & 0xFF) ^ EVEN_BIT_MASK;

        int segment = (alaw & 0x70) >> 4;
        int magnitude = (alaw & 0x0F) << 4;

        switch (segment) {
            case 0 -> magnitude += 8;
            case 1 -> magnitude += 0x108;
            default -> {
                magnitude += 0x108;
                magnitude <<= segment - 1;
            }
        }

        // In A-law a set sign bit means positive
        return (short) ((alaw & 0x80) != 0 ? magnitude : -magnitude);
    }

    public static short decode(byte alawByte) {
        return ALAW_TO_LINEAR_TABLE[alawByte & 0xFF];
    }

    /**
     * Converts A-law bytes to linear samples.
     */
    public static short[] decodeSamples(byte[] alawData) {
        short[] samples = new short[alawData.length];
        for (int i = 0; i < alawData.length; i++) {
            samples[i] = ALAW_TO_LINEAR_TABLE[alawData[i] & 0xFF];
        }
        return samples;
    }
}
