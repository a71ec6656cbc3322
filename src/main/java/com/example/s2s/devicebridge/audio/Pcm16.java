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

/**
 * Conversions between little-endian PCM16 byte buffers and sample arrays.
 */
public final class Pcm16 {

    public static final int BYTES_PER_SAMPLE = 2;

    private Pcm16() {
    }

    /**
     * Reads little-endian 16-bit samples. A trailing odd byte is ignored.
     */
    public static short[] toSamples(byte[] pcm) {
        int sampleCount = pcm.length / BYTES_PER_SAMPLE;
        short[] samples = new short[sampleCount];
        for (int i = 0; i < sampleCount; i++) {
            samples[i] = readSample(pcm, i);
        }
        return samples;
    }

    /**
     * Writes samples as little-endian 16-bit PCM.
     */
    public static byte[] toBytes(short[] samples) {
        byte[] pcm = new byte[samples.length * BYTES_PER_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            writeSample(pcm, i, samples[i]);
        }
        return pcm;
    }

    /**
     * Read a 16-bit sample from byte array (little-endian)
     */
    static short readSample(byte[] data, int sampleIndex) {
        int byteIndex = sampleIndex * 2;
        return (short) ((data[byteIndex] & 0xFF) | ((data[byteIndex + 1] & 0xFF) << 8));
    }

    /**
     * Write a 16-bit sample to byte array (little-endian)
     */
    static void writeSample(byte[] data, int sampleIndex, short sample) {
        int byteIndex = sampleIndex * 2;
        data[byteIndex] = (byte) (sample & 0xFF);
        data[byteIndex + 1] = (byte) ((sample >> 8) & 0xFF);
    }

    /**
     * Averages interleaved channels down to mono.
     */
    public static short[] downmix(short[] interleaved, int channels) {
        if (channels <= 1) {
            return interleaved;
        }
        int frames = interleaved.length / channels;
        short[] mono = new short[frames];
        for (int f = 0; f < frames; f++) {
            int sum = 0;
            for (int c = 0; c < channels; c++) {
                sum += interleaved[f * channels + c];
            }
            mono[f] = (short) (sum / channels);
        }
        return mono;
    }
}
