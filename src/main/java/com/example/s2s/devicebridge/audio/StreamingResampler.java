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

/**
 * Linear-interpolation resampler for audio that arrives in pieces.
 *
 * Output positions are counted from the start of the stream rather than the
 * start of each chunk, and the last input sample of a chunk is kept so the
 * first output of the next chunk can interpolate across the boundary. For
 * upsampling and for downsampling by at most 2:1, feeding any split of the
 * same input through {@link #process} and then {@link #finish} produces
 * exactly what {@link AudioResampler#resample(short[], int, int)} produces
 * for the whole input at once.
 *
 * Not thread-safe; the owning stream serializes calls.
 */
public final class StreamingResampler {
    private final int sourceRate;
    private final int targetRate;

    private long consumed;
    private long produced;
    private short previous;

    public StreamingResampler(int sourceRate, int targetRate) {
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + sourceRate + " -> " + targetRate);
        }
        this.sourceRate = sourceRate;
        this.targetRate = targetRate;
    }

    public int sourceRate() {
        return sourceRate;
    }

    /**
     * Resamples the next chunk. Output samples that need input beyond this
     * chunk are held back until the next call or {@link #finish()}.
     */
    public short[] process(short[] chunk) {
        if (chunk.length == 0) {
            return new short[0];
        }
        if (sourceRate == targetRate) {
            consumed += chunk.length;
            produced += chunk.length;
            previous = chunk[chunk.length - 1];
            return chunk.clone();
        }
        long end = consumed + chunk.length - 1;
        short[] output = new short[estimate(chunk.length)];
        int count = 0;
        while (true) {
            long position = produced * sourceRate;
            long index = position / targetRate;
            long fraction = position % targetRate;
            long needed = fraction == 0 ? index : index + 1;
            if (needed > end) {
                break;
            }
            if (count == output.length) {
                output = Arrays.copyOf(output, output.length * 2 + 1);
            }
            int current = sampleAt(index, chunk);
            if (fraction == 0) {
                output[count++] = (short) current;
            } else {
                int next = sampleAt(index + 1, chunk);
                output[count++] = (short) (current + (next - current) * fraction / targetRate);
            }
            produced++;
        }
        consumed += chunk.length;
        previous = chunk[chunk.length - 1];
        return count == output.length ? output : Arrays.copyOf(output, count);
    }

    /**
     * Emits the held-back tail by repeating the final input sample, then
     * starts over as a fresh stream.
     */
    public short[] finish() {
        long total = consumed == 0 ? 0 : AudioResampler.outputLength((int) consumed, sourceRate, targetRate);
        int missing = (int) Math.max(0, total - produced);
        short[] tail = new short[missing];
        Arrays.fill(tail, previous);
        reset();
        return tail;
    }

    /**
     * Forgets everything fed so far.
     */
    public void reset() {
        consumed = 0;
        produced = 0;
        previous = 0;
    }

    private int sampleAt(long index, short[] chunk) {
        return index < consumed ? previous : chunk[(int) (index - consumed)];
    }

    private int estimate(int inputLength) {
        return (int) ((long) inputLength * targetRate / sourceRate) + 2;
    }
}
