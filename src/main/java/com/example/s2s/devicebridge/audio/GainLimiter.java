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
 * Decibel gain followed by a hard ceiling on |sample|.
 */
public final class GainLimiter {

    private static final int FULL_SCALE = Short.MAX_VALUE;

    private final double gainDb;
    private final double ceiling;
    private final double factor;
    private final int limit;

    /**
     * @param gainDb  gain applied to every sample, in dB
     * @param ceiling maximum magnitude as a fraction of full scale, in (0, 1]
     */
    public GainLimiter(double gainDb, double ceiling) {
        if (ceiling <= 0.0 || ceiling > 1.0) {
            throw new IllegalArgumentException("ceiling must be in (0, 1]: " + ceiling);
        }
        this.gainDb = gainDb;
        this.ceiling = ceiling;
        this.factor = Math.pow(10.0, gainDb / 20.0);
        this.limit = (int) Math.floor(ceiling * FULL_SCALE);
    }

    /**
     * Pass-through limiter: 0 dB, full-scale ceiling.
     */
    public static GainLimiter unity() {
        return new GainLimiter(0.0, 1.0);
    }

    public static short[] apply(short[] samples, double gainDb, double ceiling) {
        return new GainLimiter(gainDb, ceiling).apply(samples);
    }

    /**
     * @return a new array with gain applied and magnitudes clipped to the ceiling
     */
    public short[] apply(short[] samples) {
        short[] out = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            long scaled = Math.round(samples[i] * factor);
            if (scaled > limit) {
                scaled = limit;
            } else if (scaled < -limit) {
                scaled = -limit;
            }
            out[i] = (short) scaled;
        }
        return out;
    }

    public boolean isUnity() {
        return gainDb == 0.0 && limit == FULL_SCALE;
    }

    public double gainDb() {
        return gainDb;
    }

    public double ceiling() {
        return ceiling;
    }
}
