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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits linear PCM into fixed-length frames. The final partial frame is
 * zero-padded, never dropped or emitted short.
 */
public final class FrameSlicer {

    private FrameSlicer() {
    }

    public static List<byte[]> slice(byte[] pcm, int frameBytes) {
        if (frameBytes <= 0) {
            throw new IllegalArgumentException("frameBytes must be positive: " + frameBytes);
        }
        List<byte[]> frames = new ArrayList<>((pcm.length + frameBytes - 1) / frameBytes);
        for (int offset = 0; offset < pcm.length; offset += frameBytes) {
            // copyOfRange pads with zeros past the source end
            frames.add(Arrays.copyOfRange(pcm, offset, offset + frameBytes));
        }
        return frames;
    }
}
