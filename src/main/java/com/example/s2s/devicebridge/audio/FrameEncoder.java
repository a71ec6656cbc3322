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
 * Stateful encoder for fixed-size linear PCM frames.
 *
 * One instance belongs to one outbound stream and is fed consecutive frames,
 * so codecs with inter-frame prediction keep their state.
 */
public interface FrameEncoder {

    /**
     * Encodes exactly one frame of {@link DeviceAudioFormat#frameBytes()} bytes.
     *
     * @param pcmFrame little-endian PCM16 frame
     * @return one encoded packet
     * @throws TranscodeException if this frame could not be encoded; the
     *         encoder stays usable for the next one
     */
    byte[] encode(byte[] pcmFrame) throws TranscodeException;

    /**
     * Creates a fresh encoder per stream.
     */
    @FunctionalInterface
    interface Factory {
        FrameEncoder create() throws TranscodeException;
    }
}
