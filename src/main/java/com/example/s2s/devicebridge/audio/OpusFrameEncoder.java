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

import io.github.jaredmdobson.concentus.OpusApplication;
import io.github.jaredmdobson.concentus.OpusEncoder;
import io.github.jaredmdobson.concentus.OpusException;

import java.util.Arrays;

/**
 * Opus encoder for device playback frames, backed by the pure-Java Concentus port.
 */
public class OpusFrameEncoder implements FrameEncoder {

    // Upper bound recommended by libopus for a single packet
    private static final int MAX_PACKET_BYTES = 1275;

    private final OpusEncoder encoder;
    private final DeviceAudioFormat format;
    private final byte[] packetBuffer = new byte[MAX_PACKET_BYTES];

    public OpusFrameEncoder(DeviceAudioFormat format, int bitrate) throws TranscodeException {
        this.format = format;
        try {
            this.encoder = new OpusEncoder(format.outputSampleRate(), format.channels(),
                OpusApplication.OPUS_APPLICATION_VOIP);
            this.encoder.setBitrate(bitrate);
        } catch (OpusException e) {
            throw new TranscodeException("Failed to create Opus encoder for " + format, e);
        }
    }

    /**
     * @return a factory creating one encoder per stream with the given settings
     */
    public static FrameEncoder.Factory factory(DeviceAudioFormat format, int bitrate) {
        return () -> new OpusFrameEncoder(format, bitrate);
    }

    @Override
    public synchronized byte[] encode(byte[] pcmFrame) throws TranscodeException {
        if (pcmFrame.length != format.frameBytes()) {
            throw new TranscodeException("Expected " + format.frameBytes() + " byte frame, got " + pcmFrame.length);
        }
        short[] samples = Pcm16.toSamples(pcmFrame);
        try {
            int written = encoder.encode(samples, 0, format.frameSamples(), packetBuffer, 0, packetBuffer.length);
            return Arrays.copyOf(packetBuffer, written);
        } catch (OpusException e) {
            throw new TranscodeException("Opus encode failed", e);
        }
    }
}
