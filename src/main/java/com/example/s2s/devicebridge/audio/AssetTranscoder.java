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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a stored WAV asset into device-ready linear PCM frames.
 *
 * Audio flow: WAV → G.711/PCM decode → downmix → resample → gain/limit → fixed frames
 */
public class AssetTranscoder {
    private static final Logger LOG = LoggerFactory.getLogger(AssetTranscoder.class);

    private final DeviceAudioFormat format;
    private final GainLimiter limiter;

    public AssetTranscoder(DeviceAudioFormat format, GainLimiter limiter) {
        this.format = format;
        this.limiter = limiter;
    }

    /**
     * @param wav complete WAV file bytes
     * @return PCM16 frames of exactly {@link DeviceAudioFormat#frameBytes()} bytes
     * @throws TranscodeException if the buffer is not a usable WAV container
     */
    public List<byte[]> toFrames(byte[] wav) throws TranscodeException {
        WavContainer container = WavContainer.parse(wav);
        if (container.sampleRate() <= 0 || container.channels() <= 0) {
            throw new TranscodeException("Invalid WAV parameters: " + container);
        }
        LOG.debug("Transcoding asset {}", container);

        short[] samples = Pcm16.downmix(container.decodeSamples(), container.channels());
        samples = AudioResampler.resample(samples, container.sampleRate(), format.outputSampleRate());
        if (!limiter.isUnity()) {
            samples = limiter.apply(samples);
        }
        List<byte[]> frames = FrameSlicer.slice(Pcm16.toBytes(samples), format.frameBytes());
        LOG.debug("Asset produced {} frames of {} bytes", frames.size(), format.frameBytes());
        return frames;
    }
}
