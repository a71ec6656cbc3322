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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Streaming encoder front-end for provider audio headed to the device.
 *
 * Audio flow: provider PCM (any rate) → downmix → resample → gain/limit → frame → encode → sink
 *
 * Providers deliver chunks whose sizes have nothing to do with the device
 * frame size, so the sub-frame remainder of one chunk is carried into the next.
 * Resampling also runs across chunk boundaries, so a turn split into many
 * chunks sounds the same as one delivered whole.
 * {@link #flush()} at the end of a turn zero-pads and sends what is left.
 * One encoder instance is used for the whole stream.
 */
public class OutboundAudioStream {
    private static final Logger LOG = LoggerFactory.getLogger(OutboundAudioStream.class);

    private final DeviceAudioFormat format;
    private final GainLimiter limiter;
    private final FrameEncoder encoder;
    private final Consumer<byte[]> sink;

    // Packet buffer for breaking provider chunks into device-sized frames
    private final byte[] packetBuffer;
    private int packetBufferPos = 0;
    private StreamingResampler resampler;

    private final AtomicLong framesSent = new AtomicLong();
    private final AtomicLong framesFailed = new AtomicLong();

    /**
     * @param format  device output format (rate and frame size)
     * @param limiter gain stage applied after resampling
     * @param encoder encoder owned by this stream
     * @param sink    receives each encoded packet, in order
     */
    public OutboundAudioStream(DeviceAudioFormat format, GainLimiter limiter,
                               FrameEncoder encoder, Consumer<byte[]> sink) {
        this.format = format;
        this.limiter = limiter;
        this.encoder = encoder;
        this.sink = sink;
        this.packetBuffer = new byte[format.frameBytes()];
    }

    /**
     * Normalizes one provider chunk and sends every complete frame it fills.
     *
     * @param chunk PCM16 audio at any rate and channel count
     * @return number of frames sent for this chunk
     */
    public synchronized int write(AudioFrame chunk) {
        if (!chunk.isPcm()) {
            throw new IllegalArgumentException("Outbound stream expects PCM16, got " + chunk.codec());
        }
        if (chunk.length() == 0) {
            return 0;
        }
        byte[] normalized = normalize(chunk);
        return packetizeAndSend(normalized);
    }

    /**
     * Drains the resampler tail, then sends the buffered remainder as one
     * zero-padded frame.
     *
     * @return number of frames sent
     */
    public synchronized int flush() {
        int sent = 0;
        if (resampler != null) {
            short[] tail = resampler.finish();
            if (tail.length > 0) {
                sent += packetizeAndSend(shape(tail));
            }
        }
        if (packetBufferPos == 0) {
            return sent;
        }
        byte[] frame = new byte[packetBuffer.length];
        System.arraycopy(packetBuffer, 0, frame, 0, packetBufferPos);
        LOG.debug("Flushing {} buffered bytes as a padded frame", packetBufferPos);
        packetBufferPos = 0;
        return encodeAndSend(frame) ? sent + 1 : sent;
    }

    /**
     * Drops any partial frame without sending it (interrupts).
     */
    public synchronized void clear() {
        if (packetBufferPos > 0) {
            LOG.debug("Discarding {} buffered bytes", packetBufferPos);
        }
        packetBufferPos = 0;
        if (resampler != null) {
            resampler.reset();
        }
    }

    public long framesSent() {
        return framesSent.get();
    }

    public long framesFailed() {
        return framesFailed.get();
    }

    private byte[] normalize(AudioFrame chunk) {
        short[] samples = Pcm16.downmix(chunk.samples(), chunk.channels());
        if (resampler == null || resampler.sourceRate() != chunk.sampleRate()) {
            if (resampler != null) {
                LOG.debug("Provider rate changed {} -> {} Hz mid-stream", resampler.sourceRate(), chunk.sampleRate());
            }
            resampler = new StreamingResampler(chunk.sampleRate(), format.outputSampleRate());
        }
        return shape(resampler.process(samples));
    }

    private byte[] shape(short[] samples) {
        return Pcm16.toBytes(limiter.isUnity() ? samples : limiter.apply(samples));
    }

    /**
     * Break audio data into device-sized frames.
     */
    private int packetizeAndSend(byte[] pcm) {
        int sourcePos = 0;
        int sent = 0;

        while (sourcePos < pcm.length) {
            int spaceInPacket = packetBuffer.length - packetBufferPos;
            int bytesToCopy = Math.min(spaceInPacket, pcm.length - sourcePos);

            System.arraycopy(pcm, sourcePos, packetBuffer, packetBufferPos, bytesToCopy);
            packetBufferPos += bytesToCopy;
            sourcePos += bytesToCopy;

            if (packetBufferPos == packetBuffer.length) {
                byte[] frame = packetBuffer.clone();
                packetBufferPos = 0;
                if (encodeAndSend(frame)) {
                    sent++;
                }
            }
        }
        return sent;
    }

    private boolean encodeAndSend(byte[] frame) {
        byte[] packet;
        try {
            packet = encoder.encode(frame);
        } catch (TranscodeException e) {
            long failed = framesFailed.incrementAndGet();
            LOG.warn("Skipping frame that failed to encode ({} failures so far): {}", failed, e.getMessage());
            return false;
        }
        sink.accept(packet);
        framesSent.incrementAndGet();
        return true;
    }
}
