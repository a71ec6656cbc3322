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

import com.example.s2s.devicebridge.audio.transcode.AlawToPcmTranscoder;
import com.example.s2s.devicebridge.audio.transcode.UlawToPcmTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Parsed RIFF/WAVE header plus the location of its sample payload.
 *
 * Chunks are walked in order until both {@code fmt } and {@code data} are
 * found, so LIST/fact chunks in front of the payload are skipped. Streaming
 * encoders often write a placeholder data size; sizes that run past the end of
 * the buffer are clamped to what is actually there.
 */
public final class WavContainer {

    private static final Logger LOG = LoggerFactory.getLogger(WavContainer.class);

    public static final int FORMAT_PCM = 0x0001;
    public static final int FORMAT_IEEE_FLOAT = 0x0003;
    public static final int FORMAT_ALAW = 0x0006;
    public static final int FORMAT_MULAW = 0x0007;
    public static final int FORMAT_EXTENSIBLE = 0xFFFE;

    private static final int RIFF_HEADER_SIZE = 12;
    private static final int CHUNK_HEADER_SIZE = 8;

    private final int formatTag;
    private final int channels;
    private final int sampleRate;
    private final int bitsPerSample;
    private final int dataOffset;
    private final int dataLength;
    private final byte[] buffer;

    private WavContainer(int formatTag, int channels, int sampleRate, int bitsPerSample,
                         int dataOffset, int dataLength, byte[] buffer) {
        this.formatTag = formatTag;
        this.channels = channels;
        this.sampleRate = sampleRate;
        this.bitsPerSample = bitsPerSample;
        this.dataOffset = dataOffset;
        this.dataLength = dataLength;
        this.buffer = buffer;
    }

    /**
     * Parses the header of a WAV buffer.
     *
     * @param wav complete (or streaming) WAV bytes
     * @return header fields and payload range
     * @throws TranscodeException if the buffer is not RIFF/WAVE or has no data chunk
     */
    public static WavContainer parse(byte[] wav) throws TranscodeException {
        if (wav == null || wav.length < RIFF_HEADER_SIZE) {
            throw new TranscodeException("Buffer too short for a WAV header");
        }
        if (!"RIFF".equals(fourCc(wav, 0)) || !"WAVE".equals(fourCc(wav, 8))) {
            throw new TranscodeException("Not a RIFF/WAVE buffer");
        }

        int formatTag = -1;
        int channels = 0;
        int sampleRate = 0;
        int bitsPerSample = 0;

        int pos = RIFF_HEADER_SIZE;
        while (pos + CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = fourCc(wav, pos);
            long chunkSize = readUInt32(wav, pos + 4);
            int body = pos + CHUNK_HEADER_SIZE;

            if ("fmt ".equals(chunkId)) {
                if (body + 16 > wav.length) {
                    throw new TranscodeException("Truncated fmt chunk");
                }
                formatTag = readUInt16(wav, body);
                channels = readUInt16(wav, body + 2);
                sampleRate = (int) readUInt32(wav, body + 4);
                bitsPerSample = readUInt16(wav, body + 14);
                if (formatTag == FORMAT_EXTENSIBLE && chunkSize >= 40 && body + 26 <= wav.length) {
                    // First two bytes of the sub-format GUID carry the real codec tag
                    formatTag = readUInt16(wav, body + 24);
                }
            } else if ("data".equals(chunkId)) {
                if (formatTag < 0) {
                    throw new TranscodeException("data chunk before fmt chunk");
                }
                long available = wav.length - body;
                int length = (int) Math.min(chunkSize, available);
                return new WavContainer(formatTag, channels, sampleRate, bitsPerSample, body, length, wav);
            }

            // Chunks are word aligned
            long next = body + chunkSize + (chunkSize & 1);
            if (next > wav.length) {
                break;
            }
            pos = (int) next;
        }
        throw new TranscodeException("No data chunk in WAV buffer");
    }

    /**
     * Decodes the payload to 16-bit linear samples, interleaved as stored.
     * µ-law and A-law are expanded; 8-bit PCM is re-centred. Any other codec
     * tag is read as raw 16-bit PCM and logged.
     */
    public short[] decodeSamples() {
        byte[] payload = payload();
        switch (formatTag) {
            case FORMAT_MULAW -> {
                return UlawToPcmTranscoder.decodeSamples(payload);
            }
            case FORMAT_ALAW -> {
                return AlawToPcmTranscoder.decodeSamples(payload);
            }
            case FORMAT_PCM -> {
                if (bitsPerSample == 8) {
                    short[] samples = new short[payload.length];
                    for (int i = 0; i < payload.length; i++) {
                        samples[i] = (short) (((payload[i] & 0xFF) - 128) << 8);
                    }
                    return samples;
                }
                if (bitsPerSample != 16) {
                    LOG.warn("Unsupported PCM depth {} bits, reading payload as 16-bit", bitsPerSample);
                }
                return Pcm16.toSamples(payload);
            }
            default -> {
                LOG.warn("Unsupported WAV codec tag 0x{}, treating payload as raw 16-bit PCM",
                    Integer.toHexString(formatTag));
                return Pcm16.toSamples(payload);
            }
        }
    }

    /**
     * @return a copy of the sample payload
     */
    public byte[] payload() {
        return Arrays.copyOfRange(buffer, dataOffset, dataOffset + dataLength);
    }

    public int formatTag() {
        return formatTag;
    }

    public int channels() {
        return channels;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int bitsPerSample() {
        return bitsPerSample;
    }

    public int dataOffset() {
        return dataOffset;
    }

    public int dataLength() {
        return dataLength;
    }

    private static String fourCc(byte[] data, int offset) {
        return new String(data, offset, 4, StandardCharsets.US_ASCII);
    }

    private static int readUInt16(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    private static long readUInt32(byte[] data, int offset) {
        return (data[offset] & 0xFFL)
            | ((data[offset + 1] & 0xFFL) << 8)
            | ((data[offset + 2] & 0xFFL) << 16)
            | ((data[offset + 3] & 0xFFL) << 24);
    }

    @Override
    public String toString() {
        return "WavContainer{" +
               "formatTag=0x" + Integer.toHexString(formatTag) +
               ", channels=" + channels +
               ", sampleRate=" + sampleRate +
               ", bitsPerSample=" + bitsPerSample +
               ", dataLength=" + dataLength +
               '}';
    }
}
