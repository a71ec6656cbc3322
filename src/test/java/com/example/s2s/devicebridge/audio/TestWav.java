package com.example.s2s.devicebridge.audio;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Builds WAV buffers for tests.
 */
public final class TestWav {

    private TestWav() {
    }

    public static byte[] pcm16(int sampleRate, int channels, short[] samples) {
        return build(WavContainer.FORMAT_PCM, channels, sampleRate, 16, Pcm16.toBytes(samples));
    }

    public static byte[] build(int formatTag, int channels, int sampleRate, int bitsPerSample, byte[] payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeAscii(out, "RIFF");
        writeInt(out, 4 + 8 + 16 + 8 + payload.length);
        writeAscii(out, "WAVE");
        writeFmt(out, formatTag, channels, sampleRate, bitsPerSample);
        writeAscii(out, "data");
        writeInt(out, payload.length);
        out.writeBytes(payload);
        return out.toByteArray();
    }

    static void writeFmt(ByteArrayOutputStream out, int formatTag, int channels, int sampleRate, int bitsPerSample) {
        int blockAlign = channels * bitsPerSample / 8;
        writeAscii(out, "fmt ");
        writeInt(out, 16);
        writeShort(out, formatTag);
        writeShort(out, channels);
        writeInt(out, sampleRate);
        writeInt(out, sampleRate * blockAlign);
        writeShort(out, blockAlign);
        writeShort(out, bitsPerSample);
    }

    static void writeAscii(ByteArrayOutputStream out, String fourCc) {
        out.writeBytes(fourCc.getBytes(StandardCharsets.US_ASCII));
    }

    static void writeInt(ByteArrayOutputStream out, int value) {
        out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
    }

    static void writeShort(ByteArrayOutputStream out, int value) {
        out.writeBytes(ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN).putShort((short) value).array());
    }
}
