package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavContainerTest {

    @Test
    void shouldReadPcmHeaderFields() throws Exception {
        byte[] wav = TestWav.pcm16(48000, 2, new short[]{1, 2, 3, 4});

        WavContainer container = WavContainer.parse(wav);

        assertThat(container.formatTag()).isEqualTo(WavContainer.FORMAT_PCM);
        assertThat(container.sampleRate()).isEqualTo(48000);
        assertThat(container.channels()).isEqualTo(2);
        assertThat(container.bitsPerSample()).isEqualTo(16);
        assertThat(container.dataOffset()).isEqualTo(44);
        assertThat(container.dataLength()).isEqualTo(8);
        assertThat(container.decodeSamples()).containsExactly((short) 1, (short) 2, (short) 3, (short) 4);
    }

    @Test
    void shouldExpandUlawPayload() throws Exception {
        byte[] wav = TestWav.build(WavContainer.FORMAT_MULAW, 1, 8000, 8, new byte[]{(byte) 0xFF, 0x00});

        short[] samples = WavContainer.parse(wav).decodeSamples();

        assertThat(samples).containsExactly((short) 0, (short) -32124);
    }

    @Test
    void shouldRecentreEightBitPcm() throws Exception {
        byte[] wav = TestWav.build(WavContainer.FORMAT_PCM, 1, 8000, 8, new byte[]{(byte) 128, (byte) 255, 0});

        short[] samples = WavContainer.parse(wav).decodeSamples();

        assertThat(samples).containsExactly((short) 0, (short) (127 << 8), (short) (-128 << 8));
    }

    @Test
    void shouldResolveExtensibleFormatToSubFormat() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestWav.writeAscii(out, "RIFF");
        TestWav.writeInt(out, 0);
        TestWav.writeAscii(out, "WAVE");
        TestWav.writeAscii(out, "fmt ");
        TestWav.writeInt(out, 40);
        TestWav.writeShort(out, WavContainer.FORMAT_EXTENSIBLE);
        TestWav.writeShort(out, 1);
        TestWav.writeInt(out, 8000);
        TestWav.writeInt(out, 8000);
        TestWav.writeShort(out, 1);
        TestWav.writeShort(out, 8);
        TestWav.writeShort(out, 22);
        TestWav.writeShort(out, 8);
        TestWav.writeInt(out, 0);
        // sub-format GUID, codec tag first
        TestWav.writeShort(out, WavContainer.FORMAT_MULAW);
        out.writeBytes(new byte[14]);
        TestWav.writeAscii(out, "data");
        TestWav.writeInt(out, 1);
        out.write(0xFF);

        WavContainer container = WavContainer.parse(out.toByteArray());

        assertThat(container.formatTag()).isEqualTo(WavContainer.FORMAT_MULAW);
        assertThat(container.decodeSamples()).containsExactly((short) 0);
    }

    @Test
    void shouldTreatUnknownCodecAsRawPcm() throws Exception {
        byte[] wav = TestWav.build(0x0055, 1, 16000, 16, new byte[]{0x10, 0x00, 0x20, 0x00});

        short[] samples = WavContainer.parse(wav).decodeSamples();

        assertThat(samples).containsExactly((short) 16, (short) 32);
    }

    @Test
    void shouldSkipChunksBeforeData() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestWav.writeAscii(out, "RIFF");
        TestWav.writeInt(out, 0);
        TestWav.writeAscii(out, "WAVE");
        TestWav.writeFmt(out, WavContainer.FORMAT_PCM, 1, 24000, 16);
        TestWav.writeAscii(out, "LIST");
        TestWav.writeInt(out, 3);
        out.writeBytes(new byte[]{1, 2, 3, 0});
        TestWav.writeAscii(out, "data");
        TestWav.writeInt(out, 2);
        out.writeBytes(new byte[]{0x05, 0x00});

        WavContainer container = WavContainer.parse(out.toByteArray());

        assertThat(container.decodeSamples()).containsExactly((short) 5);
    }

    @Test
    void shouldClampStreamingDataSizeToBuffer() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestWav.writeAscii(out, "RIFF");
        TestWav.writeInt(out, -1);
        TestWav.writeAscii(out, "WAVE");
        TestWav.writeFmt(out, WavContainer.FORMAT_PCM, 1, 48000, 16);
        TestWav.writeAscii(out, "data");
        TestWav.writeInt(out, -1);
        out.writeBytes(new byte[]{1, 0, 2, 0});

        WavContainer container = WavContainer.parse(out.toByteArray());

        assertThat(container.dataLength()).isEqualTo(4);
        assertThat(container.decodeSamples()).containsExactly((short) 1, (short) 2);
    }

    @Test
    void shouldRejectNonRiffInput() {
        assertThatThrownBy(() -> WavContainer.parse("not a wave file at all".getBytes()))
            .isInstanceOf(TranscodeException.class)
            .hasMessageContaining("RIFF");
    }

    @Test
    void shouldRejectBufferWithoutDataChunk() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        TestWav.writeAscii(out, "RIFF");
        TestWav.writeInt(out, 28);
        TestWav.writeAscii(out, "WAVE");
        TestWav.writeFmt(out, WavContainer.FORMAT_PCM, 1, 16000, 16);

        assertThatThrownBy(() -> WavContainer.parse(out.toByteArray()))
            .isInstanceOf(TranscodeException.class)
            .hasMessageContaining("data");
    }

    @Test
    void shouldRejectTooShortBuffer() {
        assertThatThrownBy(() -> WavContainer.parse(new byte[4]))
            .isInstanceOf(TranscodeException.class);
    }
}
