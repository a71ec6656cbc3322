package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpusFrameEncoderTest {

    private static final DeviceAudioFormat FORMAT = DeviceAudioFormat.defaults();

    private static byte[] tone(int hz) {
        short[] samples = new short[FORMAT.frameSamples()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (short) (8000 * Math.sin(2 * Math.PI * hz * i / FORMAT.outputSampleRate()));
        }
        return Pcm16.toBytes(samples);
    }

    @Test
    void shouldEncodeOneFrameIntoOnePacket() throws Exception {
        FrameEncoder encoder = OpusFrameEncoder.factory(FORMAT, 12000).create();

        byte[] packet = encoder.encode(tone(440));

        assertThat(packet).isNotEmpty();
        assertThat(packet.length).isLessThan(FORMAT.frameBytes());
    }

    @Test
    void shouldEncodeSilence() throws Exception {
        FrameEncoder encoder = new OpusFrameEncoder(FORMAT, 12000);

        assertThat(encoder.encode(new byte[FORMAT.frameBytes()])).isNotEmpty();
    }

    @Test
    void shouldRejectPartialFrames() throws Exception {
        FrameEncoder encoder = new OpusFrameEncoder(FORMAT, 12000);

        assertThatThrownBy(() -> encoder.encode(new byte[100]))
            .isInstanceOf(TranscodeException.class)
            .hasMessageContaining("2880");
    }

    @Test
    void shouldCreateAFreshEncoderPerStream() throws Exception {
        FrameEncoder.Factory factory = OpusFrameEncoder.factory(FORMAT, 12000);

        assertThat(factory.create()).isNotSameAs(factory.create());
    }
}
