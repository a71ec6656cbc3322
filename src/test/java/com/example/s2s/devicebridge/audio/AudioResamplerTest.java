package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioResamplerTest {

    @Test
    void shouldTripleSampleCountFrom8kTo24k() {
        short[] input = new short[1000];

        short[] output = AudioResampler.resample(input, 8000, 24000);

        assertThat(output).hasSize(3000);
    }

    @Test
    void shouldRoundOutputLengthHalfUp() {
        assertThat(AudioResampler.outputLength(441, 44100, 24000)).isEqualTo(240);
        assertThat(AudioResampler.outputLength(1, 48000, 24000)).isEqualTo(1);
        assertThat(AudioResampler.outputLength(3, 48000, 16000)).isEqualTo(1);
    }

    @Test
    void shouldInterpolateBetweenNeighbouringSamples() {
        short[] output = AudioResampler.resample(new short[]{0, 300}, 8000, 16000);

        assertThat(output).containsExactly((short) 0, (short) 150, (short) 300, (short) 300);
    }

    @Test
    void shouldPickExactSourcePositionsWhenDownsampling() {
        short[] output = AudioResampler.resample(new short[]{0, 10, 20, 30}, 48000, 24000);

        assertThat(output).containsExactly((short) 0, (short) 20);
    }

    @Test
    void shouldReturnCopyWhenRatesMatch() {
        short[] input = {1, 2, 3};

        short[] output = AudioResampler.resample(input, 24000, 24000);

        assertThat(output).containsExactly(input);
        assertThat(output).isNotSameAs(input);
    }

    @Test
    void shouldResampleLittleEndianBytes() {
        byte[] pcm = Pcm16.toBytes(new short[]{100, 100});

        byte[] output = AudioResampler.resample(pcm, 16000, 24000);

        assertThat(Pcm16.toSamples(output)).containsExactly((short) 100, (short) 100, (short) 100);
    }

    @Test
    void shouldRejectNonPositiveRates() {
        assertThatThrownBy(() -> AudioResampler.resample(new short[]{1}, 0, 24000))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
