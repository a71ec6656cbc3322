package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboundAudioStreamTest {

    private static final DeviceAudioFormat FORMAT = new DeviceAudioFormat(16000, 24000, 60);

    @Test
    void shouldCarryRemainderAcrossChunks() {
        // Arrange
        List<byte[]> sent = new ArrayList<>();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), sent::add);

        // Act: 2000 bytes, then 2000 more; one 2880-byte frame fits
        int first = stream.write(AudioFrame.pcm16Mono(filled(1000, (short) 7), 24000));
        int second = stream.write(AudioFrame.pcm16Mono(filled(1000, (short) 7), 24000));

        // Assert
        assertThat(first).isZero();
        assertThat(second).isEqualTo(1);
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0)).hasSize(FORMAT.frameBytes());
    }

    @Test
    void shouldZeroPadRemainderOnFlush() {
        List<byte[]> sent = new ArrayList<>();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), sent::add);
        stream.write(AudioFrame.pcm16Mono(filled(100, (short) 9), 24000));

        int flushed = stream.flush();

        assertThat(flushed).isEqualTo(1);
        short[] samples = Pcm16.toSamples(sent.get(0));
        assertThat(samples).hasSize(FORMAT.frameSamples());
        assertThat(samples[99]).isEqualTo((short) 9);
        assertThat(samples[100]).isZero();
        assertThat(stream.flush()).isZero();
    }

    @Test
    void shouldResampleProviderAudioToDeviceRate() {
        List<byte[]> sent = new ArrayList<>();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), sent::add);

        // 60ms at 16kHz becomes one 60ms frame at 24kHz once the turn ends
        int written = stream.write(AudioFrame.pcm16Mono(filled(960, (short) 3), 16000));
        int flushed = stream.flush();

        assertThat(written + flushed).isEqualTo(1);
        assertThat(sent).hasSize(1);
        assertThat(Pcm16.toSamples(sent.get(0))).containsOnly((short) 3);
    }

    @Test
    void shouldResampleSplitTurnsLikeWholeOnes() {
        // Arrange
        short[] ramp = new short[1600];
        for (int i = 0; i < ramp.length; i++) {
            ramp[i] = (short) (i * 10);
        }
        List<byte[]> whole = new ArrayList<>();
        List<byte[]> split = new ArrayList<>();
        OutboundAudioStream wholeStream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), whole::add);
        OutboundAudioStream splitStream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), split::add);

        // Act
        wholeStream.write(AudioFrame.pcm16Mono(Pcm16.toBytes(ramp), 16000));
        wholeStream.flush();
        int offset = 0;
        for (int size : new int[]{333, 1, 500, 766}) {
            splitStream.write(AudioFrame.pcm16Mono(Pcm16.toBytes(Arrays.copyOfRange(ramp, offset, offset + size)), 16000));
            offset += size;
        }
        splitStream.flush();

        // Assert
        assertThat(split).hasSameSizeAs(whole);
        for (int i = 0; i < whole.size(); i++) {
            assertThat(split.get(i)).containsExactly(whole.get(i));
        }
    }

    @Test
    void shouldDownmixAndApplyGain() {
        List<byte[]> sent = new ArrayList<>();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, new GainLimiter(6.0, 0.89), new PassThroughEncoder(), sent::add);
        short[] stereo = new short[FORMAT.frameSamples() * 2];
        for (int i = 0; i < stereo.length; i += 2) {
            stereo[i] = 1000;
            stereo[i + 1] = 3000;
        }

        stream.write(AudioFrame.pcm16(Pcm16.toBytes(stereo), 24000, 2));

        assertThat(Pcm16.toSamples(sent.get(0))).containsOnly((short) 3991);
    }

    @Test
    void shouldDropRemainderOnClear() {
        List<byte[]> sent = new ArrayList<>();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), sent::add);
        stream.write(AudioFrame.pcm16Mono(filled(100, (short) 1), 24000));

        stream.clear();

        assertThat(stream.flush()).isZero();
        assertThat(sent).isEmpty();
    }

    @Test
    void shouldSkipAndCountFramesThatFailToEncode() {
        List<byte[]> sent = new ArrayList<>();
        FlakyEncoder encoder = new FlakyEncoder();
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), encoder, sent::add);

        int frames = stream.write(AudioFrame.pcm16Mono(filled(FORMAT.frameSamples() * 3, (short) 1), 24000));

        assertThat(frames).isEqualTo(2);
        assertThat(sent).hasSize(2);
        assertThat(stream.framesSent()).isEqualTo(2);
        assertThat(stream.framesFailed()).isEqualTo(1);
    }

    @Test
    void shouldRejectEncodedInput() {
        OutboundAudioStream stream = new OutboundAudioStream(FORMAT, GainLimiter.unity(), new PassThroughEncoder(), b -> { });

        assertThatThrownBy(() -> stream.write(AudioFrame.opus(new byte[]{1}, 24000, 1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] filled(int samples, short value) {
        short[] data = new short[samples];
        Arrays.fill(data, value);
        return Pcm16.toBytes(data);
    }

    /**
     * Returns the PCM frame unchanged.
     */
    static class PassThroughEncoder implements FrameEncoder {
        int calls = 0;

        @Override
        public byte[] encode(byte[] pcmFrame) {
            calls++;
            return pcmFrame.clone();
        }
    }

    /**
     * Fails every second frame.
     */
    static class FlakyEncoder implements FrameEncoder {
        private int calls = 0;

        @Override
        public byte[] encode(byte[] pcmFrame) throws TranscodeException {
            calls++;
            if (calls == 2) {
                throw new TranscodeException("simulated encoder failure");
            }
            return new byte[]{(byte) calls};
        }
    }
}
