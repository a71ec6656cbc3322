package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrameSlicerTest {

    @Test
    void shouldZeroPadLastFrame() {
        List<byte[]> frames = FrameSlicer.slice(new byte[]{1, 2, 3, 4, 5}, 2);

        assertThat(frames).hasSize(3);
        assertThat(frames.get(0)).containsExactly(1, 2);
        assertThat(frames.get(1)).containsExactly(3, 4);
        assertThat(frames.get(2)).containsExactly(5, 0);
    }

    @Test
    void shouldNotAddFrameForExactMultiple() {
        List<byte[]> frames = FrameSlicer.slice(new byte[2880 * 2], 2880);

        assertThat(frames).hasSize(2).allSatisfy(frame -> assertThat(frame).hasSize(2880));
    }

    @Test
    void shouldReturnNothingForEmptyInput() {
        assertThat(FrameSlicer.slice(new byte[0], 2880)).isEmpty();
    }
}
