package com.example.s2s.devicebridge.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GainLimiterTest {

    @Test
    void shouldApplyDecibelGain() {
        short[] out = GainLimiter.apply(new short[]{1000, -1000}, 6.0, 1.0);

        // 10^(6/20) = 1.9953
        assertThat(out).containsExactly((short) 1995, (short) -1995);
    }

    @Test
    void shouldClipToCeilingInBothDirections() {
        short[] out = GainLimiter.apply(new short[]{20000, -20000, 100}, 6.0, 0.89);

        assertThat(out).containsExactly((short) 29162, (short) -29162, (short) 200);
    }

    @Test
    void shouldLimitWithoutGain() {
        short[] out = GainLimiter.apply(new short[]{Short.MAX_VALUE, Short.MIN_VALUE}, 0.0, 0.5);

        assertThat(out).containsExactly((short) 16383, (short) -16383);
    }

    @Test
    void shouldPassThroughAtUnity() {
        GainLimiter unity = GainLimiter.unity();

        assertThat(unity.isUnity()).isTrue();
        assertThat(unity.apply(new short[]{Short.MAX_VALUE, -5})).containsExactly(Short.MAX_VALUE, (short) -5);
        assertThat(new GainLimiter(6.0, 0.89).isUnity()).isFalse();
    }

    @Test
    void shouldRejectCeilingOutsideFullScale() {
        assertThatThrownBy(() -> new GainLimiter(0.0, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GainLimiter(0.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
