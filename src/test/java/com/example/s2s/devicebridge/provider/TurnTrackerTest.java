package com.example.s2s.devicebridge.provider;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TurnTrackerTest {

    @Test
    void shouldOpenAndCloseEachTurnOnce() {
        TurnTracker tracker = new TurnTracker();

        assertThat(tracker.end()).isFalse();
        assertThat(tracker.begin()).isTrue();
        assertThat(tracker.begin()).isFalse();
        assertThat(tracker.inTurn()).isTrue();
        assertThat(tracker.end()).isTrue();
        assertThat(tracker.end()).isFalse();
        assertThat(tracker.begin()).isTrue();
    }

    @Test
    void shouldForgetOpenTurnOnReset() {
        TurnTracker tracker = new TurnTracker();
        tracker.begin();

        tracker.reset();

        assertThat(tracker.inTurn()).isFalse();
        assertThat(tracker.begin()).isTrue();
    }
}
