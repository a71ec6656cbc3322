package com.example.s2s.devicebridge.session;

import com.example.s2s.devicebridge.directory.FakeUserDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class UsageMeterTest {

    private static final Duration TICK = Duration.ofSeconds(10);

    private final FakeUserDirectory directory = new FakeUserDirectory();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final List<String> quotaSignals = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private UsageMeter meter(long prior, long quota) {
        return new UsageMeter("user-1", prior, quota, directory, clock, scheduler, TICK,
            (elapsed, limit) -> quotaSignals.add(elapsed + "/" + limit));
    }

    private void elapse(Duration duration) {
        clock.advance(duration);
        scheduler.advanceTimeBy(duration);
    }

    @Test
    void shouldPersistCumulativeSecondsEveryTick() {
        UsageMeter meter = meter(100, 3600);
        meter.start();

        elapse(TICK);
        elapse(TICK);

        assertThat(directory.persistCalls).containsExactly(110L, 120L);
        assertThat(meter.elapsedSeconds()).isEqualTo(120);
        assertThat(quotaSignals).isEmpty();
    }

    @Test
    void shouldSignalQuotaExactlyOnce() {
        // Arrange
        UsageMeter meter = meter(590, 600);
        meter.start();

        // Act
        elapse(TICK);
        elapse(TICK);

        // Assert
        assertThat(quotaSignals).containsExactly("600/600");
        assertThat(directory.persistCalls).containsExactly(600L, 610L);
    }

    @Test
    void shouldPersistFinalValueOnStopAndThenGoQuiet() {
        UsageMeter meter = meter(0, 3600);
        meter.start();
        elapse(TICK);
        clock.advance(Duration.ofSeconds(4));

        meter.stop();
        meter.stop();
        elapse(TICK.multipliedBy(3));
        meter.tick();

        assertThat(directory.persistCalls).containsExactly(10L, 14L);
        assertThat(meter.isStopped()).isTrue();
        assertThat(meter.elapsedSeconds()).isEqualTo(14);
    }

    @Test
    void shouldNotPersistWhenStoppedBeforeStarting() {
        UsageMeter meter = meter(50, 3600);

        meter.stop();
        meter.start();
        elapse(TICK);

        assertThat(directory.persistCalls).isEmpty();
        assertThat(meter.elapsedSeconds()).isEqualTo(50);
    }

    @Test
    void shouldNeverReportLessThanAlreadyPersisted() {
        UsageMeter meter = meter(200, 3600);
        meter.start();
        clock.advance(Duration.ofSeconds(-30));

        meter.tick();

        assertThat(directory.persistCalls).containsExactly(200L);
    }

    @Test
    void shouldAnswerWhileATickIsStillPersisting() throws Exception {
        // Arrange
        CountDownLatch persisting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeUserDirectory slowDirectory = new FakeUserDirectory() {
            @Override
            public void persistUsageSeconds(String userId, long seconds) {
                persisting.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.persistUsageSeconds(userId, seconds);
            }
        };
        UsageMeter meter = new UsageMeter("user-1", 0, 3600, slowDirectory, clock, scheduler, TICK,
            (elapsed, limit) -> quotaSignals.add(elapsed + "/" + limit));
        meter.start();
        clock.advance(TICK);

        // Act
        CompletableFuture<Void> tick = CompletableFuture.runAsync(meter::tick);
        assertThat(persisting.await(5, TimeUnit.SECONDS)).isTrue();

        // Assert
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            assertThat(meter.elapsedSeconds()).isEqualTo(10);
            assertThat(meter.isStopped()).isFalse();
        });
        release.countDown();
        tick.get(5, TimeUnit.SECONDS);
        meter.stop();
        assertThat(slowDirectory.persistCalls).containsExactly(10L, 10L);
    }
}
