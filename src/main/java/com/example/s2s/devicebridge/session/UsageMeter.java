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


package com.example.s2s.devicebridge.session;

import com.example.s2s.devicebridge.directory.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks connected seconds for one session and persists them periodically.
 *
 * elapsed = priorSeconds + whole seconds since {@link #start}, never decreasing.
 * Each tick persists elapsed; reaching the quota notifies the listener once.
 * {@link #stop()} persists one last time and ends ticking.
 *
 * Persists run outside the meter's monitor and are serialized among
 * themselves; a value lower than one already written is never sent.
 * The directory call blocks, so the scheduler should be an I/O one.
 */
public class UsageMeter {
    private static final Logger LOG = LoggerFactory.getLogger(UsageMeter.class);

    private final String userId;
    private final long priorSeconds;
    private final long quotaSeconds;
    private final UserDirectory directory;
    private final Clock clock;
    private final Scheduler scheduler;
    private final Duration tickInterval;
    private final QuotaListener listener;
    private final Object persistLock = new Object();

    private Instant startedAt;
    private Disposable ticker;
    private long lastElapsed;
    private boolean running = false;
    private boolean stopped = false;
    private boolean quotaSignalled = false;
    private long persistedSeconds = -1;

    public UsageMeter(String userId, long priorSeconds, long quotaSeconds, UserDirectory directory,
                      Clock clock, Scheduler scheduler, Duration tickInterval, QuotaListener listener) {
        this.userId = userId;
        this.priorSeconds = priorSeconds;
        this.quotaSeconds = quotaSeconds;
        this.directory = directory;
        this.clock = clock;
        this.scheduler = scheduler;
        this.tickInterval = tickInterval;
        this.listener = listener;
        this.lastElapsed = priorSeconds;
    }

    public synchronized void start() {
        if (running || stopped) {
            return;
        }
        running = true;
        startedAt = clock.instant();
        ticker = Flux.interval(tickInterval, tickInterval, scheduler)
            .subscribe(
                i -> tick(),
                error -> LOG.error("Usage ticker for user {} failed", userId, error)
            );
        LOG.info("Usage meter started for user {} ({}s used of {}s, tick {}s)",
            userId, priorSeconds, quotaSeconds, tickInterval.toSeconds());
    }

    /**
     * Persists elapsed seconds and checks the quota. No-op once stopped.
     */
    public void tick() {
        long elapsed;
        boolean exceeded;
        synchronized (this) {
            if (!running || stopped) {
                return;
            }
            elapsed = computeElapsed();
            exceeded = elapsed >= quotaSeconds && !quotaSignalled;
            if (exceeded) {
                quotaSignalled = true;
            }
        }
        persist(elapsed);
        LOG.debug("Usage tick for user {}: {}s", userId, elapsed);
        if (exceeded) {
            LOG.info("⚠ User {} reached quota: {}s >= {}s", userId, elapsed, quotaSeconds);
            listener.onQuotaExceeded(elapsed, quotaSeconds);
        }
    }

    /**
     * Stops ticking and persists the final value. Later calls do nothing.
     */
    public void stop() {
        long elapsed;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (ticker != null) {
                ticker.dispose();
            }
            if (!running) {
                return;
            }
            elapsed = computeElapsed();
            running = false;
        }
        persist(elapsed);
        LOG.info("Usage meter stopped for user {}: {}s total", userId, elapsed);
    }

    public synchronized long elapsedSeconds() {
        return running ? computeElapsed() : lastElapsed;
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    private void persist(long elapsed) {
        synchronized (persistLock) {
            if (elapsed < persistedSeconds) {
                LOG.debug("Skipping stale usage value {}s for user {}", elapsed, userId);
                return;
            }
            directory.persistUsageSeconds(userId, elapsed);
            persistedSeconds = elapsed;
        }
    }

    private long computeElapsed() {
        long connected = Math.max(0, Duration.between(startedAt, clock.instant()).getSeconds());
        lastElapsed = Math.max(lastElapsed, priorSeconds + connected);
        return lastElapsed;
    }
}
