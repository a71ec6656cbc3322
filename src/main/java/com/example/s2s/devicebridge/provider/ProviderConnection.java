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


package com.example.s2s.devicebridge.provider;

import com.example.s2s.devicebridge.audio.AudioFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Owns one session's adapter and the frames that arrive before it is ready.
 *
 * Frames offered before {@link #drainOnce()} are queued in arrival order (up
 * to a bound, oldest dropped first). {@code drainOnce} forwards them exactly
 * once and disables the queue for good; from then on {@link #offer} forwards
 * directly without taking the lock.
 */
public class ProviderConnection {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderConnection.class);

    private final ProviderAdapter adapter;
    private final int pendingLimit;
    private final Deque<AudioFrame> pending = new ArrayDeque<>();
    private volatile boolean drained = false;
    private long dropped = 0;

    public ProviderConnection(ProviderAdapter adapter, int pendingLimit) {
        if (pendingLimit <= 0) {
            throw new IllegalArgumentException("pendingLimit must be positive");
        }
        this.adapter = adapter;
        this.pendingLimit = pendingLimit;
    }

    public ProviderAdapter adapter() {
        return adapter;
    }

    /**
     * Forwards the frame if the queue has been drained, otherwise queues it.
     */
    public void offer(AudioFrame frame) {
        if (drained) {
            forward(frame);
            return;
        }
        synchronized (this) {
            if (!drained) {
                enqueue(frame);
                return;
            }
        }
        forward(frame);
    }

    /**
     * Forwards every queued frame in arrival order and switches to direct
     * forwarding. Later calls do nothing.
     *
     * @return number of frames forwarded by this call
     */
    public synchronized int drainOnce() {
        if (drained) {
            return 0;
        }
        int forwarded = 0;
        AudioFrame frame;
        while ((frame = pending.pollFirst()) != null) {
            forward(frame);
            forwarded++;
        }
        drained = true;
        if (forwarded > 0 || dropped > 0) {
            LOG.info("Forwarded {} queued frames to {} ({} dropped while waiting)", forwarded, adapter.name(), dropped);
        }
        return forwarded;
    }

    public boolean isDrained() {
        return drained;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public void close() {
        synchronized (this) {
            pending.clear();
            drained = true;
        }
        adapter.close();
    }

    private void enqueue(AudioFrame frame) {
        if (pending.size() >= pendingLimit) {
            pending.pollFirst();
            dropped++;
            if (dropped == 1 || dropped % 100 == 0) {
                LOG.warn("⚠ Pending frame queue full ({} frames), dropped {} oldest so far", pendingLimit, dropped);
            }
        }
        pending.addLast(frame);
    }

    private void forward(AudioFrame frame) {
        if (!adapter.state().acceptsAudio()) {
            LOG.debug("Dropping frame for {} in state {}", adapter.name(), adapter.state());
            return;
        }
        try {
            adapter.sendAudio(frame);
        } catch (RuntimeException e) {
            LOG.warn("Failed to forward frame to {}: {}", adapter.name(), e.getMessage());
        }
    }
}
