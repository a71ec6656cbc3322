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

import com.example.s2s.devicebridge.directory.UserRecord;
import com.example.s2s.devicebridge.registry.DeviceChannel;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One bridged device connection.
 *
 * Lifecycle state is written only by the orchestrator. The stream token is
 * advanced only by the playback controller; a superseded token value is
 * never current again.
 */
public class Session {
    private final String deviceId;
    private final UserRecord user;
    private final String providerTag;
    private final Instant createdAt;
    private final long priorSeconds;
    private final long quotaSeconds;
    private final DeviceChannel channel;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.AWAITING_AUTH);
    private final AtomicLong streamToken = new AtomicLong();
    private final Object playbackLock = new Object();

    public Session(String deviceId, UserRecord user, String providerTag, Instant createdAt,
                   long quotaSeconds, DeviceChannel channel) {
        this.deviceId = deviceId;
        this.user = user;
        this.providerTag = providerTag;
        this.createdAt = createdAt;
        this.priorSeconds = user.getSessionSeconds();
        this.quotaSeconds = quotaSeconds;
        this.channel = channel;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public UserRecord getUser() {
        return user;
    }

    public String getProviderTag() {
        return providerTag;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return cumulative seconds stored before this session started
     */
    public long getPriorSeconds() {
        return priorSeconds;
    }

    public long getQuotaSeconds() {
        return quotaSeconds;
    }

    public DeviceChannel getChannel() {
        return channel;
    }

    public SessionState state() {
        return state.get();
    }

    boolean transition(SessionState from, SessionState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Moves to CLOSING from any non-closing state.
     *
     * @return false if the session was already closing or closed
     */
    boolean beginClosing() {
        SessionState previous = state.getAndUpdate(s -> s.isClosing() ? s : SessionState.CLOSING);
        return !previous.isClosing();
    }

    void markClosed() {
        state.set(SessionState.CLOSED);
    }

    public boolean isClosing() {
        return state.get().isClosing();
    }

    // ---------------------------------------------------------------- stream token

    public long currentToken() {
        return streamToken.get();
    }

    /**
     * Invalidates the current token.
     *
     * @return the new current token
     */
    public long advanceToken() {
        return streamToken.incrementAndGet();
    }

    public boolean isCurrent(long token) {
        return streamToken.get() == token;
    }

    /**
     * Held while a playback frame is checked and written, and while the
     * session invalidates playback on close.
     */
    public Object playbackLock() {
        return playbackLock;
    }

    @Override
    public String toString() {
        return "Session{device=" + deviceId + ", user=" + user.getUserId() + ", provider=" + providerTag
            + ", state=" + state.get() + '}';
    }
}
