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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-turn "already signalled" flag.
 *
 * Upstreams announce a response several ways (created event, first audio
 * delta, transcript); only the first announcement of a turn wins, and only a
 * started turn can complete.
 */
public final class TurnTracker {
    private final AtomicBoolean inTurn = new AtomicBoolean(false);

    /**
     * @return true if this call opened a new turn
     */
    public boolean begin() {
        return inTurn.compareAndSet(false, true);
    }

    /**
     * @return true if this call closed the open turn
     */
    public boolean end() {
        return inTurn.compareAndSet(true, false);
    }

    public boolean inTurn() {
        return inTurn.get();
    }

    public void reset() {
        inTurn.set(false);
    }
}
