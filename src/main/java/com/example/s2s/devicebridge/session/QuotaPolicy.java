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

/**
 * Connected-seconds allowance per tier.
 */
public class QuotaPolicy {
    private final long freeSeconds;
    private final long premiumSeconds;

    public QuotaPolicy(long freeSeconds, long premiumSeconds) {
        if (freeSeconds <= 0 || premiumSeconds <= 0) {
            throw new IllegalArgumentException("Quotas must be positive");
        }
        this.freeSeconds = freeSeconds;
        this.premiumSeconds = premiumSeconds;
    }

    public long quotaFor(UserRecord user) {
        return user.isPremium() ? premiumSeconds : freeSeconds;
    }

    public boolean isExhausted(UserRecord user) {
        return user.getSessionSeconds() >= quotaFor(user);
    }

    public long getFreeSeconds() {
        return freeSeconds;
    }

    public long getPremiumSeconds() {
        return premiumSeconds;
    }
}
