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


package com.example.s2s.devicebridge.directory;

import java.util.Optional;

/**
 * External user/device directory. The bridge only consumes it.
 */
public interface UserDirectory {

    /**
     * @param bearerToken token from the upgrade request, without the "Bearer " prefix
     * @return the user with personality and device
     * @throws AuthFailureException if the token is not accepted
     */
    UserRecord resolveUser(String bearerToken) throws AuthFailureException;

    /**
     * Stores the user's cumulative connected seconds. Failures are logged, not thrown.
     */
    void persistUsageSeconds(String userId, long seconds);

    /**
     * Appends one utterance to the user's conversation history.
     */
    default void recordConversation(UserRecord user, String role, String content) {
    }

    /**
     * Stores a playback status reported by the device.
     */
    default void recordAssetStatus(String deviceId, String status, Integer position) {
    }

    /**
     * @return the device volume as currently stored, if known
     */
    default Optional<Integer> currentVolume(UserRecord user) {
        DeviceRecord device = user.getDevice();
        return device != null ? Optional.ofNullable(device.getVolume()) : Optional.empty();
    }
}
