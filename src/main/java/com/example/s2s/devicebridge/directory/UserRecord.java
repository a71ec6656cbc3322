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

/**
 * Authenticated user as resolved from a bearer token.
 */
public final class UserRecord {
    private final String userId;
    private final String email;
    private final String displayName;
    private final String languageCode;
    private final boolean premium;
    private final long sessionSeconds;
    private final Personality personality;
    private final DeviceRecord device;

    private UserRecord(Builder builder) {
        this.userId = builder.userId;
        this.email = builder.email;
        this.displayName = builder.displayName;
        this.languageCode = builder.languageCode;
        this.premium = builder.premium;
        this.sessionSeconds = builder.sessionSeconds;
        this.personality = builder.personality;
        this.device = builder.device;
    }

    public static Builder builder(String userId) {
        return new Builder(userId);
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public boolean isPremium() {
        return premium;
    }

    /**
     * @return cumulative connected seconds stored before this session
     */
    public long getSessionSeconds() {
        return sessionSeconds;
    }

    /**
     * @return selected personality, or null
     */
    public Personality getPersonality() {
        return personality;
    }

    /**
     * @return linked device, or null
     */
    public DeviceRecord getDevice() {
        return device;
    }

    @Override
    public String toString() {
        return "UserRecord{userId='" + userId + "', premium=" + premium + ", sessionSeconds=" + sessionSeconds
            + ", personality=" + personality + ", device=" + device + '}';
    }

    public static final class Builder {
        private final String userId;
        private String email;
        private String displayName;
        private String languageCode = "en-US";
        private boolean premium;
        private long sessionSeconds;
        private Personality personality;
        private DeviceRecord device;

        private Builder(String userId) {
            if (userId == null || userId.isEmpty()) {
                throw new IllegalArgumentException("userId cannot be null or empty");
            }
            this.userId = userId;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder languageCode(String languageCode) {
            if (languageCode != null && !languageCode.isEmpty()) {
                this.languageCode = languageCode;
            }
            return this;
        }

        public Builder premium(boolean premium) {
            this.premium = premium;
            return this;
        }

        public Builder sessionSeconds(long sessionSeconds) {
            this.sessionSeconds = Math.max(0, sessionSeconds);
            return this;
        }

        public Builder personality(Personality personality) {
            this.personality = personality;
            return this;
        }

        public Builder device(DeviceRecord device) {
            this.device = device;
            return this;
        }

        public UserRecord build() {
            return new UserRecord(this);
        }
    }
}
