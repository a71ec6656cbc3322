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

import java.util.Objects;

/**
 * Secrets and upstream identifiers needed to open one provider session.
 *
 * {@code resourceId} names what to talk to on the upstream side: a model for
 * realtime model APIs, an agent id or a voice configuration id otherwise.
 */
public final class ProviderCredentials {
    private final String apiKey;
    private final String resourceId;

    public ProviderCredentials(String apiKey, String resourceId) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey cannot be null or empty");
        }
        this.apiKey = apiKey;
        this.resourceId = resourceId;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * @return a copy pointing at another upstream resource with the same key
     */
    public ProviderCredentials withResourceId(String otherResourceId) {
        return new ProviderCredentials(apiKey, otherResourceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProviderCredentials)) {
            return false;
        }
        ProviderCredentials that = (ProviderCredentials) o;
        return apiKey.equals(that.apiKey) && Objects.equals(resourceId, that.resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiKey, resourceId);
    }

    @Override
    public String toString() {
        return "ProviderCredentials{resourceId='" + resourceId + "', apiKey='***'}";
    }
}
