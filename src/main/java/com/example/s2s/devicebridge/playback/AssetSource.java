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


package com.example.s2s.devicebridge.playback;

import java.util.Objects;

/**
 * A stored audio asset, addressed by id, by URL, or both.
 */
public final class AssetSource {
    private final String assetId;
    private final String url;

    private AssetSource(String assetId, String url) {
        if ((assetId == null || assetId.isEmpty()) && (url == null || url.isEmpty())) {
            throw new IllegalArgumentException("Asset needs an id or a URL");
        }
        this.assetId = assetId;
        this.url = url;
    }

    public static AssetSource of(String assetId, String url) {
        return new AssetSource(assetId, url);
    }

    public static AssetSource byId(String assetId) {
        return new AssetSource(assetId, null);
    }

    public String getAssetId() {
        return assetId;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssetSource)) {
            return false;
        }
        AssetSource that = (AssetSource) o;
        return Objects.equals(assetId, that.assetId) && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetId, url);
    }

    @Override
    public String toString() {
        return "AssetSource{" + (assetId != null ? "id=" + assetId : "") + (url != null ? " url=" + url : "") + '}';
    }
}
