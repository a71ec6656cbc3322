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

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Fetches assets over HTTP. An explicit URL wins; otherwise the asset id is
 * resolved as {@code <base>/<id>.wav}.
 */
public class HttpAssetResolver implements AssetResolver {
    private static final Logger LOG = LoggerFactory.getLogger(HttpAssetResolver.class);

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;

    /**
     * @param baseUrl base for id-only assets, may be null if every request carries a URL
     */
    public HttpAssetResolver(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl != null && !baseUrl.isEmpty() ? HttpUrl.parse(baseUrl) : null;
        if (baseUrl != null && !baseUrl.isEmpty() && this.baseUrl == null) {
            throw new IllegalArgumentException("Invalid asset base URL: " + baseUrl);
        }
    }

    HttpUrl resolve(AssetSource source) throws IOException {
        if (source.getUrl() != null) {
            HttpUrl url = HttpUrl.parse(source.getUrl());
            if (url == null) {
                throw new IOException("Invalid asset URL: " + source.getUrl());
            }
            return url;
        }
        if (baseUrl == null) {
            throw new IOException("No ASSET_BASE_URL configured for asset " + source.getAssetId());
        }
        return baseUrl.newBuilder().addPathSegment(source.getAssetId() + ".wav").build();
    }

    @Override
    public byte[] fetch(AssetSource source) throws IOException {
        HttpUrl url = resolve(source);
        LOG.info("Fetching asset {} from {}", source.getAssetId(), url);
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Asset fetch failed: HTTP " + response.code() + " for " + url);
            }
            byte[] bytes = body.bytes();
            LOG.debug("Fetched {} bytes for {}", bytes.length, source);
            return bytes;
        }
    }
}
