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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * {@link UserDirectory} over a PostgREST-style HTTP API (auth endpoint plus
 * REST tables for users, devices and conversations).
 *
 * The bearer token identifies the user; table access uses the service key.
 */
public class RestUserDirectory implements UserDirectory {
    private static final Logger LOG = LoggerFactory.getLogger(RestUserDirectory.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final String USER_SELECT =
        "*,personality:personality_id(*),device:device_id(*)";

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String serviceKey;

    public RestUserDirectory(OkHttpClient httpClient, String baseUrl, String serviceKey) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid directory URL: " + baseUrl);
        }
        if (serviceKey == null || serviceKey.isEmpty()) {
            throw new IllegalArgumentException("serviceKey cannot be null or empty");
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.serviceKey = serviceKey;
    }

    @Override
    public UserRecord resolveUser(String bearerToken) throws AuthFailureException {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new AuthFailureException("Missing bearer token");
        }
        String userId = authenticate(bearerToken);

        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("rest/v1/users")
            .addQueryParameter("user_id", "eq." + userId)
            .addQueryParameter("select", USER_SELECT)
            .build();
        JsonObject row;
        try {
            JsonArray rows = execute(serviceRequest(url).get().build()).getAsJsonArray();
            if (rows.size() == 0) {
                throw new AuthFailureException("No user profile for " + userId);
            }
            row = rows.get(0).getAsJsonObject();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new AuthFailureException("Failed to load user " + userId, e);
        }

        JsonObject device = object(row, "device");
        if (device == null || string(device, "device_id") == null) {
            throw new AuthFailureException("User " + userId + " has no linked device");
        }
        return toUser(userId, row);
    }

    private String authenticate(String bearerToken) throws AuthFailureException {
        Request request = new Request.Builder()
            .url(baseUrl.newBuilder().addPathSegments("auth/v1/user").build())
            .header("apikey", serviceKey)
            .header("Authorization", "Bearer " + bearerToken)
            .get()
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 401 || response.code() == 403) {
                throw new AuthFailureException("Token rejected by directory");
            }
            if (!response.isSuccessful()) {
                throw new AuthFailureException("Directory auth failed: HTTP " + response.code());
            }
            String id = string(parse(response).getAsJsonObject(), "id");
            if (id == null) {
                throw new AuthFailureException("Directory auth response had no user id");
            }
            return id;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new AuthFailureException("Directory unreachable", e);
        }
    }

    static UserRecord toUser(String userId, JsonObject row) {
        JsonObject personality = object(row, "personality");
        JsonObject device = object(row, "device");
        return UserRecord.builder(userId)
            .email(string(row, "email"))
            .displayName(string(row, "supervisee_name"))
            .languageCode(string(row, "language_code"))
            .premium(bool(row, "is_premium"))
            .sessionSeconds(number(row, "session_time", 0L))
            .personality(personality != null ? toPersonality(personality) : null)
            .device(device != null ? toDevice(device) : null)
            .build();
    }

    private static Personality toPersonality(JsonObject p) {
        return new Personality(
            string(p, "key"),
            string(p, "provider"),
            string(p, "oai_voice"),
            string(p, "title"),
            string(p, "character_prompt"),
            string(p, "voice_prompt"),
            string(p, "first_message_prompt"),
            p.has("pitch_factor") && !p.get("pitch_factor").isJsonNull() ? p.get("pitch_factor").getAsDouble() : 1.0);
    }

    private static DeviceRecord toDevice(JsonObject d) {
        Long volume = d.has("volume") && !d.get("volume").isJsonNull() ? number(d, "volume", 0L) : null;
        return new DeviceRecord(
            string(d, "device_id"),
            volume != null ? volume.intValue() : null,
            bool(d, "is_ota"),
            bool(d, "is_reset"),
            string(d, "selected_asset_id"),
            string(d, "current_asset_status"));
    }

    @Override
    public void persistUsageSeconds(String userId, long seconds) {
        JsonObject body = new JsonObject();
        body.addProperty("session_time", seconds);
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("rest/v1/users")
            .addQueryParameter("user_id", "eq." + userId)
            .build();
        if (send(serviceRequest(url).patch(RequestBody.create(body.toString(), JSON)).build())) {
            LOG.debug("Persisted {}s usage for user {}", seconds, userId);
        }
    }

    @Override
    public void recordConversation(UserRecord user, String role, String content) {
        JsonObject body = new JsonObject();
        body.addProperty("role", role);
        body.addProperty("content", content);
        body.addProperty("user_id", user.getUserId());
        body.addProperty("is_sensitive", false);
        if (user.getPersonality() != null) {
            body.addProperty("personality_key", user.getPersonality().getKey());
        }
        HttpUrl url = baseUrl.newBuilder().addPathSegments("rest/v1/conversations").build();
        send(serviceRequest(url).post(RequestBody.create(body.toString(), JSON)).build());
    }

    @Override
    public void recordAssetStatus(String deviceId, String status, Integer position) {
        JsonObject body = new JsonObject();
        body.addProperty("current_asset_status", status);
        if (position != null) {
            body.addProperty("current_asset_position", position);
        }
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("rest/v1/devices")
            .addQueryParameter("device_id", "eq." + deviceId)
            .build();
        send(serviceRequest(url).patch(RequestBody.create(body.toString(), JSON)).build());
    }

    @Override
    public Optional<Integer> currentVolume(UserRecord user) {
        DeviceRecord device = user.getDevice();
        if (device == null) {
            return Optional.empty();
        }
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("rest/v1/devices")
            .addQueryParameter("device_id", "eq." + device.getDeviceId())
            .addQueryParameter("select", "volume")
            .build();
        try {
            JsonArray rows = execute(serviceRequest(url).get().build()).getAsJsonArray();
            if (rows.size() == 0 || !rows.get(0).getAsJsonObject().has("volume")
                || rows.get(0).getAsJsonObject().get("volume").isJsonNull()) {
                return Optional.empty();
            }
            return Optional.of(rows.get(0).getAsJsonObject().get("volume").getAsInt());
        } catch (IOException | JsonParseException | IllegalStateException e) {
            LOG.warn("Could not fetch volume for device {}: {}", device.getDeviceId(), e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------- HTTP helpers

    private Request.Builder serviceRequest(HttpUrl url) {
        return new Request.Builder()
            .url(url)
            .header("apikey", serviceKey)
            .header("Authorization", "Bearer " + serviceKey)
            .header("Prefer", "return=minimal");
    }

    private JsonElement execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException(request.method() + " " + request.url().encodedPath()
                    + " failed: HTTP " + response.code());
            }
            return parse(response);
        }
    }

    private boolean send(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                LOG.warn("{} {} failed: HTTP {}", request.method(), request.url().encodedPath(), response.code());
                return false;
            }
            return true;
        } catch (IOException e) {
            LOG.warn("{} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            return false;
        }
    }

    private static JsonElement parse(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("Empty response body");
        }
        return JsonParser.parseString(body.string());
    }

    // ---------------------------------------------------------------- JSON helpers

    private static JsonObject object(JsonObject o, String member) {
        JsonElement e = o.get(member);
        return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
    }

    private static String string(JsonObject o, String member) {
        JsonElement e = o.get(member);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    private static boolean bool(JsonObject o, String member) {
        JsonElement e = o.get(member);
        return e != null && e.isJsonPrimitive() && e.getAsBoolean();
    }

    private static long number(JsonObject o, String member, long fallback) {
        JsonElement e = o.get(member);
        if (e == null || !e.isJsonPrimitive()) {
            return fallback;
        }
        try {
            return (long) e.getAsDouble();
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
