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

import com.example.s2s.devicebridge.directory.DeviceRecord;
import com.example.s2s.devicebridge.directory.Personality;
import com.google.gson.JsonObject;

/**
 * JSON control messages sent to the device.
 */
public final class DeviceMessages {

    public static final String RESPONSE_CREATED = "RESPONSE.CREATED";
    public static final String RESPONSE_COMPLETE = "RESPONSE.COMPLETE";
    public static final String RESPONSE_ERROR = "RESPONSE.ERROR";
    public static final String SESSION_CREATED = "SESSION.CREATED";
    public static final String SESSION_END = "SESSION.END";

    public static final String QUOTA_EXCEEDED = "QUOTA_EXCEEDED";
    public static final String UNKNOWN_PROVIDER = "UNKNOWN_PROVIDER";
    public static final String UPSTREAM_UNAVAILABLE = "UPSTREAM_UNAVAILABLE";
    public static final String PROVIDER_TIMEOUT = "PROVIDER_TIMEOUT";
    public static final String ENCODER_UNAVAILABLE = "ENCODER_UNAVAILABLE";
    public static final String ASSET_UNAVAILABLE = "ASSET_UNAVAILABLE";

    private DeviceMessages() {
    }

    /**
     * First message of every session.
     */
    public static JsonObject auth(DeviceRecord device, Personality personality) {
        JsonObject message = new JsonObject();
        message.addProperty("type", "auth");
        message.addProperty("volume_control", device != null ? device.getVolumeOrDefault() : DeviceRecord.DEFAULT_VOLUME);
        message.addProperty("is_ota", device != null && device.isOta());
        message.addProperty("is_reset", device != null && device.isReset());
        message.addProperty("pitch_factor", personality != null ? personality.getPitchFactor() : 1.0);
        message.addProperty("selected_asset_id", device != null ? device.getSelectedAssetId() : null);
        message.addProperty("current_asset_status",
            device != null ? device.getCurrentAssetStatus() : DeviceRecord.DEFAULT_ASSET_STATUS);
        return message;
    }

    public static JsonObject server(String msg) {
        JsonObject message = new JsonObject();
        message.addProperty("type", "server");
        message.addProperty("msg", msg);
        return message;
    }

    public static JsonObject responseComplete(Integer volume) {
        JsonObject message = server(RESPONSE_COMPLETE);
        if (volume != null) {
            message.addProperty("volume_control", volume);
        }
        return message;
    }

    public static JsonObject responseError(String error) {
        JsonObject message = server(RESPONSE_ERROR);
        message.addProperty("error", error);
        return message;
    }

    public static JsonObject error(String code, String text) {
        JsonObject message = new JsonObject();
        message.addProperty("type", "error");
        message.addProperty("code", code);
        message.addProperty("message", text);
        return message;
    }

    public static JsonObject assetStatus(String status, String assetId, long streamToken) {
        JsonObject message = new JsonObject();
        message.addProperty("type", "asset_status");
        message.addProperty("status", status);
        if (assetId != null) {
            message.addProperty("asset_id", assetId);
        }
        message.addProperty("stream", streamToken);
        return message;
    }

    /**
     * @param positionSeconds playback position within the asset
     */
    public static JsonObject assetStatus(String status, String assetId, long streamToken, int positionSeconds) {
        JsonObject message = assetStatus(status, assetId, streamToken);
        message.addProperty("position", positionSeconds);
        return message;
    }
}
