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
 * Device settings sent to the device in the {@code auth} message.
 */
public final class DeviceRecord {
    public static final int DEFAULT_VOLUME = 20;
    public static final String DEFAULT_ASSET_STATUS = "stopped";

    private final String deviceId;
    private final Integer volume;
    private final boolean ota;
    private final boolean reset;
    private final String selectedAssetId;
    private final String currentAssetStatus;

    public DeviceRecord(String deviceId, Integer volume, boolean ota, boolean reset,
                        String selectedAssetId, String currentAssetStatus) {
        if (deviceId == null || deviceId.isEmpty()) {
            throw new IllegalArgumentException("deviceId cannot be null or empty");
        }
        this.deviceId = deviceId;
        this.volume = volume;
        this.ota = ota;
        this.reset = reset;
        this.selectedAssetId = selectedAssetId;
        this.currentAssetStatus = currentAssetStatus;
    }

    public static DeviceRecord of(String deviceId) {
        return new DeviceRecord(deviceId, null, false, false, null, null);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public int getVolumeOrDefault() {
        return volume != null ? volume : DEFAULT_VOLUME;
    }

    public Integer getVolume() {
        return volume;
    }

    public boolean isOta() {
        return ota;
    }

    public boolean isReset() {
        return reset;
    }

    public String getSelectedAssetId() {
        return selectedAssetId;
    }

    public String getCurrentAssetStatus() {
        return currentAssetStatus != null ? currentAssetStatus : DEFAULT_ASSET_STATUS;
    }

    @Override
    public String toString() {
        return "DeviceRecord{deviceId='" + deviceId + "', volume=" + volume + ", ota=" + ota + ", reset=" + reset + '}';
    }
}
