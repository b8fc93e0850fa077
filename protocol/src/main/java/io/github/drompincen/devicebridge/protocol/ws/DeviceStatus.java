package io.github.drompincen.devicebridge.protocol.ws;

public record DeviceStatus(String deviceName, String status) {

    public static DeviceStatus connected(String deviceName) {
        return new DeviceStatus(deviceName, "connected");
    }
}
