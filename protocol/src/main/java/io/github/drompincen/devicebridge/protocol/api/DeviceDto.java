package io.github.drompincen.devicebridge.protocol.api;

public record DeviceDto(String deviceName) {}
