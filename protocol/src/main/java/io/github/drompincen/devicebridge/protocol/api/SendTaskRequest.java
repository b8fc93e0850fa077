package io.github.drompincen.devicebridge.protocol.api;

public record SendTaskRequest(String deviceName, String content) {}
