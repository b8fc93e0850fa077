package io.github.drompincen.devicebridge.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * One frame of the hub wire protocol. Only the fields relevant to {@link #type()} are set;
 * the rest stay null and are omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeMessage(
        BridgeMessageType type,
        String deviceName,
        String messageId,
        String content,
        String message,
        Instant time,
        List<DeviceStatus> devices
) {
    public static BridgeMessage register(String deviceName) {
        return new BridgeMessage(BridgeMessageType.REGISTER, deviceName, null, null, null, null, null);
    }

    public static BridgeMessage registered(String deviceName) {
        return new BridgeMessage(BridgeMessageType.REGISTERED, deviceName, null, null, null, null, null);
    }

    public static BridgeMessage subscribe() {
        return new BridgeMessage(BridgeMessageType.SUBSCRIBE, null, null, null, null, null, null);
    }

    public static BridgeMessage devices(List<DeviceStatus> devices) {
        return new BridgeMessage(BridgeMessageType.DEVICES, null, null, null, null, null, List.copyOf(devices));
    }

    public static BridgeMessage log(String message) {
        return new BridgeMessage(BridgeMessageType.LOG, null, null, null, message, null, null);
    }

    public static BridgeMessage deviceLog(String deviceName, Instant time, String message) {
        return new BridgeMessage(BridgeMessageType.DEVICE_LOG, deviceName, null, null, message, time, null);
    }

    public static BridgeMessage task(String messageId, String content) {
        return new BridgeMessage(BridgeMessageType.TASK, null, messageId, content, null, null, null);
    }

    public static BridgeMessage response(String messageId, String content) {
        return new BridgeMessage(BridgeMessageType.RESPONSE, null, messageId, content, null, null, null);
    }

    public static BridgeMessage ping() {
        return new BridgeMessage(BridgeMessageType.PING, null, null, null, null, null, null);
    }

    public static BridgeMessage pong() {
        return new BridgeMessage(BridgeMessageType.PONG, null, null, null, null, null, null);
    }

    public static BridgeMessage reset() {
        return new BridgeMessage(BridgeMessageType.RESET, null, null, null, null, null, null);
    }
}
