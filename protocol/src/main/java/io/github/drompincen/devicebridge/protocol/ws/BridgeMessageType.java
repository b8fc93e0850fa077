package io.github.drompincen.devicebridge.protocol.ws;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BridgeMessageType {
    // Device -> Hub
    REGISTER,
    LOG,
    RESPONSE,
    PONG,

    // Viewer -> Hub
    SUBSCRIBE,

    // Hub -> Device
    REGISTERED,
    TASK,
    PING,
    RESET,

    // Hub -> Viewer
    DEVICES,
    DEVICE_LOG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns null for names this hub does not understand. */
    @JsonCreator
    public static BridgeMessageType fromWire(String value) {
        if (value == null) return null;
        for (BridgeMessageType t : values()) {
            if (t.wireName().equals(value)) return t;
        }
        return null;
    }
}
