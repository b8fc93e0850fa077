package io.github.drompincen.devicebridge.protocol.api;

/** Failures the hub reports to the orchestrator instead of a device response. */
public enum BridgeError {
    NOT_CONNECTED,
    TIMEOUT,
    DISCONNECTED
}
