package io.github.drompincen.devicebridge.protocol.ws;

/** A wire frame that could not be decoded into a {@link BridgeMessage}. */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
