package io.github.drompincen.devicebridge.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON codec for hub frames. Decoding is strict about the frame shape: a frame must be a JSON
 * object with a known {@code type} and the fields that type requires.
 */
public class BridgeCodec {

    private final ObjectMapper objectMapper;

    public BridgeCodec() {
        this(new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public BridgeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(BridgeMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type() + " frame", e);
        }
    }

    public BridgeMessage decode(String frame) throws ProtocolException {
        BridgeMessage message;
        try {
            message = objectMapper.readValue(frame, BridgeMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.type() == null) {
            throw new ProtocolException("Missing or unknown message type");
        }
        switch (message.type()) {
            case REGISTER -> require(message.deviceName(), "deviceName", message);
            case TASK -> {
                require(message.messageId(), "messageId", message);
                require(message.content(), "content", message);
            }
            case RESPONSE -> {
                require(message.messageId(), "messageId", message);
                if (message.content() == null) throw missing("content", message);
            }
            case LOG -> {
                if (message.message() == null) throw missing("message", message);
            }
            default -> { }
        }
        return message;
    }

    private static void require(String value, String field, BridgeMessage message) throws ProtocolException {
        if (value == null || value.isBlank()) throw missing(field, message);
    }

    private static ProtocolException missing(String field, BridgeMessage message) {
        return new ProtocolException("'" + message.type().wireName() + "' frame requires " + field);
    }
}
