package io.github.drompincen.devicebridge.runtime.agent;

/** The model could not be reached within the configured timeout and retries. */
public class ModelCallException extends RuntimeException {

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
