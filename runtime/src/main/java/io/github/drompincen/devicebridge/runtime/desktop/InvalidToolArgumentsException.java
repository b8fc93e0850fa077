package io.github.drompincen.devicebridge.runtime.desktop;

public class InvalidToolArgumentsException extends Exception {

    public InvalidToolArgumentsException(String message) {
        super(message);
    }
}
