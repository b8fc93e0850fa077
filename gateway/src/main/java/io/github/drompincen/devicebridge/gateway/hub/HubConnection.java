package io.github.drompincen.devicebridge.gateway.hub;

import java.io.IOException;

/** A live, bidirectional channel to one device or viewer. */
public interface HubConnection {

    String id();

    boolean isOpen();

    void send(String frame) throws IOException;
}
