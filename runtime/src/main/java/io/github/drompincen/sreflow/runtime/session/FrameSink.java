package io.github.drompincen.sreflow.runtime.session;

import io.github.drompincen.sreflow.protocol.ws.ServerFrame;

import java.io.IOException;

/**
 * One client channel subscribed to a workflow thread.
 */
public interface FrameSink {

    String id();

    void send(ServerFrame frame) throws IOException;

    default boolean isOpen() { return true; }
}
