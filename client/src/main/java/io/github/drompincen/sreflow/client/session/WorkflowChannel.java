package io.github.drompincen.sreflow.client.session;

import java.io.IOException;

/** A bidirectional text channel to the workflow endpoint. */
public interface WorkflowChannel {

    boolean isOpen();

    void send(String text) throws IOException;

    /** Idempotent; also cancels a connection attempt still in progress. */
    void close();
}
