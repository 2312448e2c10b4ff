package io.github.drompincen.sreflow.client.session;

/**
 * Callbacks of one channel. Implementations receive them one at a time, in arrival order.
 */
public interface ChannelListener {

    void onOpen(WorkflowChannel channel);

    void onText(String text);

    void onTransportError(Throwable error);

    void onClosed();
}
