package io.github.drompincen.sreflow.client.session;

/**
 * Opens workflow channels. {@link #connect} returns at once; the listener is told when
 * the channel opens or fails.
 */
@FunctionalInterface
public interface ChannelConnector {

    WorkflowChannel connect(ChannelListener listener);
}
