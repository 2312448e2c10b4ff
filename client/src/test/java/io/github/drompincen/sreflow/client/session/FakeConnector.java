package io.github.drompincen.sreflow.client.session;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Hands out in-memory channels and keeps the listener of each connect call. */
class FakeConnector implements ChannelConnector {

    final List<ChannelListener> listeners = new ArrayList<>();
    final List<FakeChannel> channels = new ArrayList<>();

    @Override
    public WorkflowChannel connect(ChannelListener listener) {
        FakeChannel channel = new FakeChannel();
        listeners.add(listener);
        channels.add(channel);
        return channel;
    }

    /** Opens the most recent channel from the transport side. */
    FakeChannel open() {
        FakeChannel channel = last();
        lastListener().onOpen(channel);
        return channel;
    }

    void receive(String text) {
        lastListener().onText(text);
    }

    FakeChannel last() {
        return channels.get(channels.size() - 1);
    }

    ChannelListener lastListener() {
        return listeners.get(listeners.size() - 1);
    }

    long openChannels() {
        return channels.stream().filter(FakeChannel::isOpen).count();
    }

    static class FakeChannel implements WorkflowChannel {

        final List<String> sent = new ArrayList<>();
        boolean open = true;
        boolean failSends;
        int closeCalls;

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String text) throws IOException {
            if (failSends) throw new IOException("broken pipe");
            sent.add(text);
        }

        @Override
        public void close() {
            closeCalls++;
            open = false;
        }
    }
}
