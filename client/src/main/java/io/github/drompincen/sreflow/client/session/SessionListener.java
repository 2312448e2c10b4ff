package io.github.drompincen.sreflow.client.session;

import io.github.drompincen.sreflow.client.conversation.ConversationSnapshot;

@FunctionalInterface
public interface SessionListener {

    void onUpdate(String issueKey, ClientSessionState state, ConversationSnapshot snapshot);
}
