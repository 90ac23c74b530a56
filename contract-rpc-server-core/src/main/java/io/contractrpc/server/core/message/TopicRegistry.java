package io.contractrpc.server.core.message;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic memberships of the sessions of one {@link MessageRouter}.
 */
final class TopicRegistry {

    private final ConcurrentHashMap<String, Set<MessageSession>> topics = new ConcurrentHashMap<>();

    void subscribe(String topic, MessageSession session) {
        topics.computeIfAbsent(topic, t -> ConcurrentHashMap.newKeySet()).add(session);
    }

    void unsubscribe(String topic, MessageSession session) {
        topics.computeIfPresent(topic, (t, members) -> {
            members.remove(session);
            return members.isEmpty() ? null : members;
        });
    }

    void unsubscribeAll(MessageSession session) {
        for (String topic : topics.keySet()) {
            unsubscribe(topic, session);
        }
    }

    Set<MessageSession> subscribers(String topic) {
        Set<MessageSession> members = topics.get(topic);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    boolean isSubscribed(String topic, MessageSession session) {
        Set<MessageSession> members = topics.get(topic);
        return members != null && members.contains(session);
    }
}
