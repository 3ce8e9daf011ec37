package com.deepansh.historyagent.conversation;

import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.core.Orchestrator;
import com.deepansh.historyagent.exception.ConversationBusyException;
import com.deepansh.historyagent.model.AgentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest state of every conversation in memory and runs at most one turn
 * per conversation at a time. State is lost on restart.
 *
 * Idle conversations expire after {@code agent.conversation.idle-ttl}; the clock
 * restarts on every completed turn. When more than {@code agent.conversation.max-conversations}
 * are held, the least recently used ones are dropped. A conversation with a running
 * turn is never evicted.
 */
@Service
@Slf4j
public class ConversationService {

    private final Orchestrator orchestrator;
    private final Clock clock;
    private final Duration idleTtl;
    private final int maxConversations;
    private final Map<String, StoredConversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public ConversationService(Orchestrator orchestrator, AgentProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.idleTtl = properties.getConversation().getIdleTtl();
        this.maxConversations = Math.max(1, properties.getConversation().getMaxConversations());
    }

    /**
     * Runs one turn. A null id starts a new conversation; an id not seen before
     * (or expired) starts a new conversation under that id.
     *
     * @throws ConversationBusyException if a turn for the same conversation is still running
     */
    public AgentState chat(String conversationId, String message) {
        String id = conversationId != null && !conversationId.isBlank()
                ? conversationId : UUID.randomUUID().toString();

        CancellationToken token = new CancellationToken();
        if (inFlight.putIfAbsent(id, token) != null) {
            throw new ConversationBusyException(id);
        }

        try {
            evictIdle();
            AgentState prior = latest(id).orElse(null);
            AgentState result = prior == null
                    ? orchestrator.start(id, message, token)
                    : orchestrator.submit(prior, message, token);
            conversations.put(id, new StoredConversation(result, clock.instant()));
            evictOverflow();
            return result;
        } finally {
            inFlight.remove(id, token);
        }
    }

    /** @return true if a running turn was signalled */
    public boolean cancel(String conversationId) {
        CancellationToken token = inFlight.get(conversationId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling turn [conversationId={}]", conversationId);
        token.cancel();
        return true;
    }

    public Optional<AgentState> latest(String conversationId) {
        StoredConversation stored = conversations.get(conversationId);
        if (stored == null || isExpired(stored)) {
            return Optional.empty();
        }
        return Optional.of(stored.state());
    }

    int size() {
        return conversations.size();
    }

    private boolean isExpired(StoredConversation stored) {
        return stored.lastActive().plus(idleTtl).isBefore(clock.instant());
    }

    private void evictIdle() {
        conversations.entrySet().removeIf(e -> {
            boolean evict = !inFlight.containsKey(e.getKey()) && isExpired(e.getValue());
            if (evict) {
                log.debug("Conversation expired [conversationId={}]", e.getKey());
            }
            return evict;
        });
    }

    private void evictOverflow() {
        int excess = conversations.size() - maxConversations;
        if (excess <= 0) {
            return;
        }
        conversations.entrySet().stream()
                .filter(e -> !inFlight.containsKey(e.getKey()))
                .sorted(Comparator.comparing(e -> e.getValue().lastActive()))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(id -> {
                    conversations.remove(id);
                    log.debug("Conversation evicted, capacity {} reached [conversationId={}]",
                            maxConversations, id);
                });
    }

    private record StoredConversation(AgentState state, Instant lastActive) {}
}
