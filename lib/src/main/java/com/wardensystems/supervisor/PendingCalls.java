package com.wardensystems.supervisor;

import com.wardensystems.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outstanding calls keyed by correlation id. Every reply from every service is delivered here and
 * matched to the caller waiting for it, so any number of calls may be outstanding at once.
 *
 * <p>A correlation id is retired when its caller stops waiting; a reply arriving afterwards finds no
 * entry and is discarded.</p>
 */
class PendingCalls {

    private static final Logger logger = LoggerFactory.getLogger(PendingCalls.class);

    private final Map<String, CompletableFuture<Message>> pending = new ConcurrentHashMap<>();

    /**
     * Registers a call before its request is sent, so the reply can never arrive first.
     *
     * @param correlationId the request's correlation id
     * @return the future completed with the reply
     */
    CompletableFuture<Message> register(String correlationId) {
        CompletableFuture<Message> reply = new CompletableFuture<>();
        if (pending.putIfAbsent(correlationId, reply) != null) {
            throw new IllegalStateException("Correlation id already in flight: " + correlationId);
        }
        return reply;
    }

    /**
     * Delivers a reply to its waiting caller.
     *
     * @param reply a RESPONSE or ERROR message
     * @return true if a caller was waiting, false if the reply was discarded
     */
    boolean complete(Message reply) {
        CompletableFuture<Message> waiting = pending.remove(reply.correlationId());
        if (waiting == null) {
            logger.debug("Discarding {} from {} for retired call {}",
                    reply.kind(), reply.sourceService(), reply.correlationId());
            return false;
        }
        return waiting.complete(reply);
    }

    /**
     * Stops waiting for a reply.
     *
     * @param correlationId the call to retire
     * @return true if the call was still outstanding
     */
    boolean retire(String correlationId) {
        return pending.remove(correlationId) != null;
    }

    /**
     * Fails every outstanding call, used when the supervisor shuts down.
     *
     * @param cause the failure handed to each caller
     */
    void failAll(Throwable cause) {
        pending.keySet().forEach(id -> {
            CompletableFuture<Message> waiting = pending.remove(id);
            if (waiting != null) {
                waiting.completeExceptionally(cause);
            }
        });
    }

    int size() {
        return pending.size();
    }
}
