package com.wardensystems.supervisor;

import com.wardensystems.protocol.ErrorCode;
import com.wardensystems.protocol.Message;
import com.wardensystems.protocol.MessageKind;
import com.wardensystems.protocol.MessageProtocol;
import com.wardensystems.test.MessageMatchers;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class PendingCallsTest {

    private final PendingCalls pending = new PendingCalls();

    @Test
    void replyCompletesMatchingCaller() throws Exception {
        Message first = MessageProtocol.buildRequest("gateway", "users", "get_user", null);
        Message second = MessageProtocol.buildRequest("gateway", "users", "list_users", null);
        CompletableFuture<Message> firstReply = pending.register(first.correlationId());
        CompletableFuture<Message> secondReply = pending.register(second.correlationId());

        assertTrue(pending.complete(MessageProtocol.buildResponse(second, Map.of("count", 0), true)));

        assertFalse(firstReply.isDone());
        Message answer = secondReply.get();
        assertTrue(MessageMatchers.allOf(
                MessageMatchers.answers(second),
                MessageMatchers.kind(MessageKind.RESPONSE),
                MessageMatchers.payloadEntry("count", 0)).test(answer));
        assertFalse(MessageMatchers.answers(first).test(answer));
        assertEquals(1, pending.size());
    }

    @Test
    void errorReplyReachesItsCaller() throws Exception {
        Message request = MessageProtocol.buildRequest("OrderService", "UserService", "validate_user", null);
        CompletableFuture<Message> reply = pending.register(request.correlationId());

        assertTrue(pending.complete(MessageProtocol.buildError(request, ErrorCode.NOT_FOUND, "User 9 not found")));

        assertTrue(MessageMatchers.allOf(
                MessageMatchers.answers(request),
                MessageMatchers.action("validate_user"),
                MessageMatchers.errorCode(ErrorCode.NOT_FOUND)).test(reply.get()));
    }

    @Test
    void lateReplyIsDiscarded() {
        Message request = MessageProtocol.buildRequest("gateway", "users", "get_user", null);
        CompletableFuture<Message> reply = pending.register(request.correlationId());

        assertTrue(pending.retire(request.correlationId()));
        assertFalse(pending.complete(MessageProtocol.buildResponse(request, null, true)));
        assertFalse(reply.isDone());
        assertFalse(pending.retire(request.correlationId()));
    }

    @Test
    void duplicateRegistrationIsRejected() {
        pending.register("abc");
        assertThrows(IllegalStateException.class, () -> pending.register("abc"));
    }

    @Test
    void failAllFailsEveryCaller() {
        CompletableFuture<Message> a = pending.register("a");
        CompletableFuture<Message> b = pending.register("b");

        pending.failAll(new IllegalStateException("closing"));

        ExecutionException error = assertThrows(ExecutionException.class, a::get);
        assertEquals("closing", error.getCause().getMessage());
        assertTrue(b.isCompletedExceptionally());
        assertEquals(0, pending.size());
    }
}
