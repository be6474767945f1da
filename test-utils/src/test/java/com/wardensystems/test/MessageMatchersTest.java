package com.wardensystems.test;

import com.wardensystems.protocol.ErrorCode;
import com.wardensystems.protocol.Message;
import com.wardensystems.protocol.MessageKind;
import com.wardensystems.protocol.MessageProtocol;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class MessageMatchersTest {

    private final Message request = MessageProtocol.buildRequest("gateway", "UserService", "get_user", Map.of("user_id", 7));

    @Test
    void answersMatchesOnlyRepliesToTheRequest() {
        Message reply = MessageProtocol.buildResponse(request, Map.of("user", "ada"), true);
        Message other = MessageProtocol.buildResponse(
                MessageProtocol.buildRequest("gateway", "UserService", "get_user", null), null, true);

        assertTrue(MessageMatchers.answers(request).test(reply));
        assertFalse(MessageMatchers.answers(request).test(other));
        assertFalse(MessageMatchers.answers(request).test(request));
    }

    @Test
    void combinators() {
        Message error = MessageProtocol.buildError(request, ErrorCode.NOT_FOUND, "User 7 not found");
        Predicate<Message> notFound = MessageMatchers.allOf(
                MessageMatchers.kind(MessageKind.ERROR),
                MessageMatchers.errorCode(ErrorCode.NOT_FOUND),
                MessageMatchers.action("get_user"));

        assertTrue(notFound.test(error));
        assertFalse(notFound.test(request));
        assertTrue(MessageMatchers.anyOf(MessageMatchers.payloadEntry("user_id", 7), notFound).test(request));
        assertThrows(IllegalArgumentException.class, () -> MessageMatchers.allOf());
    }
}
