package examples;

import com.wardensystems.service.ActionRouter;
import com.wardensystems.service.Payloads;
import com.wardensystems.service.ServiceContext;

import java.util.Locale;
import java.util.Map;

/**
 * Simulated notification sender built with {@link ActionRouter}. The sent count lives in the shared
 * statistics store, where it shows up in the service's health view.
 *
 * <p>Actions: {@code send_notification} (user_id, message, optional type), {@code get_stats}.</p>
 */
public final class NotificationService {

    public static final String NAME = "NotificationService";
    static final String SENT_COUNTER = "notifications_sent";

    private NotificationService() {
    }

    public static ActionRouter create() {
        return ActionRouter.builder()
                .on("send_notification", NotificationService::send)
                .on("get_stats", (payload, context) -> Map.of(SENT_COUNTER, context.counter(SENT_COUNTER)))
                .build();
    }

    private static Map<String, Object> send(Map<String, Object> payload, ServiceContext context) {
        long userId = Payloads.requireLong(payload, "user_id");
        String message = Payloads.requireString(payload, "message");
        String type = Payloads.optionalString(payload, "type", "email").toLowerCase(Locale.ROOT);

        context.getLogger().info("Sending {} to user {}: {}", type, userId, message);
        long sent = context.increment(SENT_COUNTER);

        String label = type.isEmpty() ? type : Character.toUpperCase(type.charAt(0)) + type.substring(1);
        return Map.of("message", label + " notification sent", "user_id", userId, SENT_COUNTER, sent);
    }
}
