package examples;

import com.wardensystems.ServiceCallException;
import com.wardensystems.ServiceHealth;
import com.wardensystems.ServiceOrchestrator;
import com.wardensystems.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Starts the three example services, runs a short user/order/notification workflow, kills one service
 * and lets the health monitor bring it back.
 */
public class OrchestrationExample {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationExample.class);

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = new OrchestratorConfig()
                .setCheckInterval(Duration.ofMillis(500))
                .setHeartbeatInterval(Duration.ofMillis(200))
                .setSlowThreshold(Duration.ofSeconds(1))
                .setDeadThreshold(Duration.ofSeconds(3));

        try (ServiceOrchestrator orchestrator = new ServiceOrchestrator(config)) {
            orchestrator.start();
            orchestrator.startService(UserService.NAME, UserService::new);
            orchestrator.startService(OrderService.NAME, OrderService::new);
            orchestrator.startService(NotificationService.NAME, NotificationService::create);

            Map<String, Object> created = orchestrator.call(UserService.NAME, "create_user",
                    Map.of("username", "ada", "email", "ada@example.com"));
            logger.info("Created: {}", created);

            Map<String, Object> order = orchestrator.call(OrderService.NAME, "create_order",
                    Map.of("user_id", 1, "product", "Laptop", "quantity", 2));
            logger.info("Order: {}", order);

            try {
                orchestrator.call(OrderService.NAME, "create_order", Map.of("user_id", 99, "product", "Phone"));
            } catch (ServiceCallException e) {
                logger.info("Rejected as expected: {} {}", e.getErrorCode(), e.getMessage());
            }

            orchestrator.call(NotificationService.NAME, "send_notification",
                    Map.of("user_id", 1, "message", "Your order has been created"));

            long killedUnit = orchestrator.health(UserService.NAME).orElseThrow().executionId();
            orchestrator.getRegistry().get(UserService.NAME).orElseThrow().executionHandle().terminate();
            logger.info("Terminated {} unit {}, waiting for the monitor", UserService.NAME, killedUnit);
            Thread.sleep(2000);

            for (ServiceHealth health : orchestrator.healthAll()) {
                logger.info("{}: {} (unit {}, restarts {}, requests {})", health.name(), health.status(),
                        health.executionId(), health.restartCount(), health.stats().requestCount());
            }
        }
    }
}
