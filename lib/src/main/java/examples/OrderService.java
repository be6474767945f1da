package examples;

import com.wardensystems.service.Payloads;
import com.wardensystems.service.ServiceContext;
import com.wardensystems.service.ServiceException;
import com.wardensystems.service.ServiceHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps an in-memory order table. Creating an order first asks {@link UserService} whether the user exists.
 *
 * <p>Actions: {@code create_order} (user_id, product, optional quantity), {@code get_order} (order_id),
 * {@code list_orders}.</p>
 */
public class OrderService implements ServiceHandler<OrderService.Command> {

    public static final String NAME = "OrderService";

    sealed interface Command permits CreateOrder, GetOrder, ListOrders {
    }

    record CreateOrder(long userId, String product, long quantity) implements Command {
    }

    record GetOrder(long orderId) implements Command {
    }

    record ListOrders() implements Command {
    }

    record Order(long id, long userId, String product, long quantity, String status) {
        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", id);
            map.put("user_id", userId);
            map.put("product", product);
            map.put("quantity", quantity);
            map.put("status", status);
            return map;
        }
    }

    private final Map<Long, Order> orders = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public Command decode(String action, Map<String, Object> payload) {
        return switch (action) {
            case "create_order" -> {
                long quantity = Payloads.optionalLong(payload, "quantity", 1);
                if (quantity < 1) {
                    throw ServiceException.invalidPayload("quantity must be at least 1");
                }
                yield new CreateOrder(
                        Payloads.requireLong(payload, "user_id"),
                        Payloads.requireString(payload, "product"),
                        quantity);
            }
            case "get_order" -> new GetOrder(Payloads.requireLong(payload, "order_id"));
            case "list_orders" -> new ListOrders();
            default -> throw ServiceException.unknownAction(action);
        };
    }

    @Override
    public Map<String, Object> handle(Command command, ServiceContext context) {
        if (command instanceof CreateOrder create) {
            return createOrder(create, context);
        } else if (command instanceof GetOrder get) {
            Order order = orders.get(get.orderId());
            if (order == null) {
                throw ServiceException.notFound("Order " + get.orderId() + " not found");
            }
            return Map.of("order", order.toMap());
        } else if (command instanceof ListOrders) {
            List<Map<String, Object>> all = orders.values().stream().map(Order::toMap).toList();
            return Map.of("orders", all, "count", all.size());
        }
        throw new IllegalStateException("Unhandled command " + command);
    }

    private Map<String, Object> createOrder(CreateOrder create, ServiceContext context) {
        context.getLogger().debug("Validating user {} with {}", create.userId(), UserService.NAME);
        Map<String, Object> validation = context.call(UserService.NAME, "validate_user",
                Map.of("user_id", create.userId()));
        if (!Boolean.TRUE.equals(validation.get("valid"))) {
            throw ServiceException.notFound("User " + create.userId() + " not found");
        }

        Order order = new Order(nextId++, create.userId(), create.product(), create.quantity(), "created");
        orders.put(order.id(), order);
        context.increment("orders_created");
        context.getLogger().info("Created order {} for user {}", order.id(), order.userId());
        return Map.of("message", "Order created successfully", "order", order.toMap());
    }
}
