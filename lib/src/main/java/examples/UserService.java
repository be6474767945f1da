package examples;

import com.wardensystems.service.Payloads;
import com.wardensystems.service.ServiceContext;
import com.wardensystems.service.ServiceException;
import com.wardensystems.service.ServiceHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps an in-memory user table. Each instance starts empty, so a restart loses all users.
 *
 * <p>Actions: {@code create_user} (username, email), {@code get_user} (user_id),
 * {@code list_users}, {@code validate_user} (user_id).</p>
 */
public class UserService implements ServiceHandler<UserService.Command> {

    public static final String NAME = "UserService";

    sealed interface Command permits CreateUser, GetUser, ListUsers, ValidateUser {
    }

    record CreateUser(String username, String email) implements Command {
    }

    record GetUser(long userId) implements Command {
    }

    record ListUsers() implements Command {
    }

    record ValidateUser(long userId) implements Command {
    }

    record User(long id, String username, String email) {
        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", id);
            map.put("username", username);
            map.put("email", email);
            return map;
        }
    }

    private final Map<Long, User> users = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public Command decode(String action, Map<String, Object> payload) {
        return switch (action) {
            case "create_user" -> new CreateUser(
                    Payloads.requireString(payload, "username"),
                    Payloads.requireString(payload, "email"));
            case "get_user" -> new GetUser(Payloads.requireLong(payload, "user_id"));
            case "list_users" -> new ListUsers();
            case "validate_user" -> new ValidateUser(Payloads.requireLong(payload, "user_id"));
            default -> throw ServiceException.unknownAction(action);
        };
    }

    @Override
    public Map<String, Object> handle(Command command, ServiceContext context) {
        if (command instanceof CreateUser create) {
            return createUser(create, context);
        } else if (command instanceof GetUser get) {
            User user = users.get(get.userId());
            if (user == null) {
                throw ServiceException.notFound("User " + get.userId() + " not found");
            }
            return Map.of("user", user.toMap());
        } else if (command instanceof ListUsers) {
            List<Map<String, Object>> all = users.values().stream().map(User::toMap).toList();
            return Map.of("users", all, "count", all.size());
        } else if (command instanceof ValidateUser validate) {
            return Map.of("user_id", validate.userId(), "valid", users.containsKey(validate.userId()));
        }
        throw new IllegalStateException("Unhandled command " + command);
    }

    private Map<String, Object> createUser(CreateUser create, ServiceContext context) {
        boolean taken = users.values().stream().anyMatch(user -> user.username().equals(create.username()));
        if (taken) {
            throw ServiceException.conflict("User " + create.username() + " already exists");
        }
        User user = new User(nextId++, create.username(), create.email());
        users.put(user.id(), user);
        context.increment("users_created");
        context.getLogger().info("Created user {} (id {})", user.username(), user.id());
        return Map.of("message", "User created successfully", "user", user.toMap());
    }
}
