package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkers keyed by service category. A task's {@code (category, operation)} pair resolves to a
 * {@link BoundCheck} or to nothing.
 */
public final class CheckerRegistry {
    private final Map<String, ServiceChecker> checkers = new ConcurrentHashMap<>();

    public void register(ServiceChecker checker) {
        String key = normalize(checker.category());
        if (checkers.putIfAbsent(key, checker) != null) {
            throw new IllegalStateException("Checker already registered for category " + key);
        }
    }

    public Optional<ServiceChecker> get(String category) {
        return Optional.ofNullable(checkers.get(normalize(category)));
    }

    public Optional<BoundCheck> lookup(String category, String operation) {
        ServiceChecker checker = checkers.get(normalize(category));
        if (checker == null || operation == null || operation.isBlank()) {
            return Optional.empty();
        }
        String op = operation.trim();
        if (Capability.HEALTH_CHECK.operationName().equals(op)) {
            return Optional.of(new BoundCheck(checker, Capability.HEALTH_CHECK, op));
        }
        if (Capability.RESOURCE_LIST.operationName().equals(op)) {
            return Optional.of(new BoundCheck(checker, Capability.RESOURCE_LIST, op));
        }
        if (checker.customOperations().contains(op)) {
            return Optional.of(new BoundCheck(checker, Capability.CUSTOM_OPERATION, op));
        }
        return Optional.empty();
    }

    /**
     * Category to supported operation names, for operators.
     */
    public Map<String, List<String>> catalog() {
        Map<String, List<String>> out = new TreeMap<>();
        for (ServiceChecker checker : checkers.values()) {
            List<String> ops = new ArrayList<>();
            ops.add(Capability.HEALTH_CHECK.operationName());
            ops.add(Capability.RESOURCE_LIST.operationName());
            checker.customOperations().stream().sorted().forEach(ops::add);
            out.put(checker.category(), ops);
        }
        return out;
    }

    public static CheckerRegistry withDefaults(RemoteServiceClient client) {
        CheckerRegistry registry = new CheckerRegistry();
        registry.register(new ComputeChecker(client));
        registry.register(new StorageChecker(client));
        registry.register(new DatabaseChecker(client));
        registry.register(new NetworkingChecker(client));
        registry.register(new SecurityChecker(client));
        registry.register(new AnalyticsChecker(client));
        registry.register(new ManagementChecker(client));
        return registry;
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * A checker bound to one capability and operation name.
     */
    public record BoundCheck(ServiceChecker checker, Capability capability, String operation) {
        public void validate(JsonNode configuration) {
            checker.validate(capability, operation, configuration);
        }

        public JsonNode invoke(CheckContext ctx) throws CheckerException {
            return switch (capability) {
                case HEALTH_CHECK -> checker.healthCheck(ctx);
                case RESOURCE_LIST -> checker.listResources(ctx);
                case CUSTOM_OPERATION -> checker.customOperation(operation, ctx);
            };
        }
    }
}
