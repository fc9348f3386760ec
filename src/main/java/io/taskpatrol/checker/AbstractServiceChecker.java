package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared plumbing for the shipped checkers: remote calls with error classification, configuration
 * validation, and table-driven custom operations.
 */
public abstract class AbstractServiceChecker implements ServiceChecker {
    private static final Logger logger = LoggerFactory.getLogger(AbstractServiceChecker.class);

    private static final Set<String> AUTHENTICATION_CODES = Set.of(
            "InvalidClientTokenId", "SignatureDoesNotMatch", "AuthFailure", "ExpiredToken");
    private static final Set<String> PERMISSION_CODES = Set.of(
            "AccessDenied", "AccessDeniedException", "UnauthorizedOperation");
    private static final Set<String> LIMIT_CODES = Set.of(
            "Throttling", "ThrottlingException", "ServiceUnavailable", "RequestLimitExceeded");
    static final int MAX_RESULTS_LIMIT = 1000;

    private final RemoteServiceClient client;
    private final Map<String, CustomOperation> customOperations;

    protected AbstractServiceChecker(RemoteServiceClient client) {
        this.client = client;
        this.customOperations = new LinkedHashMap<>();
        for (CustomOperation op : declareCustomOperations()) {
            customOperations.put(op.name(), op);
        }
    }

    /**
     * Services {@code resource_list} can target; the first one is the default.
     */
    protected abstract List<String> listableServices();

    protected List<CustomOperation> declareCustomOperations() {
        return List.of();
    }

    @Override
    public final Set<String> customOperations() {
        return Set.copyOf(customOperations.keySet());
    }

    @Override
    public JsonNode customOperation(String name, CheckContext ctx) throws CheckerException {
        CustomOperation op = customOperations.get(name);
        if (op == null) {
            throw new CheckerException(ErrorClassification.SERVICE_ERROR, "UnsupportedOperation",
                    "Unsupported " + category() + " operation: " + name);
        }
        ObjectNode params = Jsons.mapper().createObjectNode();
        for (String field : op.parameters()) {
            JsonNode value = ctx.configuration() == null ? null : ctx.configuration().get(field);
            if (value != null && !value.isNull()) {
                params.set(field, value);
            }
        }
        JsonNode data = call(ctx, op.service(), op.action(), params);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("service", op.service());
        out.put("operation", name);
        out.set("data", data);
        out.put("success", true);
        return out;
    }

    @Override
    public void validate(Capability capability, String operation, JsonNode configuration) {
        List<String> problems = new ArrayList<>();
        if (configuration != null && !configuration.isNull() && !configuration.isObject()) {
            throw new ConfigurationException("configuration must be a JSON object");
        }
        JsonNode cfg = configuration == null || configuration.isNull() ? Jsons.mapper().createObjectNode() : configuration;
        if (cfg.has("region") && (!cfg.path("region").isTextual() || cfg.path("region").asText().isBlank())) {
            problems.add("region must be a non-empty string");
        }
        switch (capability) {
            case HEALTH_CHECK -> {
            }
            case RESOURCE_LIST -> {
                if (cfg.has("service")) {
                    String service = cfg.path("service").asText("");
                    if (!listableServices().contains(service)) {
                        problems.add("service must be one of " + listableServices() + " for " + category());
                    }
                }
                if (cfg.has("max_results")) {
                    JsonNode max = cfg.path("max_results");
                    if (!max.canConvertToInt() || !max.isIntegralNumber()
                            || max.asInt() < 1 || max.asInt() > MAX_RESULTS_LIMIT) {
                        problems.add("max_results must be an integer between 1 and " + MAX_RESULTS_LIMIT);
                    }
                }
            }
            case CUSTOM_OPERATION -> {
                CustomOperation op = customOperations.get(operation);
                if (op == null) {
                    problems.add("unknown " + category() + " operation " + operation);
                } else {
                    for (String required : op.required()) {
                        JsonNode value = cfg.get(required);
                        if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                            problems.add(required + " is required for " + operation);
                        }
                    }
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    /**
     * One remote call, with provider errors translated into classified {@link CheckerException}s.
     */
    protected final JsonNode call(CheckContext ctx, String service, String action, ObjectNode params) throws CheckerException {
        RemoteCall remote = new RemoteCall(service, action, ctx.region(), params);
        try {
            return client.invoke(remote, ctx.credentials());
        } catch (RemoteCallException e) {
            ErrorClassification classification = classify(e);
            logger.warn("{} {}.{} failed for execution {}: code={} status={} classification={}",
                    category(), service, action, ctx.executionId(), e.errorCode(), e.httpStatus(), classification.wireName());
            throw new CheckerException(classification, e.errorCode(), e.getMessage(), e);
        }
    }

    protected final String resourceListTarget(CheckContext ctx) {
        return ctx.text("service", listableServices().get(0));
    }

    protected final ObjectNode params() {
        return Jsons.mapper().createObjectNode();
    }

    protected final ObjectNode healthy() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("status", "healthy");
        return node;
    }

    /**
     * Builds {@code {"service", "resource_type", "count", <itemsField>: [...]}} from a provider array,
     * keeping only the mapped fields of each element.
     */
    protected final ObjectNode listing(String service, String resourceType, String itemsField, JsonNode source,
                                       Map<String, String> fieldMapping) {
        ArrayNode items = Jsons.mapper().createArrayNode();
        if (source != null && source.isArray()) {
            for (JsonNode element : source) {
                items.add(project(element, fieldMapping));
            }
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("service", service);
        out.put("resource_type", resourceType);
        out.put("count", items.size());
        out.set(itemsField, items);
        return out;
    }

    /**
     * Output field to provider path pairs, in output order.
     */
    protected static Map<String, String> fields(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("fields() takes name/path pairs");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put(pairs[i], pairs[i + 1]);
        }
        return out;
    }

    protected final int maxResults(CheckContext ctx, int fallback) {
        return Math.max(1, Math.min(MAX_RESULTS_LIMIT, ctx.integer("max_results", fallback)));
    }

    protected final CheckerException unsupportedService(String service) {
        return new CheckerException(ErrorClassification.SERVICE_ERROR, "UnsupportedService",
                "Unsupported " + category() + " service: " + service);
    }

    private static ObjectNode project(JsonNode element, Map<String, String> fieldMapping) {
        ObjectNode row = Jsons.mapper().createObjectNode();
        for (Map.Entry<String, String> mapping : fieldMapping.entrySet()) {
            JsonNode value = resolvePath(element, mapping.getValue());
            row.set(mapping.getKey(), value == null || value.isMissingNode() ? Jsons.mapper().nullNode() : value);
        }
        return row;
    }

    private static JsonNode resolvePath(JsonNode node, String dottedPath) {
        JsonNode current = node;
        for (String part : dottedPath.split("\\.")) {
            if (current == null) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    public static ErrorClassification classify(RemoteCallException e) {
        String code = e.errorCode() == null ? "" : e.errorCode();
        if (AUTHENTICATION_CODES.contains(code) || e.httpStatus() == 401) {
            return ErrorClassification.AUTHENTICATION_ERROR;
        }
        if (PERMISSION_CODES.contains(code) || e.httpStatus() == 403) {
            return ErrorClassification.PERMISSION_ERROR;
        }
        if (LIMIT_CODES.contains(code) || e.httpStatus() == 429 || e.httpStatus() == 503 || e.timeout()) {
            return ErrorClassification.SERVICE_LIMIT_ERROR;
        }
        return ErrorClassification.SERVICE_ERROR;
    }

    /**
     * A named pass-through operation: configuration fields listed in {@code parameters} are forwarded
     * to {@code service.action}; those in {@code required} must be present.
     */
    protected record CustomOperation(String name, String service, String action, List<String> parameters,
                                      List<String> required) {
    }
}
