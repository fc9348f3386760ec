package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

/**
 * IAM. The account summary doubles as the health check.
 */
public final class SecurityChecker extends AbstractServiceChecker {
    public SecurityChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "security";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("iam");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("list_roles", "iam", "ListRoles", List.of("PathPrefix", "MaxItems"), List.of()),
                new CustomOperation("list_access_keys", "iam", "ListAccessKeys", List.of("UserName"), List.of("UserName"))
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        JsonNode summary = call(ctx, "iam", "GetAccountSummary", params()).path("SummaryMap");
        ObjectNode iam = healthy();
        iam.put("users", summary.path("Users").asInt(0));
        iam.put("roles", summary.path("Roles").asInt(0));
        iam.put("policies", summary.path("Policies").asInt(0));
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.set("iam", iam);
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        if (!"iam".equals(service)) {
            throw unsupportedService(service);
        }
        return listing("iam", "users", "users",
                call(ctx, "iam", "ListUsers", params().put("MaxItems", maxResults(ctx, 100))).path("Users"),
                fields("user_name", "UserName", "user_id", "UserId", "arn", "Arn", "create_date", "CreateDate"));
    }
}
