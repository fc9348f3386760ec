package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

public final class AnalyticsChecker extends AbstractServiceChecker {
    public AnalyticsChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "analytics";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("athena", "redshift");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("list_named_queries", "athena", "ListNamedQueries", List.of("WorkGroup", "MaxResults"), List.of()),
                new CustomOperation("get_work_group", "athena", "GetWorkGroup", List.of("WorkGroup"), List.of("WorkGroup"))
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode groups = call(ctx, "athena", "ListWorkGroups", params().put("MaxResults", 50));
        out.set("athena", healthy().put("work_group_count", groups.path("WorkGroups").size()));
        call(ctx, "redshift", "DescribeClusters", params().put("MaxRecords", 20));
        out.set("redshift", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "athena" -> listing("athena", "work_groups", "work_groups",
                    call(ctx, "athena", "ListWorkGroups", params().put("MaxResults", Math.min(50, maxResults(ctx, 50))))
                            .path("WorkGroups"),
                    fields("name", "Name", "state", "State", "description", "Description"));
            case "redshift" -> listing("redshift", "clusters", "clusters",
                    call(ctx, "redshift", "DescribeClusters", params().put("MaxRecords", Math.max(20, maxResults(ctx, 100))))
                            .path("Clusters"),
                    fields("cluster_identifier", "ClusterIdentifier", "node_type", "NodeType",
                            "status", "ClusterStatus", "number_of_nodes", "NumberOfNodes"));
            default -> throw unsupportedService(service);
        };
    }
}
