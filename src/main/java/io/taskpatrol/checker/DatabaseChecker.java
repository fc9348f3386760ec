package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

public final class DatabaseChecker extends AbstractServiceChecker {
    public DatabaseChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "database";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("rds", "dynamodb");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("describe_table", "dynamodb", "DescribeTable", List.of("TableName"), List.of("TableName")),
                new CustomOperation("describe_db_snapshots", "rds", "DescribeDBSnapshots",
                        List.of("DBInstanceIdentifier", "SnapshotType"), List.of())
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode instances = call(ctx, "rds", "DescribeDBInstances", params().put("MaxRecords", 20));
        out.set("rds", healthy().put("instance_count", instances.path("DBInstances").size()));
        call(ctx, "dynamodb", "ListTables", params().put("Limit", 1));
        out.set("dynamodb", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "rds" -> listing("rds", "db_instances", "db_instances",
                    call(ctx, "rds", "DescribeDBInstances", params().put("MaxRecords", Math.max(20, maxResults(ctx, 100))))
                            .path("DBInstances"),
                    fields("db_instance_identifier", "DBInstanceIdentifier", "engine", "Engine",
                            "engine_version", "EngineVersion", "status", "DBInstanceStatus",
                            "instance_class", "DBInstanceClass"));
            case "dynamodb" -> listTables(ctx);
            default -> throw unsupportedService(service);
        };
    }

    private JsonNode listTables(CheckContext ctx) throws CheckerException {
        JsonNode names = call(ctx, "dynamodb", "ListTables", params().put("Limit", Math.min(100, maxResults(ctx, 100))))
                .path("TableNames");
        ArrayNode tables = Jsons.mapper().createArrayNode();
        for (JsonNode name : names) {
            tables.add(Jsons.mapper().createObjectNode().put("TableName", name.asText()));
        }
        return listing("dynamodb", "tables", "tables", tables, fields("table_name", "TableName"));
    }
}
