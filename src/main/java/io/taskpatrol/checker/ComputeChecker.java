package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

/**
 * EC2, Lambda and ECS.
 */
public final class ComputeChecker extends AbstractServiceChecker {
    public ComputeChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "compute";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("ec2", "lambda", "ecs");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("describe_instance_status", "ec2", "DescribeInstanceStatus",
                        List.of("InstanceIds", "IncludeAllInstances"), List.of()),
                new CustomOperation("get_function", "lambda", "GetFunction",
                        List.of("FunctionName"), List.of("FunctionName")),
                new CustomOperation("describe_services", "ecs", "DescribeServices",
                        List.of("cluster", "services"), List.of("cluster", "services"))
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode regions = call(ctx, "ec2", "DescribeRegions", params());
        out.set("ec2", healthy().put("available_regions", regions.path("Regions").size()));
        call(ctx, "lambda", "ListFunctions", params().put("MaxItems", 1));
        out.set("lambda", healthy().put("service_available", true));
        call(ctx, "ecs", "ListClusters", params().put("maxResults", 1));
        out.set("ecs", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "ec2" -> listInstances(ctx);
            case "lambda" -> listing("lambda", "functions", "functions",
                    call(ctx, "lambda", "ListFunctions", params().put("MaxItems", maxResults(ctx, 50))).path("Functions"),
                    fields("function_name", "FunctionName", "runtime", "Runtime", "memory_size", "MemorySize",
                            "timeout", "Timeout", "last_modified", "LastModified"));
            case "ecs" -> listClusters(ctx);
            default -> throw unsupportedService(service);
        };
    }

    private JsonNode listInstances(CheckContext ctx) throws CheckerException {
        ObjectNode request = params();
        if (ctx.configuration() != null && ctx.configuration().path("filters").isArray()) {
            request.set("Filters", ctx.configuration().path("filters"));
        }
        JsonNode response = call(ctx, "ec2", "DescribeInstances", request);
        ArrayNode instances = Jsons.mapper().createArrayNode();
        for (JsonNode reservation : response.path("Reservations")) {
            for (JsonNode instance : reservation.path("Instances")) {
                instances.add(instance);
            }
        }
        return listing("ec2", "instances", "instances", instances,
                fields("instance_id", "InstanceId", "instance_type", "InstanceType", "state", "State.Name",
                        "launch_time", "LaunchTime"));
    }

    private JsonNode listClusters(CheckContext ctx) throws CheckerException {
        JsonNode arns = call(ctx, "ecs", "ListClusters", params()).path("clusterArns");
        if (!arns.isArray() || arns.isEmpty()) {
            return listing("ecs", "clusters", "clusters", Jsons.mapper().createArrayNode(), fields());
        }
        ObjectNode describe = params();
        describe.set("clusters", arns);
        return listing("ecs", "clusters", "clusters",
                call(ctx, "ecs", "DescribeClusters", describe).path("clusters"),
                fields("cluster_name", "clusterName", "status", "status", "running_tasks_count", "runningTasksCount",
                        "pending_tasks_count", "pendingTasksCount"));
    }
}
