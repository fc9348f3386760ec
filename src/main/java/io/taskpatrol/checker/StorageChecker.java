package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

public final class StorageChecker extends AbstractServiceChecker {
    public StorageChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "storage";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("s3", "efs");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("get_bucket_location", "s3", "GetBucketLocation", List.of("Bucket"), List.of("Bucket")),
                new CustomOperation("list_objects", "s3", "ListObjectsV2",
                        List.of("Bucket", "Prefix", "MaxKeys"), List.of("Bucket")),
                new CustomOperation("describe_mount_targets", "efs", "DescribeMountTargets",
                        List.of("FileSystemId"), List.of("FileSystemId"))
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode buckets = call(ctx, "s3", "ListBuckets", params());
        out.set("s3", healthy().put("bucket_count", buckets.path("Buckets").size()));
        call(ctx, "efs", "DescribeFileSystems", params().put("MaxItems", 1));
        out.set("efs", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "s3" -> listing("s3", "buckets", "buckets",
                    call(ctx, "s3", "ListBuckets", params()).path("Buckets"),
                    fields("name", "Name", "creation_date", "CreationDate"));
            case "efs" -> listing("efs", "file_systems", "file_systems",
                    call(ctx, "efs", "DescribeFileSystems", params().put("MaxItems", maxResults(ctx, 100))).path("FileSystems"),
                    fields("file_system_id", "FileSystemId", "name", "Name", "life_cycle_state", "LifeCycleState",
                            "size_in_bytes", "SizeInBytes.Value", "performance_mode", "PerformanceMode"));
            default -> throw unsupportedService(service);
        };
    }
}
