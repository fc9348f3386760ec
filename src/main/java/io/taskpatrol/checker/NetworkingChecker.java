package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

public final class NetworkingChecker extends AbstractServiceChecker {
    public NetworkingChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "networking";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("vpc", "cloudfront");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("describe_subnets", "ec2", "DescribeSubnets", List.of("Filters", "SubnetIds"), List.of()),
                new CustomOperation("describe_security_groups", "ec2", "DescribeSecurityGroups",
                        List.of("Filters", "GroupIds"), List.of())
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode vpcs = call(ctx, "ec2", "DescribeVpcs", params());
        out.set("vpc", healthy().put("vpc_count", vpcs.path("Vpcs").size()));
        call(ctx, "cloudfront", "ListDistributions", params().put("MaxItems", "1"));
        out.set("cloudfront", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "vpc" -> listing("vpc", "vpcs", "vpcs",
                    call(ctx, "ec2", "DescribeVpcs", params()).path("Vpcs"),
                    fields("vpc_id", "VpcId", "cidr_block", "CidrBlock", "state", "State", "is_default", "IsDefault"));
            case "cloudfront" -> listing("cloudfront", "distributions", "distributions",
                    call(ctx, "cloudfront", "ListDistributions", params().put("MaxItems", Integer.toString(maxResults(ctx, 100))))
                            .path("DistributionList").path("Items"),
                    fields("id", "Id", "domain_name", "DomainName", "status", "Status", "enabled", "Enabled"));
            default -> throw unsupportedService(service);
        };
    }
}
