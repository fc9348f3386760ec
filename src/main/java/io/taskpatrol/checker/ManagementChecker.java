package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.List;

/**
 * Management and governance services: monitoring alarms, stacks, managed instances, config rules,
 * organization accounts and auto scaling groups.
 */
public final class ManagementChecker extends AbstractServiceChecker {
    public ManagementChecker(RemoteServiceClient client) {
        super(client);
    }

    @Override
    public String category() {
        return "management";
    }

    @Override
    protected List<String> listableServices() {
        return List.of("cloudwatch", "cloudformation", "ssm", "config", "organizations", "autoscaling");
    }

    @Override
    protected List<CustomOperation> declareCustomOperations() {
        return List.of(
                new CustomOperation("list_metrics", "cloudwatch", "ListMetrics", List.of("Namespace", "MetricName"), List.of()),
                new CustomOperation("describe_stack_resources", "cloudformation", "DescribeStackResources",
                        List.of("StackName"), List.of("StackName")),
                new CustomOperation("get_parameter", "ssm", "GetParameter", List.of("Name"), List.of("Name")),
                new CustomOperation("get_compliance_summary", "config", "GetComplianceSummaryByConfigRule", List.of(), List.of()),
                new CustomOperation("describe_organization", "organizations", "DescribeOrganization", List.of(), List.of())
        );
    }

    @Override
    public JsonNode healthCheck(CheckContext ctx) throws CheckerException {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode alarms = call(ctx, "cloudwatch", "DescribeAlarms", params().put("MaxRecords", 100));
        out.set("cloudwatch", healthy().put("alarm_count", alarms.path("MetricAlarms").size()));
        JsonNode stacks = call(ctx, "cloudformation", "DescribeStacks", params());
        out.set("cloudformation", healthy().put("stack_count", stacks.path("Stacks").size()));
        call(ctx, "ssm", "DescribeInstanceInformation", params().put("MaxResults", 5));
        out.set("ssm", healthy().put("service_available", true));
        return out;
    }

    @Override
    public JsonNode listResources(CheckContext ctx) throws CheckerException {
        String service = resourceListTarget(ctx);
        return switch (service) {
            case "cloudwatch" -> listing("cloudwatch", "alarms", "alarms",
                    call(ctx, "cloudwatch", "DescribeAlarms", params().put("MaxRecords", Math.min(100, maxResults(ctx, 100))))
                            .path("MetricAlarms"),
                    fields("name", "AlarmName", "state", "StateValue", "metric", "MetricName", "namespace", "Namespace"));
            case "cloudformation" -> listing("cloudformation", "stacks", "stacks",
                    call(ctx, "cloudformation", "DescribeStacks", params()).path("Stacks"),
                    fields("name", "StackName", "status", "StackStatus", "created_at", "CreationTime"));
            case "ssm" -> listing("ssm", "managed_instances", "instances",
                    call(ctx, "ssm", "DescribeInstanceInformation", params().put("MaxResults", Math.min(50, maxResults(ctx, 50))))
                            .path("InstanceInformationList"),
                    fields("instance_id", "InstanceId", "ping_status", "PingStatus", "platform", "PlatformName"));
            case "config" -> listing("config", "config_rules", "rules",
                    call(ctx, "config", "DescribeConfigRules", params()).path("ConfigRules"),
                    fields("name", "ConfigRuleName", "state", "ConfigRuleState", "source", "Source.SourceIdentifier"));
            case "organizations" -> listing("organizations", "accounts", "accounts",
                    call(ctx, "organizations", "ListAccounts", params().put("MaxResults", Math.min(20, maxResults(ctx, 20))))
                            .path("Accounts"),
                    fields("id", "Id", "name", "Name", "status", "Status"));
            case "autoscaling" -> listing("autoscaling", "auto_scaling_groups", "groups",
                    call(ctx, "autoscaling", "DescribeAutoScalingGroups", params().put("MaxRecords", Math.min(100, maxResults(ctx, 100))))
                            .path("AutoScalingGroups"),
                    fields("name", "AutoScalingGroupName", "desired_capacity", "DesiredCapacity",
                            "min_size", "MinSize", "max_size", "MaxSize"));
            default -> throw unsupportedService(service);
        };
    }
}
