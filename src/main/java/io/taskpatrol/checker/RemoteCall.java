package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record RemoteCall(String service, String action, String region, ObjectNode parameters) {
}
