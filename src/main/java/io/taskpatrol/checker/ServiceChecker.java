package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Inspection logic for one service category. Every call is a single remote interaction bounded by the
 * worker's timeout; implementations raise {@link CheckerException} with a classification instead of
 * returning partial data.
 */
public interface ServiceChecker {
    String category();

    JsonNode healthCheck(CheckContext ctx) throws CheckerException;

    JsonNode listResources(CheckContext ctx) throws CheckerException;

    Set<String> customOperations();

    JsonNode customOperation(String name, CheckContext ctx) throws CheckerException;

    /**
     * @throws ConfigurationException when {@code configuration} cannot drive the capability
     */
    void validate(Capability capability, String operation, JsonNode configuration);
}
