package io.taskpatrol.checker;

public enum Capability {
    HEALTH_CHECK("health_check"),
    RESOURCE_LIST("resource_list"),
    CUSTOM_OPERATION("custom_operation");

    private final String operationName;

    Capability(String operationName) {
        this.operationName = operationName;
    }

    /**
     * Operation name a task uses to select this capability. Custom operations use their own names.
     */
    public String operationName() {
        return operationName;
    }
}
