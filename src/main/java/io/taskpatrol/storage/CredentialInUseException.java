package io.taskpatrol.storage;

public final class CredentialInUseException extends RuntimeException {
    private final int referencingTasks;

    public CredentialInUseException(String credentialId, int referencingTasks) {
        super("Credential " + credentialId + " is referenced by " + referencingTasks
                + " task(s); reassign them before deleting");
        this.referencingTasks = referencingTasks;
    }

    public int referencingTasks() {
        return referencingTasks;
    }
}
