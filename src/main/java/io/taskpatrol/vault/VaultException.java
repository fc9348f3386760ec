package io.taskpatrol.vault;

public final class VaultException extends Exception {
    public enum Reason {
        CREDENTIAL_NOT_FOUND,
        DECRYPTION_FAILED
    }

    private final Reason reason;
    private final String credentialId;

    public VaultException(Reason reason, String credentialId, String message) {
        this(reason, credentialId, message, null);
    }

    public VaultException(Reason reason, String credentialId, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
        this.credentialId = credentialId;
    }

    public Reason reason() {
        return reason;
    }

    public String credentialId() {
        return credentialId;
    }
}
