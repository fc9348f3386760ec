package io.taskpatrol.security;

import java.util.Arrays;

/**
 * Decrypted credential handed to a checker for the duration of one call. The secret, and the session
 * token of temporary credentials, live only in this object's {@code char[]}s and are overwritten on
 * {@link #close()}.
 */
public final class SecretMaterial implements AutoCloseable {
    private final String credentialId;
    private final String accessKeyId;
    private final char[] secret;
    private final char[] sessionToken;
    private final String region;
    private volatile boolean closed;

    public SecretMaterial(String credentialId, String accessKeyId, char[] secret, String region) {
        this(credentialId, accessKeyId, secret, null, region);
    }

    public SecretMaterial(String credentialId, String accessKeyId, char[] secret, char[] sessionToken, String region) {
        this.credentialId = credentialId;
        this.accessKeyId = accessKeyId;
        this.secret = secret;
        this.sessionToken = sessionToken;
        this.region = region;
    }

    public String credentialId() {
        return credentialId;
    }

    public String accessKeyId() {
        return accessKeyId;
    }

    /**
     * Live view of the secret, not a copy.
     */
    public char[] secret() {
        if (closed) {
            throw new IllegalStateException("Secret material for " + credentialId + " has been closed");
        }
        return secret;
    }

    /**
     * Live view of the session token, or null for long-lived keys.
     */
    public char[] sessionToken() {
        if (closed) {
            throw new IllegalStateException("Secret material for " + credentialId + " has been closed");
        }
        return sessionToken;
    }

    public String region() {
        return region;
    }

    public boolean closed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        Arrays.fill(secret, '\0');
        if (sessionToken != null) {
            Arrays.fill(sessionToken, '\0');
        }
    }

    @Override
    public String toString() {
        return "SecretMaterial[credentialId=" + credentialId + ", accessKeyId=" + maskAccessKey(accessKeyId)
                + ", region=" + region + ", secret=***" + (sessionToken == null ? "" : ", sessionToken=***") + "]";
    }

    private static String maskAccessKey(String accessKeyId) {
        if (accessKeyId == null || accessKeyId.length() <= 4) {
            return "***";
        }
        return "***" + accessKeyId.substring(accessKeyId.length() - 4);
    }
}
