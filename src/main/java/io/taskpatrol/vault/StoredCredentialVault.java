package io.taskpatrol.vault;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.taskpatrol.security.CredentialCipher;
import io.taskpatrol.security.DecryptionException;
import io.taskpatrol.security.SecretMaterial;
import io.taskpatrol.storage.CredentialStore;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

/**
 * Vault over the credentials table. Secrets are sealed as a small JSON document
 * {@code {"access_key_id": ..., "secret_access_key": ..., "session_token": ...}} (the token only for
 * temporary credentials) and parsed straight into {@code char[]}s on the way out.
 */
public final class StoredCredentialVault implements CredentialVault {
    private static final Logger logger = LoggerFactory.getLogger(StoredCredentialVault.class);
    private static final String ACCESS_KEY_FIELD = "access_key_id";
    private static final String SECRET_FIELD = "secret_access_key";
    private static final String SESSION_TOKEN_FIELD = "session_token";

    private final CredentialStore store;
    private final CredentialCipher cipher;

    public StoredCredentialVault(CredentialStore store, CredentialCipher cipher) {
        this.store = store;
        this.cipher = cipher;
    }

    @Override
    public SecretMaterial resolve(String credentialId) throws VaultException {
        Optional<CredentialStore.StoredSecret> stored = store.findSecret(credentialId);
        if (stored.isEmpty()) {
            throw new VaultException(VaultException.Reason.CREDENTIAL_NOT_FOUND, credentialId,
                    "No credential " + credentialId);
        }
        CredentialStore.StoredSecret secret = stored.get();
        if (!secret.active()) {
            throw new VaultException(VaultException.Reason.CREDENTIAL_NOT_FOUND, credentialId,
                    "Credential " + credentialId + " is inactive");
        }
        byte[] plain;
        try {
            plain = cipher.decrypt(secret.secretBlob());
        } catch (DecryptionException e) {
            logger.warn("Credential {} could not be decrypted: {}", credentialId, e.getMessage());
            throw new VaultException(VaultException.Reason.DECRYPTION_FAILED, credentialId, e.getMessage(), e);
        }
        try {
            return parse(credentialId, plain, secret.region());
        } finally {
            Arrays.fill(plain, (byte) 0);
        }
    }

    /**
     * Seals an access key pair into a blob for {@link CredentialStore}. The caller keeps ownership of
     * {@code secret}.
     */
    public String seal(String accessKeyId, char[] secret) {
        return seal(accessKeyId, secret, null);
    }

    /**
     * Seals temporary credentials; a null or empty {@code sessionToken} seals a plain key pair.
     */
    public String seal(String accessKeyId, char[] secret, char[] sessionToken) {
        if (accessKeyId == null || accessKeyId.isBlank()) {
            throw new IllegalArgumentException("access key id is required");
        }
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("secret is required");
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
        try (JsonGenerator gen = Jsons.mapper().getFactory().createGenerator(buffer)) {
            gen.writeStartObject();
            gen.writeStringField(ACCESS_KEY_FIELD, accessKeyId.trim());
            gen.writeFieldName(SECRET_FIELD);
            gen.writeString(secret, 0, secret.length);
            if (sessionToken != null && sessionToken.length > 0) {
                gen.writeFieldName(SESSION_TOKEN_FIELD);
                gen.writeString(sessionToken, 0, sessionToken.length);
            }
            gen.writeEndObject();
        } catch (IOException e) {
            throw new RuntimeException("Failed to encode credential", e);
        }
        byte[] plain = buffer.toByteArray();
        try {
            return cipher.encrypt(plain);
        } finally {
            Arrays.fill(plain, (byte) 0);
        }
    }

    private SecretMaterial parse(String credentialId, byte[] plain, String region) throws VaultException {
        String accessKeyId = null;
        char[] secret = null;
        char[] sessionToken = null;
        try (JsonParser parser = Jsons.mapper().getFactory().createParser(plain)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw malformed(credentialId, null);
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                if (ACCESS_KEY_FIELD.equals(field) && value == JsonToken.VALUE_STRING) {
                    accessKeyId = parser.getText();
                } else if (SECRET_FIELD.equals(field) && value == JsonToken.VALUE_STRING) {
                    wipe(secret);
                    secret = textChars(parser);
                } else if (SESSION_TOKEN_FIELD.equals(field) && value == JsonToken.VALUE_STRING) {
                    wipe(sessionToken);
                    sessionToken = textChars(parser);
                } else {
                    parser.skipChildren();
                }
            }
        } catch (IOException e) {
            wipe(secret);
            wipe(sessionToken);
            throw malformed(credentialId, e);
        }
        if (accessKeyId == null || accessKeyId.isBlank() || secret == null || secret.length == 0) {
            wipe(secret);
            wipe(sessionToken);
            throw malformed(credentialId, null);
        }
        if (sessionToken != null && sessionToken.length == 0) {
            sessionToken = null;
        }
        return new SecretMaterial(credentialId, accessKeyId, secret, sessionToken, region);
    }

    private static char[] textChars(JsonParser parser) throws IOException {
        int offset = parser.getTextOffset();
        int length = parser.getTextLength();
        return Arrays.copyOfRange(parser.getTextCharacters(), offset, offset + length);
    }

    private static void wipe(char[] chars) {
        if (chars != null) {
            Arrays.fill(chars, '\0');
        }
    }

    private static VaultException malformed(String credentialId, Throwable cause) {
        return new VaultException(VaultException.Reason.DECRYPTION_FAILED, credentialId,
                "Credential " + credentialId + " decrypted to an unexpected document", cause);
    }
}
