package io.taskpatrol.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-256-GCM sealing of credential secrets under a rotating keyring. Each blob records the id of the
 * key that sealed it, so rotation never strands existing credentials.
 */
public final class CredentialCipher {
    private static final Logger logger = LoggerFactory.getLogger(CredentialCipher.class);
    private static final String SCHEMA = "taskpatrol.aesgcm.v1";
    private static final String KEYRING_SCHEMA = "taskpatrol.credential.keys.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final Clock clock;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public CredentialCipher(Path keyFile) {
        this(keyFile, Clock.systemUTC());
    }

    public CredentialCipher(Path keyFile, Clock clock) {
        this.keyFile = keyFile;
        this.clock = clock;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    public String encrypt(byte[] plaintext) {
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(ring.activeKid.getBytes(StandardCharsets.UTF_8));
            byte[] cipherText = cipher.doFinal(plaintext);
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kid", ring.activeKid);
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to encrypt credential", e);
        }
    }

    /**
     * Opens a sealed blob. The caller owns the returned buffer and should zero it once consumed.
     *
     * @throws DecryptionException when the blob is malformed, names an unknown key, or fails authentication
     */
    public byte[] decrypt(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new DecryptionException("Credential blob is empty");
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(blob);
        } catch (IOException e) {
            throw new DecryptionException("Credential blob is not valid JSON", e);
        }
        if (node == null || !SCHEMA.equals(node.path("enc").asText(""))) {
            throw new DecryptionException("Unsupported credential blob format");
        }
        String kid = node.path("kid").asText("");
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (kid.isBlank() || ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new DecryptionException("Invalid credential blob: missing kid/iv/ct");
        }
        SecretKeySpec key = keyring.keys.get(kid);
        if (key == null) {
            throw new DecryptionException("Credential sealed with unknown key id " + kid);
        }
        try {
            byte[] iv = Base64.getDecoder().decode(ivBase64);
            byte[] cipherText = Base64.getDecoder().decode(ctBase64);
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(kid.getBytes(StandardCharsets.UTF_8));
            return cipher.doFinal(cipherText);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Credential blob failed authentication under key " + kid, e);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt credential", e);
        }
    }

    public synchronized RotationOutcome rotate() {
        Keyring current = keyring;
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(current.keys);
        String kid = nextKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        logger.info("Rotated credential key, active kid {} ({} key(s) retained)", kid, next.size());
        return new RotationOutcome(kid, next.size(), keyFile.toString());
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKid, ring.keys.size(), keyFile.toString());
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            logger.info("Created credential keyring at {}", keyFile);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            if (keysNode.isObject()) {
                keysNode.fieldNames().forEachRemaining(kid -> {
                    String rawBase64 = keysNode.path(kid).asText("");
                    if (kid.isBlank() || rawBase64.isBlank()) {
                        return;
                    }
                    byte[] raw = Base64.getDecoder().decode(rawBase64);
                    if (raw.length != KEY_BYTES) {
                        throw new IllegalStateException("Key " + kid + " is not a 256-bit key");
                    }
                    keys.put(kid, new SecretKeySpec(raw, "AES"));
                });
            }
            if (keys.isEmpty()) {
                throw new IllegalStateException("Keyring has no keys");
            }
            if (!keys.containsKey(active)) {
                throw new IllegalStateException("Active key id " + active + " is not in the keyring");
            }
            return new Keyring(active, keys);
        } catch (IOException | RuntimeException e) {
            throw new RuntimeException("Failed to load credential keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = nextKid(keys);
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private String nextKid(Map<String, SecretKeySpec> existing) {
        String kid = "k" + clock.millis();
        int suffix = 1;
        while (existing.containsKey(kid)) {
            kid = "k" + clock.millis() + "_" + suffix++;
        }
        return kid;
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", KEYRING_SCHEMA);
            root.put("active_kid", ring.activeKid);
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Path staging = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
            Files.writeString(staging, Jsons.toJson(root), StandardCharsets.UTF_8);
            Files.move(staging, keyFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist credential keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record RotationOutcome(String activeKid, int totalKeys, String keyFile) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
