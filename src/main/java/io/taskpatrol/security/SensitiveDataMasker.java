package io.taskpatrol.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskpatrol.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "access_key", "private_key", "signature"
    );
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b((?:aws_)?(?:secret(?:_access)?_key|password|passwd|token|session_token|signature|authorization)\\s*[=:]\\s*)(\"[^\"]*\"|[^\\s,;&]+)");
    private static final Pattern ACCESS_KEY_ID = Pattern.compile("\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b");
    private static final Pattern SECRET_LIKE = Pattern.compile("(?<![A-Za-z0-9/+])[A-Za-z0-9/+]{40}(?![A-Za-z0-9/+=])");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            String maskedText = maskText(text);
            return maskedText.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(maskedText);
        }
        return input;
    }

    /**
     * Masks secret-looking fragments inside free text such as remote error messages.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = ASSIGNMENT.matcher(text).replaceAll("$1" + MASK);
        out = ACCESS_KEY_ID.matcher(out).replaceAll(MASK);
        return SECRET_LIKE.matcher(out).replaceAll(MASK);
    }

    /**
     * Masks and bounds an error detail before it is persisted.
     */
    public static String errorDetail(String detail, int maxChars) {
        if (detail == null) {
            return null;
        }
        String masked = maskText(detail);
        if (masked.length() <= maxChars) {
            return masked;
        }
        return masked.substring(0, Math.max(0, maxChars - 3)) + "...";
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
