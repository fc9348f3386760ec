package io.taskpatrol.model;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Position in a task's reverse-chronological execution history. Listing resumes strictly after the
 * execution the cursor names.
 */
public record ExecutionCursor(long queuedAtMs, String executionId) {
    public ExecutionCursor {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId is required");
        }
    }

    public static ExecutionCursor after(Execution execution) {
        return new ExecutionCursor(execution.queuedAtMs(), execution.executionId());
    }

    public String encode() {
        String raw = queuedAtMs + ":" + executionId;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static ExecutionCursor decode(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid execution cursor: " + token, e);
        }
        int split = raw.indexOf(':');
        if (split <= 0 || split == raw.length() - 1) {
            throw new IllegalArgumentException("Invalid execution cursor: " + token);
        }
        try {
            return new ExecutionCursor(Long.parseLong(raw.substring(0, split)), raw.substring(split + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid execution cursor: " + token, e);
        }
    }
}
