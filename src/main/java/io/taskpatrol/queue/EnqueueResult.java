package io.taskpatrol.queue;

public record EnqueueResult(boolean ok, String reason) {
    public static EnqueueResult accepted() {
        return new EnqueueResult(true, null);
    }

    public static EnqueueResult failed(String reason) {
        return new EnqueueResult(false, reason == null || reason.isBlank() ? "enqueue failed" : reason);
    }
}
