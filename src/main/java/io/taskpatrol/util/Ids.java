package io.taskpatrol.util;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String taskId() {
        return "tsk_" + UUID.randomUUID();
    }

    public static String executionId() {
        return "exe_" + UUID.randomUUID();
    }

    public static String credentialId() {
        return "crd_" + UUID.randomUUID();
    }

    public static String leaseToken() {
        return UUID.randomUUID().toString();
    }
}
