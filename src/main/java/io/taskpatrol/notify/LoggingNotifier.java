package io.taskpatrol.notify;

import io.taskpatrol.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public final class LoggingNotifier implements Notifier {
    private static final Logger logger = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String tenantId, String executionId, ExecutionStatus status) {
        logger.info("Tenant {} execution {} finished: {}", tenantId, executionId, status.name().toLowerCase(Locale.ROOT));
    }
}
