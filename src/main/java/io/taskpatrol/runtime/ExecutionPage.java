package io.taskpatrol.runtime;

import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionCursor;

import java.util.List;

public record ExecutionPage(List<Execution> executions, ExecutionCursor nextCursor) {
    public boolean hasMore() {
        return nextCursor != null;
    }
}
