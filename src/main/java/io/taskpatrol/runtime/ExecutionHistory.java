package io.taskpatrol.runtime;

import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionCursor;
import io.taskpatrol.storage.ExecutionStore;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy newest-first walk over a task's executions, one store page at a time. Each iterator starts
 * from the cursor given at construction.
 */
public final class ExecutionHistory implements Iterable<Execution> {
    private final ExecutionStore store;
    private final String taskId;
    private final ExecutionCursor start;
    private final int pageSize;

    ExecutionHistory(ExecutionStore store, String taskId, ExecutionCursor start, int pageSize) {
        this.store = store;
        this.taskId = taskId;
        this.start = start;
        this.pageSize = Math.max(1, Math.min(ExecutionStore.MAX_PAGE_SIZE, pageSize));
    }

    @Override
    public Iterator<Execution> iterator() {
        return new Iterator<>() {
            private ExecutionCursor cursor = start;
            private List<Execution> page = List.of();
            private int index = 0;
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                if (index < page.size()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                page = store.listExecutions(taskId, cursor, pageSize);
                index = 0;
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                if (!page.isEmpty()) {
                    cursor = ExecutionCursor.after(page.get(page.size() - 1));
                }
                return !page.isEmpty();
            }

            @Override
            public Execution next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return page.get(index++);
            }
        };
    }
}
