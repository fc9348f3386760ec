package io.taskpatrol.runtime;

import io.taskpatrol.RecordingNotifier;
import io.taskpatrol.TestClock;
import io.taskpatrol.checker.RemoteCallException;
import io.taskpatrol.checker.RemoteServiceClient;
import io.taskpatrol.config.EngineSettings;
import io.taskpatrol.config.TaskPatrolConfig;
import io.taskpatrol.engine.WorkerOutcome;
import io.taskpatrol.model.CredentialView;
import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionResult;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.notify.Notifier;
import io.taskpatrol.storage.CredentialInUseException;
import io.taskpatrol.storage.Database;
import io.taskpatrol.storage.TaskBusyException;
import io.taskpatrol.storage.TaskNotFoundException;
import io.taskpatrol.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

final class TaskPatrolRuntimeTest {
    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");
    private static final String BUCKETS = "{\"Buckets\":[{\"Name\":\"logs\",\"CreationDate\":\"2025-01-01\"},{\"Name\":\"assets\"}]}";

    @Test
    void successfulExecutionStoresOneResultAndNotifiesOnce() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-success-");
        RecordingNotifier notifier = new RecordingNotifier();
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS), notifier)) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), "eu-west-1", false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    Jsons.parse("{\"service\":\"s3\"}"), "on_demand", true, null));

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            Execution queued = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.QUEUED, queued.status());
            Assertions.assertTrue(runtime.getResult(executionId).isEmpty());

            List<WorkerOutcome> outcomes = runtime.runWorkers("w1", 5);
            Assertions.assertEquals(1, outcomes.size());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, outcomes.get(0).status());
            Assertions.assertTrue(runtime.runWorkers("w1", 5).isEmpty());

            Execution done = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, done.status());
            Assertions.assertNull(done.errorClassification());
            Assertions.assertNotNull(done.startedAtMs());
            Assertions.assertNotNull(done.finishedAtMs());
            Assertions.assertEquals(done, runtime.getExecution(executionId).orElseThrow());

            ExecutionResult result = runtime.getResult(executionId).orElseThrow();
            Assertions.assertEquals(2, result.payload().path("count").asInt());
            Assertions.assertEquals("logs", result.payload().path("buckets").path(0).path("name").asText());

            List<RecordingNotifier.Delivery> deliveries = notifier.forExecution(executionId);
            Assertions.assertEquals(1, deliveries.size());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, deliveries.get(0).status());
            Assertions.assertEquals("tenant-a", deliveries.get(0).tenantId());
            Assertions.assertTrue(runtime.verifyAudit().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void undecryptableCredentialFailsWithoutCallingTheProvider() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-decrypt-");
        AtomicInteger calls = new AtomicInteger();
        RecordingNotifier notifier = new RecordingNotifier();
        RemoteServiceClient counting = (call, credentials) -> {
            calls.incrementAndGet();
            return Jsons.parse(BUCKETS);
        };
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), counting, notifier)) {
            CredentialView credential = runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001",
                    "secret".toCharArray(), null, true);
            Assertions.assertEquals(EngineSettings.DEFAULT_REGION, credential.region());
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "weekly", true, credential.credentialId()));

            try (Connection c = new Database(runtime.config()).openConnection();
                 PreparedStatement ps = c.prepareStatement("UPDATE credentials SET secret_blob=? WHERE credential_id=?")) {
                ps.setString(1, "{\"enc\":\"taskpatrol.aesgcm.v1\",\"kid\":\"k-retired\",\"iv\":\"AAAAAAAAAAAAAAAA\",\"ct\":\"AAAA\"}");
                ps.setString(2, credential.credentialId());
                Assertions.assertEquals(1, ps.executeUpdate());
            }

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            runtime.runWorkers("w1", 5);

            Execution failed = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.FAILED, failed.status());
            Assertions.assertEquals(ErrorClassification.AUTHENTICATION_ERROR, failed.errorClassification());
            Assertions.assertEquals(0, calls.get());
            Assertions.assertTrue(runtime.getResult(executionId).isEmpty());
            Assertions.assertEquals(1, notifier.forExecution(executionId).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tenantWithoutAnyCredentialFailsAuthentication() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-nocred-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));
            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            runtime.runWorkers("w1", 5);
            Execution failed = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ErrorClassification.AUTHENTICATION_ERROR, failed.errorClassification());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void manualTriggerWhileRunningIsRejectedAsConflict() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-conflict-");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordingNotifier notifier = new RecordingNotifier();
        RemoteServiceClient blocking = (call, credentials) -> {
            entered.countDown();
            awaitQuietly(release);
            return Jsons.parse(BUCKETS);
        };
        ExecutorService background = Executors.newSingleThreadExecutor();
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), blocking, notifier)) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    null, "on_demand", true, null));

            String first = runtime.triggerExecution("tenant-a", task.taskId());
            Future<List<WorkerOutcome>> worker = background.submit(() -> runtime.runWorkers("w1", 1));
            Assertions.assertTrue(entered.await(10, TimeUnit.SECONDS));
            Assertions.assertEquals(ExecutionStatus.RUNNING, runtime.getExecution(first).orElseThrow().status());

            String second = runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertNotEquals(first, second);
            Execution rejected = runtime.getExecution(second).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.FAILED, rejected.status());
            Assertions.assertEquals(ErrorClassification.CONCURRENCY_CONFLICT, rejected.errorClassification());
            Assertions.assertEquals(0, runtime.queueDepth());

            release.countDown();
            List<WorkerOutcome> outcomes = worker.get(30, TimeUnit.SECONDS);
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, outcomes.get(0).status());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(first).orElseThrow().status());
            Assertions.assertEquals(ExecutionStatus.FAILED, notifier.forExecution(second).get(0).status());
        } finally {
            release.countDown();
            background.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentTriggersLeaveAtMostOneExecutionInFlight() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-race-");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));

            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return runtime.triggerExecution("tenant-a", task.taskId());
                }));
            }
            start.countDown();
            List<Execution> executions = new ArrayList<>();
            for (Future<String> f : futures) {
                executions.add(runtime.getExecution(f.get(30, TimeUnit.SECONDS)).orElseThrow());
            }

            Assertions.assertEquals(1, executions.stream().filter(e -> e.status() == ExecutionStatus.QUEUED).count());
            Assertions.assertTrue(executions.stream()
                    .filter(e -> e.status() != ExecutionStatus.QUEUED)
                    .allMatch(e -> e.status() == ExecutionStatus.FAILED
                            && e.errorClassification() == ErrorClassification.CONCURRENCY_CONFLICT));
            Assertions.assertEquals(1, runtime.queueDepth());
            Assertions.assertEquals(1, runtime.runWorkers("w1", 10).size());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void slowCheckerIsFailedAsServiceLimit() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-timeout-");
        RemoteServiceClient slow = (call, credentials) -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteCallException("Interrupted", 0, true, "call cancelled", e);
            }
            return Jsons.parse(BUCKETS);
        };
        EngineSettings settings = new EngineSettings(0L, 0L, 2, 5_000L, 200L, 0L, null, null, null);
        RecordingNotifier notifier = new RecordingNotifier();
        try (TaskPatrolRuntime runtime = new TaskPatrolRuntime(TaskPatrolConfig.fromRoot(root.toString()), settings,
                new TestClock(T0), slow, notifier, null)) {
            runtime.init();
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            List<WorkerOutcome> outcomes = runtime.runWorkers("w1", 1);
            Assertions.assertEquals(ErrorClassification.SERVICE_LIMIT_ERROR, outcomes.get(0).classification());

            Execution failed = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.FAILED, failed.status());
            Assertions.assertTrue(failed.errorDetail().contains("timed out"));
            Assertions.assertEquals(1, notifier.forExecution(executionId).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lapsedLeaseIsReconciledToStaleAndLateCommitIsFenced() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-stale-");
        TestClock clock = new TestClock(T0);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordingNotifier notifier = new RecordingNotifier();
        RemoteServiceClient blocking = (call, credentials) -> {
            entered.countDown();
            awaitQuietly(release);
            return Jsons.parse(BUCKETS);
        };
        ExecutorService background = Executors.newSingleThreadExecutor();
        try (TaskPatrolRuntime runtime = runtime(root, clock, blocking, notifier)) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    null, "on_demand", true, null));
            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            Future<List<WorkerOutcome>> worker = background.submit(() -> runtime.runWorkers("w1", 1));
            Assertions.assertTrue(entered.await(10, TimeUnit.SECONDS));

            Assertions.assertTrue(runtime.reconcileStaleExecutions().isEmpty());
            clock.advance(Duration.ofMillis(EngineSettings.DEFAULT_LEASE_TIMEOUT_MS + 1_000L));
            List<Execution> flagged = runtime.reconcileStaleExecutions();
            Assertions.assertEquals(1, flagged.size());
            Assertions.assertEquals(executionId, flagged.get(0).executionId());
            Assertions.assertEquals(ExecutionStatus.STALE, flagged.get(0).status());
            Assertions.assertEquals(ExecutionStatus.STALE, notifier.forExecution(executionId).get(0).status());

            release.countDown();
            WorkerOutcome outcome = worker.get(30, TimeUnit.SECONDS).get(0);
            Assertions.assertTrue(outcome.fenced());
            Assertions.assertNull(outcome.status());
            Assertions.assertEquals(ExecutionStatus.STALE, runtime.getExecution(executionId).orElseThrow().status());
            Assertions.assertTrue(runtime.getResult(executionId).isEmpty());
            Assertions.assertEquals(1, notifier.forExecution(executionId).size());
            Assertions.assertEquals(executionId, runtime.listStaleExecutions(10).get(0).executionId());

            String next = runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertEquals(ExecutionStatus.QUEUED, runtime.getExecution(next).orElseThrow().status());
        } finally {
            release.countDown();
            background.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void unsupportedOperationAndBadConfigurationFailAtExecution() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-config-");
        AtomicInteger calls = new AtomicInteger();
        RemoteServiceClient counting = (call, credentials) -> {
            calls.incrementAndGet();
            return Jsons.parse(BUCKETS);
        };
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), counting, new RecordingNotifier())) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition unknown = runtime.createTaskDefinition(new TaskSpec("tenant-a", "warp", "storage", "warp_drive",
                    null, "on_demand", true, null));
            TaskDefinition badConfig = runtime.createTaskDefinition(new TaskSpec("tenant-a", "wrong service", "storage",
                    "resource_list", Jsons.parse("{\"service\":\"ec2\"}"), "on_demand", true, null));

            String unknownRun = runtime.triggerExecution("tenant-a", unknown.taskId());
            String badRun = runtime.triggerExecution("tenant-a", badConfig.taskId());
            runtime.runWorkers("w1", 5);

            Execution unsupported = runtime.getExecution(unknownRun).orElseThrow();
            Assertions.assertEquals(ErrorClassification.SERVICE_ERROR, unsupported.errorClassification());
            Assertions.assertTrue(unsupported.errorDetail().contains("unsupported operation"));
            Assertions.assertEquals(ErrorClassification.CONFIGURATION_ERROR,
                    runtime.getExecution(badRun).orElseThrow().errorClassification());
            Assertions.assertEquals(0, calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void triggerRejectsUnknownForeignAndInactiveTasks() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-trigger-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            TaskDefinition paused = runtime.createTaskDefinition(new TaskSpec("tenant-a", "paused", "compute", "health_check",
                    null, "daily", false, null));

            Assertions.assertThrows(TaskNotFoundException.class, () -> runtime.triggerExecution("tenant-a", "tsk_missing"));
            Assertions.assertThrows(TaskNotFoundException.class, () -> runtime.triggerExecution("tenant-b", paused.taskId()));
            Assertions.assertThrows(IllegalStateException.class, () -> runtime.triggerExecution("tenant-a", paused.taskId()));
            Assertions.assertTrue(runtime.listExecutions(paused.taskId(), null, 10).executions().isEmpty());

            TaskDefinition resumed = runtime.updateTaskDefinition("tenant-a", paused.taskId(),
                    new TaskUpdate(null, null, null, null, null, Boolean.TRUE, null, false));
            Assertions.assertTrue(resumed.active());
            Assertions.assertEquals("paused", resumed.name());
            Assertions.assertNotNull(runtime.triggerExecution("tenant-a", paused.taskId()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void taskDefinitionsValidateInputAndCredentialOwnership() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-define-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            CredentialView foreign = runtime.addCredential("tenant-b", "theirs", "AKIAEXAMPLEKEY000009",
                    "secret".toCharArray(), null, false);
            Assertions.assertTrue(foreign.isDefault());

            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.createTaskDefinition(
                    new TaskSpec("tenant-a", "x", "storage", "health_check", null, "daily", true, foreign.credentialId())));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.createTaskDefinition(
                    new TaskSpec("tenant-a", " ", "storage", "health_check", null, "daily", true, null)));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.createTaskDefinition(
                    new TaskSpec("tenant-a", "x", "storage", "health_check", null, "hourly", true, null)));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.createTaskDefinition(
                    new TaskSpec("tenant-a", "x", "storage", "health_check", Jsons.parse("[1]"), "daily", true, null)));

            TaskDefinition created = runtime.createTaskDefinition(
                    new TaskSpec("tenant-a", " nightly ", "storage", "health_check", null, null, true, null));
            Assertions.assertEquals("nightly", created.name());
            Assertions.assertEquals(T0.toEpochMilli(), created.lastTriggerAtMs());
            Assertions.assertTrue(created.configuration().isObject());
            Assertions.assertEquals(List.of(created.taskId()),
                    runtime.listTaskDefinitions("tenant-a").stream().map(TaskDefinition::taskId).toList());
            Assertions.assertTrue(runtime.listTaskDefinitions("tenant-b").isEmpty());

            Assertions.assertThrows(TaskNotFoundException.class, () -> runtime.updateTaskDefinition("tenant-b", created.taskId(),
                    new TaskUpdate("renamed", null, null, null, null, null, null, false)));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.updateTaskDefinition("tenant-a", created.taskId(),
                    new TaskUpdate(null, null, null, null, null, null, foreign.credentialId(), false)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void historyPagesNewestFirstWithoutGapsOrDuplicates() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-history-");
        TestClock clock = new TestClock(T0);
        try (TaskPatrolRuntime runtime = runtime(root, clock, (call, credentials) -> Jsons.parse(BUCKETS), new RecordingNotifier())) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));
            List<String> triggered = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                clock.advance(Duration.ofSeconds(1));
                triggered.add(0, runtime.triggerExecution("tenant-a", task.taskId()));
                runtime.runWorkers("w1", 1);
            }

            List<String> paged = new ArrayList<>();
            ExecutionPage page = runtime.listExecutions(task.taskId(), null, 2);
            int pages = 1;
            paged.addAll(page.executions().stream().map(Execution::executionId).toList());
            while (page.hasMore()) {
                page = runtime.listExecutions(task.taskId(), page.nextCursor(), 2);
                paged.addAll(page.executions().stream().map(Execution::executionId).toList());
                pages++;
            }
            Assertions.assertEquals(triggered, paged);
            Assertions.assertEquals(3, pages);

            List<String> walked = new ArrayList<>();
            for (Execution execution : runtime.listExecutions(task.taskId())) {
                walked.add(execution.executionId());
            }
            Assertions.assertEquals(triggered, walked);
            Assertions.assertTrue(runtime.listExecutions("tsk_missing", null, 10).executions().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteIsRefusedWhileInFlightAndCascadesAfterwards() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-delete-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            CredentialView credential = runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001",
                    "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, credential.credentialId()));
            String executionId = runtime.triggerExecution("tenant-a", task.taskId());

            Assertions.assertThrows(TaskBusyException.class, () -> runtime.deleteTaskDefinition("tenant-a", task.taskId()));
            runtime.runWorkers("w1", 1);
            Assertions.assertFalse(runtime.deleteCredential("tenant-b", credential.credentialId()));

            Assertions.assertTrue(runtime.deleteTaskDefinition("tenant-a", task.taskId()));
            Assertions.assertTrue(runtime.getTaskDefinition(task.taskId()).isEmpty());
            Assertions.assertTrue(runtime.getExecution(executionId).isEmpty());
            Assertions.assertTrue(runtime.getResult(executionId).isEmpty());
            Assertions.assertTrue(runtime.deleteCredential("tenant-a", credential.credentialId()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rotatedKeyKeepsStoredCredentialsUsable() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-rotate-");
        TestClock clock = new TestClock(T0);
        try (TaskPatrolRuntime runtime = runtime(root, clock, (call, credentials) -> Jsons.parse(BUCKETS), new RecordingNotifier())) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));
            String before = runtime.keyStatus().activeKid();
            clock.advance(Duration.ofSeconds(1));
            String after = runtime.rotateKey().activeKid();
            Assertions.assertNotEquals(before, after);
            Assertions.assertTrue(Files.isRegularFile(root.resolve("security").resolve("credential-keys.json")));

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            runtime.runWorkers("w1", 1);
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(executionId).orElseThrow().status());
            Assertions.assertTrue(runtime.verifyAudit().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void credentialDefaultsAndReassignmentThroughTheRuntime() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-credentials-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS),
                new RecordingNotifier())) {
            CredentialView first = runtime.addCredential("tenant-a", "first", "AKIAEXAMPLEKEY000001", "s1".toCharArray(), null, false);
            CredentialView second = runtime.addCredential("tenant-a", "second", "AKIAEXAMPLEKEY000002", "s2".toCharArray(), "eu-west-1", false);
            Assertions.assertTrue(first.isDefault());
            Assertions.assertFalse(second.isDefault());
            Assertions.assertEquals(EngineSettings.DEFAULT_REGION, first.region());

            Assertions.assertTrue(runtime.setDefaultCredential("tenant-a", second.credentialId()));
            Assertions.assertFalse(runtime.setDefaultCredential("tenant-b", first.credentialId()));
            List<CredentialView> listed = runtime.listCredentials("tenant-a");
            Assertions.assertEquals(2, listed.size());
            Assertions.assertEquals(List.of(second.credentialId()),
                    listed.stream().filter(CredentialView::isDefault).map(CredentialView::credentialId).toList());

            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    null, "weekly", true, first.credentialId()));
            Assertions.assertThrows(CredentialInUseException.class,
                    () -> runtime.deleteCredential("tenant-a", first.credentialId()));

            Assertions.assertEquals(1, runtime.reassignCredential("tenant-a", first.credentialId(), second.credentialId()));
            Assertions.assertEquals(second.credentialId(), runtime.getTaskDefinition(task.taskId()).orElseThrow().credentialId());
            Assertions.assertTrue(runtime.deleteCredential("tenant-a", first.credentialId()));
            Assertions.assertEquals(1, runtime.listCredentials("tenant-a").size());
            Assertions.assertTrue(runtime.verifyAudit().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backgroundWorkersPickUpManualTriggers() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-background-");
        RecordingNotifier notifier = new RecordingNotifier();
        EngineSettings settings = new EngineSettings(0L, 0L, 2, 0L, 0L, 20L, null, null, null);
        try (TaskPatrolRuntime runtime = new TaskPatrolRuntime(TaskPatrolConfig.fromRoot(root.toString()), settings,
                new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS), notifier, null)) {
            runtime.init();
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), "eu-west-1", false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    Jsons.parse("{}"), "on_demand", true, null));
            runtime.startBackground();
            runtime.startBackground();

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
            while (notifier.forExecution(executionId).isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(20L);
            }

            Assertions.assertEquals(1, notifier.forExecution(executionId).size());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(executionId).orElseThrow().status());
            Assertions.assertEquals(0, runtime.queueDepth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void notifierCanQueueTheNextRunOfTheTaskItHearsAbout() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-chained-");
        AtomicReference<TaskPatrolRuntime> current = new AtomicReference<>();
        AtomicReference<String> chainedTask = new AtomicReference<>();
        List<String> followUps = new CopyOnWriteArrayList<>();
        RecordingNotifier recorded = new RecordingNotifier();
        Notifier chaining = (tenantId, executionId, status) -> {
            recorded.notify(tenantId, executionId, status);
            if (status == ExecutionStatus.SUCCEEDED && followUps.isEmpty()) {
                followUps.add(current.get().triggerExecution(tenantId, chainedTask.get()));
            }
        };
        try (TaskPatrolRuntime runtime = new TaskPatrolRuntime(TaskPatrolConfig.fromRoot(root.toString()),
                EngineSettings.defaults(), new TestClock(T0), (call, credentials) -> Jsons.parse(BUCKETS), chaining, null)) {
            runtime.init();
            current.set(runtime);
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "resource_list",
                    null, "on_demand", true, null));
            chainedTask.set(task.taskId());

            String first = runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.runWorkers("w1", 1).get(0).status());

            Assertions.assertEquals(1, followUps.size());
            Execution next = runtime.getExecution(followUps.get(0)).orElseThrow();
            Assertions.assertNotEquals(first, next.executionId());
            Assertions.assertEquals(ExecutionStatus.QUEUED, next.status());
            Assertions.assertNull(next.errorClassification());
            Assertions.assertEquals(1, runtime.queueDepth());

            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.runWorkers("w1", 1).get(0).status());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, recorded.forExecution(next.executionId()).get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedExecutionFreesTheTaskForTheNextTrigger() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-failed-lease-");
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0),
                (call, credentials) -> { throw new RemoteCallException("AccessDenied", 403, "denied"); }, new RecordingNotifier())) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));

            runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertEquals(ExecutionStatus.FAILED, runtime.runWorkers("w1", 1).get(0).status());
            String next = runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertEquals(ExecutionStatus.QUEUED, runtime.getExecution(next).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workerFailureBeforeStartFailsTheQueuedExecution() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-abandon-");
        AtomicInteger calls = new AtomicInteger();
        RecordingNotifier notifier = new RecordingNotifier();
        RemoteServiceClient counting = (call, credentials) -> {
            calls.incrementAndGet();
            return Jsons.parse(BUCKETS);
        };
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), counting, notifier)) {
            runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, null));
            try (Connection c = new Database(runtime.config()).openConnection();
                 PreparedStatement ps = c.prepareStatement("CREATE TRIGGER refuse_start BEFORE UPDATE OF status ON executions "
                         + "WHEN NEW.status='RUNNING' BEGIN SELECT RAISE(ABORT, 'disk I/O error'); END")) {
                ps.executeUpdate();
            }

            String executionId = runtime.triggerExecution("tenant-a", task.taskId());
            List<WorkerOutcome> outcomes = runtime.runWorkers("w1", 5);
            Assertions.assertEquals(1, outcomes.size());
            Assertions.assertEquals(ExecutionStatus.FAILED, outcomes.get(0).status());
            Assertions.assertEquals(ErrorClassification.SERVICE_ERROR, outcomes.get(0).classification());

            Execution failed = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(ExecutionStatus.FAILED, failed.status());
            Assertions.assertEquals(ErrorClassification.SERVICE_ERROR, failed.errorClassification());
            Assertions.assertTrue(failed.errorDetail().contains("Failed to start execution"));
            Assertions.assertEquals(List.of(ExecutionStatus.FAILED),
                    notifier.forExecution(executionId).stream().map(RecordingNotifier.Delivery::status).toList());
            Assertions.assertEquals(0, runtime.queueDepth());
            Assertions.assertEquals(0, calls.get());

            try (Connection c = new Database(runtime.config()).openConnection();
                 PreparedStatement ps = c.prepareStatement("DROP TRIGGER refuse_start")) {
                ps.executeUpdate();
            }
            String next = runtime.triggerExecution("tenant-a", task.taskId());
            Assertions.assertEquals(ExecutionStatus.QUEUED, runtime.getExecution(next).orElseThrow().status());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.runWorkers("w1", 5).get(0).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void triggerCanRunOnceWithAnotherCredentialOfTheSameTenant() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-override-");
        List<String> usedKeys = new CopyOnWriteArrayList<>();
        RemoteServiceClient recording = (call, credentials) -> {
            usedKeys.add(credentials.accessKeyId());
            return Jsons.parse(BUCKETS);
        };
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), recording, new RecordingNotifier())) {
            CredentialView own = runtime.addCredential("tenant-a", "own", "AKIAEXAMPLEKEY000001", "s1".toCharArray(), null, false);
            CredentialView audit = runtime.addCredential("tenant-a", "audit", "AKIAEXAMPLEKEY000002", "s2".toCharArray(), null, false);
            CredentialView foreign = runtime.addCredential("tenant-b", "theirs", "AKIAEXAMPLEKEY000009", "s9".toCharArray(), null, false);
            TaskDefinition task = runtime.createTaskDefinition(new TaskSpec("tenant-a", "buckets", "storage", "health_check",
                    null, "on_demand", true, own.credentialId()));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.triggerExecution("tenant-a", task.taskId(), foreign.credentialId()));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.triggerExecution("tenant-a", task.taskId(), "cred_missing"));
            Assertions.assertEquals(0, runtime.queueDepth());

            String overridden = runtime.triggerExecution("tenant-a", task.taskId(), " " + audit.credentialId() + " ");
            runtime.runWorkers("w1", 1);
            String regular = runtime.triggerExecution("tenant-a", task.taskId(), " ");
            runtime.runWorkers("w1", 1);

            Assertions.assertEquals(List.of("AKIAEXAMPLEKEY000002", "AKIAEXAMPLEKEY000001"), usedKeys);
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(overridden).orElseThrow().status());
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(regular).orElseThrow().status());
            Assertions.assertEquals(own.credentialId(), runtime.getTaskDefinition(task.taskId()).orElseThrow().credentialId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deactivatedCredentialsAreNeverUsedUntilReactivated() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-runtime-inactive-");
        AtomicInteger calls = new AtomicInteger();
        RemoteServiceClient counting = (call, credentials) -> {
            calls.incrementAndGet();
            return Jsons.parse(BUCKETS);
        };
        try (TaskPatrolRuntime runtime = runtime(root, new TestClock(T0), counting, new RecordingNotifier())) {
            CredentialView main = runtime.addCredential("tenant-a", "main", "AKIAEXAMPLEKEY000001", "secret".toCharArray(), null, false);
            TaskDefinition byDefault = runtime.createTaskDefinition(new TaskSpec("tenant-a", "default", "storage", "health_check",
                    null, "on_demand", true, null));
            TaskDefinition explicit = runtime.createTaskDefinition(new TaskSpec("tenant-a", "explicit", "storage", "health_check",
                    null, "on_demand", true, main.credentialId()));

            Assertions.assertFalse(runtime.setCredentialActive("tenant-b", main.credentialId(), false));
            Assertions.assertTrue(runtime.setCredentialActive("tenant-a", main.credentialId(), false));
            Assertions.assertFalse(runtime.listCredentials("tenant-a").get(0).active());

            String viaDefault = runtime.triggerExecution("tenant-a", byDefault.taskId());
            String viaTask = runtime.triggerExecution("tenant-a", explicit.taskId());
            runtime.runWorkers("w1", 5);
            Assertions.assertEquals(ErrorClassification.AUTHENTICATION_ERROR,
                    runtime.getExecution(viaDefault).orElseThrow().errorClassification());
            Execution refused = runtime.getExecution(viaTask).orElseThrow();
            Assertions.assertEquals(ErrorClassification.AUTHENTICATION_ERROR, refused.errorClassification());
            Assertions.assertTrue(refused.errorDetail().contains("inactive"));
            Assertions.assertEquals(0, calls.get());

            Assertions.assertTrue(runtime.setCredentialActive("tenant-a", main.credentialId(), true));
            String again = runtime.triggerExecution("tenant-a", byDefault.taskId());
            runtime.runWorkers("w1", 5);
            Assertions.assertEquals(ExecutionStatus.SUCCEEDED, runtime.getExecution(again).orElseThrow().status());
            Assertions.assertEquals(1, calls.get());
            Assertions.assertTrue(runtime.verifyAudit().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskPatrolRuntime runtime(Path root, TestClock clock, RemoteServiceClient client, RecordingNotifier notifier) {
        TaskPatrolRuntime runtime = new TaskPatrolRuntime(TaskPatrolConfig.fromRoot(root.toString()),
                EngineSettings.defaults(), clock, client, notifier, null);
        runtime.init();
        return runtime;
    }

    private static void awaitQuietly(CountDownLatch latch) throws RemoteCallException {
        try {
            if (!latch.await(30, TimeUnit.SECONDS)) {
                throw new RemoteCallException("TestTimeout", 0, "latch never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException("Interrupted", 0, true, "call cancelled", e);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
