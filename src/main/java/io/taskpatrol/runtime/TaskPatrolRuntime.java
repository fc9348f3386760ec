package io.taskpatrol.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.checker.CheckerRegistry;
import io.taskpatrol.checker.HttpRemoteServiceClient;
import io.taskpatrol.checker.RemoteServiceClient;
import io.taskpatrol.config.EngineSettings;
import io.taskpatrol.config.TaskPatrolConfig;
import io.taskpatrol.engine.ExecutionDispatcher;
import io.taskpatrol.engine.ExecutionWorker;
import io.taskpatrol.engine.PeriodicTasks;
import io.taskpatrol.engine.Scheduler;
import io.taskpatrol.engine.StaleExecutionReconciler;
import io.taskpatrol.engine.TickSummary;
import io.taskpatrol.engine.WorkerOutcome;
import io.taskpatrol.engine.WorkerPool;
import io.taskpatrol.model.CredentialView;
import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionCursor;
import io.taskpatrol.model.ExecutionResult;
import io.taskpatrol.model.Frequency;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.model.TriggerReason;
import io.taskpatrol.notify.LoggingNotifier;
import io.taskpatrol.notify.NotificationDispatcher;
import io.taskpatrol.notify.Notifier;
import io.taskpatrol.notify.WebhookNotifier;
import io.taskpatrol.observability.AuditLogger;
import io.taskpatrol.queue.FileWorkQueue;
import io.taskpatrol.queue.WorkQueue;
import io.taskpatrol.security.CredentialCipher;
import io.taskpatrol.storage.CredentialStore;
import io.taskpatrol.storage.Database;
import io.taskpatrol.storage.ExecutionStore;
import io.taskpatrol.storage.TaskNotFoundException;
import io.taskpatrol.util.Ids;
import io.taskpatrol.util.Jsons;
import io.taskpatrol.vault.StoredCredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires storage, queue, vault, checkers and engine together and exposes the operations used by the
 * CLI and by embedding code.
 */
public final class TaskPatrolRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskPatrolRuntime.class);
    private static final String TRIGGER_HOLDER = "trigger";
    private static final String OPERATOR = "operator";
    private static final int DEFAULT_PAGE_SIZE = 50;

    private final TaskPatrolConfig config;
    private final EngineSettings settings;
    private final Clock clock;
    private final Database database;
    private final ExecutionStore store;
    private final CredentialStore credentials;
    private final CredentialCipher cipher;
    private final StoredCredentialVault vault;
    private final CheckerRegistry checkers;
    private final WorkQueue queue;
    private final AuditLogger audit;
    private final ExecutionDispatcher dispatcher;
    private final Scheduler scheduler;
    private final StaleExecutionReconciler reconciler;
    private final ThreadPoolExecutor checkerExecutor;
    private final WorkerPool workerPool;
    private final PeriodicTasks periodic;
    private final AtomicBoolean backgroundStarted = new AtomicBoolean(false);

    public TaskPatrolRuntime(TaskPatrolConfig config) {
        this(config, EngineSettings.load(config), Clock.systemUTC(), null, null, null);
    }

    /**
     * {@code remoteClient}, {@code notifier} and {@code queue} may be null to use the implementations
     * named by {@code settings}.
     */
    public TaskPatrolRuntime(TaskPatrolConfig config, EngineSettings settings, Clock clock,
                             RemoteServiceClient remoteClient, Notifier notifier, WorkQueue queue) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config, clock);
        this.store = new ExecutionStore(database);
        this.credentials = new CredentialStore(database);
        this.cipher = new CredentialCipher(config.credentialKeyFile(), clock);
        this.vault = new StoredCredentialVault(credentials, cipher);
        this.checkers = CheckerRegistry.withDefaults(remoteClient != null
                ? remoteClient
                : new HttpRemoteServiceClient(settings.remoteEndpoint(), Duration.ofMillis(settings.checkerTimeoutMs()), clock));
        this.queue = queue != null ? queue : new FileWorkQueue(config, settings.queuePollIntervalMs(), clock);
        this.audit = new AuditLogger(config.auditRoot().resolve("audit.log"), clock);
        NotificationDispatcher notifications = new NotificationDispatcher(notifier != null ? notifier : defaultNotifier(settings, clock));
        this.dispatcher = new ExecutionDispatcher(store, this.queue, notifications, audit, settings.leaseTimeoutMs());
        this.scheduler = new Scheduler(store, dispatcher, clock);
        this.reconciler = new StaleExecutionReconciler(store, notifications, audit, clock);
        this.checkerExecutor = newCheckerExecutor(settings.workerThreads());
        ExecutionWorker worker = new ExecutionWorker(store, credentials, vault, checkers, notifications, audit,
                checkerExecutor, clock, settings.leaseTimeoutMs(), settings.checkerTimeoutMs());
        this.workerPool = new WorkerPool(this.queue, worker, settings.workerThreads(), "worker",
                settings.queuePollIntervalMs());
        this.periodic = new PeriodicTasks();
    }

    public void init() {
        database.init();
    }

    public TaskPatrolConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public CheckerRegistry checkers() {
        return checkers;
    }

    // ---- task definitions ----

    public TaskDefinition createTaskDefinition(TaskSpec spec) {
        requireText(spec.tenantId(), "tenantId");
        requireText(spec.name(), "name");
        requireText(spec.serviceCategory(), "serviceCategory");
        requireText(spec.operation(), "operation");
        JsonNode configuration = normalizeConfiguration(spec.configuration());
        Frequency frequency = Frequency.fromString(spec.frequency());
        String credentialId = blankToNull(spec.credentialId());
        if (credentialId != null) {
            requireOwnedCredential(spec.tenantId(), credentialId);
        }
        long now = clock.millis();
        TaskDefinition task = new TaskDefinition(
                Ids.taskId(),
                spec.tenantId().trim(),
                spec.name().trim(),
                spec.serviceCategory().trim(),
                spec.operation().trim(),
                configuration,
                frequency,
                spec.active(),
                credentialId,
                now,
                now,
                now
        );
        store.insertTask(task);
        audit.log(AuditLogger.AuditEvent.of("task.create", OPERATOR, task.tenantId(), task.taskId(), null, "ok",
                taskDetails(task)));
        logger.info("Created task {} ({}/{}, {}) for tenant {}", task.taskId(), task.serviceCategory(), task.operation(),
                frequency.wireName(), task.tenantId());
        return task;
    }

    public TaskDefinition updateTaskDefinition(String tenantId, String taskId, TaskUpdate update) {
        TaskDefinition current = requireTask(tenantId, taskId);
        String credentialId = current.credentialId();
        if (update.clearCredential()) {
            credentialId = null;
        } else if (blankToNull(update.credentialId()) != null) {
            credentialId = update.credentialId().trim();
            requireOwnedCredential(current.tenantId(), credentialId);
        }
        TaskDefinition updated = new TaskDefinition(
                current.taskId(),
                current.tenantId(),
                update.name() == null ? current.name() : requireText(update.name(), "name"),
                update.serviceCategory() == null ? current.serviceCategory() : requireText(update.serviceCategory(), "serviceCategory"),
                update.operation() == null ? current.operation() : requireText(update.operation(), "operation"),
                update.configuration() == null ? current.configuration() : normalizeConfiguration(update.configuration()),
                update.frequency() == null ? current.frequency() : Frequency.fromString(update.frequency()),
                update.active() == null ? current.active() : update.active(),
                credentialId,
                current.createdAtMs(),
                clock.millis(),
                current.lastTriggerAtMs()
        );
        if (!store.updateTask(updated)) {
            throw new TaskNotFoundException(taskId);
        }
        audit.log(AuditLogger.AuditEvent.of("task.update", OPERATOR, updated.tenantId(), updated.taskId(), null, "ok",
                taskDetails(updated)));
        return updated;
    }

    /**
     * Removes the task with its execution history. Refused with
     * {@link io.taskpatrol.storage.TaskBusyException} while an execution holds the task lease.
     */
    public boolean deleteTaskDefinition(String tenantId, String taskId) {
        TaskDefinition task = requireTask(tenantId, taskId);
        boolean removed = store.deleteTask(task.taskId(), clock.millis());
        if (removed) {
            audit.log(AuditLogger.AuditEvent.of("task.delete", OPERATOR, task.tenantId(), task.taskId(), null, "ok", Map.of()));
            logger.info("Deleted task {} of tenant {}", task.taskId(), task.tenantId());
        }
        return removed;
    }

    public Optional<TaskDefinition> getTaskDefinition(String taskId) {
        return store.findTask(taskId);
    }

    public List<TaskDefinition> listTaskDefinitions(String tenantId) {
        return store.listTasks(tenantId);
    }

    // ---- executions ----

    /**
     * Queues a manual execution and returns its id. When the task already has an execution in flight
     * the returned execution is already failed with {@code ConcurrencyConflict}.
     *
     * @throws TaskNotFoundException when the task does not exist for {@code tenantId}
     * @throws IllegalStateException when the task is inactive
     */
    public String triggerExecution(String tenantId, String taskId) {
        return triggerExecution(tenantId, taskId, null);
    }

    /**
     * Like {@link #triggerExecution(String, String)}, running this one execution with
     * {@code credentialId} instead of the task's credential. A null override keeps the task's own.
     *
     * @throws IllegalArgumentException when the override does not belong to {@code tenantId}
     */
    public String triggerExecution(String tenantId, String taskId, String credentialId) {
        TaskDefinition task = requireTask(tenantId, taskId);
        if (!task.active()) {
            throw new IllegalStateException("Task " + taskId + " is inactive");
        }
        String override = credentialId == null || credentialId.isBlank() ? null : credentialId.trim();
        if (override != null) {
            requireOwnedCredential(task.tenantId(), override);
        }
        ExecutionDispatcher.DispatchOutcome outcome = dispatcher.dispatch(task, TriggerReason.MANUAL, TRIGGER_HOLDER,
                clock.millis(), override);
        return outcome.executionId();
    }

    public Optional<Execution> getExecution(String executionId) {
        return store.getExecution(executionId);
    }

    public Optional<ExecutionResult> getResult(String executionId) {
        return store.getResult(executionId);
    }

    public ExecutionPage listExecutions(String taskId, ExecutionCursor cursor, int pageSize) {
        int size = Math.max(1, Math.min(ExecutionStore.MAX_PAGE_SIZE - 1, pageSize));
        List<Execution> rows = store.listExecutions(taskId, cursor, size + 1);
        if (rows.size() <= size) {
            return new ExecutionPage(rows, null);
        }
        List<Execution> page = List.copyOf(rows.subList(0, size));
        return new ExecutionPage(page, ExecutionCursor.after(page.get(page.size() - 1)));
    }

    /**
     * Every execution of the task, newest first, fetched lazily.
     */
    public ExecutionHistory listExecutions(String taskId) {
        return executionHistory(taskId, null);
    }

    public ExecutionHistory executionHistory(String taskId, ExecutionCursor from) {
        return new ExecutionHistory(store, taskId, from, DEFAULT_PAGE_SIZE);
    }

    // ---- credentials ----

    public CredentialView addCredential(String tenantId, String name, String accessKeyId, char[] secret,
                                        String region, boolean makeDefault) {
        return addCredential(tenantId, name, accessKeyId, secret, null, region, makeDefault);
    }

    /**
     * Stores temporary credentials when {@code sessionToken} is given. The caller keeps ownership of both
     * arrays.
     */
    public CredentialView addCredential(String tenantId, String name, String accessKeyId, char[] secret,
                                        char[] sessionToken, String region, boolean makeDefault) {
        requireText(tenantId, "tenantId");
        requireText(name, "name");
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("secret is required");
        }
        String blob = vault.seal(accessKeyId, secret, sessionToken);
        String credentialId = Ids.credentialId();
        boolean isDefault = makeDefault || credentials.findDefaultCredentialId(tenantId.trim()).isEmpty();
        String effectiveRegion = region == null || region.isBlank() ? settings.defaultRegion() : region.trim();
        credentials.insert(new CredentialStore.NewCredential(credentialId, tenantId.trim(), name.trim(), blob,
                effectiveRegion, isDefault, clock.millis()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", name.trim());
        details.put("region", effectiveRegion);
        details.put("default", isDefault);
        details.put("temporary", sessionToken != null && sessionToken.length > 0);
        audit.log(AuditLogger.AuditEvent.of("credential.create", OPERATOR, tenantId.trim(), null, null, "ok", details));
        logger.info("Stored credential {} for tenant {}", credentialId, tenantId);
        return credentials.find(credentialId)
                .orElseThrow(() -> new IllegalStateException("Credential vanished after insert: " + credentialId));
    }

    public List<CredentialView> listCredentials(String tenantId) {
        return credentials.list(tenantId);
    }

    public boolean setDefaultCredential(String tenantId, String credentialId) {
        return credentials.setDefault(tenantId, credentialId, clock.millis());
    }

    /**
     * Deactivated credentials stay stored but resolve as not found, and are never used as the tenant
     * default. Returns false when the tenant has no such credential.
     */
    public boolean setCredentialActive(String tenantId, String credentialId, boolean active) {
        boolean changed = credentials.setActive(tenantId, credentialId, active, clock.millis());
        if (changed) {
            audit.log(AuditLogger.AuditEvent.of(active ? "credential.activate" : "credential.deactivate", OPERATOR,
                    tenantId, null, null, "ok", Map.of("credential_id", credentialId)));
            logger.info("Credential {} of tenant {} is now {}", credentialId, tenantId, active ? "active" : "inactive");
        }
        return changed;
    }

    /**
     * Moves every task of the tenant from one credential to another; returns the number of tasks moved.
     */
    public int reassignCredential(String tenantId, String fromCredentialId, String toCredentialId) {
        int moved = credentials.reassign(tenantId, fromCredentialId, toCredentialId, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", fromCredentialId);
        details.put("to", toCredentialId);
        details.put("tasks", moved);
        audit.log(AuditLogger.AuditEvent.of("credential.reassign", OPERATOR, tenantId, null, null, "ok", details));
        return moved;
    }

    /**
     * @throws io.taskpatrol.storage.CredentialInUseException while tasks still reference the credential
     */
    public boolean deleteCredential(String tenantId, String credentialId) {
        Optional<CredentialView> existing = credentials.find(credentialId);
        if (existing.isEmpty() || !existing.get().tenantId().equals(tenantId)) {
            return false;
        }
        boolean removed = credentials.delete(credentialId);
        if (removed) {
            audit.log(AuditLogger.AuditEvent.of("credential.delete", OPERATOR, tenantId, null, null, "ok",
                    Map.of("credential_id", credentialId)));
        }
        return removed;
    }

    // ---- engine ----

    public TickSummary tick() {
        return scheduler.tick();
    }

    /**
     * Processes queued requests on the calling thread until the queue is empty or {@code max} were
     * handled.
     */
    public List<WorkerOutcome> runWorkers(String workerId, int max) {
        return workerPool.drain(workerId, Math.max(1, max));
    }

    public int recoverOrphans() {
        int recovered = queue.recoverOrphans();
        if (recovered > 0) {
            logger.warn("Recovered {} orphaned request(s) from processing", recovered);
        }
        return recovered;
    }

    /**
     * Starts the scheduler tick, stale reconciliation and the worker threads. Idempotent.
     */
    public void startBackground() {
        if (!backgroundStarted.compareAndSet(false, true)) {
            return;
        }
        recoverOrphans();
        periodic.register("scheduler-tick", settings.tickIntervalMs(), scheduler::tick);
        periodic.register("stale-reconcile", settings.reconcileIntervalMs(), reconciler::reconcile);
        periodic.start();
        workerPool.start();
    }

    public List<Execution> reconcileStaleExecutions() {
        return reconciler.reconcile();
    }

    public List<Execution> listStaleExecutions(int limit) {
        return store.listStaleExecutions(limit);
    }

    public int queueDepth() {
        return queue.depth();
    }

    public Map<String, List<String>> catalog() {
        return checkers.catalog();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    // ---- keys and audit ----

    public CredentialCipher.KeyringStatus keyStatus() {
        return cipher.status();
    }

    public CredentialCipher.RotationOutcome rotateKey() {
        CredentialCipher.RotationOutcome outcome = cipher.rotate();
        audit.log(AuditLogger.AuditEvent.of("credential.key_rotate", OPERATOR, null, null, null, "ok",
                Map.of("active_kid", outcome.activeKid(), "total_keys", outcome.totalKeys())));
        return outcome;
    }

    public AuditLogger.ChainVerification verifyAudit() {
        return audit.verify();
    }

    @Override
    public void close() {
        if (backgroundStarted.get()) {
            workerPool.stop();
            periodic.stop();
        }
        checkerExecutor.shutdownNow();
        try {
            if (!checkerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Checker executor did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Checker executor shutdown interrupted.");
        }
    }

    private TaskDefinition requireTask(String tenantId, String taskId) {
        Optional<TaskDefinition> task = store.findTask(taskId);
        if (task.isEmpty() || (tenantId != null && !task.get().tenantId().equals(tenantId))) {
            throw new TaskNotFoundException(taskId);
        }
        return task.get();
    }

    private void requireOwnedCredential(String tenantId, String credentialId) {
        Optional<CredentialView> credential = credentials.find(credentialId);
        if (credential.isEmpty() || !credential.get().tenantId().equals(tenantId.trim())) {
            throw new IllegalArgumentException("Credential " + credentialId + " does not belong to tenant " + tenantId);
        }
    }

    private static JsonNode normalizeConfiguration(JsonNode configuration) {
        if (configuration == null || configuration.isNull() || configuration.isMissingNode()) {
            return Jsons.mapper().createObjectNode();
        }
        if (!configuration.isObject()) {
            throw new IllegalArgumentException("configuration must be a JSON object");
        }
        return configuration;
    }

    private static Map<String, Object> taskDetails(TaskDefinition task) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", task.name());
        details.put("service_category", task.serviceCategory());
        details.put("operation", task.operation());
        details.put("frequency", task.frequency().wireName());
        details.put("active", task.active());
        details.put("credential_id", task.credentialId() == null ? "" : task.credentialId());
        return details;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Notifier defaultNotifier(EngineSettings settings, Clock clock) {
        if (settings.notifierWebhookUrl().isEmpty()) {
            return new LoggingNotifier();
        }
        return new WebhookNotifier(settings.notifierWebhookUrl(), clock);
    }

    private static ThreadPoolExecutor newCheckerExecutor(int workerThreads) {
        AtomicInteger seq = new AtomicInteger();
        int core = Math.max(1, workerThreads);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, core * 4, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "taskpatrol-checker-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
