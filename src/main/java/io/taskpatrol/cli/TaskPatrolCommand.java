package io.taskpatrol.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.config.TaskPatrolConfig;
import io.taskpatrol.engine.TickSummary;
import io.taskpatrol.engine.WorkerOutcome;
import io.taskpatrol.model.CredentialView;
import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionCursor;
import io.taskpatrol.model.ExecutionResult;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.runtime.ExecutionPage;
import io.taskpatrol.runtime.TaskPatrolRuntime;
import io.taskpatrol.runtime.TaskSpec;
import io.taskpatrol.runtime.TaskUpdate;
import io.taskpatrol.storage.CredentialInUseException;
import io.taskpatrol.storage.TaskBusyException;
import io.taskpatrol.storage.TaskNotFoundException;
import io.taskpatrol.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "taskpatrol",
        mixinStandardHelpOptions = true,
        description = "TaskPatrol scheduling and execution engine CLI",
        subcommands = {
                TaskPatrolCommand.InitCommand.class,
                TaskPatrolCommand.CredentialAddCommand.class,
                TaskPatrolCommand.CredentialsCommand.class,
                TaskPatrolCommand.CredentialDefaultCommand.class,
                TaskPatrolCommand.CredentialActiveCommand.class,
                TaskPatrolCommand.CredentialReassignCommand.class,
                TaskPatrolCommand.CredentialDeleteCommand.class,
                TaskPatrolCommand.TaskCreateCommand.class,
                TaskPatrolCommand.TaskUpdateCommand.class,
                TaskPatrolCommand.TaskDeleteCommand.class,
                TaskPatrolCommand.TasksCommand.class,
                TaskPatrolCommand.TriggerCommand.class,
                TaskPatrolCommand.ExecutionCommand.class,
                TaskPatrolCommand.ExecutionsCommand.class,
                TaskPatrolCommand.TickCommand.class,
                TaskPatrolCommand.WorkerCommand.class,
                TaskPatrolCommand.ServeCommand.class,
                TaskPatrolCommand.ReconcileCommand.class,
                TaskPatrolCommand.StaleCommand.class,
                TaskPatrolCommand.CatalogCommand.class,
                TaskPatrolCommand.SchemaMigrationsCommand.class,
                TaskPatrolCommand.KeyStatusCommand.class,
                TaskPatrolCommand.KeyRotateCommand.class,
                TaskPatrolCommand.AuditVerifyCommand.class
        }
)
public final class TaskPatrolCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = TaskPatrolConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | credential-add | credentials | credential-default | credential-active | credential-reassign | credential-delete | task-create | task-update | task-delete | tasks | trigger | execution | executions | tick | worker | serve | reconcile | stale | catalog | schema-migrations | key-status | key-rotate | audit-verify");
    }

    TaskPatrolRuntime runtime() {
        TaskPatrolRuntime runtime = new TaskPatrolRuntime(TaskPatrolConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static int error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        System.out.println(Jsons.toJson(out));
        return 1;
    }

    @Command(name = "init", description = "Initialize directories, keyring and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println("Initialized TaskPatrol at: " + runtime.config().rootDir());
                return 0;
            }
        }
    }

    @Command(name = "credential-add", description = "Encrypt and store a tenant credential")
    static final class CredentialAddCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--name"}, required = true, description = "Display name")
        String name;

        @Option(names = {"--access-key-id"}, required = true, description = "Access key id")
        String accessKeyId;

        @Option(names = {"--secret"}, required = true, interactive = true, arity = "0..1",
                description = "Secret access key (prompted when no value is given)")
        char[] secret;

        @Option(names = {"--session-token"}, interactive = true, arity = "0..1",
                description = "Session token of temporary credentials (prompted when no value is given)")
        char[] sessionToken;

        @Option(names = {"--region"}, description = "Region; defaults to the configured default region")
        String region;

        @Option(names = {"--default"}, defaultValue = "false", description = "Make this the tenant's default credential")
        boolean makeDefault;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                CredentialView view = runtime.addCredential(tenant, name, accessKeyId, secret, sessionToken, region, makeDefault);
                System.out.println(Jsons.toJson(view));
                return 0;
            } finally {
                if (secret != null) {
                    Arrays.fill(secret, '\0');
                }
                if (sessionToken != null) {
                    Arrays.fill(sessionToken, '\0');
                }
            }
        }
    }

    @Command(name = "credentials", description = "List a tenant's credentials (secrets are never shown)")
    static final class CredentialsCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listCredentials(tenant)));
                return 0;
            }
        }
    }

    @Command(name = "credential-default", description = "Set the tenant's default credential")
    static final class CredentialDefaultCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Credential id")
        String credentialId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                if (!runtime.setDefaultCredential(tenant, credentialId)) {
                    return error("credential not found");
                }
                System.out.println(Jsons.toJson(runtime.listCredentials(tenant)));
                return 0;
            }
        }
    }

    @Command(name = "credential-active", description = "Deactivate or reactivate a credential")
    static final class CredentialActiveCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Credential id")
        String credentialId;

        @Option(names = {"--active"}, required = true, arity = "1", description = "true to activate, false to deactivate")
        boolean active;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                if (!runtime.setCredentialActive(tenant, credentialId, active)) {
                    return error("credential not found");
                }
                System.out.println(Jsons.toJson(runtime.listCredentials(tenant)));
                return 0;
            }
        }
    }

    @Command(name = "credential-reassign", description = "Move every task from one credential to another")
    static final class CredentialReassignCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--from"}, required = true, description = "Credential currently referenced")
        String from;

        @Option(names = {"--to"}, required = true, description = "Replacement credential")
        String to;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                int moved = runtime.reassignCredential(tenant, from, to);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("from", from);
                out.put("to", to);
                out.put("tasksMoved", moved);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "credential-delete", description = "Delete a credential no task references")
    static final class CredentialDeleteCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Credential id")
        String credentialId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                if (!runtime.deleteCredential(tenant, credentialId)) {
                    return error("credential not found");
                }
                System.out.println(Jsons.toJson(Map.of("deleted", credentialId)));
                return 0;
            } catch (CredentialInUseException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "task-create", description = "Create a task definition")
    static final class TaskCreateCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--name"}, required = true, description = "Task name")
        String name;

        @Option(names = {"--category"}, required = true, description = "Service category, e.g. compute")
        String category;

        @Option(names = {"--operation"}, required = true, description = "health_check | resource_list | custom operation name")
        String operation;

        @Option(names = {"--config"}, description = "Configuration JSON object")
        String configuration;

        @Option(names = {"--frequency"}, defaultValue = "daily", description = "daily | weekly | monthly | on_demand")
        String frequency;

        @Option(names = {"--inactive"}, defaultValue = "false", description = "Create the task inactive")
        boolean inactive;

        @Option(names = {"--credential"}, description = "Credential id; omitted means the tenant default")
        String credentialId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                JsonNode cfg = Jsons.parse(configuration);
                TaskDefinition task = runtime.createTaskDefinition(
                        new TaskSpec(tenant, name, category, operation, cfg, frequency, !inactive, credentialId));
                System.out.println(Jsons.toJson(task));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "task-update", description = "Update fields of a task definition")
    static final class TaskUpdateCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--name"}, description = "Task name")
        String name;

        @Option(names = {"--category"}, description = "Service category")
        String category;

        @Option(names = {"--operation"}, description = "Operation name")
        String operation;

        @Option(names = {"--config"}, description = "Configuration JSON object")
        String configuration;

        @Option(names = {"--frequency"}, description = "daily | weekly | monthly | on_demand")
        String frequency;

        @Option(names = {"--active"}, arity = "1", description = "true | false")
        Boolean active;

        @Option(names = {"--credential"}, description = "Credential id")
        String credentialId;

        @Option(names = {"--clear-credential"}, defaultValue = "false", description = "Fall back to the tenant default credential")
        boolean clearCredential;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                JsonNode cfg = configuration == null ? null : Jsons.parse(configuration);
                TaskDefinition task = runtime.updateTaskDefinition(tenant, taskId,
                        new TaskUpdate(name, category, operation, cfg, frequency, active, credentialId, clearCredential));
                System.out.println(Jsons.toJson(task));
                return 0;
            } catch (TaskNotFoundException | IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "task-delete", description = "Delete a task with its execution history")
    static final class TaskDeleteCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                runtime.deleteTaskDefinition(tenant, taskId);
                System.out.println(Jsons.toJson(Map.of("deleted", taskId)));
                return 0;
            } catch (TaskNotFoundException | TaskBusyException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "tasks", description = "List a tenant's task definitions")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listTaskDefinitions(tenant)));
                return 0;
            }
        }
    }

    @Command(name = "trigger", description = "Queue a manual execution of a task")
    static final class TriggerCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--credential"}, description = "Run this execution with another credential of the tenant")
        String credentialId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                String executionId = runtime.triggerExecution(tenant, taskId, credentialId);
                Optional<Execution> execution = runtime.getExecution(executionId);
                System.out.println(Jsons.toJson(execution.isPresent() ? execution.get() : Map.of("executionId", executionId)));
                return 0;
            } catch (TaskNotFoundException | IllegalStateException | IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "execution", description = "Show an execution and its result")
    static final class ExecutionCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                Optional<Execution> execution = runtime.getExecution(executionId);
                if (execution.isEmpty()) {
                    return error("execution not found");
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("execution", execution.get());
                Optional<ExecutionResult> result = runtime.getResult(executionId);
                out.put("result", result.isPresent() ? result.get() : null);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "executions", description = "List a task's executions, newest first")
    static final class ExecutionsCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--cursor"}, description = "Cursor returned by a previous page")
        String cursor;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Page size")
        int limit;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                ExecutionPage page = runtime.listExecutions(taskId, ExecutionCursor.decode(cursor), limit);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("executions", page.executions());
                out.put("nextCursor", page.hasMore() ? page.nextCursor().encode() : null);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "tick", description = "Run one scheduler sweep")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                TickSummary summary = runtime.tick();
                System.out.println(Jsons.toJson(summary));
                return 0;
            }
        }
    }

    @Command(name = "worker", description = "Process queued requests on this thread until the queue is empty")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity")
        String workerId;

        @Option(names = {"--max"}, defaultValue = "100", description = "Maximum requests to process")
        int max;

        @Option(names = {"--recover"}, defaultValue = "false", description = "Requeue orphaned claims first")
        boolean recover;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                if (recover) {
                    runtime.recoverOrphans();
                }
                List<WorkerOutcome> outcomes = runtime.runWorkers(workerId, max);
                System.out.println(Jsons.toJson(outcomes));
                return 0;
            }
        }
    }

    @Command(name = "serve", description = "Run scheduler, reconciler and worker pool until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() throws Exception {
            TaskPatrolRuntime runtime = parent.runtime();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "taskpatrol-shutdown-hook"));
            runtime.startBackground();
            System.out.println("TaskPatrol serving from " + runtime.config().rootDir()
                    + " with " + runtime.settings().workerThreads() + " worker(s)");
            stopped.await();
            return 0;
        }
    }

    @Command(name = "reconcile", description = "Flag running executions whose lease was lost as stale")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reconcileStaleExecutions()));
                return 0;
            }
        }
    }

    @Command(name = "stale", description = "List executions flagged stale")
    static final class StaleCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listStaleExecutions(limit)));
                return 0;
            }
        }
    }

    @Command(name = "catalog", description = "List service categories and their operations")
    static final class CatalogCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.catalog()));
                return 0;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations()));
                return 0;
            }
        }
    }

    @Command(name = "key-status", description = "Show credential keyring status")
    static final class KeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.keyStatus()));
                return 0;
            }
        }
    }

    @Command(name = "key-rotate", description = "Add a new active credential key; older keys stay readable")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.rotateKey()));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TaskPatrolCommand parent;

        @Override
        public Integer call() {
            try (TaskPatrolRuntime runtime = parent.runtime()) {
                var out = runtime.verifyAudit();
                System.out.println(Jsons.toJson(out));
                return out.valid() ? 0 : 1;
            }
        }
    }
}
