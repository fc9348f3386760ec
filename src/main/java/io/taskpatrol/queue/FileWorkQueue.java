package io.taskpatrol.queue;

import io.taskpatrol.config.TaskPatrolConfig;
import io.taskpatrol.model.ExecutionRequest;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Work queue backed by one JSON file per request. Files are named {@code <queuedAt>_<executionId>}
 * so directory order is FIFO; a worker claims a file by moving it into {@code processing/<workerId>}.
 */
public final class FileWorkQueue implements WorkQueue {
    private static final Logger logger = LoggerFactory.getLogger(FileWorkQueue.class);
    private static final String SUFFIX = ".request.json";

    private final TaskPatrolConfig config;
    private final long pollIntervalMs;
    private final Clock clock;

    public FileWorkQueue(TaskPatrolConfig config, long pollIntervalMs) {
        this(config, pollIntervalMs, Clock.systemUTC());
    }

    public FileWorkQueue(TaskPatrolConfig config, long pollIntervalMs, Clock clock) {
        this.config = config;
        this.pollIntervalMs = Math.max(10L, pollIntervalMs);
        this.clock = clock;
    }

    @Override
    public EnqueueResult enqueue(ExecutionRequest request) {
        String fileName = fileName(request);
        Path target = config.inboxDir().resolve(fileName);
        Path staging = config.inboxDir().resolve(fileName + ".tmp");
        try {
            Files.createDirectories(config.inboxDir());
            Files.writeString(staging, Jsons.toCompactJson(request), StandardCharsets.UTF_8);
            move(staging, target);
            return EnqueueResult.accepted();
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to enqueue execution {}", request.executionId(), e);
            try {
                Files.deleteIfExists(staging);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            return EnqueueResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public ClaimedRequest dequeue(String workerId) throws InterruptedException {
        while (true) {
            Optional<ClaimedRequest> claimed = poll(workerId);
            if (claimed.isPresent()) {
                return claimed.get();
            }
            Thread.sleep(pollIntervalMs);
        }
    }

    @Override
    public Optional<ClaimedRequest> poll(String workerId) {
        Path workerDir = config.processingDir().resolve(workerId);
        for (Path candidate : listRequests(config.inboxDir())) {
            Path claimed = workerDir.resolve(candidate.getFileName().toString());
            try {
                Files.createDirectories(workerDir);
                move(candidate, claimed);
            } catch (NoSuchFileException e) {
                // another worker took it
                continue;
            } catch (IOException e) {
                throw new RuntimeException("Failed to claim request: " + candidate, e);
            }
            try {
                ExecutionRequest request = Jsons.mapper().readValue(claimed.toFile(), ExecutionRequest.class);
                return Optional.of(new ClaimedRequest(request, workerId, claimed));
            } catch (IOException e) {
                logger.warn("Unreadable request {} moved to dead letter: {}", claimed.getFileName(), e.getMessage());
                moveQuietly(claimed, config.deadRoot());
            }
        }
        return Optional.empty();
    }

    @Override
    public void acknowledge(ClaimedRequest claimed) {
        Path dailyDoneDir = config.doneRoot().resolve(LocalDate.now(clock.withZone(ZoneOffset.UTC)).toString());
        try {
            Files.createDirectories(dailyDoneDir);
            Files.move(
                    claimed.processingFile(),
                    dailyDoneDir.resolve(claimed.processingFile().getFileName().toString()),
                    StandardCopyOption.REPLACE_EXISTING
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to move request to done directory", e);
        }
    }

    @Override
    public void reject(ClaimedRequest claimed) {
        try {
            Files.createDirectories(config.deadRoot());
            Files.move(
                    claimed.processingFile(),
                    config.deadRoot().resolve(claimed.processingFile().getFileName().toString()),
                    StandardCopyOption.REPLACE_EXISTING
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to move request to dead directory", e);
        }
    }

    /**
     * Returns requests stranded under {@code processing/} to the inbox. Only safe while no worker of
     * this data root is running.
     */
    @Override
    public int recoverOrphans() {
        Path processing = config.processingDir();
        if (!Files.isDirectory(processing)) {
            return 0;
        }
        int recovered = 0;
        try (DirectoryStream<Path> workers = Files.newDirectoryStream(processing)) {
            for (Path workerDir : workers) {
                if (!Files.isDirectory(workerDir)) {
                    continue;
                }
                for (Path orphan : listRequests(workerDir)) {
                    Files.move(orphan, config.inboxDir().resolve(orphan.getFileName().toString()),
                            StandardCopyOption.REPLACE_EXISTING);
                    recovered++;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to recover orphaned requests", e);
        }
        if (recovered > 0) {
            logger.info("Recovered {} orphaned request(s) into the inbox", recovered);
        }
        return recovered;
    }

    @Override
    public int depth() {
        return listRequests(config.inboxDir()).size();
    }

    private List<Path> listRequests(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list requests in " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private void moveQuietly(Path file, Path dir) {
        try {
            Files.createDirectories(dir);
            Files.move(file, dir.resolve(file.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to move {} to {}", file, dir, e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    static String fileName(ExecutionRequest request) {
        return String.format("%013d_%s%s", Math.max(0L, request.queuedAtMs()), request.executionId(), SUFFIX);
    }
}
