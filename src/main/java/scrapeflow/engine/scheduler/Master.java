package scrapeflow.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.config.EngineConfig;
import scrapeflow.engine.error.ConfigurationException;
import scrapeflow.engine.error.PoolExhaustionException;
import scrapeflow.engine.model.EngineSnapshot;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.RunStats;
import scrapeflow.engine.model.SourceType;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.model.WorkerState;
import scrapeflow.engine.model.WorkerStatus;
import scrapeflow.engine.scraper.ScraperSelector;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Coordinator of a run: owns the task queue, the worker pool and the
 * aggregate statistics.
 *
 * Lifecycle:
 * <pre>
 * Master master = new Master(selector, RateLimiter.perSecond(1.0), config);
 * master.submit(tasks);
 * RunStats stats = master.run(1, 3);
 * List&lt;Result&gt; results = master.results();
 * </pre>
 *
 * The pool is sized once at start. A worker that dies mid-task is replaced
 * and its task is recorded as failed, not retried elsewhere.
 */
public final class Master {

    private static final Logger log = LoggerFactory.getLogger(Master.class);

    private final ScraperSelector selector;
    private final RateLimiter rateLimiter;
    private final EngineConfig config;
    private final ThreadFactory threadFactory;

    private final List<Task> pending = new ArrayList<>();
    private final List<WorkerHandle> workers = new CopyOnWriteArrayList<>();
    private final List<Result> results = new CopyOnWriteArrayList<>();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger workerSequence = new AtomicInteger();

    private volatile TaskQueue queue;
    private volatile int submitted;
    private volatile boolean running;

    public Master(ScraperSelector selector, RateLimiter rateLimiter, EngineConfig config) {
        this(selector, rateLimiter, config, runnable -> {
            Thread t = new Thread(runnable);
            t.setDaemon(true);
            return t;
        });
    }

    public Master(ScraperSelector selector, RateLimiter rateLimiter, EngineConfig config, ThreadFactory threadFactory) {
        this.selector = selector;
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.threadFactory = threadFactory;
    }

    /**
     * Load tasks for the next run. May be called several times before
     * {@link #run}; the tasks are consumed by the run.
     *
     * @throws ConfigurationException if the list is empty, a task has an
     *                                unknown type or reuses an id, or a run
     *                                is in progress
     */
    public synchronized void submit(List<Task> tasks) {
        if (running) {
            throw new ConfigurationException("Cannot submit tasks while a run is in progress");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new ConfigurationException("Task list is empty");
        }

        Set<Integer> ids = new HashSet<>();
        for (Task queued : pending) {
            ids.add(queued.id());
        }
        for (Task task : tasks) {
            if (task == null) {
                throw new ConfigurationException("Task list contains a null entry");
            }
            if (task.sourceType().isEmpty()) {
                throw new ConfigurationException("Task " + task.id() + " has unsupported type '" + task.type()
                        + "', expected one of " + SourceType.ids());
            }
            if (!ids.add(task.id())) {
                throw new ConfigurationException("Duplicate task id " + task.id());
            }
        }

        pending.addAll(tasks);
        log.info("Submitted {} tasks ({} pending)", tasks.size(), pending.size());
    }

    /**
     * Run with the worker bounds from the configuration.
     */
    public RunStats run() {
        return run(config.minWorkers(), config.maxWorkers());
    }

    /**
     * Process every submitted task and block until each has a result.
     *
     * @return aggregate statistics; {@code succeeded + failed} equals the number of submitted tasks
     * @throws ConfigurationException  on invalid bounds, nothing submitted, or a run already in progress
     * @throws PoolExhaustionException if fewer than {@code minWorkers} workers could be started
     */
    public RunStats run(int minWorkers, int maxWorkers) {
        if (minWorkers < 1 || minWorkers > maxWorkers) {
            throw new ConfigurationException(
                    "Worker bounds must satisfy 1 <= min <= max, got min=" + minWorkers + ", max=" + maxWorkers);
        }

        List<Task> tasks;
        synchronized (this) {
            if (running) {
                throw new ConfigurationException("A run is already in progress");
            }
            if (pending.isEmpty()) {
                throw new ConfigurationException("No tasks submitted");
            }
            tasks = List.copyOf(pending);
            pending.clear();
            running = true;
        }

        Instant startedAt = Instant.now();
        TaskQueue runQueue = new TaskQueue();
        BlockingQueue<Result> channel = new LinkedBlockingQueue<>();
        workers.clear();
        results.clear();
        completed.set(0);
        submitted = tasks.size();
        queue = runQueue;

        int poolSize = Math.max(minWorkers, Math.min(maxWorkers, tasks.size()));
        log.info("Starting run: {} tasks, {} workers (bounds {}..{}), {}",
                tasks.size(), poolSize, minWorkers, maxWorkers, rateLimiter);

        try {
            startPool(poolSize, minWorkers, runQueue, channel);
            runQueue.addAll(tasks);

            RunStatsCollector stats = new RunStatsCollector(startedAt);
            collect(tasks, runQueue, channel, stats);

            RunStats finished = stats.snapshot();
            log.info("Run finished: {}", finished);
            return finished;
        } finally {
            shutdown(runQueue);
            running = false;
        }
    }

    /**
     * Results of the current or last run, in completion order.
     */
    public List<Result> results() {
        return List.copyOf(results);
    }

    /**
     * Read-only view of the pool. Safe to call from any thread.
     */
    public EngineSnapshot snapshot() {
        TaskQueue current = queue;
        List<WorkerStatus> statuses = workers.stream()
                .map(handle -> handle.worker.status())
                .collect(Collectors.toList());
        return new EngineSnapshot(statuses, current == null ? 0 : current.size(), submitted, completed.get(),
                running);
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== Pool ====================

    private void startPool(int poolSize, int minWorkers, TaskQueue runQueue, BlockingQueue<Result> channel) {
        for (int i = 0; i < poolSize; i++) {
            startWorker(runQueue, channel);
        }
        if (workers.size() < minWorkers) {
            log.error("Only {} of {} required workers started", workers.size(), minWorkers);
            throw new PoolExhaustionException(workers.size(), minWorkers);
        }
        if (workers.size() < poolSize) {
            log.warn("Started {} of {} planned workers", workers.size(), poolSize);
        }
    }

    private boolean startWorker(TaskQueue runQueue, BlockingQueue<Result> channel) {
        String name = "worker-" + workerSequence.incrementAndGet();
        Worker worker = new Worker(name, runQueue, channel, selector, rateLimiter, config);
        try {
            Thread thread = threadFactory.newThread(worker);
            if (thread == null) {
                log.warn("Thread factory refused to create {}", name);
                return false;
            }
            thread.setName("scrapeflow-" + name);
            // The worker logs its own death; keep the default handler from printing it again.
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.debug("Thread {} terminated by {}", t.getName(), e.toString()));
            thread.start();
            workers.add(new WorkerHandle(worker, thread));
            log.debug("Started {}", name);
            return true;
        } catch (RuntimeException | OutOfMemoryError e) {
            // OutOfMemoryError here means the JVM could not create a native thread
            log.warn("Could not start {}: {}", name, e.toString());
            return false;
        }
    }

    private int aliveWorkers() {
        int alive = 0;
        for (WorkerHandle handle : workers) {
            if (handle.thread.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    // ==================== Collection ====================

    private void collect(List<Task> tasks, TaskQueue runQueue, BlockingQueue<Result> channel,
            RunStatsCollector stats) {
        Map<Integer, Task> outstanding = new LinkedHashMap<>();
        for (Task task : tasks) {
            outstanding.put(task.id(), task);
        }
        long pollMillis = config.livenessInterval().toMillis();
        long progressNanos = config.progressInterval().toNanos();
        long nextProgress = System.nanoTime() + progressNanos;

        while (!outstanding.isEmpty()) {
            Result result;
            try {
                result = channel.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run interrupted with {} tasks outstanding", outstanding.size());
                runQueue.drain();
                failAll(outstanding, "Run interrupted", stats);
                return;
            }
            if (result != null) {
                accept(result, outstanding, stats);
            }
            reapDeadWorkers(runQueue, channel, outstanding, stats);

            if (progressNanos > 0 && System.nanoTime() - nextProgress >= 0) {
                logProgress(stats);
                nextProgress = System.nanoTime() + progressNanos;
            }
        }
    }

    private void logProgress(RunStatsCollector stats) {
        EngineSnapshot snapshot = snapshot();
        log.info(progressLine(snapshot, stats.succeeded(), stats.failed()));
        if (log.isDebugEnabled()) {
            for (WorkerStatus status : snapshot.workers()) {
                log.debug("  {}", workerLine(status));
            }
        }
    }

    static String progressLine(EngineSnapshot snapshot, int succeeded, int failed) {
        int percent = snapshot.submitted() == 0 ? 100 : snapshot.completed() * 100 / snapshot.submitted();
        return String.format("Progress: %d/%d tasks (%d%%), %d succeeded, %d failed, %d queued, %d/%d workers busy",
                snapshot.completed(), snapshot.submitted(), percent, succeeded, failed, snapshot.queueDepth(),
                snapshot.busyWorkers(), snapshot.workers().size());
    }

    static String workerLine(WorkerStatus status) {
        String current = status.currentTaskId() == null ? "-" : "task " + status.currentTaskId();
        return String.format("%s %s %s, %d done, %d failed", status.workerName(), status.state(), current,
                status.tasksCompleted(), status.tasksFailed());
    }

    private void accept(Result result, Map<Integer, Task> outstanding, RunStatsCollector stats) {
        if (outstanding.remove(result.taskId()) == null) {
            log.warn("Ignoring result for task {} that is not outstanding", result.taskId());
            return;
        }
        results.add(result);
        stats.add(result);
        completed.incrementAndGet();
        log.debug("Collected {} ({} outstanding)", result, outstanding.size());
    }

    private void drainChannel(BlockingQueue<Result> channel, Map<Integer, Task> outstanding, RunStatsCollector stats) {
        Result result;
        while ((result = channel.poll()) != null) {
            accept(result, outstanding, stats);
        }
    }

    /**
     * Detect workers whose thread ended during the run, report their orphaned
     * task and start replacements.
     */
    private void reapDeadWorkers(TaskQueue runQueue, BlockingQueue<Result> channel,
            Map<Integer, Task> outstanding, RunStatsCollector stats) {
        for (WorkerHandle handle : workers) {
            if (handle.reaped || handle.thread.isAlive()) {
                continue;
            }
            handle.reaped = true;

            // A result published just before the thread ended must win over a fault report.
            drainChannel(channel, outstanding, stats);

            WorkerStatus status = handle.worker.status();
            log.error("Worker {} is no longer alive (state {})", status.workerName(), status.state());

            if (status.state() == WorkerState.DEAD && status.currentTaskId() != null) {
                Task orphan = outstanding.get(status.currentTaskId());
                if (orphan != null) {
                    Duration elapsed = status.busySince() == null
                            ? Duration.ZERO
                            : Duration.between(status.busySince(), Instant.now());
                    accept(Result.failure(orphan, status.workerName(), "Worker fault: " + status.lastError(), 0,
                            elapsed, 0, status.busySince()), outstanding, stats);
                }
            }

            if (runQueue.size() > 0 && startWorker(runQueue, channel)) {
                log.info("Replaced dead worker {}", status.workerName());
            }
        }

        if (!outstanding.isEmpty() && aliveWorkers() == 0) {
            drainChannel(channel, outstanding, stats);
            if (!outstanding.isEmpty() && !startWorker(runQueue, channel)) {
                log.error("No live workers left, failing {} outstanding tasks", outstanding.size());
                runQueue.drain();
                failAll(outstanding, "No live worker left to process the task", stats);
            }
        }
    }

    private void failAll(Map<Integer, Task> outstanding, String reason, RunStatsCollector stats) {
        for (Task task : new ArrayList<>(outstanding.values())) {
            accept(Result.failure(task, "master", reason, 0, Duration.ZERO, 0, null), outstanding, stats);
        }
    }

    // ==================== Shutdown ====================

    private void shutdown(TaskQueue runQueue) {
        runQueue.close();

        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (WorkerHandle handle : workers) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                break;
            }
            try {
                handle.thread.join(remainingMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        for (WorkerHandle handle : workers) {
            if (handle.thread.isAlive()) {
                log.warn("Worker {} did not stop within {}, interrupting", handle.worker.name(),
                        config.shutdownTimeout());
                handle.thread.interrupt();
            }
        }
        log.info("Worker pool shut down");
    }

    /** A started worker and its thread. {@code reaped} is touched only by the run thread. */
    private static final class WorkerHandle {
        private final Worker worker;
        private final Thread thread;
        private boolean reaped;

        private WorkerHandle(Worker worker, Thread thread) {
            this.worker = worker;
            this.thread = thread;
        }
    }
}
