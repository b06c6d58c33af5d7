package scrapeflow.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.config.EngineConfig;
import scrapeflow.engine.error.FetchException;
import scrapeflow.engine.error.ResolutionException;
import scrapeflow.engine.model.FetchOutcome;
import scrapeflow.engine.model.Result;
import scrapeflow.engine.model.SourceType;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.model.WorkerStatus;
import scrapeflow.engine.scheduler.TaskQueue.Dispatch;
import scrapeflow.engine.scraper.Scraper;
import scrapeflow.engine.scraper.ScraperSelector;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * A unit of concurrent execution.
 *
 * Loops: take a task, execute it with rate limiting and bounded retries,
 * publish exactly one result, repeat until the queue is closed.
 *
 * Error handling per task:
 * - a task whose type cannot be resolved fails at once with 0 attempts
 * - a failed attempt (FetchException or a runtime exception from the
 *   scraper) is retried up to the configured attempt count
 * - an Error escaping the scraper kills the worker; the master reports the
 *   orphaned task
 */
public final class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final TaskQueue queue;
    private final Queue<Result> results;
    private final ScraperSelector selector;
    private final RateLimiter rateLimiter;
    private final int maxAttempts;
    private final Duration retryBackoff;

    /** Written only by this worker's thread. */
    private volatile WorkerStatus status;

    public Worker(String name,
            TaskQueue queue,
            Queue<Result> results,
            ScraperSelector selector,
            RateLimiter rateLimiter,
            EngineConfig config) {
        this.name = name;
        this.queue = queue;
        this.results = results;
        this.selector = selector;
        this.rateLimiter = rateLimiter;
        this.maxAttempts = config.maxAttempts();
        this.retryBackoff = config.retryBackoff();
        this.status = WorkerStatus.idle(name);
    }

    public String name() {
        return name;
    }

    public WorkerStatus status() {
        return status;
    }

    @Override
    public void run() {
        log.info("Worker {} started", name);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Dispatch dispatch = queue.take();
                if (dispatch == null) {
                    break;
                }
                status = status.busy(dispatch.task().id());
                log.debug("Worker {} took task {} (dispatch #{})", name, dispatch.task().id(), dispatch.sequence());

                Result result = execute(dispatch);
                results.add(result);
                status = status.finished(result.success(), result.errorMessage());
            }
            status = status.stopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = status.stopped();
        } catch (RuntimeException | Error e) {
            status = status.dead(e.toString());
            log.error("Worker {} died while processing task {}", name, status.currentTaskId(), e);
            throw e;
        }
        log.info("Worker {} finished ({} completed, {} failed)", name, status.tasksCompleted(), status.tasksFailed());
    }

    /**
     * Execute one task and build its result. Never throws for task-scoped
     * failures; those are recorded in the returned result.
     */
    Result execute(Dispatch dispatch) {
        Task task = dispatch.task();
        long startNanos = System.nanoTime();

        Scraper scraper;
        try {
            scraper = resolve(task);
        } catch (ResolutionException e) {
            log.warn("Task {} not executed: {}", task.id(), e.getMessage());
            return Result.failure(task, name, e.getMessage(), 0, elapsedSince(startNanos),
                    dispatch.sequence(), dispatch.dispatchedAt());
        }

        FetchOutcome outcome = null;
        int attempts = 0;
        try {
            while (attempts < maxAttempts) {
                if (attempts > 0) {
                    backoff();
                }
                rateLimiter.acquire();
                attempts++;
                log.info("Worker {} scraping task {} ({} {}), attempt {}/{}",
                        name, task.id(), task.type(), task.url(), attempts, maxAttempts);

                outcome = attempt(scraper, task);
                if (outcome.success()) {
                    break;
                }
                log.warn("Task {} attempt {}/{} failed: {}", task.id(), attempts, maxAttempts, outcome.errorMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(task, name, "Interrupted after " + attempts + " attempts", attempts,
                    elapsedSince(startNanos), dispatch.sequence(), dispatch.dispatchedAt());
        }

        Duration elapsed = elapsedSince(startNanos);
        if (outcome != null && outcome.success()) {
            log.info("Task {} completed by worker {} in {} ms ({} records)",
                    task.id(), name, elapsed.toMillis(), outcome.data().size());
            return Result.success(task, name, outcome.data(), attempts, elapsed,
                    dispatch.sequence(), dispatch.dispatchedAt());
        }
        String error = outcome == null ? "No attempts made" : outcome.errorMessage();
        log.error("Task {} failed after {} attempts: {}", task.id(), attempts, error);
        return Result.failure(task, name, error, attempts, elapsed, dispatch.sequence(), dispatch.dispatchedAt());
    }

    private Scraper resolve(Task task) throws ResolutionException {
        SourceType type = task.sourceType()
                .orElseThrow(() -> new ResolutionException("Unsupported task type: " + task.type()));
        Scraper scraper;
        try {
            scraper = selector.resolve(type, task.searchWord());
        } catch (RuntimeException e) {
            throw new ResolutionException(
                    "Scraper selection failed for type '" + type.id() + "': " + e.getMessage(), e);
        }
        if (scraper == null) {
            throw new ResolutionException("No scraper for type '" + type.id() + "'");
        }
        return scraper;
    }

    private static FetchOutcome attempt(Scraper scraper, Task task) {
        try {
            List<Map<String, Object>> data = scraper.fetch(task.url(), task.searchWord());
            if (data != null) {
                for (Map<String, Object> record : data) {
                    // immutable lists throw on contains(null)
                    if (record == null) {
                        return FetchOutcome.failure(scraper.name() + " scraper returned a null record");
                    }
                }
            }
            return FetchOutcome.success(data);
        } catch (FetchException e) {
            return FetchOutcome.failure(e.getMessage());
        } catch (RuntimeException e) {
            return FetchOutcome.failure(scraper.name() + " scraper error: " + e);
        }
    }

    private void backoff() throws InterruptedException {
        if (!retryBackoff.isZero() && !retryBackoff.isNegative()) {
            Thread.sleep(retryBackoff.toMillis());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
