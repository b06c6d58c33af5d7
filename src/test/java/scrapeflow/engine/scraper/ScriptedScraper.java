package scrapeflow.engine.scraper;

import scrapeflow.engine.error.FetchException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Network-free scraper that fails a fixed number of calls before succeeding.
 * Tracks call count, call instants and the peak number of concurrent calls.
 */
public final class ScriptedScraper implements Scraper {

    private final int failuresBeforeSuccess;
    private final Duration delay;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final List<Instant> callTimes = Collections.synchronizedList(new ArrayList<>());

    private ScriptedScraper(int failuresBeforeSuccess, Duration delay) {
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.delay = delay;
    }

    public static ScriptedScraper succeeding() {
        return new ScriptedScraper(0, Duration.ZERO);
    }

    public static ScriptedScraper succeedingAfter(Duration delay) {
        return new ScriptedScraper(0, delay);
    }

    public static ScriptedScraper failingTimes(int failures) {
        return new ScriptedScraper(failures, Duration.ZERO);
    }

    public static ScriptedScraper alwaysFailing() {
        return new ScriptedScraper(Integer.MAX_VALUE, Duration.ZERO);
    }

    @Override
    public List<Map<String, Object>> fetch(String url, String searchWord) throws FetchException {
        int call = calls.incrementAndGet();
        callTimes.add(Instant.now());
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        try {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            if (call <= failuresBeforeSuccess) {
                throw new FetchException("scripted failure #" + call);
            }
            return List.of(Map.of("url", url, "call", call));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("interrupted", e);
        } finally {
            active.decrementAndGet();
        }
    }

    @Override
    public String name() {
        return "scripted";
    }

    public int calls() {
        return calls.get();
    }

    public int maxConcurrentCalls() {
        return maxActive.get();
    }

    public List<Instant> callTimes() {
        synchronized (callTimes) {
            return List.copyOf(callTimes);
        }
    }
}
