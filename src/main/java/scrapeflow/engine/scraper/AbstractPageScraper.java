package scrapeflow.engine.scraper;

import scrapeflow.engine.error.FetchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shared helpers for scrapers that read pages through a {@link PageFetcher}.
 */
public abstract class AbstractPageScraper implements Scraper {

    protected final PageFetcher fetcher;

    protected AbstractPageScraper(PageFetcher fetcher) {
        this.fetcher = fetcher;
    }

    protected static void requireHttpUrl(String url) throws FetchException {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new FetchException("Invalid URL: '" + url + "'");
        }
    }

    /** True when no search word is set or any of the texts contains it, ignoring case. */
    protected static boolean matches(String searchWord, String... texts) {
        if (searchWord == null || searchWord.isBlank()) {
            return true;
        }
        String needle = searchWord.trim().toLowerCase(Locale.ROOT);
        for (String text : texts) {
            if (text != null && text.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    /** Collapse whitespace runs and trim. */
    protected static String clean(String text) {
        if (text == null) {
            return null;
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    protected Map<String, Object> record(String sourceType, String source) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("source_type", sourceType);
        record.put("source", source);
        record.put("scraped_at", Instant.now().toString());
        record.put("scraper", name());
        return record;
    }
}
