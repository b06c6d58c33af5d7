package scrapeflow.engine.scraper;

import scrapeflow.engine.error.FetchException;

import java.util.List;
import java.util.Map;

/**
 * Fetch capability for one kind of source. Implementations return structured
 * records; the scheduler treats them as opaque.
 */
public interface Scraper {

    /**
     * Fetch and parse records from a source.
     *
     * @param url        target address, may be empty for sources that derive their own
     * @param searchWord optional filter term, may be null
     * @return records in source order, never null
     * @throws FetchException when the attempt fails and may be retried
     */
    List<Map<String, Object>> fetch(String url, String searchWord) throws FetchException;

    /** Short name used in logs. */
    String name();
}
