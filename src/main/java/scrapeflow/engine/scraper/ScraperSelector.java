package scrapeflow.engine.scraper;

import scrapeflow.engine.error.ResolutionException;
import scrapeflow.engine.model.SourceType;

/**
 * Maps a task kind to a scraper.
 */
public interface ScraperSelector {

    /**
     * @param type       kind declared by the task
     * @param searchWord optional filter term for kinds that use one
     * @return a scraper ready to fetch
     * @throws ResolutionException if no scraper is available for the kind
     */
    Scraper resolve(SourceType type, String searchWord) throws ResolutionException;
}
