package scrapeflow.engine.scraper;

import scrapeflow.engine.error.ResolutionException;
import scrapeflow.engine.model.SourceType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Selector backed by a fixed map; kinds without an entry fail to resolve.
 */
public final class StubScraperSelector implements ScraperSelector {

    private final Map<SourceType, Scraper> scrapers = new EnumMap<>(SourceType.class);

    public static StubScraperSelector of(SourceType type, Scraper scraper) {
        return new StubScraperSelector().with(type, scraper);
    }

    /** Every kind resolves to the same scraper. */
    public static StubScraperSelector all(Scraper scraper) {
        StubScraperSelector selector = new StubScraperSelector();
        for (SourceType type : SourceType.values()) {
            selector.with(type, scraper);
        }
        return selector;
    }

    public StubScraperSelector with(SourceType type, Scraper scraper) {
        scrapers.put(type, scraper);
        return this;
    }

    @Override
    public Scraper resolve(SourceType type, String searchWord) throws ResolutionException {
        Scraper scraper = scrapers.get(type);
        if (scraper == null) {
            throw new ResolutionException("No scraper registered for " + type);
        }
        return scraper;
    }
}
