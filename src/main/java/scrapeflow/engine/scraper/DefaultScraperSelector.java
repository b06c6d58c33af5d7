package scrapeflow.engine.scraper;

import scrapeflow.engine.error.ResolutionException;
import scrapeflow.engine.model.SourceType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Builds the scraper for each kind. Kinds can be disabled, in which case
 * resolving them fails.
 */
public class DefaultScraperSelector implements ScraperSelector {

    static final String DEFAULT_RSS_SEARCH_WORD = "inflation";

    private final PageFetcher fetcher;
    private final Set<SourceType> enabled;

    public DefaultScraperSelector(PageFetcher fetcher) {
        this(fetcher, EnumSet.allOf(SourceType.class));
    }

    public DefaultScraperSelector(PageFetcher fetcher, Set<SourceType> enabled) {
        this.fetcher = fetcher;
        this.enabled = enabled.isEmpty() ? EnumSet.noneOf(SourceType.class) : EnumSet.copyOf(enabled);
    }

    @Override
    public Scraper resolve(SourceType type, String searchWord) throws ResolutionException {
        if (type == null) {
            throw new ResolutionException("No source type given");
        }
        if (!enabled.contains(type)) {
            throw new ResolutionException("Scraper for type '" + type.id() + "' is disabled");
        }
        return switch (type) {
            case NEWS -> new NewsPageScraper(fetcher);
            case RSS -> new RssFeedScraper(fetcher, DEFAULT_RSS_SEARCH_WORD);
            case BLOG -> new BlogScraper(fetcher);
        };
    }
}
