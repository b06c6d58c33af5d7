package scrapeflow.engine.scraper;

import org.junit.jupiter.api.Test;
import scrapeflow.engine.error.ResolutionException;
import scrapeflow.engine.model.SourceType;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class DefaultScraperSelectorTest {

    private final DefaultScraperSelector selector = new DefaultScraperSelector(new FakePageFetcher());

    @Test
    void resolvesEveryKind() throws ResolutionException {
        assertInstanceOf(NewsPageScraper.class, selector.resolve(SourceType.NEWS, null));
        assertInstanceOf(RssFeedScraper.class, selector.resolve(SourceType.RSS, "gold"));
        assertInstanceOf(BlogScraper.class, selector.resolve(SourceType.BLOG, null));
    }

    @Test
    void disabledKindFailsToResolve() {
        DefaultScraperSelector newsOnly = new DefaultScraperSelector(new FakePageFetcher(),
                EnumSet.of(SourceType.NEWS));

        ResolutionException e = assertThrows(ResolutionException.class,
                () -> newsOnly.resolve(SourceType.BLOG, null));
        assertTrue(e.getMessage().contains("'blog' is disabled"));
    }

    @Test
    void missingKindFailsToResolve() {
        assertThrows(ResolutionException.class, () -> selector.resolve(null, null));
    }
}
