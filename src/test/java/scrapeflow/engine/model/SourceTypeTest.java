package scrapeflow.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceTypeTest {

    @Test
    void fromIdIsCaseInsensitiveAndTrimmed() {
        assertEquals(Optional.of(SourceType.NEWS), SourceType.fromId("news"));
        assertEquals(Optional.of(SourceType.RSS), SourceType.fromId(" RSS "));
        assertEquals(Optional.of(SourceType.BLOG), SourceType.fromId("Blog"));
    }

    @Test
    void unknownIdsAreEmpty() {
        assertTrue(SourceType.fromId("video").isEmpty());
        assertTrue(SourceType.fromId("").isEmpty());
        assertTrue(SourceType.fromId(null).isEmpty());
    }

    @Test
    void idsListsEveryKind() {
        assertEquals(List.of("news", "rss", "blog"), SourceType.ids());
    }
}
