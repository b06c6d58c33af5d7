package scrapeflow.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void buildMinimalTask() {
        Task task = Task.builder()
                .id(7)
                .type("rss")
                .build();

        assertEquals(7, task.id());
        assertEquals(0, task.priority());
        assertEquals("", task.url());
        assertEquals("rss", task.type());
        assertNull(task.searchWord());
        assertFalse(task.hasSearchWord());
        assertNotNull(task.createdAt());
        assertEquals(Optional.of(SourceType.RSS), task.sourceType());
    }

    @Test
    void buildFullTask() {
        Instant now = Instant.now();

        Task task = Task.builder()
                .id(2)
                .priority(5)
                .url("https://www.bbc.com/news")
                .type(SourceType.NEWS)
                .searchWord("election")
                .createdAt(now)
                .build();

        assertEquals(5, task.priority());
        assertEquals("https://www.bbc.com/news", task.url());
        assertEquals("news", task.type());
        assertTrue(task.hasSearchWord());
        assertEquals(now, task.createdAt());
    }

    @Test
    void typeIsRequired() {
        assertThrows(NullPointerException.class, () -> Task.builder().id(1).build());
    }

    @Test
    void unknownTypeHasNoSourceType() {
        Task task = Task.builder().id(1).type("podcast").build();

        assertTrue(task.sourceType().isEmpty());
        assertEquals("podcast", task.type());
    }

    @Test
    void nullUrlBecomesEmpty() {
        Task task = Task.builder().id(1).type("rss").url(null).build();

        assertEquals("", task.url());
    }

    @Test
    void equalityIsById() {
        Task a = Task.builder().id(3).type("news").priority(1).build();
        Task b = Task.builder().id(3).type("blog").priority(9).build();
        Task c = Task.builder().id(4).type("news").priority(1).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void toBuilderCopiesAllFields() {
        Task original = Task.builder().id(9).priority(4).url("https://x.org").type("blog").searchWord("go").build();

        Task copy = original.toBuilder().priority(8).build();

        assertEquals(9, copy.id());
        assertEquals(8, copy.priority());
        assertEquals("https://x.org", copy.url());
        assertEquals("blog", copy.type());
        assertEquals("go", copy.searchWord());
        assertEquals(original.createdAt(), copy.createdAt());
    }
}
