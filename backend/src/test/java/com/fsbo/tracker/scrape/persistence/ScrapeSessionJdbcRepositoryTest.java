package com.fsbo.tracker.scrape.persistence;

import com.fsbo.tracker.scrape.model.ScrapeSession;
import com.fsbo.tracker.scrape.model.ScrapeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeSessionJdbcRepositoryTest {

    @Autowired
    private ScrapeSessionJdbcRepository repository;

    @BeforeEach
    void clearSessions() {
        repository.deleteAll();
    }

    @Test
    void storesSessionAndReadsHistoryNewestFirst() {
        Instant base = Instant.parse("2026-03-01T10:00:00Z");
        long older = repository.insertSession(
            "landing_pages", base, base.plusSeconds(30), 4, 3, 1, 0, ScrapeStatus.COMPLETED, null
        );
        long newer = repository.insertSession(
            "landing_pages", base.plusSeconds(600), base.plusSeconds(610), 0, 0, 0, 2,
            ScrapeStatus.FAILED, "Discovery failed: boom"
        );
        repository.insertSession(
            "paginated_search", base.plusSeconds(300), base.plusSeconds(320), 1, 1, 0, 0, ScrapeStatus.COMPLETED, null
        );

        List<ScrapeSession> history = repository.findHistory("landing_pages", 10);

        assertEquals(List.of(newer, older), history.stream().map(ScrapeSession::id).toList());
        ScrapeSession failed = history.get(0);
        assertEquals(ScrapeStatus.FAILED, failed.status());
        assertEquals("Discovery failed: boom", failed.errorMessage());
        assertEquals(2, failed.errors());
        ScrapeSession completed = history.get(1);
        assertEquals(base, completed.scrapeStart());
        assertEquals(3, completed.listingsNew());
        assertEquals(1, completed.listingsDuplicates());
        assertNull(completed.errorMessage());
    }

    @Test
    void historyWithoutSourceCoversAllSourcesAndHonoursLimit() {
        Instant base = Instant.parse("2026-03-01T10:00:00Z");
        for (int i = 0; i < 4; i++) {
            repository.insertSession(
                i % 2 == 0 ? "landing_pages" : "paginated_search",
                base.plusSeconds(i * 60L),
                base.plusSeconds(i * 60L + 5),
                i, i, 0, 0, ScrapeStatus.COMPLETED, null
            );
        }

        List<ScrapeSession> history = repository.findHistory(null, 3);

        assertEquals(3, history.size());
        assertEquals(3, history.get(0).listingsFound());
        assertTrue(history.stream().anyMatch(s -> s.sourceWebsite().equals("landing_pages")));
    }
}
