package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.scrape.address.AddressNormalizer;
import com.fsbo.tracker.scrape.model.ListingDraft;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs without a surrounding test transaction so that commits and rollbacks are visible.
 */
@SpringBootTest
@ActiveProfiles("test")
class ListingStoreServiceCommitTest {

    @Autowired
    private ListingStoreService store;

    @BeforeEach
    void clearBefore() {
        store.clearAll();
    }

    @AfterEach
    void clearAfter() {
        store.clearAll();
    }

    @Test
    void failedBatchLeavesNoRowsBehind() {
        List<ListingDraft> batch = List.of(
            draft("1 First St", "Boise", "ID", "83702", "landing_pages"),
            draft("2 Second St", "Boise", "ID", "83702", null),
            draft("3 Third St", "Reno", "NV", "89501", "landing_pages")
        );

        assertThrows(DataIntegrityViolationException.class, () -> store.bulkInsert(batch));

        assertEquals(0L, store.countListings(null, null));
    }

    @Test
    void concurrentInsertsOfSameAddressStoreExactlyOneRow() throws Exception {
        int threads = 4;
        ListingDraft draft = draft("123 Main St", "Springfield", "IL", "62701", "landing_pages");
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<Long>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return store.insert(draft);
                }));
            }
            start.countDown();

            int stored = 0;
            for (Future<Optional<Long>> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    stored++;
                }
            }

            assertEquals(1, stored);
            assertEquals(1L, store.countListings(null, null));
        } finally {
            executor.shutdownNow();
        }
    }

    private ListingDraft draft(String street, String city, String state, String zip, String source) {
        return new ListingDraft(
            AddressNormalizer.normalize(street, city, state, zip),
            "https://fsbo.example.com/" + zip,
            source,
            null
        );
    }
}
