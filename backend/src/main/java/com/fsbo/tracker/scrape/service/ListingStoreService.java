package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.scrape.address.ListingFingerprint;
import com.fsbo.tracker.scrape.model.BulkInsertResult;
import com.fsbo.tracker.scrape.model.Listing;
import com.fsbo.tracker.scrape.model.ListingDraft;
import com.fsbo.tracker.scrape.model.ListingPageResponse;
import com.fsbo.tracker.scrape.model.ListingQuery;
import com.fsbo.tracker.scrape.persistence.ListingJdbcRepository;
import com.fsbo.tracker.scrape.persistence.ScrapeSessionJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deduplicating listing store. The fingerprint's unique constraint is the only guard
 * against duplicates, so concurrent source runs need no further locking.
 */
@Service
public class ListingStoreService {
    private static final Logger log = LoggerFactory.getLogger(ListingStoreService.class);

    private final ListingJdbcRepository listingRepository;
    private final ScrapeSessionJdbcRepository sessionRepository;
    private final Clock clock;

    public ListingStoreService(
        ListingJdbcRepository listingRepository,
        ScrapeSessionJdbcRepository sessionRepository,
        Clock clock
    ) {
        this.listingRepository = listingRepository;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
    }

    /**
     * @return the new listing id, or empty when an identical address is already stored
     */
    public Optional<Long> insert(ListingDraft draft) {
        String fingerprint = ListingFingerprint.of(draft.address());
        return Optional.ofNullable(listingRepository.insertIfAbsent(draft, fingerprint, clock.instant()));
    }

    /**
     * Stores a batch in one transaction. A persistence failure rolls back the whole batch.
     */
    @Transactional
    public BulkInsertResult bulkInsert(List<ListingDraft> drafts) {
        int inserted = 0;
        int duplicates = 0;
        for (ListingDraft draft : drafts) {
            if (insert(draft).isPresent()) {
                inserted++;
            } else {
                duplicates++;
            }
        }
        if (!drafts.isEmpty()) {
            log.debug("Stored {} new listings, {} duplicates", inserted, duplicates);
        }
        return new BulkInsertResult(inserted, duplicates);
    }

    public ListingPageResponse findListings(ListingQuery query) {
        List<Listing> items = listingRepository.findListings(query);
        long total = listingRepository.countListings(query);
        return new ListingPageResponse(items, total, query.limit(), query.offset());
    }

    public List<Listing> listAll(ListingQuery query) {
        return listingRepository.findListings(query);
    }

    public long countListings(String source, Boolean exported) {
        return listingRepository.countListings(new ListingQuery(source, exported, null, 0));
    }

    public Map<String, Long> countBySource() {
        return listingRepository.countBySource();
    }

    public Optional<Listing> findById(long id) {
        return listingRepository.findById(id);
    }

    /**
     * Flags listings as exported. Never called by the exporter itself.
     */
    public int markExported(Collection<Long> ids) {
        int updated = listingRepository.markExported(ids, clock.instant());
        log.info("Marked {} listings as exported", updated);
        return updated;
    }

    @Transactional
    public Map<String, Integer> clearAll() {
        int listings = listingRepository.deleteAll();
        int sessions = sessionRepository.deleteAll();
        log.warn("Cleared {} listings and {} scrape sessions", listings, sessions);
        Map<String, Integer> deleted = new LinkedHashMap<>();
        deleted.put("listings", listings);
        deleted.put("sessions", sessions);
        return deleted;
    }
}
