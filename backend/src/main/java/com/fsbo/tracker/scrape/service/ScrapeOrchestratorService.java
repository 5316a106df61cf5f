package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.address.AddressNormalizer;
import com.fsbo.tracker.scrape.address.NormalizedAddress;
import com.fsbo.tracker.scrape.extract.DiscoveryException;
import com.fsbo.tracker.scrape.extract.ExtractionException;
import com.fsbo.tracker.scrape.extract.ExtractorRegistry;
import com.fsbo.tracker.scrape.extract.SourceExtractor;
import com.fsbo.tracker.scrape.http.FetchException;
import com.fsbo.tracker.scrape.http.Fetcher;
import com.fsbo.tracker.scrape.http.FetcherFactory;
import com.fsbo.tracker.scrape.model.BulkInsertResult;
import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.ListingDraft;
import com.fsbo.tracker.scrape.model.RawListingCandidate;
import com.fsbo.tracker.scrape.model.ScrapeRunStage;
import com.fsbo.tracker.scrape.model.ScrapeRunSummary;
import com.fsbo.tracker.scrape.model.ScrapeSession;
import com.fsbo.tracker.scrape.model.ScrapeStatus;
import com.fsbo.tracker.scrape.model.SourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Drives one source through discover, fetch and extract, normalize, persist. Targets of
 * a source are processed one at a time; separate sources may run in parallel. Every run
 * leaves exactly one session row, whatever happens.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final ScraperProperties properties;
    private final ExtractorRegistry extractorRegistry;
    private final FetcherFactory fetcherFactory;
    private final ListingStoreService listingStore;
    private final SessionRecorder sessionRecorder;
    private final ExecutorService sourceExecutor;
    private final Clock clock;
    private final Set<String> activeSources = ConcurrentHashMap.newKeySet();

    public ScrapeOrchestratorService(
        ScraperProperties properties,
        ExtractorRegistry extractorRegistry,
        FetcherFactory fetcherFactory,
        ListingStoreService listingStore,
        SessionRecorder sessionRecorder,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.extractorRegistry = extractorRegistry;
        this.fetcherFactory = fetcherFactory;
        this.listingStore = listingStore;
        this.sessionRecorder = sessionRecorder;
        this.sourceExecutor = sourceExecutor;
        this.clock = clock;
    }

    public ScrapeRunSummary runSource(String sourceId) {
        SourceExtractor extractor = extractorRegistry.find(sourceId)
            .orElseThrow(() -> new UnknownSourceException(sourceId));
        SourceSettings settings = properties.resolveSource(extractor.sourceId());
        if (!activeSources.add(extractor.sourceId())) {
            throw new ActiveScrapeRunException("A scrape of " + extractor.sourceId() + " is already running");
        }
        try {
            return execute(extractor, settings);
        } finally {
            activeSources.remove(extractor.sourceId());
        }
    }

    /**
     * Runs several sources in parallel on the source pool. A source that is already
     * running elsewhere is skipped.
     */
    public List<ScrapeRunSummary> runSources(List<String> sourceIds) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String sourceId : sourceIds) {
            if (sourceId == null || sourceId.isBlank()) {
                continue;
            }
            String trimmed = sourceId.trim();
            if (extractorRegistry.find(trimmed).isEmpty()) {
                throw new UnknownSourceException(trimmed);
            }
            unique.add(trimmed);
        }

        List<String> ordered = new ArrayList<>(unique);
        List<CompletableFuture<ScrapeRunSummary>> futures = new ArrayList<>();
        for (String sourceId : ordered) {
            futures.add(CompletableFuture.supplyAsync(() -> runSource(sourceId), sourceExecutor));
        }

        List<ScrapeRunSummary> summaries = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                summaries.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof ActiveScrapeRunException) {
                    log.warn("Skipping {}: {}", ordered.get(i), cause.getMessage());
                    continue;
                }
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw e;
            }
        }
        return summaries;
    }

    public List<ScrapeRunSummary> runEnabledSources() {
        List<String> enabled = new ArrayList<>();
        for (String sourceId : extractorRegistry.sourceIds()) {
            if (properties.resolveSource(sourceId).enabled()) {
                enabled.add(sourceId);
            }
        }
        if (enabled.isEmpty()) {
            log.warn("No enabled sources configured");
            return List.of();
        }
        return runSources(enabled);
    }

    public boolean isRunning(String sourceId) {
        return activeSources.contains(sourceId);
    }

    private ScrapeRunSummary execute(SourceExtractor extractor, SourceSettings settings) {
        String sourceId = extractor.sourceId();
        Instant startedAt = clock.instant();
        RunState state = new RunState();
        log.info("Starting scrape of {} ({})", extractor.displayName(), sourceId);

        ScrapeRunSummary summary = null;
        try (Fetcher fetcher = fetcherFactory.open(settings)) {
            state.stage = ScrapeRunStage.DISCOVERING;
            List<FetchTarget> targets = extractor.discover(settings, fetcher);
            state.targetsDiscovered = targets.size();
            log.info("[{}] discovered {} targets", sourceId, targets.size());

            state.stage = ScrapeRunStage.FETCHING_AND_EXTRACTING;
            List<RawListingCandidate> candidates = fetchAndExtract(extractor, settings, fetcher, targets, state);

            state.stage = ScrapeRunStage.NORMALIZING;
            List<ListingDraft> drafts = normalize(candidates, settings);
            state.found = drafts.size();

            state.stage = ScrapeRunStage.PERSISTING;
            BulkInsertResult inserted = listingStore.bulkInsert(drafts);
            state.newCount = inserted.newCount();
            state.duplicates = inserted.duplicateCount();

            if (state.interrupted) {
                fail(state, "Run interrupted after " + state.processedTargets + " of " + targets.size() + " targets");
            } else {
                state.stage = ScrapeRunStage.COMPLETED;
                state.status = ScrapeStatus.COMPLETED;
            }
        } catch (DiscoveryException e) {
            log.error("[{}] discovery failed: {}", sourceId, e.getMessage(), e);
            fail(state, "Discovery failed: " + e.getMessage());
        } catch (DataAccessException e) {
            log.error("[{}] persistence failed: {}", sourceId, e.getMessage(), e);
            fail(state, "Persistence failed: " + e.getMostSpecificCause().getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] run failed during {}", sourceId, state.stage, e);
            fail(state, "Failed during " + state.stage.name().toLowerCase(Locale.ROOT) + ": " + describe(e));
        } finally {
            ScrapeSession session = sessionRecorder.record(
                sourceId,
                startedAt,
                state.found,
                state.newCount,
                state.duplicates,
                state.errors,
                state.status,
                state.errorMessage
            );
            summary = new ScrapeRunSummary(
                session.id(),
                sourceId,
                startedAt,
                session.scrapeEnd(),
                state.targetsDiscovered,
                state.found,
                state.newCount,
                state.duplicates,
                state.errors,
                state.status,
                state.stage,
                state.errorMessage
            );
            log.info(
                "Finished scrape of {} in {} ms: status={} targets={} found={} new={} duplicates={} errors={}",
                sourceId,
                Duration.between(startedAt, session.scrapeEnd()).toMillis(),
                state.status.dbValue(),
                state.targetsDiscovered,
                state.found,
                state.newCount,
                state.duplicates,
                state.errors
            );
        }
        return summary;
    }

    private List<RawListingCandidate> fetchAndExtract(
        SourceExtractor extractor,
        SourceSettings settings,
        Fetcher fetcher,
        List<FetchTarget> targets,
        RunState state
    ) {
        List<RawListingCandidate> candidates = new ArrayList<>();
        for (FetchTarget target : targets) {
            if (Thread.currentThread().isInterrupted()) {
                state.interrupted = true;
                break;
            }
            try {
                String content = fetcher.fetch(target);
                List<RawListingCandidate> extracted = extractor.extract(settings, target, content);
                candidates.addAll(extracted);
                log.debug("[{}] {} yielded {} candidates", settings.sourceId(), target.url(), extracted.size());
            } catch (FetchException e) {
                state.errors++;
                log.warn("[{}] fetch failed for {}: {}", settings.sourceId(), target.url(), e.getMessage());
            } catch (ExtractionException e) {
                state.errors++;
                log.warn("[{}] extraction failed for {}: {}", settings.sourceId(), target.url(), e.getMessage());
            } catch (RuntimeException e) {
                state.errors++;
                log.warn("[{}] unexpected error on {}", settings.sourceId(), target.url(), e);
            }
            state.processedTargets++;
        }
        return candidates;
    }

    /**
     * Normalizes candidates, dropping incomplete addresses and states outside the
     * allowed set, and stops at {@code maxListings}.
     */
    List<ListingDraft> normalize(List<RawListingCandidate> candidates, SourceSettings settings) {
        List<ListingDraft> drafts = new ArrayList<>();
        for (RawListingCandidate candidate : candidates) {
            NormalizedAddress address = AddressNormalizer.normalize(candidate);
            if (!address.isComplete()) {
                log.debug("[{}] dropping incomplete address {}", settings.sourceId(), candidate);
                continue;
            }
            if (!settings.isStateAllowed(address.state())) {
                log.debug("[{}] dropping {} outside allowed states", settings.sourceId(), address.state());
                continue;
            }
            if (drafts.size() >= settings.maxListings()) {
                log.info("[{}] reached maxListings={}, ignoring remaining candidates", settings.sourceId(), settings.maxListings());
                break;
            }
            drafts.add(new ListingDraft(address, candidate.listingUrl(), settings.sourceId(), candidate.notes()));
        }
        return drafts;
    }

    private void fail(RunState state, String message) {
        state.stage = ScrapeRunStage.FAILED;
        state.status = ScrapeStatus.FAILED;
        state.errorMessage = message;
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static final class RunState {
        private ScrapeRunStage stage = ScrapeRunStage.IDLE;
        private ScrapeStatus status = ScrapeStatus.FAILED;
        private String errorMessage;
        private int targetsDiscovered;
        private int processedTargets;
        private int found;
        private int newCount;
        private int duplicates;
        private int errors;
        private boolean interrupted;
    }
}
