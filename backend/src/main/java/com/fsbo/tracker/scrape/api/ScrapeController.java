package com.fsbo.tracker.scrape.api;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.address.AddressNormalizer;
import com.fsbo.tracker.scrape.address.NormalizedAddress;
import com.fsbo.tracker.scrape.extract.ExtractorRegistry;
import com.fsbo.tracker.scrape.extract.SourceExtractor;
import com.fsbo.tracker.scrape.model.ExportResult;
import com.fsbo.tracker.scrape.model.Listing;
import com.fsbo.tracker.scrape.model.ListingPageResponse;
import com.fsbo.tracker.scrape.model.ListingQuery;
import com.fsbo.tracker.scrape.model.ScrapeRunSummary;
import com.fsbo.tracker.scrape.model.ScrapeSession;
import com.fsbo.tracker.scrape.model.SourceSettings;
import com.fsbo.tracker.scrape.model.SourceView;
import com.fsbo.tracker.scrape.model.StatsResponse;
import com.fsbo.tracker.scrape.service.ListingExportService;
import com.fsbo.tracker.scrape.service.ListingStoreService;
import com.fsbo.tracker.scrape.service.ScrapeOrchestratorService;
import com.fsbo.tracker.scrape.service.SessionRecorder;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private static final int DEFAULT_LISTING_LIMIT = 100;
    private static final int MAX_LISTING_LIMIT = 1000;
    private static final int STATS_RECENT_SESSIONS = 5;

    private final ScrapeOrchestratorService orchestratorService;
    private final ListingStoreService listingStore;
    private final SessionRecorder sessionRecorder;
    private final ListingExportService exportService;
    private final ExtractorRegistry extractorRegistry;
    private final ScraperProperties properties;

    public ScrapeController(
        ScrapeOrchestratorService orchestratorService,
        ListingStoreService listingStore,
        SessionRecorder sessionRecorder,
        ListingExportService exportService,
        ExtractorRegistry extractorRegistry,
        ScraperProperties properties
    ) {
        this.orchestratorService = orchestratorService;
        this.listingStore = listingStore;
        this.sessionRecorder = sessionRecorder;
        this.exportService = exportService;
        this.extractorRegistry = extractorRegistry;
        this.properties = properties;
    }

    @PostMapping("/scrape/run")
    public List<ScrapeRunSummary> runScrape(@RequestParam(name = "source", required = false) String source) {
        if (source == null || source.isBlank()) {
            return orchestratorService.runEnabledSources();
        }
        return List.of(orchestratorService.runSource(source.trim()));
    }

    @GetMapping("/listings")
    public ListingPageResponse listings(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "exported", required = false) Boolean exported,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset
    ) {
        int safeLimit = limit == null
            ? DEFAULT_LISTING_LIMIT
            : Math.max(1, Math.min(MAX_LISTING_LIMIT, limit));
        return listingStore.findListings(new ListingQuery(source, exported, safeLimit, Math.max(0, offset)));
    }

    @GetMapping(value = "/listings/{id}/label", produces = MediaType.TEXT_PLAIN_VALUE)
    public String mailingLabel(@PathVariable("id") long id) {
        Listing listing = listingStore.findById(id)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Listing " + id + " not found"));
        return AddressNormalizer.formatMailingLabel(
            new NormalizedAddress(listing.street(), listing.city(), listing.state(), listing.zipCode())
        );
    }

    @PostMapping("/listings/mark-exported")
    public Map<String, Integer> markExported(@RequestBody MarkExportedRequest request) {
        if (request == null || request.ids() == null || request.ids().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "ids must not be empty");
        }
        return Map.of("updated", listingStore.markExported(request.ids()));
    }

    @DeleteMapping("/listings")
    public Map<String, Integer> clearAll(@RequestParam(name = "confirm", required = false, defaultValue = "false") boolean confirm) {
        if (!confirm) {
            throw new ResponseStatusException(BAD_REQUEST, "confirm=true is required to clear all data");
        }
        return listingStore.clearAll();
    }

    @PostMapping("/export")
    public ExportResult export(@RequestBody(required = false) ExportRequest request) {
        String source = request == null ? null : request.source();
        boolean exportedOnly = request != null && Boolean.TRUE.equals(request.exportedOnly());
        Path outputPath = request == null ? null : resolveExportPath(request.outputPath());
        return exportService.export(source, exportedOnly, outputPath);
    }

    @GetMapping("/sessions")
    public List<ScrapeSession> sessions(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return sessionRecorder.history(source, limit);
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return new StatsResponse(
            listingStore.countListings(null, null),
            listingStore.countListings(null, false),
            listingStore.countBySource(),
            sessionRecorder.history(null, STATS_RECENT_SESSIONS)
        );
    }

    @GetMapping("/sources")
    public List<SourceView> sources() {
        List<SourceView> out = new ArrayList<>();
        for (SourceExtractor extractor : extractorRegistry.all()) {
            SourceSettings settings = properties.resolveSource(extractor.sourceId());
            out.add(new SourceView(
                extractor.sourceId(),
                extractor.displayName(),
                settings.enabled(),
                settings.minDelaySeconds(),
                settings.maxDelaySeconds(),
                settings.maxListings(),
                settings.maxPages(),
                settings.allowedStates()
            ));
        }
        return out;
    }

    private Path resolveExportPath(String requested) {
        if (requested == null || requested.isBlank()) {
            return null;
        }
        Path base = Paths.get(properties.getExport().getDirectory()).toAbsolutePath().normalize();
        Path resolved = base.resolve(requested.trim()).normalize();
        if (!resolved.startsWith(base)) {
            throw new ResponseStatusException(BAD_REQUEST, "outputPath must stay inside the export directory");
        }
        return resolved;
    }
}
