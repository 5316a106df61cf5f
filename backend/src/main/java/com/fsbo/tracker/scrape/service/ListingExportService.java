package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.model.ExportResult;
import com.fsbo.tracker.scrape.model.Listing;
import com.fsbo.tracker.scrape.model.ListingQuery;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CSV export of stored listings. Exporting is read-only: listings are flagged as exported
 * only through {@link ListingStoreService#markExported}.
 */
@Service
public class ListingExportService {
    private static final Logger log = LoggerFactory.getLogger(ListingExportService.class);
    static final String[] HEADERS = {
        "id", "street", "city", "state", "zip_code", "listing_url", "source_website", "scraped_at"
    };
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ListingStoreService listingStore;
    private final ScraperProperties properties;
    private final Clock clock;

    public ListingExportService(ListingStoreService listingStore, ScraperProperties properties, Clock clock) {
        this.listingStore = listingStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Exports either the not-yet-exported listings or, with {@code exportedOnly}, the ones
     * already flagged. A null path means a timestamped file under the export directory.
     */
    public ExportResult export(String source, boolean exportedOnly, Path outputPath) {
        ListingQuery query = exportedOnly ? ListingQuery.exportedOnly(source) : ListingQuery.notExported(source);
        List<Listing> listings = listingStore.listAll(query);
        Path target = outputPath == null ? defaultOutputPath() : outputPath;
        return writeCsv(listings, target);
    }

    public ExportResult writeCsv(List<Listing> listings, Path outputPath) {
        if (listings.isEmpty()) {
            log.warn("No listings to export; {} not written", outputPath);
            return ExportResult.skipped(outputPath);
        }
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADERS)
                .build();
            try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (Listing listing : listings) {
                    printer.printRecord(
                        listing.id(),
                        listing.street(),
                        listing.city(),
                        listing.state(),
                        listing.zipCode(),
                        listing.listingUrl(),
                        listing.sourceWebsite(),
                        listing.scrapedAt() == null ? null : listing.scrapedAt().toString()
                    );
                }
            }
        } catch (IOException e) {
            log.error("Failed to write export {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("Export to " + outputPath + " failed", e);
        }
        log.info("Exported {} listings to {}", listings.size(), outputPath);
        return new ExportResult(outputPath, listings.size(), true);
    }

    public Path defaultOutputPath() {
        String stamp = FILE_STAMP.format(clock.instant().atZone(ZoneId.systemDefault()));
        return Paths.get(properties.getExport().getDirectory(), "fsbo_listings_" + stamp + ".csv");
    }
}
