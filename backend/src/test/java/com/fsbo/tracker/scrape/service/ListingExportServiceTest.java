package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.model.ExportResult;
import com.fsbo.tracker.scrape.model.Listing;
import com.fsbo.tracker.scrape.model.ListingQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ListingExportServiceTest {
    private static final Instant NOW = Instant.parse("2026-05-02T08:30:00Z");

    @TempDir
    Path tempDir;

    private final ListingStoreService listingStore = mock(ListingStoreService.class);
    private final ScraperProperties properties = new ScraperProperties();
    private final ListingExportService exportService =
        new ListingExportService(listingStore, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void emptyExportWritesNoFile() {
        Path output = tempDir.resolve("empty.csv");

        ExportResult result = exportService.writeCsv(List.of(), output);

        assertThat(result.written()).isFalse();
        assertThat(result.rowCount()).isZero();
        assertThat(output).doesNotExist();
    }

    @Test
    void writesHeaderThenOneRowPerListing() throws Exception {
        Path output = tempDir.resolve("nested/out.csv");

        ExportResult result = exportService.writeCsv(List.of(
            listing(1, "123 Main St", "Springfield", "IL", "62701", "https://fsbo.example.com/a"),
            listing(2, "9 Oak Ave, Unit 2", "Peoria", "IL", "61602", "https://fsbo.example.com/b")
        ), output);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(result.written()).isTrue();
        assertThat(result.rowCount()).isEqualTo(2);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("id,street,city,state,zip_code,listing_url,source_website,scraped_at");
        assertThat(lines.get(1))
            .isEqualTo("1,123 Main St,Springfield,IL,62701,https://fsbo.example.com/a,landing_pages,2026-05-01T10:00:00Z");
        assertThat(lines.get(2)).startsWith("2,\"9 Oak Ave, Unit 2\",Peoria,IL,61602,");
    }

    @Test
    void exportReadsNotExportedListingsAndNeverFlagsThem() {
        Path output = tempDir.resolve("pending.csv");
        when(listingStore.listAll(any(ListingQuery.class))).thenReturn(List.of(
            listing(1, "123 Main St", "Springfield", "IL", "62701", "https://fsbo.example.com/a")
        ));

        ExportResult result = exportService.export("landing_pages", false, output);

        assertThat(result.rowCount()).isEqualTo(1);
        verify(listingStore).listAll(ListingQuery.notExported("landing_pages"));
        verify(listingStore, never()).markExported(anyCollection());
    }

    @Test
    void defaultPathIsTimestampedInsideExportDirectory() {
        ScraperProperties.Export export = new ScraperProperties.Export();
        export.setDirectory(tempDir.toString());
        properties.setExport(export);

        Path path = exportService.defaultOutputPath();

        assertThat(path.getParent()).isEqualTo(tempDir);
        assertThat(path.getFileName().toString()).matches("fsbo_listings_\\d{8}_\\d{6}\\.csv");
    }

    private Listing listing(long id, String street, String city, String state, String zip, String url) {
        Instant scrapedAt = Instant.parse("2026-05-01T10:00:00Z");
        return new Listing(id, street, city, state, zip, url, "landing_pages", scrapedAt, scrapedAt, "fp" + id, false, null);
    }
}
