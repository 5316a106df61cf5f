package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.model.ExportResult;
import com.fsbo.tracker.scrape.model.ScrapeRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * One-shot mode: with {@code scraper.cli.run=true} the configured sources are scraped at
 * startup, optionally exported, and the process exits.
 */
@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ListingExportService exportService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ListingExportService exportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.exportService = exportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> sources = Arrays.stream(properties.getCli().getSources().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        List<ScrapeRunSummary> summaries = sources.isEmpty()
            ? orchestratorService.runEnabledSources()
            : orchestratorService.runSources(sources);
        int totalNew = 0;
        for (ScrapeRunSummary summary : summaries) {
            totalNew += summary.listingsNew();
            log.info(
                "Summary {}: status={} found={} new={} duplicates={} errors={}{}",
                summary.sourceId(),
                summary.status().dbValue(),
                summary.listingsFound(),
                summary.listingsNew(),
                summary.listingsDuplicates(),
                summary.errors(),
                summary.errorMessage() == null ? "" : " message=" + summary.errorMessage()
            );
        }
        log.info("Scrape complete: {} sources, {} new listings", summaries.size(), totalNew);

        if (properties.getCli().isExportAfterRun()) {
            ExportResult export = exportService.export(null, false, null);
            if (export.written()) {
                log.info("Exported {} listings to {}", export.rowCount(), export.outputPath());
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
