package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.http.Fetcher;
import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.SourceSettings;
import com.fsbo.tracker.scrape.util.ListingUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Static pages that list several FSBO properties each. Targets are the configured start
 * URLs; discovery does no network work.
 */
@Component
public class LandingPageExtractor extends HtmlPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(LandingPageExtractor.class);
    public static final String SOURCE_ID = "landing_pages";

    public LandingPageExtractor(AddressStrategyChain strategyChain) {
        super(strategyChain);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public String displayName() {
        return "FSBO Landing Pages";
    }

    @Override
    public List<FetchTarget> discover(SourceSettings settings, Fetcher fetcher) {
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        for (String raw : settings.startUrls()) {
            String url = ListingUrlUtils.sanitizeUrl(raw);
            if (url == null) {
                log.warn("[{}] ignoring malformed start URL {}", settings.sourceId(), raw);
                continue;
            }
            if (!ListingUrlUtils.isDomainAllowed(url, settings.allowlistDomains(), settings.blocklistDomains())) {
                log.debug("[{}] start URL {} excluded by domain lists", settings.sourceId(), url);
                continue;
            }
            urls.add(url);
        }
        List<FetchTarget> targets = new ArrayList<>();
        for (String url : urls) {
            targets.add(FetchTarget.of(url));
        }
        return targets;
    }
}
