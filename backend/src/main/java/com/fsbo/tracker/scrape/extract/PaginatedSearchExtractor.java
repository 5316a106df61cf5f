package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.http.FetchException;
import com.fsbo.tracker.scrape.http.Fetcher;
import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.SourceSettings;
import com.fsbo.tracker.scrape.util.ListingUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Search-result sites: walks result pages from each start URL via the next-page link,
 * collecting detail links that match {@code listingLinkPattern}. Each start URL stops at
 * {@code maxPages} pages or at the first page that adds no new links.
 */
@Component
public class PaginatedSearchExtractor extends HtmlPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(PaginatedSearchExtractor.class);
    public static final String SOURCE_ID = "paginated_search";
    static final String DEFAULT_NEXT_PAGE_SELECTOR = "a[rel=next]";

    public PaginatedSearchExtractor(AddressStrategyChain strategyChain) {
        super(strategyChain);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public String displayName() {
        return "Paginated Search Results";
    }

    @Override
    public List<FetchTarget> discover(SourceSettings settings, Fetcher fetcher) throws DiscoveryException {
        Pattern linkPattern = compileLinkPattern(settings);
        String nextSelector = settings.nextPageSelector() == null || settings.nextPageSelector().isBlank()
            ? DEFAULT_NEXT_PAGE_SELECTOR
            : settings.nextPageSelector();

        LinkedHashSet<String> links = new LinkedHashSet<>();
        int startUrls = 0;
        int failedStartUrls = 0;
        FetchException lastFailure = null;
        for (String raw : settings.startUrls()) {
            String startUrl = ListingUrlUtils.sanitizeUrl(raw);
            if (startUrl == null
                || !ListingUrlUtils.isDomainAllowed(startUrl, settings.allowlistDomains(), settings.blocklistDomains())) {
                log.debug("[{}] skipping start URL {}", settings.sourceId(), raw);
                continue;
            }
            if (links.size() >= settings.maxListings()) {
                break;
            }
            startUrls++;
            try {
                walkPages(settings, fetcher, startUrl, linkPattern, nextSelector, links);
            } catch (FetchException e) {
                failedStartUrls++;
                lastFailure = e;
                log.warn("[{}] search page failed for {}: {}", settings.sourceId(), startUrl, e.getMessage());
            }
        }
        if (startUrls > 0 && failedStartUrls == startUrls && links.isEmpty()) {
            throw new DiscoveryException("Every search start page failed for " + settings.sourceId(), lastFailure);
        }

        List<FetchTarget> targets = new ArrayList<>();
        for (String link : links) {
            targets.add(FetchTarget.of(link));
        }
        log.info("[{}] discovered {} listing links", settings.sourceId(), targets.size());
        return targets;
    }

    private void walkPages(
        SourceSettings settings,
        Fetcher fetcher,
        String startUrl,
        Pattern linkPattern,
        String nextSelector,
        LinkedHashSet<String> links
    ) throws FetchException {
        Set<String> visitedPages = new HashSet<>();
        String pageUrl = startUrl;
        int pages = 0;
        while (pageUrl != null && pages < settings.maxPages() && links.size() < settings.maxListings()) {
            if (!visitedPages.add(pageUrl)) {
                break;
            }
            String html;
            try {
                html = fetcher.fetch(FetchTarget.of(pageUrl));
            } catch (FetchException e) {
                if (pages == 0) {
                    throw e;
                }
                log.warn("[{}] stopping pagination at page {}: {}", settings.sourceId(), pages + 1, e.getMessage());
                return;
            }
            pages++;
            Document doc = Jsoup.parse(html, pageUrl);

            int added = 0;
            for (Element anchor : doc.select("a[href]")) {
                String href = ListingUrlUtils.sanitizeUrl(anchor.attr("abs:href"));
                if (href == null || !linkPattern.matcher(href).find()) {
                    continue;
                }
                if (!ListingUrlUtils.isDomainAllowed(href, settings.allowlistDomains(), settings.blocklistDomains())) {
                    continue;
                }
                if (links.size() >= settings.maxListings()) {
                    break;
                }
                if (links.add(href)) {
                    added++;
                }
            }
            log.debug("[{}] page {} of {} added {} links", settings.sourceId(), pages, startUrl, added);
            if (added == 0) {
                return;
            }
            pageUrl = nextPageUrl(doc, nextSelector);
        }
    }

    private String nextPageUrl(Document doc, String nextSelector) {
        Element next = doc.selectFirst(nextSelector);
        if (next == null) {
            return null;
        }
        return ListingUrlUtils.sanitizeUrl(next.attr("abs:href"));
    }

    private Pattern compileLinkPattern(SourceSettings settings) throws DiscoveryException {
        String pattern = settings.listingLinkPattern();
        if (pattern == null || pattern.isBlank()) {
            throw new DiscoveryException("listingLinkPattern is not configured for " + settings.sourceId());
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new DiscoveryException("Invalid listingLinkPattern for " + settings.sourceId(), e);
        }
    }
}
