package com.fsbo.tracker.config;

import com.fsbo.tracker.scrape.model.SourceSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("fsbo-tracker/0.1"));
    }

    @Test
    void limitsAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.setMaxRequestsPerMinute(0);
        properties.setSourceParallelism(-3);
        properties.getRetry().setMaxRetries(-1);
        properties.getRetry().setBackoffFactor(0);
        assertEquals(1, properties.getMaxRequestsPerMinute());
        assertEquals(1, properties.getSourceParallelism());
        assertEquals(0, properties.getRetry().getMaxRetries());
        assertEquals(1.0, properties.getRetry().getBackoffFactor());
    }

    @Test
    void unconfiguredSourceUsesDefaults() {
        SourceSettings settings = new ScraperProperties().resolveSource("anything");

        assertTrue(settings.enabled());
        assertEquals(Duration.ofSeconds(1), settings.minDelay());
        assertEquals(Duration.ofSeconds(5), settings.maxDelay());
        assertEquals(50, settings.maxListings());
        assertTrue(settings.isStateAllowed("TX"));
    }

    @Test
    void sourceOverridesAreNormalized() {
        ScraperProperties properties = new ScraperProperties();
        ScraperProperties.Source source = new ScraperProperties.Source();
        source.setEnabled(false);
        source.setMinDelaySeconds(4.0);
        source.setMaxDelaySeconds(2.0);
        source.setAllowedStates(List.of(" il", "Tx "));
        source.setBlocklistDomains(List.of("Zillow.COM"));
        properties.getSources().put("custom", source);

        SourceSettings settings = properties.resolveSource("custom");

        assertFalse(settings.enabled());
        assertEquals(4.0, settings.maxDelaySeconds());
        assertEquals(Set.of("IL", "TX"), settings.allowedStates());
        assertEquals(Set.of("zillow.com"), settings.blocklistDomains());
        assertFalse(settings.isStateAllowed("CA"));
        assertFalse(settings.isStateAllowed(null));
    }
}
