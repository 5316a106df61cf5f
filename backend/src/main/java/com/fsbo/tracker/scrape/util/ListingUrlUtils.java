package com.fsbo.tracker.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

public final class ListingUrlUtils {
    private ListingUrlUtils() {
    }

    /**
     * Returns the trimmed URL when it is an absolute http(s) URL with a host, else null.
     * Fragments are dropped so the same page is not queued twice.
     */
    public static String sanitizeUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            trimmed = trimmed.substring(0, hash);
        }
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
            return null;
        }
        return trimmed;
    }

    public static String hostOf(String url) {
        URI uri = url == null ? null : safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * A host matches a domain when it equals it or is a subdomain of it. An empty
     * allowlist admits every host; the blocklist always wins.
     */
    public static boolean isDomainAllowed(String url, Set<String> allowlist, Set<String> blocklist) {
        String host = hostOf(url);
        if (host == null) {
            return false;
        }
        for (String blocked : blocklist) {
            if (matchesDomain(host, blocked)) {
                return false;
            }
        }
        if (allowlist.isEmpty()) {
            return true;
        }
        for (String allowed : allowlist) {
            if (matchesDomain(host, allowed)) {
                return true;
            }
        }
        return false;
    }

    public static boolean matchesDomain(String host, String domain) {
        if (host == null || domain == null || domain.isBlank()) {
            return false;
        }
        String d = domain.trim().toLowerCase(Locale.ROOT);
        return host.equals(d) || host.endsWith("." + d);
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
