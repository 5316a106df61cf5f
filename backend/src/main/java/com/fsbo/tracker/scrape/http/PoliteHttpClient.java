package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.model.HttpFetchResult;
import com.fsbo.tracker.scrape.util.ListingUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-attempt GET with browser-like headers. Every request first passes the shared
 * {@link RequestThrottler}. A host answering 403 or 429 is put on cooldown, for its
 * {@code Retry-After} when it sends one. Retries are the caller's business.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);
    static final Duration MAX_COOLDOWN = Duration.ofMinutes(5);
    private static final Pattern CHARSET = Pattern.compile("charset=\"?([\\w.:-]+)\"?", Pattern.CASE_INSENSITIVE);

    private final ScraperProperties properties;
    private final RequestThrottler throttler;
    private final Clock clock;
    private final HttpClient client;
    private final Map<String, Instant> cooldownUntil = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        ScraperProperties properties,
        RequestThrottler throttler,
        Clock clock,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.throttler = throttler;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url) {
        return get(url, HTML_ACCEPT);
    }

    public HttpFetchResult get(String url, String accept) {
        Instant startedAt = clock.instant();
        URI uri = toRequestUri(url);
        if (uri == null) {
            return HttpFetchResult.failure(url, FetchException.INVALID_URL, "Not an absolute URL with a host", startedAt, clock.instant());
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            waitOutCooldown(host);
            throttler.acquire(host);

            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", userAgent())
                .header("Accept", accept == null || accept.isBlank() ? "*/*" : accept)
                .header("Accept-Language", "en-US,en;q=0.9")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());

            int status = response.statusCode();
            if (status == 403 || status == 429) {
                Duration cooldown = cooldownFor(response.headers());
                log.warn("{} answered {}; cooling down for {}s", host, status, cooldown.toSeconds());
                startCooldown(host, cooldown);
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            return HttpFetchResult.response(
                url,
                response.uri(),
                status,
                decode(response.body(), contentType),
                contentType,
                startedAt,
                clock.instant()
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, FetchException.TIMEOUT, e.getMessage(), startedAt, clock.instant());
        } catch (IOException e) {
            return HttpFetchResult.failure(url, FetchException.IO_ERROR, e.getMessage(), startedAt, clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, FetchException.INTERRUPTED, "Interrupted", startedAt, clock.instant());
        } catch (IllegalArgumentException e) {
            return HttpFetchResult.failure(url, FetchException.INVALID_URL, e.getMessage(), startedAt, clock.instant());
        }
    }

    /**
     * Time left before the host may be contacted again; zero when it is not cooling down.
     */
    Duration cooldownRemaining(String host) {
        Instant until = cooldownUntil.get(host.toLowerCase(Locale.ROOT));
        if (until == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), until);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private void waitOutCooldown(String host) throws InterruptedException {
        Duration left = cooldownRemaining(host);
        if (!left.isZero()) {
            log.debug("Waiting {} ms for {} cooldown", left.toMillis(), host);
            Thread.sleep(left.toMillis());
        }
    }

    private void startCooldown(String host, Duration cooldown) {
        Instant until = clock.instant().plus(cooldown);
        cooldownUntil.merge(host, until, (current, proposed) -> proposed.isAfter(current) ? proposed : current);
    }

    static Duration cooldownFor(HttpHeaders headers) {
        String retryAfter = headers.firstValue("Retry-After").orElse(null);
        if (retryAfter == null || !retryAfter.trim().matches("\\d{1,6}")) {
            return DEFAULT_COOLDOWN;
        }
        Duration requested = Duration.ofSeconds(Long.parseLong(retryAfter.trim()));
        return requested.compareTo(MAX_COOLDOWN) > 0 ? MAX_COOLDOWN : requested;
    }

    private String userAgent() {
        return properties.isRotateUserAgents() ? UserAgentRotator.next() : properties.getUserAgent();
    }

    private static URI toRequestUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        String sanitized = ListingUrlUtils.sanitizeUrl(value);
        return sanitized == null ? null : ListingUrlUtils.safeUri(sanitized);
    }

    static String decode(byte[] body, String contentType) {
        if (body == null) {
            return null;
        }
        Charset charset = StandardCharsets.UTF_8;
        if (contentType != null) {
            Matcher m = CHARSET.matcher(contentType);
            if (m.find()) {
                try {
                    charset = Charset.forName(m.group(1));
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    log.debug("Unknown charset {}; decoding as UTF-8", m.group(1));
                }
            }
        }
        return new String(body, charset);
    }
}
