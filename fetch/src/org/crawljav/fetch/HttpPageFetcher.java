package org.crawljav.fetch;

import org.crawljav.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Fetches pages with the JDK http client, sending the session cookies and browser-like headers.
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private final HttpClient httpClient;
    private final Credentials credentials;
    private final String userAgent;
    private final String acceptLanguage;
    private final String referer;
    private final Duration timeout;

    public HttpPageFetcher(Credentials credentials, Url baseUrl, String userAgent, String acceptLanguage,
                           Duration timeout) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(timeout)
                        .build(),
                credentials, baseUrl, userAgent, acceptLanguage, timeout);
    }

    HttpPageFetcher(HttpClient httpClient, Credentials credentials, Url baseUrl, String userAgent,
                    String acceptLanguage, Duration timeout) {
        this.httpClient = httpClient;
        this.credentials = credentials;
        this.userAgent = userAgent;
        this.acceptLanguage = acceptLanguage;
        this.referer = baseUrl.resolve("/").toString();
        this.timeout = timeout;
    }

    HttpRequest buildRequest(URI uri) {
        var builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", acceptLanguage)
                .header("Cache-Control", "no-cache")
                .header("Pragma", "no-cache")
                .header("Referer", referer);
        String cookieHeader = credentials.cookieHeader();
        if (!cookieHeader.isEmpty()) builder.header("Cookie", cookieHeader);
        return builder.GET().build();
    }

    @Override
    public Page fetch(Url url) throws FetchException {
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new FetchException(url, "Invalid URL", e);
        }
        try {
            long start = System.nanoTime();
            var response = httpClient.send(buildRequest(uri), BodyHandlers.ofString(UTF_8));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("GET {} -> {} in {}ms", url, response.statusCode(), elapsedMs);
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new FetchException(url, "HTTP " + response.statusCode());
            }
            return new Page(new Url(response.uri().toString()), response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
