package org.crawljav.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Url(String url) {
        this.url = url;
    }

    public static Url orNull(String url) {
        if (url == null || url.isBlank()) return null;
        return new Url(url.trim());
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    /**
     * Resolves a possibly relative reference against this URL.
     */
    public Url resolve(String href) {
        if (href == null || href.isBlank()) return this;
        try {
            return new Url(toURI().resolve(href.trim()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Unable to resolve " + href + " against " + url, e);
        }
    }

    public String withoutQuery() {
        int i = url.indexOf('?');
        int j = url.indexOf('#');
        int end = i != -1 ? i : j != -1 ? j : url.length();
        return url.substring(0, end);
    }

    public List<Map.Entry<String, String>> queryParameters() {
        var params = new ArrayList<Map.Entry<String, String>>();
        int i = url.indexOf('?');
        if (i == -1) return params;
        int j = url.indexOf('#', i);
        String query = url.substring(i + 1, j == -1 ? url.length() : j);
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq == -1 ? pair : pair.substring(0, eq);
            String value = eq == -1 ? "" : pair.substring(eq + 1);
            params.add(Map.entry(URLDecoder.decode(key, UTF_8), URLDecoder.decode(value, UTF_8)));
        }
        return params;
    }

    /**
     * Returns a copy of this URL with the query replaced by the given parameters.
     */
    public Url withQueryParameters(List<Map.Entry<String, String>> params) {
        var builder = new StringBuilder(withoutQuery());
        char separator = '?';
        for (var param : params) {
            builder.append(separator);
            builder.append(URLEncoder.encode(param.getKey(), UTF_8));
            builder.append('=');
            builder.append(URLEncoder.encode(param.getValue(), UTF_8));
            separator = '&';
        }
        return new Url(builder.toString());
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
