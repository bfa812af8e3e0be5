package org.crawljav.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Cookie bundle sent with every request. Loaded once per process.
 */
public final class Credentials {
    private static final Logger log = LoggerFactory.getLogger(Credentials.class);
    private final Map<String, String> cookies;

    public Credentials(Map<String, String> cookies) {
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
    }

    /**
     * Reads a cookie file holding either {@code {"cookie": "a=b; c=d"}} or a flat object of
     * cookie names to values.
     */
    public static Credentials load(Path file) throws CredentialsException {
        String json;
        try {
            json = Files.readString(file);
        } catch (NoSuchFileException e) {
            throw new CredentialsException("Cookie file " + file + " not found");
        } catch (IOException e) {
            throw new CredentialsException("Unable to read cookie file " + file, e);
        }
        try {
            return parse(new ObjectMapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new CredentialsException("Cookie file " + file + " is not valid JSON", e);
        }
    }

    static Credentials parse(JsonNode root) {
        var cookies = new LinkedHashMap<String, String>();
        if (root == null || !root.isObject()) return new Credentials(cookies);
        JsonNode cookieString = root.get("cookie");
        if (cookieString != null && cookieString.isTextual()) {
            cookies.putAll(parseCookieString(cookieString.asText()));
        } else {
            root.fields().forEachRemaining(field -> cookies.put(field.getKey(), field.getValue().asText()));
        }
        return new Credentials(cookies);
    }

    /**
     * Parses a {@code Cookie} header style string ({@code a=b; c=d}).
     */
    public static Map<String, String> parseCookieString(String cookieString) {
        var cookies = new LinkedHashMap<String, String>();
        for (String pair : cookieString.split(";")) {
            int eq = pair.indexOf('=');
            if (eq == -1) continue;
            cookies.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return cookies;
    }

    /**
     * Shallow structural check. Missing required cookies are fatal, missing recommended ones are
     * only logged.
     */
    public Credentials require(List<String> required, List<String> recommended) throws CredentialsException {
        if (cookies.isEmpty()) {
            throw new CredentialsException("No cookies found in cookie file");
        }
        var missing = new ArrayList<String>();
        for (String name : required) {
            if (!cookies.containsKey(name)) missing.add(name);
        }
        if (!missing.isEmpty()) {
            throw new CredentialsException("Missing required cookies: " + String.join(", ", missing));
        }
        for (String name : recommended) {
            if (!cookies.containsKey(name)) {
                log.warn("Cookie {} is missing, requests may be blocked", name);
            }
        }
        return this;
    }

    public Map<String, String> cookies() {
        return cookies;
    }

    public String cookieHeader() {
        return cookies.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return "Credentials" + cookies.keySet();
    }
}
