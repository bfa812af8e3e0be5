package org.crawljav.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.crawljav.util.DurationDeserializer;
import org.crawljav.util.Url;

import java.time.Duration;

/**
 * The source being crawled.
 *
 * @param baseUrl        root of the site, used to resolve relative links
 * @param collectionPath path of the logged in user's collected actors listing
 * @param userAgent      User-Agent header sent with every request
 * @param acceptLanguage Accept-Language header sent with every request
 * @param timeout        connect and request timeout
 */
public record SiteConfig(
        Url baseUrl,
        String collectionPath,
        String userAgent,
        String acceptLanguage,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout
) {
    public Url collectionUrl() {
        return baseUrl.resolve(collectionPath);
    }
}
