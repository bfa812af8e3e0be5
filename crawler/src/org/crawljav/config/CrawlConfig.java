package org.crawljav.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.crawljav.util.DurationDeserializer;

import java.time.Duration;

/**
 * How the crawl behaves.
 *
 * @param minDelay  shortest pause between two requests
 * @param maxDelay  longest pause between two requests
 * @param earlyStop stop paging an actor's works at the first already stored work. Only correct
 *                  when the source lists works newest first.
 */
public record CrawlConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration minDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxDelay,
        boolean earlyStop
) {
}
