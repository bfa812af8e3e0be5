package org.crawljav;

import org.crawljav.config.CrawlerConfig;
import org.crawljav.util.Url;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrawljavTest {

    @Test
    void defaultsApplyWithoutConfigFile(@TempDir Path jobDir) throws Exception {
        CrawlerConfig config = Crawljav.loadConfig(jobDir);

        assertEquals(new Url("https://javdb.com"), config.site().baseUrl());
        assertEquals(new Url("https://javdb.com/users/collection_actors"), config.site().collectionUrl());
        assertEquals(Duration.ofSeconds(30), config.site().timeout());
        assertEquals(Duration.ofMillis(800), config.crawl().minDelay());
        assertEquals(Duration.ofMillis(1600), config.crawl().maxDelay());
        assertTrue(config.crawl().earlyStop());
        assertEquals(List.of("_jdb_session"), config.credentials().required());
        assertEquals(List.of("over18", "cf_clearance"), config.credentials().recommended());
        assertEquals(List.of(), config.works().tags());
        assertNull(config.works().sortType());
        assertEquals("actors.db", config.storage().database());
    }

    @Test
    void jobConfigOverridesDefaults(@TempDir Path jobDir) throws Exception {
        Files.writeString(jobDir.resolve("config.yaml"), """
                crawl:
                  earlyStop: false
                  minDelay: 2s
                works:
                  tags: [s, d]
                  sortType: "0"
                """);
        CrawlerConfig config = Crawljav.loadConfig(jobDir);

        assertFalse(config.crawl().earlyStop());
        assertEquals(Duration.ofSeconds(2), config.crawl().minDelay());
        assertEquals(Duration.ofMillis(1600), config.crawl().maxDelay());
        assertEquals(List.of("s", "d"), config.works().tags());
        assertEquals("0", config.works().sortType());
        assertEquals(new Url("https://javdb.com"), config.site().baseUrl());
    }

    @Test
    void emptyConfigFileIsIgnored(@TempDir Path jobDir) throws Exception {
        Files.writeString(jobDir.resolve("config.yaml"), "");
        assertTrue(Crawljav.loadConfig(jobDir).crawl().earlyStop());
    }
}
