package org.crawljav;

import org.crawljav.config.CrawlConfig;
import org.crawljav.config.CrawlerConfig;
import org.crawljav.config.CredentialsConfig;
import org.crawljav.config.SiteConfig;
import org.crawljav.config.StorageConfig;
import org.crawljav.config.WorksConfig;
import org.crawljav.util.Url;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Wires stages against a {@link FakeSite}, the shared test database and a temporary job directory.
 */
class StageFixture {
    static final String BASE = "https://example.com";
    final FakeSite site = new FakeSite();
    final Catalog catalog;
    final Path dir;
    final HistoryLog history;
    CheckpointStore checkpoints;

    StageFixture(Database database, Path dir) throws IOException {
        this.catalog = new Catalog(database);
        this.dir = dir;
        this.history = new HistoryLog(dir.resolve("history.jsonl"));
        this.checkpoints = new CheckpointStore(dir.resolve("checkpoints.json"));
    }

    static CrawlerConfig config(boolean earlyStop) {
        return new CrawlerConfig(
                new SiteConfig(new Url(BASE), "/users/collection_actors", "test-agent", "en", Duration.ofSeconds(5)),
                new CrawlConfig(Duration.ZERO, Duration.ZERO, earlyStop),
                new CredentialsConfig("cookie.json", List.of("_jdb_session"), List.of()),
                new WorksConfig(List.of(), null),
                new StorageConfig("actors.db", "checkpoints.json", "history.jsonl", "picks"));
    }

    /**
     * Simulates a restart: the checkpoint document is read back from disk.
     */
    void restart() throws IOException {
        checkpoints = new CheckpointStore(dir.resolve("checkpoints.json"));
        site.fetched.clear();
    }

    CrawlContext context() {
        return context(true);
    }

    CrawlContext context(boolean earlyStop) {
        return CrawlContext.create(config(earlyStop), catalog, checkpoints, history, site, site, Politeness.none());
    }
}
