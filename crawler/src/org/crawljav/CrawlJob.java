package org.crawljav;

import org.crawljav.config.CrawlerConfig;
import org.crawljav.config.StorageConfig;
import org.crawljav.extract.RecordExtractor;
import org.crawljav.fetch.PageFetcher;
import org.crawljav.select.MagnetSelector;
import org.crawljav.select.PickWriter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A crawl bound to a job directory holding its database, checkpoints, history and picks.
 */
public class CrawlJob implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrawlJob.class);
    private final Database db;
    private final CrawlContext context;
    private final Path picksDir;

    public CrawlJob(Path jobDir, CrawlerConfig config, PageFetcher fetcher, RecordExtractor extractor) throws IOException {
        StorageConfig storage = config.storage();
        this.db = Database.open(jobDir.resolve(storage.database()));
        try {
            var politeness = new Politeness(config.crawl().minDelay(), config.crawl().maxDelay());
            this.context = CrawlContext.create(config, new Catalog(db),
                    new CheckpointStore(jobDir.resolve(storage.checkpoints())),
                    new HistoryLog(jobDir.resolve(storage.history())),
                    fetcher, extractor, politeness);
        } catch (IOException | RuntimeException e) {
            db.close();
            throw e;
        }
        this.picksDir = jobDir.resolve(storage.picks());
    }

    public StageResult collectActors() throws IOException, InterruptedException {
        return new ActorStage(context).run();
    }

    public StageResult fetchWorks(@Nullable List<String> actors) throws IOException, InterruptedException {
        return new WorkStage(context).run(actors);
    }

    public StageResult fetchMagnets(@Nullable List<String> actors) throws IOException, InterruptedException {
        return new MagnetStage(context).run(actors);
    }

    /**
     * Runs the given stages in crawl order, skipping the others.
     *
     * @return one result per stage that ran
     */
    public List<StageResult> run(Set<Stage> stages, @Nullable List<String> actors) throws IOException, InterruptedException {
        var results = new ArrayList<StageResult>();
        for (Stage stage : Stage.values()) {
            if (!stages.contains(stage)) {
                log.atInfo().addKeyValue("stage", stage.key()).log("Skipping stage");
                continue;
            }
            results.add(switch (stage) {
                case ACTORS -> collectActors();
                case WORKS -> fetchWorks(actors);
                case MAGNETS -> fetchMagnets(actors);
            });
        }
        return results;
    }

    /**
     * Writes the best magnet of every stored work. Reads only from the catalog.
     */
    public PickWriter.Summary writePicks() throws IOException {
        var writer = new PickWriter(picksDir, new MagnetSelector());
        return writer.write(context.catalog().groupedMagnetsByActorAndWork());
    }

    public CrawlContext context() {
        return context;
    }

    @Override
    public void close() {
        try {
            db.close();
        } catch (Exception e) {
            log.error("Failed to close database", e);
        }
    }
}
