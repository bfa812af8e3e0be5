package org.crawljav;

import org.crawljav.extract.ActorRecord;
import org.crawljav.fetch.FetchException;
import org.crawljav.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 1: walks the logged in user's collected actors listing and upserts every actor found.
 * The whole walk is one unit, so there is no checkpoint.
 */
public class ActorStage {
    private static final Logger log = LoggerFactory.getLogger(ActorStage.class);
    private final CrawlContext ctx;

    public ActorStage(CrawlContext ctx) {
        this.ctx = ctx;
    }

    public StageResult run() throws IOException, InterruptedException {
        Url start = ctx.config().site().collectionUrl();
        log.info("Collecting actors from {}", start);
        List<ActorRecord> records;
        try {
            records = ctx.paginator().walk(start, Set.of(), ctx.extractor()::extractActors, ActorRecord::name);
        } catch (FetchException e) {
            log.error("Collecting actors failed", e);
            return new StageResult(Stage.ACTORS, StageResult.Status.INCOMPLETE, Map.of("actors", 0L, "failed", 1L));
        }

        int written = ctx.catalog().upsertActors(records);
        if (written == 0) {
            log.warn("No actors found at {}, the cookie may have expired", start);
        }
        var counters = new LinkedHashMap<String, Long>();
        counters.put("actors", (long) written);
        ctx.history().append(new HistoryRecord(Stage.ACTORS.key(), Instant.now(), null, counters));
        log.atInfo().addKeyValue("actors", written).log("Actor collection finished");
        return new StageResult(Stage.ACTORS, StageResult.Status.COMPLETED, counters);
    }
}
