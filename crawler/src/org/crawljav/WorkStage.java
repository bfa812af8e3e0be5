package org.crawljav;

import org.crawljav.extract.WorkRecord;
import org.crawljav.fetch.FetchException;
import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 2: fetches the works of every stored actor. One actor is one unit; the checkpoint records
 * which actors are done, so actors collected after it was written are still visited.
 */
public class WorkStage {
    private static final Logger log = LoggerFactory.getLogger(WorkStage.class);
    private final CrawlContext ctx;

    public WorkStage(CrawlContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Progress of an unscoped run.
     *
     * @param index     number of actors completed
     * @param actor     name of the last completed actor, if any
     * @param completed names of the completed actors. Older checkpoints lack it and resume by index.
     */
    public record WorksCursor(int index, @Nullable String actor, @Nullable List<String> completed) {
    }

    /**
     * Runs the stage over all actors, or only over the named ones. A run restricted to named actors
     * always starts from the first of them and leaves the checkpoint alone.
     */
    public StageResult run(@Nullable List<String> actorFilter) throws IOException, InterruptedException {
        boolean scoped = actorFilter != null && !actorFilter.isEmpty();
        List<Actor> actors = scoped ? resolveActors(actorFilter) : ctx.catalog().actors();
        if (actors.isEmpty()) {
            log.warn("No actors to fetch works for, run the actor collection first");
        }

        // actors added since the checkpoint was written are not in it and still get processed
        Set<String> skip = scoped ? Set.of() : completedActors(actors);
        if (!skip.isEmpty()) {
            log.info("Resuming works, {} of {} actors already done", skip.size(), actors.size());
        }

        var sortType = ctx.config().works().sortType();
        var tags = ctx.config().works().tags();
        boolean earlyStop = ctx.config().crawl().earlyStop();
        var completed = new ArrayList<>(skip);
        String lastCompleted = completed.isEmpty() ? null : completed.get(completed.size() - 1);
        long fetched = 0;
        long saved = 0;
        long failed = 0;
        boolean frozen = false;
        boolean first = true;
        for (int i = 0; i < actors.size(); i++) {
            Actor actor = actors.get(i);
            if (skip.contains(actor.name())) continue;
            if (!first) ctx.politeness().pause();
            first = false;
            if (actor.href() == null) {
                log.warn("Actor {} has no link, skipping", actor.name());
            } else {
                Url url = actorWorksUrl(ctx.config().site().baseUrl(), actor.href().toString(), tags, sortType);
                Set<String> known = earlyStop ? ctx.catalog().knownWorkCodes(actor.id()) : Set.of();
                log.atInfo().addKeyValue("actor", actor.name()).addKeyValue("known", known.size())
                        .log("[" + (i + 1) + "/" + actors.size() + "] Fetching works");
                try {
                    List<WorkRecord> works = ctx.paginator().walk(url, known, ctx.extractor()::extractWorks,
                            WorkRecord::code);
                    int written = ctx.catalog().upsertWorks(actor.id(), works);
                    fetched += works.size();
                    saved += written;
                    log.atInfo().addKeyValue("actor", actor.name()).addKeyValue("new", works.size())
                            .addKeyValue("saved", written).log("Works saved");
                } catch (FetchException e) {
                    failed++;
                    log.error("Fetching works of {} failed", actor.name(), e);
                    if (!scoped && !frozen) {
                        ctx.checkpoints().save(Stage.WORKS, new WorksCursor(completed.size(), lastCompleted, completed));
                    }
                    frozen = true;
                    continue;
                }
            }
            if (!scoped && !frozen) {
                completed.add(actor.name());
                lastCompleted = actor.name();
                ctx.checkpoints().save(Stage.WORKS, new WorksCursor(completed.size(), lastCompleted, completed));
            }
        }

        var counters = new LinkedHashMap<String, Long>();
        counters.put("actors", (long) actors.size());
        counters.put("works_fetched", fetched);
        counters.put("works_saved", saved);
        counters.put("failed", failed);
        if (failed > 0) {
            log.warn("Works stage incomplete, {} actors failed; rerun to retry them", failed);
            return new StageResult(Stage.WORKS, StageResult.Status.INCOMPLETE, counters);
        }
        if (!scoped) ctx.checkpoints().clear(Stage.WORKS);
        ctx.history().append(new HistoryRecord(Stage.WORKS.key(), Instant.now(), scoped ? actorFilter : null, counters));
        log.info("Works stage finished: {}", counters);
        return new StageResult(Stage.WORKS, StageResult.Status.COMPLETED, counters);
    }

    private List<Actor> resolveActors(List<String> names) {
        var actors = new ArrayList<Actor>();
        var seen = new HashSet<Long>();
        for (String name : names) {
            Actor actor = ctx.catalog().findActor(name.trim());
            if (actor == null) {
                log.warn("Actor {} is not in the catalog, skipping", name);
                continue;
            }
            if (seen.add(actor.id())) actors.add(actor);
        }
        return actors;
    }

    private Set<String> completedActors(List<Actor> actors) {
        WorksCursor cursor = ctx.checkpoints().cursor(Stage.WORKS, WorksCursor.class).orElse(null);
        if (cursor == null) return Set.of();
        if (cursor.completed() != null) return new LinkedHashSet<>(cursor.completed());
        var done = new LinkedHashSet<String>();
        for (int i = 0; i < Math.min(cursor.index(), actors.size()); i++) {
            done.add(actors.get(i).name());
        }
        return done;
    }

    /**
     * Builds the works listing URL of an actor. Given tags replace any {@code t} parameter already in
     * the link and a given sort type replaces {@code sort_type}; other parameters are kept.
     */
    static Url actorWorksUrl(Url baseUrl, String href, List<String> tags, @Nullable String sortType) {
        Url url = baseUrl.resolve(href);
        var params = new ArrayList<Map.Entry<String, String>>();
        for (var param : url.queryParameters()) {
            if (param.getKey().equals("t") && !tags.isEmpty()) continue;
            if (param.getKey().equals("sort_type") && sortType != null) continue;
            params.add(param);
        }
        if (!tags.isEmpty()) params.add(Map.entry("t", String.join(",", tags)));
        if (sortType != null) params.add(Map.entry("sort_type", sortType));
        if (params.isEmpty()) return new Url(url.withoutQuery());
        return url.withQueryParameters(params);
    }
}
