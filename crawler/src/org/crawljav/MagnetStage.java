package org.crawljav;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.crawljav.extract.MagnetRecord;
import org.crawljav.fetch.FetchException;
import org.crawljav.fetch.Page;
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
 * Stage 3: fetches the magnet links of every stored work and replaces the stored set with what
 * was found. One work is one unit, so an interrupted run resumes inside the actor it stopped in.
 */
public class MagnetStage {
    private static final Logger log = LoggerFactory.getLogger(MagnetStage.class);
    private final CrawlContext ctx;

    public MagnetStage(CrawlContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Progress of an unscoped run.
     *
     * @param actor           actor being processed
     * @param actorIndex      position of that actor in name order when the cursor was written
     * @param workIndex       number of its works completed
     * @param completedActors actors whose works were all done before this one
     * @param completedWorks  codes of this actor's completed works
     */
    public record MagnetsCursor(
            String actor,
            @JsonProperty("actor_index") int actorIndex,
            @JsonProperty("work_index") int workIndex,
            @JsonProperty("completed_actors") @Nullable List<String> completedActors,
            @JsonProperty("completed_works") @Nullable List<String> completedWorks) {
    }

    /**
     * What a resumed run skips. Units added since the checkpoint was written are in neither set.
     */
    private record Resume(Set<String> actors, @Nullable String actor, Set<String> works) {
        static final Resume NONE = new Resume(Set.of(), null, Set.of());

        Set<String> worksOf(Actor a) {
            return a.name().equals(actor) ? works : Set.of();
        }
    }

    public StageResult run(@Nullable List<String> actorFilter) throws IOException, InterruptedException {
        boolean scoped = actorFilter != null && !actorFilter.isEmpty();
        var units = new ArrayList<>(ctx.catalog().allWorksGroupedByActor().entrySet());
        if (scoped) units = filter(units, actorFilter);
        if (units.isEmpty()) {
            log.warn("No works to fetch magnets for, run the works stage first");
        }

        Resume resume = scoped ? Resume.NONE : resume(units);
        if (resume != Resume.NONE) {
            log.info("Resuming magnets, {} actors done, {} works of {} done", resume.actors().size(),
                    resume.works().size(), resume.actor());
        }

        Url baseUrl = ctx.config().site().baseUrl();
        var completedActors = new ArrayList<>(resume.actors());
        long works = 0;
        long magnets = 0;
        long empty = 0;
        long failed = 0;
        boolean frozen = false;
        boolean first = true;
        for (int a = 0; a < units.size(); a++) {
            Actor actor = units.get(a).getKey();
            if (resume.actors().contains(actor.name())) continue;
            List<Work> actorWorks = units.get(a).getValue();
            Set<String> skip = resume.worksOf(actor);
            var completedWorks = new ArrayList<>(skip);
            log.info("Fetching magnets of {} ({} works)", actor.name(), actorWorks.size());
            for (int w = 0; w < actorWorks.size(); w++) {
                Work work = actorWorks.get(w);
                if (skip.contains(work.code())) continue;
                if (!first) ctx.politeness().pause();
                first = false;
                if (work.href() == null) {
                    log.warn("Work {} has no link, skipping", work.code());
                } else {
                    Url url = baseUrl.resolve(work.href().toString());
                    log.info("[{}/{}] {} -> {}", w + 1, actorWorks.size(), work.code(), url);
                    try {
                        Page page = ctx.fetcher().fetch(url);
                        List<MagnetRecord> found = ctx.extractor().extractMagnets(page);
                        if (found.isEmpty()) {
                            log.warn("No magnets found for {}", work.code());
                            empty++;
                        }
                        int written = ctx.catalog().replaceMagnets(work.id(), found);
                        works++;
                        magnets += written;
                        log.atInfo().addKeyValue("code", work.code()).addKeyValue("magnets", written)
                                .log("Magnets saved");
                    } catch (FetchException e) {
                        failed++;
                        log.error("Fetching magnets of {} failed", work.code(), e);
                        if (!scoped && !frozen) {
                            ctx.checkpoints().save(Stage.MAGNETS, new MagnetsCursor(actor.name(), a,
                                    completedWorks.size(), completedActors, completedWorks));
                        }
                        frozen = true;
                        continue;
                    }
                }
                if (!scoped && !frozen) {
                    completedWorks.add(work.code());
                    ctx.checkpoints().save(Stage.MAGNETS, new MagnetsCursor(actor.name(), a,
                            completedWorks.size(), completedActors, completedWorks));
                }
            }
            if (!frozen) completedActors.add(actor.name());
        }

        var counters = new LinkedHashMap<String, Long>();
        counters.put("actors", (long) units.size());
        counters.put("works", works);
        counters.put("magnets", magnets);
        counters.put("works_without_magnets", empty);
        counters.put("failed", failed);
        if (failed > 0) {
            log.warn("Magnets stage incomplete, {} works failed; rerun to retry them", failed);
            return new StageResult(Stage.MAGNETS, StageResult.Status.INCOMPLETE, counters);
        }
        if (!scoped) ctx.checkpoints().clear(Stage.MAGNETS);
        ctx.history().append(new HistoryRecord(Stage.MAGNETS.key(), Instant.now(), scoped ? actorFilter : null, counters));
        log.info("Magnets stage finished: {}", counters);
        return new StageResult(Stage.MAGNETS, StageResult.Status.COMPLETED, counters);
    }

    private Resume resume(List<Map.Entry<Actor, List<Work>>> units) {
        MagnetsCursor cursor = ctx.checkpoints().cursor(Stage.MAGNETS, MagnetsCursor.class).orElse(null);
        if (cursor == null) return Resume.NONE;
        if (cursor.completedActors() != null) {
            return new Resume(new LinkedHashSet<>(cursor.completedActors()), cursor.actor(),
                    cursor.completedWorks() == null ? Set.of() : new LinkedHashSet<>(cursor.completedWorks()));
        }

        // older checkpoints only hold positions
        int index = -1;
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).getKey().name().equals(cursor.actor())) index = i;
        }
        if (index == -1) index = Math.max(0, Math.min(cursor.actorIndex(), units.size()));
        var actors = new LinkedHashSet<String>();
        for (int i = 0; i < index; i++) actors.add(units.get(i).getKey().name());
        var works = new LinkedHashSet<String>();
        if (index < units.size()) {
            List<Work> actorWorks = units.get(index).getValue();
            for (int w = 0; w < Math.min(Math.max(0, cursor.workIndex()), actorWorks.size()); w++) {
                works.add(actorWorks.get(w).code());
            }
            return new Resume(actors, units.get(index).getKey().name(), works);
        }
        return new Resume(actors, null, works);
    }

    private ArrayList<Map.Entry<Actor, List<Work>>> filter(List<Map.Entry<Actor, List<Work>>> units,
                                                           List<String> names) {
        Set<Long> wanted = new HashSet<>();
        for (String name : names) {
            Actor actor = ctx.catalog().findActor(name.trim());
            if (actor == null) {
                log.warn("Actor {} is not in the catalog, skipping", name);
            } else {
                wanted.add(actor.id());
            }
        }
        var filtered = new ArrayList<Map.Entry<Actor, List<Work>>>();
        Set<Long> matched = new HashSet<>();
        for (var unit : units) {
            if (wanted.contains(unit.getKey().id())) {
                filtered.add(unit);
                matched.add(unit.getKey().id());
            }
        }
        if (matched.size() < wanted.size()) {
            log.warn("{} of the named actors have no stored works, skipping them", wanted.size() - matched.size());
        }
        return filtered;
    }
}
