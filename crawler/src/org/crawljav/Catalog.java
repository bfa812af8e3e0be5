package org.crawljav;

import org.crawljav.db.MagnetDAO;
import org.crawljav.extract.ActorRecord;
import org.crawljav.extract.MagnetRecord;
import org.crawljav.extract.WorkRecord;
import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Idempotent read/write operations over the actor → work → magnet hierarchy.
 * <p>
 * Every mutating call runs in its own transaction, so a failure leaves no half-written state
 * behind. Calling any of them twice with the same input leaves the same rows.
 */
public class Catalog {
    private static final Logger log = LoggerFactory.getLogger(Catalog.class);
    private final Database db;

    public Catalog(Database db) {
        this.db = db;
    }

    public long upsertActor(String name, @Nullable Url href) {
        return db.inTransaction(dao -> dao.actors().upsert(name.trim(), href));
    }

    /**
     * Upserts all valid actor records in one transaction.
     *
     * @return number of actors written
     */
    public int upsertActors(Collection<ActorRecord> actors) {
        return db.inTransaction(dao -> {
            int written = 0;
            for (var actor : actors) {
                if (!actor.isValid()) continue;
                dao.actors().upsert(actor.name().trim(), actor.href());
                written++;
            }
            return written;
        });
    }

    /**
     * Inserts or updates works by (actor, code). Records without a code or href are skipped and not
     * counted.
     */
    public int upsertWorks(long actorId, Collection<WorkRecord> works) {
        return db.inTransaction(dao -> {
            int written = 0;
            for (var work : works) {
                if (!work.isValid()) {
                    log.debug("Skipping malformed work {}", work);
                    continue;
                }
                String title = work.title() == null || work.title().isBlank() ? null : work.title().trim();
                dao.works().upsert(actorId, work.code().trim(), title, work.href());
                written++;
            }
            return written;
        });
    }

    /**
     * Replaces the stored magnets of a work with the given set. The stored magnets always reflect the
     * most recent fetch: an empty list clears them. Duplicate URIs keep their first occurrence.
     */
    public int replaceMagnets(long workId, Collection<MagnetRecord> magnets) {
        return db.inTransaction(dao -> {
            dao.magnets().deleteByWork(workId);
            Set<String> seen = new HashSet<>();
            int written = 0;
            for (var magnet : magnets) {
                if (!magnet.isValid()) continue;
                String uri = magnet.uri().trim();
                if (!seen.add(uri)) continue;
                String size = magnet.size().isEmpty() ? null : magnet.size();
                dao.magnets().insert(workId, uri, Tags.of(magnet.tags()), size);
                written++;
            }
            return written;
        });
    }

    public Set<String> knownWorkCodes(long actorId) {
        return db.works().codesByActor(actorId);
    }

    public List<Actor> actors() {
        return db.actors().listAll();
    }

    /**
     * Looks an actor up by name, ignoring case.
     */
    public @Nullable Actor findActor(String name) {
        return db.actors().findByName(name);
    }

    public List<Work> worksOf(long actorId) {
        return db.works().listByActor(actorId);
    }

    public List<Magnet> magnetsOf(long workId) {
        return db.magnets().listByWork(workId);
    }

    /**
     * Works of every actor, actors ordered case-insensitively by name and works by code. Actors with
     * no works are left out.
     */
    public LinkedHashMap<Actor, List<Work>> allWorksGroupedByActor() {
        return db.inTransaction(dao -> {
            var grouped = new LinkedHashMap<Actor, List<Work>>();
            for (Actor actor : dao.actors().listAll()) {
                List<Work> works = dao.works().listByActor(actor.id());
                if (!works.isEmpty()) grouped.put(actor, works);
            }
            return grouped;
        });
    }

    /**
     * Stored magnets as actor name → work code → magnets, each level in a stable order. Magnets of a
     * work keep the order they were fetched in.
     */
    public LinkedHashMap<String, LinkedHashMap<String, List<Magnet>>> groupedMagnetsByActorAndWork() {
        var grouped = new LinkedHashMap<String, LinkedHashMap<String, List<Magnet>>>();
        for (MagnetDAO.Row row : db.magnets().listWithOwners()) {
            grouped.computeIfAbsent(row.actorName(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(row.code(), k -> new ArrayList<>())
                    .add(row.toMagnet());
        }
        return grouped;
    }

    public Map<String, Long> counts() {
        var counts = new LinkedHashMap<String, Long>();
        counts.put("actors", db.actors().count());
        counts.put("works", db.works().count());
        counts.put("magnets", db.magnets().count());
        return counts;
    }
}
