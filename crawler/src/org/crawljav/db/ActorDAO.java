package org.crawljav.db;

import org.crawljav.Actor;
import org.crawljav.util.Url;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.List;

@RegisterConstructorMapper(Actor.class)
public interface ActorDAO {
    // an empty href never replaces a known one
    @SqlQuery("""
            INSERT INTO actors (name, href) VALUES (:name, :href)
            ON CONFLICT (name) DO UPDATE SET href = COALESCE(NULLIF(excluded.href, ''), actors.href)
            RETURNING id
            """)
    long upsert(String name, Url href);

    // case-insensitive like the listing order, an exact match wins when names differ only in case
    @SqlQuery("""
            SELECT * FROM actors WHERE LOWER(name) = LOWER(:name)
            ORDER BY name = :name DESC, name
            LIMIT 1
            """)
    Actor findByName(String name);

    @SqlQuery("SELECT * FROM actors ORDER BY LOWER(name), name")
    List<Actor> listAll();

    @SqlQuery("SELECT COUNT(*) FROM actors")
    long count();
}
