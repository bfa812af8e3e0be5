package org.crawljav.db;

import org.crawljav.Work;
import org.crawljav.util.Url;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Set;

@RegisterConstructorMapper(Work.class)
public interface WorkDAO {
    @SqlUpdate("""
            INSERT INTO works (actor_id, code, title, href) VALUES (:actorId, :code, :title, :href)
            ON CONFLICT (actor_id, code) DO UPDATE SET title = excluded.title, href = excluded.href
            """)
    void upsert(long actorId, String code, String title, Url href);

    @SqlQuery("SELECT * FROM works WHERE actor_id = ? ORDER BY code")
    List<Work> listByActor(long actorId);

    @SqlQuery("SELECT code FROM works WHERE actor_id = ?")
    Set<String> codesByActor(long actorId);

    @SqlQuery("SELECT COUNT(*) FROM works")
    long count();
}
