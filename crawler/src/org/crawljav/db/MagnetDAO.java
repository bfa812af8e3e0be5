package org.crawljav.db;

import org.crawljav.Magnet;
import org.crawljav.Tags;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(Magnet.class)
public interface MagnetDAO {
    @SqlUpdate("DELETE FROM magnets WHERE work_id = ?")
    int deleteByWork(long workId);

    @SqlUpdate("INSERT INTO magnets (work_id, magnet, tags, size) VALUES (:workId, :magnet, :tags, :size)")
    void insert(long workId, String magnet, Tags tags, String size);

    // ordered by id so that magnets come back in the order they were fetched
    @SqlQuery("SELECT * FROM magnets WHERE work_id = ? ORDER BY id")
    List<Magnet> listByWork(long workId);

    @SqlQuery("""
            SELECT a.name AS actor_name, w.code, m.id, m.work_id, m.magnet, m.tags, m.size
            FROM magnets m
            JOIN works w ON w.id = m.work_id
            JOIN actors a ON a.id = w.actor_id
            ORDER BY LOWER(a.name), a.name, w.code, m.id
            """)
    @RegisterConstructorMapper(Row.class)
    List<Row> listWithOwners();

    @SqlQuery("SELECT COUNT(*) FROM magnets")
    long count();

    record Row(String actorName, String code, long id, long workId, String magnet, Tags tags, String size) {
        public Magnet toMagnet() {
            return new Magnet(id, workId, magnet, tags, size);
        }
    }
}
