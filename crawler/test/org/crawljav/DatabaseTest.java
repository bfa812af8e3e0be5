package org.crawljav;

import org.crawljav.extract.MagnetRecord;
import org.crawljav.extract.WorkRecord;
import org.crawljav.util.Url;
import org.jdbi.v3.core.JdbiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @Test
    void storesUrlsAndTagsAsText(@TempDir Path dir) throws Exception {
        try (Database db = Database.open(dir.resolve("nested/actors.db"))) {
            var catalog = new Catalog(db);
            long actorId = catalog.upsertActor("Aoi", new Url("https://example.com/actors/a?t=s"));
            catalog.upsertWorks(actorId, List.of(new WorkRecord("A-001", "first", new Url("https://example.com/v/A-001"))));
            long workId = catalog.worksOf(actorId).get(0).id();
            catalog.replaceMagnets(workId, List.of(
                    new MagnetRecord("magnet:?xt=1", List.of("字幕", "高清"), "1GB"),
                    new MagnetRecord("magnet:?xt=2", List.of(), "2GB")));

            assertEquals(new Url("https://example.com/actors/a?t=s"), catalog.findActor("Aoi").href());
            catalog.upsertActor("Beni", null);
            assertNull(catalog.findActor("Beni").href());
            assertEquals(List.of(Tags.of(List.of("字幕", "高清")), Tags.EMPTY),
                    catalog.magnetsOf(workId).stream().map(Magnet::tags).toList());
            String stored = db.withHandle(handle -> handle.createQuery("SELECT tags FROM magnets WHERE magnet = 'magnet:?xt=1'")
                    .mapTo(String.class).one());
            assertEquals("字幕, 高清", stored);
        }
        assertTrue(Files.exists(dir.resolve("nested/actors.db")));
    }

    @Test
    void closeReleasesThePool(@TempDir Path dir) throws Exception {
        Database db = Database.open(dir.resolve("actors.db"));
        db.close();
        assertThrows(JdbiException.class, () -> db.actors().count());
    }
}
