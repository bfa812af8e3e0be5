package org.crawljav;

import org.crawljav.MagnetStage.MagnetsCursor;
import org.crawljav.WorkStage.WorksCursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final MagnetsCursor CURSOR = new MagnetsCursor("Aoi", 2, 2, List.of("Adam", "Ai"),
            List.of("A-001", "A-002"));

    @TempDir
    Path dir;

    private CheckpointStore open() throws Exception {
        return new CheckpointStore(dir.resolve("checkpoints.json"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void survivesReopening() throws Exception {
        open().save(Stage.MAGNETS, CURSOR);

        CheckpointStore reopened = open();
        assertEquals(CURSOR, reopened.cursor(Stage.MAGNETS, MagnetsCursor.class).orElseThrow());
        assertEquals(NOW, reopened.get(Stage.MAGNETS).orElseThrow().updatedAt());
        assertTrue(reopened.get(Stage.WORKS).isEmpty());
    }

    @Test
    void documentUsesStageNamesAndSnakeCaseKeys() throws Exception {
        CheckpointStore store = open();
        store.save(Stage.MAGNETS, CURSOR);
        store.save(Stage.WORKS, new WorksCursor(3, "Chika", List.of("Aoi", "Beni", "Chika")));

        String json = Files.readString(store.file());
        assertTrue(json.contains("\"work_magnets\""));
        assertTrue(json.contains("\"actor_works\""));
        assertTrue(json.contains("\"actor_index\" : 2"));
        assertTrue(json.contains("\"completed_works\""));
        assertTrue(json.contains("\"updated_at\" : \"2024-05-01T10:15:30Z\""));
        assertFalse(Files.exists(dir.resolve("checkpoints.json.tmp")));
    }

    @Test
    void saveOverwritesAndClearRemoves() throws Exception {
        CheckpointStore store = open();
        store.save(Stage.WORKS, new WorksCursor(1, "Aoi", List.of("Aoi")));
        store.save(Stage.WORKS, new WorksCursor(2, "Beni", List.of("Aoi", "Beni")));
        assertEquals(2, store.cursor(Stage.WORKS, WorksCursor.class).orElseThrow().index());

        store.clear(Stage.WORKS);
        assertTrue(store.get(Stage.WORKS).isEmpty());
        assertTrue(open().get(Stage.WORKS).isEmpty());
    }

    @Test
    void unreadableCursorIsIgnored() throws Exception {
        Files.writeString(dir.resolve("checkpoints.json"), """
                {"actor_works": {"cursor": {"index": "lots"}, "updated_at": "2024-05-01T10:15:30Z"}}
                """);
        assertTrue(open().cursor(Stage.WORKS, WorksCursor.class).isEmpty());
    }
}
