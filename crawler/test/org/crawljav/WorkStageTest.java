package org.crawljav;

import org.crawljav.WorkStage.WorksCursor;
import org.crawljav.extract.WorkRecord;
import org.crawljav.util.Url;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class WorkStageTest {
    private static final List<String> ACTORS = List.of("Aoi", "Beni", "Chika", "Daisy", "Emi");

    private final Database database;
    private StageFixture fixture;

    WorkStageTest(Database database) {
        this.database = database;
    }

    private static String actorUrl(String name) {
        return "https://example.com/actors/" + name.toLowerCase();
    }

    @BeforeEach
    void setUp(@TempDir Path dir) throws Exception {
        fixture = new StageFixture(database, dir);
        for (String name : ACTORS) {
            fixture.catalog.upsertActor(name, new Url(actorUrl(name)));
            fixture.site.page(actorUrl(name),
                    "work:" + name.toUpperCase() + "-002|second|https://example.com/v/" + name + "2",
                    "work:" + name.toUpperCase() + "-001|first|https://example.com/v/" + name + "1");
        }
    }

    private StageResult run(List<String> filter) throws Exception {
        return new WorkStage(fixture.context()).run(filter);
    }

    @Test
    void completedRunClearsCheckpointAndRecordsHistoryOnce() throws Exception {
        StageResult result = run(null);

        assertTrue(result.completed());
        assertEquals(5, result.counter("actors"));
        assertEquals(10, result.counter("works_saved"));
        assertEquals(10L, fixture.catalog.counts().get("works"));
        assertTrue(fixture.checkpoints.get(Stage.WORKS).isEmpty());
        var history = fixture.history.readAll();
        assertEquals(1, history.size());
        assertEquals("actor_works", history.get(0).stage());
        assertEquals(10L, history.get(0).counters().get("works_saved"));
    }

    @Test
    void resumesAfterTheLastCompletedActor() throws Exception {
        fixture.site.crash(actorUrl("Daisy"));
        assertThrows(IllegalStateException.class, () -> run(null));
        assertEquals(new WorksCursor(3, "Chika", List.of("Aoi", "Beni", "Chika")),
                fixture.checkpoints.cursor(Stage.WORKS, WorksCursor.class).orElseThrow());
        assertTrue(fixture.history.readAll().isEmpty());

        fixture.restart();
        fixture.site.heal();
        StageResult result = run(null);

        assertTrue(result.completed());
        assertEquals(List.of(actorUrl("Daisy"), actorUrl("Emi")), fixture.site.fetchedUrls());
        assertTrue(fixture.checkpoints.get(Stage.WORKS).isEmpty());
    }

    @Test
    void scopedRunIgnoresAndKeepsTheCheckpoint() throws Exception {
        var cursor = new WorksCursor(3, "Chika", List.of("Aoi", "Beni", "Chika"));
        fixture.checkpoints.save(Stage.WORKS, cursor);

        StageResult result = run(List.of("Aoi", "Nobody"));

        assertTrue(result.completed());
        assertEquals(List.of(actorUrl("Aoi")), fixture.site.fetchedUrls());
        assertEquals(cursor, fixture.checkpoints.cursor(Stage.WORKS, WorksCursor.class).orElseThrow());
        var history = fixture.history.readAll();
        assertEquals(1, history.size());
        assertEquals(List.of("Aoi", "Nobody"), history.get(0).scope());
    }

    @Test
    void resumeVisitsActorsCollectedAfterTheCheckpoint() throws Exception {
        fixture.checkpoints.save(Stage.WORKS, new WorksCursor(3, "Chika", List.of("Aoi", "Beni", "Chika")));
        // sorts before every completed actor
        fixture.catalog.upsertActor("Abe", new Url(actorUrl("Abe")));
        fixture.site.page(actorUrl("Abe"), "work:ABE-001|first|https://example.com/v/Abe1");

        StageResult result = run(null);

        assertTrue(result.completed());
        assertEquals(List.of(actorUrl("Abe"), actorUrl("Daisy"), actorUrl("Emi")), fixture.site.fetchedUrls());
        assertTrue(fixture.checkpoints.get(Stage.WORKS).isEmpty());
    }

    @Test
    void checkpointWithoutCompletedNamesResumesByIndex() throws Exception {
        fixture.checkpoints.save(Stage.WORKS, Map.of("index", 3, "actor", "Chika"));

        assertTrue(run(null).completed());
        assertEquals(List.of(actorUrl("Daisy"), actorUrl("Emi")), fixture.site.fetchedUrls());
    }

    @Test
    void scopedRunMatchesNamesIgnoringCase() throws Exception {
        StageResult result = run(List.of("aoi", "AOI"));

        assertTrue(result.completed());
        assertEquals(List.of(actorUrl("Aoi")), fixture.site.fetchedUrls());
    }

    @Test
    void failedActorFreezesTheCheckpoint() throws Exception {
        fixture.site.fail(actorUrl("Beni"));
        StageResult result = run(null);

        assertFalse(result.completed());
        assertEquals(1, result.counter("failed"));
        // later actors still ran
        assertEquals(8L, fixture.catalog.counts().get("works"));
        assertEquals(new WorksCursor(1, "Aoi", List.of("Aoi")),
                fixture.checkpoints.cursor(Stage.WORKS, WorksCursor.class).orElseThrow());
        assertTrue(fixture.history.readAll().isEmpty());

        fixture.restart();
        fixture.site.heal();
        assertTrue(run(null).completed());
        assertEquals(actorUrl("Beni"), fixture.site.fetchedUrls().get(0));
        assertEquals(10L, fixture.catalog.counts().get("works"));
    }

    @Test
    void stopsPagingAtAKnownWork() throws Exception {
        Actor aoi = fixture.catalog.findActor("Aoi");
        fixture.catalog.upsertWorks(aoi.id(), List.of(new WorkRecord("AOI-001", "first", new Url("https://example.com/v/Aoi1"))));
        fixture.site.page(actorUrl("Aoi"),
                "work:AOI-003|third|https://example.com/v/Aoi3",
                "work:AOI-001|first|https://example.com/v/Aoi1",
                "next:" + actorUrl("Aoi") + "?page=2");

        StageResult result = run(List.of("Aoi"));

        assertEquals(1, result.counter("works_fetched"));
        assertEquals(List.of("AOI-001", "AOI-003"), fixture.catalog.worksOf(aoi.id()).stream().map(Work::code).toList());
        assertFalse(fixture.site.fetchedUrls().contains(actorUrl("Aoi") + "?page=2"));
    }

    @Test
    void actorWorksUrlReplacesFilterParameters() {
        Url base = new Url("https://example.com");
        assertEquals(new Url("https://example.com/actors/abc?page=2&t=s%2Cd&sort_type=0"),
                WorkStage.actorWorksUrl(base, "/actors/abc?t=x&page=2", List.of("s", "d"), "0"));
        assertEquals(new Url("https://example.com/actors/abc?t=x"),
                WorkStage.actorWorksUrl(base, "/actors/abc?t=x", List.of(), null));
        assertEquals(new Url("https://example.com/actors/abc"),
                WorkStage.actorWorksUrl(base, "https://example.com/actors/abc", List.of(), null));
    }
}
