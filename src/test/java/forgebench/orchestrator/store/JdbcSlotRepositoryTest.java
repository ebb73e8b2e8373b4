package forgebench.orchestrator.store;

import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSlotRepositoryTest {

    private static Database db;
    private static JdbcSlotRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-slots");
        repo = new JdbcSlotRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanSlots() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM application_slots");
            conn.commit();
        }
    }

    @Test
    void insertNextStartsAtOneAndCounts() {
        Instant now = Instant.now();
        ApplicationSlot first = repo.tryInsertNext("s1", "gpt", "crud", now).orElseThrow();
        ApplicationSlot second = repo.tryInsertNext("s2", "gpt", "crud", now).orElseThrow();
        ApplicationSlot other = repo.tryInsertNext("s3", "claude", "crud", now).orElseThrow();

        assertEquals(1, first.appNumber());
        assertEquals(1, first.version());
        assertNull(first.parentSlotId());
        assertEquals(2, second.appNumber());
        assertEquals(1, other.appNumber(), "numbering is per model");
        assertEquals("crud", second.template());
    }

    @Test
    void insertNextSkipsPastExplicitNumbers() {
        Instant now = Instant.now();
        repo.tryInsert(new ApplicationSlot("s7", "gpt", 7, 1, null, null, now)).orElseThrow();

        assertEquals(8, repo.tryInsertNext("s8", "gpt", null, now).orElseThrow().appNumber());
    }

    @Test
    void insertTakenNumberReturnsEmpty() {
        Instant now = Instant.now();
        assertTrue(repo.tryInsert(new ApplicationSlot("a", "gpt", 3, 1, null, null, now)).isPresent());

        Optional<ApplicationSlot> dup = repo.tryInsert(new ApplicationSlot("b", "gpt", 3, 1, null, null, now));

        assertTrue(dup.isEmpty());
        assertTrue(repo.findById("b").isEmpty());
    }

    @Test
    void versionChainRequiresLatestParent() {
        Instant now = Instant.now();
        ApplicationSlot v1 = repo.tryInsertNext("v1", "gpt", "crud", now).orElseThrow();
        ApplicationSlot v2 = repo.tryInsertVersion(v1, "v2", now).orElseThrow();

        assertEquals(2, v2.version());
        assertEquals(v1.id(), v2.parentSlotId());
        assertEquals(v1.appNumber(), v2.appNumber());
        assertEquals("crud", v2.template());

        // v1 is no longer the latest version
        assertTrue(repo.tryInsertVersion(v1, "v2b", now).isEmpty());

        ApplicationSlot v3 = repo.tryInsertVersion(v2, "v3", now).orElseThrow();
        assertEquals(3, v3.version());
    }

    @Test
    void lineageAndLatest() {
        Instant now = Instant.now();
        ApplicationSlot v1 = repo.tryInsertNext("l1", "gpt", null, now).orElseThrow();
        ApplicationSlot v2 = repo.tryInsertVersion(v1, "l2", now).orElseThrow();
        repo.tryInsertNext("other", "gpt", null, now).orElseThrow();

        List<ApplicationSlot> lineage = repo.findLineage("gpt", v1.appNumber());
        assertEquals(List.of("l1", "l2"), lineage.stream().map(ApplicationSlot::id).toList());
        assertEquals("l2", repo.findLatest("gpt", v1.appNumber()).orElseThrow().id());

        List<ApplicationSlot> byModel = repo.findByModel("gpt");
        assertEquals(2, byModel.size());
        assertEquals(v2.id(), byModel.get(0).id(), "one entry per app number, latest version");
    }
}
