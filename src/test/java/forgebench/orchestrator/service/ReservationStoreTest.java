package forgebench.orchestrator.service;

import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.repository.DistributedLock;
import forgebench.orchestrator.store.Database;
import forgebench.orchestrator.store.JdbcDistributedLock;
import forgebench.orchestrator.store.JdbcSlotRepository;
import forgebench.orchestrator.testing.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ReservationStoreTest {

    private Database db;
    private JdbcSlotRepository slots;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("test-reservations");
        slots = new JdbcSlotRepository(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private ReservationStore storeWithLock() {
        return new ReservationStore(slots, new JdbcDistributedLock(db, Duration.ofSeconds(10), Duration.ofSeconds(10)));
    }

    /** Lock that never excludes anyone: only the unique key protects allocation. */
    private static final DistributedLock NO_LOCK = new DistributedLock() {
        @Override
        public <T> T withLock(String name, Supplier<T> action) {
            return action.get();
        }

        @Override
        public String tryAcquire(String name) {
            return "nobody";
        }

        @Override
        public void release(String name, String owner) {
        }
    };

    @Test
    void sequentialAllocationCountsUp() {
        ReservationStore store = storeWithLock();

        assertEquals(1, store.allocate("gpt", "crud").appNumber());
        assertEquals(2, store.allocate("gpt", "crud").appNumber());
        assertEquals(1, store.allocate("claude", "crud").appNumber());
    }

    @Test
    @DisplayName("Concurrent allocations for one model get distinct, gap-free numbers")
    void concurrentAllocationsAreDisjoint() throws Exception {
        assertEquals(Set.of(1, 2, 3, 4, 5), allocateConcurrently(storeWithLock(), 5));
    }

    @Test
    @DisplayName("The unique key alone keeps numbers disjoint when the lock does not exclude")
    void concurrentAllocationsWithoutLock() throws Exception {
        assertEquals(Set.of(1, 2, 3, 4, 5), allocateConcurrently(new ReservationStore(slots, NO_LOCK), 5));
    }

    private static Set<Integer> allocateConcurrently(ReservationStore store, int callers) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ApplicationSlot>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<ApplicationSlot> call = () -> {
                    start.await();
                    return store.allocate("gpt", "crud");
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            Set<Integer> numbers = new TreeSet<>();
            for (Future<ApplicationSlot> f : futures) {
                numbers.add(f.get(30, TimeUnit.SECONDS).appNumber());
            }
            return numbers;
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void requestedNumberConflictIsReported() {
        ReservationStore store = storeWithLock();
        for (int i = 0; i < 3; i++) {
            store.allocate("gpt", null);
        }
        assertEquals(4, store.allocate("gpt", null, 4).appNumber());

        SlotConflictException e = assertThrows(SlotConflictException.class, () -> store.allocate("gpt", null, 4));
        assertEquals(4, e.appNumber());
        assertThrows(SlotConflictException.class, () -> store.allocate("gpt", null, 2));
        assertEquals(5, store.allocate("gpt", null).appNumber());
    }

    @Test
    @DisplayName("A requested number past the next free one is rejected so app numbers stay contiguous")
    void requestedNumberCannotLeaveGap() {
        ReservationStore store = storeWithLock();
        store.allocate("gpt", null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> store.allocate("gpt", null, 7));
        assertTrue(e.getMessage().contains("next free number is 2"));
        assertEquals(1, store.allocate("claude", null, 1).appNumber());
        assertEquals(2, store.allocate("gpt", null, 2).appNumber());
        assertEquals(3, store.allocate("gpt", null).appNumber());
    }

    @Test
    void invalidArgumentsAreRejected() {
        ReservationStore store = storeWithLock();
        assertThrows(IllegalArgumentException.class, () -> store.allocate(" ", "crud"));
        assertThrows(IllegalArgumentException.class, () -> store.allocate("gpt", "crud", 0));
        assertThrows(IllegalArgumentException.class, () -> store.createVersion("slot-missing"));
    }

    @Test
    @DisplayName("Versions form a chain; branching from an old version is refused")
    void versionLineage() {
        ReservationStore store = storeWithLock();
        ApplicationSlot v1 = store.allocate("gpt", "crud");
        ApplicationSlot v2 = store.createVersion(v1.id());
        ApplicationSlot v3 = store.createVersion(v2.id());

        assertEquals(List.of(1, 2, 3), store.lineage("gpt", v1.appNumber()).stream()
                .map(ApplicationSlot::version).toList());
        assertEquals(v2.id(), v3.parentSlotId());
        assertEquals(v3.id(), store.latest("gpt", v1.appNumber()).orElseThrow().id());

        assertThrows(StaleVersionException.class, () -> store.createVersion(v1.id()));
        assertEquals(3, store.lineage("gpt", v1.appNumber()).size());
    }

    @Test
    void slotsForModelListsLatestVersions() {
        ReservationStore store = storeWithLock();
        ApplicationSlot a = store.allocate("gpt", "crud");
        store.allocate("gpt", "blog");
        store.createVersion(a.id());

        List<ApplicationSlot> listed = store.slotsForModel("gpt");
        assertEquals(2, listed.size());
        assertEquals(2, listed.get(0).version());
        assertEquals(1, listed.get(1).version());
    }
}
