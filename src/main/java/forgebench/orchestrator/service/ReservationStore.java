package forgebench.orchestrator.service;

import forgebench.orchestrator.model.ApplicationSlot;
import forgebench.orchestrator.repository.DistributedLock;
import forgebench.orchestrator.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Allocates application slots and their version lineages.
 *
 * <p>
 * Allocation is a single insert against the store's unique
 * (model, app_number, version) key, retried when a concurrent caller wins the
 * same number. The named lock around it only reduces contention; the key is
 * what keeps numbers disjoint.
 */
public class ReservationStore {

    private static final Logger log = LoggerFactory.getLogger(ReservationStore.class);

    static final int MAX_ATTEMPTS = 10;

    private final SlotRepository slotRepository;
    private final DistributedLock lock;
    private final Clock clock;

    public ReservationStore(SlotRepository slotRepository, DistributedLock lock) {
        this(slotRepository, lock, Clock.systemUTC());
    }

    public ReservationStore(SlotRepository slotRepository, DistributedLock lock, Clock clock) {
        this.slotRepository = slotRepository;
        this.lock = lock;
        this.clock = clock;
    }

    /**
     * Allocate the next free app number for a model.
     */
    public ApplicationSlot allocate(String model, String template) {
        return allocate(model, template, null);
    }

    /**
     * Allocate version 1 of a slot.
     *
     * @param model              the model name
     * @param template           the template generated into the slot (nullable)
     * @param requestedAppNumber explicit app number, or null for the next free one;
     *                           at most one past the highest number in use
     * @return the new slot
     * @throws SlotConflictException if the requested number is already taken
     * @throws IllegalArgumentException if the requested number would leave a gap
     * @throws IllegalStateException if no number could be allocated after
     *                               {@value #MAX_ATTEMPTS} attempts
     */
    public ApplicationSlot allocate(String model, String template, Integer requestedAppNumber) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        if (requestedAppNumber != null && requestedAppNumber < 1) {
            throw new IllegalArgumentException("appNumber must be >= 1");
        }

        return lock.withLock(lockName(model), () -> {
            if (requestedAppNumber != null) {
                int next = highestAppNumber(model) + 1;
                if (requestedAppNumber > next) {
                    throw new IllegalArgumentException("appNumber " + requestedAppNumber + " for " + model
                            + " would leave a gap, the next free number is " + next);
                }
                ApplicationSlot slot = new ApplicationSlot(newId(), model, requestedAppNumber, 1, null, template,
                        clock.instant());
                ApplicationSlot inserted = slotRepository.tryInsert(slot)
                        .orElseThrow(() -> new SlotConflictException(model, requestedAppNumber));
                log.info("Reserved requested slot {}", inserted.label());
                return inserted;
            }

            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                Optional<ApplicationSlot> inserted = slotRepository.tryInsertNext(newId(), model, template,
                        clock.instant());
                if (inserted.isPresent()) {
                    log.info("Reserved slot {} (attempt {})", inserted.get().label(), attempt);
                    return inserted.get();
                }
                log.debug("Allocation conflict for {}, retrying ({}/{})", model, attempt, MAX_ATTEMPTS);
            }
            throw new IllegalStateException(
                    "Failed to allocate a slot for " + model + " after " + MAX_ATTEMPTS + " attempts");
        });
    }

    private int highestAppNumber(String model) {
        return slotRepository.findByModel(model).stream()
                .mapToInt(ApplicationSlot::appNumber)
                .max()
                .orElse(0);
    }

    /**
     * Create the next version of a slot's lineage.
     *
     * @param parentSlotId id of the version being regenerated; must be the latest
     * @return the new version
     * @throws IllegalArgumentException if the parent does not exist
     * @throws StaleVersionException    if the parent is not the latest version
     */
    public ApplicationSlot createVersion(String parentSlotId) {
        ApplicationSlot parent = slotRepository.findById(parentSlotId)
                .orElseThrow(() -> new IllegalArgumentException("Slot not found: " + parentSlotId));

        return lock.withLock(lockName(parent.model()), () -> {
            ApplicationSlot next = slotRepository.tryInsertVersion(parent, newId(), clock.instant())
                    .orElseThrow(() -> new StaleVersionException(
                            "Cannot branch from " + parent.label() + ": it is not the latest version"));
            log.info("Created version {} from {}", next.label(), parent.id());
            return next;
        });
    }

    public Optional<ApplicationSlot> findById(String slotId) {
        return slotRepository.findById(slotId);
    }

    public Optional<ApplicationSlot> latest(String model, int appNumber) {
        return slotRepository.findLatest(model, appNumber);
    }

    /**
     * All versions of one app, oldest first.
     */
    public List<ApplicationSlot> lineage(String model, int appNumber) {
        return slotRepository.findLineage(model, appNumber);
    }

    public List<ApplicationSlot> slotsForModel(String model) {
        return slotRepository.findByModel(Objects.requireNonNull(model, "model is required"));
    }

    private static String lockName(String model) {
        return "slot-allocation:" + model;
    }

    private static String newId() {
        return "slot-" + UUID.randomUUID();
    }
}
