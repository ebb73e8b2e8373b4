package forgebench.orchestrator.repository;

import forgebench.orchestrator.model.ApplicationSlot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for application slots.
 * Every write relies on the unique (model, app_number, version) key; a lost
 * race is reported as an empty result, never as an exception.
 */
public interface SlotRepository {

    /**
     * Insert version 1 of the next free app number for a model in a single
     * statement.
     *
     * @param id        the new slot id
     * @param model     the model name
     * @param template  the template the app is generated from (nullable)
     * @param createdAt creation timestamp
     * @return the inserted slot, or empty if a concurrent writer took the number
     */
    Optional<ApplicationSlot> tryInsertNext(String id, String model, String template, Instant createdAt);

    /**
     * Insert a slot exactly as given.
     *
     * @param slot the slot to insert
     * @return the slot, or empty if (model, appNumber, version) is already taken
     */
    Optional<ApplicationSlot> tryInsert(ApplicationSlot slot);

    /**
     * Insert the next version of a lineage, provided the parent is still the
     * latest version of its (model, appNumber). The latest version is re-read
     * inside the same transaction.
     *
     * @param parent    the version being regenerated
     * @param id        the new slot id
     * @param createdAt creation timestamp
     * @return the new slot, or empty if the parent is no longer the latest
     */
    Optional<ApplicationSlot> tryInsertVersion(ApplicationSlot parent, String id, Instant createdAt);

    Optional<ApplicationSlot> findById(String id);

    /**
     * Highest version for a (model, appNumber).
     */
    Optional<ApplicationSlot> findLatest(String model, int appNumber);

    /**
     * All versions of a (model, appNumber), ordered by version.
     */
    List<ApplicationSlot> findLineage(String model, int appNumber);

    /**
     * Latest version of every app number of a model, ordered by app number.
     */
    List<ApplicationSlot> findByModel(String model);
}
