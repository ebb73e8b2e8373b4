package forgebench.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One version of a generated application: (model, appNumber, version) with an
 * optional link to the version it was regenerated from.
 */
public record ApplicationSlot(
        String id,
        String model,
        int appNumber,
        int version,
        String parentSlotId,
        String template,
        Instant createdAt) {

    public ApplicationSlot {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(model, "model is required");
        if (appNumber < 1) {
            throw new IllegalArgumentException("appNumber must be >= 1");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }

    /** Display key, e.g. "openai_gpt-4/app3 v2". */
    public String label() {
        return model + "/app" + appNumber + " v" + version;
    }
}
