package forgebench.orchestrator.service;

import forgebench.orchestrator.model.ApplicationSlot;

/**
 * Produces the application for an allocated slot.
 */
public interface ApplicationGenerator {

    /**
     * Generate the application, blocking until it is written.
     *
     * @throws GenerationException if generation failed
     */
    void generate(ApplicationSlot slot);
}
