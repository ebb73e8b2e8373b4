package forgebench.orchestrator.service;

/**
 * Thrown when an explicitly requested app number is already taken.
 */
public class SlotConflictException extends RuntimeException {

    private final String model;
    private final int appNumber;

    public SlotConflictException(String model, int appNumber) {
        super("Slot already exists: " + model + "/app" + appNumber + " (create a new version instead)");
        this.model = model;
        this.appNumber = appNumber;
    }

    public String model() {
        return model;
    }

    public int appNumber() {
        return appNumber;
    }
}
