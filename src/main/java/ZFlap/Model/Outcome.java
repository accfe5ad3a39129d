package ZFlap.Model;

/**
 * Which termination condition ended a search.
 */
public enum Outcome {
    ACCEPTED_AT_FINAL("Accepted"),
    EXHAUSTED_INPUT("Rejected - ended in non-final state"),
    EXHAUSTED_STEPS("Rejected - step limit reached"),
    NO_TRANSITION("Rejected - no possible transitions");

    private final String description;

    Outcome(String description) {
        this.description = description;
    }

    public boolean isAccepted() {
        return this == ACCEPTED_AT_FINAL;
    }

    /**
     * Human-readable reason, suitable for a status line.
     */
    public String describe() {
        return description;
    }
}
