package domain.model;

/**
 * Phases of one consolidation run, in execution order, with their share of the overall
 * progress bar. Weights sum to 100.
 */
public enum ConsolidationPhase {

    VALIDATION(10),
    CLEARING(10),
    PROCESSING(70),
    SAVING(10);

    private final int weight;

    ConsolidationPhase(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /** Sum of the weights of every phase before this one. */
    public int completedWeightBefore() {
        int sum = 0;
        for (ConsolidationPhase p : values()) {
            if (p == this) break;
            sum += p.weight;
        }
        return sum;
    }

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
