package domain.model;

/**
 * Progress notification: phase, position within the phase, and a short message.
 */
public final class ProgressEvent {

    private final ConsolidationPhase phase;
    private final int current;
    private final int total;
    private final String message;

    public ProgressEvent(ConsolidationPhase phase, int current, int total, String message) {
        if (phase == null) throw new IllegalArgumentException("phase is null");
        this.phase = phase;
        this.current = Math.max(0, current);
        this.total = Math.max(0, total);
        this.message = message == null ? "" : message;
    }

    public ConsolidationPhase getPhase() {
        return phase;
    }

    public int getCurrent() {
        return current;
    }

    public int getTotal() {
        return total;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Overall completion in percent (0..100): weights of the earlier phases plus the completed
     * fraction of this phase times its weight. A zero total counts as no progress in the phase.
     */
    public double overallPercent() {
        double within = 0d;
        if (total > 0) {
            within = Math.min(1d, (double) current / total) * phase.getWeight();
        }
        return phase.completedWeightBefore() + within;
    }

    @Override
    public String toString() {
        return "[" + phase.label().toUpperCase(java.util.Locale.ROOT) + "] "
                + current + "/" + total + " " + message;
    }
}
