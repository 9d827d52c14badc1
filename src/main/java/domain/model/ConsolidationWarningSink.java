package domain.model;

/**
 * Sink for consolidation warnings.
 *
 * <p>Validators and the engine report through it so that callers (CLI summary, tests) can
 * collect findings without parsing log output.</p>
 */
public interface ConsolidationWarningSink {

    static ConsolidationWarningSink none() {
        return NullConsolidationWarningSink.INSTANCE;
    }

    void warn(ConsolidationWarning warning);
}
