package domain.model;
/** No-op warning sink. */
final class NullConsolidationWarningSink implements ConsolidationWarningSink {

    static final NullConsolidationWarningSink INSTANCE = new NullConsolidationWarningSink();

    private NullConsolidationWarningSink() {
    }

    @Override
    public void warn(ConsolidationWarning warning) {
        // no-op
    }
}
