package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|file|message|detail): a missing destination column is hit once per
 * estimate file and would otherwise repeat for every row written.</p>
 */
public final class ListConsolidationWarningSink implements ConsolidationWarningSink {

    private final List<ConsolidationWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListConsolidationWarningSink(List<ConsolidationWarning> target) {
        this.target = target;
    }

    private static String key(ConsolidationWarning w) {
        return w.getCode().name() + "|"
                + w.getFile() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(ConsolidationWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
