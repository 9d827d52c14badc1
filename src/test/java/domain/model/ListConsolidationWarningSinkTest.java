package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListConsolidationWarningSinkTest {

    @Test
    void identicalWarnings_areRecordedOnce() {
        List<ConsolidationWarning> list = new ArrayList<>();
        ListConsolidationWarningSink sink = new ListConsolidationWarningSink(list);

        ConsolidationWarning w = new ConsolidationWarning(WarningCode.DESTINATION_COLUMN_NOT_FOUND,
                "est1.xlsx", "Destination column 'Qty' not found in consolidation header", "Sheet1!B3");
        sink.warn(w);
        sink.warn(new ConsolidationWarning(WarningCode.DESTINATION_COLUMN_NOT_FOUND,
                "est1.xlsx", "Destination column 'Qty' not found in consolidation header", "Sheet1!B3"));
        sink.warn(new ConsolidationWarning(WarningCode.DESTINATION_COLUMN_NOT_FOUND,
                "est2.xlsx", "Destination column 'Qty' not found in consolidation header", "Sheet1!B3"));
        sink.warn(null);

        assertEquals(2, list.size());
        assertSame(w, list.get(0));
    }

    @Test
    void noneSink_ignoresEverything() {
        assertDoesNotThrow(() -> ConsolidationWarningSink.none()
                .warn(ConsolidationWarning.of(WarningCode.LARGE_FILE, "a.xlsx", "big")));
    }
}
