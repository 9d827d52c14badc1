package app;

import cli.CliProgressMonitor;
import domain.model.ConsolidationConfig;
import domain.model.ConsolidationWarningSink;
import domain.model.ProgressSink;
import org.slf4j.Logger;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Object-assembly factory for {@link AutoConsolidatorCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/console output and moves object
 * creation here.
 */
final class ConsolidatorComponentsFactory {

    private final Logger log;
    private final Clock clock;

    ConsolidatorComponentsFactory(Logger log, Clock clock) {
        this.log = log;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    ExcelConsolidator createConsolidator(ConsolidationConfig config, ConsolidationWarningSink warningSink) {
        return new ExcelConsolidator(config, log, warningSink, clock);
    }

    ProgressSink createProgressSink(PrintStream out) {
        return new CliProgressMonitor(out);
    }
}
