package cli;

import domain.model.ProgressEvent;
import domain.model.ProgressSink;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Console progress sink: one line per event with the overall percentage.
 */
public final class CliProgressMonitor implements ProgressSink {

    private final PrintStream out;
    private final long startNs = System.nanoTime();

    public CliProgressMonitor(PrintStream out) {
        this.out = out == null ? System.out : out;
    }

    @Override
    public void onProgress(ProgressEvent event) {
        long elapsed = (System.nanoTime() - startNs) / 1_000_000L;
        out.printf(Locale.ROOT, "[PROGRESS] %5.1f%% %-10s %d/%d elapsed=%dms %s%n",
                event.overallPercent(),
                event.getPhase().label(),
                event.getCurrent(),
                event.getTotal(),
                elapsed,
                event.getMessage());
    }
}
