package domain.model;

/**
 * Receives progress events synchronously on the thread running the consolidation.
 *
 * <p>Every phase transition waits for {@link #onProgress} to return, so implementations must
 * not block or do long work.</p>
 */
@FunctionalInterface
public interface ProgressSink {

    static ProgressSink none() {
        return event -> {
        };
    }

    void onProgress(ProgressEvent event);
}
