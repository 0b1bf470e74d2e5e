package career.pulse.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.function.BooleanSupplier;

/**
 * Caller-supplied parameters for one sync run. Null query/afterDate/maxResults
 * fall back to the configured defaults.
 */
@Value
@Builder
public class SyncOptions {
    String query;
    String afterDate;
    Integer maxResults;

    @Builder.Default
    BooleanSupplier cancellationRequested = () -> false;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
    }
}
