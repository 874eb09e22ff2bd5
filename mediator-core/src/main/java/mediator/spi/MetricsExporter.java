package mediator.spi;

/**
 * Observability hook for exporting dispatch counters to a metrics backend.
 *
 * <p>Each {@code send} records exactly one outcome counter. The {@link #NOOP} instance discards
 * all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of requests whose handler completed normally.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of requests whose handler failed.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of requests that ended cancelled.
     */
    void incrementDispatchCancelled();

    /**
     * Increments the count of requests with no registered handler.
     */
    void incrementDispatchUnroutable();

    /**
     * Records the time from handler invocation to completion.
     *
     * @param durationMs handler duration in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchCancelled() {
        }

        @Override
        public void incrementDispatchUnroutable() {
        }
    }
}
