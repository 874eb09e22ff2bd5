package mediator.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import mediator.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a distribution summary with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mediator.dispatch.success}: handler completed normally</li>
 *   <li>{@code mediator.dispatch.failure}: handler or its resolution failed</li>
 *   <li>{@code mediator.dispatch.cancelled}: request ended cancelled</li>
 *   <li>{@code mediator.dispatch.unroutable}: no handler registered for the request</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code mediator.handler.duration.ms}: time from handler invocation to completion</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter dispatchCancelled;
  private final Counter dispatchUnroutable;
  private final DistributionSummary handlerDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "mediator"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mediator");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for applications running several
   * mediators side by side.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.mediator"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Requests whose handler completed normally")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Requests whose handler failed")
        .register(registry);
    this.dispatchCancelled = Counter.builder(namePrefix + ".dispatch.cancelled")
        .description("Requests that ended cancelled")
        .register(registry);
    this.dispatchUnroutable = Counter.builder(namePrefix + ".dispatch.unroutable")
        .description("Requests with no registered handler")
        .register(registry);
    this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
        .description("Time from handler invocation to completion")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementDispatchCancelled() {
    if (closed) return;
    dispatchCancelled.increment();
  }

  @Override
  public void incrementDispatchUnroutable() {
    if (closed) return;
    dispatchUnroutable.increment();
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>The Spring Boot starter calls this when the application context shuts down.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatchSuccess, dispatchFailure, dispatchCancelled,
        dispatchUnroutable, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
