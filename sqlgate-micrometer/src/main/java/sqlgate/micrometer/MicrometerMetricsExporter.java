package sqlgate.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import sqlgate.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sqlgate.connections.opened} - connections opened from a configuration</li>
 *   <li>{@code sqlgate.connections.closed} - configuration-derived connections closed</li>
 *   <li>{@code sqlgate.connections.borrowed} - connections borrowed from a pool</li>
 *   <li>{@code sqlgate.connections.returned} - connections returned to a pool</li>
 *   <li>{@code sqlgate.tx.commit} - transactions committed</li>
 *   <li>{@code sqlgate.tx.rollback} - transactions rolled back</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code sqlgate.connections.outstanding} - borrowed minus returned</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code sqlgate.execute} - time spent per execute call</li>
 * </ul>
 *
 * <p>The outstanding gauge only sees connections taken through sqlgate; a
 * connection resolved by {@code execute} from a pool stays outstanding until the
 * caller returns it outside sqlgate.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter opened;
  private final Counter closedConnections;
  private final Counter borrowed;
  private final Counter returned;
  private final Counter commits;
  private final Counter rollbacks;
  private final Gauge outstandingGauge;
  private final Timer executeTimer;

  private final AtomicInteger outstanding = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "sqlgate"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "sqlgate");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.sqlgate"})
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
    this.opened = Counter.builder(namePrefix + ".connections.opened")
        .description("Connections opened from a configuration")
        .register(registry);
    this.closedConnections = Counter.builder(namePrefix + ".connections.closed")
        .description("Configuration-derived connections closed")
        .register(registry);
    this.borrowed = Counter.builder(namePrefix + ".connections.borrowed")
        .description("Connections borrowed from a pool")
        .register(registry);
    this.returned = Counter.builder(namePrefix + ".connections.returned")
        .description("Connections returned to a pool")
        .register(registry);
    this.commits = Counter.builder(namePrefix + ".tx.commit")
        .description("Transactions committed")
        .register(registry);
    this.rollbacks = Counter.builder(namePrefix + ".tx.rollback")
        .description("Transactions rolled back")
        .register(registry);

    this.outstandingGauge = Gauge.builder(namePrefix + ".connections.outstanding", outstanding, AtomicInteger::get)
        .description("Pool connections borrowed and not yet returned")
        .register(registry);
    this.executeTimer = Timer.builder(namePrefix + ".execute")
        .description("Time spent per execute call")
        .register(registry);
  }

  @Override
  public void incrementConnectionsOpened() {
    if (closed) return;
    opened.increment();
  }

  @Override
  public void incrementConnectionsClosed() {
    if (closed) return;
    closedConnections.increment();
  }

  @Override
  public void incrementConnectionsBorrowed() {
    if (closed) return;
    borrowed.increment();
    outstanding.incrementAndGet();
  }

  @Override
  public void incrementConnectionsReturned() {
    if (closed) return;
    returned.increment();
    outstanding.decrementAndGet();
  }

  @Override
  public void incrementCommits() {
    if (closed) return;
    commits.increment();
  }

  @Override
  public void incrementRollbacks() {
    if (closed) return;
    rollbacks.increment();
  }

  @Override
  public void recordExecutionMs(long durationMs) {
    if (closed) return;
    executeTimer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(opened, closedConnections, borrowed, returned,
        commits, rollbacks, outstandingGauge, executeTimer)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
