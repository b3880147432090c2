package sqlgate.spi;

/**
 * Observability hook for exporting connection and transaction counters to a
 * metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see sqlgate.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /** A connection was opened from a configuration. */
  void incrementConnectionsOpened();

  /** A configuration-derived connection was closed. */
  void incrementConnectionsClosed();

  /** A connection was borrowed from a pool. */
  void incrementConnectionsBorrowed();

  /** A borrowed connection was returned to its pool. */
  void incrementConnectionsReturned();

  void incrementCommits();

  void incrementRollbacks();

  /**
   * Records the time spent in a single execute call.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordExecutionMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementConnectionsOpened() {
    }

    @Override
    public void incrementConnectionsClosed() {
    }

    @Override
    public void incrementConnectionsBorrowed() {
    }

    @Override
    public void incrementConnectionsReturned() {
    }

    @Override
    public void incrementCommits() {
    }

    @Override
    public void incrementRollbacks() {
    }
  }
}
