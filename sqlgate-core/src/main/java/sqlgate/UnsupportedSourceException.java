package sqlgate;

/**
 * Thrown when a connection source is neither a {@link java.sql.Connection},
 * a {@link sqlgate.spi.ConnectionPool}, nor a connection configuration.
 */
public final class UnsupportedSourceException extends SqlGateException {
  private final transient Object source;

  public UnsupportedSourceException(Object source) {
    super("Unsupported connection source: " + describe(source));
    this.source = source;
  }

  /** The rejected value. */
  public Object getSource() {
    return source;
  }

  static String describe(Object value) {
    return value.getClass().getName() + " " + value;
  }
}
