package sqlgate;

/**
 * Thrown when a connection source is {@code null}.
 */
public final class NullSourceException extends SqlGateException {
  public NullSourceException() {
    super("Connection source cannot be null");
  }
}
