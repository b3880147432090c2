package sqlgate;

/**
 * Thrown by operations that are declared but deliberately not supported,
 * such as server-side batch execution.
 */
public final class NotImplementedException extends UnsupportedOperationException {
  public NotImplementedException(String message) {
    super(message);
  }
}
