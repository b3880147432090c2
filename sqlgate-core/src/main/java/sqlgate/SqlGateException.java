package sqlgate;

/**
 * Base class for precondition failures raised by sqlgate before any connection
 * is acquired or any statement is run.
 *
 * <p>Failures coming from the driver or from caller code are never wrapped in
 * this type; they reach the caller unchanged.
 */
public class SqlGateException extends RuntimeException {
  public SqlGateException(String message) {
    super(message);
  }
}
