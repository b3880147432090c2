package sqlgate.exec;

/**
 * How an executable form is run.
 */
public enum ExecutionPath {
  /** SQL text, compiled and run in one go. */
  TEXT,
  /** A {@link java.sql.PreparedStatement} whose plan is already compiled. */
  STATEMENT
}
