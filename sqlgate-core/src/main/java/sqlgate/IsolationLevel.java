package sqlgate;

import java.sql.Connection;
import java.util.Locale;

/**
 * Transaction isolation levels accepted under {@link TxOptions#ISOLATION}.
 */
public enum IsolationLevel {
  READ_UNCOMMITTED("read-uncommitted", Connection.TRANSACTION_READ_UNCOMMITTED),
  READ_COMMITTED("read-committed", Connection.TRANSACTION_READ_COMMITTED),
  REPEATABLE_READ("repeatable-read", Connection.TRANSACTION_REPEATABLE_READ),
  SERIALIZABLE("serializable", Connection.TRANSACTION_SERIALIZABLE);

  private final String keyword;
  private final int jdbcLevel;

  IsolationLevel(String keyword, int jdbcLevel) {
    this.keyword = keyword;
    this.jdbcLevel = jdbcLevel;
  }

  /** The option keyword, e.g. {@code "repeatable-read"}. */
  public String keyword() {
    return keyword;
  }

  /** The matching {@code Connection.TRANSACTION_*} constant. */
  public int jdbcLevel() {
    return jdbcLevel;
  }

  /**
   * Accepts an {@code IsolationLevel} or its keyword. Keywords are matched
   * case-insensitively; underscores and spaces count as dashes.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static IsolationLevel of(Object value) {
    if (value instanceof IsolationLevel level) {
      return level;
    }
    if (value instanceof CharSequence text) {
      String normalized = text.toString().trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
      for (IsolationLevel level : values()) {
        if (level.keyword.equals(normalized)) {
          return level;
        }
      }
    }
    throw new IllegalArgumentException("Unknown isolation level: " + value);
  }
}
