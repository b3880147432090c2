package sqlgate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translation between the caller-facing transaction options and the
 * vocabulary of the transaction primitive.
 *
 * <table>
 *   <caption>Key mapping</caption>
 *   <tr><th>caller</th><th>primitive</th></tr>
 *   <tr><td>{@code isolation}</td><td>{@code isolation-level}</td></tr>
 *   <tr><td>{@code read-only}</td><td>{@code read-only?}</td></tr>
 *   <tr><td>{@code rollback-only}</td><td>{@code rollback?}</td></tr>
 * </table>
 *
 * <p>Only keys are renamed. Values are never coerced and unknown keys are
 * carried over unchanged. When a map holds both a key and its renamed form,
 * the value of the key being renamed wins.
 */
public final class TxOptions {
  public static final String ISOLATION = "isolation";
  public static final String READ_ONLY = "read-only";
  public static final String ROLLBACK_ONLY = "rollback-only";

  public static final String ISOLATION_LEVEL = "isolation-level";
  public static final String READ_ONLY_FLAG = "read-only?";
  public static final String ROLLBACK_FLAG = "rollback?";

  private static final Map<String, String> RENAMES = Map.of(
      ISOLATION, ISOLATION_LEVEL,
      READ_ONLY, READ_ONLY_FLAG,
      ROLLBACK_ONLY, ROLLBACK_FLAG);

  private static final Map<String, String> REVERSE = Map.of(
      ISOLATION_LEVEL, ISOLATION,
      READ_ONLY_FLAG, READ_ONLY,
      ROLLBACK_FLAG, ROLLBACK_ONLY);

  /** Renames caller keys to primitive keys; {@code null} yields an empty map. */
  public static Map<String, Object> remap(Map<String, ?> options) {
    return rename(options, RENAMES);
  }

  /** Inverse of {@link #remap(Map)}. */
  public static Map<String, Object> restore(Map<String, ?> options) {
    return rename(options, REVERSE);
  }

  private static Map<String, Object> rename(Map<String, ?> options, Map<String, String> table) {
    Map<String, Object> renamed = new LinkedHashMap<>();
    if (options == null) {
      return renamed;
    }
    for (Map.Entry<String, ?> entry : options.entrySet()) {
      if (!table.containsKey(entry.getKey())) {
        renamed.put(entry.getKey(), entry.getValue());
      }
    }
    // renamed keys overwrite a target key the caller also passed
    for (Map.Entry<String, ?> entry : options.entrySet()) {
      if (table.containsKey(entry.getKey())) {
        renamed.put(table.get(entry.getKey()), entry.getValue());
      }
    }
    return renamed;
  }

  private TxOptions() {
  }
}
