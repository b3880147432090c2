package sqlgate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable option map passed to the execution primitives.
 *
 * <p>Built from the caller's options, then extended with internal entries via
 * {@link #with(String, Object)}. A later {@code with} replaces an earlier value
 * for the same key, so entries set by sqlgate ({@link #PARAMS},
 * {@link #FIRST_ROW_ONLY}) take precedence over caller input.
 */
public final class ExecuteOptions {
  /** Positional parameter values, a {@link List}. */
  public static final String PARAMS = "params";
  /** {@code true} to fetch only the first row. */
  public static final String FIRST_ROW_ONLY = "first-row-only";
  /** JDBC fetch size hint. */
  public static final String FETCH_SIZE = "fetch-size";
  /** Upper bound on rows returned. */
  public static final String MAX_ROWS = "max-rows";
  /** Statement timeout in seconds. */
  public static final String QUERY_TIMEOUT = "query-timeout";

  private static final ExecuteOptions EMPTY = new ExecuteOptions(Map.of());

  private final Map<String, Object> values;

  private ExecuteOptions(Map<String, Object> values) {
    this.values = values;
  }

  public static ExecuteOptions empty() {
    return EMPTY;
  }

  /** Copies the caller's options; {@code null} means no options. */
  public static ExecuteOptions of(Map<String, ?> options) {
    if (options == null || options.isEmpty()) {
      return EMPTY;
    }
    return new ExecuteOptions(Collections.unmodifiableMap(new LinkedHashMap<>(options)));
  }

  /** Returns a copy with {@code key} set to {@code value}. */
  public ExecuteOptions with(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(key, value);
    return new ExecuteOptions(Collections.unmodifiableMap(copy));
  }

  public Object get(String key) {
    return values.get(key);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Positional parameters, empty when none were given. */
  public List<Object> params() {
    Object params = values.get(PARAMS);
    if (params == null) {
      return List.of();
    }
    if (params instanceof List<?> list) {
      return Collections.unmodifiableList(new ArrayList<>(list));
    }
    throw new IllegalArgumentException(PARAMS + " must be a List, got " + params.getClass().getName());
  }

  public boolean firstRowOnly() {
    return Boolean.TRUE.equals(values.get(FIRST_ROW_ONLY));
  }

  /**
   * Reads an integer option.
   *
   * @throws IllegalArgumentException if the value is present but not a number
   *                                  in {@code int} range
   */
  public int intOption(String key, int defaultValue) {
    Object value = values.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n && n.longValue() == n.intValue()) {
      return n.intValue();
    }
    throw new IllegalArgumentException(key + " must be an int, got " + value);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "ExecuteOptions" + values;
  }
}
