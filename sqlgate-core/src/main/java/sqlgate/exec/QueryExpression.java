package sqlgate.exec;

import sqlgate.InvalidExpressionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An executable form followed by its positional parameters, as in
 * {@code ["select ? as x", 42]}.
 *
 * <p>Parameter order is kept as given; the n-th parameter binds to the n-th
 * placeholder. {@code null} parameters are allowed.
 */
public final class QueryExpression {
  private final Object executable;
  private final List<Object> params;

  private QueryExpression(Object executable, List<Object> params) {
    this.executable = executable;
    this.params = params;
  }

  /**
   * Splits a SQL vector into its first element and the remaining parameters.
   *
   * @throws InvalidExpressionException if the vector is {@code null} or empty
   */
  public static QueryExpression of(List<?> sqlVector) {
    if (sqlVector == null || sqlVector.isEmpty()) {
      throw new InvalidExpressionException("SQL vector must contain an executable expression");
    }
    List<Object> params = new ArrayList<>(sqlVector.subList(1, sqlVector.size()));
    return new QueryExpression(sqlVector.get(0), Collections.unmodifiableList(params));
  }

  public static QueryExpression of(Object executable, Object... params) {
    List<Object> vector = new ArrayList<>(params.length + 1);
    vector.add(executable);
    vector.addAll(Arrays.asList(params));
    return of(vector);
  }

  public Object executable() {
    return executable;
  }

  public List<Object> params() {
    return params;
  }

  @Override
  public String toString() {
    return "[" + executable + (params.isEmpty() ? "" : ", " + params) + "]";
  }
}
