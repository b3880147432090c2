package sqlgate;

/**
 * Thrown when the executable part of a query expression is neither SQL text
 * nor a {@link java.sql.PreparedStatement}.
 */
public final class InvalidExpressionException extends SqlGateException {
  private final transient Object expression;

  public InvalidExpressionException(Object expression) {
    super("Wrong execute expression: "
        + (expression == null ? "null" : UnsupportedSourceException.describe(expression)));
    this.expression = expression;
  }

  public InvalidExpressionException(String message) {
    super(message);
    this.expression = null;
  }

  /** The rejected value, or {@code null} when the expression was missing. */
  public Object getExpression() {
    return expression;
  }
}
