/**
 * Dispatch of query expressions to the execution primitives.
 *
 * <p>{@link sqlgate.exec.ExecutionDispatcher} picks the text or prepared
 * statement path for a {@link sqlgate.exec.QueryExpression} and merges the
 * caller's options with the internal {@code params} and {@code first-row-only}
 * entries.
 */
package sqlgate.exec;
