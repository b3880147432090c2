package sqlgate.source;

/**
 * The ownership class of a connection source. It decides how a connection is
 * obtained and what happens to it when a scope ends.
 */
public enum SourceKind {
  /** A live connection owned by the caller: used as-is, never released. */
  CONNECTION,
  /** A pool: a connection is borrowed and must be returned. */
  POOL,
  /** A configuration: a connection is opened and must be closed. */
  CONFIGURATION
}
