/**
 * Resolution of connection sources and scoped connection use.
 *
 * @see sqlgate.source.SourceResolver
 * @see sqlgate.source.ConnectionScope
 */
package sqlgate.source;
