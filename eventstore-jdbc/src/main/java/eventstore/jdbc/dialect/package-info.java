/**
 * Built-in {@link eventstore.jdbc.spi.Dialect} implementations and the {@link eventstore.jdbc.dialect.Dialects} registry.
 */
package eventstore.jdbc.dialect;
