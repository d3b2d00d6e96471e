/**
 * Extension point for additional databases.
 */
package eventstore.jdbc.spi;
