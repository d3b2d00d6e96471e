/**
 * Storage backends kept in process memory, for tests and single-process demos.
 *
 * @see eventstore.inmemory.InMemoryEventLog
 */
package eventstore.inmemory;
