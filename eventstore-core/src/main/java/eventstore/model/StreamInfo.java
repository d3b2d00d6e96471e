package eventstore.model;

/**
 * Identity and current version of a stream. {@code version} equals the number of events
 * appended to the stream so far.
 */
public record StreamInfo(String streamId, long internalId, long version) {}
