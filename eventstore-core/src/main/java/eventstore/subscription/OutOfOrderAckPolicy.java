package eventstore.subscription;

/**
 * What a running subscription does with an acknowledgment behind its current cursor.
 */
public enum OutOfOrderAckPolicy {
  /** Throw {@link eventstore.OutOfOrderAckException}; the cursor is unchanged. */
  REJECT,
  /** Drop the acknowledgment silently; the cursor is unchanged. */
  IGNORE
}
