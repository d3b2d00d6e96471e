package eventstore;

/**
 * Thrown when an acknowledgment would move a subscription cursor backwards.
 * The cursor is left unchanged.
 */
public final class OutOfOrderAckException extends EventStoreException {
  private final long currentPosition;
  private final long rejectedPosition;

  public OutOfOrderAckException(String subscription, long currentPosition, long rejectedPosition) {
    super("Out-of-order ack for " + subscription + ": cursor at " + currentPosition
        + ", ack for " + rejectedPosition);
    this.currentPosition = currentPosition;
    this.rejectedPosition = rejectedPosition;
  }

  public long currentPosition() {
    return currentPosition;
  }

  public long rejectedPosition() {
    return rejectedPosition;
  }
}
