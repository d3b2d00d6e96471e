package eventstore.model;

/**
 * Seed for a new durable cursor. Values are "last seen" markers: delivery starts with the
 * first event strictly after them. Ignored when the cursor already exists.
 *
 * @param position      last seen global position ({@code 0} = from the beginning)
 * @param streamVersion last seen stream version, single-stream scopes only
 */
public record StartFrom(long position, long streamVersion) {
  private static final StartFrom BEGINNING = new StartFrom(0L, 0L);

  public StartFrom {
    if (position < 0 || streamVersion < 0) {
      throw new IllegalArgumentException("start markers must be >= 0");
    }
  }

  public static StartFrom beginning() {
    return BEGINNING;
  }

  public static StartFrom position(long position) {
    return new StartFrom(position, 0L);
  }

  public static StartFrom of(long position, long streamVersion) {
    return new StartFrom(position, streamVersion);
  }
}
