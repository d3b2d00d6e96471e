package eventstore;

/**
 * Special values for the {@code expectedVersion} argument of an append.
 *
 * <p>Any non-negative value is a concrete version check: the append succeeds only if the
 * stream's current version equals it.
 */
public final class ExpectedVersion {

  /** Skip the concurrency check; the stream is created if missing. */
  public static final long ANY = -1L;

  /** The stream must not exist yet (or contain no events); it is created on append. */
  public static final long NO_STREAM = 0L;

  private ExpectedVersion() {}
}
