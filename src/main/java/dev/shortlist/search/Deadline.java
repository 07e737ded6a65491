package dev.shortlist.search;

import java.time.Duration;

/** Time budget of a single retrieval call, measured on the monotonic clock. */
public final class Deadline {

  private static final Deadline NONE = new Deadline(0L, true);

  private final long expiresAtNanos;
  private final boolean unbounded;

  private Deadline(long expiresAtNanos, boolean unbounded) {
    this.expiresAtNanos = expiresAtNanos;
    this.unbounded = unbounded;
  }

  public static Deadline after(Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new InvalidConfigException("timeout must be positive, got: " + timeout);
    }
    return new Deadline(System.nanoTime() + timeout.toNanos(), false);
  }

  public static Deadline none() {
    return NONE;
  }

  public boolean isUnbounded() {
    return unbounded;
  }

  /** Nanoseconds left before expiry, never negative. Meaningless when unbounded. */
  public long remainingNanos() {
    if (unbounded) {
      return Long.MAX_VALUE;
    }
    return Math.max(0L, expiresAtNanos - System.nanoTime());
  }
}
