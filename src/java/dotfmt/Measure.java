package dotfmt;

/**
 * Measure cache of a node packed into a single long.
 *
 * <p>A space is trailing if no content follows it before the end of its
 * sequence or a break, so spaces are counted lazily: {@code pendingSpace}
 * marks a space that becomes one column of width only once content follows.
 * Width is meaningless while the broken bit is set.
 */
public final class Measure {
  public static final long BROKEN_BIT = 1L << 63;
  public static final long PENDING_SPACE_BIT = 1L << 62;
  public static final long WIDTH_MASK = 0xFFFFFFFFL;

  public static final long EMPTY = 0L;
  public static final long BROKEN = BROKEN_BIT;
  public static final long PENDING_SPACE = PENDING_SPACE_BIT;

  private Measure() {
  }

  public static long toBits(int width, boolean broken, boolean pendingSpace) {
    assert width >= 0;
    return (broken ? BROKEN_BIT : 0)
        | (pendingSpace ? PENDING_SPACE_BIT : 0)
        | (width & WIDTH_MASK);
  }

  public static boolean isBroken(long bits) {
    return (bits & BROKEN_BIT) != 0;
  }

  public static boolean hasPendingSpace(long bits) {
    return (bits & PENDING_SPACE_BIT) != 0;
  }

  public static int width(long bits) {
    return (int) (bits & WIDTH_MASK);
  }

  public static long ofWidth(int width) {
    return toBits(width, false, false);
  }

  /**
   * Folds {@code child} into the accumulated measure of the siblings
   * preceding it.
   */
  public static long add(long acc, long child) {
    if (isBroken(acc) || isBroken(child)) {
      return toBits(width(acc), true, false);
    }
    int width = width(acc);
    boolean pendingSpace = hasPendingSpace(acc);
    if (width(child) > 0 || hasPendingSpace(child)) {
      if (pendingSpace) {
        width = Util.safeAdd(width, 1);
      }
      pendingSpace = hasPendingSpace(child);
    }
    return toBits(Util.safeAdd(width, width(child)), false, pendingSpace);
  }

  public static String toString(long bits) {
    return isBroken(bits) ? "broken" : String.valueOf(width(bits));
  }
}
