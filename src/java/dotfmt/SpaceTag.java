package dotfmt;

import clojure.lang.Keyword;

public final class SpaceTag extends Tag {
  public static final SpaceTag INSTANCE = new SpaceTag();

  private SpaceTag() {
  }

  @Override
  public Keyword kind() {
    return Keywords.SPACE;
  }

  @Override
  public long localBits() {
    return Measure.PENDING_SPACE;
  }

  @Override
  public String toString() {
    return "Space";
  }
}
