package dotfmt;

import clojure.lang.Keyword;

public final class GroupTag extends Tag {
  public static final GroupTag INSTANCE = new GroupTag();

  private GroupTag() {
  }

  @Override
  public Keyword kind() {
    return Keywords.GROUP;
  }

  @Override
  public long localBits() {
    return Measure.EMPTY;
  }

  @Override
  public String toString() {
    return "Group";
  }
}
