package dotfmt;

import clojure.lang.ITransientMap;
import clojure.lang.Keyword;

import static dotfmt.Keywords.COUNT;

public final class BreakTag extends Tag {
  public final int count;

  public BreakTag(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("Break count must be positive: " + count);
    }
    this.count = count;
  }

  @Override
  public Keyword kind() {
    return Keywords.BREAK;
  }

  @Override
  public long localBits() {
    return Measure.BROKEN;
  }

  @Override
  public ITransientMap inspectProps(ITransientMap props) {
    return props.assoc(COUNT, count);
  }

  @Override
  public String toString() {
    return "Break(" + count + ")";
  }
}
