package dotfmt;

import clojure.lang.ITransientMap;
import clojure.lang.Keyword;

import static dotfmt.Keywords.COLUMNS;

public final class IndentTag extends Tag {
  public final int columns;

  public IndentTag(int columns) {
    this.columns = columns;
  }

  @Override
  public Keyword kind() {
    return Keywords.INDENT;
  }

  @Override
  public long localBits() {
    return Measure.EMPTY;
  }

  @Override
  public ITransientMap inspectProps(ITransientMap props) {
    return props.assoc(COLUMNS, columns);
  }

  @Override
  public String toString() {
    return "Indent(" + columns + ")";
  }
}
