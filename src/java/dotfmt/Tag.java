package dotfmt;

import clojure.lang.ITransientMap;
import clojure.lang.Keyword;

/**
 * Kind specific part of a node. Tags are immutable and shared between
 * copies of a document.
 */
public abstract class Tag {

  public abstract Keyword kind();

  /**
   * Measure of the tag on its own, before its children (if any) are
   * folded in.
   */
  public abstract long localBits();

  public ITransientMap inspectProps(ITransientMap props) {
    return props;
  }
}
