package dotfmt;

import clojure.lang.Keyword;

/**
 * Determines when a node renders, relative to the resolved state of
 * its nearest enclosing group. The document itself counts as broken.
 */
public enum Condition {
  /** Renders unconditionally. */
  ALWAYS("always"),
  /** Renders only when the enclosing group fits on one line. */
  FLAT("flat"),
  /** Renders only when the enclosing group spans multiple lines. */
  BROKEN("broken");

  public final String label;
  public final Keyword keyword;

  Condition(String label) {
    this.label = label;
    this.keyword = Keyword.intern(label);
  }

  public boolean rendersIn(boolean parentBroken) {
    switch (this) {
      case FLAT:
        return !parentBroken;
      case BROKEN:
        return parentBroken;
      default:
        return true;
    }
  }
}
