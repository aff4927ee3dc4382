package dotfmt;

import clojure.lang.Keyword;

public interface Keywords {
  /** Node kinds **/
  Keyword DOCUMENT = Keyword.intern("document");
  Keyword TEXT = Keyword.intern("text");
  Keyword SPACE = Keyword.intern("space");
  Keyword BREAK = Keyword.intern("break");
  Keyword GROUP = Keyword.intern("group");
  Keyword INDENT = Keyword.intern("indent");

  /** Inspection props **/
  Keyword COND = Keyword.intern("cond");
  Keyword CONTENT = Keyword.intern("content");
  Keyword COUNT = Keyword.intern("count");
  Keyword COLUMNS = Keyword.intern("columns");
  Keyword WIDTH = Keyword.intern("width");
  Keyword BROKEN = Keyword.intern("broken");
  Keyword MAX_COLUMN = Keyword.intern("max-column");
}
