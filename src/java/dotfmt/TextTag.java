package dotfmt;

import clojure.lang.ITransientMap;
import clojure.lang.Keyword;

import static dotfmt.Keywords.CONTENT;

public final class TextTag extends Tag {
  public final String content;
  public final int width;

  public TextTag(String content) {
    this.content = content;
    this.width = content.codePointCount(0, content.length());
  }

  @Override
  public Keyword kind() {
    return Keywords.TEXT;
  }

  @Override
  public long localBits() {
    return Measure.ofWidth(width);
  }

  @Override
  public ITransientMap inspectProps(ITransientMap props) {
    return props.assoc(CONTENT, content);
  }

  @Override
  public String toString() {
    return "Text(" + Util.quote(content) + ")";
  }
}
