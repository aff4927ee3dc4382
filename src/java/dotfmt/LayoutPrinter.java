package dotfmt;

import java.io.IOException;

import static dotfmt.Util.quote;
import static dotfmt.Util.tabs;

/**
 * Writes the node structure as HTML-like markup, one node per line. Nodes
 * that would not render are included, together with the measure caches, to
 * show why a group did or did not break.
 */
final class LayoutPrinter {
  private final Document _doc;
  private final Appendable _out;

  LayoutPrinter(Document doc, Appendable out) {
    _doc = doc;
    _out = out;
  }

  void print() throws IOException {
    print(0, _doc.size(), 0);
  }

  private void print(int from, int to, int depth) throws IOException {
    for (int i = from; i < to; ) {
      Node node = _doc.node(i);
      int end = _doc.skip(i, to);
      Tag tag = node.tag;
      _out.append(tabs(depth));
      if (tag instanceof GroupTag) {
        _out.append("<group width=").append(Measure.toString(node.bits)).append(">\n");
        print(i + 1, end, depth + 1);
        _out.append(tabs(depth)).append("</group>\n");
      } else if (tag instanceof IndentTag) {
        _out.append("<indent columns=").append(String.valueOf(((IndentTag) tag).columns)).append(">\n");
        print(i + 1, end, depth + 1);
        _out.append(tabs(depth)).append("</indent>\n");
      } else if (tag instanceof TextTag) {
        _out.append("<text");
        appendCond(node);
        // text rendering only when broken has no flat width
        if (node.cond != Condition.BROKEN) {
          _out.append(" width=").append(Measure.toString(node.bits));
        }
        _out.append(" content=").append(quote(((TextTag) tag).content)).append("/>\n");
      } else if (tag instanceof SpaceTag) {
        _out.append("<space");
        appendCond(node);
        _out.append("/>\n");
      } else if (tag instanceof BreakTag) {
        _out.append("<break");
        appendCond(node);
        _out.append(" count=").append(String.valueOf(((BreakTag) tag).count)).append("/>\n");
      } else {
        throw new IllegalStateException("Unknown tag: " + tag);
      }
      i = end;
    }
  }

  private void appendCond(Node node) throws IOException {
    if (node.cond != Condition.ALWAYS) {
      _out.append(" cond=\"").append(node.cond.label).append('"');
    }
  }
}
