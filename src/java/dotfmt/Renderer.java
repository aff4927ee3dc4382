package dotfmt;

import java.io.IOException;

import static dotfmt.Util.safeAdd;

/**
 * Writes the laid out document as text.
 */
final class Renderer {
  private final Document _doc;
  private final Appendable _out;
  private int _indent;
  // written only once known not to be trailing
  private boolean _pendingSpace;
  // newlines since the last text, consecutive breaks merge into the longest one
  private int _writtenNewlines;

  Renderer(Document doc, Appendable out) {
    _doc = doc;
    _out = out;
  }

  void render() throws IOException {
    render(0, _doc.size(), true);
  }

  private void render(int from, int to, boolean parentBroken) throws IOException {
    for (int i = from; i < to; ) {
      Node node = _doc.node(i);
      int end = _doc.skip(i, to);
      if (node.cond.rendersIn(parentBroken)) {
        Tag tag = node.tag;
        if (tag instanceof GroupTag) {
          render(i + 1, end, Measure.isBroken(node.bits));
        } else if (tag instanceof IndentTag) {
          int columns = ((IndentTag) tag).columns;
          _indent = safeAdd(_indent, columns);
          render(i + 1, end, parentBroken);
          _indent -= columns;
        } else if (tag instanceof TextTag) {
          writeText(((TextTag) tag).content);
        } else if (tag instanceof SpaceTag) {
          _pendingSpace = true;
        } else if (tag instanceof BreakTag) {
          _pendingSpace = false;
          for (int count = ((BreakTag) tag).count; _writtenNewlines < count; _writtenNewlines++) {
            _out.append('\n');
          }
        } else {
          throw new IllegalStateException("Unknown tag: " + tag);
        }
      }
      i = end;
    }
  }

  private void writeText(String content) throws IOException {
    if (_pendingSpace) {
      _out.append(' ');
      _pendingSpace = false;
    }
    if (_writtenNewlines > 0) {
      for (int i = _indent; i > 0; i--) {
        _out.append('\t');
      }
    }
    _out.append(content);
    _writtenNewlines = 0;
  }
}
