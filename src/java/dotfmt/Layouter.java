package dotfmt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dotfmt.Util.safeAdd;

/**
 * Decides top-down which groups break, using the measured widths and the
 * column budget consumed by everything before them.
 */
final class Layouter {
  private static final Logger LOG = LoggerFactory.getLogger(Layouter.class);

  private final Document _doc;
  private final int _maxColumn;

  Layouter(Document doc) {
    _doc = doc;
    _maxColumn = doc.maxColumn();
  }

  void layout() {
    layout(0, _doc.size(), 0, 0);
  }

  /**
   * Lays out nodes {@code [from, to)}, all of them in a broken context, and
   * returns the column reached after the last one.
   */
  private int layout(int from, int to, int indent, int column) {
    for (int i = from; i < to; ) {
      Node node = _doc.node(i);
      int end = _doc.skip(i, to);
      if (node.cond == Condition.FLAT) {
        i = end;
        continue;
      }
      Tag tag = node.tag;
      if (tag instanceof GroupTag) {
        int width = Measure.width(node.bits);
        if (Measure.isBroken(node.bits) || safeAdd(column, width) > _maxColumn) {
          if (LOG.isTraceEnabled()) {
            LOG.trace("Breaking group at node {} (column {}, width {})", i, column, Measure.toString(node.bits));
          }
          node.bits |= Measure.BROKEN_BIT;
          column = layout(i + 1, end, indent, column);
        } else {
          column = safeAdd(column, width);
        }
      } else if (tag instanceof IndentTag) {
        column = layout(i + 1, end, safeAdd(indent, ((IndentTag) tag).columns), column);
      } else if (tag instanceof TextTag) {
        column = safeAdd(column, ((TextTag) tag).width);
      } else if (tag instanceof SpaceTag) {
        column = safeAdd(column, 1);
      } else if (tag instanceof BreakTag) {
        column = indent;
      } else {
        throw new IllegalStateException("Unknown tag: " + tag);
      }
      i = end;
    }
    return column;
  }
}
