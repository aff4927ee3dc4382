package dotfmt;

/**
 * Computes the flat width of every node, bottom-up. Context free: nothing
 * here depends on the column a node ends up at.
 */
final class Measurer {

  private Measurer() {
  }

  static void measure(Document doc) {
    for (int i = 0, n = doc.size(); i < n; i++) {
      Node node = doc.node(i);
      // content that only renders when broken does not take up flat width
      node.bits = node.cond == Condition.BROKEN ? Measure.EMPTY : node.tag.localBits();
    }
    fold(doc, 0, doc.size());
  }

  private static long fold(Document doc, int from, int to) {
    long acc = Measure.EMPTY;
    for (int i = from; i < to; ) {
      Node node = doc.node(i);
      int end = doc.skip(i, to);
      if (end > i + 1) {
        node.bits = Measure.add(node.bits, fold(doc, i + 1, end));
      }
      acc = Measure.add(acc, node.bits);
      i = end;
    }
    return acc;
  }
}
