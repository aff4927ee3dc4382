package dotfmt;

/**
 * Entry of the flattened node array. {@code span} is the number of
 * descendants stored directly after the node; {@code bits} is the mutable
 * measure cache (see {@link Measure}).
 */
public final class Node {
  public final Tag tag;
  public final Condition cond;
  int span;
  long bits;

  Node(Tag tag, Condition cond) {
    this.tag = tag;
    this.cond = cond;
  }

  Node copy() {
    Node copy = new Node(tag, cond);
    copy.span = span;
    return copy;
  }

  public int span() {
    return span;
  }

  public long bits() {
    return bits;
  }

  @Override
  public String toString() {
    return "Node{tag=" + tag + ", span=" + span + ", cond=" + cond.label
        + ", measure=" + Measure.toString(bits) + "}";
  }
}
