package dotfmt;

/**
 * Signals a corrupted document or arithmetic that left the int range.
 * Never caused by the content being formatted.
 */
public class LayoutException extends RuntimeException {
  public final int nodeIndex;

  public LayoutException(String msg) {
    this(msg, -1);
  }

  public LayoutException(String msg, int nodeIndex) {
    super(nodeIndex >= 0 ? msg + " (node " + nodeIndex + ")" : msg, null, false, false);
    this.nodeIndex = nodeIndex;
  }
}
