package dotfmt;

import clojure.lang.IPersistentVector;
import clojure.lang.ITransientCollection;
import clojure.lang.ITransientMap;
import clojure.lang.PersistentArrayMap;
import clojure.lang.PersistentVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Objects;
import java.util.function.Consumer;

import static dotfmt.Keywords.BROKEN;
import static dotfmt.Keywords.COND;
import static dotfmt.Keywords.MAX_COLUMN;
import static dotfmt.Keywords.WIDTH;

/**
 * Document to lay out. Built by chaining {@link #text}, {@link #space},
 * {@link #breakLines}, {@link #group} and {@link #indent} (plus their
 * conditional variants), then rendered once with {@link #render}.
 *
 * <p>The node tree is stored flattened: every composite node is followed by
 * its descendants and records their count as its span. Measuring and laying
 * out mutate the nodes in place, so a rendered document can not be rendered
 * again. Use {@link #copy()} to render a document more than once.
 */
public final class Document {
  private static final Logger LOG = LoggerFactory.getLogger(Document.class);

  public static Document create(int maxColumn) {
    if (maxColumn <= 0) {
      throw new IllegalArgumentException("maxColumn must be positive: " + maxColumn);
    }
    return new Document(maxColumn, new ArrayList<>());
  }

  private final int _maxColumn;
  private final ArrayList<Node> _nodes;
  private boolean _rendered;

  private Document(int maxColumn, ArrayList<Node> nodes) {
    _maxColumn = maxColumn;
    _nodes = nodes;
  }

  public int maxColumn() {
    return _maxColumn;
  }

  public int size() {
    return _nodes.size();
  }

  public boolean isRendered() {
    return _rendered;
  }

  /**
   * Independent copy with reset measure caches. Can be taken before or after
   * this document is rendered.
   */
  public Document copy() {
    ArrayList<Node> nodes = new ArrayList<>(_nodes.size());
    for (Node node : _nodes) {
      nodes.add(node.copy());
    }
    return new Document(_maxColumn, nodes);
  }

  //
  // Construction
  //

  public Document text(String content) {
    return textIf(content, Condition.ALWAYS);
  }

  public Document textIf(String content, Condition cond) {
    Objects.requireNonNull(content, "content");
    return append(new TextTag(content), cond, null);
  }

  public Document space() {
    return spaceIf(Condition.ALWAYS);
  }

  public Document spaceIf(Condition cond) {
    Objects.requireNonNull(cond, "cond");
    // a space right after a space of the same condition collapses, even
    // when the previous one closed a group or an indent
    int n = _nodes.size();
    if (n > 0) {
      Node last = _nodes.get(n - 1);
      if (last.tag == SpaceTag.INSTANCE && last.cond == cond) {
        checkNotRendered();
        return this;
      }
    }
    return append(SpaceTag.INSTANCE, cond, null);
  }

  public Document breakLines(int count) {
    return breakLinesIf(count, Condition.ALWAYS);
  }

  public Document breakLinesIf(int count, Condition cond) {
    return append(new BreakTag(count), cond, null);
  }

  /**
   * Content added by {@code body} is rendered on one line if it fits into
   * the remaining columns, otherwise the group breaks.
   */
  public Document group(Consumer<Document> body) {
    Objects.requireNonNull(body, "body");
    return append(GroupTag.INSTANCE, Condition.ALWAYS, body);
  }

  /**
   * Shifts the indentation of lines started by breaks within {@code body}.
   * Each column renders as one tab; {@code columns} may be negative.
   */
  public Document indent(int columns, Consumer<Document> body) {
    Objects.requireNonNull(body, "body");
    return append(new IndentTag(columns), Condition.ALWAYS, body);
  }

  private Document append(Tag tag, Condition cond, Consumer<Document> body) {
    Objects.requireNonNull(cond, "cond");
    checkNotRendered();
    int i = _nodes.size();
    Node node = new Node(tag, cond);
    _nodes.add(node);
    if (body != null) {
      body.accept(this);
      node.span = _nodes.size() - i - 1;
    }
    return this;
  }

  private void checkNotRendered() {
    if (_rendered) {
      throw new IllegalStateException("Document was already rendered, use copy() to render it again");
    }
  }

  //
  // Traversal
  //

  Node node(int i) {
    return _nodes.get(i);
  }

  /**
   * Index after the subtree rooted at node {@code i}, which must end
   * within {@code limit}.
   */
  int skip(int i, int limit) {
    int end = i + 1 + _nodes.get(i).span;
    if (end > limit) {
      throw new LayoutException("Span of " + _nodes.get(i) + " exceeds its parent ending at " + limit, i);
    }
    return end;
  }

  //
  // Rendering
  //

  /**
   * Measures, lays out and writes the document to {@code out}. The first
   * failing write aborts rendering and leaves partial output behind.
   */
  public void render(Appendable out, Format format) throws IOException {
    Objects.requireNonNull(out, "out");
    Objects.requireNonNull(format, "format");
    checkNotRendered();
    _rendered = true;
    LOG.debug("Rendering {} nodes as {} with max column {}", _nodes.size(), format.label, _maxColumn);
    switch (format) {
      case DEFAULT:
        Measurer.measure(this);
        new Layouter(this).layout();
        new Renderer(this, out).render();
        break;
      case LAYOUT:
        Measurer.measure(this);
        new Layouter(this).layout();
        new LayoutPrinter(this, out).print();
        break;
      case SOURCE:
        new SourcePrinter(this, out).print();
        break;
      default:
        throw new IllegalArgumentException("Unsupported format: " + format);
    }
  }

  /**
   * Renders a copy of this document in the default format.
   */
  public String format() {
    StringBuilder sb = new StringBuilder();
    try {
      copy().render(sb, Format.DEFAULT);
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return sb.toString();
  }

  /**
   * Node structure in the {@link Format#LAYOUT} markup, showing the measure
   * caches as they currently are. Runs none of the layout passes.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    try {
      new LayoutPrinter(this, sb).print();
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return sb.toString();
  }

  /**
   * Java source that rebuilds this document, as rendered with
   * {@link Format#SOURCE}.
   */
  public String toSource() {
    StringBuilder sb = new StringBuilder();
    try {
      new SourcePrinter(this, sb).print();
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return sb.toString();
  }

  //
  // Inspection
  //

  /**
   * Document as Clojure data: {@code [:document {:max-column n} & nodes]}
   * where each node is {@code [kind props & children]}.
   */
  public IPersistentVector inspect() {
    ITransientCollection out = ((ITransientCollection) PersistentVector.EMPTY.asTransient())
        .conj(Keywords.DOCUMENT)
        .conj(PersistentArrayMap.EMPTY.assoc(MAX_COLUMN, _maxColumn));
    return (IPersistentVector) inspectRange(out, 0, _nodes.size()).persistent();
  }

  private ITransientCollection inspectRange(ITransientCollection out, int from, int to) {
    for (int i = from; i < to; ) {
      int end = skip(i, to);
      out = out.conj(inspectNode(i, end));
      i = end;
    }
    return out;
  }

  private IPersistentVector inspectNode(int i, int end) {
    Node node = _nodes.get(i);
    ITransientMap props = PersistentArrayMap.EMPTY.asTransient();
    if (node.cond != Condition.ALWAYS) {
      props = props.assoc(COND, node.cond.keyword);
    }
    props = node.tag.inspectProps(props);
    if (Measure.isBroken(node.bits)) {
      props = props.assoc(BROKEN, true);
    } else {
      props = props.assoc(WIDTH, Measure.width(node.bits));
    }
    ITransientCollection vec = ((ITransientCollection) PersistentVector.EMPTY.asTransient())
        .conj(node.tag.kind())
        .conj(props.persistent());
    return (IPersistentVector) inspectRange(vec, i + 1, end).persistent();
  }
}
