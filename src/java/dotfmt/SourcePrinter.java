package dotfmt;

import java.io.IOException;

import static dotfmt.Util.quote;

/**
 * Writes a standalone Java class, {@value #CLASS_NAME}, that rebuilds the
 * document through the construction API and prints it in the default
 * format when run.
 */
final class SourcePrinter {
  static final String CLASS_NAME = "LayoutReplay";
  private static final String STEP = "    ";

  private final Document _doc;
  private final Appendable _out;

  SourcePrinter(Document doc, Appendable out) {
    _doc = doc;
    _out = out;
  }

  void print() throws IOException {
    _out.append("import dotfmt.Condition;\n")
        .append("import dotfmt.Document;\n")
        .append("import dotfmt.Format;\n")
        .append("\n")
        .append("import java.io.IOException;\n")
        .append("\n")
        .append("public class ").append(CLASS_NAME).append(" {\n")
        .append("  public static Document document() {\n")
        .append("    return Document.create(").append(String.valueOf(_doc.maxColumn())).append(")");
    printChain(0, _doc.size(), "        ", 0);
    _out.append(";\n")
        .append("  }\n")
        .append("\n")
        .append("  public static void main(String[] args) throws IOException {\n")
        .append("    StringBuilder out = new StringBuilder();\n")
        .append("    document().render(out, Format.DEFAULT);\n")
        .append("    System.out.print(out);\n")
        .append("  }\n")
        .append("}\n");
  }

  private void printChain(int from, int to, String indent, int depth) throws IOException {
    for (int i = from; i < to; ) {
      Node node = _doc.node(i);
      int end = _doc.skip(i, to);
      Tag tag = node.tag;
      _out.append('\n').append(indent).append('.');
      if (tag instanceof GroupTag) {
        _out.append("group(");
        printBody(i, end, indent, depth);
        _out.append(')');
      } else if (tag instanceof IndentTag) {
        _out.append("indent(").append(String.valueOf(((IndentTag) tag).columns)).append(", ");
        printBody(i, end, indent, depth);
        _out.append(')');
      } else if (tag instanceof TextTag) {
        String content = quote(((TextTag) tag).content);
        if (node.cond == Condition.ALWAYS) {
          _out.append("text(").append(content).append(')');
        } else {
          _out.append("textIf(").append(content).append(", ").append(condition(node)).append(')');
        }
      } else if (tag instanceof SpaceTag) {
        if (node.cond == Condition.ALWAYS) {
          _out.append("space()");
        } else {
          _out.append("spaceIf(").append(condition(node)).append(')');
        }
      } else if (tag instanceof BreakTag) {
        String count = String.valueOf(((BreakTag) tag).count);
        if (node.cond == Condition.ALWAYS) {
          _out.append("breakLines(").append(count).append(')');
        } else {
          _out.append("breakLinesIf(").append(count).append(", ").append(condition(node)).append(')');
        }
      } else {
        throw new IllegalStateException("Unknown tag: " + tag);
      }
      i = end;
    }
  }

  private void printBody(int i, int end, String indent, int depth) throws IOException {
    // nested lambdas may not shadow the parameter of the enclosing one
    String param = depth == 0 ? "d" : "d" + depth;
    if (end == i + 1) {
      _out.append(param).append(" -> {}");
    } else {
      _out.append(param).append(" -> ").append(param);
      printChain(i + 1, end, indent + STEP, depth + 1);
    }
  }

  private static String condition(Node node) {
    return "Condition." + node.cond.name();
  }
}
