package dotfmt;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Output representation used by {@link Document#render}.
 */
public enum Format {
  /** The formatted text. */
  DEFAULT("default"),
  /**
   * Node structure as HTML-like markup including nodes that do not render,
   * annotated with measured widths and break decisions.
   */
  LAYOUT("layout"),
  /** A standalone Java class that rebuilds the document and renders it. */
  SOURCE("source");

  public final String label;

  Format(String label) {
    this.label = label;
  }

  public static Format fromName(String name) {
    for (Format format : values()) {
      if (format.label.equals(name)) {
        return format;
      }
    }
    String valid = Arrays.stream(values())
        .map(f -> "\"" + f.label + "\"")
        .collect(Collectors.joining(", "));
    throw new IllegalArgumentException("Invalid format: \"" + name + "\", valid ones are: " + valid);
  }
}
