package dotfmt;

import java.util.Arrays;

public class Util {
  /**
   * Adds two ints, failing with {@link LayoutException} instead of
   * wrapping around.
   */
  public static int safeAdd(int a, int b) {
    if (b > 0 && a > Integer.MAX_VALUE - b) {
      throw new LayoutException("overflow adding " + b + " to " + a);
    }
    if (b < 0 && a < Integer.MIN_VALUE - b) {
      throw new LayoutException("underflow adding " + b + " to " + a);
    }
    return a + b;
  }

  public static String tabs(int count) {
    if (count <= 0) {
      return "";
    }
    char[] chars = new char[count];
    Arrays.fill(chars, '\t');
    return String.valueOf(chars);
  }

  /**
   * Double quoted string literal, escaped so it is valid Java source.
   */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0, n = s.length(); i < n; i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        default:
          if (ch < 0x20 || ch == 0x7f) {
            sb.append(String.format("\\u%04x", (int) ch));
          } else {
            sb.append(ch);
          }
      }
    }
    sb.append('"');
    return sb.toString();
  }
}
