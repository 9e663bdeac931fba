package cafe.woden.ircwire.tags;

/**
 * IRCv3 message-tag value escaping.
 *
 * <p>Encoding replaces {@code ;}, space, {@code \}, CR and LF with {@code \:}, {@code \s},
 * {@code \\}, {@code \r} and {@code \n}. Decoding reverses that table in a single pass; an unknown
 * escape {@code \X} keeps {@code X} and a lone trailing backslash is dropped. Neither direction
 * fails.
 */
public final class TagValueCodec {

  private TagValueCodec() {}

  public static String encode(String raw) {
    if (raw == null || raw.isEmpty()) return "";
    if (!needsEscaping(raw)) return raw;

    StringBuilder sb = new StringBuilder(raw.length() + 8);
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      switch (c) {
        case ';' -> sb.append("\\:");
        case ' ' -> sb.append("\\s");
        case '\\' -> sb.append("\\\\");
        case '\r' -> sb.append("\\r");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  public static String decode(String escaped) {
    if (escaped == null || escaped.isEmpty()) return "";
    if (escaped.indexOf('\\') < 0) return escaped;

    StringBuilder sb = new StringBuilder(escaped.length());
    for (int i = 0; i < escaped.length(); i++) {
      char c = escaped.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      // lone trailing backslash
      if (i + 1 >= escaped.length()) break;
      char n = escaped.charAt(++i);
      switch (n) {
        case ':' -> sb.append(';');
        case 's' -> sb.append(' ');
        case 'r' -> sb.append('\r');
        case 'n' -> sb.append('\n');
        case '\\' -> sb.append('\\');
        default -> sb.append(n);
      }
    }
    return sb.toString();
  }

  private static boolean needsEscaping(String raw) {
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == ';' || c == ' ' || c == '\\' || c == '\r' || c == '\n') return true;
    }
    return false;
  }
}
