package cafe.woden.ircwire.tags;

/**
 * Lexical checks for IRCv3 tag keys.
 *
 * <p>A key is {@code ['+'] [vendor '/'] name} where {@code vendor} is a hostname-like run of
 * letters, digits, {@code -} and {@code .}, and {@code name} is letters, digits and {@code -}.
 * Keys are case-sensitive; no registry lookup is done.
 */
public final class TagKeys {

  public static final char CLIENT_ONLY_PREFIX = '+';

  private TagKeys() {}

  public static boolean isValid(String key) {
    if (key == null || key.isEmpty()) return false;

    int start = key.charAt(0) == CLIENT_ONLY_PREFIX ? 1 : 0;
    int slash = key.indexOf('/', start);
    int nameStart = start;
    if (slash >= 0) {
      if (slash == start) return false;
      for (int i = start; i < slash; i++) {
        char c = key.charAt(i);
        if (!isNameChar(c) && c != '.') return false;
      }
      nameStart = slash + 1;
    }

    if (nameStart >= key.length()) return false;
    for (int i = nameStart; i < key.length(); i++) {
      if (!isNameChar(key.charAt(i))) return false;
    }
    return true;
  }

  /** True for client-only tags such as {@code +typing} or {@code +draft/reply}. */
  public static boolean isClientOnly(String key) {
    return key != null && !key.isEmpty() && key.charAt(0) == CLIENT_ONLY_PREFIX;
  }

  /** Vendor namespace of the key, or an empty string when the key has none. */
  public static String vendor(String key) {
    if (key == null) return "";
    int start = isClientOnly(key) ? 1 : 0;
    int slash = key.indexOf('/', start);
    return slash < 0 ? "" : key.substring(start, slash);
  }

  private static boolean isNameChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-';
  }
}
