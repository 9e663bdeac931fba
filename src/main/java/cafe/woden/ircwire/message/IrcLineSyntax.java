package cafe.woden.ircwire.message;

/** Lexical predicates shared by the parser and serializer. */
final class IrcLineSyntax {

  static final char TAGS_SENTINEL = '@';
  static final char TAG_SEPARATOR = ';';
  static final char TAG_VALUE_SEPARATOR = '=';
  static final char PREFIX_SENTINEL = ':';
  static final char TRAILING_SENTINEL = ':';
  static final char SPACE = ' ';

  private IrcLineSyntax() {}

  /** One or more ASCII letters, or exactly three ASCII digits. */
  static boolean isCommand(String s) {
    if (s == null || s.isEmpty()) return false;
    if (looksNumeric(s)) return s.length() == 3;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) return false;
    }
    return true;
  }

  static boolean looksNumeric(String s) {
    if (s == null || s.isEmpty()) return false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  /** CR, LF and NUL can never appear inside a line. */
  static boolean containsLineBreakOrNul(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\r' || c == '\n' || c == '\0') return true;
    }
    return false;
  }

  static int skipSpaces(String s, int from) {
    int i = from;
    while (i < s.length() && s.charAt(i) == SPACE) i++;
    return i;
  }

  static int nextSpace(String s, int from) {
    int sp = s.indexOf(SPACE, from);
    return sp < 0 ? s.length() : sp;
  }
}
