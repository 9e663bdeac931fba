package cafe.woden.ircwire.casemap;

import java.util.Locale;
import java.util.Optional;

/**
 * Network casemapping rules, as announced by the {@code CASEMAPPING} ISUPPORT token.
 *
 * <p>Every mapping folds ASCII {@code A-Z} to {@code a-z}. {@link #RFC1459} additionally folds
 * {@code [ ] \ ~} to {@code { } | ^}; {@link #RFC1459_STRICT} folds the same set minus {@code ~}.
 * Two identifiers are the same nickname or channel when their folded forms are equal.
 */
public enum CaseMapping {
  ASCII("ascii", false, false),
  RFC1459("rfc1459", true, true),
  RFC1459_STRICT("rfc1459-strict", true, false);

  private final String token;
  private final boolean foldsBrackets;
  private final boolean foldsTilde;

  CaseMapping(String token, boolean foldsBrackets, boolean foldsTilde) {
    this.token = token;
    this.foldsBrackets = foldsBrackets;
    this.foldsTilde = foldsTilde;
  }

  /** The ISUPPORT token for this mapping. */
  public String token() {
    return token;
  }

  public String fold(String text) {
    if (text == null || text.isEmpty()) return "";

    StringBuilder sb = null;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      char f = foldChar(c);
      if (f != c && sb == null) {
        sb = new StringBuilder(text.length());
        sb.append(text, 0, i);
      }
      if (sb != null) sb.append(f);
    }
    return sb == null ? text : sb.toString();
  }

  public char foldChar(char c) {
    if (c >= 'A' && c <= 'Z') return (char) (c + ('a' - 'A'));
    if (foldsBrackets) {
      switch (c) {
        case '[':
          return '{';
        case ']':
          return '}';
        case '\\':
          return '|';
        default:
          break;
      }
    }
    if (foldsTilde && c == '~') return '^';
    return c;
  }

  /** Identity comparison under this mapping. Null is only equal to null. */
  public boolean equalsIgnoreCase(String a, String b) {
    if (a == null || b == null) return a == b;
    if (a.length() != b.length()) return false;
    for (int i = 0; i < a.length(); i++) {
      if (foldChar(a.charAt(i)) != foldChar(b.charAt(i))) return false;
    }
    return true;
  }

  /**
   * Resolve an ISUPPORT {@code CASEMAPPING} value. {@code strict-rfc1459} is accepted as an alias of
   * {@code rfc1459-strict}.
   */
  public static Optional<CaseMapping> fromToken(String token) {
    if (token == null) return Optional.empty();
    String t = token.trim().toLowerCase(Locale.ROOT);
    if (t.isEmpty()) return Optional.empty();
    if ("strict-rfc1459".equals(t)) return Optional.of(RFC1459_STRICT);
    for (CaseMapping m : values()) {
      if (m.token.equals(t)) return Optional.of(m);
    }
    return Optional.empty();
  }
}
