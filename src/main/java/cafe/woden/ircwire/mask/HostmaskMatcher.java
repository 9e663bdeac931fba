package cafe.woden.ircwire.mask;

import cafe.woden.ircwire.casemap.CaseMapping;
import java.util.Collection;
import java.util.Objects;

/**
 * Ban/exception mask matching against {@code nick!user@host} strings.
 *
 * <p>Patterns support {@code *} (any run, including empty) and {@code ?} (exactly one character),
 * anchored at both ends. Both sides are casefolded under the network's mapping before matching.
 * There is no escaping and no character classes.
 */
public final class HostmaskMatcher {

  private HostmaskMatcher() {}

  public static boolean matches(String candidate, String pattern, CaseMapping mapping) {
    Objects.requireNonNull(mapping, "mapping");
    String txt = mapping.fold(Objects.toString(candidate, ""));
    String ptn = mapping.fold(Objects.toString(pattern, ""));
    return globMatches(ptn, txt);
  }

  public static boolean matchesAny(
      String candidate, Collection<String> patterns, CaseMapping mapping) {
    if (patterns == null || patterns.isEmpty()) return false;
    for (String p : patterns) {
      if (p == null) continue;
      if (matches(candidate, p, mapping)) return true;
    }
    return false;
  }

  /**
   * Two-pointer glob match with single-star backtracking. On mismatch the most recent {@code *} is
   * extended by one character, which is sufficient for any number of stars.
   */
  static boolean globMatches(String ptn, String txt) {
    int p = 0;
    int t = 0;
    int starIdx = -1;
    int match = 0;

    while (t < txt.length()) {
      // '*' must win over a literal match so a '*' in the candidate stays wild.
      if (p < ptn.length() && ptn.charAt(p) == '*') {
        starIdx = p;
        match = t;
        p++;
      } else if (p < ptn.length() && (ptn.charAt(p) == '?' || ptn.charAt(p) == txt.charAt(t))) {
        p++;
        t++;
      } else if (starIdx != -1) {
        p = starIdx + 1;
        match++;
        t = match;
      } else {
        return false;
      }
    }

    while (p < ptn.length() && ptn.charAt(p) == '*') p++;
    return p == ptn.length();
  }
}
