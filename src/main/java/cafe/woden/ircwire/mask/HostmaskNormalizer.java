package cafe.woden.ircwire.mask;

import java.util.Locale;
import java.util.Objects;

/** Widens partial user input into a full {@code nick!user@host} pattern. */
public final class HostmaskNormalizer {

  private HostmaskNormalizer() {}

  /**
   * Normalize a user-provided mask, nick, {@code user@host} or host into a hostmask pattern.
   *
   * <p>{@code "BadNick"} becomes {@code "BadNick!*@*"}, {@code "ident@host"} becomes
   * {@code "*!ident@host"} and {@code "some.host"} becomes {@code "*!*@some.host"}. Whitespace is
   * removed; blank input yields an empty string.
   */
  public static String toHostmaskPattern(String raw) {
    String s = Objects.toString(raw, "").replaceAll("\\s+", "");
    if (s.isEmpty()) return "";

    if (s.indexOf('!') >= 0 && s.indexOf('@') >= 0) return s.startsWith("!") ? "*" + s : s;

    if (s.indexOf('@') >= 0) return "*!" + s;

    // nick!user without a host
    if (s.indexOf('!') >= 0) {
      if (s.startsWith("!")) s = "*" + s;
      return s + "@*";
    }

    if (looksLikeHost(s)) return "*!*@" + s;

    return s + "!*@*";
  }

  private static boolean looksLikeHost(String s) {
    String lower = s.toLowerCase(Locale.ROOT);
    return lower.contains(".") || lower.contains(":") || lower.endsWith("/");
  }
}
