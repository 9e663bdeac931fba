package cafe.woden.ircwire.message;

import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * The source of a message: {@code nick[!user][@host]}, or a bare server name held in {@link #nick}.
 *
 * <p>{@code user} and {@code host} are absent when the prefix had no {@code !} or {@code @}
 * respectively; an empty string means the separator was present with nothing after it.
 */
@ValueObject
public record Prefix(String nick, Optional<String> user, Optional<String> host) {

  public static final char USER_SEPARATOR = '!';
  public static final char HOST_SEPARATOR = '@';

  public Prefix {
    nick = Objects.requireNonNull(nick, "nick");
    user = Objects.requireNonNull(user, "user");
    host = Objects.requireNonNull(host, "host");
  }

  public static Prefix of(String nick, String user, String host) {
    return new Prefix(nick, Optional.ofNullable(user), Optional.ofNullable(host));
  }

  /** A nick-only prefix, the shape servers use for their own name. */
  public static Prefix ofServer(String serverName) {
    return new Prefix(serverName, Optional.empty(), Optional.empty());
  }

  /**
   * Split prefix text (without the leading {@code :}) into nick, user and host.
   *
   * <p>Never fails: nick ends at the first {@code !}, user ends at the first {@code @} after it. With
   * no {@code !}, an {@code @} separates nick from host. Text with neither is all nick.
   */
  public static Prefix parse(String text) {
    String s = Objects.toString(text, "");

    int bang = s.indexOf(USER_SEPARATOR);
    int at = s.indexOf(HOST_SEPARATOR, bang < 0 ? 0 : bang + 1);

    if (bang < 0 && at < 0) return ofServer(s);
    if (bang < 0) {
      return new Prefix(s.substring(0, at), Optional.empty(), Optional.of(s.substring(at + 1)));
    }
    if (at < 0) {
      return new Prefix(s.substring(0, bang), Optional.of(s.substring(bang + 1)), Optional.empty());
    }
    return new Prefix(
        s.substring(0, bang),
        Optional.of(s.substring(bang + 1, at)),
        Optional.of(s.substring(at + 1)));
  }

  public boolean hasUser() {
    return user.isPresent();
  }

  public boolean hasHost() {
    return host.isPresent();
  }

  /** True for prefixes carrying neither user nor host, e.g. {@code irc.example.com}. */
  public boolean isNickOnly() {
    return user.isEmpty() && host.isEmpty();
  }

  /** The {@code nick[!user][@host]} form, as written on the wire. */
  public String mask() {
    StringBuilder sb = new StringBuilder(nick);
    user.ifPresent(u -> sb.append(USER_SEPARATOR).append(u));
    host.ifPresent(h -> sb.append(HOST_SEPARATOR).append(h));
    return sb.toString();
  }

  @Override
  public String toString() {
    return mask();
  }
}
