package cafe.woden.ircwire.message;

import static cafe.woden.ircwire.message.IrcLineSyntax.PREFIX_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.SPACE;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAGS_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAG_SEPARATOR;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAG_VALUE_SEPARATOR;
import static cafe.woden.ircwire.message.IrcLineSyntax.TRAILING_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.containsLineBreakOrNul;

import cafe.woden.ircwire.message.IrcSerializeException.Reason;
import cafe.woden.ircwire.tags.TagKeys;
import cafe.woden.ircwire.tags.TagValueCodec;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders an {@link IrcMessage} as a wire line, without the CR LF terminator.
 *
 * <p>The last parameter is written as a trailing ({@code :}-prefixed) parameter when it is empty,
 * contains a space or starts with {@code :}; this is exactly what {@link IrcMessageParser} needs to
 * read it back unchanged. Messages that cannot be written faithfully are rejected with an
 * {@link IrcSerializeException} rather than mangled. Line length is not enforced here.
 */
public final class IrcMessageSerializer {

  private static final IrcMessageSerializer INSTANCE = new IrcMessageSerializer();

  public static IrcMessageSerializer instance() {
    return INSTANCE;
  }

  public String serialize(IrcMessage message) {
    Objects.requireNonNull(message, "message");

    String command = message.command();
    if (!IrcLineSyntax.isCommand(command)) {
      throw new IrcSerializeException(
          Reason.INVALID_COMMAND, "command must be letters or three digits (got: " + command + ")");
    }

    StringBuilder sb = new StringBuilder(64);
    appendTags(sb, message.tags());
    message.source().ifPresent(p -> appendPrefix(sb, p));
    sb.append(command);
    appendParams(sb, message.params());
    return sb.toString();
  }

  private static void appendTags(StringBuilder sb, Map<String, Optional<String>> tags) {
    if (tags.isEmpty()) return;

    sb.append(TAGS_SENTINEL);
    boolean first = true;
    for (Map.Entry<String, Optional<String>> e : tags.entrySet()) {
      String key = e.getKey();
      if (!TagKeys.isValid(key)) {
        throw new IrcSerializeException(Reason.INVALID_TAG, "invalid tag key '" + key + "'");
      }
      if (!first) sb.append(TAG_SEPARATOR);
      first = false;

      sb.append(key);
      Optional<String> value = e.getValue();
      if (value.isPresent()) {
        sb.append(TAG_VALUE_SEPARATOR).append(TagValueCodec.encode(value.get()));
      }
    }
    sb.append(SPACE);
  }

  private static void appendPrefix(StringBuilder sb, Prefix prefix) {
    String nick = prefix.nick();
    checkPrefixPart("nick", nick);
    if (nick.indexOf(Prefix.USER_SEPARATOR) >= 0 || nick.indexOf(Prefix.HOST_SEPARATOR) >= 0) {
      throw new IrcSerializeException(
          Reason.INVALID_PREFIX, "prefix nick contains '!' or '@' (got: " + nick + ")");
    }
    prefix
        .user()
        .ifPresent(
            u -> {
              checkPrefixPart("user", u);
              if (u.indexOf(Prefix.HOST_SEPARATOR) >= 0) {
                throw new IrcSerializeException(
                    Reason.INVALID_PREFIX, "prefix user contains '@' (got: " + u + ")");
              }
            });
    prefix.host().ifPresent(h -> checkPrefixPart("host", h));
    // without a user part, a '!' in the host would be read back as the user separator
    if (prefix.user().isEmpty()
        && prefix.host().map(h -> h.indexOf(Prefix.USER_SEPARATOR) >= 0).orElse(false)) {
      throw new IrcSerializeException(
          Reason.INVALID_PREFIX, "prefix host contains '!' but the prefix has no user");
    }

    sb.append(PREFIX_SENTINEL).append(prefix.mask()).append(SPACE);
  }

  private static void checkPrefixPart(String what, String part) {
    if (part.indexOf(SPACE) >= 0 || containsLineBreakOrNul(part)) {
      throw new IrcSerializeException(
          Reason.INVALID_PREFIX, "prefix " + what + " contains a space, CR, LF or NUL");
    }
  }

  private static void appendParams(StringBuilder sb, List<String> params) {
    if (params.size() > IrcMessage.MAX_PARAMS) {
      throw new IrcSerializeException(
          Reason.INVALID_PARAMETER,
          "at most " + IrcMessage.MAX_PARAMS + " parameters (got: " + params.size() + ")");
    }

    int last = params.size() - 1;
    for (int i = 0; i < params.size(); i++) {
      String p = params.get(i);
      if (containsLineBreakOrNul(p)) {
        throw new IrcSerializeException(
            Reason.INVALID_PARAMETER, "parameter " + i + " contains CR, LF or NUL");
      }

      sb.append(SPACE);
      boolean needsTrailing =
          p.isEmpty() || p.indexOf(SPACE) >= 0 || p.charAt(0) == TRAILING_SENTINEL;
      if (!needsTrailing) {
        sb.append(p);
      } else if (i == last) {
        sb.append(TRAILING_SENTINEL).append(p);
      } else {
        throw new IrcSerializeException(
            Reason.INVALID_PARAMETER,
            "only the last parameter may be empty, contain spaces or start with ':' (parameter "
                + i
                + ": '"
                + p
                + "')");
      }
    }
  }
}
