package cafe.woden.ircwire.message;

import static cafe.woden.ircwire.message.IrcLineSyntax.PREFIX_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAGS_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAG_SEPARATOR;
import static cafe.woden.ircwire.message.IrcLineSyntax.TAG_VALUE_SEPARATOR;
import static cafe.woden.ircwire.message.IrcLineSyntax.TRAILING_SENTINEL;
import static cafe.woden.ircwire.message.IrcLineSyntax.nextSpace;
import static cafe.woden.ircwire.message.IrcLineSyntax.skipSpaces;

import cafe.woden.ircwire.message.IrcParseException.Reason;
import cafe.woden.ircwire.tags.TagKeys;
import cafe.woden.ircwire.tags.TagValueCodec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizes one already-delimited IRC line ({@code ['@' tags ' '] [':' prefix ' '] command params})
 * into an {@link IrcMessage}.
 *
 * <p>The scan is a single left-to-right pass. Runs of spaces between tokens are skipped. Recovered
 * quietly:
 *
 * <ul>
 *   <li>unknown tag escapes and a trailing backslash in a tag value
 *   <li>duplicate tag keys (the last occurrence wins)
 *   <li>prefixes without recognizable {@code !}/{@code @} structure (kept whole as the nick)
 *   <li>more than {@value IrcMessage#MAX_PARAMS} parameters: the remaining text, spaces included,
 *       becomes the last parameter. Parsers built with {@code rejectParameterOverflow} fail instead.
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class IrcMessageParser {

  private static final Logger log = LoggerFactory.getLogger(IrcMessageParser.class);

  private static final IrcMessageParser LENIENT = new IrcMessageParser(false);

  private final boolean rejectParameterOverflow;

  public IrcMessageParser(boolean rejectParameterOverflow) {
    this.rejectParameterOverflow = rejectParameterOverflow;
  }

  /** Shared parser with the default (wire-compatible) overflow folding. */
  public static IrcMessageParser lenient() {
    return LENIENT;
  }

  public boolean rejectsParameterOverflow() {
    return rejectParameterOverflow;
  }

  public IrcMessage parse(String line) {
    if (line == null || line.isEmpty()) {
      throw new IrcParseException(Reason.EMPTY_LINE, line, "line is empty");
    }

    int pos = 0;
    Map<String, Optional<String>> tags = Map.of();
    if (line.charAt(0) == TAGS_SENTINEL) {
      int end = nextSpace(line, 1);
      tags = parseTags(line, line.substring(1, end));
      pos = skipSpaces(line, end);
    }

    Optional<Prefix> source = Optional.empty();
    if (pos < line.length() && line.charAt(pos) == PREFIX_SENTINEL) {
      int end = nextSpace(line, pos + 1);
      source = Optional.of(Prefix.parse(line.substring(pos + 1, end)));
      pos = skipSpaces(line, end);
    }

    int commandEnd = nextSpace(line, pos);
    String command = line.substring(pos, commandEnd);
    if (command.isEmpty()) {
      throw new IrcParseException(Reason.MISSING_COMMAND, line, "no command token");
    }
    if (!IrcLineSyntax.isCommand(command)) {
      throw new IrcParseException(
          Reason.MISSING_COMMAND,
          line,
          "command must be letters or three digits (got: " + command + ")");
    }

    List<String> params = parseParams(line, commandEnd);
    return new IrcMessage(tags, source, command, params);
  }

  private static Map<String, Optional<String>> parseTags(String line, String section) {
    LinkedHashMap<String, Optional<String>> out = new LinkedHashMap<>();
    int idx = 0;
    while (idx < section.length()) {
      int next = section.indexOf(TAG_SEPARATOR, idx);
      if (next < 0) next = section.length();
      String part = section.substring(idx, next);
      idx = next + 1;

      if (part.isEmpty()) continue;
      int eq = part.indexOf(TAG_VALUE_SEPARATOR);
      String key = (eq >= 0) ? part.substring(0, eq) : part;
      if (!TagKeys.isValid(key)) {
        throw new IrcParseException(
            Reason.MALFORMED_TAGS, line, "invalid tag key '" + key + "'");
      }

      Optional<String> value =
          (eq >= 0) ? Optional.of(TagValueCodec.decode(part.substring(eq + 1))) : Optional.empty();
      if (out.put(key, value) != null) {
        log.trace("[ircwire] Duplicate tag key '{}', keeping the last value", key);
      }
    }
    return out;
  }

  private List<String> parseParams(String line, int from) {
    ArrayList<String> params = new ArrayList<>();
    int pos = from;
    while (true) {
      pos = skipSpaces(line, pos);
      if (pos >= line.length()) break;

      if (line.charAt(pos) == TRAILING_SENTINEL) {
        params.add(line.substring(pos + 1));
        break;
      }

      int end = nextSpace(line, pos);
      if (params.size() == IrcMessage.MAX_PARAMS - 1 && skipSpaces(line, end) < line.length()) {
        if (rejectParameterOverflow) {
          throw new IrcParseException(
              Reason.PARAMETER_OVERFLOW,
              line,
              "more than " + IrcMessage.MAX_PARAMS + " parameters");
        }
        log.trace("[ircwire] Folding parameters past {} into the last one", IrcMessage.MAX_PARAMS);
        params.add(line.substring(pos));
        break;
      }

      params.add(line.substring(pos, end));
      pos = end;
    }
    return params;
  }
}
