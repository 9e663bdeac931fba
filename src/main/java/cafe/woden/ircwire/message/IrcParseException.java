package cafe.woden.ircwire.message;

import java.util.Objects;

/** Thrown by {@link IrcMessageParser} when a line cannot be tokenized. */
public final class IrcParseException extends IrcWireException {

  public enum Reason {
    EMPTY_LINE,
    MISSING_COMMAND,
    MALFORMED_TAGS,
    /** Only raised by parsers configured to reject parameter overflow. */
    PARAMETER_OVERFLOW
  }

  private final Reason reason;
  private final String line;

  public IrcParseException(Reason reason, String line, String detail) {
    super(reason + ": " + detail);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.line = Objects.toString(line, "");
  }

  public Reason reason() {
    return reason;
  }

  /** The raw line that failed. */
  public String line() {
    return line;
  }
}
