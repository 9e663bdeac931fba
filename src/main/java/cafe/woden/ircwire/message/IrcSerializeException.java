package cafe.woden.ircwire.message;

import java.util.Objects;

/**
 * Thrown by {@link IrcMessageSerializer} when a message has no faithful wire form.
 */
public final class IrcSerializeException extends IrcWireException {

  public enum Reason {
    INVALID_COMMAND,
    INVALID_PARAMETER,
    INVALID_TAG,
    INVALID_PREFIX
  }

  private final Reason reason;

  public IrcSerializeException(Reason reason, String detail) {
    super(reason + ": " + detail);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}
