package cafe.woden.ircwire.message;

/** Base type for lines that cannot be parsed and messages that cannot be written. */
public abstract class IrcWireException extends IllegalArgumentException {

  protected IrcWireException(String message) {
    super(message);
  }
}
