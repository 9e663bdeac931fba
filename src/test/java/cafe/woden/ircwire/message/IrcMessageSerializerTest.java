package cafe.woden.ircwire.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.ircwire.message.IrcSerializeException.Reason;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IrcMessageSerializerTest {

  private final IrcMessageSerializer serializer = IrcMessageSerializer.instance();

  @Test
  void lastParameterWithSpaceIsWrittenAsTrailing() {
    assertEquals("CMD a :b c", serializer.serialize(IrcMessage.of("CMD", "a", "b c")));
  }

  @Test
  void lastParameterIsBareWhenItCanBe() {
    assertEquals("foo bar baz asdf", serializer.serialize(IrcMessage.of("foo", "bar", "baz", "asdf")));
    assertEquals("PING", serializer.serialize(IrcMessage.of("PING")));
  }

  @Test
  void emptyOrColonLeadingLastParameterGetsTrailingMarker() {
    assertEquals("foo bar baz :", serializer.serialize(IrcMessage.of("foo", "bar", "baz", "")));
    assertEquals("foo bar baz ::asdf", serializer.serialize(IrcMessage.of("foo", "bar", "baz", ":asdf")));
  }

  @Test
  void writesTagsInInsertionOrderWithEscapedValues() {
    IrcMessage m =
        IrcMessage.builder("PRIVMSG")
            .tag("id", "234AB")
            .tag("tag2", "a b;c\\")
            .tag("+typing", null)
            .tag("empty", "")
            .source(Prefix.of("dan", "d", "localhost"))
            .params("#chan", "Hello")
            .build();

    assertEquals(
        "@id=234AB;tag2=a\\sb\\:c\\\\;+typing;empty= :dan!d@localhost PRIVMSG #chan Hello",
        serializer.serialize(m));
  }

  @Test
  void writesPartialPrefixes() {
    assertEquals(
        ":irc.example.com 001 nick :Welcome to IRC",
        serializer.serialize(
            IrcMessage.of(Prefix.ofServer("irc.example.com"), "001", "nick", "Welcome to IRC")));
    assertEquals(
        ":coolguy@127.0.0.1 X", serializer.serialize(IrcMessage.of(Prefix.of("coolguy", null, "127.0.0.1"), "X")));
    assertEquals(":coolguy!ag X", serializer.serialize(IrcMessage.of(Prefix.of("coolguy", "ag", null), "X")));
  }

  @Test
  void rejectsNonFinalParameterThatCannotBeAMiddleToken() {
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("CMD", "a b", "c"));
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("CMD", ":a", "c"));
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("CMD", "", "c"));
  }

  @Test
  void rejectsLineBreaksAndNulInParameters() {
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("PRIVMSG", "#c", "hi\r\nQUIT"));
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("PRIVMSG", "#c", "a\0b"));
  }

  @Test
  void rejectsMoreThanFourteenParameters() {
    List<String> params = new ArrayList<>();
    for (int i = 0; i < 15; i++) params.add("p" + i);
    assertReason(Reason.INVALID_PARAMETER, IrcMessage.of("CMD").withParams(params));
  }

  @Test
  void rejectsInvalidCommands() {
    assertReason(Reason.INVALID_COMMAND, IrcMessage.of(""));
    assertReason(Reason.INVALID_COMMAND, IrcMessage.of("12"));
    assertReason(Reason.INVALID_COMMAND, IrcMessage.of("PRIV MSG"));
    assertReason(Reason.INVALID_COMMAND, IrcMessage.of("CMD1"));
  }

  @Test
  void rejectsInvalidTagKeys() {
    assertReason(Reason.INVALID_TAG, IrcMessage.of("CMD").withTag("bad key", "v"));
    assertReason(Reason.INVALID_TAG, IrcMessage.of("CMD").withTag("", null));
  }

  @Test
  void rejectsPrefixesThatWouldReadBackDifferently() {
    assertReason(Reason.INVALID_PREFIX, IrcMessage.of(Prefix.ofServer("a b"), "CMD"));
    assertReason(Reason.INVALID_PREFIX, IrcMessage.of(Prefix.ofServer("n!u"), "CMD"));
    assertReason(Reason.INVALID_PREFIX, IrcMessage.of(Prefix.of("n", "u@x", "h"), "CMD"));
    assertReason(Reason.INVALID_PREFIX, IrcMessage.of(Prefix.of("n", null, "h!x"), "CMD"));
    assertReason(
        Reason.INVALID_PREFIX,
        IrcMessage.of(new Prefix("n", Optional.of("u"), Optional.of("h\r")), "CMD"));
  }

  private void assertReason(Reason reason, IrcMessage message) {
    IrcSerializeException e =
        assertThrows(IrcSerializeException.class, () -> serializer.serialize(message));
    assertEquals(reason, e.reason(), e.getMessage());
  }
}
