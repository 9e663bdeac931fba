package cafe.woden.ircwire.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class PrefixTest {

  @Test
  void splitsFullHostmask() {
    Prefix p = Prefix.parse("coolguy!~ag@localhost");
    assertEquals("coolguy", p.nick());
    assertEquals(Optional.of("~ag"), p.user());
    assertEquals(Optional.of("localhost"), p.host());
    assertEquals("coolguy!~ag@localhost", p.mask());
  }

  @Test
  void textWithoutSeparatorsIsNickOnly() {
    Prefix p = Prefix.parse("irc.example.com");
    assertTrue(p.isNickOnly());
    assertFalse(p.hasUser());
    assertFalse(p.hasHost());
    assertEquals("irc.example.com", p.toString());
  }

  @Test
  void atBeforeBangDoesNotEndTheUser() {
    // the first '@' is searched only after the first '!'
    Prefix p = Prefix.parse("a@b!c@d");
    assertEquals("a@b", p.nick());
    assertEquals(Optional.of("c"), p.user());
    assertEquals(Optional.of("d"), p.host());
  }

  @Test
  void emptySegmentsAreDistinctFromMissingOnes() {
    Prefix p = Prefix.parse("nick!@");
    assertEquals(Optional.of(""), p.user());
    assertEquals(Optional.of(""), p.host());
    assertEquals("nick!@", p.mask());
    assertEquals(Prefix.ofServer(""), Prefix.parse(""));
    assertEquals(Prefix.ofServer(""), Prefix.parse(null));
  }
}
