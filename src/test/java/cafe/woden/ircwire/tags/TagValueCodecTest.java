package cafe.woden.ircwire.tags;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TagValueCodecTest {

  @Test
  void encodesEveryEscapedCharacter() {
    assertEquals("a\\:b\\sc\\\\d\\re\\nf", TagValueCodec.encode("a;b c\\d\re\nf"));
  }

  @Test
  void encodeLeavesPlainValuesUntouched() {
    assertEquals("2026-02-16T12:34:56.000Z", TagValueCodec.encode("2026-02-16T12:34:56.000Z"));
    assertEquals("", TagValueCodec.encode(""));
    assertEquals("", TagValueCodec.encode(null));
  }

  @Test
  void decodesKnownEscapes() {
    assertEquals("req;42", TagValueCodec.decode("req\\:42"));
    assertEquals("abc 123", TagValueCodec.decode("abc\\s123"));
    assertEquals("b\\and\nk", TagValueCodec.decode("b\\\\and\\nk"));
    assertEquals("72 45", TagValueCodec.decode("72\\s45"));
    assertEquals("gh;764", TagValueCodec.decode("gh\\:764"));
    assertEquals("\r", TagValueCodec.decode("\\r"));
  }

  @Test
  void unknownEscapeKeepsTheCharacter() {
    assertEquals("value1", TagValueCodec.decode("value\\1"));
    assertEquals("ab", TagValueCodec.decode("\\a\\b"));
  }

  @Test
  void loneTrailingBackslashIsDropped() {
    assertEquals("value1", TagValueCodec.decode("value1\\"));
    assertEquals("", TagValueCodec.decode("\\"));
  }

  @Test
  void decodeDoesNotRescanItsOwnOutput() {
    // "\\\\s" decodes to a literal backslash followed by 's', not to a space
    assertEquals("\\s", TagValueCodec.decode("\\\\s"));
    assertEquals("value\\ntest", TagValueCodec.decode("value\\\\ntest"));
  }
}
