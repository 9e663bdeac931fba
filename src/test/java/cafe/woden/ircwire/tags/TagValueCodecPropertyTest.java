package cafe.woden.ircwire.tags;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Random;
import org.junit.jupiter.api.Test;

class TagValueCodecPropertyTest {

  @Test
  void decodeInvertsEncode() {
    Random random = new Random(0x7A65L);
    for (int i = 0; i < 2_000; i++) {
      String raw = randomValue(random);
      String encoded = TagValueCodec.encode(raw);
      assertEquals(raw, TagValueCodec.decode(encoded), () -> "round trip failed for: " + raw);
    }
  }

  @Test
  void encodedValuesNeverContainWireDelimiters() {
    Random random = new Random(0x5EEDL);
    for (int i = 0; i < 2_000; i++) {
      String encoded = TagValueCodec.encode(randomValue(random));
      assertFalse(encoded.indexOf(' ') >= 0, () -> "space in " + encoded);
      assertFalse(encoded.indexOf(';') >= 0, () -> "semicolon in " + encoded);
      assertFalse(encoded.indexOf('\r') >= 0 || encoded.indexOf('\n') >= 0, "line break");
    }
  }

  private static String randomValue(Random random) {
    int len = random.nextInt(24);
    String alphabet = "abcXYZ019-=:;\\ \r\nsrné☃";
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < len; i++) {
      out.append(alphabet.charAt(random.nextInt(alphabet.length())));
    }
    return out.toString();
  }
}
