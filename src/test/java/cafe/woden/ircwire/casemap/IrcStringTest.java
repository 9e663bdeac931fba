package cafe.woden.ircwire.casemap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class IrcStringTest {

  @Test
  void equalityAndHashFollowTheCasemapping() {
    IrcString a = IrcString.of("#Chan[1]", CaseMapping.RFC1459);
    IrcString b = IrcString.of("#chan{1}", CaseMapping.RFC1459);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    IrcString c = IrcString.of("#Chan[1]", CaseMapping.ASCII);
    IrcString d = IrcString.of("#chan{1}", CaseMapping.ASCII);
    assertNotEquals(c, d);
  }

  @Test
  void worksAsMapKeyForPerNetworkState() {
    Map<IrcString, String> modes = new HashMap<>();
    modes.put(IrcString.of("Dan", CaseMapping.RFC1459), "+o");
    assertEquals("+o", modes.get(IrcString.of("DAN", CaseMapping.RFC1459)));
  }

  @Test
  void keepsOriginalSpellingForDisplay() {
    IrcString s = IrcString.of("Ni[ck]", CaseMapping.RFC1459);
    assertEquals("Ni[ck]", s.toString());
    assertEquals("ni{ck}", s.folded());
    assertEquals(6, s.length());
    assertEquals('[', s.charAt(2));
    assertEquals("[ck", s.subSequence(2, 5).toString());
  }

  @Test
  void substringQueriesIgnoreCase() {
    IrcString s = IrcString.of("Some[Nick]", CaseMapping.RFC1459);
    assertTrue(s.contains("{nick"));
    assertTrue(s.startsWith("SOME"));
    assertTrue(s.endsWith("nick}"));
    assertEquals(4, s.indexOf("{"));
    assertFalse(s.contains("other"));
    assertTrue(s.equalsIgnoreCase("some{nick}"));
  }

  @Test
  void ordersByFoldedForm() {
    TreeSet<IrcString> sorted = new TreeSet<>();
    sorted.add(IrcString.of("bob", CaseMapping.ASCII));
    sorted.add(IrcString.of("Alice", CaseMapping.ASCII));
    sorted.add(IrcString.of("ALICE", CaseMapping.ASCII));
    assertEquals(2, sorted.size());
    assertEquals("Alice", sorted.first().toString());
  }
}
