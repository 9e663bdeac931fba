package cafe.woden.ircwire.cap;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * The space-separated capability list carried by {@code CAP LS/ACK/NAK/NEW/DEL}.
 *
 * <p>Parsing strips a leading {@code :} and surrounding whitespace, since some networks send a
 * trailing space after the last capability.
 */
@ValueObject
public record CapList(ImmutableList<Cap> caps) {

  public CapList {
    caps = caps == null ? ImmutableList.of() : caps;
  }

  public static CapList of(Collection<Cap> caps) {
    return new CapList(ImmutableList.copyOf(caps));
  }

  public static CapList parse(String text) {
    String s = Objects.toString(text, "");
    if (s.startsWith(":")) s = s.substring(1);
    s = s.strip();
    if (s.isEmpty()) return new CapList(ImmutableList.of());

    ImmutableList.Builder<Cap> out = ImmutableList.builder();
    for (String token : s.split("\\s+")) {
      if (token.isEmpty()) continue;
      out.add(Cap.parse(token));
    }
    return new CapList(out.build());
  }

  public int size() {
    return caps.size();
  }

  public boolean isEmpty() {
    return caps.isEmpty();
  }

  /** First entry whose {@link Cap#capName()} equals {@code name}. */
  public Optional<Cap> find(String name) {
    if (name == null) return Optional.empty();
    for (Cap c : caps) {
      if (c.capName().equals(name)) return Optional.of(c);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return caps.stream().map(Cap::toString).collect(Collectors.joining(" "));
  }
}
