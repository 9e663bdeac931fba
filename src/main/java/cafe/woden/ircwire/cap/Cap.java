package cafe.woden.ircwire.cap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single IRCv3 capability token, {@code name} or {@code name=value}.
 *
 * <p>In {@code CAP ACK} replies the name may carry a leading {@code -} meaning the capability was
 * disabled; {@link #isRemoval()} and {@link #capName()} expose that without altering {@link #name}.
 */
@ValueObject
public record Cap(String name, Optional<String> value) {

  public Cap {
    name = Objects.requireNonNull(name, "name");
    if (value == null) value = Optional.empty();
  }

  public static Cap of(String name) {
    return new Cap(name, Optional.empty());
  }

  public static Cap of(String name, String value) {
    return new Cap(name, Optional.ofNullable(value));
  }

  /** Split on the first {@code =}; an empty value counts as no value. */
  public static Cap parse(String text) {
    String t = Objects.toString(text, "");
    int eq = t.indexOf('=');
    if (eq < 0) return of(t);
    String v = t.substring(eq + 1);
    return new Cap(t.substring(0, eq), v.isEmpty() ? Optional.empty() : Optional.of(v));
  }

  public boolean isRemoval() {
    return name.startsWith("-");
  }

  /** The capability name without a removal marker. */
  public String capName() {
    return isRemoval() ? name.substring(1) : name;
  }

  /** Comma-separated value entries, e.g. {@code sasl=PLAIN,EXTERNAL}. */
  public List<String> valueList() {
    if (value.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : value.get().split(",")) {
      if (!part.isEmpty()) out.add(part);
    }
    return List.copyOf(out);
  }

  @Override
  public String toString() {
    return value.map(v -> name + "=" + v).orElse(name);
  }
}
