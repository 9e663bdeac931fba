package cafe.woden.ircwire.command;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A named command argument, required ({@code <name>}) or optional ({@code [name]}). */
@ValueObject
public record CommandArgument(String name, boolean required) {

  public CommandArgument {
    name = Objects.requireNonNull(name, "name");
  }

  /**
   * Parse {@code "<target>"} or {@code "[key]"}.
   *
   * @throws IllegalArgumentException for any other shape
   */
  public static CommandArgument parse(String text) {
    String s = Objects.toString(text, "");
    if (s.length() >= 2) {
      char open = s.charAt(0);
      char close = s.charAt(s.length() - 1);
      String inner = s.substring(1, s.length() - 1);
      if (open == '<' && close == '>') return new CommandArgument(inner, true);
      if (open == '[' && close == ']') return new CommandArgument(inner, false);
    }
    throw new IllegalArgumentException("Unable to parse argument: " + s);
  }

  @Override
  public String toString() {
    return required ? "<" + name + ">" : "[" + name + "]";
  }
}
