package cafe.woden.ircwire.command;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Argument shape of a client command.
 *
 * <p>{@code minArgs} defaults to the number of required arguments and {@code maxArgs} to the total
 * argument count.
 */
@ValueObject
public record CommandSpec(String name, List<CommandArgument> args, int minArgs, OptionalInt maxArgs) {

  public CommandSpec {
    name = Objects.requireNonNull(name, "name");
    args = args == null ? ImmutableList.of() : ImmutableList.copyOf(args);
    if (maxArgs == null) maxArgs = OptionalInt.empty();
    if (minArgs < 0) throw new IllegalArgumentException("minArgs must be >= 0");
  }

  /** Build from argument strings such as {@code "<target>"} and {@code "[key]"}. */
  public static CommandSpec of(String name, String... argSpecs) {
    ImmutableList.Builder<CommandArgument> args = ImmutableList.builder();
    int required = 0;
    for (String a : argSpecs) {
      CommandArgument arg = CommandArgument.parse(a);
      if (arg.required()) required++;
      args.add(arg);
    }
    return new CommandSpec(name, args.build(), required, OptionalInt.of(argSpecs.length));
  }

  /** True when {@code count} parameters satisfy the bounds. */
  public boolean accepts(int count) {
    if (count < minArgs) return false;
    return maxArgs.isEmpty() || count <= maxArgs.getAsInt();
  }
}
