package cafe.woden.ircwire.command;

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/** Argument shapes for commands a client sends. Lookup ignores case. */
public final class ClientCommands {

  public static final CommandSpec PRIVMSG = CommandSpec.of("PRIVMSG", "<target>", "<content>");
  public static final CommandSpec NOTICE = CommandSpec.of("NOTICE", "<target>", "<content>");
  public static final CommandSpec JOIN = CommandSpec.of("JOIN", "<channel>", "[key]");

  private static final ImmutableMap<String, CommandSpec> BY_NAME =
      ImmutableMap.of(PRIVMSG.name(), PRIVMSG, NOTICE.name(), NOTICE, JOIN.name(), JOIN);

  private ClientCommands() {}

  public static Optional<CommandSpec> lookup(String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(BY_NAME.get(name.trim().toUpperCase(Locale.ROOT)));
  }

  public static Collection<CommandSpec> all() {
    return BY_NAME.values();
  }
}
