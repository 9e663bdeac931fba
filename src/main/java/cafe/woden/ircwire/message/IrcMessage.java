package cafe.woden.ircwire.message;

import cafe.woden.ircwire.numeric.IrcNumeric;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One IRC protocol line: IRCv3 tags, optional source prefix, command and parameters.
 *
 * <p>Tag values are {@link Optional}: {@code Optional.empty()} is a valueless tag ({@code +typing})
 * and {@code Optional.of("")} an empty-valued one ({@code key=}). Tag equality ignores order but
 * iteration keeps insertion order, which is what {@link IrcMessageSerializer} writes.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies. The constructor does
 * not check lexical validity, that happens when the message is serialized.
 */
@ValueObject
public record IrcMessage(
    Map<String, Optional<String>> tags,
    Optional<Prefix> source,
    String command,
    List<String> params) {

  /** Protocol bound on parameters: command plus params is at most 15 tokens. */
  public static final int MAX_PARAMS = 14;

  public IrcMessage {
    tags = tags == null ? ImmutableMap.of() : ImmutableMap.copyOf(tags);
    if (source == null) source = Optional.empty();
    command = Objects.requireNonNull(command, "command");
    params = params == null ? ImmutableList.of() : ImmutableList.copyOf(params);
  }

  public static IrcMessage of(String command, String... params) {
    return new IrcMessage(ImmutableMap.of(), Optional.empty(), command, Arrays.asList(params));
  }

  public static IrcMessage of(Prefix source, String command, String... params) {
    return new IrcMessage(
        ImmutableMap.of(), Optional.ofNullable(source), command, Arrays.asList(params));
  }

  public static Builder builder(String command) {
    return new Builder(command);
  }

  public Builder toBuilder() {
    Builder b = new Builder(command);
    b.tags.putAll(tags);
    b.source = source.orElse(null);
    b.params.addAll(params);
    return b;
  }

  public IrcMessage withTags(Map<String, Optional<String>> newTags) {
    return new IrcMessage(newTags, source, command, params);
  }

  /** Copy with one tag added or replaced. A null value makes it valueless. */
  public IrcMessage withTag(String key, String value) {
    return toBuilder().tag(key, value).build();
  }

  public IrcMessage withoutTag(String key) {
    if (!tags.containsKey(key)) return this;
    LinkedHashMap<String, Optional<String>> copy = new LinkedHashMap<>(tags);
    copy.remove(key);
    return withTags(copy);
  }

  public IrcMessage withSource(Prefix newSource) {
    return new IrcMessage(tags, Optional.ofNullable(newSource), command, params);
  }

  public IrcMessage withParams(List<String> newParams) {
    return new IrcMessage(tags, source, command, newParams);
  }

  public Optional<String> param(int index) {
    if (index < 0 || index >= params.size()) return Optional.empty();
    return Optional.of(params.get(index));
  }

  public Optional<String> lastParam() {
    return params.isEmpty() ? Optional.empty() : Optional.of(params.get(params.size() - 1));
  }

  public boolean hasTag(String key) {
    return tags.containsKey(key);
  }

  /** Value of a tag; empty both when the tag is missing and when it carries no value. */
  public Optional<String> tag(String key) {
    Optional<String> v = tags.get(key);
    return v == null ? Optional.empty() : v;
  }

  /** True when the command is a three-digit numeric reply. */
  public boolean isNumeric() {
    if (command.length() != 3) return false;
    for (int i = 0; i < 3; i++) {
      char c = command.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  /** Registry entry for a numeric command, if it is one we know. */
  public Optional<IrcNumeric> numeric() {
    return isNumeric() ? IrcNumeric.fromToken(command) : Optional.empty();
  }

  /** Builder for outgoing messages; tags keep insertion order. */
  public static final class Builder {
    private final String command;
    private final LinkedHashMap<String, Optional<String>> tags = new LinkedHashMap<>();
    private Prefix source;
    private final List<String> params = new ArrayList<>();

    private Builder(String command) {
      this.command = Objects.requireNonNull(command, "command");
    }

    public Builder tag(String key, String value) {
      tags.put(Objects.requireNonNull(key, "key"), Optional.ofNullable(value));
      return this;
    }

    public Builder source(Prefix source) {
      this.source = source;
      return this;
    }

    public Builder param(String param) {
      params.add(Objects.requireNonNull(param, "param"));
      return this;
    }

    public Builder params(String... values) {
      for (String v : values) param(v);
      return this;
    }

    public IrcMessage build() {
      return new IrcMessage(tags, Optional.ofNullable(source), command, params);
    }
  }
}
