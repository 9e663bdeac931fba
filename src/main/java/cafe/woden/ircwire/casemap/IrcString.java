package cafe.woden.ircwire.casemap;

import java.util.Objects;

/**
 * A nickname or channel name bound to the casemapping of the network it came from.
 *
 * <p>{@link #equals}, {@link #hashCode} and {@link #compareTo} work on the folded form, so instances
 * can be used directly as map keys for per-network user and channel state. The original spelling is
 * kept for display via {@link #toString()}.
 */
public final class IrcString implements CharSequence, Comparable<IrcString> {

  private final String value;
  private final CaseMapping mapping;
  private final String folded;

  private IrcString(String value, CaseMapping mapping) {
    this.value = value;
    this.mapping = mapping;
    this.folded = mapping.fold(value);
  }

  public static IrcString of(String value, CaseMapping mapping) {
    return new IrcString(
        Objects.requireNonNull(value, "value"), Objects.requireNonNull(mapping, "mapping"));
  }

  public CaseMapping mapping() {
    return mapping;
  }

  /** The casefolded form used for comparisons. */
  public String folded() {
    return folded;
  }

  public boolean contains(CharSequence other) {
    return folded.contains(mapping.fold(String.valueOf(other)));
  }

  public boolean startsWith(CharSequence prefix) {
    return folded.startsWith(mapping.fold(String.valueOf(prefix)));
  }

  public boolean endsWith(CharSequence suffix) {
    return folded.endsWith(mapping.fold(String.valueOf(suffix)));
  }

  public int indexOf(CharSequence other) {
    return folded.indexOf(mapping.fold(String.valueOf(other)));
  }

  /** Equality against a plain string under this instance's mapping. */
  public boolean equalsIgnoreCase(String other) {
    return mapping.equalsIgnoreCase(value, other);
  }

  @Override
  public int length() {
    return value.length();
  }

  @Override
  public char charAt(int index) {
    return value.charAt(index);
  }

  @Override
  public IrcString subSequence(int start, int end) {
    return new IrcString(value.substring(start, end), mapping);
  }

  @Override
  public int compareTo(IrcString o) {
    return folded.compareTo(o.folded);
  }

  // Instances from different mappings compare by folded form only.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IrcString other)) return false;
    return folded.equals(other.folded);
  }

  @Override
  public int hashCode() {
    return folded.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
