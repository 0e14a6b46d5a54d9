package animexpr;

import java.util.Set;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/** Generated parameter names for references that were not given one. */
public final class ParameterNames {

  /**
   * The name for {@code index} in spreadsheet-column order: A..Z, AA..AZ, BA..ZZ, AAA and so
   * on. Defined for every non-negative long.
   */
  public static String fromIndex(long index) {
    Preconditions.checkArgument(index >= 0, "negative index %s", index);

    StringBuilder name = new StringBuilder();
    name.append((char) ('A' + index % 26));
    index /= 26;
    while (index > 0) {
      index--;
      name.append((char) ('A' + index % 26));
      index /= 26;
    }
    return name.reverse().toString();
  }

  // Hands out names in order, skipping any that collide with an explicit name in the tree.
  static final class Generator {
    private final ImmutableSet<String> reserved;
    private long next = 0;

    Generator(Set<String> reservedNames) {
      ImmutableSet.Builder<String> builder = ImmutableSet.builder();
      reservedNames.forEach(n -> builder.add(Ascii.toLowerCase(n)));
      this.reserved = builder.build();
    }

    String next() {
      String name;
      do {
        name = fromIndex(next++);
      } while (reserved.contains(Ascii.toLowerCase(name)));
      return name;
    }
  }

  private ParameterNames() {}
}
