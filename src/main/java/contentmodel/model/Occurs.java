package contentmodel.model;

import java.util.OptionalInt;

/**
 * Occurrence constraint on a content model node.
 *
 * <p>Any well-formed {@code (min, max)} pair can be represented, but only the
 * four canonical shapes ({@link #ONCE}, {@link #OPTIONAL},
 * {@link #ZERO_OR_MORE}, {@link #ONE_OR_MORE}) can be turned into automata.
 *
 * @param min minimum number of occurrences
 * @param max maximum number of occurrences (absent if unbounded)
 */
public record Occurs(
  int min,
  OptionalInt max
) {

  public static final Occurs ONCE = new Occurs(1, OptionalInt.of(1));
  public static final Occurs OPTIONAL = new Occurs(0, OptionalInt.of(1));
  public static final Occurs ZERO_OR_MORE = new Occurs(0, OptionalInt.empty());
  public static final Occurs ONE_OR_MORE = new Occurs(1, OptionalInt.empty());

  public Occurs {
    if (min < 0) {
      throw new IllegalArgumentException("Minimum occurrences cannot be negative: " + min);
    }
    if (max.isPresent() && max.getAsInt() < min) {
      throw new IllegalArgumentException(
        "Maximum occurrences " + max.getAsInt() + " is less than the minimum " + min
      );
    }
  }

  /**
   * Bounded occurrence constraint.
   *
   * @param min minimum number of occurrences
   * @param max maximum number of occurrences
   * @return occurrence constraint
   */
  public static Occurs of(int min, int max) {
    return new Occurs(min, OptionalInt.of(max));
  }

  /**
   * Occurrence constraint without an upper bound.
   *
   * @param min minimum number of occurrences
   * @return occurrence constraint
   */
  public static Occurs atLeast(int min) {
    return new Occurs(min, OptionalInt.empty());
  }

  public boolean isUnbounded() {
    return max.isEmpty();
  }

  /**
   * Whether this is one of the four shapes the automaton builder supports.
   *
   * @return whether the constraint is {@code (1,1)}, {@code (0,1)},
   *         {@code (0,unbounded)}, or {@code (1,unbounded)}
   */
  public boolean isCanonical() {
    return min <= 1 && (max.isEmpty() || max.getAsInt() == 1);
  }

  @Override
  public String toString() {
    return "(" + min + ", " + (max.isPresent() ? Integer.toString(max.getAsInt()) : "unbounded") + ")";
  }
}
