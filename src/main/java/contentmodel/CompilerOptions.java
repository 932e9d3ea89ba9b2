package contentmodel;

import contentmodel.graph.AllGroupOverflow;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for compiling content models.
 *
 * <p>The only thing there is to configure is how far all groups get expanded:
 * an all group with {@code n} children becomes a choice over {@code n!}
 * sequences before minimization.
 *
 * @param maxAllGroupSize largest all group expanded into permutations
 * @param allGroupOverflow what to do with larger all groups
 */
public record CompilerOptions(
  int maxAllGroupSize,
  AllGroupOverflow allGroupOverflow
) {

  /**
   * System property overriding {@link #maxAllGroupSize}.
   */
  public static final String MAX_ALL_GROUP_SIZE_PROPERTY = "contentmodel.maxAllGroupSize";

  /**
   * System property overriding {@link #allGroupOverflow} ({@code reject} or
   * {@code warn}).
   */
  public static final String ALL_GROUP_OVERFLOW_PROPERTY = "contentmodel.allGroupOverflow";

  public static final CompilerOptions DEFAULT = new CompilerOptions(6, AllGroupOverflow.REJECT);

  public CompilerOptions {
    if (maxAllGroupSize < 0) {
      throw new IllegalArgumentException("All group size limit cannot be negative: " + maxAllGroupSize);
    }
    Objects.requireNonNull(allGroupOverflow, "allGroupOverflow");
  }

  public CompilerOptions withMaxAllGroupSize(int newMaxAllGroupSize) {
    return new CompilerOptions(newMaxAllGroupSize, allGroupOverflow);
  }

  public CompilerOptions withAllGroupOverflow(AllGroupOverflow newAllGroupOverflow) {
    return new CompilerOptions(maxAllGroupSize, newAllGroupOverflow);
  }

  /**
   * Defaults, overridden by whichever of the {@code contentmodel.*} system
   * properties are set.
   *
   * @return options read from the system properties
   */
  public static CompilerOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /**
   * Defaults, overridden by whichever of the {@code contentmodel.*}
   * properties are set.
   *
   * @param properties properties to read
   * @return options read from the properties
   * @throws IllegalArgumentException if a property is set to an invalid value
   */
  public static CompilerOptions fromProperties(Properties properties) {
    CompilerOptions options = DEFAULT;

    final String maxSize = properties.getProperty(MAX_ALL_GROUP_SIZE_PROPERTY);
    if (maxSize != null) {
      try {
        options = options.withMaxAllGroupSize(Integer.parseInt(maxSize.trim()));
      } catch (IllegalArgumentException err) {
        throw new IllegalArgumentException(
          "Property " + MAX_ALL_GROUP_SIZE_PROPERTY + " must be a non-negative integer: " + maxSize,
          err
        );
      }
    }

    final String overflow = properties.getProperty(ALL_GROUP_OVERFLOW_PROPERTY);
    if (overflow != null) {
      try {
        options = options.withAllGroupOverflow(
          AllGroupOverflow.valueOf(overflow.trim().toUpperCase(Locale.ROOT))
        );
      } catch (IllegalArgumentException err) {
        throw new IllegalArgumentException(
          "Property " + ALL_GROUP_OVERFLOW_PROPERTY + " must be 'reject' or 'warn': " + overflow,
          err
        );
      }
    }

    return options;
  }
}
