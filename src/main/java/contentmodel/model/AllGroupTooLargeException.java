package contentmodel.model;

/**
 * All group with more children than the permutation expansion allows.
 *
 * <p>Raised before any of the permutations get built.
 */
public class AllGroupTooLargeException extends InvalidContentModelException {

  @java.io.Serial
  private static final long serialVersionUID = -1730522954181007238L;

  /**
   * Number of children in the rejected group.
   */
  public final int groupSize;

  /**
   * Largest group size which would have been accepted.
   */
  public final int maxGroupSize;

  public AllGroupTooLargeException(int groupSize, int maxGroupSize) {
    super(
      "All group has " + groupSize + " children but at most " + maxGroupSize
        + " are expanded (the automaton grows factorially with the group size)"
    );
    this.groupSize = groupSize;
    this.maxGroupSize = maxGroupSize;
  }
}
