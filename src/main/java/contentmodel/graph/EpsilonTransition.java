package contentmodel.graph;

/**
 * Empty transition, used to wire together choice branches, optional skips,
 * and repetition back-edges.
 */
public enum EpsilonTransition implements EnfaTransition {
  EPSILON;

  @Override
  public String dotLabel() {
    return "&epsilon;";
  }
}
