package contentmodel.graph;

/**
 * Label on a transition in an {@link Enfa}.
 *
 * <p>Either an element symbol, which consumes one child element of the input,
 * or {@link EpsilonTransition#EPSILON}, which consumes nothing.
 */
public interface EnfaTransition {

  /**
   * Label for a DOT graph transition.
   */
  String dotLabel();
}
