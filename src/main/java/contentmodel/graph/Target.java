package contentmodel.graph;

/**
 * Target of an NFA transition while the NFA is still being built.
 *
 * <p>Fragments get wired together without knowing the states that come after
 * them: their dangling transitions point at {@link #PENDING} until
 * {@link FragmentBuilder#patch} resolves them.
 */
public interface Target {

  /**
   * Transition whose target is not yet known.
   */
  Target PENDING = Pending.INSTANCE;

  /**
   * Transition to a concrete state.
   *
   * @param state target state
   */
  record Resolved(int state) implements Target {

    @Override
    public String toString() {
      return Integer.toString(state);
    }
  }

  enum Pending implements Target {
    INSTANCE;

    @Override
    public String toString() {
      return "PENDING";
    }
  }
}
