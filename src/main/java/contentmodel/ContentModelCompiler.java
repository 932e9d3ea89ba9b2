package contentmodel;

import contentmodel.graph.Dfa;
import contentmodel.graph.Enfa;
import contentmodel.model.ContentNode;
import contentmodel.model.InvalidContentModelException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles content models into minimal, canonical DFA transition tables.
 *
 * <p>The pipeline is: content model to epsilon-NFA (one fragment per node),
 * subset construction into a DFA, minimization, and finally renumbering into
 * an {@link AutomatonRecord}. Each call is independent and instances hold no
 * mutable state, so a compiler can be shared freely.
 */
public final class ContentModelCompiler {

  private static final Logger logger = Logger.getLogger("contentmodel");

  private final CompilerOptions options;

  public ContentModelCompiler(CompilerOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ContentModelCompiler() {
    this(CompilerOptions.DEFAULT);
  }

  public CompilerOptions options() {
    return options;
  }

  /**
   * Compile a content model using the default options.
   *
   * @param root root of the content model
   * @return canonical minimal DFA
   * @throws InvalidContentModelException if the model cannot be compiled
   */
  public static AutomatonRecord buildDfa(ContentNode root) {
    return new ContentModelCompiler().compile(root);
  }

  /**
   * Compile a content model.
   *
   * @param root root of the content model
   * @return canonical minimal DFA
   * @throws InvalidContentModelException if the model cannot be compiled
   */
  public AutomatonRecord compile(ContentNode root) {
    Objects.requireNonNull(root, "root");

    final Enfa nfa = Enfa.fromContentModel(root, options.maxAllGroupSize(), options.allGroupOverflow());
    final Dfa dfa = Dfa.fromEnfa(nfa);
    final Dfa minimal = dfa.minimized();
    final AutomatonRecord record = AutomatonRecord.fromDfa(minimal, nfa.elements);

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
        "Compiled content model: " + nfa.stateCount() + " NFA states ("
          + nfa.permutationsExpanded + " all group permutations), "
          + dfa.stateCount() + " DFA states, "
          + record.states().size() + " states after minimization"
      );
    }
    return record;
  }
}
