package contentmodel.graph;

import contentmodel.model.ContentNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Non-deterministic finite state automaton with epsilon transitions.
 *
 * <p>States are dense integers starting at 0, transitions are labelled with
 * element symbols or epsilon. There is exactly one accepting state.
 */
final public class Enfa implements DotGraph<Integer, EnfaTransition> {

  /**
   * State transitions, indexed along all of the starting nodes.
   *
   * <p>This list is not modifiable and supports fast random access. Each inner
   * map goes from a transition label to the (non-empty) set of target states.
   */
  public final List<Map<EnfaTransition, SortedSet<Integer>>> states;

  /**
   * Index of the initial state inside {@code states}.
   */
  public final int initialState;

  /**
   * Index of the accepting state inside {@code states}.
   */
  public final int finalState;

  /**
   * Element symbols used on transitions.
   */
  public final SortedSet<String> alphabet;

  /**
   * Descriptors of the elements, keyed by their symbol.
   */
  public final SortedMap<String, ContentNode.Element> elements;

  /**
   * Number of sequence fragments built while expanding all groups.
   */
  public final long permutationsExpanded;

  private Enfa(
    List<Map<EnfaTransition, SortedSet<Integer>>> states,
    int initialState,
    int finalState,
    SortedSet<String> alphabet,
    SortedMap<String, ContentNode.Element> elements,
    long permutationsExpanded
  ) {
    this.states = states;
    this.initialState = initialState;
    this.finalState = finalState;
    this.alphabet = alphabet;
    this.elements = elements;
    this.permutationsExpanded = permutationsExpanded;
  }

  /**
   * Build the NFA for a content model.
   *
   * @param root root of the content model
   * @param maxAllGroupSize largest all group expanded into permutations
   * @param allGroupOverflow what to do with larger all groups
   * @return NFA accepting the sequences of child elements the model allows
   */
  public static Enfa fromContentModel(
    ContentNode root,
    int maxAllGroupSize,
    AllGroupOverflow allGroupOverflow
  ) {
    return new Builder(maxAllGroupSize, allGroupOverflow).constructEnfa(root);
  }

  public static class Builder extends FragmentBuilder {

    private boolean used = false;
    private final List<Map<EnfaTransition, Set<Target>>> transitions = new ArrayList<>();
    private final List<Integer> incomingCounts = new ArrayList<>();
    private final Map<String, ContentNode.Element> elements = new LinkedHashMap<>();

    public Builder(int maxAllGroupSize, AllGroupOverflow allGroupOverflow) {
      super(maxAllGroupSize, allGroupOverflow);
    }

    @Override
    public int freshState() {
      transitions.add(new LinkedHashMap<>());
      incomingCounts.add(0);
      return transitions.size() - 1;
    }

    @Override
    public void addTransition(int from, EnfaTransition label, Target to) {
      final boolean added = transitions
        .get(from)
        .computeIfAbsent(label, k -> new LinkedHashSet<>())
        .add(to);
      if (added && to instanceof Target.Resolved resolved) {
        countIncoming(resolved.state());
      }
    }

    @Override
    public void patch(int state, int to) {
      boolean patched = false;
      for (Set<Target> targets : transitions.get(state).values()) {
        if (targets.remove(Target.PENDING)) {
          if (targets.add(new Target.Resolved(to))) {
            countIncoming(to);
          }
          patched = true;
        }
      }

      // Every vacant state is patched exactly once, by the fragment that follows it
      if (!patched) {
        throw new IllegalStateException("State " + state + " has no pending transition to patch");
      }
    }

    @Override
    public boolean hasIncomingTransitions(int state) {
      return incomingCounts.get(state) > 0;
    }

    @Override
    public void registerElement(ContentNode.Element element) {
      elements.putIfAbsent(element.name(), element);
    }

    private void countIncoming(int state) {
      incomingCounts.set(state, incomingCounts.get(state) + 1);
    }

    /**
     * Finalize the construction of the NFA.
     *
     * @param root root of the content model
     * @return valid NFA, without any pending transitions
     */
    public Enfa constructEnfa(ContentNode root) {
      if (used) {
        throw new IllegalStateException("construct may only be called once on an NFA builder");
      } else {
        used = true;
      }

      final Fragment rootFragment = build(root);
      final int finalState = freshState();
      for (int vacant : rootFragment.vacant()) {
        patch(vacant, finalState);
      }

      final var states = new ArrayList<Map<EnfaTransition, SortedSet<Integer>>>(transitions.size());
      final var alphabet = new TreeSet<String>();
      for (int state = 0; state < transitions.size(); state++) {
        final var frozen = new LinkedHashMap<EnfaTransition, SortedSet<Integer>>();
        for (var entry : transitions.get(state).entrySet()) {
          final var targets = new TreeSet<Integer>();
          for (Target target : entry.getValue()) {
            if (target instanceof Target.Resolved resolved) {
              targets.add(resolved.state());
            } else {
              throw new IllegalStateException("State " + state + " still has a pending transition");
            }
          }
          if (entry.getKey() instanceof SymbolTransition symbol) {
            alphabet.add(symbol.symbol());
          }
          frozen.put(entry.getKey(), Collections.unmodifiableSortedSet(targets));
        }
        states.add(Collections.unmodifiableMap(frozen));
      }

      return new Enfa(
        Collections.unmodifiableList(states),
        rootFragment.start(),
        finalState,
        Collections.unmodifiableSortedSet(alphabet),
        Collections.unmodifiableSortedMap(new TreeMap<>(elements)),
        permutationsExpanded()
      );
    }
  }

  /**
   * Smallest superset of the given states closed under epsilon transitions.
   *
   * @param seeds states from which to start
   * @return epsilon closure of the seeds
   */
  public SortedSet<Integer> epsilonClosure(Collection<Integer> seeds) {
    final var closure = new TreeSet<Integer>(seeds);
    final var toVisit = new Stack<Integer>();
    toVisit.addAll(closure);

    while (!toVisit.isEmpty()) {
      final var targets = states.get(toVisit.pop()).get(EpsilonTransition.EPSILON);
      if (targets == null) {
        continue;
      }
      for (int target : targets) {
        if (closure.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return closure;
  }

  /**
   * States reached from any of the given states by consuming one symbol.
   *
   * <p>This does not follow epsilon transitions after the symbol.
   *
   * @param from states from which to start
   * @param symbol element symbol consumed
   * @return targets of the symbol transitions
   */
  public SortedSet<Integer> move(Collection<Integer> from, String symbol) {
    final var label = new SymbolTransition(symbol);
    final var targets = new TreeSet<Integer>();
    for (int state : from) {
      final var stateTargets = states.get(state).get(label);
      if (stateTargets != null) {
        targets.addAll(stateTargets);
      }
    }
    return targets;
  }

  /**
   * Simulate the NFA on a sequence of element symbols.
   *
   * @param input symbols of the child elements, in order
   * @return whether the NFA accepts the whole input
   */
  public boolean matches(List<String> input) {
    SortedSet<Integer> current = epsilonClosure(List.of(initialState));
    for (String symbol : input) {
      current = epsilonClosure(move(current, symbol));
      if (current.isEmpty()) {
        return false;
      }
    }
    return current.contains(finalState);
  }

  public int stateCount() {
    return states.size();
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return IntStream
      .range(0, states.size())
      .mapToObj((int id) -> new DotGraph.Vertex<Integer>(id, id == finalState));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, EnfaTransition>> edges() {
    final var transitionEdges = IntStream
      .range(0, states.size())
      .boxed()
      .flatMap((Integer from) -> states
        .get(from)
        .entrySet()
        .stream()
        .flatMap(entry -> entry
          .getValue()
          .stream()
          .map(to -> new DotGraph.Edge<>(from, to, entry.getKey()))
        )
      );
    final var initialEdge = Stream
      .of(new DotGraph.Edge<Integer, EnfaTransition>(null, initialState, null));
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, EnfaTransition> edge) {
    final EnfaTransition label = edge.label();
    return label == null ? "" : label.dotLabel();
  }
}
