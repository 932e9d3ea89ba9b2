package contentmodel.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic finite state automaton over element symbols.
 *
 * <p>The transition function is partial: a missing transition goes to an
 * implicit trap state, which is never accepting and which no transition
 * leaves.
 */
public class Dfa implements DotGraph<Integer, String> {

  /**
   * Full set of states inside the DFA.
   *
   * <p>Each state maps element symbols to the target state. Every state in the
   * DFA is in this map, even if it does not have any outgoing transitions.
   */
  public final SortedMap<Integer, SortedMap<String, Integer>> states;

  /**
   * Accepting states in the DFA.
   */
  public final SortedSet<Integer> acceptingStates;

  /**
   * Initial state of the DFA.
   */
  public final int initialState;

  /**
   * Element symbols the DFA reads.
   */
  public final SortedSet<String> alphabet;

  public Dfa(
    Map<Integer, ? extends Map<String, Integer>> states,
    Set<Integer> acceptingStates,
    int initialState,
    Set<String> alphabet
  ) {
    final var copiedStates = new TreeMap<Integer, SortedMap<String, Integer>>();
    for (var entry : states.entrySet()) {
      for (var transition : entry.getValue().entrySet()) {
        if (!states.containsKey(transition.getValue())) {
          throw new IllegalArgumentException(
            "Transition " + entry.getKey() + " --" + transition.getKey() + "--> "
              + transition.getValue() + " targets an unknown state"
          );
        }
        if (!alphabet.contains(transition.getKey())) {
          throw new IllegalArgumentException("Symbol " + transition.getKey() + " is not in the alphabet");
        }
      }
      copiedStates.put(entry.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(entry.getValue())));
    }
    if (!states.containsKey(initialState)) {
      throw new IllegalArgumentException("Initial state " + initialState + " is not a state");
    }
    if (!states.keySet().containsAll(acceptingStates)) {
      throw new IllegalArgumentException("Accepting states " + acceptingStates + " are not all states");
    }

    this.states = Collections.unmodifiableSortedMap(copiedStates);
    this.acceptingStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptingStates));
    this.initialState = initialState;
    this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
  }

  /**
   * Subset construction for building a DFA from an epsilon-NFA.
   *
   * <p>Every reachable set of NFA states becomes one DFA state (sets are
   * compared by contents) and DFA states are numbered in the order they are
   * discovered by a breadth-first search, visiting symbols in sorted order.
   * An empty set of NFA states is never materialized: that is the trap.
   *
   * @param nfa non-deterministic automaton
   * @return deterministic automaton accepting the same language
   */
  public static Dfa fromEnfa(Enfa nfa) {
    final var seenStates = new HashMap<SortedSet<Integer>, Integer>();
    final var toVisit = new ArrayDeque<SortedSet<Integer>>();

    final var states = new HashMap<Integer, Map<String, Integer>>();
    final var acceptingStates = new HashSet<Integer>();

    {
      final SortedSet<Integer> initial = nfa.epsilonClosure(List.of(nfa.initialState));
      seenStates.put(initial, 0);
      toVisit.add(initial);
    }

    while (!toVisit.isEmpty()) {
      final SortedSet<Integer> nfaStates = toVisit.poll();
      final int dfaState = seenStates.get(nfaStates);

      if (nfaStates.contains(nfa.finalState)) {
        acceptingStates.add(dfaState);
      }

      final var transitions = new HashMap<String, Integer>();
      for (String symbol : nfa.alphabet) {
        final SortedSet<Integer> successor = nfa.epsilonClosure(nfa.move(nfaStates, symbol));
        if (successor.isEmpty()) {
          continue;
        }

        Integer target = seenStates.get(successor);
        if (target == null) {
          target = seenStates.size();
          seenStates.put(successor, target);
          toVisit.add(successor);
        }
        transitions.put(symbol, target);
      }
      states.put(dfaState, transitions);
    }

    return new Dfa(states, acceptingStates, 0, nfa.alphabet);
  }

  /**
   * Extra state completing the transition function.
   *
   * @return ID one past the largest state
   */
  public int trapState() {
    return states.lastKey() + 1;
  }

  public int stateCount() {
    return states.size();
  }

  /**
   * Minimize the DFA.
   *
   * <p>Indistinguishable states are merged into the smallest of them. States
   * which cannot reach an accepting state are equivalent to the trap and get
   * dropped along with every transition into them. The one exception is the
   * initial state, which survives without transitions if the language is
   * empty.
   *
   * @return equivalent minimal DFA
   */
  public Dfa minimized() {
    final int trap = trapState();

    // Mapping from every state to the canonical state of its class
    final Map<Integer, Integer> canonicalStates = new HashMap<>();
    SortedSet<Integer> trapClass = null;
    for (final SortedSet<Integer> partition : minimizedDfaPartition()) {
      final int canonical = partition.first();
      for (final int state : partition) {
        canonicalStates.put(state, canonical);
      }
      if (partition.contains(trap)) {
        trapClass = partition;
      }
    }
    Objects.requireNonNull(trapClass, "trap state missing from partition");

    final var newStates = new HashMap<Integer, Map<String, Integer>>();
    final var newAcceptingStates = new HashSet<Integer>();
    for (final var entry : states.entrySet()) {
      final int fromState = entry.getKey();
      if (canonicalStates.get(fromState) != fromState || trapClass.contains(fromState)) {
        continue;
      }

      final var newTransitions = new HashMap<String, Integer>();
      for (final var transition : entry.getValue().entrySet()) {
        final int targetState = transition.getValue();
        if (!trapClass.contains(targetState)) {
          newTransitions.put(transition.getKey(), canonicalStates.get(targetState));
        }
      }
      newStates.put(fromState, newTransitions);
      if (acceptingStates.contains(fromState)) {
        newAcceptingStates.add(fromState);
      }
    }

    final int newInitialState = canonicalStates.get(initialState);
    if (trapClass.contains(initialState)) {
      newStates.put(newInitialState, Collections.emptyMap());
    }

    return new Dfa(newStates, newAcceptingStates, newInitialState, alphabet);
  }

  /**
   * Perform minimization and return the coarsest partition of the states
   * into indistinguishable classes.
   *
   * <p>The transition function is first completed using {@link #trapState()},
   * which consequently shows up in exactly one class of the output. The
   * refinement is Hopcroft's algorithm, run backwards over the reversed
   * transitions.
   *
   * @return a partition of the DFA states, plus the trap
   */
  public Set<SortedSet<Integer>> minimizedDfaPartition() {
    final int trap = trapState();
    final var allStates = new TreeSet<Integer>(states.keySet());
    allStates.add(trap);

    // Keys are target states and values are mappings from symbols to source states
    final Map<Integer, Map<String, Set<Integer>>> reversedTransitions = new HashMap<>();
    for (final int fromState : allStates) {
      final Map<String, Integer> transitions = states.getOrDefault(fromState, Collections.emptySortedMap());
      for (final String symbol : alphabet) {
        final int toState = transitions.getOrDefault(symbol, trap);
        reversedTransitions
          .computeIfAbsent(toState, k -> new HashMap<>())
          .computeIfAbsent(symbol, k -> new HashSet<>())
          .add(fromState);
      }
    }

    // Set up initial partition
    final var partition = new HashSet<SortedSet<Integer>>();
    final var sortedSetCollector = Collectors.<Integer, SortedSet<Integer>>toCollection(TreeSet::new);
    partition.add(new TreeSet<Integer>(acceptingStates));
    partition.add(
      allStates
        .stream()
        .filter(k -> !acceptingStates.contains(k))
        .collect(sortedSetCollector)
    );
    partition.removeIf(Set::isEmpty);

    // Mapping from states to their class in the partition
    final var stateToPartition = new HashMap<Integer, SortedSet<Integer>>();
    for (final var powerState : partition) {
      for (final var state : powerState) {
        stateToPartition.put(state, powerState);
      }
    }

    // Worklist
    final var toVisit = new HashSet<SortedSet<Integer>>(partition);

    while (!toVisit.isEmpty()) {
      final var powerState = toVisit.iterator().next();
      toVisit.remove(powerState);

      // Find all pre-images of this class, keyed by symbol
      final var reversedFromThisState = new HashMap<String, Set<Integer>>();
      for (final int state : powerState) {
        final var toTransitions = reversedTransitions.get(state);
        if (toTransitions != null) {
          for (final var entry : toTransitions.entrySet()) {
            reversedFromThisState
              .computeIfAbsent(entry.getKey(), k -> new HashSet<>())
              .addAll(entry.getValue());
          }
        }
      }

      // Figure out which pre-images require some refinement of partition sets
      for (final Set<Integer> targetSubset : reversedFromThisState.values()) {
        for (final int containedState : targetSubset) {
          final var oldPowerSet = stateToPartition.get(containedState);

          final var inTargetSubset = new TreeSet<Integer>();
          final var notInTargetSubset = new TreeSet<Integer>();
          for (final int state : oldPowerSet) {
            if (targetSubset.contains(state)) {
              inTargetSubset.add(state);
            } else {
              notInTargetSubset.add(state);
            }
          }

          // Skip to the next class if `oldPowerSet` needs no refinement
          if (notInTargetSubset.isEmpty()) {
            continue;
          }

          partition.remove(oldPowerSet);
          partition.add(inTargetSubset);
          partition.add(notInTargetSubset);

          for (final int state : inTargetSubset) {
            stateToPartition.put(state, inTargetSubset);
          }
          for (final int state : notInTargetSubset) {
            stateToPartition.put(state, notInTargetSubset);
          }

          // Both halves still need processing if the old class did, otherwise the smaller one suffices
          if (toVisit.remove(oldPowerSet)) {
            toVisit.add(inTargetSubset);
            toVisit.add(notInTargetSubset);
          } else if (inTargetSubset.size() < notInTargetSubset.size()) {
            toVisit.add(inTargetSubset);
          } else {
            toVisit.add(notInTargetSubset);
          }
        }
      }
    }

    return partition;
  }

  /**
   * Run the DFA on a sequence of element symbols.
   *
   * @param input symbols of the child elements, in order
   * @return whether the DFA accepts the whole input
   */
  public boolean matches(List<String> input) {
    int currentState = initialState;
    for (String symbol : input) {
      final Integer nextState = states.get(currentState).get(symbol);
      if (nextState == null) {
        return false;
      }
      currentState = nextState;
    }
    return acceptingStates.contains(currentState);
  }

  @Override
  public Stream<Vertex<Integer>> vertices() {
    return states
      .keySet()
      .stream()
      .map(id -> new Vertex<>(id, acceptingStates.contains(id)));
  }

  @Override
  public Stream<Edge<Integer, String>> edges() {
    final var initialEdge = Stream.of(new Edge<Integer, String>(null, initialState, null));
    final var innerEdges = states
      .entrySet()
      .stream()
      .flatMap(stateEntry -> stateEntry
        .getValue()
        .entrySet()
        .stream()
        .map(transition -> new Edge<>(stateEntry.getKey(), transition.getValue(), transition.getKey()))
      );
    return Stream.concat(initialEdge, innerEdges);
  }
}
