package contentmodel;

import contentmodel.graph.Dfa;
import contentmodel.graph.DotGraph;
import contentmodel.model.ContentNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Canonical, trap-free transition table of a minimal DFA.
 *
 * <p>This is what gets handed to code generation. States are numbered densely
 * from 0 in breadth-first order from the start state. Rejection is implicit:
 * any (state, symbol) pair without an entry in {@code transitions} rejects the
 * input.
 *
 * @param states every state ID
 * @param start initial state ID
 * @param accepts accepting state IDs
 * @param transitions state ID to element symbol to target state ID (states
 *                    without outgoing transitions have no row)
 * @param elements element descriptors keyed by their symbol
 */
public record AutomatonRecord(
  SortedSet<Integer> states,
  int start,
  SortedSet<Integer> accepts,
  SortedMap<Integer, SortedMap<String, Integer>> transitions,
  SortedMap<String, ContentNode.Element> elements
) implements DotGraph<Integer, String> {

  public AutomatonRecord {
    states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
    accepts = Collections.unmodifiableSortedSet(new TreeSet<>(accepts));
    elements = Collections.unmodifiableSortedMap(new TreeMap<>(elements));

    if (!states.contains(start)) {
      throw new IllegalArgumentException("Start state " + start + " is not a state");
    }
    if (!states.containsAll(accepts)) {
      throw new IllegalArgumentException("Accepting states " + accepts + " are not all states");
    }

    final var copiedTransitions = new TreeMap<Integer, SortedMap<String, Integer>>();
    for (var row : transitions.entrySet()) {
      if (!states.contains(row.getKey())) {
        throw new IllegalArgumentException("Transitions from unknown state " + row.getKey());
      }
      if (row.getValue().isEmpty()) {
        continue;
      }
      for (var cell : row.getValue().entrySet()) {
        if (!elements.containsKey(cell.getKey())) {
          throw new IllegalArgumentException("No element descriptor for symbol " + cell.getKey());
        }
        if (!states.contains(cell.getValue())) {
          throw new IllegalArgumentException(
            "Transition " + row.getKey() + " --" + cell.getKey() + "--> " + cell.getValue()
              + " targets an unknown state"
          );
        }
      }
      copiedTransitions.put(row.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(row.getValue())));
    }
    transitions = Collections.unmodifiableSortedMap(copiedTransitions);
  }

  /**
   * Renumber the states of a minimal DFA and package it up.
   *
   * <p>Only states reachable from the initial state are kept. They are
   * numbered in breadth-first order, visiting symbols in sorted order.
   *
   * @param dfa minimized DFA (without any state equivalent to the trap)
   * @param elements descriptors of the elements in the content model
   * @return canonical record
   */
  public static AutomatonRecord fromDfa(Dfa dfa, Map<String, ContentNode.Element> elements) {
    final var renumbered = new HashMap<Integer, Integer>();
    final var toVisit = new ArrayDeque<Integer>();
    renumbered.put(dfa.initialState, 0);
    toVisit.add(dfa.initialState);

    final var transitions = new TreeMap<Integer, SortedMap<String, Integer>>();
    while (!toVisit.isEmpty()) {
      final int state = toVisit.poll();
      final var row = new TreeMap<String, Integer>();
      for (var transition : dfa.states.get(state).entrySet()) {
        final int target = transition.getValue();
        Integer targetId = renumbered.get(target);
        if (targetId == null) {
          targetId = renumbered.size();
          renumbered.put(target, targetId);
          toVisit.add(target);
        }
        row.put(transition.getKey(), targetId);
      }
      transitions.put(renumbered.get(state), row);
    }

    final var states = new TreeSet<Integer>(renumbered.values());
    final var accepts = new TreeSet<Integer>();
    for (var entry : renumbered.entrySet()) {
      if (dfa.acceptingStates.contains(entry.getKey())) {
        accepts.add(entry.getValue());
      }
    }

    return new AutomatonRecord(states, 0, accepts, transitions, new TreeMap<>(elements));
  }

  /**
   * Element symbols, in the order code generation indexes them.
   *
   * @return sorted element symbols
   */
  public List<String> alphabet() {
    return List.copyOf(elements.keySet());
  }

  /**
   * Transitions out of one state.
   *
   * @param state state ID
   * @return element symbol to target state (empty if every symbol rejects)
   */
  public SortedMap<String, Integer> transitionsFrom(int state) {
    return transitions.getOrDefault(state, Collections.emptySortedMap());
  }

  /**
   * Run the table on a sequence of element symbols.
   *
   * @param input symbols of the child elements, in order
   * @return whether the whole input is accepted
   */
  public boolean matches(List<String> input) {
    int currentState = start;
    for (String symbol : input) {
      final Integer nextState = transitionsFrom(currentState).get(symbol);
      if (nextState == null) {
        return false;
      }
      currentState = nextState;
    }
    return accepts.contains(currentState);
  }

  @Override
  public Stream<Vertex<Integer>> vertices() {
    return states.stream().map(id -> new Vertex<>(id, accepts.contains(id)));
  }

  @Override
  public Stream<Edge<Integer, String>> edges() {
    final var edges = new ArrayList<Edge<Integer, String>>();
    edges.add(new Edge<>(null, start, null));
    for (var row : transitions.entrySet()) {
      for (var cell : row.getValue().entrySet()) {
        edges.add(new Edge<>(row.getKey(), cell.getValue(), cell.getKey()));
      }
    }
    return edges.stream();
  }
}
