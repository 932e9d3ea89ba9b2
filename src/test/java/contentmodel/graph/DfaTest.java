package contentmodel.graph;

import static contentmodel.model.ContentNode.all;
import static contentmodel.model.ContentNode.choice;
import static contentmodel.model.ContentNode.element;
import static contentmodel.model.ContentNode.sequence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import contentmodel.model.ContentNode;
import contentmodel.model.Occurs;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import org.junit.jupiter.api.Test;

final class DfaTest {

  private static Dfa determinize(ContentNode root) {
    return Dfa.fromEnfa(Enfa.fromContentModel(root, 6, AllGroupOverflow.REJECT));
  }

  @Test
  void subsetConstructionOfSequence() {
    final Dfa dfa = determinize(sequence(element("A"), element("B")));

    assertThat(dfa.initialState).isEqualTo(0);
    assertThat(dfa.alphabet).containsExactly("A", "B");
    assertThat(dfa.states).isEqualTo(Map.of(0, Map.of("A", 1), 1, Map.of("B", 2), 2, Map.of()));
    assertThat(dfa.acceptingStates).containsExactly(2);
  }

  @Test
  void subsetConstructionMergesChoiceTargets() {
    final Dfa dfa = determinize(choice(element("A"), element("B")));

    // Both branches lead to the same set of NFA states
    assertThat(dfa.stateCount()).isEqualTo(2);
    assertThat(dfa.states.get(0)).isEqualTo(Map.of("A", 1, "B", 1));
    assertThat(dfa.acceptingStates).containsExactly(1);
  }

  @Test
  void subsetConstructionNumbersInDiscoveryOrder() {
    // A, then either C D or B D
    final Dfa dfa = determinize(
      sequence(element("A"), choice(sequence(element("C"), element("D")), sequence(element("B"), element("D"))))
    );

    assertThat(dfa.states.get(0)).isEqualTo(Map.of("A", 1));
    assertThat(dfa.states.get(1)).isEqualTo(Map.of("B", 2, "C", 3));
    assertThat(dfa.states.get(2)).isEqualTo(Map.of("D", 4));
    assertThat(dfa.states.get(3)).isEqualTo(Map.of("D", 4));
    assertThat(dfa.acceptingStates).containsExactly(4);
  }

  @Test
  void minimizationMergesEquivalentStates() {
    final Map<Integer, Map<String, Integer>> states = Map.of(
      0, Map.of("a", 1, "b", 2),
      1, Map.of("a", 3),
      2, Map.of("a", 3),
      3, Map.of()
    );
    final Dfa dfa = new Dfa(states, Set.of(3), 0, Set.of("a", "b"));
    final Dfa minimal = dfa.minimized();

    assertThat(minimal.stateCount()).isEqualTo(3);
    assertThat(minimal.initialState).isEqualTo(0);
    assertThat(minimal.states).isEqualTo(Map.of(0, Map.of("a", 1, "b", 1), 1, Map.of("a", 3), 3, Map.of()));
    assertThat(minimal.acceptingStates).containsExactly(3);
  }

  @Test
  void minimizationDropsDeadStates() {
    final Map<Integer, Map<String, Integer>> states = Map.of(
      0, Map.of("a", 1, "b", 2),
      1, Map.of(),
      2, Map.of("a", 2, "b", 2)
    );
    final Dfa minimal = new Dfa(states, Set.of(1), 0, Set.of("a", "b")).minimized();

    assertThat(minimal.states).isEqualTo(Map.of(0, Map.of("a", 1), 1, Map.of()));
    assertThat(minimal.matches(List.of("a"))).isTrue();
    assertThat(minimal.matches(List.of("b"))).isFalse();
  }

  @Test
  void emptyLanguageKeepsOnlyTheInitialState() {
    final Map<Integer, Map<String, Integer>> states = Map.of(0, Map.of("a", 1), 1, Map.of("a", 0));
    final Dfa minimal = new Dfa(states, Set.of(), 0, Set.of("a")).minimized();

    assertThat(minimal.states).isEqualTo(Map.of(0, Map.of()));
    assertThat(minimal.initialState).isEqualTo(0);
    assertThat(minimal.acceptingStates).isEmpty();
  }

  @Test
  void trapLandsInExactlyOneBlock() {
    final Dfa dfa = determinize(sequence(element("A"), element("B", Occurs.OPTIONAL)));
    final Set<SortedSet<Integer>> partition = dfa.minimizedDfaPartition();

    assertThat(partition)
      .filteredOn(block -> block.contains(dfa.trapState()))
      .hasSize(1);
    assertThat(partition.stream().mapToInt(Set::size).sum()).isEqualTo(dfa.stateCount() + 1);
  }

  @Test
  void allGroupMinimizesToSubsetLattice() {
    final Dfa dfa = determinize(all(element("A"), element("B"), element("C")));
    final Dfa minimal = dfa.minimized();

    // One state per subset of children consumed so far
    assertThat(dfa.stateCount()).isGreaterThan(8);
    assertThat(minimal.stateCount()).isEqualTo(8);
    assertThat(minimal.acceptingStates).hasSize(1);
  }

  @Test
  void minimizationIsIdempotent() {
    final List<ContentNode> models = List.of(
      all(element("A"), element("B"), element("C")),
      sequence(element("A", Occurs.ZERO_OR_MORE), element("B")).withOccurs(Occurs.ONE_OR_MORE),
      choice(sequence(element("A"), element("B")), sequence(element("A"), element("C"))),
      choice()
    );

    for (ContentNode model : models) {
      final Dfa minimal = determinize(model).minimized();
      final Dfa again = minimal.minimized();

      assertThat(again.states).isEqualTo(minimal.states);
      assertThat(again.acceptingStates).isEqualTo(minimal.acceptingStates);
      assertThat(again.initialState).isEqualTo(minimal.initialState);
    }
  }

  @Test
  void constructorValidatesStates() {
    final Map<Integer, Map<String, Integer>> dangling = Map.of(0, Map.of("a", 1));
    assertThatIllegalArgumentException()
      .isThrownBy(() -> new Dfa(dangling, Set.of(), 0, Set.of("a")))
      .withMessageContaining("unknown state");

    final Map<Integer, Map<String, Integer>> foreign = Map.of(0, Map.of("z", 0));
    assertThatIllegalArgumentException()
      .isThrownBy(() -> new Dfa(foreign, Set.of(), 0, Set.of("a")))
      .withMessageContaining("alphabet");

    final Map<Integer, Map<String, Integer>> single = Map.of(0, Map.of());
    assertThatIllegalArgumentException().isThrownBy(() -> new Dfa(single, Set.of(), 1, Set.of()));
    assertThatIllegalArgumentException().isThrownBy(() -> new Dfa(single, Set.of(4), 0, Set.of()));
  }

  @Test
  void dotGraphMarksAcceptingStates() {
    final String dot = determinize(element("A")).dotGraph("dfa");

    assertThat(dot)
      .contains("\"0\" [shape = circle];")
      .contains("\"1\" [shape = doublecircle];")
      .contains("\"0\" -> \"1\" [label = <A>];");
  }
}
