package contentmodel;

import static contentmodel.model.ContentNode.all;
import static contentmodel.model.ContentNode.choice;
import static contentmodel.model.ContentNode.element;
import static contentmodel.model.ContentNode.sequence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import contentmodel.graph.Dfa;
import contentmodel.model.ContentNode;
import contentmodel.model.Occurs;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

final class AutomatonRecordTest {

  private static final Map<String, ContentNode.Element> AB = Map.of("a", element("a"), "b", element("b"));

  private static AutomatonRecord record(
    Set<Integer> states,
    int start,
    Set<Integer> accepts,
    Map<Integer, Map<String, Integer>> transitions
  ) {
    final var sortedTransitions = new TreeMap<Integer, SortedMap<String, Integer>>();
    transitions.forEach((state, row) -> sortedTransitions.put(state, new TreeMap<>(row)));
    return new AutomatonRecord(new TreeSet<>(states), start, new TreeSet<>(accepts), sortedTransitions, new TreeMap<>(AB));
  }

  @Test
  void renumbersBreadthFirstFromStart() {
    final Map<Integer, Map<String, Integer>> states = Map.of(
      5, Map.of("b", 9, "a", 7),
      7, Map.of(),
      9, Map.of("a", 7),
      11, Map.of("a", 7)
    );
    final Dfa dfa = new Dfa(states, Set.of(7), 5, Set.of("a", "b"));
    final AutomatonRecord record = AutomatonRecord.fromDfa(dfa, AB);

    // State 11 is unreachable and dropped
    assertThat(record.states()).containsExactly(0, 1, 2);
    assertThat(record.start()).isZero();
    assertThat(record.accepts()).containsExactly(1);
    assertThat(record.transitions()).isEqualTo(Map.of(0, Map.of("a", 1, "b", 2), 2, Map.of("a", 1)));
    assertThat(record.transitionsFrom(1)).isEmpty();
  }

  @Test
  void compiledRecordsAreCanonicallyNumbered() {
    final List<ContentNode> models = List.of(
      all(element("A"), element("B"), element("C")),
      sequence(element("A"), choice(element("C"), element("B")).withOccurs(Occurs.ONE_OR_MORE), element("D")),
      sequence(element("A", Occurs.ZERO_OR_MORE), element("B")).withOccurs(Occurs.ZERO_OR_MORE)
    );

    for (ContentNode model : models) {
      final AutomatonRecord record = ContentModelCompiler.buildDfa(model);

      // Replaying the breadth-first numbering must give back the same IDs
      final var renumbered = new HashMap<Integer, Integer>();
      final var toVisit = new ArrayDeque<Integer>();
      renumbered.put(record.start(), 0);
      toVisit.add(record.start());
      while (!toVisit.isEmpty()) {
        for (int target : record.transitionsFrom(toVisit.poll()).values()) {
          if (!renumbered.containsKey(target)) {
            renumbered.put(target, renumbered.size());
            toVisit.add(target);
          }
        }
      }

      assertThat(renumbered).hasSize(record.states().size());
      renumbered.forEach((id, expected) -> assertThat(id).isEqualTo(expected));
      assertThat(record.states().last()).isEqualTo(record.states().size() - 1);
    }
  }

  @Test
  void emptyRowsAreOmitted() {
    final var record = record(Set.of(0, 1), 0, Set.of(1), Map.of(0, Map.of("a", 1), 1, Map.of()));

    assertThat(record.transitions()).containsOnlyKeys(0);
    assertThat(record.matches(List.of("a"))).isTrue();
    assertThat(record.matches(List.of("a", "a"))).isFalse();
    assertThat(record.matches(List.of("c"))).isFalse();
  }

  @Test
  void validatesConsistency() {
    assertThatIllegalArgumentException()
      .isThrownBy(() -> record(Set.of(0), 1, Set.of(), Map.of()));
    assertThatIllegalArgumentException()
      .isThrownBy(() -> record(Set.of(0), 0, Set.of(2), Map.of()));
    assertThatIllegalArgumentException()
      .isThrownBy(() -> record(Set.of(0), 0, Set.of(), Map.of(3, Map.of("a", 0))));
    assertThatIllegalArgumentException()
      .isThrownBy(() -> record(Set.of(0), 0, Set.of(), Map.of(0, Map.of("a", 4))))
      .withMessageContaining("unknown state");
    assertThatIllegalArgumentException()
      .isThrownBy(() -> record(Set.of(0), 0, Set.of(), Map.of(0, Map.of("z", 0))))
      .withMessageContaining("descriptor");
  }

  @Test
  void isImmutable() {
    final var record = ContentModelCompiler.buildDfa(sequence(element("A"), element("B")));

    assertThatThrownBy(() -> record.states().add(7)).isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> record.transitions().get(0).put("B", 0))
      .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> record.elements().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void alphabetIsSorted() {
    final var record = ContentModelCompiler.buildDfa(choice(element("Zeta"), element("alpha"), element("Beta")));
    assertThat(record.alphabet()).containsExactly("Beta", "Zeta", "alpha");
  }

  @Test
  void dotGraph() {
    final String dot = ContentModelCompiler.buildDfa(sequence(element("A"), element("B"))).dotGraph("AB");

    assertThat(dot).isEqualTo(String.join("\n",
      "digraph \"AB\" {",
      "  rankdir = LR;",
      "  \"0\" [shape = circle];",
      "  \"1\" [shape = circle];",
      "  \"2\" [shape = doublecircle];",
      "  \"_entry0\" [shape = none, label = <>];",
      "  \"_entry0\" -> \"0\" [label = <>];",
      "  \"0\" -> \"1\" [label = <A>];",
      "  \"1\" -> \"2\" [label = <B>];",
      "}"
    ));
  }
}
