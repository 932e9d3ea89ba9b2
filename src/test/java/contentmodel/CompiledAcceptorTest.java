package contentmodel;

import static contentmodel.model.ContentNode.all;
import static contentmodel.model.ContentNode.choice;
import static contentmodel.model.ContentNode.element;
import static contentmodel.model.ContentNode.sequence;
import static org.assertj.core.api.Assertions.assertThat;

import contentmodel.model.ContentNode;
import contentmodel.model.Occurs;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

final class CompiledAcceptorTest {

  /**
   * Check the generated methods against the table, cell by cell.
   */
  private static void assertAgreesWithTable(CompiledAcceptor acceptor) {
    final AutomatonRecord record = acceptor.record();
    final List<String> alphabet = record.alphabet();

    assertThat(acceptor.initialState()).isEqualTo(record.start());
    for (int state : record.states()) {
      assertThat(acceptor.isAccepting(state)).as("accepting %d", state).isEqualTo(record.accepts().contains(state));
      for (int symbol = 0; symbol < alphabet.size(); symbol++) {
        final Integer expected = record.transitionsFrom(state).get(alphabet.get(symbol));
        assertThat(acceptor.step(state, symbol))
          .as("step(%d, %s)", state, alphabet.get(symbol))
          .isEqualTo(expected == null ? CompiledAcceptor.TRAP_STATE : expected);
      }
      assertThat(acceptor.step(state, alphabet.size())).isEqualTo(CompiledAcceptor.TRAP_STATE);
    }
  }

  @Test
  void scenariosCompile() throws Exception {
    final List<ContentNode> models = List.of(
      element("A"),
      element("A", Occurs.OPTIONAL),
      sequence(element("A"), element("B")),
      choice(element("A"), element("B")),
      element("A", Occurs.ZERO_OR_MORE),
      all(element("A"), element("B"), element("C"), element("D"), element("E")),
      choice()
    );

    for (ContentNode model : models) {
      assertAgreesWithTable(CompiledAcceptor.compile(ContentModelCompiler.buildDfa(model)));
    }
  }

  @Test
  void matchesSequences() throws Exception {
    final CompiledAcceptor acceptor = CompiledAcceptor.compile(
      ContentModelCompiler.buildDfa(sequence(element("A"), element("B", Occurs.ONE_OR_MORE)))
    );

    assertThat(acceptor.matches(List.of("A", "B"))).isTrue();
    assertThat(acceptor.matches(List.of("A", "B", "B", "B"))).isTrue();
    assertThat(acceptor.matches(List.of("A"))).isFalse();
    assertThat(acceptor.matches(List.of("B", "A"))).isFalse();
    assertThat(acceptor.matches(List.of("A", "C"))).isFalse();
    assertThat(acceptor.matches(List.of())).isFalse();
  }

  @Test
  void symbolIndicesFollowTheAlphabet() throws Exception {
    final CompiledAcceptor acceptor = CompiledAcceptor.compile(
      ContentModelCompiler.buildDfa(choice(element("b"), element("c"), element("a")))
    );

    assertThat(acceptor.symbolIndex("a")).isEqualTo(0);
    assertThat(acceptor.symbolIndex("b")).isEqualTo(1);
    assertThat(acceptor.symbolIndex("c")).isEqualTo(2);
    assertThat(acceptor.symbolIndex("d")).isEqualTo(-1);
  }

  @Test
  void sparseStateIdsUseLookupSwitches() throws Exception {
    final var transitions = new TreeMap<Integer, SortedMap<String, Integer>>();
    transitions.put(5, new TreeMap<>(Map.of("a", 10)));
    transitions.put(10, new TreeMap<>(Map.of("b", 0)));
    transitions.put(0, new TreeMap<>(Map.of("a", 5, "c", 0)));
    final var record = new AutomatonRecord(
      new TreeSet<>(List.of(0, 5, 10)),
      5,
      new TreeSet<>(List.of(10)),
      transitions,
      new TreeMap<>(Map.of("a", element("a"), "b", element("b"), "c", element("c")))
    );

    final CompiledAcceptor acceptor = CompiledAcceptor.compile(record);
    assertAgreesWithTable(acceptor);
    assertThat(acceptor.matches(List.of("a"))).isTrue();
    assertThat(acceptor.matches(List.of("a", "b", "c", "a", "a"))).isTrue();
    assertThat(acceptor.matches(List.of("a", "b"))).isFalse();
  }

  @Test
  void eachCompileDefinesAFreshClass() throws Exception {
    final AutomatonRecord record = ContentModelCompiler.buildDfa(element("A"));
    final CompiledAcceptor first = CompiledAcceptor.compile(record);
    final CompiledAcceptor second = CompiledAcceptor.compile(record);

    assertThat(first.getClass()).isNotSameAs(second.getClass());
    assertThat(first.getClass().isHidden()).isTrue();
    assertThat(first.getClass().getSuperclass()).isEqualTo(CompiledAcceptor.class);
    assertThat(first.record()).isSameAs(record);
    assertThat(first).asString().contains("2 states");
  }
}
