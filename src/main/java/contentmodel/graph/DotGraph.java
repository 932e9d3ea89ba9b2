package contentmodel.graph;

import java.util.stream.Stream;

/**
 * Automata which can be rendered using the DOT language.
 *
 * <p>Compile the output using {@code dot -Tsvg automaton.dot > automaton.svg}.
 *
 * @param <V> vertex in the graph
 * @param <E> label on edges in the graph
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * <p>An edge without a source vertex marks the initial state.
   *
   * @param from vertex where the edges starts (or no vertex if {@code null})
   * @param to vertex where the edges ends
   * @param label label on the edge (or no label if {@code null})
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : escapeHtml(label.toString());
  }

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + "];\n");
    }

    // Edges (the ones without a source get an invisible one)
    int entries = 0;
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final String from;
      if (edge.from() == null) {
        from = escapeId("_entry" + entries++);
        builder.append("  " + from + " [shape = none, label = <>];\n");
      } else {
        from = escapeId(edge.from().toString());
      }
      final var to = escapeId(edge.to().toString());
      builder.append("  " + from + " -> " + to + " [label = <" + renderEdgeLabel(edge) + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a DOT ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }

  /**
   * Escape text for use inside an HTML-like label.
   *
   * @param str raw text
   * @return text with markup characters replaced by entities
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }
}
