package regexnfa.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * @param <V> vertex in the graph
 * @param <E> edge label in the graph
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
   * @param from vertex where the edge starts (or the entry arrow if {@code null})
   * @param to vertex where the edge ends
   * @param label label on the edge ({@code null} for the entry arrow)
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph, including a single entry edge (with no
   * {@code from}) pointing at the initial vertex.
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
    return label == null ? "" : label.toString();
  }

  /**
   * Extra DOT attributes for an edge (for instance a line style).
   *
   * @param edge edge being rendered
   * @return attributes, each prefixed with {@code ", "}, or an empty string
   */
  default String renderEdgeAttributes(Edge<V, E> edge) {
    return "";
  }

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph ").append(escapeId(name)).append(" {\n");
    builder.append("  rankdir = LR;\n");

    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      builder
        .append("  ")
        .append(escapeId(vertex.id().toString()))
        .append(" [shape = ")
        .append(vertex.accepting() ? "doublecircle" : "circle")
        .append("];\n");
    }

    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final String to = escapeId(edge.to().toString());
      if (edge.from() == null) {
        builder.append("  \"_entry\" [shape = none, label = <>];\n");
        builder.append("  \"_entry\" -> ").append(to).append(";\n");
      } else {
        builder
          .append("  ")
          .append(escapeId(edge.from().toString()))
          .append(" -> ")
          .append(to)
          .append(" [label = <")
          .append(renderEdgeLabel(edge))
          .append(">")
          .append(renderEdgeAttributes(edge))
          .append("];\n");
      }
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a double-quoted DOT ID.
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
