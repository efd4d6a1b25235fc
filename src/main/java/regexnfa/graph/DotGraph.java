package regexnfa.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * <p>Labels are emitted as HTML-like labels, so anything rendered through
 * {@link #renderEdgeLabel} or {@link #renderVertexLabel} has its markup
 * characters escaped.
 *
 * @param <V> vertex in the graph
 * @param <E> edge in the graph
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
   * @param from vertex where the edge starts (or no vertex if {@code null})
   * @param to vertex where the edge ends
   * @param label label on the edge
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  public Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  public Stream<Edge<V, E>> edges();

  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : escapeHtml(label.toString());
  }

  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(vertex.id().toString());
  }

  /**
   * Render the graph into its DOT source.
   *
   * <p>Edges without a source vertex (eg. the arrow into the start state) are
   * drawn from invisible generated vertices.
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
        .append(", label = <")
        .append(renderVertexLabel(vertex))
        .append(">];\n");
    }

    int generated = 0;
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final String from;
      if (edge.from() == null) {
        from = escapeId("_gen" + ++generated);
        builder.append("  ").append(from).append(" [shape = none, label = <>];\n");
      } else {
        from = escapeId(edge.from().toString());
      }
      builder
        .append("  ")
        .append(from)
        .append(" -> ")
        .append(escapeId(edge.to().toString()))
        .append(" [label = <")
        .append(renderEdgeLabel(edge))
        .append(">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Escape text for use inside an HTML-like label.
   *
   * @param str raw text
   * @return text with {@code &}, {@code <}, {@code >} and {@code "} escaped
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
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
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
