package wiringdiagrams.graphviz;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pretty-printer for the DOT language.
 *
 * <p>Bodies are indented by two spaces per nesting level. Default {@code graph}, {@code node} and
 * {@code edge} attribute statements come first (each only when non-empty), then one statement per
 * line.
 */
public final class GraphvizPrinter {
  private static final Joiner ATTRIBUTE_JOINER = Joiner.on(',');
  private static final int INDENT = 2;

  private GraphvizPrinter() {}

  public static String print(Graph graph) {
    StringBuilder out = new StringBuilder();
    print(graph, out);
    return out.toString();
  }

  public static void print(Graph graph, Appendable out) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(out, "out");
    try {
      printGraph(graph, out);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static void printGraph(Graph graph, Appendable out) throws IOException {
    out.append(graph.directed() ? "digraph " : "graph ").append(graph.name()).append(" {\n");
    printDefaults(out, INDENT, graph.graphAttrs(), graph.nodeAttrs(), graph.edgeAttrs());
    for (Statement stmt : graph.stmts()) {
      printStatement(stmt, out, INDENT, graph.directed());
      out.append('\n');
    }
    out.append("}\n");
  }

  private static void printStatement(Statement stmt, Appendable out, int indent, boolean directed)
      throws IOException {
    if (stmt instanceof Subgraph subgraph) {
      printSubgraph(subgraph, out, indent, directed);
    } else if (stmt instanceof Node node) {
      indent(out, indent);
      out.append(node.name()).append(attributeList(node.attrs())).append(';');
    } else if (stmt instanceof Edge edge) {
      indent(out, indent);
      List<String> endpoints = new ArrayList<>(edge.path().size());
      for (NodeId node : edge.path()) {
        endpoints.add(nodeId(node));
      }
      out.append(String.join(directed ? " -> " : " -- ", endpoints));
      out.append(attributeList(edge.attrs())).append(';');
    } else {
      throw new IllegalArgumentException("Unsupported statement: " + stmt);
    }
  }

  private static void printSubgraph(
      Subgraph subgraph, Appendable out, int indent, boolean directed) throws IOException {
    indent(out, indent);
    if (subgraph.name().isEmpty()) {
      out.append("{\n");
    } else {
      out.append("subgraph ").append(subgraph.name()).append(" {\n");
    }
    printDefaults(
        out, indent + INDENT, subgraph.graphAttrs(), subgraph.nodeAttrs(), subgraph.edgeAttrs());
    for (Statement stmt : subgraph.stmts()) {
      printStatement(stmt, out, indent + INDENT, directed);
      out.append('\n');
    }
    indent(out, indent);
    out.append('}');
  }

  private static void printDefaults(
      Appendable out, int indent, Attributes graph, Attributes node, Attributes edge)
      throws IOException {
    printDefault(out, indent, "graph", graph);
    printDefault(out, indent, "node", node);
    printDefault(out, indent, "edge", edge);
  }

  private static void printDefault(Appendable out, int indent, String keyword, Attributes attrs)
      throws IOException {
    if (attrs.isEmpty()) {
      return;
    }
    indent(out, indent);
    out.append(keyword).append(attributeList(attrs)).append(";\n");
  }

  /** {@code " [k=v,...]"}, or the empty string for no attributes. */
  static String attributeList(Attributes attrs) {
    if (attrs.isEmpty()) {
      return "";
    }
    List<String> pairs = new ArrayList<>(attrs.size());
    for (Map.Entry<String, Object> entry : attrs.asMap().entrySet()) {
      pairs.add(entry.getKey() + "=" + attributeValue(entry.getValue()));
    }
    return " [" + ATTRIBUTE_JOINER.join(pairs) + "]";
  }

  static String attributeValue(Object value) {
    if (value instanceof Html html) {
      return "<" + html.content() + ">";
    }
    return "\"" + value.toString().replace("\"", "\\\"") + "\"";
  }

  private static String nodeId(NodeId node) {
    StringBuilder sb = new StringBuilder(node.name());
    if (!node.port().isEmpty()) {
      sb.append(':').append(node.port());
    }
    if (!node.anchor().isEmpty()) {
      sb.append(':').append(node.anchor());
    }
    return sb.toString();
  }

  private static void indent(Appendable out, int width) throws IOException {
    out.append(" ".repeat(width));
  }
}
