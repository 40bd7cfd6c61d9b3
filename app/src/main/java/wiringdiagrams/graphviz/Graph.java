package wiringdiagrams.graphviz;

import java.util.List;
import java.util.Objects;

/** Top-level {@code graph} or {@code digraph}. */
public record Graph(
    String name,
    boolean directed,
    List<Statement> stmts,
    Attributes graphAttrs,
    Attributes nodeAttrs,
    Attributes edgeAttrs) {

  public Graph {
    Objects.requireNonNull(name, "name");
    stmts = List.copyOf(Objects.requireNonNull(stmts, "stmts"));
    graphAttrs = Attributes.copyOf(graphAttrs);
    nodeAttrs = Attributes.copyOf(nodeAttrs);
    edgeAttrs = Attributes.copyOf(edgeAttrs);
  }

  public static Graph digraph(String name, List<Statement> stmts) {
    return new Graph(name, true, stmts, null, null, null);
  }

  public static Graph undirected(String name, List<Statement> stmts) {
    return new Graph(name, false, stmts, null, null, null);
  }
}
