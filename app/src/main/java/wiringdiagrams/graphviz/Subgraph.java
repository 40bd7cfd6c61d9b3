package wiringdiagrams.graphviz;

import java.util.List;
import java.util.Objects;

/** Subgraph statement; an empty name prints an anonymous {@code { ... }} block. */
public record Subgraph(
    String name,
    List<Statement> stmts,
    Attributes graphAttrs,
    Attributes nodeAttrs,
    Attributes edgeAttrs)
    implements Statement {

  public Subgraph {
    name = name == null ? "" : name;
    stmts = List.copyOf(Objects.requireNonNull(stmts, "stmts"));
    graphAttrs = Attributes.copyOf(graphAttrs);
    nodeAttrs = Attributes.copyOf(nodeAttrs);
    edgeAttrs = Attributes.copyOf(edgeAttrs);
  }

  public static Subgraph anonymous(
      List<Statement> stmts, Attributes graphAttrs, Attributes nodeAttrs, Attributes edgeAttrs) {
    return new Subgraph("", stmts, graphAttrs, nodeAttrs, edgeAttrs);
  }
}
