package wiringdiagrams.graphviz;

import java.util.List;
import java.util.Objects;

/** Edge statement; a path of more than two nodes prints as a chain {@code a -> b -> c}. */
public record Edge(List<NodeId> path, Attributes attrs) implements Statement {

  public Edge {
    path = List.copyOf(Objects.requireNonNull(path, "path"));
    if (path.size() < 2) {
      throw new IllegalArgumentException("An edge needs at least two nodes, got " + path.size());
    }
    attrs = Attributes.copyOf(attrs);
  }

  public static Edge of(NodeId source, NodeId target, Attributes attrs) {
    return new Edge(List.of(source, target), attrs);
  }

  public static Edge of(String source, String target) {
    return new Edge(List.of(NodeId.of(source), NodeId.of(target)), new Attributes());
  }
}
