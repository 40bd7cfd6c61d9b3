package wiringdiagrams.graphviz;

import java.util.Objects;

public record Node(String name, Attributes attrs) implements Statement {

  public Node {
    Objects.requireNonNull(name, "name");
    attrs = Attributes.copyOf(attrs);
  }

  public Node(String name) {
    this(name, new Attributes());
  }
}
