package wiringdiagrams.cli;

import java.nio.file.Path;
import java.util.List;

/** Ids are box ids as written in the diagram file. */
record OrderOptions(Path file, List<Integer> nodes, List<Integer> sources, List<Integer> targets) {

  OrderOptions {
    nodes = List.copyOf(nodes);
    sources = sources == null ? List.of() : List.copyOf(sources);
    targets = targets == null ? List.of() : List.copyOf(targets);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path file;
    private List<Integer> nodes = List.of();
    private List<Integer> sources = List.of();
    private List<Integer> targets = List.of();

    Builder file(Path file) {
      this.file = file;
      return this;
    }

    Builder nodes(List<Integer> nodes) {
      this.nodes = nodes;
      return this;
    }

    Builder sources(List<Integer> sources) {
      this.sources = sources;
      return this;
    }

    Builder targets(List<Integer> targets) {
      this.targets = targets;
      return this;
    }

    OrderOptions build() {
      if (file == null) {
        throw new IllegalArgumentException("--file is required");
      }
      if (nodes.isEmpty()) {
        throw new IllegalArgumentException("--nodes is required");
      }
      return new OrderOptions(file, nodes, sources, targets);
    }
  }
}
