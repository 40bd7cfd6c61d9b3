package wiringdiagrams.cli;

import java.nio.file.Path;
import wiringdiagrams.graphics.GraphvizOptions;
import wiringdiagrams.graphics.GraphvizOptions.Direction;

record RenderOptions(
    Path file,
    Direction direction,
    boolean edgeLabels,
    boolean orderNodes,
    boolean outerPorts,
    Path output) {

  RenderOptions {
    direction = direction == null ? Direction.VERTICAL : direction;
  }

  GraphvizOptions graphvizOptions() {
    return GraphvizOptions.builder()
        .direction(direction)
        .edgeLabels(edgeLabels)
        .orderNodes(orderNodes)
        .outerPorts(outerPorts)
        .build();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path file;
    private Direction direction = Direction.VERTICAL;
    private boolean edgeLabels;
    private boolean orderNodes;
    private boolean outerPorts = true;
    private Path output;

    Builder file(Path file) {
      this.file = file;
      return this;
    }

    Builder direction(Direction direction) {
      this.direction = direction;
      return this;
    }

    Builder edgeLabels(boolean edgeLabels) {
      this.edgeLabels = edgeLabels;
      return this;
    }

    Builder orderNodes(boolean orderNodes) {
      this.orderNodes = orderNodes;
      return this;
    }

    Builder outerPorts(boolean outerPorts) {
      this.outerPorts = outerPorts;
      return this;
    }

    Builder output(Path output) {
      this.output = output;
      return this;
    }

    RenderOptions build() {
      if (file == null) {
        throw new IllegalArgumentException("--file is required");
      }
      return new RenderOptions(file, direction, edgeLabels, orderNodes, outerPorts, output);
    }
  }
}
