package wiringdiagrams.core;

import java.util.Objects;

/**
 * Reference to one port of a box: box id, port kind and 1-based port index.
 *
 * <p>The diagram's inputs are the {@link PortKind#OUTPUT} ports of {@link WiringDiagram#INPUT_ID}
 * and its outputs the {@link PortKind#INPUT} ports of {@link WiringDiagram#OUTPUT_ID}.
 */
public record Port(int box, PortKind kind, int port) {

  public Port {
    Objects.requireNonNull(kind, "kind");
    if (port < 1) {
      throw new InvalidPortException("Port indices are 1-based, got " + port);
    }
  }

  public static Port input(int box, int port) {
    return new Port(box, PortKind.INPUT, port);
  }

  public static Port output(int box, int port) {
    return new Port(box, PortKind.OUTPUT, port);
  }

  @Override
  public String toString() {
    String boxName =
        switch (box) {
          case WiringDiagram.INPUT_ID -> "input";
          case WiringDiagram.OUTPUT_ID -> "output";
          default -> Integer.toString(box);
        };
    return "(" + boxName + (kind == PortKind.INPUT ? ".in" : ".out") + port + ")";
  }
}
