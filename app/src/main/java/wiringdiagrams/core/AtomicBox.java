package wiringdiagrams.core;

import java.util.List;
import java.util.Objects;

/** Box holding an opaque morphism value together with individually typed ports. */
public record AtomicBox(Object value, List<Object> inputPorts, List<Object> outputPorts)
    implements Box {

  public AtomicBox {
    Objects.requireNonNull(value, "value");
    inputPorts = List.copyOf(inputPorts);
    outputPorts = List.copyOf(outputPorts);
  }

  @Override
  public BoxKind kind() {
    return BoxKind.ATOMIC;
  }

  @Override
  public String toString() {
    return value + ": " + inputPorts + " → " + outputPorts;
  }
}
