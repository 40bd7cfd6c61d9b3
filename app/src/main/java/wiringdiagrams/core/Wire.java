package wiringdiagrams.core;

import java.util.Objects;

/** Directed connection from an output port to an input port. */
public record Wire(Port source, Port target) {

  public Wire {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if (source.kind() != PortKind.OUTPUT) {
      throw new InvalidPortException("Wire source must be an output port: " + source);
    }
    if (target.kind() != PortKind.INPUT) {
      throw new InvalidPortException("Wire target must be an input port: " + target);
    }
  }

  /** Wire from output {@code sourcePort} of {@code sourceBox} to input {@code targetPort}. */
  public static Wire of(int sourceBox, int sourcePort, int targetBox, int targetPort) {
    return new Wire(Port.output(sourceBox, sourcePort), Port.input(targetBox, targetPort));
  }

  /** Same wire with the source replaced. */
  public Wire withSource(Port newSource) {
    return new Wire(newSource, target);
  }

  /** Same wire with the target replaced. */
  public Wire withTarget(Port newTarget) {
    return new Wire(source, newTarget);
  }

  @Override
  public String toString() {
    return source + " => " + target;
  }
}
