package wiringdiagrams.core;

import java.util.List;

/**
 * Node of a {@link WiringDiagram}.
 *
 * <p>The set of implementations is closed: {@link AtomicBox}, {@link GeneratorBox} and {@link
 * Junction}. Passes dispatch on {@link #kind()} rather than on the runtime class.
 */
public interface Box {

  BoxKind kind();

  /** Opaque value carried by the box: the morphism for atomic boxes, the port value otherwise. */
  Object value();

  /** Value tag of every input port, in port order. */
  List<Object> inputPorts();

  /** Value tag of every output port, in port order. */
  List<Object> outputPorts();

  default int inputCount() {
    return inputPorts().size();
  }

  default int outputCount() {
    return outputPorts().size();
  }

  static AtomicBox atomic(Object value, List<?> inputPorts, List<?> outputPorts) {
    return new AtomicBox(value, List.copyOf(inputPorts), List.copyOf(outputPorts));
  }

  static GeneratorBox copy(Object value) {
    return new GeneratorBox(BoxKind.COPY, value);
  }

  static GeneratorBox merge(Object value) {
    return new GeneratorBox(BoxKind.MERGE, value);
  }

  static GeneratorBox delete(Object value) {
    return new GeneratorBox(BoxKind.DELETE, value);
  }

  static GeneratorBox create(Object value) {
    return new GeneratorBox(BoxKind.CREATE, value);
  }

  static Junction junction(Object value, int inputCount, int outputCount) {
    return new Junction(value, inputCount, outputCount);
  }
}
