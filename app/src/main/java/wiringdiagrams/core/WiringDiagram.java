package wiringdiagrams.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable port graph representing a morphism of a monoidal category.
 *
 * <p>Boxes live in an arena keyed by integer ids handed out by {@link #addBox(Box)}; ids are never
 * reused within one diagram. Wires refer to boxes by id only, so removing or adding boxes never
 * invalidates other references. The two sentinels {@link #INPUT_ID} and {@link #OUTPUT_ID} stand
 * for the outer boundary.
 *
 * <p>Equality is structural: two diagrams are equal when their boundaries agree and some bijection
 * between their box ids maps boxes onto equal boxes and wires onto wires. Port order inside a box
 * is significant.
 *
 * <p>Instances are not thread-safe; rewriting passes mutate them in place.
 */
public final class WiringDiagram {
  public static final int INPUT_ID = -1;
  public static final int OUTPUT_ID = -2;

  private final List<Object> inputPorts;
  private final List<Object> outputPorts;
  private final Map<Integer, Box> boxes;
  private final Set<Wire> wires;
  private int nextBoxId;

  public WiringDiagram(List<?> inputPorts, List<?> outputPorts) {
    this.inputPorts = List.copyOf(Objects.requireNonNull(inputPorts, "inputPorts"));
    this.outputPorts = List.copyOf(Objects.requireNonNull(outputPorts, "outputPorts"));
    this.boxes = new LinkedHashMap<>();
    this.wires = new LinkedHashSet<>();
    this.nextBoxId = 1;
  }

  private WiringDiagram(WiringDiagram other) {
    this.inputPorts = other.inputPorts;
    this.outputPorts = other.outputPorts;
    this.boxes = new LinkedHashMap<>(other.boxes);
    this.wires = new LinkedHashSet<>(other.wires);
    this.nextBoxId = other.nextBoxId;
  }

  /** Independent deep copy; boxes are immutable, so only the arena and wire set are copied. */
  public WiringDiagram copy() {
    return new WiringDiagram(this);
  }

  public int inputId() {
    return INPUT_ID;
  }

  public int outputId() {
    return OUTPUT_ID;
  }

  public List<Object> inputPorts() {
    return inputPorts;
  }

  public List<Object> outputPorts() {
    return outputPorts;
  }

  public static boolean isBoundary(int id) {
    return id == INPUT_ID || id == OUTPUT_ID;
  }

  // Boxes

  public int addBox(Box box) {
    Objects.requireNonNull(box, "box");
    int id = nextBoxId++;
    boxes.put(id, box);
    return id;
  }

  public List<Integer> addBoxes(List<? extends Box> newBoxes) {
    Objects.requireNonNull(newBoxes, "newBoxes");
    newBoxes.forEach(box -> Objects.requireNonNull(box, "box"));
    List<Integer> ids = new ArrayList<>(newBoxes.size());
    for (Box box : newBoxes) {
      ids.add(addBox(box));
    }
    return ids;
  }

  /** Removes a box together with every wire touching it. */
  public void removeBox(int id) {
    removeBoxes(List.of(id));
  }

  public void removeBoxes(Collection<Integer> ids) {
    Objects.requireNonNull(ids, "ids");
    for (Integer id : ids) {
      if (id == null || !boxes.containsKey(id)) {
        throw new UnknownBoxException("Cannot remove unknown box " + id);
      }
    }
    Set<Integer> doomed = Set.copyOf(ids);
    wires.removeIf(
        wire -> doomed.contains(wire.source().box()) || doomed.contains(wire.target().box()));
    boxes.keySet().removeAll(doomed);
  }

  /**
   * Swaps a box for another one under a fresh id, moving every incident wire onto the new box.
   * The replacement must offer every port the wires use, with the same value tags.
   *
   * @return id of the replacement box
   */
  public int replaceBox(int id, Box replacement) {
    Objects.requireNonNull(replacement, "replacement");
    box(id);
    int newId = nextBoxId;
    List<Wire> incident = new ArrayList<>();
    List<Wire> moved = new ArrayList<>();
    for (Wire wire : wires) {
      if (wire.source().box() != id && wire.target().box() != id) {
        continue;
      }
      incident.add(wire);
      Port source = wire.source().box() == id ? relabel(wire.source(), newId) : wire.source();
      Port target = wire.target().box() == id ? relabel(wire.target(), newId) : wire.target();
      Object sourceValue = valueAfterReplacement(source, newId, replacement);
      Object targetValue = valueAfterReplacement(target, newId, replacement);
      if (!Objects.equals(sourceValue, targetValue)) {
        throw new PortTypeMismatchException(
            "Replacing box " + id + " with " + replacement + " breaks wire " + wire);
      }
      moved.add(new Wire(source, target));
    }
    nextBoxId++;
    wires.removeAll(incident);
    boxes.remove(id);
    boxes.put(newId, replacement);
    wires.addAll(moved);
    return newId;
  }

  private static Port relabel(Port port, int box) {
    return new Port(box, port.kind(), port.port());
  }

  private Object valueAfterReplacement(Port port, int newId, Box replacement) {
    if (port.box() != newId) {
      return portValue(port);
    }
    List<Object> values =
        port.kind() == PortKind.INPUT ? replacement.inputPorts() : replacement.outputPorts();
    if (port.port() > values.size()) {
      throw new InvalidPortException(
          "Replacement " + replacement + " has no port " + port.kind() + " " + port.port());
    }
    return values.get(port.port() - 1);
  }

  public boolean hasBox(int id) {
    return boxes.containsKey(id);
  }

  public Box box(int id) {
    Box box = boxes.get(id);
    if (box == null) {
      throw UnknownBoxException.of(id);
    }
    return box;
  }

  /** Box ids in insertion order. */
  public List<Integer> boxIds() {
    return List.copyOf(boxes.keySet());
  }

  public int boxCount() {
    return boxes.size();
  }

  /** Value tags on the given side of a box or boundary. */
  public List<Object> portValues(int box, PortKind kind) {
    Objects.requireNonNull(kind, "kind");
    if (box == INPUT_ID) {
      return kind == PortKind.OUTPUT ? inputPorts : List.of();
    }
    if (box == OUTPUT_ID) {
      return kind == PortKind.INPUT ? outputPorts : List.of();
    }
    Box found = box(box);
    return kind == PortKind.INPUT ? found.inputPorts() : found.outputPorts();
  }

  public int portCount(int box, PortKind kind) {
    if (isBoundary(box)) {
      return portValues(box, kind).size();
    }
    Box found = box(box);
    return kind == PortKind.INPUT ? found.inputCount() : found.outputCount();
  }

  public Object portValue(Port port) {
    checkPort(port);
    return portValues(port.box(), port.kind()).get(port.port() - 1);
  }

  // Wires

  public void addWire(Port source, Port target) {
    addWire(new Wire(source, target));
  }

  public void addWire(Wire wire) {
    addWires(List.of(wire));
  }

  /**
   * Adds wires after validating all of them; if any wire is rejected the diagram is left
   * untouched.
   *
   * @throws InvalidPortException if a wire refers to a missing box or an out-of-range port
   * @throws PortTypeMismatchException if a wire connects ports with different value tags
   */
  public void addWires(Collection<Wire> newWires) {
    Objects.requireNonNull(newWires, "newWires");
    for (Wire wire : newWires) {
      Objects.requireNonNull(wire, "wire");
      checkPort(wire.source());
      checkPort(wire.target());
      Object sourceValue = portValue(wire.source());
      Object targetValue = portValue(wire.target());
      if (!Objects.equals(sourceValue, targetValue)) {
        throw new PortTypeMismatchException(
            "Wire " + wire + " connects " + sourceValue + " to " + targetValue);
      }
    }
    wires.addAll(newWires);
  }

  public boolean removeWire(Wire wire) {
    return wires.remove(wire);
  }

  public void removeWires(Collection<Wire> oldWires) {
    wires.removeAll(List.copyOf(oldWires));
  }

  public boolean hasWire(Wire wire) {
    return wires.contains(wire);
  }

  /** Snapshot of all wires in insertion order. */
  public List<Wire> wires() {
    return List.copyOf(wires);
  }

  public int wireCount() {
    return wires.size();
  }

  public List<Wire> inWires(int box) {
    requireNode(box);
    List<Wire> result = new ArrayList<>();
    for (Wire wire : wires) {
      if (wire.target().box() == box) {
        result.add(wire);
      }
    }
    return result;
  }

  public List<Wire> inWires(int box, int port) {
    requireNode(box);
    List<Wire> result = new ArrayList<>();
    for (Wire wire : wires) {
      if (wire.target().box() == box && wire.target().port() == port) {
        result.add(wire);
      }
    }
    return result;
  }

  public List<Wire> outWires(int box) {
    requireNode(box);
    List<Wire> result = new ArrayList<>();
    for (Wire wire : wires) {
      if (wire.source().box() == box) {
        result.add(wire);
      }
    }
    return result;
  }

  public List<Wire> outWires(int box, int port) {
    requireNode(box);
    List<Wire> result = new ArrayList<>();
    for (Wire wire : wires) {
      if (wire.source().box() == box && wire.source().port() == port) {
        result.add(wire);
      }
    }
    return result;
  }

  /** Distinct ids of boxes (or the input boundary) wired into {@code box}. */
  public List<Integer> inNeighbors(int box) {
    Set<Integer> neighbors = new LinkedHashSet<>();
    for (Wire wire : inWires(box)) {
      neighbors.add(wire.source().box());
    }
    return List.copyOf(neighbors);
  }

  /** Distinct ids of boxes (or the output boundary) fed by {@code box}. */
  public List<Integer> outNeighbors(int box) {
    Set<Integer> neighbors = new LinkedHashSet<>();
    for (Wire wire : outWires(box)) {
      neighbors.add(wire.target().box());
    }
    return List.copyOf(neighbors);
  }

  private void requireNode(int box) {
    if (!isBoundary(box) && !boxes.containsKey(box)) {
      throw UnknownBoxException.of(box);
    }
  }

  private void checkPort(Port port) {
    Objects.requireNonNull(port, "port");
    int box = port.box();
    if (!isBoundary(box) && !boxes.containsKey(box)) {
      throw new InvalidPortException("Port " + port + " refers to a missing box");
    }
    if (box == INPUT_ID && port.kind() != PortKind.OUTPUT) {
      throw new InvalidPortException("The input boundary only has output ports: " + port);
    }
    if (box == OUTPUT_ID && port.kind() != PortKind.INPUT) {
      throw new InvalidPortException("The output boundary only has input ports: " + port);
    }
    int arity = portCount(box, port.kind());
    if (port.port() > arity) {
      throw new InvalidPortException("Port " + port + " is out of range (arity " + arity + ")");
    }
  }

  // Equality

  /**
   * Finds a box-id bijection witnessing structural equality with {@code other}.
   *
   * @return mapping from this diagram's box ids to the other's, or empty if the diagrams differ
   */
  public Optional<Map<Integer, Integer>> isomorphism(WiringDiagram other) {
    Objects.requireNonNull(other, "other");
    return DiagramMatcher.match(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WiringDiagram other)) {
      return false;
    }
    return DiagramMatcher.match(this, other).isPresent();
  }

  @Override
  public int hashCode() {
    int boxHash = 0;
    for (Box box : boxes.values()) {
      boxHash += box.hashCode();
    }
    return Objects.hash(inputPorts, outputPorts, boxHash, wires.size());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("WiringDiagram(").append(inputPorts).append(" → ").append(outputPorts).append(")");
    for (Map.Entry<Integer, Box> entry : boxes.entrySet()) {
      sb.append("\n  ").append(entry.getKey()).append(": ").append(entry.getValue());
    }
    List<String> wireStrings = new ArrayList<>(wires.size());
    for (Wire wire : wires) {
      wireStrings.add(wire.toString());
    }
    sb.append("\n  wires: ").append(String.join(", ", wireStrings));
    return sb.toString();
  }

  Map<Integer, Box> boxMap() {
    return Collections.unmodifiableMap(boxes);
  }

  Set<Wire> wireSet() {
    return Collections.unmodifiableSet(wires);
  }
}
