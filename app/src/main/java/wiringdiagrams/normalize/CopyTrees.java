package wiringdiagrams.normalize;

import java.util.ArrayList;
import java.util.List;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.BoxKind;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.PortKind;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * Helpers for the trees of copy boxes hanging off a single output port.
 *
 * <p>A copy is treated as transparent routing: its outputs carry whatever feeds its input.
 */
final class CopyTrees {
  private CopyTrees() {}

  /** Consumers reached from a port through copies, plus the copies traversed on the way. */
  record FanOut(List<Port> consumers, List<Integer> copies) {}

  /**
   * Walks upstream through copy boxes to the port that actually produces the value. Stops at a
   * copy that is not fed by exactly one wire and returns that copy's input port.
   */
  static Port resolveSource(WiringDiagram diagram, Port source) {
    Port current = source;
    while (isCopy(diagram, current.box())) {
      List<Wire> feeds = diagram.inWires(current.box(), 1);
      if (feeds.size() != 1) {
        return Port.input(current.box(), 1);
      }
      current = feeds.get(0).source();
    }
    return current;
  }

  /**
   * Depth-first walk (output 1 before output 2) of the copy tree below {@code root}. A copy fed by
   * more than one wire is a consumer, not part of the tree.
   */
  static FanOut fanOut(WiringDiagram diagram, Port root) {
    List<Port> consumers = new ArrayList<>();
    List<Integer> copies = new ArrayList<>();
    collect(diagram, root, consumers, copies);
    return new FanOut(consumers, copies);
  }

  private static void collect(
      WiringDiagram diagram, Port source, List<Port> consumers, List<Integer> copies) {
    for (Wire wire : diagram.outWires(source.box(), source.port())) {
      int target = wire.target().box();
      if (isCopy(diagram, target)
          && diagram.inWires(target, 1).size() == 1
          && !copies.contains(target)) {
        copies.add(target);
        collect(diagram, Port.output(target, 1), consumers, copies);
        collect(diagram, Port.output(target, 2), consumers, copies);
      } else {
        consumers.add(wire.target());
      }
    }
  }

  /**
   * Replaces the copy tree below {@code root} by the canonical one for its consumers: no wire for
   * none, a direct wire for one, otherwise a right-leaning chain of copies.
   */
  static void rebuild(WiringDiagram diagram, Port root) {
    if (root.kind() != PortKind.OUTPUT) {
      return;
    }
    FanOut fanOut = fanOut(diagram, root);
    diagram.removeWires(diagram.outWires(root.box(), root.port()));
    if (!fanOut.copies().isEmpty()) {
      diagram.removeBoxes(fanOut.copies());
    }

    List<Port> consumers = fanOut.consumers();
    Object value = diagram.portValue(root);
    List<Wire> wires = new ArrayList<>();
    Port source = root;
    for (int i = 0; i < consumers.size(); i++) {
      if (i == consumers.size() - 1) {
        wires.add(new Wire(source, consumers.get(i)));
        break;
      }
      int copy = diagram.addBox(Box.copy(value));
      wires.add(new Wire(source, Port.input(copy, 1)));
      wires.add(new Wire(Port.output(copy, 1), consumers.get(i)));
      source = Port.output(copy, 2);
    }
    diagram.addWires(wires);
  }

  /**
   * Removes copies left with a single outgoing wire, connecting their feed straight to that wire's
   * target.
   *
   * @return number of copies removed
   */
  static int collapseUnaryCopies(WiringDiagram diagram) {
    int collapsed = 0;
    for (int id : diagram.boxIds()) {
      if (!diagram.hasBox(id) || !isCopy(diagram, id)) {
        continue;
      }
      List<Wire> feeds = diagram.inWires(id);
      List<Wire> outgoing = diagram.outWires(id);
      if (feeds.size() != 1 || outgoing.size() != 1) {
        continue;
      }
      Wire bypass = new Wire(feeds.get(0).source(), outgoing.get(0).target());
      diagram.removeBox(id);
      diagram.addWire(bypass);
      collapsed++;
    }
    return collapsed;
  }

  static boolean isCopy(WiringDiagram diagram, int id) {
    return !WiringDiagram.isBoundary(id) && diagram.box(id).kind() == BoxKind.COPY;
  }
}
