package wiringdiagrams.rewrite;

import java.util.ArrayList;
import java.util.List;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.Junction;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * Canonical decomposition of a {@link Junction} into binary generators.
 *
 * <p>An {@code (n, m)} junction becomes a fan-in stage followed by a fan-out stage:
 *
 * <ul>
 *   <li>fan-in: a {@code create} for {@code n = 0}, nothing for {@code n = 1}, otherwise a
 *       left-leaning chain of {@code n - 1} merges;
 *   <li>fan-out: a {@code delete} for {@code m = 0}, nothing for {@code m = 1}, otherwise a
 *       right-leaning chain of {@code m - 1} copies, where output 1 of each copy is the next
 *       junction output and output 2 feeds the following copy.
 * </ul>
 *
 * A {@code (1, 1)} junction expands to plain wires.
 */
final class JunctionExpansion {
  private JunctionExpansion() {}

  static void expand(WiringDiagram diagram, int id, Junction junction) {
    List<Wire> inWires = diagram.inWires(id);
    List<Wire> outWires = diagram.outWires(id);
    diagram.removeBox(id);

    Object value = junction.value();
    int inputs = junction.inputCount();
    int outputs = junction.outputCount();
    List<Wire> added = new ArrayList<>();

    if (junction.isPassThrough()) {
      for (Wire in : inWires) {
        for (Wire out : outWires) {
          added.add(new Wire(in.source(), out.target()));
        }
      }
      diagram.addWires(added);
      return;
    }

    // Fan-in: where each junction input lands, and the port carrying the merged value.
    List<Port> inputTargets = new ArrayList<>(inputs);
    Port merged = null;
    if (inputs == 0) {
      merged = Port.output(diagram.addBox(Box.create(value)), 1);
    } else if (inputs > 1) {
      int previous = diagram.addBox(Box.merge(value));
      inputTargets.add(Port.input(previous, 1));
      inputTargets.add(Port.input(previous, 2));
      for (int i = 3; i <= inputs; i++) {
        int next = diagram.addBox(Box.merge(value));
        added.add(Wire.of(previous, 1, next, 1));
        inputTargets.add(Port.input(next, 2));
        previous = next;
      }
      merged = Port.output(previous, 1);
    }

    // Fan-out: the port consuming the merged value, and where each junction output comes from.
    List<Port> outputSources = new ArrayList<>(outputs);
    Port consumer = null;
    if (outputs == 0) {
      consumer = Port.input(diagram.addBox(Box.delete(value)), 1);
    } else if (outputs > 1) {
      int previous = diagram.addBox(Box.copy(value));
      consumer = Port.input(previous, 1);
      for (int j = 2; j < outputs; j++) {
        int next = diagram.addBox(Box.copy(value));
        outputSources.add(Port.output(previous, 1));
        added.add(Wire.of(previous, 2, next, 1));
        previous = next;
      }
      outputSources.add(Port.output(previous, 1));
      outputSources.add(Port.output(previous, 2));
    }

    if (inputs == 1) {
      inputTargets.add(consumer);
    } else if (outputs == 1) {
      outputSources.add(merged);
    } else {
      added.add(new Wire(merged, consumer));
    }

    for (Wire in : inWires) {
      added.add(in.withTarget(inputTargets.get(in.target().port() - 1)));
    }
    for (Wire out : outWires) {
      added.add(out.withSource(outputSources.get(out.source().port() - 1)));
    }
    diagram.addWires(added);
  }
}
