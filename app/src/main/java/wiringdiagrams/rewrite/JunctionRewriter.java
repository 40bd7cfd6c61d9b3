package wiringdiagrams.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.BoxKind;
import wiringdiagrams.core.Junction;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.PortKind;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * Converts between the four structural generators (and implicit wire fan-out/fan-in) and the
 * unified {@link Junction} representation.
 *
 * <p>Every operation mutates the given diagram in place and returns it.
 */
public final class JunctionRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(JunctionRewriter.class);

  private JunctionRewriter() {}

  /**
   * Replaces every copy, merge, delete and create box by a junction of the same value and arity.
   * Existing junctions are left alone, so the operation is idempotent.
   */
  public static WiringDiagram addJunctions(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int replaced = 0;
    for (int id : diagram.boxIds()) {
      Box box = diagram.box(id);
      Junction junction =
          switch (box.kind()) {
            case COPY -> Box.junction(box.value(), 1, 2);
            case MERGE -> Box.junction(box.value(), 2, 1);
            case DELETE -> Box.junction(box.value(), 1, 0);
            case CREATE -> Box.junction(box.value(), 0, 1);
            case ATOMIC, JUNCTION -> null;
          };
      if (junction != null) {
        diagram.replaceBox(id, junction);
        replaced++;
      }
    }
    LOG.debug("Replaced {} generator boxes by junctions", replaced);
    return diagram;
  }

  /**
   * Expands every junction back into copy, merge, delete and create boxes, following the
   * canonical decomposition of {@link JunctionExpansion}. Inverts {@link #addJunctions}.
   */
  public static WiringDiagram removeJunctions(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int expanded = 0;
    for (int id : diagram.boxIds()) {
      if (diagram.box(id) instanceof Junction junction) {
        JunctionExpansion.expand(diagram, id, junction);
        expanded++;
      }
    }
    LOG.debug("Expanded {} junctions into generators", expanded);
    return diagram;
  }

  /**
   * Makes implicit fan-out and fan-in explicit: each output port without exactly one outgoing wire
   * gets a {@code (1, k)} junction and each input port without exactly one incoming wire a {@code
   * (k, 1)} junction. Junctions themselves are not touched.
   */
  public static WiringDiagram addFanJunctions(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    List<Integer> nodes = new ArrayList<>();
    nodes.add(WiringDiagram.INPUT_ID);
    for (int id : diagram.boxIds()) {
      if (diagram.box(id).kind() != BoxKind.JUNCTION) {
        nodes.add(id);
      }
    }
    nodes.add(WiringDiagram.OUTPUT_ID);

    int added = 0;
    for (int node : nodes) {
      added += addOutputJunctions(diagram, node);
      added += addInputJunctions(diagram, node);
    }
    LOG.debug("Inserted {} fan junctions", added);
    return diagram;
  }

  private static int addOutputJunctions(WiringDiagram diagram, int node) {
    int added = 0;
    List<Object> values = diagram.portValues(node, PortKind.OUTPUT);
    for (int port = 1; port <= values.size(); port++) {
      List<Wire> outgoing = diagram.outWires(node, port);
      if (outgoing.size() == 1) {
        continue;
      }
      int junction = diagram.addBox(Box.junction(values.get(port - 1), 1, outgoing.size()));
      List<Wire> rewired = new ArrayList<>(outgoing.size() + 1);
      rewired.add(new Wire(Port.output(node, port), Port.input(junction, 1)));
      for (int i = 0; i < outgoing.size(); i++) {
        rewired.add(outgoing.get(i).withSource(Port.output(junction, i + 1)));
      }
      diagram.removeWires(outgoing);
      diagram.addWires(rewired);
      added++;
    }
    return added;
  }

  private static int addInputJunctions(WiringDiagram diagram, int node) {
    int added = 0;
    List<Object> values = diagram.portValues(node, PortKind.INPUT);
    for (int port = 1; port <= values.size(); port++) {
      List<Wire> incoming = diagram.inWires(node, port);
      if (incoming.size() == 1) {
        continue;
      }
      int junction = diagram.addBox(Box.junction(values.get(port - 1), incoming.size(), 1));
      List<Wire> rewired = new ArrayList<>(incoming.size() + 1);
      for (int i = 0; i < incoming.size(); i++) {
        rewired.add(incoming.get(i).withTarget(Port.input(junction, i + 1)));
      }
      rewired.add(new Wire(Port.output(junction, 1), Port.input(node, port)));
      diagram.removeWires(incoming);
      diagram.addWires(rewired);
      added++;
    }
    return added;
  }

  /**
   * Removes every junction, wiring each of its sources directly to each of its targets. This is the
   * inverse of {@link #addFanJunctions} on junction-free diagrams.
   */
  public static WiringDiagram dissolveJunctions(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    List<Integer> junctions = new ArrayList<>();
    for (int id : diagram.boxIds()) {
      if (diagram.box(id).kind() != BoxKind.JUNCTION) {
        continue;
      }
      List<Wire> bypass = new ArrayList<>();
      for (Wire in : diagram.inWires(id)) {
        for (Wire out : diagram.outWires(id)) {
          bypass.add(new Wire(in.source(), out.target()));
        }
      }
      diagram.addWires(bypass);
      diagram.removeBox(id);
      junctions.add(id);
    }
    LOG.debug("Dissolved {} junctions into plain wires", junctions.size());
    return diagram;
  }

  /**
   * Fuses junctions joined by a single wire until no such pair remains. See {@link
   * JunctionFusion}.
   */
  public static WiringDiagram fuseJunctions(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int fused = 0;
    while (JunctionFusion.fuseOnce(diagram)) {
      fused++;
    }
    LOG.debug("Fused {} junction pairs", fused);
    return diagram;
  }
}
