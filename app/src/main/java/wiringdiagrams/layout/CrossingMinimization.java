package wiringdiagrams.layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.PortKind;
import wiringdiagrams.core.UnknownBoxException;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * Barycenter heuristic for ordering one layer of boxes between fixed neighbouring layers.
 *
 * <p>Every port of a fixed layer gets a coordinate: port {@code p} of the box at index {@code i},
 * out of {@code k} ports on the facing side, sits at {@code i + (p - 0.5) / k}. A node's sort key
 * is the mean coordinate of the ports it is wired to, averaged over the two layers when both are
 * given; nodes with no such wire keep their current index. The sort is stable.
 */
public final class CrossingMinimization {
  private CrossingMinimization() {}

  /**
   * Reorders {@code nodes} to reduce crossings against {@code sources} (the layer above) and/or
   * {@code targets} (the layer below). Either fixed layer may be empty.
   *
   * @return a permutation of {@code nodes}
   * @throws UnknownBoxException if any id is neither a box nor a boundary of {@code diagram}
   * @throws IllegalArgumentException if a list repeats an id
   */
  public static List<Integer> bySort(
      WiringDiagram diagram, List<Integer> nodes, List<Integer> sources, List<Integer> targets) {
    int[] permutation = sortPermutation(diagram, nodes, sources, targets);
    List<Integer> ordered = new ArrayList<>(permutation.length);
    for (int index : permutation) {
      ordered.add(nodes.get(index));
    }
    return ordered;
  }

  /** Like {@link #bySort} but returns the 0-based positions of {@code nodes} in sorted order. */
  public static int[] sortPermutation(
      WiringDiagram diagram, List<Integer> nodes, List<Integer> sources, List<Integer> targets) {
    Objects.requireNonNull(diagram, "diagram");
    List<Integer> fixedAbove = sources == null ? List.of() : sources;
    List<Integer> fixedBelow = targets == null ? List.of() : targets;
    validate(diagram, Objects.requireNonNull(nodes, "nodes"), "nodes");
    validate(diagram, fixedAbove, "sources");
    validate(diagram, fixedBelow, "targets");

    Map<Port, Double> sourceCoords = coordinates(diagram, fixedAbove, PortKind.OUTPUT);
    Map<Port, Double> targetCoords = coordinates(diagram, fixedBelow, PortKind.INPUT);

    double[] keys = new double[nodes.size()];
    for (int i = 0; i < nodes.size(); i++) {
      int node = nodes.get(i);
      Double above = meanOver(diagram.inWires(node), sourceCoords, true);
      Double below = meanOver(diagram.outWires(node), targetCoords, false);
      if (above != null && below != null) {
        keys[i] = (above + below) / 2.0;
      } else if (above != null) {
        keys[i] = above;
      } else if (below != null) {
        keys[i] = below;
      } else {
        keys[i] = i;
      }
    }

    List<Integer> order = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingDouble(i -> keys[i]));
    return order.stream().mapToInt(Integer::intValue).toArray();
  }

  private static Map<Port, Double> coordinates(
      WiringDiagram diagram, List<Integer> layer, PortKind side) {
    Map<Port, Double> coords = new HashMap<>();
    for (int i = 0; i < layer.size(); i++) {
      int box = layer.get(i);
      int count = diagram.portCount(box, side);
      for (int port = 1; port <= count; port++) {
        coords.put(new Port(box, side, port), i + (port - 0.5) / count);
      }
    }
    return coords;
  }

  private static Double meanOver(List<Wire> wires, Map<Port, Double> coords, boolean upstream) {
    double sum = 0;
    int count = 0;
    for (Wire wire : wires) {
      Double coord = coords.get(upstream ? wire.source() : wire.target());
      if (coord != null) {
        sum += coord;
        count++;
      }
    }
    return count == 0 ? null : sum / count;
  }

  private static void validate(WiringDiagram diagram, List<Integer> ids, String what) {
    Set<Integer> seen = new HashSet<>();
    for (Integer id : ids) {
      if (id == null || !(WiringDiagram.isBoundary(id) || diagram.hasBox(id))) {
        throw new UnknownBoxException("Unknown id in " + what + ": " + id);
      }
      if (!seen.add(id)) {
        throw new IllegalArgumentException("Duplicate id in " + what + ": " + id);
      }
    }
  }
}
