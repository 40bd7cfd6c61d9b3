package wiringdiagrams.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Backtracking search for a box relabeling that turns one diagram into another.
 *
 * <p>Candidates are restricted to boxes with an equal value and the same number of wires on every
 * port; wires are checked as soon as both of their endpoints are mapped.
 */
final class DiagramMatcher {
  private final WiringDiagram left;
  private final Set<Wire> rightWires;
  private final List<Integer> order;
  private final Map<Integer, List<Integer>> candidates;
  private final Map<Integer, Integer> mapping = new HashMap<>();
  private final Set<Integer> used = new HashSet<>();
  private final Map<Integer, List<Wire>> incident = new HashMap<>();

  private DiagramMatcher(
      WiringDiagram left,
      WiringDiagram right,
      List<Integer> order,
      Map<Integer, List<Integer>> candidates) {
    this.left = left;
    this.rightWires = right.wireSet();
    this.order = order;
    this.candidates = candidates;
    for (Wire wire : left.wireSet()) {
      incident.computeIfAbsent(wire.source().box(), k -> new ArrayList<>()).add(wire);
      incident.computeIfAbsent(wire.target().box(), k -> new ArrayList<>()).add(wire);
    }
    mapping.put(WiringDiagram.INPUT_ID, WiringDiagram.INPUT_ID);
    mapping.put(WiringDiagram.OUTPUT_ID, WiringDiagram.OUTPUT_ID);
  }

  static Optional<Map<Integer, Integer>> match(WiringDiagram left, WiringDiagram right) {
    if (!left.inputPorts().equals(right.inputPorts())
        || !left.outputPorts().equals(right.outputPorts())
        || left.boxCount() != right.boxCount()
        || left.wireCount() != right.wireCount()) {
      return Optional.empty();
    }

    Map<Integer, List<Integer>> candidates = new LinkedHashMap<>();
    Map<Integer, Signature> rightSignatures = new LinkedHashMap<>();
    for (int id : right.boxIds()) {
      rightSignatures.put(id, Signature.of(right, id));
    }
    for (int id : left.boxIds()) {
      Signature signature = Signature.of(left, id);
      List<Integer> matches = new ArrayList<>();
      for (Map.Entry<Integer, Signature> entry : rightSignatures.entrySet()) {
        if (entry.getValue().equals(signature)) {
          matches.add(entry.getKey());
        }
      }
      if (matches.isEmpty()) {
        return Optional.empty();
      }
      candidates.put(id, matches);
    }

    List<Integer> order = new ArrayList<>(left.boxIds());
    order.sort(Comparator.comparingInt(id -> candidates.get(id).size()));

    DiagramMatcher matcher = new DiagramMatcher(left, right, order, candidates);
    if (!matcher.boundaryWiresMatch() || !matcher.search(0)) {
      return Optional.empty();
    }
    Map<Integer, Integer> result = new LinkedHashMap<>();
    for (int id : left.boxIds()) {
      result.put(id, matcher.mapping.get(id));
    }
    return Optional.of(result);
  }

  private boolean boundaryWiresMatch() {
    for (Wire wire : left.wireSet()) {
      if (WiringDiagram.isBoundary(wire.source().box())
          && WiringDiagram.isBoundary(wire.target().box())
          && !rightWires.contains(wire)) {
        return false;
      }
    }
    return true;
  }

  private boolean search(int depth) {
    if (depth == order.size()) {
      return true;
    }
    int box = order.get(depth);
    for (int candidate : candidates.get(box)) {
      if (used.contains(candidate)) {
        continue;
      }
      mapping.put(box, candidate);
      if (consistent(box)) {
        used.add(candidate);
        if (search(depth + 1)) {
          return true;
        }
        used.remove(candidate);
      }
      mapping.remove(box);
    }
    return false;
  }

  private boolean consistent(int box) {
    for (Wire wire : incident.getOrDefault(box, List.of())) {
      Integer source = mapping.get(wire.source().box());
      Integer target = mapping.get(wire.target().box());
      if (source == null || target == null) {
        continue;
      }
      Wire image =
          new Wire(
              new Port(source, wire.source().kind(), wire.source().port()),
              new Port(target, wire.target().kind(), wire.target().port()));
      if (!rightWires.contains(image)) {
        return false;
      }
    }
    return true;
  }

  /** Relabeling-invariant description of a box and the wire counts on each of its ports. */
  private record Signature(Box box, List<Integer> inDegrees, List<Integer> outDegrees) {
    static Signature of(WiringDiagram diagram, int id) {
      Box box = diagram.box(id);
      List<Integer> in = new ArrayList<>(box.inputCount());
      for (int port = 1; port <= box.inputCount(); port++) {
        in.add(0);
      }
      List<Integer> out = new ArrayList<>(box.outputCount());
      for (int port = 1; port <= box.outputCount(); port++) {
        out.add(0);
      }
      for (Wire wire : diagram.wireSet()) {
        if (wire.target().box() == id) {
          int index = wire.target().port() - 1;
          in.set(index, in.get(index) + 1);
        }
        if (wire.source().box() == id) {
          int index = wire.source().port() - 1;
          out.set(index, out.get(index) + 1);
        }
      }
      return new Signature(box, in, out);
    }
  }
}
