package wiringdiagrams.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/** Box-level graph queries over a {@link WiringDiagram}, ignoring port structure. */
public final class DiagramGraphs {
  private DiagramGraphs() {}

  /**
   * Orders the boxes so that every wire between two boxes points forward. Ties are broken by
   * insertion order, which makes the result deterministic.
   *
   * @throws IllegalStateException if the boxes contain a directed cycle
   */
  public static List<Integer> topologicalSort(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    List<Integer> ids = diagram.boxIds();
    Map<Integer, Integer> indegree = new LinkedHashMap<>();
    Map<Integer, Set<Integer>> successors = new HashMap<>();
    for (int id : ids) {
      indegree.put(id, 0);
    }
    for (Wire wire : diagram.wires()) {
      int source = wire.source().box();
      int target = wire.target().box();
      if (WiringDiagram.isBoundary(source) || WiringDiagram.isBoundary(target)) {
        continue;
      }
      if (successors.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target)) {
        indegree.merge(target, 1, Integer::sum);
      }
    }

    List<Integer> sorted = new ArrayList<>(ids.size());
    Deque<Integer> ready = new ArrayDeque<>();
    for (Map.Entry<Integer, Integer> entry : indegree.entrySet()) {
      if (entry.getValue() == 0) {
        ready.add(entry.getKey());
      }
    }
    while (!ready.isEmpty()) {
      int current = ready.poll();
      sorted.add(current);
      for (int next : successors.getOrDefault(current, Set.of())) {
        if (indegree.merge(next, -1, Integer::sum) == 0) {
          ready.add(next);
        }
      }
    }
    if (sorted.size() != ids.size()) {
      throw new IllegalStateException("Wiring diagram contains a cycle between boxes");
    }
    return sorted;
  }

  /** Ids (boxes and the input boundary) with a directed path of wires into {@code node}. */
  public static Set<Integer> ancestors(WiringDiagram diagram, int node) {
    Objects.requireNonNull(diagram, "diagram");
    Map<Integer, Set<Integer>> predecessors = new HashMap<>();
    for (Wire wire : diagram.wires()) {
      predecessors
          .computeIfAbsent(wire.target().box(), k -> new LinkedHashSet<>())
          .add(wire.source().box());
    }
    Set<Integer> visited = new LinkedHashSet<>();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      int current = stack.pop();
      for (int predecessor : predecessors.getOrDefault(current, Set.of())) {
        if (visited.add(predecessor)) {
          stack.push(predecessor);
        }
      }
    }
    return visited;
  }

  /**
   * Length of the longest wire path from the input boundary (or from any box without inputs) to
   * each box. Boxes fed only by the boundary or by nothing sit at depth 0.
   */
  public static Map<Integer, Integer> depths(WiringDiagram diagram) {
    Map<Integer, Integer> depths = new LinkedHashMap<>();
    for (int id : topologicalSort(diagram)) {
      int depth = 0;
      for (int predecessor : diagram.inNeighbors(id)) {
        if (!WiringDiagram.isBoundary(predecessor)) {
          depth = Math.max(depth, depths.get(predecessor) + 1);
        }
      }
      depths.put(id, depth);
    }
    return depths;
  }
}
