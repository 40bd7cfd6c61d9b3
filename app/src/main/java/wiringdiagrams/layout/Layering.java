package wiringdiagrams.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.util.DiagramGraphs;

/** Groups boxes into layers by longest-path depth and orders each layer by barycenter. */
public final class Layering {
  private Layering() {}

  /** Boxes grouped by depth; inside a layer boxes keep insertion order. */
  public static List<List<Integer>> layers(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    Map<Integer, Integer> depths = DiagramGraphs.depths(diagram);
    List<List<Integer>> layers = new ArrayList<>();
    for (int id : diagram.boxIds()) {
      int depth = depths.get(id);
      while (layers.size() <= depth) {
        layers.add(new ArrayList<>());
      }
      layers.get(depth).add(id);
    }
    return layers;
  }

  /**
   * Single downward sweep: the first layer is ordered against the input boundary, every later
   * layer against the already ordered layer above it.
   */
  public static List<List<Integer>> orderedLayers(WiringDiagram diagram) {
    List<List<Integer>> ordered = new ArrayList<>();
    List<Integer> above = List.of(WiringDiagram.INPUT_ID);
    for (List<Integer> layer : layers(diagram)) {
      List<Integer> sorted = CrossingMinimization.bySort(diagram, layer, above, List.of());
      ordered.add(sorted);
      above = sorted;
    }
    return ordered;
  }
}
