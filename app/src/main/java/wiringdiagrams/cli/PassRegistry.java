package wiringdiagrams.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.normalize.CartesianNormalizer;
import wiringdiagrams.normalize.CopyNormalizer;
import wiringdiagrams.normalize.DeleteNormalizer;
import wiringdiagrams.normalize.DiagramPass;
import wiringdiagrams.normalize.NormalizationOptions;
import wiringdiagrams.rewrite.JunctionRewriter;

/** Named rewriting passes selectable with {@code rewrite --passes}. */
final class PassRegistry {
  private final Map<String, DiagramPass> passes = new LinkedHashMap<>();

  PassRegistry(NormalizationOptions options) {
    register(rewrite("add-junctions", JunctionRewriter::addJunctions));
    register(rewrite("remove-junctions", JunctionRewriter::removeJunctions));
    register(rewrite("add-fan-junctions", JunctionRewriter::addFanJunctions));
    register(rewrite("dissolve-junctions", JunctionRewriter::dissolveJunctions));
    register(rewrite("fuse-junctions", JunctionRewriter::fuseJunctions));
    register(new CopyNormalizer(options));
    register(new DeleteNormalizer(options));
    register(new CartesianNormalizer(options));
  }

  Set<String> names() {
    return passes.keySet();
  }

  DiagramPass get(String name) {
    DiagramPass pass = passes.get(name);
    if (pass == null) {
      throw new IllegalArgumentException(
          "Unknown pass: " + name + " (expected one of " + String.join(", ", names()) + ")");
    }
    return pass;
  }

  /** Resolves every name up front so that a typo fails before any pass runs. */
  List<DiagramPass> resolve(List<String> names) {
    List<DiagramPass> resolved = new ArrayList<>(names.size());
    for (String name : names) {
      resolved.add(get(name));
    }
    return resolved;
  }

  private void register(DiagramPass pass) {
    passes.put(pass.name(), pass);
  }

  private static DiagramPass rewrite(String name, UnaryOperator<WiringDiagram> operation) {
    return new RewritePass(name, operation);
  }

  /**
   * Adapts a junction rewrite to {@link DiagramPass}. Box ids are never reused, so the diagram
   * changed exactly when its box ids or wires differ afterwards.
   */
  private record RewritePass(String name, UnaryOperator<WiringDiagram> operation)
      implements DiagramPass {

    RewritePass {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(operation, "operation");
    }

    @Override
    public boolean apply(WiringDiagram diagram) {
      List<Integer> boxesBefore = diagram.boxIds();
      List<Wire> wiresBefore = diagram.wires();
      operation.apply(diagram);
      return !boxesBefore.equals(diagram.boxIds()) || !wiresBefore.equals(diagram.wires());
    }
  }
}
