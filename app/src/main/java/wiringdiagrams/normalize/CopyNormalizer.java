package wiringdiagrams.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.BoxKind;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.util.DiagramGraphs;

/**
 * Pushes duplication downstream past shared computation.
 *
 * <p>Two atomic boxes are equivalent when they are equal and each of their inputs resolves, through
 * copy boxes, to the same output of equivalent boxes. Boxes are classified in topological order,
 * so {@code copy ; (f ⊗ f) ; (g ⊗ g)} collapses in one round to {@code f ; g ; copy}. Every class
 * keeps its first member; the consumers of the others move to it and the affected fan-outs are
 * rebuilt as canonical copy chains.
 */
public final class CopyNormalizer implements DiagramPass {
  private static final Logger LOG = LoggerFactory.getLogger(CopyNormalizer.class);

  private final NormalizationOptions options;

  public CopyNormalizer() {
    this(NormalizationOptions.defaults());
  }

  public CopyNormalizer(NormalizationOptions options) {
    this.options = NormalizationOptions.normalize(options);
  }

  @Override
  public String name() {
    return "normalize-copy";
  }

  @Override
  public boolean apply(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int limit = options.roundLimit(diagram);
    boolean changed = false;
    for (int round = 1; ; round++) {
      if (round > limit) {
        throw new IllegalStateException(
            "Copy normalization did not reach a fixpoint within " + limit + " rounds");
      }
      int merged = mergeEquivalentBoxes(diagram);
      LOG.debug("Copy normalization round {} merged {} boxes", round, merged);
      if (merged == 0) {
        return changed;
      }
      changed = true;
    }
  }

  private int mergeEquivalentBoxes(WiringDiagram diagram) {
    Map<Integer, Integer> representatives = new HashMap<>();
    Map<ClassKey, Integer> classes = new HashMap<>();
    List<Integer> duplicates = new ArrayList<>();

    for (int id : DiagramGraphs.topologicalSort(diagram)) {
      Box box = diagram.box(id);
      if (box.kind() != BoxKind.ATOMIC) {
        continue;
      }
      List<Port> sources = new ArrayList<>(box.inputCount());
      for (int port = 1; port <= box.inputCount(); port++) {
        List<Wire> feeds = diagram.inWires(id, port);
        if (feeds.size() != 1) {
          // Unfed or implicitly merged inputs never match another box.
          sources.add(Port.input(id, port));
          continue;
        }
        Port source = CopyTrees.resolveSource(diagram, feeds.get(0).source());
        sources.add(representative(source, representatives));
      }
      Integer existing = classes.putIfAbsent(new ClassKey(box, sources), id);
      if (existing != null) {
        representatives.put(id, existing);
        duplicates.add(id);
      }
    }
    if (duplicates.isEmpty()) {
      return 0;
    }

    Set<Integer> doomed = Set.copyOf(duplicates);
    Set<Port> roots = new LinkedHashSet<>();
    List<Wire> reattached = new ArrayList<>();
    for (int duplicate : duplicates) {
      int keeper = representatives.get(duplicate);
      for (Wire wire : diagram.inWires(duplicate)) {
        roots.add(representative(CopyTrees.resolveSource(diagram, wire.source()), representatives));
      }
      for (Wire wire : diagram.outWires(duplicate)) {
        Port source = Port.output(keeper, wire.source().port());
        roots.add(source);
        if (!doomed.contains(wire.target().box())) {
          reattached.add(wire.withSource(source));
        }
      }
    }

    diagram.removeBoxes(duplicates);
    diagram.addWires(reattached);
    for (Port root : roots) {
      if (WiringDiagram.isBoundary(root.box()) || diagram.hasBox(root.box())) {
        CopyTrees.rebuild(diagram, root);
      }
    }
    return duplicates.size();
  }

  private static Port representative(Port port, Map<Integer, Integer> representatives) {
    Integer keeper = representatives.get(port.box());
    return keeper == null ? port : new Port(keeper, port.kind(), port.port());
  }

  /** Box value plus the resolved source of every input port. */
  private record ClassKey(Box box, List<Port> sources) {}
}
