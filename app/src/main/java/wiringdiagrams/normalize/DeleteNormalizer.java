package wiringdiagrams.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.core.WiringDiagram;

/**
 * Dead-code elimination. Each round removes every box with no outgoing wire, which covers delete
 * boxes, boxes whose outputs all dangle and boxes that fed only boxes removed in an earlier round,
 * and then collapses copies left with a single consumer. Rounds repeat until nothing changes, after
 * which every remaining box has a wire path to the diagram outputs.
 */
public final class DeleteNormalizer implements DiagramPass {
  private static final Logger LOG = LoggerFactory.getLogger(DeleteNormalizer.class);

  private final NormalizationOptions options;

  public DeleteNormalizer() {
    this(NormalizationOptions.defaults());
  }

  public DeleteNormalizer(NormalizationOptions options) {
    this.options = NormalizationOptions.normalize(options);
  }

  @Override
  public String name() {
    return "normalize-delete";
  }

  @Override
  public boolean apply(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    int limit = options.roundLimit(diagram);
    boolean changed = false;
    for (int round = 1; ; round++) {
      if (round > limit) {
        throw new IllegalStateException(
            "Delete normalization did not reach a fixpoint within " + limit + " rounds");
      }
      List<Integer> dead = new ArrayList<>();
      for (int id : diagram.boxIds()) {
        if (diagram.outWires(id).isEmpty()) {
          dead.add(id);
        }
      }
      if (!dead.isEmpty()) {
        diagram.removeBoxes(dead);
      }
      int collapsed = CopyTrees.collapseUnaryCopies(diagram);
      LOG.debug(
          "Delete normalization round {} removed {} boxes and collapsed {} copies",
          round,
          dead.size(),
          collapsed);
      if (dead.isEmpty() && collapsed == 0) {
        return changed;
      }
      changed = true;
    }
  }
}
