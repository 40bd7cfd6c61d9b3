package wiringdiagrams.normalize;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.Junction;
import wiringdiagrams.core.UnsupportedStructureException;
import wiringdiagrams.core.WiringDiagram;

/**
 * Normal form for morphisms of a cartesian category: alternates copy and delete normalization
 * until neither changes the diagram.
 *
 * <p>Merge and create structure has no meaning in that setting. In strict mode (the default) such
 * diagrams are rejected before anything is rewritten.
 */
public final class CartesianNormalizer implements DiagramPass {
  private static final Logger LOG = LoggerFactory.getLogger(CartesianNormalizer.class);

  private final NormalizationOptions options;
  private final CopyNormalizer copy;
  private final DeleteNormalizer delete;

  public CartesianNormalizer() {
    this(NormalizationOptions.defaults());
  }

  public CartesianNormalizer(NormalizationOptions options) {
    this.options = NormalizationOptions.normalize(options);
    this.copy = new CopyNormalizer(this.options);
    this.delete = new DeleteNormalizer(this.options);
  }

  @Override
  public String name() {
    return "normalize-cartesian";
  }

  @Override
  public boolean apply(WiringDiagram diagram) {
    Objects.requireNonNull(diagram, "diagram");
    if (options.strictCartesian()) {
      requireCartesian(diagram);
    }
    int limit = 2 * options.roundLimit(diagram);
    boolean changed = false;
    for (int round = 1; ; round++) {
      if (round > limit) {
        throw new IllegalStateException(
            "Cartesian normalization did not reach a fixpoint within " + limit + " rounds");
      }
      boolean copied = copy.apply(diagram);
      boolean deleted = delete.apply(diagram);
      LOG.debug("Cartesian normalization round {} (copy: {}, delete: {})", round, copied, deleted);
      if (!copied && !deleted) {
        return changed;
      }
      changed = true;
    }
  }

  /**
   * Rejects merges, creates and junctions whose in-arity is not one.
   *
   * @throws UnsupportedStructureException naming the first offending box
   */
  static void requireCartesian(WiringDiagram diagram) {
    for (int id : diagram.boxIds()) {
      Box box = diagram.box(id);
      boolean offending =
          switch (box.kind()) {
            case MERGE, CREATE -> true;
            case JUNCTION -> ((Junction) box).inputCount() != 1;
            case ATOMIC, COPY, DELETE -> false;
          };
      if (offending) {
        throw new UnsupportedStructureException(
            "Cartesian normalization does not apply to box " + id + " (" + box + ")");
      }
    }
  }
}
