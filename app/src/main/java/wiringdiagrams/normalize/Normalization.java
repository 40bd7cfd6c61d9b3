package wiringdiagrams.normalize;

import wiringdiagrams.core.WiringDiagram;

/** Mutating entry points for the normalization passes; each returns the diagram it was given. */
public final class Normalization {
  private Normalization() {}

  public static WiringDiagram normalizeCopy(WiringDiagram diagram) {
    return normalizeCopy(diagram, NormalizationOptions.defaults());
  }

  public static WiringDiagram normalizeCopy(WiringDiagram diagram, NormalizationOptions options) {
    new CopyNormalizer(options).apply(diagram);
    return diagram;
  }

  public static WiringDiagram normalizeDelete(WiringDiagram diagram) {
    return normalizeDelete(diagram, NormalizationOptions.defaults());
  }

  public static WiringDiagram normalizeDelete(WiringDiagram diagram, NormalizationOptions options) {
    new DeleteNormalizer(options).apply(diagram);
    return diagram;
  }

  /** Copy and delete normalization to a joint fixpoint; see {@link CartesianNormalizer}. */
  public static WiringDiagram normalizeCartesian(WiringDiagram diagram) {
    return normalizeCartesian(diagram, NormalizationOptions.defaults());
  }

  public static WiringDiagram normalizeCartesian(
      WiringDiagram diagram, NormalizationOptions options) {
    new CartesianNormalizer(options).apply(diagram);
    return diagram;
  }
}
