package wiringdiagrams.normalize;

import wiringdiagrams.core.WiringDiagram;

/** Rewriting pass that mutates a diagram in place. */
public interface DiagramPass {

  String name();

  /**
   * Rewrites {@code diagram} in place.
   *
   * @return whether the diagram changed
   */
  boolean apply(WiringDiagram diagram);
}
