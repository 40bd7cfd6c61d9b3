package wiringdiagrams.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.Junction;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;

/**
 * Spider fusion of two junctions on the same value that are connected by exactly one wire, from
 * output {@code p} of the upstream junction to input {@code q} of the downstream one.
 *
 * <p>The fused junction takes the downstream inputs with the upstream inputs spliced in at
 * position {@code q}, and the upstream outputs with the downstream outputs spliced in at position
 * {@code p}. Fusing the canonical merge and copy chains of {@link JunctionExpansion} therefore
 * yields a single junction whose expansion is that chain again.
 */
final class JunctionFusion {
  private JunctionFusion() {}

  /** Fuses the first eligible pair found; returns false when there is none. */
  static boolean fuseOnce(WiringDiagram diagram) {
    for (Wire link : diagram.wires()) {
      int upstream = link.source().box();
      int downstream = link.target().box();
      if (upstream == downstream
          || WiringDiagram.isBoundary(upstream)
          || WiringDiagram.isBoundary(downstream)) {
        continue;
      }
      if (diagram.box(upstream) instanceof Junction first
          && diagram.box(downstream) instanceof Junction second
          && Objects.equals(first.value(), second.value())
          && wiresBetween(diagram, upstream, downstream) == 1) {
        fuse(diagram, link, first, second);
        return true;
      }
    }
    return false;
  }

  private static int wiresBetween(WiringDiagram diagram, int a, int b) {
    int count = 0;
    for (Wire wire : diagram.outWires(a)) {
      if (wire.target().box() == b) {
        count++;
      }
    }
    for (Wire wire : diagram.outWires(b)) {
      if (wire.target().box() == a) {
        count++;
      }
    }
    return count;
  }

  private static void fuse(WiringDiagram diagram, Wire link, Junction first, Junction second) {
    int upstream = link.source().box();
    int downstream = link.target().box();
    int p = link.source().port();
    int q = link.target().port();

    List<Wire> upstreamIn = diagram.inWires(upstream);
    List<Wire> upstreamOut = diagram.outWires(upstream);
    List<Wire> downstreamIn = diagram.inWires(downstream);
    List<Wire> downstreamOut = diagram.outWires(downstream);
    diagram.removeBoxes(List.of(upstream, downstream));

    int fused =
        diagram.addBox(
            Box.junction(
                first.value(),
                first.inputCount() + second.inputCount() - 1,
                first.outputCount() + second.outputCount() - 1));

    List<Wire> rewired = new ArrayList<>();
    for (Wire wire : upstreamIn) {
      int index = q - 1 + wire.target().port();
      rewired.add(wire.withTarget(Port.input(fused, index)));
    }
    for (Wire wire : downstreamIn) {
      if (wire.equals(link)) {
        continue;
      }
      int k = wire.target().port();
      int index = k < q ? k : k - 1 + first.inputCount();
      rewired.add(wire.withTarget(Port.input(fused, index)));
    }
    for (Wire wire : upstreamOut) {
      if (wire.equals(link)) {
        continue;
      }
      int k = wire.source().port();
      int index = k < p ? k : k - 1 + second.outputCount();
      rewired.add(wire.withSource(Port.output(fused, index)));
    }
    for (Wire wire : downstreamOut) {
      int index = p - 1 + wire.source().port();
      rewired.add(wire.withSource(Port.output(fused, index)));
    }
    diagram.addWires(rewired);
  }
}
