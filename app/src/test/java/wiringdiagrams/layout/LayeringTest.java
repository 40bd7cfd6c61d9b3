package wiringdiagrams.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static wiringdiagrams.testing.DiagramFixtures.IN;
import static wiringdiagrams.testing.DiagramFixtures.OUT;
import static wiringdiagrams.testing.DiagramFixtures.f;
import static wiringdiagrams.testing.DiagramFixtures.g;
import static wiringdiagrams.testing.DiagramFixtures.wire;

import java.util.List;
import org.junit.jupiter.api.Test;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.testing.DiagramFixtures;

final class LayeringTest {

  @Test
  void chainHasOneBoxPerLayer() {
    assertEquals(List.of(List.of(1), List.of(2)), Layering.layers(DiagramFixtures.fThenG()));
  }

  @Test
  void crossedWiresAreUntangled() {
    // f1 and f2 read the inputs in order; g1 is fed by f2 and g2 by f1.
    WiringDiagram diagram = new WiringDiagram(List.of("A", "A"), List.of("C", "C"));
    int f1 = diagram.addBox(f());
    int f2 = diagram.addBox(f());
    int g1 = diagram.addBox(g());
    int g2 = diagram.addBox(g());
    wire(diagram, IN, 1, f1, 1);
    wire(diagram, IN, 2, f2, 1);
    wire(diagram, f2, 1, g1, 1);
    wire(diagram, f1, 1, g2, 1);
    wire(diagram, g1, 1, OUT, 1);
    wire(diagram, g2, 1, OUT, 2);

    assertEquals(List.of(List.of(f1, f2), List.of(g1, g2)), Layering.layers(diagram));
    assertEquals(List.of(List.of(f1, f2), List.of(g2, g1)), Layering.orderedLayers(diagram));
  }

  @Test
  void emptyDiagramHasNoLayers() {
    assertEquals(List.of(), Layering.orderedLayers(new WiringDiagram(List.of(), List.of())));
  }
}
