package wiringdiagrams.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wiringdiagrams.testing.DiagramFixtures.IN;
import static wiringdiagrams.testing.DiagramFixtures.OUT;
import static wiringdiagrams.testing.DiagramFixtures.f;
import static wiringdiagrams.testing.DiagramFixtures.g;
import static wiringdiagrams.testing.DiagramFixtures.wire;

import java.util.List;
import org.junit.jupiter.api.Test;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.testing.DiagramFixtures;

final class CopyNormalizerTest {

  @Test
  void copyBeforeEqualBoxesMovesAfterThem() {
    WiringDiagram diagram = DiagramFixtures.copyThenTwoF();

    assertEquals(DiagramFixtures.fThenCopy(), Normalization.normalizeCopy(diagram));
  }

  @Test
  void copyBetweenBoxesMovesToTheEnd() {
    // f ; copy(B) ; (g ⊗ g)
    WiringDiagram diagram = new WiringDiagram(List.of("A"), List.of("C", "C"));
    int f = diagram.addBox(f());
    int copy = diagram.addBox(Box.copy("B"));
    int g1 = diagram.addBox(g());
    int g2 = diagram.addBox(g());
    wire(diagram, IN, 1, f, 1);
    wire(diagram, f, 1, copy, 1);
    wire(diagram, copy, 1, g1, 1);
    wire(diagram, copy, 2, g2, 1);
    wire(diagram, g1, 1, OUT, 1);
    wire(diagram, g2, 1, OUT, 2);

    assertEquals(DiagramFixtures.fThenGThenCopy(), Normalization.normalizeCopy(diagram));
  }

  @Test
  void duplicatedChainsCollapseToOne() {
    // copy(A) ; (f ⊗ f) ; (g ⊗ g)
    WiringDiagram diagram = new WiringDiagram(List.of("A"), List.of("C", "C"));
    int copy = diagram.addBox(Box.copy("A"));
    int f1 = diagram.addBox(f());
    int f2 = diagram.addBox(f());
    int g1 = diagram.addBox(g());
    int g2 = diagram.addBox(g());
    wire(diagram, IN, 1, copy, 1);
    wire(diagram, copy, 1, f1, 1);
    wire(diagram, copy, 2, f2, 1);
    wire(diagram, f1, 1, g1, 1);
    wire(diagram, f2, 1, g2, 1);
    wire(diagram, g1, 1, OUT, 1);
    wire(diagram, g2, 1, OUT, 2);

    assertEquals(DiagramFixtures.fThenGThenCopy(), Normalization.normalizeCopy(diagram));
  }

  @Test
  void boxesFedFromDifferentSourcesStayApart() {
    WiringDiagram diagram = new WiringDiagram(List.of("A", "A"), List.of("B", "B"));
    int f1 = diagram.addBox(f());
    int f2 = diagram.addBox(f());
    wire(diagram, IN, 1, f1, 1);
    wire(diagram, IN, 2, f2, 1);
    wire(diagram, f1, 1, OUT, 1);
    wire(diagram, f2, 1, OUT, 2);
    WiringDiagram original = diagram.copy();

    assertFalse(new CopyNormalizer().apply(diagram));
    assertEquals(original, diagram);
  }

  @Test
  void normalFormIsAFixpoint() {
    WiringDiagram diagram = Normalization.normalizeCopy(DiagramFixtures.copyThenTwoF());
    WiringDiagram normalized = diagram.copy();

    assertFalse(new CopyNormalizer().apply(diagram));
    assertEquals(normalized, diagram);
  }

  @Test
  void reportsChange() {
    assertTrue(new CopyNormalizer().apply(DiagramFixtures.copyThenTwoF()));
  }

  @Test
  void threeWayCopyCollapsesIntoOneBoxAndAChain() {
    WiringDiagram diagram = new WiringDiagram(List.of("A"), List.of("B", "B", "B"));
    int c1 = diagram.addBox(Box.copy("A"));
    int c2 = diagram.addBox(Box.copy("A"));
    int f1 = diagram.addBox(f());
    int f2 = diagram.addBox(f());
    int f3 = diagram.addBox(f());
    wire(diagram, IN, 1, c1, 1);
    wire(diagram, c1, 1, f1, 1);
    wire(diagram, c1, 2, c2, 1);
    wire(diagram, c2, 1, f2, 1);
    wire(diagram, c2, 2, f3, 1);
    wire(diagram, f1, 1, OUT, 1);
    wire(diagram, f2, 1, OUT, 2);
    wire(diagram, f3, 1, OUT, 3);

    Normalization.normalizeCopy(diagram);

    WiringDiagram expected = new WiringDiagram(List.of("A"), List.of("B", "B", "B"));
    int f = expected.addBox(f());
    int e1 = expected.addBox(Box.copy("B"));
    int e2 = expected.addBox(Box.copy("B"));
    wire(expected, IN, 1, f, 1);
    wire(expected, f, 1, e1, 1);
    wire(expected, e1, 1, OUT, 1);
    wire(expected, e1, 2, e2, 1);
    wire(expected, e2, 1, OUT, 2);
    wire(expected, e2, 2, OUT, 3);
    assertEquals(expected, diagram);
  }

  @Test
  void copyWithASecondFeedKeepsIt() {
    // input 1 -> c0 -> (c1 -> f, f) and c0 -> c2, with input 2 also feeding c2
    WiringDiagram diagram = new WiringDiagram(List.of("A", "A"), List.of("B", "B", "A", "A"));
    int c0 = diagram.addBox(Box.copy("A"));
    int c1 = diagram.addBox(Box.copy("A"));
    int c2 = diagram.addBox(Box.copy("A"));
    int f1 = diagram.addBox(f());
    int f2 = diagram.addBox(f());
    wire(diagram, IN, 1, c0, 1);
    wire(diagram, c0, 1, c1, 1);
    wire(diagram, c0, 2, c2, 1);
    wire(diagram, IN, 2, c2, 1);
    wire(diagram, c1, 1, f1, 1);
    wire(diagram, c1, 2, f2, 1);
    wire(diagram, f1, 1, OUT, 1);
    wire(diagram, f2, 1, OUT, 2);
    wire(diagram, c2, 1, OUT, 3);
    wire(diagram, c2, 2, OUT, 4);

    Normalization.normalizeCopy(diagram);

    assertEquals(1, diagram.outWires(IN, 2).size());
    assertTrue(diagram.hasWire(Wire.of(IN, 2, c2, 1)));
    WiringDiagram expected = new WiringDiagram(List.of("A", "A"), List.of("B", "B", "A", "A"));
    int a = expected.addBox(Box.copy("A"));
    int f = expected.addBox(f());
    int b = expected.addBox(Box.copy("B"));
    int merged = expected.addBox(Box.copy("A"));
    wire(expected, IN, 1, a, 1);
    wire(expected, a, 1, f, 1);
    wire(expected, a, 2, merged, 1);
    wire(expected, IN, 2, merged, 1);
    wire(expected, f, 1, b, 1);
    wire(expected, b, 1, OUT, 1);
    wire(expected, b, 2, OUT, 2);
    wire(expected, merged, 1, OUT, 3);
    wire(expected, merged, 2, OUT, 4);
    assertEquals(expected, diagram);
  }
}
