package wiringdiagrams.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class BoxTest {

  @Test
  void generatorsHaveFixedArities() {
    assertEquals(1, Box.copy("A").inputCount());
    assertEquals(2, Box.copy("A").outputCount());
    assertEquals(List.of("A", "A"), Box.merge("A").inputPorts());
    assertEquals(0, Box.delete("A").outputCount());
    assertEquals(0, Box.create("A").inputCount());
    assertEquals("copy(A)", Box.copy("A").toString());
  }

  @Test
  void generatorBoxesRejectOtherKinds() {
    assertThrows(IllegalArgumentException.class, () -> new GeneratorBox(BoxKind.ATOMIC, "A"));
    assertThrows(IllegalArgumentException.class, () -> new GeneratorBox(BoxKind.JUNCTION, "A"));
  }

  @Test
  void junctionsCarryTheirValueOnEveryPort() {
    Junction junction = Box.junction("X", 3, 0);

    assertEquals(List.of("X", "X", "X"), junction.inputPorts());
    assertTrue(junction.outputPorts().isEmpty());
    assertFalse(junction.isPassThrough());
    assertTrue(Box.junction("X", 1, 1).isPassThrough());
    assertThrows(IllegalArgumentException.class, () -> Box.junction("X", -1, 2));
  }

  @Test
  void boxesCompareByValue() {
    assertEquals(
        Box.atomic("f", List.of("A"), List.of("B")), Box.atomic("f", List.of("A"), List.of("B")));
    assertEquals(Box.junction("X", 2, 1), Box.junction("X", 2, 1));
    assertFalse(Box.copy("A").equals(Box.merge("A")));
  }

  @Test
  void wiresRunFromOutputsToInputs() {
    Port output = Port.output(1, 1);
    Port input = Port.input(2, 1);

    assertThrows(IllegalArgumentException.class, () -> new Wire(input, output));
    assertEquals(new Wire(output, input), Wire.of(1, 1, 2, 1));
  }
}
