package wiringdiagrams.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.normalize.DiagramPass;
import wiringdiagrams.normalize.NormalizationOptions;
import wiringdiagrams.testing.DiagramFixtures;

final class PassRegistryTest {
  private final PassRegistry registry = new PassRegistry(NormalizationOptions.defaults());

  @Test
  void knowsEveryPass() {
    assertEquals(
        List.of(
            "add-junctions",
            "remove-junctions",
            "add-fan-junctions",
            "dissolve-junctions",
            "fuse-junctions",
            "normalize-copy",
            "normalize-delete",
            "normalize-cartesian"),
        List.copyOf(registry.names()));
  }

  @Test
  void junctionRewritesReportWhetherTheyChangedAnything() {
    WiringDiagram diagram = DiagramFixtures.fThenCopy();
    DiagramPass add = registry.get("add-junctions");

    assertTrue(add.apply(diagram));
    assertFalse(add.apply(diagram));
    assertTrue(registry.get("remove-junctions").apply(diagram));
    assertEquals(DiagramFixtures.fThenCopy(), diagram);
  }

  @Test
  void unknownNamesFailBeforeAnythingRuns() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> registry.resolve(List.of("normalize-copy", "normalise-copy")));
    assertTrue(ex.getMessage().contains("normalise-copy"));
  }
}
