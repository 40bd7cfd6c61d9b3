package wiringdiagrams.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import wiringdiagrams.testing.DiagramFixtures;

final class NormalizationOptionsTest {

  @AfterEach
  void clearProperty() {
    System.clearProperty(NormalizationOptions.MAX_ROUNDS_PROPERTY);
  }

  @Test
  void systemPropertyOverridesTheRoundBound() {
    System.setProperty(NormalizationOptions.MAX_ROUNDS_PROPERTY, "7");

    NormalizationOptions options = NormalizationOptions.defaults();
    assertEquals(7, options.maxRounds());
    assertTrue(options.strictCartesian());
    assertEquals(7, options.roundLimit(DiagramFixtures.fThenG()));
  }

  @Test
  void unparsablePropertyIsIgnored() {
    System.setProperty(NormalizationOptions.MAX_ROUNDS_PROPERTY, "many");

    assertEquals(NormalizationOptions.defaults(), NormalizationOptions.normalize(null));
  }

  @Test
  void automaticBoundFollowsDiagramSize() {
    NormalizationOptions options =
        NormalizationOptions.normalize(new NormalizationOptions(-3, false));

    assertEquals(0, options.maxRounds());
    assertEquals(4, options.roundLimit(DiagramFixtures.fThenG()));
  }
}
