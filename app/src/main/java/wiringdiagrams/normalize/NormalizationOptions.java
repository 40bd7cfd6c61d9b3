package wiringdiagrams.normalize;

import wiringdiagrams.core.WiringDiagram;

/**
 * Knobs for the normalization passes.
 *
 * @param maxRounds upper bound on fixpoint rounds per call; zero or less derives the bound from
 *     the diagram size
 * @param strictCartesian whether cartesian normalization rejects merge/create structure
 */
public record NormalizationOptions(int maxRounds, boolean strictCartesian) {
  static final String MAX_ROUNDS_PROPERTY = "wiringdiagrams.maxRounds";
  static final String MAX_ROUNDS_ENV = "WIRINGDIAGRAMS_MAX_ROUNDS";

  /**
   * Strict cartesian checking and an automatic round bound, unless overridden through the system
   * property {@code wiringdiagrams.maxRounds} or the environment variable {@code
   * WIRINGDIAGRAMS_MAX_ROUNDS}.
   */
  public static NormalizationOptions defaults() {
    return new NormalizationOptions(configuredMaxRounds(), true);
  }

  public static NormalizationOptions normalize(NormalizationOptions options) {
    if (options == null) {
      return defaults();
    }
    return new NormalizationOptions(Math.max(0, options.maxRounds()), options.strictCartesian());
  }

  /** Round bound for one pass over {@code diagram}: every productive round removes a box. */
  int roundLimit(WiringDiagram diagram) {
    return maxRounds > 0 ? maxRounds : diagram.boxCount() + 2;
  }

  private static int configuredMaxRounds() {
    String propertyValue = System.getProperty(MAX_ROUNDS_PROPERTY);
    if (propertyValue != null) {
      try {
        return Integer.parseInt(propertyValue.trim());
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(MAX_ROUNDS_ENV);
    if (envValue != null) {
      try {
        return Integer.parseInt(envValue.trim());
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return 0;
  }
}
