package wiringdiagrams.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import wiringdiagrams.normalize.NormalizationOptions;

record RewriteOptions(
    Path file,
    List<String> passes,
    OutputFormat format,
    Path output,
    int maxRounds,
    boolean strictCartesian) {

  RewriteOptions {
    Objects.requireNonNull(file, "--file is required");
    passes = passes == null ? List.of() : List.copyOf(passes);
    format = format == null ? OutputFormat.JSON : format;
    if (maxRounds < 0) {
      throw new IllegalArgumentException("--max-rounds must be non-negative");
    }
  }

  NormalizationOptions normalizationOptions() {
    int rounds = maxRounds > 0 ? maxRounds : NormalizationOptions.defaults().maxRounds();
    return new NormalizationOptions(rounds, strictCartesian);
  }

  static Builder builder() {
    return new Builder();
  }

  enum OutputFormat {
    JSON,
    DOT
  }

  static final class Builder {
    private Path file;
    private List<String> passes = List.of();
    private OutputFormat format = OutputFormat.JSON;
    private Path output;
    private int maxRounds;
    private boolean strictCartesian = true;

    Builder file(Path file) {
      this.file = file;
      return this;
    }

    Builder passes(List<String> passes) {
      this.passes = passes;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    Builder output(Path output) {
      this.output = output;
      return this;
    }

    Builder maxRounds(int maxRounds) {
      this.maxRounds = maxRounds;
      return this;
    }

    Builder strictCartesian(boolean strictCartesian) {
      this.strictCartesian = strictCartesian;
      return this;
    }

    RewriteOptions build() {
      if (file == null) {
        throw new IllegalArgumentException("--file is required");
      }
      return new RewriteOptions(file, passes, format, output, maxRounds, strictCartesian);
    }
  }
}
