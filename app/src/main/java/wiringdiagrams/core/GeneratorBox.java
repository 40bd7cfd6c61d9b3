package wiringdiagrams.core;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One of the structural generators Copy (1 → 2), Merge (2 → 1), Delete (1 → 0) and Create (0 →
 * 1). Every port carries the generator's value.
 */
public record GeneratorBox(BoxKind kind, Object value) implements Box {

  public GeneratorBox {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
    if (!kind.isGenerator()) {
      throw new IllegalArgumentException("Not a generator kind: " + kind);
    }
  }

  @Override
  public List<Object> inputPorts() {
    return Collections.nCopies(kind.generatorInputs(), value);
  }

  @Override
  public List<Object> outputPorts() {
    return Collections.nCopies(kind.generatorOutputs(), value);
  }

  @Override
  public int inputCount() {
    return kind.generatorInputs();
  }

  @Override
  public int outputCount() {
    return kind.generatorOutputs();
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + "(" + value + ")";
  }
}
