package wiringdiagrams.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generalized n-to-m structural node on a single value. Its ports are untyped by index: every one
 * of them carries {@link #value()}, so consumers should read {@link #inputCount()} and {@link
 * #outputCount()} rather than the port lists.
 */
public record Junction(Object value, int inputCount, int outputCount) implements Box {

  public Junction {
    Objects.requireNonNull(value, "value");
    if (inputCount < 0 || outputCount < 0) {
      throw new IllegalArgumentException(
          "Junction arities must be non-negative: (" + inputCount + ", " + outputCount + ")");
    }
  }

  @Override
  public BoxKind kind() {
    return BoxKind.JUNCTION;
  }

  @Override
  public List<Object> inputPorts() {
    return Collections.nCopies(inputCount, value);
  }

  @Override
  public List<Object> outputPorts() {
    return Collections.nCopies(outputCount, value);
  }

  /** True when the junction only routes one wire through, i.e. {@code (1, 1)}. */
  public boolean isPassThrough() {
    return inputCount == 1 && outputCount == 1;
  }

  @Override
  public String toString() {
    return "junction(" + value + ", " + inputCount + ", " + outputCount + ")";
  }
}
