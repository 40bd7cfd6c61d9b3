package wiringdiagrams.core;

/** Closed set of box kinds a {@link WiringDiagram} can hold. */
public enum BoxKind {
  ATOMIC,
  COPY,
  MERGE,
  DELETE,
  CREATE,
  JUNCTION;

  /** True for the four binary/unary structural generators. */
  public boolean isGenerator() {
    return switch (this) {
      case COPY, MERGE, DELETE, CREATE -> true;
      case ATOMIC, JUNCTION -> false;
    };
  }

  /** Fixed in-arity of a generator kind. */
  int generatorInputs() {
    return switch (this) {
      case COPY, DELETE -> 1;
      case MERGE -> 2;
      case CREATE -> 0;
      case ATOMIC, JUNCTION -> throw new IllegalStateException(this + " has no fixed arity");
    };
  }

  /** Fixed out-arity of a generator kind. */
  int generatorOutputs() {
    return switch (this) {
      case COPY -> 2;
      case MERGE, CREATE -> 1;
      case DELETE -> 0;
      case ATOMIC, JUNCTION -> throw new IllegalStateException(this + " has no fixed arity");
    };
  }
}
