package wiringdiagrams.core;

/** A pass was asked to rewrite a diagram shape it is not defined on. */
public final class UnsupportedStructureException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public UnsupportedStructureException(String message) {
    super(message);
  }
}
