package wiringdiagrams.core;

/** A wire would connect ports carrying different value tags. */
public final class PortTypeMismatchException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public PortTypeMismatchException(String message) {
    super(message);
  }
}
