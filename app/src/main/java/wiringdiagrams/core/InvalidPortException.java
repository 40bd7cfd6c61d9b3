package wiringdiagrams.core;

/** A port reference names a port kind or index a box does not have. */
public final class InvalidPortException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidPortException(String message) {
    super(message);
  }
}
