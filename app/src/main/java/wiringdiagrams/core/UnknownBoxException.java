package wiringdiagrams.core;

/** A box id is not present in the diagram it was used with. */
public final class UnknownBoxException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public UnknownBoxException(String message) {
    super(message);
  }

  static UnknownBoxException of(int box) {
    return new UnknownBoxException("No box with id " + box);
  }
}
