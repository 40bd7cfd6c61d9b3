package wiringdiagrams.core;

public enum PortKind {
  INPUT,
  OUTPUT
}
