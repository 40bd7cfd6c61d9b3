package wiringdiagrams.graphviz;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered attribute list. Values are either plain strings (printed double-quoted) or {@link Html}
 * (printed between angle brackets). Re-putting a key keeps its original position.
 */
public final class Attributes {
  private final Map<String, Object> values = new LinkedHashMap<>();

  public Attributes() {}

  /** Attributes from alternating keys and string values. */
  public static Attributes of(String... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got " + keyValues.length);
    }
    Attributes attrs = new Attributes();
    for (int i = 0; i < keyValues.length; i += 2) {
      attrs.put(keyValues[i], keyValues[i + 1]);
    }
    return attrs;
  }

  public static Attributes copyOf(Attributes attrs) {
    Attributes copy = new Attributes();
    if (attrs != null) {
      copy.values.putAll(attrs.values);
    }
    return copy;
  }

  /** Left-to-right merge: later lists override earlier values but not their positions. */
  public static Attributes merge(Attributes... lists) {
    Attributes merged = new Attributes();
    for (Attributes attrs : lists) {
      if (attrs != null) {
        merged.values.putAll(attrs.values);
      }
    }
    return merged;
  }

  public Attributes put(String key, String value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return this;
  }

  public Attributes put(String key, Html value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return this;
  }

  public Object get(String key) {
    return values.get(key);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int size() {
    return values.size();
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Attributes other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
