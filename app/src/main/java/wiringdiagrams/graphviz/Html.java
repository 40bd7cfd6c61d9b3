package wiringdiagrams.graphviz;

import java.util.Objects;

/** Graphviz "HTML-like" label, kept as raw markup and printed between angle brackets. */
public record Html(String content) {

  public Html {
    Objects.requireNonNull(content, "content");
  }
}
