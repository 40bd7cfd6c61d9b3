package wiringdiagrams.graphviz;

import java.util.Objects;

/** Edge endpoint: node name with optional port name and compass anchor. */
public record NodeId(String name, String port, String anchor) {

  public NodeId {
    Objects.requireNonNull(name, "name");
    port = port == null ? "" : port;
    anchor = anchor == null ? "" : anchor;
  }

  public static NodeId of(String name) {
    return new NodeId(name, "", "");
  }

  public static NodeId of(String name, String port) {
    return new NodeId(name, port, "");
  }
}
