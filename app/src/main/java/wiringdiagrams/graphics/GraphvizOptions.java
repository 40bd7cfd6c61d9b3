package wiringdiagrams.graphics;

import java.math.BigDecimal;
import java.util.Objects;
import wiringdiagrams.graphviz.Attributes;

/**
 * Rendering options for {@link GraphvizWiringDiagrams}.
 *
 * @param graphName name of the emitted digraph
 * @param direction top-to-bottom or left-to-right layout
 * @param nodeLabels whether boxes show their value
 * @param edgeLabels whether wires show their port value
 * @param labelAttribute which edge attribute carries the wire label
 * @param portSize minimum size of box ports, in points
 * @param junctionSize diameter of junction nodes, in inches
 * @param outerPorts whether to draw the diagram's own inputs and outputs (and their wires)
 * @param anchorOuterPorts whether to pin the order of the outer ports
 * @param orderNodes whether to emit boxes layer by layer in crossing-reduced order
 */
public record GraphvizOptions(
    String graphName,
    Direction direction,
    boolean nodeLabels,
    boolean edgeLabels,
    LabelAttribute labelAttribute,
    String portSize,
    String junctionSize,
    boolean outerPorts,
    boolean anchorOuterPorts,
    boolean orderNodes,
    Attributes graphAttrs,
    Attributes nodeAttrs,
    Attributes edgeAttrs,
    Attributes cellAttrs) {

  public GraphvizOptions {
    Objects.requireNonNull(graphName, "graphName");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(labelAttribute, "labelAttribute");
    requireNumber(portSize, "portSize");
    requireNumber(junctionSize, "junctionSize");
    graphAttrs = Attributes.copyOf(graphAttrs);
    nodeAttrs = Attributes.copyOf(nodeAttrs);
    edgeAttrs = Attributes.copyOf(edgeAttrs);
    cellAttrs = Attributes.copyOf(cellAttrs);
  }

  private static void requireNumber(String value, String name) {
    Objects.requireNonNull(value, name);
    try {
      new BigDecimal(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number: " + value, ex);
    }
  }

  public static GraphvizOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public enum Direction {
    VERTICAL("TB"),
    HORIZONTAL("LR");

    private final String rankdir;

    Direction(String rankdir) {
      this.rankdir = rankdir;
    }

    public String rankdir() {
      return rankdir;
    }
  }

  public enum LabelAttribute {
    LABEL("label"),
    XLABEL("xlabel"),
    HEADLABEL("headlabel"),
    TAILLABEL("taillabel");

    private final String key;

    LabelAttribute(String key) {
      this.key = key;
    }

    public String key() {
      return key;
    }
  }

  public static final class Builder {
    private String graphName = "G";
    private Direction direction = Direction.VERTICAL;
    private boolean nodeLabels = true;
    private boolean edgeLabels;
    private LabelAttribute labelAttribute = LabelAttribute.LABEL;
    private String portSize = "24";
    private String junctionSize = "0.05";
    private boolean outerPorts = true;
    private boolean anchorOuterPorts = true;
    private boolean orderNodes;
    private Attributes graphAttrs = new Attributes();
    private Attributes nodeAttrs = new Attributes();
    private Attributes edgeAttrs = new Attributes();
    private Attributes cellAttrs = new Attributes();

    private Builder() {}

    public Builder graphName(String graphName) {
      this.graphName = graphName;
      return this;
    }

    public Builder direction(Direction direction) {
      this.direction = direction;
      return this;
    }

    public Builder nodeLabels(boolean nodeLabels) {
      this.nodeLabels = nodeLabels;
      return this;
    }

    public Builder edgeLabels(boolean edgeLabels) {
      this.edgeLabels = edgeLabels;
      return this;
    }

    public Builder labelAttribute(LabelAttribute labelAttribute) {
      this.labelAttribute = labelAttribute;
      return this;
    }

    public Builder portSize(String portSize) {
      this.portSize = portSize;
      return this;
    }

    public Builder junctionSize(String junctionSize) {
      this.junctionSize = junctionSize;
      return this;
    }

    public Builder outerPorts(boolean outerPorts) {
      this.outerPorts = outerPorts;
      return this;
    }

    public Builder anchorOuterPorts(boolean anchorOuterPorts) {
      this.anchorOuterPorts = anchorOuterPorts;
      return this;
    }

    public Builder orderNodes(boolean orderNodes) {
      this.orderNodes = orderNodes;
      return this;
    }

    public Builder graphAttrs(Attributes graphAttrs) {
      this.graphAttrs = graphAttrs;
      return this;
    }

    public Builder nodeAttrs(Attributes nodeAttrs) {
      this.nodeAttrs = nodeAttrs;
      return this;
    }

    public Builder edgeAttrs(Attributes edgeAttrs) {
      this.edgeAttrs = edgeAttrs;
      return this;
    }

    public Builder cellAttrs(Attributes cellAttrs) {
      this.cellAttrs = cellAttrs;
      return this;
    }

    public GraphvizOptions build() {
      return new GraphvizOptions(
          graphName,
          direction,
          nodeLabels,
          edgeLabels,
          labelAttribute,
          portSize,
          junctionSize,
          outerPorts,
          anchorOuterPorts,
          orderNodes,
          graphAttrs,
          nodeAttrs,
          edgeAttrs,
          cellAttrs);
    }
  }
}
