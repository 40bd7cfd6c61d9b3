package wiringdiagrams.graphics;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.BoxKind;
import wiringdiagrams.core.Port;
import wiringdiagrams.core.PortKind;
import wiringdiagrams.core.Wire;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.graphviz.Attributes;
import wiringdiagrams.graphviz.Edge;
import wiringdiagrams.graphviz.Graph;
import wiringdiagrams.graphviz.Html;
import wiringdiagrams.graphviz.Node;
import wiringdiagrams.graphviz.NodeId;
import wiringdiagrams.graphviz.Statement;
import wiringdiagrams.graphviz.Subgraph;
import wiringdiagrams.layout.Layering;

/**
 * Draws a wiring diagram as a Graphviz digraph.
 *
 * <p>Boxes become nodes {@code n<id>} with an HTML table label whose cells are the box ports, so
 * wires attach to the right side of each box. Junctions become small filled circles. The outer
 * inputs and outputs become invisible rank-pinned nodes {@code ninp<i>} and {@code noutp<i>}.
 * Wires are emitted in insertion order with ids {@code e1, e2, ...}.
 */
public final class GraphvizWiringDiagrams {
  private static final Logger LOG = LoggerFactory.getLogger(GraphvizWiringDiagrams.class);
  private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();
  private static final String TABLE = "<TABLE BORDER=\"0\" CELLPADDING=\"0\" CELLSPACING=\"0\">";

  static final Attributes DEFAULT_GRAPH_ATTRS = Attributes.of("fontname", "Serif");
  static final Attributes DEFAULT_NODE_ATTRS =
      Attributes.of(
          "fontname", "Serif", "shape", "none", "width", "0", "height", "0", "margin", "0");
  static final Attributes DEFAULT_EDGE_ATTRS =
      Attributes.of("arrowsize", "0.5", "fontname", "Serif");
  static final Attributes DEFAULT_CELL_ATTRS = Attributes.of("border", "1", "cellpadding", "4");

  private GraphvizWiringDiagrams() {}

  public static Graph toGraphviz(WiringDiagram diagram) {
    return toGraphviz(diagram, GraphvizOptions.defaults());
  }

  public static Graph toGraphviz(WiringDiagram diagram, GraphvizOptions options) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(options, "options");
    boolean vertical = options.direction() == GraphvizOptions.Direction.VERTICAL;
    List<Statement> stmts = new ArrayList<>();
    Map<Port, NodeId> endpoints = new HashMap<>();

    if (options.outerPorts()) {
      addOuterPorts(diagram, WiringDiagram.INPUT_ID, options, stmts, endpoints);
      addOuterPorts(diagram, WiringDiagram.OUTPUT_ID, options, stmts, endpoints);
    }

    Attributes cellAttrs = Attributes.merge(DEFAULT_CELL_ATTRS, options.cellAttrs());
    for (int id : boxOrder(diagram, options)) {
      Box box = diagram.box(id);
      String name = nodeName(id);
      if (box.kind() == BoxKind.JUNCTION) {
        stmts.add(junctionNode(id, options));
        for (int i = 1; i <= box.inputCount(); i++) {
          endpoints.put(Port.input(id, i), NodeId.of(name));
        }
        for (int i = 1; i <= box.outputCount(); i++) {
          endpoints.put(Port.output(id, i), NodeId.of(name));
        }
        continue;
      }
      stmts.add(boxNode(id, box, options, cellAttrs));
      for (int i = 1; i <= box.inputCount(); i++) {
        endpoints.put(
            Port.input(id, i),
            new NodeId(name, portName(PortKind.INPUT, i), anchor(PortKind.INPUT, vertical)));
      }
      for (int i = 1; i <= box.outputCount(); i++) {
        endpoints.put(
            Port.output(id, i),
            new NodeId(name, portName(PortKind.OUTPUT, i), anchor(PortKind.OUTPUT, vertical)));
      }
    }

    int index = 0;
    int skipped = 0;
    for (Wire wire : diagram.wires()) {
      index++;
      NodeId source = endpoints.get(wire.source());
      NodeId target = endpoints.get(wire.target());
      if (source == null || target == null) {
        skipped++;
        continue;
      }
      String label = String.valueOf(diagram.portValue(wire.source()));
      Attributes attrs = Attributes.of("id", "e" + index, "comment", label);
      if (options.edgeLabels()) {
        attrs.put(options.labelAttribute().key(), label);
      }
      stmts.add(Edge.of(source, target, attrs));
    }
    if (skipped > 0) {
      LOG.debug("Left out {} wires touching the hidden outer ports", skipped);
    }

    Attributes graphAttrs =
        Attributes.merge(
            DEFAULT_GRAPH_ATTRS,
            options.graphAttrs(),
            Attributes.of("rankdir", options.direction().rankdir()));
    return new Graph(
        options.graphName(),
        true,
        stmts,
        graphAttrs,
        Attributes.merge(DEFAULT_NODE_ATTRS, options.nodeAttrs()),
        Attributes.merge(DEFAULT_EDGE_ATTRS, options.edgeAttrs()));
  }

  private static List<Integer> boxOrder(WiringDiagram diagram, GraphvizOptions options) {
    if (!options.orderNodes()) {
      return diagram.boxIds();
    }
    List<Integer> order = new ArrayList<>(diagram.boxCount());
    for (List<Integer> layer : Layering.orderedLayers(diagram)) {
      order.addAll(layer);
    }
    return order;
  }

  private static void addOuterPorts(
      WiringDiagram diagram,
      int boundary,
      GraphvizOptions options,
      List<Statement> stmts,
      Map<Port, NodeId> endpoints) {
    boolean vertical = options.direction() == GraphvizOptions.Direction.VERTICAL;
    boolean inputs = boundary == WiringDiagram.INPUT_ID;
    // The input boundary exposes its ports as outputs feeding the diagram, and vice versa.
    PortKind kind = inputs ? PortKind.OUTPUT : PortKind.INPUT;
    int count = inputs ? diagram.inputPorts().size() : diagram.outputPorts().size();
    if (count == 0) {
      return;
    }

    List<Statement> nodes = new ArrayList<>(count);
    List<NodeId> chain = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      String name = nodeName(boundary) + "p" + i;
      String id = portName(inputs ? PortKind.INPUT : PortKind.OUTPUT, i);
      nodes.add(new Node(name, Attributes.of("id", id)));
      chain.add(NodeId.of(name));
      endpoints.put(new Port(boundary, kind, i), new NodeId(name, "", anchor(kind, vertical)));
    }
    if (options.anchorOuterPorts() && count > 1) {
      nodes.add(new Edge(chain, new Attributes()));
    }

    String rankdir = vertical ? "LR" : "TB";
    String size = inches(options.portSize());
    Attributes graphAttrs = Attributes.of("rank", inputs ? "source" : "sink", "rankdir", rankdir);
    Attributes nodeAttrs =
        Attributes.of(
            "style", "invis",
            "shape", "none",
            "label", "",
            "width", vertical ? size : "0",
            "height", vertical ? "0" : size);
    stmts.add(Subgraph.anonymous(nodes, graphAttrs, nodeAttrs, Attributes.of("style", "invis")));
  }

  private static Node junctionNode(int id, GraphvizOptions options) {
    return new Node(
        nodeName(id),
        Attributes.of(
            "id", nodeId(id),
            "comment", "junction",
            "label", "",
            "shape", "circle",
            "style", "filled",
            "fillcolor", "black",
            "width", options.junctionSize(),
            "height", options.junctionSize()));
  }

  private static Node boxNode(int id, Box box, GraphvizOptions options, Attributes cellAttrs) {
    String label = boxLabel(box);
    String text = options.nodeLabels() ? label : "";
    boolean vertical = options.direction() == GraphvizOptions.Direction.VERTICAL;
    String html =
        vertical
            ? verticalTable(box, text, cellAttrs, options.portSize())
            : horizontalTable(box, text, cellAttrs, options.portSize());
    Attributes attrs = Attributes.of("id", nodeId(id), "comment", label);
    attrs.put("label", new Html(html));
    return new Node(nodeName(id), attrs);
  }

  /** Atomic boxes show their value, generators their kind. */
  static String boxLabel(Box box) {
    if (box.kind() == BoxKind.ATOMIC) {
      return String.valueOf(box.value());
    }
    return box.kind().name().toLowerCase(Locale.ROOT);
  }

  private static String verticalTable(Box box, String text, Attributes cellAttrs, String portSize) {
    return TABLE
        + "\n<TR><TD>"
        + portRow(PortKind.INPUT, box.inputCount(), portSize)
        + "</TD></TR>\n<TR><TD "
        + cellAttributes(cellAttrs)
        + ">"
        + ESCAPER.escape(text)
        + "</TD></TR>\n<TR><TD>"
        + portRow(PortKind.OUTPUT, box.outputCount(), portSize)
        + "</TD></TR>\n</TABLE>";
  }

  private static String horizontalTable(
      Box box, String text, Attributes cellAttrs, String portSize) {
    return TABLE
        + "\n<TR>\n<TD>"
        + portColumn(PortKind.INPUT, box.inputCount(), portSize)
        + "</TD>\n<TD "
        + cellAttributes(cellAttrs)
        + ">"
        + ESCAPER.escape(text)
        + "</TD>\n<TD>"
        + portColumn(PortKind.OUTPUT, box.outputCount(), portSize)
        + "</TD>\n</TR>\n</TABLE>";
  }

  private static String portRow(PortKind kind, int count, String portSize) {
    StringBuilder sb = new StringBuilder(TABLE).append("<TR>");
    if (count == 0) {
      sb.append("<TD HEIGHT=\"0\" WIDTH=\"").append(portSize).append("\"></TD>");
    }
    for (int i = 1; i <= count; i++) {
      sb.append("<TD HEIGHT=\"0\" WIDTH=\"")
          .append(portSize)
          .append("\" PORT=\"")
          .append(portName(kind, i))
          .append("\"></TD>");
    }
    return sb.append("</TR></TABLE>").toString();
  }

  private static String portColumn(PortKind kind, int count, String portSize) {
    StringBuilder sb = new StringBuilder(TABLE);
    if (count == 0) {
      sb.append("<TR><TD HEIGHT=\"").append(portSize).append("\" WIDTH=\"0\"></TD></TR>");
    }
    for (int i = 1; i <= count; i++) {
      sb.append("<TR><TD HEIGHT=\"")
          .append(portSize)
          .append("\" WIDTH=\"0\" PORT=\"")
          .append(portName(kind, i))
          .append("\"></TD></TR>");
    }
    return sb.append("</TABLE>").toString();
  }

  private static String cellAttributes(Attributes attrs) {
    List<String> pairs = new ArrayList<>(attrs.size());
    for (Map.Entry<String, Object> entry : attrs.asMap().entrySet()) {
      pairs.add(entry.getKey().toUpperCase(Locale.ROOT) + "=\"" + entry.getValue() + "\"");
    }
    return String.join(" ", pairs);
  }

  static String nodeName(int id) {
    if (id == WiringDiagram.INPUT_ID) {
      return "nin";
    }
    if (id == WiringDiagram.OUTPUT_ID) {
      return "nout";
    }
    return "n" + id;
  }

  private static String nodeId(int id) {
    return "n" + id;
  }

  static String portName(PortKind kind, int port) {
    return (kind == PortKind.INPUT ? "in" : "out") + port;
  }

  private static String anchor(PortKind kind, boolean vertical) {
    if (vertical) {
      return kind == PortKind.INPUT ? "n" : "s";
    }
    return kind == PortKind.INPUT ? "w" : "e";
  }

  /** Port size in points converted to inches, three decimals. */
  static String inches(String points) {
    BigDecimal value =
        new BigDecimal(points).divide(BigDecimal.valueOf(72), 3, RoundingMode.HALF_UP);
    return value.stripTrailingZeros().toPlainString();
  }
}
