package wiringdiagrams.graphics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static wiringdiagrams.testing.DiagramFixtures.IN;
import static wiringdiagrams.testing.DiagramFixtures.OUT;
import static wiringdiagrams.testing.DiagramFixtures.f;
import static wiringdiagrams.testing.DiagramFixtures.g;
import static wiringdiagrams.testing.DiagramFixtures.wire;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import wiringdiagrams.core.Box;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.graphviz.Attributes;
import wiringdiagrams.graphviz.Edge;
import wiringdiagrams.graphviz.Graph;
import wiringdiagrams.graphviz.GraphvizPrinter;
import wiringdiagrams.graphviz.Html;
import wiringdiagrams.graphviz.Node;
import wiringdiagrams.graphviz.Statement;
import wiringdiagrams.graphviz.Subgraph;
import wiringdiagrams.testing.DiagramFixtures;

final class GraphvizWiringDiagramsTest {
  private static final String TABLE = "<TABLE BORDER=\"0\" CELLPADDING=\"0\" CELLSPACING=\"0\">";

  @Test
  void singleBoxWithOuterPorts() {
    Graph graph = GraphvizWiringDiagrams.toGraphviz(DiagramFixtures.singleton(f()));

    assertEquals("G", graph.name());
    assertTrue(graph.directed());
    assertEquals(Attributes.of("fontname", "Serif", "rankdir", "TB"), graph.graphAttrs());
    assertEquals(
        Attributes.of(
            "fontname", "Serif", "shape", "none", "width", "0", "height", "0", "margin", "0"),
        graph.nodeAttrs());
    assertEquals(Attributes.of("arrowsize", "0.5", "fontname", "Serif"), graph.edgeAttrs());

    List<Statement> stmts = graph.stmts();
    assertEquals(5, stmts.size());
    Subgraph inputs = assertInstanceOf(Subgraph.class, stmts.get(0));
    assertEquals(Attributes.of("rank", "source", "rankdir", "LR"), inputs.graphAttrs());
    assertEquals(
        Attributes.of(
            "style", "invis", "shape", "none", "label", "", "width", "0.333", "height", "0"),
        inputs.nodeAttrs());
    assertEquals(List.of(new Node("ninp1", Attributes.of("id", "in1"))), inputs.stmts());
    Subgraph outputs = assertInstanceOf(Subgraph.class, stmts.get(1));
    assertEquals("sink", outputs.graphAttrs().get("rank"));

    String dot = GraphvizPrinter.print(graph);
    assertTrue(dot.contains("ninp1:s -> n1:in1:n [id=\"e1\",comment=\"A\"];"), dot);
    assertTrue(dot.contains("n1:out1:s -> noutp1:n [id=\"e2\",comment=\"B\"];"), dot);
  }

  @Test
  void boxLabelIsAnHtmlTableOfPorts() {
    Graph graph = GraphvizWiringDiagrams.toGraphviz(DiagramFixtures.singleton(f()));
    Node node = assertInstanceOf(Node.class, graph.stmts().get(2));

    assertEquals("n1", node.name());
    assertEquals("n1", node.attrs().get("id"));
    assertEquals("f", node.attrs().get("comment"));
    String expected =
        TABLE
            + "\n<TR><TD>"
            + TABLE
            + "<TR><TD HEIGHT=\"0\" WIDTH=\"24\" PORT=\"in1\"></TD></TR></TABLE></TD></TR>\n"
            + "<TR><TD BORDER=\"1\" CELLPADDING=\"4\">f</TD></TR>\n"
            + "<TR><TD>"
            + TABLE
            + "<TR><TD HEIGHT=\"0\" WIDTH=\"24\" PORT=\"out1\"></TD></TR></TABLE></TD></TR>\n"
            + "</TABLE>";
    assertEquals(new Html(expected), node.attrs().get("label"));
  }

  @Test
  void horizontalLayoutUsesSideAnchorsAndColumns() {
    GraphvizOptions options =
        GraphvizOptions.builder().direction(GraphvizOptions.Direction.HORIZONTAL).build();
    Graph graph = GraphvizWiringDiagrams.toGraphviz(DiagramFixtures.fThenG(), options);
    String dot = GraphvizPrinter.print(graph);

    assertEquals("LR", graph.graphAttrs().get("rankdir"));
    assertTrue(dot.contains("n1:out1:e -> n2:in1:w"), dot);
    assertTrue(dot.contains("<TD HEIGHT=\"24\" WIDTH=\"0\" PORT=\"in1\"></TD>"), dot);
    Subgraph inputs = assertInstanceOf(Subgraph.class, graph.stmts().get(0));
    assertEquals("TB", inputs.graphAttrs().get("rankdir"));
    assertEquals("0.333", inputs.nodeAttrs().get("height"));
  }

  @Test
  void junctionsAreSmallFilledCircles() {
    WiringDiagram diagram = DiagramFixtures.singleton(Box.junction("X", 1, 2));
    Graph graph = GraphvizWiringDiagrams.toGraphviz(diagram);
    Node junction = assertInstanceOf(Node.class, graph.stmts().get(2));

    assertEquals("junction", junction.attrs().get("comment"));
    assertEquals("circle", junction.attrs().get("shape"));
    assertEquals("0.05", junction.attrs().get("width"));
    String dot = GraphvizPrinter.print(graph);
    assertTrue(dot.contains("n1 -> noutp1:n"), dot);
    assertTrue(dot.contains("n1 -> noutp2:n"), dot);
  }

  @Test
  void outerPortsAreAnchoredInOrder() {
    WiringDiagram diagram = DiagramFixtures.fThenCopy();
    String dot = GraphvizPrinter.print(GraphvizWiringDiagrams.toGraphviz(diagram));

    assertTrue(dot.contains("    noutp1 -> noutp2;\n"), dot);

    GraphvizOptions loose = GraphvizOptions.builder().anchorOuterPorts(false).build();
    String unanchored = GraphvizPrinter.print(GraphvizWiringDiagrams.toGraphviz(diagram, loose));
    assertFalse(unanchored.contains("noutp1 -> noutp2"), unanchored);
  }

  @Test
  void hiddenOuterPortsDropBoundaryWires() {
    GraphvizOptions options = GraphvizOptions.builder().outerPorts(false).build();
    Graph graph = GraphvizWiringDiagrams.toGraphviz(DiagramFixtures.fThenG(), options);

    List<Edge> edges = new ArrayList<>();
    for (Statement stmt : graph.stmts()) {
      assertFalse(stmt instanceof Subgraph);
      if (stmt instanceof Edge edge) {
        edges.add(edge);
      }
    }
    assertEquals(1, edges.size());
    assertEquals("e2", edges.get(0).attrs().get("id"), "wire ids count every wire");
  }

  @Test
  void edgeLabelsAndEscaping() {
    WiringDiagram diagram = new WiringDiagram(List.of("A&B"), List.of("A&B"));
    int box = diagram.addBox(Box.atomic("x<y", List.of("A&B"), List.of("A&B")));
    wire(diagram, IN, 1, box, 1);
    wire(diagram, box, 1, OUT, 1);
    GraphvizOptions options =
        GraphvizOptions.builder()
            .edgeLabels(true)
            .labelAttribute(GraphvizOptions.LabelAttribute.XLABEL)
            .build();

    String dot = GraphvizPrinter.print(GraphvizWiringDiagrams.toGraphviz(diagram, options));

    assertTrue(dot.contains(">x&lt;y</TD>"), dot);
    assertTrue(dot.contains("[id=\"e1\",comment=\"A&B\",xlabel=\"A&B\"]"), dot);
  }

  @Test
  void generatorsAreLabelledByKind() {
    assertEquals("copy", GraphvizWiringDiagrams.boxLabel(Box.copy("B")));
    assertEquals("delete", GraphvizWiringDiagrams.boxLabel(Box.delete("B")));
    assertEquals("f", GraphvizWiringDiagrams.boxLabel(f()));
  }

  @Test
  void orderedNodesFollowTheLayering() {
    WiringDiagram diagram = new WiringDiagram(List.of("A", "B"), List.of("C", "B"));
    int g = diagram.addBox(g());
    int f = diagram.addBox(f());
    wire(diagram, IN, 1, f, 1);
    wire(diagram, IN, 2, g, 1);
    wire(diagram, g, 1, OUT, 1);
    wire(diagram, f, 1, OUT, 2);
    GraphvizOptions options =
        GraphvizOptions.builder().orderNodes(true).outerPorts(false).build();

    List<String> names = new ArrayList<>();
    for (Statement stmt : GraphvizWiringDiagrams.toGraphviz(diagram, options).stmts()) {
      if (stmt instanceof Node node) {
        names.add(node.name());
      }
    }
    assertEquals(List.of("n2", "n1"), names);
  }

  @Test
  void portSizeConvertsToInches() {
    assertEquals("0.333", GraphvizWiringDiagrams.inches("24"));
    assertEquals("0.5", GraphvizWiringDiagrams.inches("36"));
  }

  @Test
  void sizesMustBeNumbers() {
    assertThrows(
        IllegalArgumentException.class,
        () -> GraphvizOptions.builder().portSize("large").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> GraphvizOptions.builder().junctionSize("0.05in").build());
    assertEquals("36", GraphvizOptions.builder().portSize("36").build().portSize());
  }
}
