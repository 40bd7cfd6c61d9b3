package wiringdiagrams.graphviz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

final class GraphvizPrinterTest {

  @Test
  void printsNodesEdgesAndDefaults() {
    Graph graph =
        new Graph(
            "G",
            true,
            List.of(
                new Node("n1", Attributes.of("label", "f")),
                Edge.of(
                    new NodeId("n1", "out1", "s"),
                    new NodeId("n2", "in1", "n"),
                    Attributes.of("id", "e1"))),
            Attributes.of("rankdir", "TB"),
            null,
            Attributes.of("arrowsize", "0.5"));

    String expected =
        """
        digraph G {
          graph [rankdir="TB"];
          edge [arrowsize="0.5"];
          n1 [label="f"];
          n1:out1:s -> n2:in1:n [id="e1"];
        }
        """;
    assertEquals(expected, GraphvizPrinter.print(graph));
  }

  @Test
  void printsNestedSubgraphs() {
    Subgraph inner =
        Subgraph.anonymous(
            List.of(
                new Node("a"),
                new Node("b"),
                new Edge(List.of(NodeId.of("a"), NodeId.of("b"), NodeId.of("c")), null)),
            Attributes.of("rank", "source"),
            Attributes.of("style", "invis"),
            null);
    Subgraph named = new Subgraph("cluster_x", List.of(new Node("c")), null, null, null);
    Graph graph = Graph.undirected("U", List.of(inner, named, Edge.of("a", "c")));

    String expected =
        """
        graph U {
          {
            graph [rank="source"];
            node [style="invis"];
            a;
            b;
            a -- b -- c;
          }
          subgraph cluster_x {
            c;
          }
          a -- c;
        }
        """;
    assertEquals(expected, GraphvizPrinter.print(graph));
  }

  @Test
  void quotesStringsAndKeepsHtmlRaw() {
    Attributes attrs = Attributes.of("label", "say \"hi\"");
    attrs.put("xlabel", new Html("<B>bold</B>"));

    assertEquals(
        " [label=\"say \\\"hi\\\"\",xlabel=<<B>bold</B>>]",
        GraphvizPrinter.attributeList(attrs));
    assertEquals("", GraphvizPrinter.attributeList(new Attributes()));
  }

  @Test
  void laterAttributesOverrideInPlace() {
    Attributes merged =
        Attributes.merge(
            Attributes.of("fontname", "Serif", "shape", "none"), Attributes.of("fontname", "Sans"));

    assertEquals(" [fontname=\"Sans\",shape=\"none\"]", GraphvizPrinter.attributeList(merged));
  }

  @Test
  void edgesNeedTwoEndpoints() {
    assertThrows(
        IllegalArgumentException.class, () -> new Edge(List.of(NodeId.of("a")), new Attributes()));
    assertThrows(IllegalArgumentException.class, () -> Attributes.of("odd"));
  }
}
