package wiringdiagrams.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.cli.CliParsers.OptionSpec;
import wiringdiagrams.graphics.GraphvizOptions.Direction;
import wiringdiagrams.graphics.GraphvizWiringDiagrams;
import wiringdiagrams.graphviz.Graph;
import wiringdiagrams.graphviz.GraphvizPrinter;
import wiringdiagrams.io.DiagramJson;

/** Handles the {@code render} command: prints a diagram file as Graphviz DOT. */
final class RenderCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RenderCommand.class);

  private final PrintStream out;

  RenderCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) throws IOException {
    RenderOptions options =
        CliParsers.parseOptions(
                CliParsers.stripCommand(args, "render"), optionSpecs(), RenderOptions.builder())
            .build();
    Graph graph;
    try {
      DiagramJson.Loaded loaded = CliParsers.loadDiagram(options.file());
      graph = GraphvizWiringDiagrams.toGraphviz(loaded.diagram(), options.graphvizOptions());
    } catch (IllegalArgumentException | IllegalStateException ex) {
      LOG.error("Rendering {} failed: {}", options.file(), ex.getMessage());
      return Main.EXIT_FAILURE;
    }
    LOG.info("Rendered {} statements from {}", graph.stmts().size(), options.file());
    CliParsers.emit(GraphvizPrinter.print(graph), options.output(), out);
    return Main.EXIT_OK;
  }

  private Map<String, OptionSpec<RenderOptions.Builder>> optionSpecs() {
    Map<String, OptionSpec<RenderOptions.Builder>> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(Path.of(raw))));
    specs.put("--direction", OptionSpec.withValue((b, raw) -> b.direction(parseDirection(raw))));
    specs.put("--labels", OptionSpec.flag(b -> b.edgeLabels(true)));
    specs.put("--order", OptionSpec.flag(b -> b.orderNodes(true)));
    specs.put("--no-outer-ports", OptionSpec.flag(b -> b.outerPorts(false)));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    return specs;
  }

  private Direction parseDirection(String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "vertical", "tb" -> Direction.VERTICAL;
      case "horizontal", "lr" -> Direction.HORIZONTAL;
      default -> throw new IllegalArgumentException("Invalid direction: " + raw);
    };
  }
}
