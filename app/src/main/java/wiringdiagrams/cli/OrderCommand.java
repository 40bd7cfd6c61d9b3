package wiringdiagrams.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.cli.CliParsers.OptionSpec;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.io.DiagramJson;
import wiringdiagrams.layout.CrossingMinimization;

/**
 * Handles the {@code order} command: sorts one layer of boxes against fixed neighbouring layers
 * and prints the new order as a comma-separated list of file box ids.
 */
final class OrderCommand {
  private static final Logger LOG = LoggerFactory.getLogger(OrderCommand.class);

  private final PrintStream out;

  OrderCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) throws IOException {
    OrderOptions options =
        CliParsers.parseOptions(
                CliParsers.stripCommand(args, "order"), optionSpecs(), OrderOptions.builder())
            .build();
    DiagramJson.Loaded loaded;
    List<Integer> ordered;
    try {
      loaded = CliParsers.loadDiagram(options.file());
      ordered =
          CrossingMinimization.bySort(
              loaded.diagram(),
              toDiagramIds(loaded, options.nodes()),
              toDiagramIds(loaded, options.sources()),
              toDiagramIds(loaded, options.targets()));
    } catch (IllegalArgumentException ex) {
      LOG.error("Ordering failed: {}", ex.getMessage());
      return Main.EXIT_FAILURE;
    }

    List<String> printed = new ArrayList<>(ordered.size());
    for (int id : ordered) {
      printed.add(label(loaded.fileId(id)));
    }
    LOG.info("Ordered {} nodes", printed.size());
    out.println(String.join(",", printed));
    out.flush();
    return Main.EXIT_OK;
  }

  private static List<Integer> toDiagramIds(DiagramJson.Loaded loaded, List<Integer> fileIds) {
    List<Integer> ids = new ArrayList<>(fileIds.size());
    for (int fileId : fileIds) {
      ids.add(loaded.diagramId(fileId));
    }
    return ids;
  }

  private static String label(int id) {
    if (id == WiringDiagram.INPUT_ID) {
      return "input";
    }
    if (id == WiringDiagram.OUTPUT_ID) {
      return "output";
    }
    return Integer.toString(id);
  }

  private Map<String, OptionSpec<OrderOptions.Builder>> optionSpecs() {
    Map<String, OptionSpec<OrderOptions.Builder>> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(Path.of(raw))));
    specs.put(
        "--nodes",
        OptionSpec.withValue((b, raw) -> b.nodes(CliParsers.parseNodeIds(raw, "--nodes"))));
    specs.put(
        "--sources",
        OptionSpec.withValue((b, raw) -> b.sources(CliParsers.parseNodeIds(raw, "--sources"))));
    specs.put(
        "--targets",
        OptionSpec.withValue((b, raw) -> b.targets(CliParsers.parseNodeIds(raw, "--targets"))));
    return specs;
  }
}
