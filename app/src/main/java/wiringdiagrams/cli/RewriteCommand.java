package wiringdiagrams.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wiringdiagrams.cli.CliParsers.OptionSpec;
import wiringdiagrams.cli.RewriteOptions.OutputFormat;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.graphics.GraphvizWiringDiagrams;
import wiringdiagrams.graphviz.GraphvizPrinter;
import wiringdiagrams.io.DiagramJson;
import wiringdiagrams.normalize.DiagramPass;

/** Handles the {@code rewrite} command: loads a diagram, runs named passes, writes the result. */
final class RewriteCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RewriteCommand.class);

  private final PrintStream out;

  RewriteCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) throws IOException {
    RewriteOptions options =
        CliParsers.parseOptions(
                CliParsers.stripCommand(args, "rewrite"), optionSpecs(), RewriteOptions.builder())
            .build();
    List<DiagramPass> passes =
        new PassRegistry(options.normalizationOptions()).resolve(options.passes());

    WiringDiagram diagram;
    try {
      diagram = CliParsers.loadDiagram(options.file()).diagram();
      LOG.info(
          "Loaded {} with {} boxes and {} wires",
          options.file(),
          diagram.boxCount(),
          diagram.wireCount());
      for (DiagramPass pass : passes) {
        boolean changed = pass.apply(diagram);
        LOG.info(
            "Pass {}: {} ({} boxes, {} wires)",
            pass.name(),
            changed ? "changed" : "unchanged",
            diagram.boxCount(),
            diagram.wireCount());
      }
    } catch (IllegalArgumentException | IllegalStateException ex) {
      LOG.error("Rewrite of {} failed: {}", options.file(), ex.getMessage());
      return Main.EXIT_FAILURE;
    }

    String text =
        switch (options.format()) {
          case JSON -> DiagramJson.write(diagram) + System.lineSeparator();
          case DOT -> GraphvizPrinter.print(GraphvizWiringDiagrams.toGraphviz(diagram));
        };
    CliParsers.emit(text, options.output(), out);
    return Main.EXIT_OK;
  }

  private Map<String, OptionSpec<RewriteOptions.Builder>> optionSpecs() {
    Map<String, OptionSpec<RewriteOptions.Builder>> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(Path.of(raw))));
    specs.put("--passes", OptionSpec.withValue((b, raw) -> b.passes(CliParsers.parseList(raw))));
    specs.put("--format", OptionSpec.withValue((b, raw) -> b.format(parseFormat(raw))));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output(Path.of(raw))));
    specs.put(
        "--max-rounds",
        OptionSpec.withValue(
            (b, raw) -> b.maxRounds(CliParsers.parseInt(raw, 0, "--max-rounds"))));
    specs.put("--lenient", OptionSpec.flag(b -> b.strictCartesian(false)));
    return specs;
  }

  private OutputFormat parseFormat(String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "json" -> OutputFormat.JSON;
      case "dot", "graphviz" -> OutputFormat.DOT;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }
}
