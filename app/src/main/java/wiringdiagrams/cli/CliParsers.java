package wiringdiagrams.cli;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import wiringdiagrams.core.WiringDiagram;
import wiringdiagrams.io.DiagramJson;

/** Shared helpers for CLI argument parsing and diagram loading. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  /** Drops the leading command name when present. */
  static String[] stripCommand(String[] args, String command) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (command.equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  /** Applies every {@code --option value}, {@code --option=value} or flag to {@code builder}. */
  static <B> B parseOptions(String[] args, Map<String, OptionSpec<B>> specs, B builder) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<B> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder;
  }

  static List<String> parseList(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return LIST_SPLITTER.splitToList(raw);
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /** Box ids as written in a diagram file; {@code input} and {@code output} name the boundaries. */
  static List<Integer> parseNodeIds(String raw, String optionName) {
    List<Integer> ids = new ArrayList<>();
    for (String token : parseList(raw)) {
      switch (token) {
        case "input" -> ids.add(WiringDiagram.INPUT_ID);
        case "output" -> ids.add(WiringDiagram.OUTPUT_ID);
        default -> ids.add(parseInt(token, 0, optionName));
      }
    }
    return ids;
  }

  static DiagramJson.Loaded loadDiagram(Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new IOException("Diagram file not found: " + file);
    }
    return DiagramJson.load(file);
  }

  /** Writes {@code text} to {@code output}, or to {@code out} when no output file is set. */
  static void emit(String text, Path output, PrintStream out) throws IOException {
    if (output == null) {
      out.print(text);
      out.flush();
      return;
    }
    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(output, text, StandardCharsets.UTF_8);
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec<B>(boolean requiresValue, BiConsumer<B, String> apply) {
    static <B> OptionSpec<B> withValue(BiConsumer<B, String> consumer) {
      return new OptionSpec<>(true, consumer);
    }

    static <B> OptionSpec<B> flag(Consumer<B> consumer) {
      return new OptionSpec<>(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(B builder, String value) {
      apply.accept(builder, value);
    }
  }
}
