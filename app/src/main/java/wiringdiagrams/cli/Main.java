package wiringdiagrams.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code rewrite --file d.json --passes add-junctions,normalize-copy [--format json|dot]
 *       [--output path] [--max-rounds n] [--lenient]}
 *   <li>{@code render --file d.json [--direction vertical|horizontal] [--labels] [--order]
 *       [--no-outer-ports] [--output path]}
 *   <li>{@code order --file d.json --nodes 2,3 [--sources input,1] [--targets output]}
 * </ul>
 *
 * Exit codes: 0 on success, 1 when a file cannot be read or a diagram cannot be processed, 2 on
 * a usage error.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, System.out);
    if (exit != EXIT_OK) {
      System.exit(exit);
    }
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0) {
      printUsage(out);
      return EXIT_USAGE;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      return switch (command) {
        case "rewrite" -> new RewriteCommand(out).execute(rest);
        case "render" -> new RenderCommand(out).execute(rest);
        case "order" -> new OrderCommand(out).execute(rest);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield EXIT_OK;
        }
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          printUsage(out);
          yield EXIT_USAGE;
        }
      };
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage());
      return EXIT_FAILURE;
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return EXIT_USAGE;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: wiringdiagrams <command> [options]");
    out.println("  rewrite --file d.json --passes p1,p2 [--format json|dot] [--output path]");
    out.println("          [--max-rounds n] [--lenient]");
    out.println("  render  --file d.json [--direction vertical|horizontal] [--labels] [--order]");
    out.println("          [--no-outer-ports] [--output path]");
    out.println("  order   --file d.json --nodes 2,3 [--sources input,1] [--targets output]");
  }
}
