package kif;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

public class CompilerMain {

  private static final String USAGE =
      "Usage: $COMPILER kif_file [--start-line N] [--end-line N] [--find SYMBOL] [--show-source]";

  static final class Options {
    private String file = null;
    private int startLine = 1;
    private Optional<Integer> endLine = Optional.empty();
    private Optional<String> findSymbol = Optional.empty();
    private boolean showSource = false;

    static Optional<Options> parse(String[] args, PrintStream err) {
      Options options = new Options();
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if (arg.equals("--show-source")) {
          options.showSource = true;
          continue;
        } else if (!arg.startsWith("--")) {
          if (options.file != null) return usageError(err, "more than one file given");
          options.file = arg;
          continue;
        }

        if (i + 1 >= args.length) return usageError(err, arg + " needs a value");
        String value = args[++i];
        switch (arg) {
          case "--start-line":
            {
              Optional<Integer> line = parseLine(value);
              if (!line.isPresent()) return usageError(err, "bad --start-line: " + value);
              options.startLine = line.get();
              break;
            }
          case "--end-line":
            {
              Optional<Integer> line = parseLine(value);
              if (!line.isPresent()) return usageError(err, "bad --end-line: " + value);
              options.endLine = line;
              break;
            }
          case "--find":
            options.findSymbol = Optional.of(value);
            break;
          default:
            return usageError(err, "unknown option " + arg);
        }
      }

      if (options.file == null) return usageError(err, "no file given");
      return Optional.of(options);
    }

    private static Optional<Integer> parseLine(String value) {
      try {
        int line = Integer.parseInt(value);
        return line >= 1 ? Optional.of(line) : Optional.empty();
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }

    private static Optional<Options> usageError(PrintStream err, String msg) {
      err.println("ERROR: " + msg);
      err.println(USAGE);
      return Optional.empty();
    }
  }

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) System.exit(status);
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Optional<Options> parsed = Options.parse(args, err);
    if (!parsed.isPresent()) return 1;
    Options options = parsed.get();

    SourceText source;
    try {
      source = SourceText.read(new File(options.file)).lines(options.startLine, options.endLine);
    } catch (IOException ex) {
      err.println("ERROR: could not read " + options.file + ": " + ex.getMessage());
      return 1;
    }

    Compiler compiler = new Compiler();
    try {
      out.println(compiler.compile(source.content()));
    } catch (CompilerException ex) {
      ex.print(err, source);
      err.println("Compilation failed.  See errors above.");
      return 1;
    }

    if (options.showSource) {
      for (Node node : compiler.ast()) {
        out.println(node);
        node.span().ifPresent(span -> out.println("  source: " + source.slice(span)));
      }
    }

    if (options.findSymbol.isPresent()) {
      String name = options.findSymbol.get();
      ImmutableList<Node> usages = compiler.findSymbolUsages(name);
      if (usages.isEmpty()) {
        out.println(String.format("No usages of '%s'", name));
      } else {
        out.println(String.format("%d usage(s) of '%s':", usages.size(), name));
        for (Node usage : usages) {
          SourceSpan span = usage.span().get();
          out.println(String.format("  %s  %s", source.pos(span.start()), source.slice(span)));
        }
      }
    }

    return 0;
  }
}
