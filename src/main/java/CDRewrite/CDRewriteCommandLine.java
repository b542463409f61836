package CDRewrite;

import CDRewrite.Fst.AttFormat;
import CDRewrite.Fst.Determinizer;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstFormatException;
import CDRewrite.Fst.Semiring;
import CDRewrite.Model.CompilePlan;
import CDRewrite.Model.CompileResult;
import CDRewrite.Model.Direction;
import CDRewrite.Model.Mode;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

public class CDRewriteCommandLine {
  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Parses the arguments, compiles the rule and writes it.
   * @return exit status; 0 on success
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    String directionName = Direction.LEFT_TO_RIGHT.getShortName();
    String modeName = Mode.OBLIGATORY.getShortName();
    String semiringName = Semiring.tropical().getName();
    OptionalInt initialBoundaryMarker = OptionalInt.empty();
    OptionalInt finalBoundaryMarker = OptionalInt.empty();
    List<String> positional = new ArrayList<>(5);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        RuleCompiler.DEBUG = true;
        FilterBuilder.DEBUG = true;
        Determinizer.DEBUG = true;
      } else if (arg.startsWith("--")) {
        // every other flag takes a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
          err.println("Missing value for " + arg);
          printUsage(out);
          return 1;
        }
        String value = args[++i]; // consume the value
        try {
          switch (arg) {
            case "--direction" -> directionName = value;
            case "--mode" -> modeName = value;
            case "--semiring" -> semiringName = value;
            case "--initial_boundary_marker" -> initialBoundaryMarker = boundaryMarker(value);
            case "--final_boundary_marker" -> finalBoundaryMarker = boundaryMarker(value);
            default -> {
              printUsage(out);
              return 1;
            }
          }
        } catch (NumberFormatException e) {
          err.println("Bad value for " + arg + ": " + value);
          return 1;
        }
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 4 && positional.size() != 5) {
      printUsage(out);
      return 1;
    }
    Optional<Direction> direction = Direction.fromShortName(directionName);
    if (direction.isEmpty()) {
      err.println("Unknown direction: " + directionName);
      return 1;
    }
    Optional<Mode> mode = Mode.fromShortName(modeName);
    if (mode.isEmpty()) {
      err.println("Unknown mode: " + modeName);
      return 1;
    }
    Semiring<?> semiring;
    try {
      semiring = Semiring.forName(semiringName);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 1;
    }

    try {
      return compileAndWrite(semiring, positional, direction.get(), mode.get(), initialBoundaryMarker,
          finalBoundaryMarker, out, err);
    } catch (IOException | FstFormatException e) {
      err.println("Cannot read or write FST: " + e.getMessage());
      return 1;
    }
  }

  private static <W> int compileAndWrite(Semiring<W> semiring, List<String> files, Direction direction, Mode mode,
                                         OptionalInt initialBoundaryMarker, OptionalInt finalBoundaryMarker,
                                         PrintStream out, PrintStream err) throws IOException, FstFormatException {
    final Fst<W> tau = AttFormat.readFile(files.get(0), semiring);
    final Fst<W> lambda = AttFormat.readFile(files.get(1), semiring);
    final Fst<W> rho = AttFormat.readFile(files.get(2), semiring);
    final Fst<W> sigma = AttFormat.readFile(files.get(3), semiring);

    long before = System.currentTimeMillis();
    CompileResult<W> result = RuleCompiler.compile(tau, lambda, rho, sigma, direction, mode, initialBoundaryMarker,
        finalBoundaryMarker);
    long after = System.currentTimeMillis();
    if (result instanceof CompileResult.Failure<W> failure) {
      err.println("Rule compilation failed: " + failure.error());
      return 1;
    }
    Fst<W> fst = result.orElseThrow();
    if (RuleCompiler.DEBUG) {
      System.out.println("DEBUG: " + CompilePlan.of(direction, mode) + ", " + fst.numStates() + " states, "
          + fst.numArcs() + " arcs, " + ((after - before) / 1000f) + "s");
    }

    if (files.size() == 5) {
      AttFormat.writeFile(files.get(4), fst);
    } else {
      AttFormat.write(out, fst);
    }
    return 0;
  }

  private static OptionalInt boundaryMarker(String value) {
    int label = Integer.parseInt(value);
    return label == Fst.NO_LABEL ? OptionalInt.empty() : OptionalInt.of(label);
  }

  private static void printUsage(PrintStream out) {
    out.println(
        "CDRewrite [--debug] [--direction ltr|rtl|sim] [--mode obl|opt] [--initial_boundary_marker <label>]"
            + " [--final_boundary_marker <label>] [--semiring tropical|log] <tau> <lambda> <rho> <sigma> [<out>]");
    out.println("[--debug] : Additional debug/progress output");
    out.println("[--direction] : ltr (left-to-right, default), rtl (right-to-left) or sim (simultaneous)");
    out.println("[--mode] : obl (obligatory, default) or opt (optional)");
    out.println("[--initial_boundary_marker <label>] : label matching the beginning of the string in lambda");
    out.println("[--final_boundary_marker <label>] : label matching the end of the string in rho");
    out.println("[--semiring] : weights of the input FSTs, tropical (default) or log");
    out.println();
    out.println("<tau> : the phi x psi transducer");
    out.println("<lambda>, <rho> : left and right context acceptors");
    out.println("<sigma> : acceptor of the closure of the alphabet");
    out.println("[<out>] : output file; the compiled rule is written to stdout if omitted");
    out.println();
    out.println("FSTs are read and written in the AT&T text format: 'src dst ilabel olabel [weight]' and"
        + " 'state [weight]' lines.");
  }
}
