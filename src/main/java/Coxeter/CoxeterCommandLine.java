package Coxeter;

import java.util.ArrayList;
import java.util.List;

import Coxeter.Model.CoxeterConfigurationException;
import Coxeter.Model.Mode;
import Coxeter.Roots.CoxeterMatrix;
import Coxeter.Roots.MinimalRoots;

public class CoxeterCommandLine {
  public static void main(String[] args) {
    boolean list = false;
    List<String> positional = new ArrayList<>();

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        AutomatonBuilder.DEBUG = true;
      } else if ("--list".equalsIgnoreCase(arg)) {
        list = true;
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit();
    }

    final CoxeterDFA minimized;
    try {
      CoxeterMatrix matrix = parseDiagram(positional.subList(1, positional.size()));
      minimized = allModes(positional.get(0), matrix);
    } catch (CoxeterConfigurationException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }

    if (list) {
      System.out.println();
      System.out.print(minimized);
    }
  }

  private static void printUsageAndExit() {
    System.out.println("Coxeter [--debug] [--list] <mode> <diagram entries...>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--list] : Print the states and transitions of the minimized automaton");
    System.out.println();
    System.out.println("<mode> : one of the choices below:");
    System.out.println("  reduced: automaton of all reduced words.");
    System.out.println("  shortlex: automaton of shortlex normal forms, one word per group element.");
    System.out.println();
    System.out.println("<diagram entries> : upper triangle of the Coxeter matrix, row by row.");
    System.out.println("  Each entry is an integer >= 2, or 'inf' (or -1) for infinite order.");
    System.out.println("  E.g. '3 2 3' is the symmetric group S4, '5 2 3' the icosahedral group.");
    System.exit(0);
  }

  /**
   * Parse the upper triangle of a Coxeter matrix.
   * @param entries - command-line entries, integers or 'inf'
   * @return - the Coxeter matrix
   */
  static CoxeterMatrix parseDiagram(List<String> entries) {
    int[] upperTriangle = new int[entries.size()];
    for (int k = 0; k < upperTriangle.length; k++) {
      String entry = entries.get(k).trim();
      if ("inf".equalsIgnoreCase(entry) || "infinity".equalsIgnoreCase(entry)) {
        upperTriangle[k] = CoxeterMatrix.INFINITY;
        continue;
      }
      try {
        upperTriangle[k] = Integer.parseInt(entry);
      } catch (NumberFormatException e) {
        throw new CoxeterConfigurationException("Diagram entry '" + entry + "' is not an integer or 'inf'", e);
      }
    }
    return CoxeterMatrix.fromDiagram(upperTriangle);
  }

  /**
   * Compute minimal roots, build and minimize the automaton for the chosen mode.
   * @param mode - mode passed in from command-line
   * @param matrix - Coxeter matrix
   * @return - minimized DFA.
   */
  static CoxeterDFA allModes(String mode, CoxeterMatrix matrix) {
    final Mode parsed = Mode.parse(mode);
    System.out.println("Invoking mode:" + parsed.getName());
    System.out.println("Coxeter matrix: " + matrix);

    long before = System.currentTimeMillis();
    final MinimalRoots roots = MinimalRoots.compute(matrix);
    long after = System.currentTimeMillis();
    System.out.println("Minimal roots: " + roots.size());
    System.out.println("root time: " + ((after - before) / 1000f) + "s");

    before = System.currentTimeMillis();
    final CoxeterDFA dfa = AutomatonBuilder.build(roots.reflectionTable(), parsed);
    after = System.currentTimeMillis();
    System.out.println("Unminimized DFA size: " + dfa.size());
    System.out.println("build time: " + ((after - before) / 1000f) + "s");

    before = System.currentTimeMillis();
    final CoxeterDFA minimized = dfa.minimize();
    after = System.currentTimeMillis();
    System.out.println(parsed.getName() + " minimized DFA size: " + minimized.size());
    System.out.println(parsed.getName() + " minimization duration: " + ((after - before) / 1000f) + "s");

    return minimized;
  }
}
