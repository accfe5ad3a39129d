package ZFlap;

import ZFlap.Finite.FiniteAutomaton;
import ZFlap.Finite.FiniteAutomatonEngine;
import ZFlap.IO.AutomatonDocument;
import ZFlap.IO.AutomatonFormat;
import ZFlap.Model.BacktrackingSearch;
import ZFlap.Model.Symbol;

import java.util.ArrayList;
import java.util.List;

public class ZFlapCommandLine {
  private static final int NO_CYCLE_LIMIT = 0;

  public static void main(String[] args) {
    int cycleLimit = NO_CYCLE_LIMIT;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        FiniteAutomatonEngine.DEBUG = true;
        BacktrackingSearch.DEBUG = true;
      } else if ("--cycleLimit".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --cycleLimit");
          printUsageAndExit();
        }
        cycleLimit = parseCount(args[++i], "--cycleLimit");
        if (cycleLimit < 1) {
          System.err.println("--cycleLimit must be at least 1");
          printUsageAndExit();
        }
      } else if (arg.startsWith("-")) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 3) {
      printUsageAndExit();
    }

    String command = positional.get(0);
    String filePath = positional.get(1);
    String argument = positional.get(2);

    final AutomatonDocument document = AutomatonFormat.getFile(filePath);
    final FiniteAutomaton automaton = document.toFiniteAutomaton();
    System.out.println("Automaton: " + document.name());
    System.out.println("States: " + document.states().size());
    System.out.println("Alphabet size: " + automaton.getAlphabet().size());

    long before = System.currentTimeMillis();
    runCommand(command, automaton, argument, cycleLimit);
    long after = System.currentTimeMillis();
    System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");
  }

  private static void printUsageAndExit() {
    System.out.println(
        "ZFlap [--debug] [--cycleLimit <n>] <command> <automaton file> <argument>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--cycleLimit <n>] : generate only - visit each state at most n times per word");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  validate <file> <word>: Accept or reject the word, with the reason.");
    System.out.println("  reachable <file> <word>: States reached after reading the word.");
    System.out.println("  generate <file> <maxLength>: Accepted words up to the given length.");
    System.out.println();
    System.out.println("<automaton file> : finite automaton in the ZFlap text format ([States] / [Transitions] blocks).");
    System.exit(0);
  }

  /**
   * Run a command against an automaton and print its result.
   * @param command - validate, reachable or generate
   * @param automaton - automaton read from file
   * @param argument - word, or maximum length for generate
   * @param cycleLimit - per-word state visit limit for generate; 0 for none
   * @return printed result lines
   */
  static List<String> runCommand(String command, FiniteAutomaton automaton, String argument, int cycleLimit) {
    List<String> lines = new ArrayList<>();
    switch (command.toLowerCase()) {
      case "validate" -> {
        FiniteAutomatonEngine.Evaluation evaluation = automaton.evaluate(argument);
        lines.add(evaluation.outcome().describe());
      }
      case "reachable" -> lines.add(String.valueOf(automaton.reachableStates(argument)));
      case "generate" -> {
        int maxLength = parseCount(argument, "maxLength");
        List<String> words = cycleLimit == NO_CYCLE_LIMIT
            ? automaton.generateAccepted(maxLength)
            : automaton.generateAccepted(maxLength, cycleLimit);
        for (String word : words) {
          lines.add(word.isEmpty() ? Symbol.EPSILON_LABEL : word);
        }
        lines.add("Generated " + words.size() + " words");
      }
      default -> throw new IllegalStateException("Unexpected command: " + command);
    }
    lines.forEach(System.out::println);
    return lines;
  }

  private static int parseCount(String value, String what) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected a number for " + what + ": " + value, e);
    }
  }
}
