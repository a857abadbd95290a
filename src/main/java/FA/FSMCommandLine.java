package FA;

import FA.Model.DFA;
import FA.Model.FSM;
import FA.Model.NFAe;
import FA.Model.Symbol;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class FSMCommandLine {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSMCommandLine.class);

  public static void main(String[] args) {
    String conversion = "none";
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        setRootLevel(Level.DEBUG);
      } else if ("--to".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --to");
          printUsageAndExit(); // exits
        }
        conversion = args[++i]; // consume the value
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

    String filePath = positional.get(0);
    List<String> words = positional.subList(1, positional.size());

    if (filePath.endsWith(".ba")) {
      run(BAFormat.getBAFile(filePath), conversion, words, FSMCommandLine::characters);
    } else {
      run(JsonFormat.getJsonFile(filePath), conversion, words, Symbol::word);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSM [--debug] [--to <conversion>] <automaton file> [<word>...]");
    System.out.println("[--debug] : Additional debug output");
    System.out.println("[--to <conversion>] : Convert before evaluating words");
    System.out.println();
    System.out.println("<conversion> : one of the choices below:");
    System.out.println("  none: Evaluate the automaton as loaded (default).");
    System.out.println("  nfa: Epsilon elimination (NFAe to NFA); a DFA is copied into an NFA.");
    System.out.println("  dfa: Subset construction.");
    System.out.println("  transpose: Reverse a DFA into an NFA.");
    System.out.println();
    System.out.println("<automaton file> : JSON automaton, or NFA in the BA format if the name ends in .ba");
    System.out.println("<word> : input, one symbol per character; \"\" is the empty word");
    System.exit(0);
  }

  static <I> List<Boolean> run(FSM<I> fsm, String conversion, List<String> words, Function<String, List<I>> splitter) {
    System.out.println("Original " + fsm.getClass().getSimpleName() + " size: " + fsm.size());
    System.out.println("Alphabet size: " + fsm.getInputAlphabet().size());

    long before = System.currentTimeMillis();
    FSM<I> converted = convert(conversion, fsm);
    long after = System.currentTimeMillis();
    if (converted != fsm) {
      System.out.println(conversion + " size: " + converted.size());
      System.out.println(conversion + " duration: " + ((after - before) / 1000f) + "s");
    }

    List<Boolean> results = new ArrayList<>(words.size());
    for (String word : words) {
      boolean accepted = converted.accepts(splitter.apply(word));
      results.add(accepted);
      System.out.println((accepted ? "accept" : "reject") + " \"" + word + "\"");
    }
    return results;
  }

  /**
   * Choose conversion to run.
   * @param conversion - conversion passed in from command-line
   * @param fsm - loaded automaton
   * @return - converted automaton, or fsm itself for "none"
   */
  static <I> FSM<I> convert(String conversion, FSM<I> fsm) {
    LOGGER.debug("Converting {} with '{}'", fsm.getClass().getSimpleName(), conversion);
    return switch (conversion.toLowerCase()) {
      case "none" -> fsm;
      case "dfa" -> fsm.toDFA();
      case "nfa" -> {
        if (fsm instanceof NFAe<I> nfae) {
          yield nfae.toNFA();
        }
        if (fsm instanceof DFA<I> dfa) {
          yield dfa.toNFA();
        }
        yield fsm;
      }
      case "transpose" -> {
        if (fsm instanceof DFA<I> dfa) {
          yield dfa.toTranspose();
        }
        throw new IllegalStateException("Only a DFA can be transposed, got " + fsm.getClass().getSimpleName());
      }
      default -> throw new IllegalStateException("Unexpected conversion choice: " + conversion);
    };
  }

  private static List<String> characters(String word) {
    List<String> result = new ArrayList<>(word.length());
    word.codePoints().forEach(cp -> result.add(new String(Character.toChars(cp))));
    return result;
  }

  private static void setRootLevel(Level level) {
    Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
      logbackRoot.setLevel(level);
    }
  }
}
