package dfarpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs input through an automaton, recording the states visited.
 */
public final class AcceptanceChecker {

  private static final Logger LOG = LoggerFactory.getLogger(AcceptanceChecker.class);

  private AcceptanceChecker() { }

  /**
   * Outcome of a run.
   *
   * The trace always starts with the start state and holds one more state
   * than the number of symbols consumed. A run which got stuck on a missing
   * transition is rejected and its trace stops at the state where it got
   * stuck.
   *
   * @param accepted whether all of the input was consumed, ending in an accepting state
   * @param trace states visited, in order
   */
  public record CheckResult(boolean accepted, List<String> trace) { }

  /**
   * Check a string, treating every code point as one symbol.
   *
   * @param automaton automaton to run
   * @param input input string
   * @return outcome of the run
   */
  public static CheckResult check(Automaton automaton, CharSequence input) {
    return check(automaton, symbols(input));
  }

  /**
   * Check a sequence of symbols.
   *
   * Symbols outside of the alphabet are not an error: there is simply no
   * transition for them, so the run gets stuck.
   *
   * @param automaton automaton to run
   * @param input symbols to consume, in order
   * @return outcome of the run
   */
  public static CheckResult check(Automaton automaton, List<String> input) {
    final var trace = new ArrayList<String>(input.size() + 1);
    final boolean accepted = Dfa.run(
      automaton,
      input.iterator(),
      trace::add,
      symbol -> LOG.debug(
        "Stuck in state {} on symbol '{}' after {} of {} symbols",
        trace.get(trace.size() - 1),
        symbol,
        trace.size() - 1,
        input.size()
      )
    );
    return new CheckResult(accepted, Collections.unmodifiableList(trace));
  }

  /**
   * Split a string into single code point symbols.
   *
   * @param input input string
   * @return one symbol per code point
   */
  public static List<String> symbols(CharSequence input) {
    return input
      .codePoints()
      .mapToObj((int codePoint) -> new String(Character.toChars(codePoint)))
      .collect(Collectors.toList());
  }
}
