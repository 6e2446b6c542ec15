package dfarpc.rpc;

import dfarpc.AcceptanceChecker.CheckResult;
import dfarpc.Automaton;
import dfarpc.MalformedAutomatonException;
import dfarpc.RawAutomaton;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Procedures callable over the RPC server.
 */
public interface DfaRpc {

  /**
   * Outcome of a minimization, as returned to callers.
   *
   * @param minimal minimal automaton
   * @param groups every new state name mapped to the old state names merged into it
   */
  record MinimizeResult(Automaton minimal, SortedMap<String, SortedSet<String>> groups) { }

  /**
   * Check whether an automaton accepts an input.
   *
   * @param dfa automaton description
   * @param input symbols to consume
   * @return acceptance and the trace of visited states
   * @throws MalformedAutomatonException if the description is not a valid automaton
   */
  CheckResult check(RawAutomaton dfa, List<String> input) throws MalformedAutomatonException;

  /**
   * Minimize an automaton.
   *
   * Rather than the raw old-to-new renaming, callers get the old names
   * grouped under each new name: if {@code q0} and {@code q1} are equivalent
   * and merged into {@code q0}, the groups map {@code q0} to both.
   *
   * @param dfa automaton description
   * @return minimal automaton and renaming groups
   * @throws MalformedAutomatonException if the description is not a valid automaton
   */
  MinimizeResult minimize(RawAutomaton dfa) throws MalformedAutomatonException;
}
