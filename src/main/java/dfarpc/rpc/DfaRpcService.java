package dfarpc.rpc;

import dfarpc.AcceptanceChecker;
import dfarpc.AcceptanceChecker.CheckResult;
import dfarpc.Automaton;
import dfarpc.MalformedAutomatonException;
import dfarpc.Minimizer;
import dfarpc.RawAutomaton;
import dfarpc.RenamingAggregator;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates incoming automata and delegates to the core algorithms.
 *
 * Holds no state, so one instance serves every worker thread.
 */
public class DfaRpcService implements DfaRpc {

  private static final Logger LOG = LoggerFactory.getLogger(DfaRpcService.class);

  @Override
  public CheckResult check(RawAutomaton dfa, List<String> input) throws MalformedAutomatonException {
    final Automaton automaton = Automaton.validate(dfa);
    final CheckResult result = AcceptanceChecker.check(automaton, input);
    LOG.debug(
      "check: {} symbols on {} states, accepted = {}, trace length = {}",
      input.size(),
      automaton.states.size(),
      result.accepted(),
      result.trace().size()
    );
    return result;
  }

  @Override
  public MinimizeResult minimize(RawAutomaton dfa) throws MalformedAutomatonException {
    final Automaton automaton = Automaton.validate(dfa);
    final Minimizer.Minimization minimization = Minimizer.minimize(automaton);
    final var groups = RenamingAggregator.groupByNewName(minimization.renaming());
    LOG.trace("minimize: {} became {} with groups {}", automaton, minimization.minimal(), groups);
    return new MinimizeResult(minimization.minimal(), groups);
  }
}
