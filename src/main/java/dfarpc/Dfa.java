package dfarpc;

import java.util.*;
import java.util.function.Consumer;

/**
 * Deterministic finite automata
 *
 * Transitions are partial: a state need not have an outgoing transition for
 * every symbol in the alphabet. A missing transition rejects the input.
 *
 * @param <Q> states in the automata
 * @param <E> input symbol alphabet
 */
public interface Dfa<Q, E> {

  /**
   * Initial state
   *
   * @return starting state in the machine
   */
  Q initial();

  /**
   * Accepting states
   *
   * @return accepting states in the machine
   */
  Set<Q> accepting();

  /**
   * All states reachable from the initial state
   *
   * @return set of all reachable states in the DFA
   */
  default Set<Q> allStates() {
    final Set<Q> states = new HashSet<Q>();
    final Stack<Q> toVisit = new Stack<Q>();

    {
      final Q initial = initial();
      toVisit.push(initial);
      states.add(initial);
    }

    while (!toVisit.empty()) {
      for (Q target : transitionsMap(toVisit.pop()).values()) {
        if (states.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return states;
  }

  /**
   * Look up the mapping of transitions from a certain state
   *
   * @param state state inside the DFA
   * @return map of alphabet symbols to target states (empty if there are none)
   */
  Map<E, Q> transitionsMap(Q state);

  /**
   * Run the a DFA either to completion or to a stuck state
   *
   * @param dfa deterministic finite automata to run
   * @param input symbols to consume
   * @param onState callback to invoke whenever entering a state
   * @param onMissingJump callback to invoke when there is no valid transition
   * @return whether the DFA consumed all of the input and reached an accepting state
   */
  static <Q, E> boolean run(
    Dfa<Q, E> dfa,
    Iterator<E> input,
    Consumer<Q> onState,
    Consumer<E> onMissingJump
  ) {
    Q currentState = dfa.initial();
    onState.accept(currentState);
    Set<Q> terminals = dfa.accepting();

    while (input.hasNext()) {
      final E e = input.next();
      final Q target = dfa.transitionsMap(currentState).get(e);

      // No transition found
      if (target == null) {
        onMissingJump.accept(e);
        return false;
      }

      currentState = target;
      onState.accept(currentState);
    }

    return terminals.contains(currentState);
  }
}
