package dfarpc;

import dfarpc.MalformedAutomatonException.Kind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Validated, immutable deterministic finite automaton over named states and
 * textual symbols.
 *
 * All collections are sorted so that two automata built from the same sets
 * (in whatever order they were supplied) are equal and print identically.
 */
public final class Automaton implements Dfa<String, String> {

  /**
   * Every state, reachable or not.
   */
  public final SortedSet<String> states;

  /**
   * Input symbols.
   */
  public final SortedSet<String> alphabet;

  /**
   * Transitions indexed by source state then by symbol.
   *
   * States without any outgoing transition have no entry. The inner maps are
   * not modifiable.
   */
  private final SortedMap<String, SortedMap<String, String>> transitions;

  /**
   * Starting state.
   */
  public final String start;

  /**
   * Accepting states, a subset of {@code states}.
   */
  public final SortedSet<String> accepting;

  /**
   * Callers are responsible for handing over collections which already
   * satisfy the structural rules of {@link #validate}.
   */
  Automaton(
    SortedSet<String> states,
    SortedSet<String> alphabet,
    SortedMap<String, SortedMap<String, String>> transitions,
    String start,
    SortedSet<String> accepting
  ) {
    transitions.replaceAll((from, outgoing) -> Collections.unmodifiableSortedMap(outgoing));

    this.states = Collections.unmodifiableSortedSet(states);
    this.alphabet = Collections.unmodifiableSortedSet(alphabet);
    this.transitions = Collections.unmodifiableSortedMap(transitions);
    this.start = start;
    this.accepting = Collections.unmodifiableSortedSet(accepting);
  }

  /**
   * Check a raw description and build the automaton it describes.
   *
   * The following must hold:
   *
   *   - every field is present and no list contains {@code null}
   *
   *   - states and alphabet are non-empty and free of duplicates
   *
   *   - the start state and every accepting state are states
   *
   *   - every transition goes between states on a symbol in the alphabet, and
   *     no state has two different targets for the same symbol
   *
   * @param raw unvalidated description
   * @return automaton satisfying all of the rules above
   * @throws MalformedAutomatonException on the first rule found broken
   */
  public static Automaton validate(RawAutomaton raw) throws MalformedAutomatonException {
    final var states = distinct(
      requirePresent(raw.states(), "states"),
      "states",
      Kind.EMPTY_STATES,
      Kind.DUPLICATE_STATE
    );
    final var alphabet = distinct(
      requirePresent(raw.alphabet(), "alphabet"),
      "alphabet",
      Kind.EMPTY_ALPHABET,
      Kind.DUPLICATE_SYMBOL
    );

    final String start = requirePresent(raw.start(), "start");
    if (!states.contains(start)) {
      throw new MalformedAutomatonException(Kind.INVALID_START, start);
    }

    final var accepting = new TreeSet<String>();
    for (String state : requirePresent(raw.accepting(), "accepting")) {
      requirePresent(state, "accepting");
      if (!states.contains(state)) {
        throw new MalformedAutomatonException(Kind.INVALID_ACCEPTING, state);
      }
      accepting.add(state);
    }

    final var transitions = new TreeMap<String, SortedMap<String, String>>();
    for (Transition transition : requirePresent(raw.transitions(), "transitions")) {
      requirePresent(transition, "transitions");
      final String from = requirePresent(transition.from(), "transitions.from");
      final String symbol = requirePresent(transition.symbol(), "transitions.symbol");
      final String to = requirePresent(transition.to(), "transitions.to");

      if (!states.contains(from)) {
        throw new MalformedAutomatonException(Kind.UNKNOWN_TRANSITION_STATE, from);
      } else if (!alphabet.contains(symbol)) {
        throw new MalformedAutomatonException(Kind.UNKNOWN_TRANSITION_SYMBOL, symbol);
      } else if (!states.contains(to)) {
        throw new MalformedAutomatonException(Kind.UNKNOWN_TRANSITION_STATE, to);
      }

      final String previous = transitions
        .computeIfAbsent(from, k -> new TreeMap<>())
        .putIfAbsent(symbol, to);

      // Repeating the exact same transition is harmless
      if (previous != null && !previous.equals(to)) {
        throw new MalformedAutomatonException(
          Kind.CONFLICTING_TRANSITION,
          "(" + from + ", " + symbol + ") -> " + previous + " and " + to
        );
      }
    }

    return new Automaton(states, alphabet, transitions, start, accepting);
  }

  private static <T> T requirePresent(T value, String field) throws MalformedAutomatonException {
    if (value == null) {
      throw new MalformedAutomatonException(Kind.MISSING_FIELD, field);
    }
    return value;
  }

  private static TreeSet<String> distinct(
    List<String> names,
    String field,
    Kind whenEmpty,
    Kind whenDuplicated
  ) throws MalformedAutomatonException {
    if (names.isEmpty()) {
      throw new MalformedAutomatonException(whenEmpty, field);
    }
    final var output = new TreeSet<String>();
    for (String name : names) {
      requirePresent(name, field);
      if (!output.add(name)) {
        throw new MalformedAutomatonException(whenDuplicated, name);
      }
    }
    return output;
  }

  @Override
  public String initial() {
    return start;
  }

  @Override
  public Set<String> accepting() {
    return accepting;
  }

  @Override
  public Map<String, String> transitionsMap(String state) {
    return transitions.getOrDefault(state, Collections.emptySortedMap());
  }

  /**
   * Look up a single transition.
   *
   * @param state source state
   * @param symbol symbol to consume
   * @return target state, or {@code null} if there is no such transition
   */
  public String target(String state, String symbol) {
    return transitionsMap(state).get(symbol);
  }

  /**
   * All transitions, ordered by source state then symbol.
   *
   * @return stream of transitions
   */
  public Stream<Transition> transitions() {
    return transitions
      .entrySet()
      .stream()
      .flatMap(outgoing ->
        outgoing
          .getValue()
          .entrySet()
          .stream()
          .map(entry -> new Transition(outgoing.getKey(), entry.getKey(), entry.getValue()))
      );
  }

  /**
   * Number of transitions in the automaton.
   */
  public int transitionCount() {
    return transitions.values().stream().mapToInt(Map::size).sum();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Automaton)) {
      return false;
    } else {
      final var other = (Automaton) obj;
      return states.equals(other.states) &&
        alphabet.equals(other.alphabet) &&
        transitions.equals(other.transitions) &&
        start.equals(other.start) &&
        accepting.equals(other.accepting);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, alphabet, transitions, start, accepting);
  }

  @Override
  public String toString() {
    return "Automaton(states = " + states +
      ", alphabet = " + alphabet +
      ", transitions = " + transitions().toList() +
      ", start = " + start +
      ", accepting = " + accepting + ")";
  }
}
