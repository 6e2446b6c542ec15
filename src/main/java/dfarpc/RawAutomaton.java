package dfarpc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Caller-supplied description of an automaton, before any validation.
 *
 * Nothing about this description is trusted: lists may contain duplicates or
 * {@code null}, and fields may be missing. Use {@link Automaton#validate} to
 * turn it into an {@link Automaton}.
 *
 * @param states state names
 * @param alphabet input symbols
 * @param transitions transitions, in any order
 * @param start name of the starting state
 * @param accepting names of the accepting states
 */
public record RawAutomaton(
  List<String> states,
  List<String> alphabet,
  List<Transition> transitions,
  String start,
  List<String> accepting
) {

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Incrementally assembles a description. Mostly convenient for tests and
   * for decoders that see fields one at a time.
   */
  public static class Builder {
    private final List<String> states = new ArrayList<>();
    private final List<String> alphabet = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<String> accepting = new ArrayList<>();
    private String start;

    public Builder states(String... names) {
      states.addAll(Arrays.asList(names));
      return this;
    }

    public Builder alphabet(String... symbols) {
      alphabet.addAll(Arrays.asList(symbols));
      return this;
    }

    public Builder transition(String from, String symbol, String to) {
      transitions.add(new Transition(from, symbol, to));
      return this;
    }

    public Builder start(String name) {
      start = name;
      return this;
    }

    public Builder accepting(String... names) {
      accepting.addAll(Arrays.asList(names));
      return this;
    }

    public RawAutomaton build() {
      return new RawAutomaton(
        Collections.unmodifiableList(new ArrayList<>(states)),
        Collections.unmodifiableList(new ArrayList<>(alphabet)),
        Collections.unmodifiableList(new ArrayList<>(transitions)),
        start,
        Collections.unmodifiableList(new ArrayList<>(accepting))
      );
    }
  }
}
