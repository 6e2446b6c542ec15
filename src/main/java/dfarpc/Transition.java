package dfarpc;

import java.util.Comparator;

/**
 * Single transition of an automaton.
 *
 * @param from state the transition leaves
 * @param symbol alphabet symbol consumed by the transition
 * @param to state the transition enters
 */
public record Transition(
  String from,
  String symbol,
  String to
) implements Comparable<Transition> {

  private static final Comparator<Transition> ORDER = Comparator
    .comparing(Transition::from)
    .thenComparing(Transition::symbol)
    .thenComparing(Transition::to);

  public static Transition of(String from, String symbol, String to) {
    return new Transition(from, symbol, to);
  }

  @Override
  public int compareTo(Transition other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + from + ", " + symbol + ") -> " + to;
  }
}
