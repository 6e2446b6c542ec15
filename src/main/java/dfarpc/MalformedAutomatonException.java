package dfarpc;

/**
 * Automaton description which breaks one of the structural rules checked in
 * {@link Automaton#validate}.
 */
public class MalformedAutomatonException extends Exception {

  @java.io.Serial
  private static final long serialVersionUID = 2906419573170840318L;

  /**
   * Which rule was broken.
   */
  public enum Kind {
    MISSING_FIELD("Missing field"),
    EMPTY_STATES("Empty set of states"),
    EMPTY_ALPHABET("Empty alphabet"),
    DUPLICATE_STATE("Duplicate state"),
    DUPLICATE_SYMBOL("Duplicate symbol"),
    INVALID_START("Start state is not a state"),
    INVALID_ACCEPTING("Accepting state is not a state"),
    UNKNOWN_TRANSITION_STATE("Transition references an unknown state"),
    UNKNOWN_TRANSITION_SYMBOL("Transition references an unknown symbol"),
    CONFLICTING_TRANSITION("Conflicting transitions");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  /**
   * Which rule was broken.
   */
  public final Kind kind;

  /**
   * The offending state, symbol, transition or field.
   */
  public final String detail;

  public MalformedAutomatonException(Kind kind, String detail) {
    super(kind.description + ": " + detail);
    this.kind = kind;
    this.detail = detail;
  }
}
