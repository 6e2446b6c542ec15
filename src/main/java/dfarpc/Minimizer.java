package dfarpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the minimal automaton recognizing the same language as a given
 * automaton.
 */
public final class Minimizer {

  private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

  /**
   * Block index standing in for a missing transition in a signature.
   */
  private static final int NO_TRANSITION = -1;

  private Minimizer() { }

  /**
   * Minimal automaton along with how states were renamed to get there.
   *
   * @param minimal new automaton, one state per equivalence class
   * @param renaming every reachable state of the original mapped to its new name
   */
  public record Minimization(Automaton minimal, SortedMap<String, String> renaming) { }

  /**
   * Minimize an automaton.
   *
   * States unreachable from the start are dropped entirely: they appear
   * neither in the minimal automaton nor in the renaming. Each equivalence
   * class of reachable states is named after its lexicographically smallest
   * member. The input automaton is left untouched.
   *
   * @param automaton automaton to minimize
   * @return minimal automaton and renaming
   */
  public static Minimization minimize(Automaton automaton) {
    final SortedSet<String> reachable = new TreeSet<>(automaton.allStates());
    final List<SortedSet<String>> partition = minimizedPartition(automaton, automaton.alphabet, reachable);

    // Mapping from every reachable state to the canonical state of its block
    final SortedMap<String, String> renaming = new TreeMap<>();
    for (final SortedSet<String> block : partition) {
      final var canonical = block.first();
      for (final var member : block) {
        renaming.put(member, canonical);
      }
    }

    final var states = new TreeSet<String>(renaming.values());
    final var accepting = reachable
      .stream()
      .filter(automaton.accepting::contains)
      .map(renaming::get)
      .collect(Collectors.toCollection(TreeSet::new));

    // Equivalent states have equivalent targets, so colliding puts agree
    final var transitions = new TreeMap<String, SortedMap<String, String>>();
    for (final var from : reachable) {
      for (final var entry : automaton.transitionsMap(from).entrySet()) {
        transitions
          .computeIfAbsent(renaming.get(from), k -> new TreeMap<>())
          .put(entry.getKey(), renaming.get(entry.getValue()));
      }
    }

    final var minimal = new Automaton(
      states,
      new TreeSet<>(automaton.alphabet),
      transitions,
      renaming.get(automaton.start),
      accepting
    );

    LOG.debug(
      "Minimized {} states ({} reachable) down to {}",
      automaton.states.size(),
      reachable.size(),
      states.size()
    );
    return new Minimization(minimal, Collections.unmodifiableSortedMap(renaming));
  }

  /**
   * Partition states into blocks of indistinguishable states.
   *
   * Starts from the accepting/non-accepting split and refines blocks by the
   * signature of their members until no block splits any more. The signature
   * of a state lists, for every symbol of the alphabet in sorted order, the
   * block containing the target of the transition on that symbol.
   *
   * Every round either ends the refinement or adds at least one block, so
   * there are at most as many rounds as states.
   *
   * @param dfa automaton whose states are being partitioned
   * @param alphabet symbols in the order in which they appear in signatures
   * @param states states to partition, closed under transitions
   * @return blocks ordered by their smallest member
   */
  static List<SortedSet<String>> minimizedPartition(
    Dfa<String, String> dfa,
    SortedSet<String> alphabet,
    SortedSet<String> states
  ) {

    // Set up initial partition
    final var acceptingBlock = new TreeSet<String>();
    final var rejectingBlock = new TreeSet<String>();
    for (final var state : states) {
      if (dfa.accepting().contains(state)) {
        acceptingBlock.add(state);
      } else {
        rejectingBlock.add(state);
      }
    }
    List<SortedSet<String>> partition = new ArrayList<>();
    partition.add(acceptingBlock);
    partition.add(rejectingBlock);
    partition.removeIf(SortedSet::isEmpty);

    int rounds = 0;
    while (true) {
      rounds++;

      // Mapping from states to the index of their block in the partition
      final var blockOf = new HashMap<String, Integer>();
      for (int i = 0; i < partition.size(); i++) {
        for (final var state : partition.get(i)) {
          blockOf.put(state, i);
        }
      }

      // Split every block by signature, keeping sub-blocks in order of first member
      final var refined = new ArrayList<SortedSet<String>>();
      for (final var block : partition) {
        final var bySignature = new LinkedHashMap<List<Integer>, SortedSet<String>>();
        for (final var state : block) {
          bySignature
            .computeIfAbsent(signature(dfa, alphabet, state, blockOf), k -> new TreeSet<>())
            .add(state);
        }
        refined.addAll(bySignature.values());
      }

      if (refined.size() == partition.size()) {
        break;
      }
      partition = refined;
    }

    partition.sort((block1, block2) -> block1.first().compareTo(block2.first()));
    LOG.trace("Partition refinement reached a fixpoint after {} rounds", rounds);
    return partition;
  }

  private static List<Integer> signature(
    Dfa<String, String> dfa,
    SortedSet<String> alphabet,
    String state,
    Map<String, Integer> blockOf
  ) {
    final Map<String, String> outgoing = dfa.transitionsMap(state);
    final var signature = new ArrayList<Integer>(alphabet.size());
    for (final var symbol : alphabet) {
      final String target = outgoing.get(symbol);
      signature.add(target == null ? NO_TRANSITION : blockOf.get(target));
    }
    return signature;
  }
}
