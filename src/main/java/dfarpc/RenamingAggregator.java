package dfarpc;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns an old-name to new-name renaming around.
 */
public final class RenamingAggregator {

  private RenamingAggregator() { }

  /**
   * Group old names by the new name they were renamed to.
   *
   * If {@code q0}, {@code q1} and {@code q2} were merged into {@code q0}, the
   * output maps {@code q0} to {@code {q0, q1, q2}}. Every old name ends up in
   * exactly one group and no group is empty.
   *
   * @param renaming mapping from old names to new names
   * @return mapping from new names to the old names merged into them
   */
  public static SortedMap<String, SortedSet<String>> groupByNewName(Map<String, String> renaming) {
    final var groups = new TreeMap<String, SortedSet<String>>();
    for (final var entry : renaming.entrySet()) {
      final String oldName = entry.getKey();
      final String newName = entry.getValue();

      // Create the group on first encounter of a new name
      SortedSet<String> group = groups.get(newName);
      if (group == null) {
        group = new TreeSet<>();
        groups.put(newName, group);
      }
      group.add(oldName);
    }

    groups.replaceAll((newName, group) -> Collections.unmodifiableSortedSet(group));
    return Collections.unmodifiableSortedMap(groups);
  }
}
