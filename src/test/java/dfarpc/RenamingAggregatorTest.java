package dfarpc;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RenamingAggregatorTest {

  @Test
  void groupsOldNamesUnderNewNames() {
    final var renaming = Map.of(
      "q0", "q0",
      "q1", "q0",
      "q2", "q0",
      "q3", "q3",
      "q4", "q4",
      "q5", "q4"
    );
    Assertions.assertEquals(
      Map.of(
        "q0", Set.of("q0", "q1", "q2"),
        "q3", Set.of("q3"),
        "q4", Set.of("q4", "q5")
      ),
      RenamingAggregator.groupByNewName(renaming)
    );
  }

  @Test
  void emptyRenaming() {
    Assertions.assertTrue(RenamingAggregator.groupByNewName(Map.of()).isEmpty());
  }

  @Test
  void groupsAreSorted() {
    final var renaming = new HashMap<String, String>();
    renaming.put("z", "b");
    renaming.put("b", "b");
    renaming.put("m", "b");
    renaming.put("a", "a");

    final var groups = RenamingAggregator.groupByNewName(renaming);
    Assertions.assertEquals(List.of("a", "b"), List.copyOf(groups.keySet()));
    Assertions.assertEquals(List.of("b", "m", "z"), List.copyOf(groups.get("b")));
  }

  @Test
  void groupsAreNotModifiable() {
    final var groups = RenamingAggregator.groupByNewName(Map.of("q1", "q0", "q0", "q0"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> groups.get("q0").add("q9"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> groups.remove("q0"));
  }
}
