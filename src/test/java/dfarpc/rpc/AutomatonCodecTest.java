package dfarpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dfarpc.AcceptanceChecker.CheckResult;
import dfarpc.Automaton;
import dfarpc.MalformedAutomatonException;
import dfarpc.RawAutomaton;
import dfarpc.Transition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public class AutomatonCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final AutomatonCodec codec = new AutomatonCodec(mapper);

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text.replace('\'', '"'));
  }

  @Test
  void decodeTransitionObjects() throws Exception {
    final RawAutomaton raw = codec.decodeAutomaton(json(
      "{'states': ['q0', 'q1'], 'alphabet': ['a'], " +
      "'transitions': [{'from': 'q0', 'symbol': 'a', 'to': 'q1'}, {'from': 'q1', 'symbol': 'a', 'to': 'q0'}], " +
      "'start': 'q0', 'accepting': ['q1']}"
    ));

    Assertions.assertEquals(List.of("q0", "q1"), raw.states());
    Assertions.assertEquals(List.of("a"), raw.alphabet());
    Assertions.assertEquals(List.of(Transition.of("q0", "a", "q1"), Transition.of("q1", "a", "q0")), raw.transitions());
    Assertions.assertEquals("q0", raw.start());
    Assertions.assertEquals(List.of("q1"), raw.accepting());
  }

  @Test
  void transitionShapesAreEquivalent() throws Exception {
    final String rest = "'states': ['q0', 'q1'], 'alphabet': ['a', 'b'], 'start': 'q0', 'accepting': ['q1']";
    final RawAutomaton objects = codec.decodeAutomaton(json(
      "{" + rest + ", 'transitions': [{'from': 'q0', 'symbol': 'a', 'to': 'q1'}, {'from': 'q0', 'symbol': 'b', 'to': 'q0'}]}"
    ));
    final RawAutomaton triples = codec.decodeAutomaton(json(
      "{" + rest + ", 'transitions': [['q0', 'a', 'q1'], ['q0', 'b', 'q0']]}"
    ));
    final RawAutomaton nested = codec.decodeAutomaton(json(
      "{" + rest + ", 'transitions': {'q0': {'a': 'q1', 'b': 'q0'}}}"
    ));

    Assertions.assertEquals(objects, triples);
    Assertions.assertEquals(objects, nested);
  }

  @Test
  void missingFieldsAreLeftForValidation() throws Exception {
    final RawAutomaton raw = codec.decodeAutomaton(json("{'states': ['q0'], 'alphabet': ['a'], 'transitions': []}"));
    Assertions.assertNull(raw.start());
    Assertions.assertNull(raw.accepting());

    final var err = Assertions.assertThrows(MalformedAutomatonException.class, () -> Automaton.validate(raw));
    Assertions.assertEquals(MalformedAutomatonException.Kind.MISSING_FIELD, err.kind);
  }

  @Test
  void wrongJsonTypes() {
    final var notObject = Assertions.assertThrows(JsonRpcException.class, () -> codec.decodeAutomaton(json("[1, 2]")));
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, notObject.code);

    final var numericStart = Assertions.assertThrows(
      JsonRpcException.class,
      () -> codec.decodeAutomaton(json("{'states': ['q0'], 'alphabet': ['a'], 'transitions': [], 'start': 0, 'accepting': []}"))
    );
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, numericStart.code);

    final var shortTriple = Assertions.assertThrows(
      JsonRpcException.class,
      () -> codec.decodeAutomaton(json("{'states': ['q0'], 'alphabet': ['a'], 'transitions': [['q0', 'a']], 'start': 'q0', 'accepting': []}"))
    );
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, shortTriple.code);

    final var stringTransitions = Assertions.assertThrows(
      JsonRpcException.class,
      () -> codec.decodeAutomaton(json("{'states': ['q0'], 'alphabet': ['a'], 'transitions': 'none', 'start': 'q0', 'accepting': []}"))
    );
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, stringTransitions.code);
  }

  @Test
  void decodeInput() throws Exception {
    Assertions.assertEquals(List.of("a", "b", "a"), codec.decodeInput(json("'aba'")));
    Assertions.assertEquals(List.of("coin", "push"), codec.decodeInput(json("['coin', 'push']")));
    Assertions.assertEquals(List.of(), codec.decodeInput(json("''")));

    final var number = Assertions.assertThrows(JsonRpcException.class, () -> codec.decodeInput(json("12")));
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, number.code);
    final var nullSymbol = Assertions.assertThrows(JsonRpcException.class, () -> codec.decodeInput(json("['a', null]")));
    Assertions.assertEquals(JsonRpcException.INVALID_PARAMS, nullSymbol.code);
  }

  @Test
  void encodeAutomaton() throws Exception {
    final Automaton automaton = Automaton.validate(
      RawAutomaton
        .builder()
        .states("q1", "q0")
        .alphabet("b", "a")
        .transition("q1", "a", "q0")
        .transition("q0", "b", "q1")
        .transition("q0", "a", "q1")
        .start("q0")
        .accepting("q1")
        .build()
    );

    Assertions.assertEquals(
      json(
        "{'states': ['q0', 'q1'], 'alphabet': ['a', 'b'], 'transitions': [" +
        "{'from': 'q0', 'symbol': 'a', 'to': 'q1'}, " +
        "{'from': 'q0', 'symbol': 'b', 'to': 'q1'}, " +
        "{'from': 'q1', 'symbol': 'a', 'to': 'q0'}], " +
        "'start': 'q0', 'accepting': ['q1']}"
      ),
      codec.encodeAutomaton(automaton)
    );
  }

  @Test
  void encodedAutomatonDecodesToSameAutomaton() throws Exception {
    final Automaton automaton = Automaton.validate(
      RawAutomaton
        .builder()
        .states("q0", "q1", "q2")
        .alphabet("a", "b")
        .transition("q0", "a", "q1")
        .transition("q1", "b", "q2")
        .start("q0")
        .accepting("q2")
        .build()
    );
    Assertions.assertEquals(automaton, Automaton.validate(codec.decodeAutomaton(codec.encodeAutomaton(automaton))));
  }

  @Test
  void encodeResults() throws Exception {
    Assertions.assertEquals(
      json("[false, ['q0', 'q1']]"),
      codec.encodeCheckResult(new CheckResult(false, List.of("q0", "q1")))
    );

    final Automaton minimal = Automaton.validate(
      RawAutomaton.builder().states("q0").alphabet("a").transition("q0", "a", "q0").start("q0").accepting("q0").build()
    );
    final SortedMap<String, SortedSet<String>> groups = new TreeMap<>();
    groups.put("q0", new TreeSet<>(List.of("q1", "q0")));
    Assertions.assertEquals(
      json(
        "[{'states': ['q0'], 'alphabet': ['a'], 'transitions': [{'from': 'q0', 'symbol': 'a', 'to': 'q0'}], " +
        "'start': 'q0', 'accepting': ['q0']}, {'q0': ['q0', 'q1']}]"
      ),
      codec.encodeMinimizeResult(new DfaRpc.MinimizeResult(minimal, groups))
    );
  }
}
