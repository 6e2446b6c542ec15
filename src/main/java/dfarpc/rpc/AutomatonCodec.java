package dfarpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dfarpc.AcceptanceChecker;
import dfarpc.AcceptanceChecker.CheckResult;
import dfarpc.Automaton;
import dfarpc.RawAutomaton;
import dfarpc.Transition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Converts automata and results between their JSON wire form and the core
 * types.
 *
 * On the way in, only the JSON types are checked here: a missing field comes
 * out as {@code null} and is left for {@link Automaton#validate} to reject.
 * Transitions are accepted in three shapes:
 *
 *   - a list of {@code {"from": .., "symbol": .., "to": ..}} objects
 *
 *   - a list of {@code [from, symbol, to]} triples
 *
 *   - a nested mapping {@code {from: {symbol: to}}}
 *
 * On the way out, automata always use the list of objects, with every
 * collection sorted.
 */
public final class AutomatonCodec {

  private final ObjectMapper mapper;

  public AutomatonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Decode an automaton description.
   *
   * @param node JSON object describing the automaton
   * @return unvalidated automaton description
   * @throws JsonRpcException if a field has the wrong JSON type
   */
  public RawAutomaton decodeAutomaton(JsonNode node) throws JsonRpcException {
    if (node == null || !node.isObject()) {
      throw JsonRpcException.invalidParams("automaton must be an object");
    }
    return new RawAutomaton(
      decodeStrings(node.get("states"), "states"),
      decodeStrings(node.get("alphabet"), "alphabet"),
      decodeTransitions(node.get("transitions")),
      decodeString(node.get("start"), "start"),
      decodeStrings(node.get("accepting"), "accepting")
    );
  }

  /**
   * Decode input for a check.
   *
   * A string is split into one symbol per code point. An array of strings is
   * taken as the symbols themselves.
   *
   * @param node JSON string or array of strings
   * @return input symbols
   * @throws JsonRpcException if the input is neither
   */
  public List<String> decodeInput(JsonNode node) throws JsonRpcException {
    if (node != null && node.isTextual()) {
      return AcceptanceChecker.symbols(node.textValue());
    } else if (node != null && node.isArray()) {
      final List<String> symbols = decodeStrings(node, "input");
      if (symbols.contains(null)) {
        throw JsonRpcException.invalidParams("input symbols must be strings");
      }
      return symbols;
    } else {
      throw JsonRpcException.invalidParams("input must be a string or an array of strings");
    }
  }

  public ObjectNode encodeAutomaton(Automaton automaton) {
    final ObjectNode node = mapper.createObjectNode();
    node.set("states", encodeStrings(automaton.states));
    node.set("alphabet", encodeStrings(automaton.alphabet));
    final ArrayNode transitions = node.putArray("transitions");
    automaton.transitions().forEach((Transition transition) ->
      transitions
        .addObject()
        .put("from", transition.from())
        .put("symbol", transition.symbol())
        .put("to", transition.to())
    );
    node.put("start", automaton.start);
    node.set("accepting", encodeStrings(automaton.accepting));
    return node;
  }

  /**
   * Encode the outcome of a check as {@code [accepted, trace]}.
   */
  public ArrayNode encodeCheckResult(CheckResult result) {
    final ArrayNode node = mapper.createArrayNode();
    node.add(result.accepted());
    node.add(encodeStrings(result.trace()));
    return node;
  }

  /**
   * Encode the outcome of a minimization as {@code [minimal, groups]}.
   */
  public ArrayNode encodeMinimizeResult(DfaRpc.MinimizeResult result) {
    final ArrayNode node = mapper.createArrayNode();
    node.add(encodeAutomaton(result.minimal()));
    final ObjectNode groups = node.addObject();
    for (Map.Entry<String, SortedSet<String>> group : result.groups().entrySet()) {
      groups.set(group.getKey(), encodeStrings(group.getValue()));
    }
    return node;
  }

  private ArrayNode encodeStrings(Collection<String> strings) {
    final ArrayNode node = mapper.createArrayNode();
    strings.forEach(node::add);
    return node;
  }

  private static String decodeString(JsonNode node, String field) throws JsonRpcException {
    if (node == null || node.isNull()) {
      return null;
    } else if (!node.isTextual()) {
      throw JsonRpcException.invalidParams(field + " must be a string");
    }
    return node.textValue();
  }

  private static List<String> decodeStrings(JsonNode node, String field) throws JsonRpcException {
    if (node == null || node.isNull()) {
      return null;
    } else if (!node.isArray()) {
      throw JsonRpcException.invalidParams(field + " must be an array of strings");
    }
    final var output = new ArrayList<String>(node.size());
    for (JsonNode element : node) {
      output.add(decodeString(element, field + " element"));
    }
    return output;
  }

  private static List<Transition> decodeTransitions(JsonNode node) throws JsonRpcException {
    if (node == null || node.isNull()) {
      return null;
    }

    final var output = new ArrayList<Transition>();
    if (node.isArray()) {
      for (JsonNode element : node) {
        output.add(decodeTransition(element));
      }
    } else if (node.isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> sources = node.fields();
      while (sources.hasNext()) {
        final var source = sources.next();
        if (!source.getValue().isObject()) {
          throw JsonRpcException.invalidParams("transitions from " + source.getKey() + " must be an object");
        }
        final Iterator<Map.Entry<String, JsonNode>> outgoing = source.getValue().fields();
        while (outgoing.hasNext()) {
          final var entry = outgoing.next();
          final String to = decodeString(entry.getValue(), "transition target");
          output.add(new Transition(source.getKey(), entry.getKey(), to));
        }
      }
    } else {
      throw JsonRpcException.invalidParams("transitions must be an array or an object");
    }
    return output;
  }

  private static Transition decodeTransition(JsonNode node) throws JsonRpcException {
    if (node.isObject()) {
      return new Transition(
        decodeString(node.get("from"), "transition from"),
        decodeString(node.get("symbol"), "transition symbol"),
        decodeString(node.get("to"), "transition to")
      );
    } else if (node.isArray() && node.size() == 3) {
      return new Transition(
        decodeString(node.get(0), "transition from"),
        decodeString(node.get(1), "transition symbol"),
        decodeString(node.get(2), "transition to")
      );
    } else {
      throw JsonRpcException.invalidParams("transition must be an object or a [from, symbol, to] triple");
    }
  }
}
