package dfarpc.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dfarpc.MalformedAutomatonException;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches JSON-RPC 2.0 requests to a {@link DfaRpc}.
 *
 * Supports single requests, batches and notifications. Parameters may be
 * positional ({@code [dfa, input]}) or named ({@code {"dfa": .., "input": ..}}).
 */
public class JsonRpcHandler {

  private static final Logger LOG = LoggerFactory.getLogger(JsonRpcHandler.class);

  private static final String VERSION = "2.0";

  private final DfaRpc rpc;
  private final ObjectMapper mapper;
  private final ObjectReader reader;
  private final AutomatonCodec codec;

  public JsonRpcHandler(DfaRpc rpc, ObjectMapper mapper) {
    this.rpc = rpc;
    this.mapper = mapper;
    this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.codec = new AutomatonCodec(mapper);
  }

  /**
   * Handle a request body.
   *
   * @param body raw JSON text of a request or a batch of requests
   * @return response text, or nothing if every request was a notification
   */
  public Optional<String> handle(String body) {
    final JsonNode request;
    try {
      request = reader.readTree(body);
    } catch (JsonProcessingException err) {
      LOG.debug("Unparseable request body: {}", err.getOriginalMessage());
      return Optional.of(write(errorResponse(NullNode.getInstance(), JsonRpcException.parseError(err.getOriginalMessage()))));
    }

    if (request == null || request.isMissingNode()) {
      return Optional.of(write(errorResponse(NullNode.getInstance(), JsonRpcException.parseError("empty body"))));
    }

    if (request.isArray()) {
      if (request.size() == 0) {
        return Optional.of(write(errorResponse(NullNode.getInstance(), JsonRpcException.invalidRequest("empty batch"))));
      }
      final ArrayNode responses = mapper.createArrayNode();
      for (JsonNode single : request) {
        handleRequest(single).ifPresent(responses::add);
      }
      return responses.isEmpty() ? Optional.empty() : Optional.of(write(responses));
    } else {
      return handleRequest(request).map(this::write);
    }
  }

  /**
   * Handle one request object.
   *
   * @param request parsed request
   * @return response object, or nothing for a notification
   */
  Optional<ObjectNode> handleRequest(JsonNode request) {
    if (!request.isObject()) {
      return Optional.of(errorResponse(NullNode.getInstance(), JsonRpcException.invalidRequest("request must be an object")));
    }

    // Requests without an id are notifications and never get an answer
    final JsonNode id = request.get("id");
    final boolean notification = id == null;
    if (!notification && !(id.isTextual() || id.isNumber() || id.isNull())) {
      return Optional.of(errorResponse(NullNode.getInstance(), JsonRpcException.invalidRequest("id must be a string, a number or null")));
    }
    final JsonNode responseId = notification ? NullNode.getInstance() : id;

    try {
      final JsonNode version = request.get("jsonrpc");
      if (version == null || !version.isTextual() || !VERSION.equals(version.textValue())) {
        throw JsonRpcException.invalidRequest("jsonrpc must be \"2.0\"");
      }
      final JsonNode method = request.get("method");
      if (method == null || !method.isTextual()) {
        throw JsonRpcException.invalidRequest("method must be a string");
      }
      final JsonNode params = request.get("params");
      if (params != null && !params.isArray() && !params.isObject()) {
        throw JsonRpcException.invalidRequest("params must be an array or an object");
      }

      final JsonNode result = dispatch(method.textValue(), params);
      return notification ? Optional.empty() : Optional.of(resultResponse(responseId, result));
    } catch (JsonRpcException err) {
      LOG.debug("Request {} failed with {}: {}", responseId, err.code, err.getMessage());
      return notification ? Optional.empty() : Optional.of(errorResponse(responseId, err));
    } catch (RuntimeException err) {
      LOG.error("Unexpected failure handling request {}", responseId, err);
      return notification ? Optional.empty() : Optional.of(errorResponse(responseId, JsonRpcException.internalError()));
    }
  }

  private JsonNode dispatch(String method, JsonNode params) throws JsonRpcException {
    try {
      switch (method) {
        case "check":
          return codec.encodeCheckResult(
            rpc.check(
              codec.decodeAutomaton(param(params, 0, "dfa")),
              codec.decodeInput(param(params, 1, "input"))
            )
          );

        case "minimize":
          return codec.encodeMinimizeResult(
            rpc.minimize(codec.decodeAutomaton(param(params, 0, "dfa")))
          );

        default:
          throw JsonRpcException.methodNotFound(method);
      }
    } catch (MalformedAutomatonException err) {
      final ObjectNode data = mapper.createObjectNode()
        .put("kind", err.kind.name())
        .put("detail", err.detail);
      throw new JsonRpcException(JsonRpcException.INVALID_PARAMS, "Malformed automaton: " + err.getMessage(), data);
    }
  }

  /**
   * Look up a parameter by position or by name.
   */
  private static JsonNode param(JsonNode params, int index, String name) throws JsonRpcException {
    final JsonNode value;
    if (params == null) {
      value = null;
    } else if (params.isArray()) {
      value = params.get(index);
    } else {
      value = params.get(name);
    }
    if (value == null) {
      throw JsonRpcException.invalidParams("missing parameter " + name);
    }
    return value;
  }

  private ObjectNode resultResponse(JsonNode id, JsonNode result) {
    final ObjectNode response = mapper.createObjectNode();
    response.put("jsonrpc", VERSION);
    response.set("result", result);
    response.set("id", id);
    return response;
  }

  private ObjectNode errorResponse(JsonNode id, JsonRpcException err) {
    final ObjectNode error = mapper.createObjectNode();
    error.put("code", err.code);
    error.put("message", err.getMessage());
    if (err.data != null) {
      error.set("data", err.data);
    }

    final ObjectNode response = mapper.createObjectNode();
    response.put("jsonrpc", VERSION);
    response.set("error", error);
    response.set("id", id);
    return response;
  }

  private String write(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException err) {
      throw new IllegalStateException("Failed to serialize a JSON tree", err);
    }
  }
}
