package dfarpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Failure reported back to a JSON-RPC caller as an error object.
 */
public class JsonRpcException extends Exception {

  @java.io.Serial
  private static final long serialVersionUID = -4410761337309452514L;

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;

  /**
   * JSON-RPC error code.
   */
  public final int code;

  /**
   * Extra structured information for the caller (may be {@code null}).
   */
  public final transient JsonNode data;

  public JsonRpcException(int code, String message, JsonNode data) {
    super(message);
    this.code = code;
    this.data = data;
  }

  public JsonRpcException(int code, String message) {
    this(code, message, null);
  }

  public static JsonRpcException parseError(String detail) {
    return new JsonRpcException(PARSE_ERROR, "Parse error: " + detail);
  }

  public static JsonRpcException invalidRequest(String detail) {
    return new JsonRpcException(INVALID_REQUEST, "Invalid request: " + detail);
  }

  public static JsonRpcException methodNotFound(String method) {
    return new JsonRpcException(METHOD_NOT_FOUND, "Method not found: " + method);
  }

  public static JsonRpcException invalidParams(String detail) {
    return new JsonRpcException(INVALID_PARAMS, "Invalid params: " + detail);
  }

  public static JsonRpcException internalError() {
    return new JsonRpcException(INTERNAL_ERROR, "Internal error");
  }
}
