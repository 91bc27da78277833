package org.redlist.maps.compute;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node in a remote compute expression graph: either a constant or a function invocation whose arguments are other
 * expressions.
 * <p>
 * Expressions are immutable and serialize to the Earth Engine REST {@code Expression} format with a single root value:
 *
 * <pre>{@code
 * {"result": "0", "values": {"0": {"functionInvocationValue": {"functionName": "Image.load", "arguments": {...}}}}}
 * }</pre>
 */
public final class Expression {

  static final ObjectMapper MAPPER = new ObjectMapper();

  private final String functionName;
  private final Map<String, Expression> arguments;
  private final JsonNode constant;

  private Expression(String functionName, Map<String, Expression> arguments, JsonNode constant) {
    this.functionName = functionName;
    this.arguments = arguments;
    this.constant = constant;
  }

  /** Returns a constant expression, {@code value} is converted to JSON with Jackson. */
  public static Expression constant(Object value) {
    return new Expression(null, Map.of(), MAPPER.valueToTree(value));
  }

  /**
   * Returns an invocation of {@code functionName}. Arguments with a {@code null} value are omitted so the remote
   * default applies.
   */
  public static Expression invoke(String functionName, Map<String, ?> arguments) {
    Map<String, Expression> args = new LinkedHashMap<>();
    arguments.forEach((key, value) -> {
      if (value != null) {
        args.put(key, value instanceof Expression expression ? expression : constant(value));
      }
    });
    return new Expression(functionName, Map.copyOf(args), null);
  }

  /** Convenience for {@link #invoke(String, Map)} with alternating argument names and values. */
  public static Expression invoke(String functionName, Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected alternating names and values, got " + namesAndValues.length);
    }
    Map<String, Object> args = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      args.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return invoke(functionName, args);
  }

  /** Returns the invoked function name, or {@code null} for a constant. */
  public String functionName() {
    return functionName;
  }

  public boolean isConstant() {
    return constant != null;
  }

  /** Returns the argument named {@code name}, or {@code null} if absent. */
  public Expression argument(String name) {
    return arguments.get(name);
  }

  /** Returns the constant value of this expression, or {@code null} if it is an invocation. */
  public JsonNode constantValue() {
    return constant == null ? null : constant.deepCopy();
  }

  /** Returns this node in the {@code ValueNode} format. */
  public ObjectNode toValueNode() {
    ObjectNode node = MAPPER.createObjectNode();
    if (constant != null) {
      node.set("constantValue", constant.deepCopy());
    } else {
      ObjectNode invocation = node.putObject("functionInvocationValue");
      invocation.put("functionName", functionName);
      ObjectNode args = invocation.putObject("arguments");
      // sort for deterministic output
      arguments.keySet().stream().sorted().forEach(key -> args.set(key, arguments.get(key).toValueNode()));
    }
    return node;
  }

  /** Returns the full {@code Expression} document with this node as its result. */
  public ObjectNode toJson() {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("result", "0");
    root.putObject("values").set("0", toValueNode());
    return root;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Expression other && toValueNode().equals(other.toValueNode()));
  }

  @Override
  public int hashCode() {
    return Objects.hash(toValueNode());
  }

  @Override
  public String toString() {
    return toValueNode().toString();
  }
}
