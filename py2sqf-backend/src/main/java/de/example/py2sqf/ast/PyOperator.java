package de.example.py2sqf.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every operator node of the Python grammar, keyed by its node class name.
 * Operators arrive as nodes of their own ({@code {"_type": "Add"}}).
 */
public enum PyOperator {
  // arithmetic
  ADD("Add"),
  SUB("Sub"),
  MULT("Mult"),
  MAT_MULT("MatMult"),
  DIV("Div"),
  FLOOR_DIV("FloorDiv"),
  MOD("Mod"),
  POW("Pow"),
  L_SHIFT("LShift"),
  R_SHIFT("RShift"),
  BIT_OR("BitOr"),
  BIT_XOR("BitXor"),
  BIT_AND("BitAnd"),

  // boolean
  AND("And"),
  OR("Or"),

  // unary
  NOT("Not"),
  INVERT("Invert"),
  U_ADD("UAdd"),
  U_SUB("USub"),

  // comparison
  EQ("Eq"),
  NOT_EQ("NotEq"),
  LT("Lt"),
  LT_E("LtE"),
  GT("Gt"),
  GT_E("GtE"),
  IS("Is"),
  IS_NOT("IsNot"),
  IN("In"),
  NOT_IN("NotIn");

  private static final Map<String, PyOperator> BY_NODE_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(PyOperator::nodeName, Function.identity()));

  private final String nodeName;

  PyOperator(String nodeName) {
    this.nodeName = nodeName;
  }

  public String nodeName() {
    return nodeName;
  }

  public static PyOperator fromNodeName(String name) {
    PyOperator op = BY_NODE_NAME.get(name);
    if (op == null) throw new IllegalArgumentException("Unknown operator node: " + name);
    return op;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static PyOperator fromJson(JsonNode node) {
    if (node == null || node.isNull()) throw new IllegalArgumentException("Operator node is missing");
    // accept both {"_type": "Add"} and the bare name "Add"
    String name = node.isTextual() ? node.asText() : node.path("_type").asText(null);
    if (name == null) throw new IllegalArgumentException("Operator node without _type: " + node);
    return fromNodeName(name);
  }
}
