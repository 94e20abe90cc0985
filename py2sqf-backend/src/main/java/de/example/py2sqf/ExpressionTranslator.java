package de.example.py2sqf;

import de.example.py2sqf.ast.PyNode;
import de.example.py2sqf.ast.PyNode.Attribute;
import de.example.py2sqf.ast.PyNode.BinOp;
import de.example.py2sqf.ast.PyNode.BoolOp;
import de.example.py2sqf.ast.PyNode.Call;
import de.example.py2sqf.ast.PyNode.Compare;
import de.example.py2sqf.ast.PyNode.Constant;
import de.example.py2sqf.ast.PyNode.FormattedValue;
import de.example.py2sqf.ast.PyNode.IfExp;
import de.example.py2sqf.ast.PyNode.JoinedStr;
import de.example.py2sqf.ast.PyNode.Name;
import de.example.py2sqf.ast.PyNode.Sequence;
import de.example.py2sqf.ast.PyNode.Slice;
import de.example.py2sqf.ast.PyNode.Subscript;
import de.example.py2sqf.ast.PyNode.UnaryOp;
import de.example.py2sqf.ast.PyOperator;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lowers Python expressions to SQF expression text.
 *
 * Throws {@link UnsupportedConstructException} for anything without an SQF form; the caller
 * decides what to drop.
 */
public final class ExpressionTranslator {

  /** SQF marks local variables with a leading underscore. */
  public static final String PRIVATE_PREFIX = "_";

  /** {@code GLOBAL.name} refers to the engine command or global variable {@code name}. */
  public static final String GLOBAL_MARKER = "GLOBAL";

  private final OperatorLexicon lexicon;

  public ExpressionTranslator(OperatorLexicon lexicon) {
    this.lexicon = lexicon;
  }

  public String toSqf(PyNode e) {
    if (e == null) throw new MalformedTreeException("Expression is missing");

    if (e instanceof Constant c) return constant(c.value());
    if (e instanceof PyNode.Ellipsis) return "";
    if (e instanceof JoinedStr js) return joinedStr(js);
    if (e instanceof FormattedValue fv) return formattedValue(fv);

    if (e instanceof Sequence s) {
      return "[" + joinArgs(s.elts()) + "]";
    }

    if (e instanceof Name n) return variable(n);
    if (e instanceof UnaryOp u) return unary(u);
    if (e instanceof BinOp b) return binary(b);
    if (e instanceof BoolOp b) return bool(b);
    if (e instanceof Compare c) return compare(c);

    if (e instanceof IfExp ie) {
      return "if (" + toSqf(ie.test()) + ") then {" + toSqf(ie.body()) + "} else {" + toSqf(ie.orelse()) + "};";
    }

    if (e instanceof Attribute a) return attribute(a);
    if (e instanceof Subscript s) return subscript(s);
    if (e instanceof Call c) return call(c);

    if (e instanceof PyNode.Dict) throw new UnsupportedConstructException("dict", "dict is not supported");
    if (e instanceof PyNode.Starred) {
      throw new UnsupportedConstructException("unpacking", "starred expression is not supported");
    }

    throw new UnsupportedConstructException("node", e.kind() + " is not supported");
  }

  // =========================================================
  // Literals
  // =========================================================
  private String constant(Object value) {
    if (value == null) return "nil";
    if (value instanceof String s) return quote(s);
    if (value instanceof Boolean b) return b ? "true" : "false";
    if (value instanceof Number n) return n.toString();
    throw new UnsupportedConstructException("constant", value + " is not supported");
  }

  private String joinedStr(JoinedStr js) {
    // no placeholders: just a string
    if (js.values().stream().allMatch(v -> v instanceof Constant)) {
      return quote(js.values().stream().map(this::literalText).collect(Collectors.joining()));
    }

    StringBuilder template = new StringBuilder();
    List<String> args = new ArrayList<>();
    for (PyNode v : js.values()) {
      if (v instanceof Constant) {
        template.append(literalText(v));
      } else {
        args.add(toSqf(v));
        template.append('%').append(args.size());
      }
    }
    return "format [" + quote(template.toString()) + ", " + String.join(", ", args) + "]";
  }

  private String literalText(PyNode segment) {
    Object value = ((Constant) segment).value();
    if (!(value instanceof String s)) {
      throw new MalformedTreeException("f-string segment is not a string: " + value);
    }
    return s;
  }

  private String formattedValue(FormattedValue fv) {
    if (fv.conversion() != FormattedValue.NO_CONVERSION || fv.formatSpec() != null) {
      throw new UnsupportedConstructException("format string", "value format is not supported");
    }
    return toSqf(fv.value());
  }

  private static String quote(String s) {
    return "\"" + s + "\"";
  }

  // =========================================================
  // Names and operators
  // =========================================================
  private String variable(Name n) {
    return PRIVATE_PREFIX + required(n.id(), "Name.id");
  }

  private String unary(UnaryOp u) {
    if (u.op() != PyOperator.NOT) {
      throw new UnsupportedConstructException("unary operator", nodeName(u.op()) + " is not supported");
    }
    return token(u.op()) + toSqf(required(u.operand(), "UnaryOp.operand"));
  }

  private String binary(BinOp b) {
    if (!lexicon.isArithmetic(b.op())) {
      throw new UnsupportedConstructException("binary operator", nodeName(b.op()) + " is not supported");
    }
    // nested arithmetic is always grouped
    return grouped(required(b.left(), "BinOp.left")) + " " + token(b.op()) + " " + grouped(required(b.right(), "BinOp.right"));
  }

  private String grouped(PyNode operand) {
    String s = toSqf(operand);
    return operand instanceof BinOp ? "(" + s + ")" : s;
  }

  private String bool(BoolOp b) {
    if (!lexicon.isBoolean(b.op())) throw new MalformedTreeException("BoolOp with operator " + b.op());
    if (b.values().size() < 2) throw new MalformedTreeException("BoolOp needs at least two operands");

    return b.values().stream().map(this::toSqf).collect(Collectors.joining(" " + token(b.op()) + " "));
  }

  private String compare(Compare c) {
    if (c.ops().isEmpty() || c.ops().size() != c.comparators().size()) {
      throw new MalformedTreeException("Compare with " + c.ops().size() + " operators and "
          + c.comparators().size() + " comparators");
    }
    if (c.comparators().size() != 1) {
      throw new UnsupportedConstructException("compare", "multiple compare is not supported");
    }
    PyOperator op = c.ops().get(0);
    if (!lexicon.isComparison(op)) {
      throw new UnsupportedConstructException("compare", nodeName(op) + " is not supported");
    }
    return toSqf(required(c.left(), "Compare.left")) + " " + token(op) + " " + toSqf(c.comparators().get(0));
  }

  // =========================================================
  // Access and calls
  // =========================================================
  private String attribute(Attribute a) {
    String attr = required(a.attr(), "Attribute.attr");
    if (isGlobalMarker(a.value())) return attr;
    return toSqf(a.value()) + " " + attr;
  }

  private static boolean isGlobalMarker(PyNode receiver) {
    return receiver instanceof Name n && GLOBAL_MARKER.equals(n.id());
  }

  private String subscript(Subscript s) {
    PyNode slice = required(s.slice(), "Subscript.slice");

    Optional<BigInteger> index = integerConstant(slice);
    if (index.isPresent()) {
      return toSqf(s.value()) + " select " + index.get();
    }

    if (slice instanceof Slice sl) {
      if (sl.step() != null) {
        throw new UnsupportedConstructException("subscript", "slice with step is not supported");
      }
      if (sl.lower() == null || sl.upper() == null) {
        throw new UnsupportedConstructException("subscript", "slice without lower or upper is not supported");
      }
      BigInteger lower = integerConstant(sl.lower()).orElseThrow(() ->
          new UnsupportedConstructException("subscript", "slice with non-constant bounds is not supported"));
      BigInteger upper = integerConstant(sl.upper()).orElseThrow(() ->
          new UnsupportedConstructException("subscript", "slice with non-constant bounds is not supported"));
      // SQF takes [start, count]
      return toSqf(s.value()) + " select [" + lower + ", " + upper.subtract(lower) + "]";
    }

    throw new UnsupportedConstructException("subscript", "only constant index or constant slice is supported");
  }

  private String call(Call c) {
    if (!c.keywords().isEmpty()) {
      throw new UnsupportedConstructException("function call", "keyword argument is not supported");
    }
    if (c.args().stream().anyMatch(a -> a instanceof PyNode.Starred)) {
      throw new UnsupportedConstructException("function call", "unpacking operator is not supported");
    }

    PyNode func = required(c.func(), "Call.func");
    boolean single = c.args().size() == 1;

    if (func instanceof Name n) {
      String callee = required(n.id(), "Name.id");
      if (single) return toSqf(c.args().get(0)) + " call " + callee;
      return "[" + joinArgs(c.args()) + "] call " + callee;
    }

    if (func instanceof Attribute) {
      String command = toSqf(func);
      if (single) return command + " " + toSqf(c.args().get(0));
      return command + " [" + joinArgs(c.args()) + "]";
    }

    throw new UnsupportedConstructException("function call", func.kind() + " callee is not supported");
  }

  // =========================================================
  // Helpers
  // =========================================================
  private String joinArgs(List<PyNode> nodes) {
    return nodes.stream().map(this::toSqf).collect(Collectors.joining(", "));
  }

  private String token(PyOperator op) {
    return lexicon.toSqf(op).orElseThrow(() ->
        new UnsupportedConstructException("operator", nodeName(op) + " is not supported"));
  }

  private static String nodeName(PyOperator op) {
    return op == null ? "?" : op.nodeName();
  }

  /** Value of an integer literal; booleans do not count. */
  static Optional<BigInteger> integerConstant(PyNode node) {
    if (!(node instanceof Constant c)) return Optional.empty();
    Object v = c.value();
    if (v instanceof BigInteger b) return Optional.of(b);
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return Optional.of(BigInteger.valueOf(((Number) v).longValue()));
    }
    return Optional.empty();
  }

  static <T> T required(T value, String what) {
    if (value == null) throw new MalformedTreeException(what + " is missing");
    return value;
  }
}
