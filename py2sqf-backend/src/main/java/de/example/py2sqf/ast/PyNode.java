package de.example.py2sqf.ast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Python syntax tree as delivered by the external front end.
 *
 * One record per node kind; field names follow the Python {@code ast} module. Kinds outside
 * this set deserialize into {@link Unknown}, which keeps the original kind name. Nodes are
 * immutable and only ever read by the translator.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "_type",
    visible = true,
    defaultImpl = PyNode.Unknown.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = PyNode.Module.class, name = "Module"),
    @JsonSubTypes.Type(value = PyNode.Interactive.class, name = "Interactive"),
    @JsonSubTypes.Type(value = PyNode.Expression.class, name = "Expression"),
    @JsonSubTypes.Type(value = PyNode.FunctionType.class, name = "FunctionType"),

    @JsonSubTypes.Type(value = PyNode.Expr.class, name = "Expr"),
    @JsonSubTypes.Type(value = PyNode.Pass.class, name = "Pass"),
    @JsonSubTypes.Type(value = PyNode.Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = PyNode.AnnAssign.class, name = "AnnAssign"),
    @JsonSubTypes.Type(value = PyNode.AugAssign.class, name = "AugAssign"),
    @JsonSubTypes.Type(value = PyNode.Delete.class, name = "Delete"),
    @JsonSubTypes.Type(value = PyNode.If.class, name = "If"),
    @JsonSubTypes.Type(value = PyNode.While.class, name = "While"),
    @JsonSubTypes.Type(value = PyNode.For.class, name = "For"),
    @JsonSubTypes.Type(value = PyNode.Break.class, name = "Break"),
    @JsonSubTypes.Type(value = PyNode.Continue.class, name = "Continue"),
    @JsonSubTypes.Type(value = PyNode.FunctionDef.class, names = {"FunctionDef", "AsyncFunctionDef"}),
    @JsonSubTypes.Type(value = PyNode.Return.class, name = "Return"),

    @JsonSubTypes.Type(value = PyNode.Constant.class, name = "Constant"),
    @JsonSubTypes.Type(value = PyNode.Ellipsis.class, name = "Ellipsis"),
    @JsonSubTypes.Type(value = PyNode.JoinedStr.class, name = "JoinedStr"),
    @JsonSubTypes.Type(value = PyNode.FormattedValue.class, name = "FormattedValue"),
    @JsonSubTypes.Type(value = PyNode.Sequence.class, names = {"List", "Tuple"}),
    @JsonSubTypes.Type(value = PyNode.Name.class, name = "Name"),
    @JsonSubTypes.Type(value = PyNode.UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = PyNode.BinOp.class, name = "BinOp"),
    @JsonSubTypes.Type(value = PyNode.BoolOp.class, name = "BoolOp"),
    @JsonSubTypes.Type(value = PyNode.Compare.class, name = "Compare"),
    @JsonSubTypes.Type(value = PyNode.IfExp.class, name = "IfExp"),
    @JsonSubTypes.Type(value = PyNode.Attribute.class, name = "Attribute"),
    @JsonSubTypes.Type(value = PyNode.Subscript.class, name = "Subscript"),
    @JsonSubTypes.Type(value = PyNode.Slice.class, name = "Slice"),
    @JsonSubTypes.Type(value = PyNode.Call.class, name = "Call"),
    @JsonSubTypes.Type(value = PyNode.Starred.class, name = "Starred"),
    @JsonSubTypes.Type(value = PyNode.Keyword.class, name = "keyword"),
    @JsonSubTypes.Type(value = PyNode.Dict.class, name = "Dict"),

    @JsonSubTypes.Type(value = PyNode.Arguments.class, name = "arguments"),
    @JsonSubTypes.Type(value = PyNode.Arg.class, name = "arg")
})
public sealed interface PyNode {

  /** Node kind as named by the Python grammar. */
  default String kind() {
    return getClass().getSimpleName();
  }

  // =========================================================
  // Roots
  // =========================================================
  record Module(List<PyNode> body) implements PyNode {
    public Module {
      body = listOrEmpty(body);
    }
  }

  record Interactive(List<PyNode> body) implements PyNode {
    public Interactive {
      body = listOrEmpty(body);
    }
  }

  record Expression(PyNode body) implements PyNode {}

  record FunctionType() implements PyNode {}

  // =========================================================
  // Statements
  // =========================================================
  record Expr(PyNode value) implements PyNode {}

  record Pass() implements PyNode {}

  record Assign(List<PyNode> targets, PyNode value) implements PyNode {
    public Assign {
      targets = listOrEmpty(targets);
    }
  }

  record AnnAssign(PyNode target, PyNode annotation, PyNode value) implements PyNode {}

  record AugAssign(PyNode target, PyOperator op, PyNode value) implements PyNode {}

  record Delete(List<PyNode> targets) implements PyNode {
    public Delete {
      targets = listOrEmpty(targets);
    }
  }

  record If(PyNode test, List<PyNode> body, List<PyNode> orelse) implements PyNode {
    public If {
      body = listOrEmpty(body);
      orelse = listOrEmpty(orelse);
    }
  }

  record While(PyNode test, List<PyNode> body, List<PyNode> orelse) implements PyNode {
    public While {
      body = listOrEmpty(body);
      orelse = listOrEmpty(orelse);
    }
  }

  record For(PyNode target, PyNode iter, List<PyNode> body, List<PyNode> orelse) implements PyNode {
    public For {
      body = listOrEmpty(body);
      orelse = listOrEmpty(orelse);
    }
  }

  record Break() implements PyNode {}

  record Continue() implements PyNode {}

  record FunctionDef(
      String name,
      Arguments args,
      List<PyNode> body,
      @JsonProperty("decorator_list") List<PyNode> decoratorList) implements PyNode {
    public FunctionDef {
      body = listOrEmpty(body);
      decoratorList = listOrEmpty(decoratorList);
    }
  }

  record Return(PyNode value) implements PyNode {}

  // =========================================================
  // Expressions
  // =========================================================

  /** A literal; {@code value} is null, a Boolean, a Number, a String, or anything else the front end could not express. */
  record Constant(Object value) implements PyNode {}

  record Ellipsis() implements PyNode {}

  record JoinedStr(List<PyNode> values) implements PyNode {
    public JoinedStr {
      values = listOrEmpty(values);
    }
  }

  record FormattedValue(
      PyNode value,
      Integer conversion,
      @JsonProperty("format_spec") PyNode formatSpec) implements PyNode {
    public FormattedValue {
      if (conversion == null) conversion = NO_CONVERSION;
    }

    public static final int NO_CONVERSION = -1;
  }

  /** List and tuple displays; both become the same SQF array. */
  record Sequence(List<PyNode> elts) implements PyNode {
    public Sequence {
      elts = listOrEmpty(elts);
    }
  }

  record Name(String id) implements PyNode {}

  record UnaryOp(PyOperator op, PyNode operand) implements PyNode {}

  record BinOp(PyNode left, PyOperator op, PyNode right) implements PyNode {}

  record BoolOp(PyOperator op, List<PyNode> values) implements PyNode {
    public BoolOp {
      values = listOrEmpty(values);
    }
  }

  record Compare(PyNode left, List<PyOperator> ops, List<PyNode> comparators) implements PyNode {
    public Compare {
      ops = listOrEmpty(ops);
      comparators = listOrEmpty(comparators);
    }
  }

  record IfExp(PyNode test, PyNode body, PyNode orelse) implements PyNode {}

  record Attribute(PyNode value, String attr) implements PyNode {}

  record Subscript(PyNode value, PyNode slice) implements PyNode {}

  record Slice(PyNode lower, PyNode upper, PyNode step) implements PyNode {}

  record Call(PyNode func, List<PyNode> args, List<Keyword> keywords) implements PyNode {
    public Call {
      args = listOrEmpty(args);
      keywords = listOrEmpty(keywords);
    }
  }

  record Starred(PyNode value) implements PyNode {}

  record Keyword(String arg, PyNode value) implements PyNode {
    @Override
    public String kind() {
      return "keyword";
    }
  }

  record Dict(List<PyNode> keys, List<PyNode> values) implements PyNode {
    public Dict {
      keys = listOrEmpty(keys);
      values = listOrEmpty(values);
    }
  }

  // =========================================================
  // Function signature parts
  // =========================================================
  record Arguments(
      List<Arg> posonlyargs,
      List<Arg> args,
      Arg vararg,
      List<Arg> kwonlyargs,
      @JsonProperty("kw_defaults") List<PyNode> kwDefaults,
      Arg kwarg,
      List<PyNode> defaults) implements PyNode {
    public Arguments {
      posonlyargs = listOrEmpty(posonlyargs);
      args = listOrEmpty(args);
      kwonlyargs = listOrEmpty(kwonlyargs);
      kwDefaults = listOrEmpty(kwDefaults);
      defaults = listOrEmpty(defaults);
    }

    public static Arguments positional(String... names) {
      return new Arguments(List.of(), Arrays.stream(names).map(Arg::new).toList(),
          null, List.of(), List.of(), null, List.of());
    }

    @Override
    public String kind() {
      return "arguments";
    }
  }

  record Arg(String arg) implements PyNode {
    @Override
    public String kind() {
      return "arg";
    }
  }

  // =========================================================
  // Anything the translator has no record for
  // =========================================================
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unknown(@JsonProperty("_type") String type) implements PyNode {
    @Override
    public String kind() {
      return type == null ? "?" : type;
    }
  }

  private static <T> List<T> listOrEmpty(List<T> list) {
    // kw_defaults and dict keys may hold null entries, so no List.copyOf here
    return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
  }
}
