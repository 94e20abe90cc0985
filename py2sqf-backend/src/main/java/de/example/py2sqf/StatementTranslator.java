package de.example.py2sqf;

import de.example.py2sqf.ast.PyNode;
import de.example.py2sqf.ast.PyNode.AnnAssign;
import de.example.py2sqf.ast.PyNode.Assign;
import de.example.py2sqf.ast.PyNode.AugAssign;
import de.example.py2sqf.ast.PyNode.BinOp;
import de.example.py2sqf.ast.PyNode.Call;
import de.example.py2sqf.ast.PyNode.Delete;
import de.example.py2sqf.ast.PyNode.Expr;
import de.example.py2sqf.ast.PyNode.For;
import de.example.py2sqf.ast.PyNode.FunctionDef;
import de.example.py2sqf.ast.PyNode.If;
import de.example.py2sqf.ast.PyNode.Name;
import de.example.py2sqf.ast.PyNode.Return;
import de.example.py2sqf.ast.PyNode.Subscript;
import de.example.py2sqf.ast.PyNode.While;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static de.example.py2sqf.ExpressionTranslator.PRIVATE_PREFIX;
import static de.example.py2sqf.ExpressionTranslator.required;

/**
 * Lowers Python statements to flat SQF: every statement ends with {@code ;} and every block is
 * wrapped in braces. A statement containing anything untranslatable is dropped as a whole and
 * reported on the context.
 */
public final class StatementTranslator {

  /** Loop variable SQF binds inside a {@code forEach} block. */
  static final String FOREACH_CURSOR = "x";

  /** Calls to this function in a {@code for} header become counted loops. */
  static final String RANGE_FUNCTION = "range";

  private final ExpressionTranslator expr;
  private final FunctionSignatureBuilder signatures;

  public StatementTranslator(ExpressionTranslator expr, FunctionSignatureBuilder signatures) {
    this.expr = expr;
    this.signatures = signatures;
  }

  String translateBlock(List<PyNode> statements, TranslationContext ctx) {
    StringBuilder sb = new StringBuilder();
    for (PyNode s : statements) {
      sb.append(translate(s, ctx));
    }
    return sb.toString();
  }

  String translate(PyNode s, TranslationContext ctx) {
    try {
      return lower(s, ctx);
    } catch (UnsupportedConstructException e) {
      ctx.report(e);
      return "";
    }
  }

  private String lower(PyNode s, TranslationContext ctx) {
    if (s == null) throw new MalformedTreeException("Statement is missing");

    if (s instanceof Expr e) return expr.toSqf(required(e.value(), "Expr.value")) + ";";
    if (s instanceof PyNode.Pass) return "";

    if (s instanceof Assign a) {
      if (a.targets().isEmpty()) throw new MalformedTreeException("Assign without targets");
      return assign(a.targets(), a.value());
    }
    if (s instanceof AnnAssign a) return assign(List.of(required(a.target(), "AnnAssign.target")), a.value());
    if (s instanceof AugAssign a) return augAssign(a);
    if (s instanceof Delete d) return delete(d);

    if (s instanceof If i) return ifStmt(i, ctx);
    if (s instanceof While w) return whileStmt(w, ctx);
    if (s instanceof For f) return forStmt(f, ctx);
    if (s instanceof PyNode.Break) return "break;";
    if (s instanceof PyNode.Continue) return "continue;";

    if (s instanceof FunctionDef f) return functionDef(f, ctx);
    if (s instanceof Return r) {
      // the last value of an SQF code block is its result
      return r.value() == null ? "" : expr.toSqf(r.value());
    }

    throw new UnsupportedConstructException("node", s.kind() + " is not supported");
  }

  // =========================================================
  // Assignment
  // =========================================================
  private String assign(List<PyNode> targets, PyNode value) {
    if (value == null) {
      throw new UnsupportedConstructException("assign", "assign without right hand side is not supported");
    }

    String rhs = expr.toSqf(value);
    StringBuilder sb = new StringBuilder();
    for (PyNode lhs : targets) {
      if (lhs instanceof Name n) {
        sb.append(local(n)).append(" = ").append(rhs).append(";");
      } else if (lhs instanceof Subscript sub) {
        BigInteger index = ExpressionTranslator.integerConstant(sub.slice()).orElseThrow(() ->
            new UnsupportedConstructException("assign", "subscript target needs a constant index"));
        sb.append(expr.toSqf(sub.value())).append(" set [").append(index).append(", ").append(rhs).append("];");
      } else {
        throw new UnsupportedConstructException("assign", kindOf(lhs) + " target is not supported");
      }
    }
    return sb.toString();
  }

  private String augAssign(AugAssign a) {
    if (!(a.target() instanceof Name n)) {
      throw new UnsupportedConstructException("augmented assign", kindOf(a.target()) + " target is not supported");
    }
    // x op= v  ->  _x = _x op v
    return local(n) + " = " + expr.toSqf(new BinOp(n, a.op(), required(a.value(), "AugAssign.value"))) + ";";
  }

  private String delete(Delete d) {
    StringBuilder sb = new StringBuilder();
    for (PyNode target : d.targets()) {
      if (!(target instanceof Name n)) {
        throw new UnsupportedConstructException("delete", "deleting a non-name target is not supported");
      }
      sb.append(local(n)).append(" = nil;");
    }
    return sb.toString();
  }

  // =========================================================
  // Control flow
  // =========================================================
  private String ifStmt(If i, TranslationContext ctx) {
    String condition = expr.toSqf(i.test());
    String body = translateBlock(i.body(), ctx);
    if (i.orelse().isEmpty()) {
      return "if (" + condition + ") then {" + body + "};";
    }
    return "if (" + condition + ") then {" + body + "} else {" + translateBlock(i.orelse(), ctx) + "};";
  }

  private String whileStmt(While w, TranslationContext ctx) {
    if (!w.orelse().isEmpty()) {
      throw new UnsupportedConstructException("or-else", "else after while is not supported");
    }
    String condition = expr.toSqf(w.test());
    return "while {" + condition + "} do {" + translateBlock(w.body(), ctx) + "};";
  }

  private String forStmt(For f, TranslationContext ctx) {
    if (!f.orelse().isEmpty()) {
      throw new UnsupportedConstructException("or-else", "else after for is not supported");
    }
    PyNode iter = required(f.iter(), "For.iter");
    if (isRangeCall(iter)) return forRange(f, (Call) iter, ctx);
    return forEach(f, iter, ctx);
  }

  private static boolean isRangeCall(PyNode iter) {
    return iter instanceof Call c && c.func() instanceof Name n && RANGE_FUNCTION.equals(n.id());
  }

  private String forRange(For f, Call range, TranslationContext ctx) {
    if (!(f.target() instanceof Name n)) {
      throw new UnsupportedConstructException("variable", "for-range loop can only have one variable");
    }
    if (!range.keywords().isEmpty()) {
      throw new UnsupportedConstructException("range", "keyword argument is not supported");
    }

    List<BigInteger> args = new ArrayList<>();
    for (PyNode arg : range.args()) {
      Optional<BigInteger> value = ExpressionTranslator.integerConstant(arg);
      if (value.isEmpty()) {
        throw new UnsupportedConstructException("range", "arguments must be integer constants");
      }
      args.add(value.get());
    }

    BigInteger start = BigInteger.ZERO;
    BigInteger stop;
    BigInteger step = BigInteger.ONE;
    switch (args.size()) {
      case 1 -> stop = args.get(0);
      case 2 -> {
        start = args.get(0);
        stop = args.get(1);
      }
      case 3 -> {
        start = args.get(0);
        stop = args.get(1);
        step = args.get(2);
      }
      default -> throw new UnsupportedConstructException("range", args.size() + " arguments are not supported");
    }

    return "for \"" + local(n) + "\" from " + start + " to " + stop + " step " + step
        + " do {" + translateBlock(f.body(), ctx) + "};";
  }

  private String forEach(For f, PyNode iter, TranslationContext ctx) {
    if (!(f.target() instanceof Name n)) {
      throw new UnsupportedConstructException("target", "no-name target is not supported");
    }
    String items = expr.toSqf(iter);
    String rebind = FOREACH_CURSOR.equals(n.id())
        ? ""
        : "private " + local(n) + " = " + PRIVATE_PREFIX + FOREACH_CURSOR + ";";
    return "{" + rebind + translateBlock(f.body(), ctx) + "} forEach " + items + ";";
  }

  // =========================================================
  // Functions
  // =========================================================
  private String functionDef(FunctionDef f, TranslationContext ctx) {
    String name = required(f.name(), "FunctionDef.name");
    String params = signatures.buildParamsLine(f);
    return name + " = {" + params + translateBlock(f.body(), ctx) + "};";
  }

  // =========================================================
  // Helpers
  // =========================================================
  private static String local(Name n) {
    return PRIVATE_PREFIX + required(n.id(), "Name.id");
  }

  private static String kindOf(PyNode node) {
    return node == null ? "missing" : node.kind();
  }
}
