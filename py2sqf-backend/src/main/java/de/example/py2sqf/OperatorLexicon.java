package de.example.py2sqf;

import de.example.py2sqf.ast.PyOperator;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/** SQF spelling of the Python operators that have one. */
public final class OperatorLexicon {

  private static final Set<PyOperator> ARITHMETIC = EnumSet.of(
      PyOperator.ADD, PyOperator.SUB, PyOperator.MULT, PyOperator.DIV,
      PyOperator.FLOOR_DIV, PyOperator.MOD, PyOperator.POW);

  private static final Set<PyOperator> COMPARISON = EnumSet.of(
      PyOperator.EQ, PyOperator.NOT_EQ, PyOperator.LT, PyOperator.LT_E, PyOperator.GT, PyOperator.GT_E);

  public Optional<String> toSqf(PyOperator op) {
    if (op == null) return Optional.empty();
    return Optional.ofNullable(switch (op) {
      case ADD -> "+";
      case SUB -> "-";
      case MULT -> "*";
      // SQF has no integer division operator
      case DIV, FLOOR_DIV -> "/";
      case MOD -> "mod";
      case POW -> "^";
      case AND -> "&&";
      case OR -> "||";
      case NOT -> "!";
      case EQ -> "==";
      case NOT_EQ -> "!=";
      case LT -> "<";
      case LT_E -> "<=";
      case GT -> ">";
      case GT_E -> ">=";
      default -> null;
    });
  }

  public boolean isArithmetic(PyOperator op) {
    return op != null && ARITHMETIC.contains(op);
  }

  public boolean isComparison(PyOperator op) {
    return op != null && COMPARISON.contains(op);
  }

  public boolean isBoolean(PyOperator op) {
    return op == PyOperator.AND || op == PyOperator.OR;
  }
}
