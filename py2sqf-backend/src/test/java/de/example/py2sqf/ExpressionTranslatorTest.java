package de.example.py2sqf;

import de.example.py2sqf.ast.PyNode.*;
import de.example.py2sqf.ast.PyOperator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static de.example.py2sqf.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionTranslatorTest {

  private final ExpressionTranslator expr = new ExpressionTranslator(new OperatorLexicon());

  // ========== LITERALS ==========

  @Test
  void literalsMapToSqfValues() {
    assertEquals("nil", expr.toSqf(none()));
    assertEquals("true", expr.toSqf(num(true)));
    assertEquals("false", expr.toSqf(num(false)));
    assertEquals("42", expr.toSqf(num(42)));
    assertEquals("9.8", expr.toSqf(num(new BigDecimal("9.8"))));
    assertEquals("\"hello\"", expr.toSqf(str("hello")));
    assertEquals("", expr.toSqf(new Ellipsis()));
  }

  @Test
  void nonScalarConstantIsUnsupported() {
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(num(Map.of("bytes", "AAE="))));
    assertEquals("constant", e.diagnostic().construct());
  }

  @Test
  void listAndTupleBecomeTheSameArray() {
    assertEquals("[1, _a, \"s\"]", expr.toSqf(new Sequence(List.of(num(1), name("a"), str("s")))));
    assertEquals("[]", expr.toSqf(new Sequence(List.of())));
  }

  // ========== F-STRINGS ==========

  @Test
  void fStringWithoutPlaceholdersIsAPlainString() {
    assertEquals("\"abc\"", expr.toSqf(new JoinedStr(List.of(str("ab"), str("c")))));
  }

  @Test
  void fStringPlaceholdersAreNumberedInSourceOrder() {
    JoinedStr js = new JoinedStr(List.of(
        str("pos "),
        new FormattedValue(name("x"), -1, null),
        str(", "),
        new FormattedValue(name("y"), -1, null)));

    assertEquals("format [\"pos %1, %2\", _x, _y]", expr.toSqf(js));
  }

  @Test
  void fStringConversionIsUnsupported() {
    JoinedStr js = new JoinedStr(List.of(new FormattedValue(name("x"), 114, null)));
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(js));
    assertEquals("format string", e.diagnostic().construct());
  }

  @Test
  void fStringFormatSpecIsUnsupported() {
    JoinedStr js = new JoinedStr(List.of(new FormattedValue(name("x"), -1, new JoinedStr(List.of(str(".2f"))))));
    assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(js));
  }

  // ========== NAMES AND ATTRIBUTES ==========

  @Test
  void namesGetThePrivatePrefix() {
    assertEquals("_unit", expr.toSqf(name("unit")));
  }

  @Test
  void attributeIsReceiverThenMember() {
    assertEquals("_bomber ammo", expr.toSqf(attr(name("bomber"), "ammo")));
  }

  @Test
  void globalMarkerDropsTheReceiver() {
    assertEquals("player", expr.toSqf(global("player")));
  }

  // ========== OPERATORS ==========

  @Test
  void notIsPrefixedWithoutSpace() {
    assertEquals("!_alive", expr.toSqf(new UnaryOp(PyOperator.NOT, name("alive"))));
  }

  @Test
  void notIsPrefixedDirectlyToAComparison() {
    UnaryOp u = new UnaryOp(PyOperator.NOT, cmp(name("a"), PyOperator.LT, name("b")));
    assertEquals("!_a < _b", expr.toSqf(u));
  }

  @Test
  void unaryMinusIsUnsupported() {
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new UnaryOp(PyOperator.U_SUB, num(1))));
    assertEquals("unary operator", e.diagnostic().construct());
  }

  @Test
  void arithmeticOperatorsMapOneToOne() {
    assertEquals("_a + _b", expr.toSqf(bin(name("a"), PyOperator.ADD, name("b"))));
    assertEquals("_a - _b", expr.toSqf(bin(name("a"), PyOperator.SUB, name("b"))));
    assertEquals("_a * _b", expr.toSqf(bin(name("a"), PyOperator.MULT, name("b"))));
    assertEquals("_a / _b", expr.toSqf(bin(name("a"), PyOperator.DIV, name("b"))));
    assertEquals("_a / _b", expr.toSqf(bin(name("a"), PyOperator.FLOOR_DIV, name("b"))));
    assertEquals("_a mod _b", expr.toSqf(bin(name("a"), PyOperator.MOD, name("b"))));
    assertEquals("_a ^ _b", expr.toSqf(bin(name("a"), PyOperator.POW, name("b"))));
  }

  @Test
  void nestedArithmeticKeepsSourceGrouping() {
    // a + b * c
    assertEquals("_a + (_b * _c)",
        expr.toSqf(bin(name("a"), PyOperator.ADD, bin(name("b"), PyOperator.MULT, name("c")))));
    // (a - b) - (c - d)
    assertEquals("(_a - _b) - (_c - _d)",
        expr.toSqf(bin(bin(name("a"), PyOperator.SUB, name("b")), PyOperator.SUB,
            bin(name("c"), PyOperator.SUB, name("d")))));
    // ((a + b) * c) / d
    assertEquals("((_a + _b) * _c) / _d",
        expr.toSqf(bin(bin(bin(name("a"), PyOperator.ADD, name("b")), PyOperator.MULT, name("c")),
            PyOperator.DIV, name("d"))));
  }

  @Test
  void bitwiseOperatorIsUnsupported() {
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(bin(name("a"), PyOperator.BIT_AND, name("b"))));
  }

  @Test
  void boolOpJoinsAllOperands() {
    BoolOp and = new BoolOp(PyOperator.AND, List.of(name("a"), name("b"), name("c")));
    assertEquals("_a && _b && _c", expr.toSqf(and));
    BoolOp or = new BoolOp(PyOperator.OR, List.of(name("a"), cmp(name("b"), PyOperator.GT, num(1))));
    assertEquals("_a || _b > 1", expr.toSqf(or));
  }

  @Test
  void nestedBoolOpIsJoinedWithoutGrouping() {
    BoolOp inner = new BoolOp(PyOperator.AND, List.of(name("a"), name("b")));
    BoolOp outer = new BoolOp(PyOperator.OR, List.of(inner, name("c")));
    assertEquals("_a && _b || _c", expr.toSqf(outer));
  }

  @Test
  void everyComparisonOperatorHasItsToken() {
    Map<PyOperator, String> expected = Map.of(
        PyOperator.EQ, "==", PyOperator.NOT_EQ, "!=", PyOperator.LT, "<",
        PyOperator.LT_E, "<=", PyOperator.GT, ">", PyOperator.GT_E, ">=");
    expected.forEach((op, token) ->
        assertEquals("_a " + token + " _b", expr.toSqf(cmp(name("a"), op, name("b")))));
  }

  @Test
  void chainedComparisonIsUnsupported() {
    Compare chain = new Compare(name("a"), List.of(PyOperator.LT, PyOperator.LT), List.of(name("b"), name("c")));
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(chain));
    assertEquals("compare", e.diagnostic().construct());
  }

  @Test
  void membershipComparisonIsUnsupported() {
    assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(cmp(name("a"), PyOperator.IN, name("b"))));
  }

  @Test
  void compareWithMismatchedListsIsMalformed() {
    Compare broken = new Compare(name("a"), List.of(PyOperator.LT), List.of());
    assertThrows(MalformedTreeException.class, () -> expr.toSqf(broken));
  }

  @Test
  void conditionalExpressionBecomesIfThenElse() {
    IfExp ie = new IfExp(name("c"), num(1), num(2));
    assertEquals("if (_c) then {1} else {2};", expr.toSqf(ie));
  }

  // ========== SUBSCRIPTS ==========

  @Test
  void constantIndexUsesSelect() {
    assertEquals("_pos select 2", expr.toSqf(new Subscript(name("pos"), num(2))));
  }

  @Test
  void sliceBecomesStartAndCount() {
    assertEquals("_seq select [2, 3]", expr.toSqf(new Subscript(name("seq"), new Slice(num(2), num(5), null))));
  }

  @Test
  void unsupportedSlices() {
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Subscript(name("s"), new Slice(num(0), num(4), num(2)))));
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Subscript(name("s"), new Slice(null, num(4), null))));
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Subscript(name("s"), new Slice(num(1), null, null))));
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Subscript(name("s"), new Slice(name("i"), num(4), null))));
  }

  @Test
  void variableIndexIsUnsupported() {
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Subscript(name("s"), name("i"))));
    assertEquals("subscript", e.diagnostic().construct());
  }

  // ========== CALLS ==========

  @Test
  void callsOnPlainFunctions() {
    assertEquals("_unit call fnc_heal", expr.toSqf(call(name("fnc_heal"), name("unit"))));
    assertEquals("[_bomber, _weapon] call BIS_fnc_fire",
        expr.toSqf(call(name("BIS_fnc_fire"), name("bomber"), name("weapon"))));
    assertEquals("[] call fnc_init", expr.toSqf(call(name("fnc_init"))));
  }

  @Test
  void callsOnAttributesBecomeCommands() {
    assertEquals("sleep 0.1", expr.toSqf(call(global("sleep"), num(new BigDecimal("0.1")))));
    assertEquals("_bomber distance2D _target", expr.toSqf(call(attr(name("bomber"), "distance2D"), name("target"))));
    assertEquals("_unit setPos [1, 2]", expr.toSqf(call(attr(name("unit"), "setPos"), num(1), num(2))));
  }

  @Test
  void keywordArgumentsAreRejectedFirst() {
    Call c = new Call(name("f"), List.of(new Starred(name("xs"))), List.of(new Keyword("k", num(1))));
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(c));
    assertEquals("keyword argument is not supported", e.diagnostic().reason());
  }

  @Test
  void unpackingIsUnsupported() {
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(call(name("f"), new Starred(name("xs")))));
    assertEquals("unpacking operator is not supported", e.diagnostic().reason());
  }

  @Test
  void calleeMustBeNameOrAttribute() {
    assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(call(new Subscript(name("fs"), num(0)), num(1))));
  }

  @Test
  void dictAndUnknownNodesAreUnsupported() {
    assertThrows(UnsupportedConstructException.class, () -> expr.toSqf(new Dict(List.of(), List.of())));
    UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
        () -> expr.toSqf(new Unknown("ListComp")));
    assertEquals("ListComp is not supported", e.diagnostic().reason());
  }
}
