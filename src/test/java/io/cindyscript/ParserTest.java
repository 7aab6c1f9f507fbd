/*
 * Copyright 2022 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cindyscript;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static io.cindyscript.Diagnostic.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

  private static Expr.Sequence parseClean(String source) {
    ParseResult result = CindyScript.parse(source);
    assertFalse(result.hasErrors(), () -> source + ": " + result.getDiagnostics());
    return result.getRoot();
  }

  private static Expr single(String source) {
    Expr.Sequence root = parseClean(source);
    assertEquals(1, root.statements.size(), source);
    return root.statements.get(0);
  }

  private static Expr.Undefined singleUndefined(ParseResult result) {
    assertEquals(1, result.getRoot().statements.size());
    Expr stmt = result.getRoot().statements.get(0);
    assertTrue(stmt instanceof Expr.Undefined, () -> "Expected undefined but got " + stmt);
    return (Expr.Undefined) stmt;
  }

  private static void errorTest(String source, Diagnostic.Kind kind, String messagePart) {
    ParseResult result = CindyScript.parse(source);
    assertTrue(result.hasErrors(), source);
    Diagnostic first = result.getDiagnostics().errors().get(0);
    assertEquals(kind, first.getKind(), () -> source + ": " + first);
    assertTrue(first.getMessage().contains(messagePart), () -> source + ": " + first.getMessage());
  }

  @Test public void precedence() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("1+2*3", "1+(2*3)");
    doTest.accept("1*2+3", "(1*2)+3");
    doTest.accept("3^2^4", "(3^2)^4");
    doTest.accept("a-b-c", "(a-b)-c");
    doTest.accept("a/b*c", "(a/b)*c");
    doTest.accept("-a*b", "-(a*b)");
    doTest.accept("-a^2", "-(a^2)");
    doTest.accept("!a == b", "(!a)==b");
    doTest.accept("a - -b", "a-(-b)");
  }

  @Test public void precedenceLevels() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("a == b + c", "a==(b+c)");
    doTest.accept("a & b == c", "a&(b==c)");
    doTest.accept("a ++ b & c", "a++(b&c)");
    doTest.accept("x = a ++ b", "x = (a++b)");
    doTest.accept("a + b * c ^ d", "a+(b*(c^d))");
    doTest.accept("a_1.x", "a_(1.x)");
    doTest.accept("a.x_1", "(a.x)_1");
    doTest.accept("1..n", "1..n");
    doTest.accept("a <> b", "a<>b");
    doTest.accept("a ~>= b", "a~>=b");
    doTest.accept("l :> x", "l:>x");
    doTest.accept("a % b != c", "(a%b)!=c");
    doTest.accept("30°", "30°");
    doTest.accept("a.b.c", "(a.b).c");
  }

  @Test public void prefixAtStartOfOperand() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("a * -b", "a*(-b)");
    doTest.accept("a ^ -2", "a^(-2)");
    doTest.accept("+a", "+a");
    doTest.accept("!!a", "!(!a)");
    // A prefix operand is a whole multiplicative term, even inside '^'
    doTest.accept("2^-1", "2^(-1)");
    doTest.accept("2^-1*3", "2^(-(1*3))");
    doTest.accept("2^(-1)*3", "(2^(-1))*3");
  }

  @Test public void decimalPoint() {
    BiConsumer<String,String> doTest = (source,value) -> {
      Expr expr = single(source);
      assertTrue(expr instanceof Expr.NumberLiteral, () -> source + " gave " + expr.getClass().getSimpleName());
      assertEquals(0, new BigDecimal(value).compareTo(((Expr.NumberLiteral) expr).getValue()), source);
    };
    doTest.accept("2.5", "2.5");
    doTest.accept("2.", "2");
    doTest.accept(".34", "0.34");
    doTest.accept(".", "0");
    doTest.accept("1 000.5", "1000.5");
    doTest.accept("2 . 5", "2.5");
    doTest.accept("123", "123");
  }

  @Test public void decimalPointInExpressions() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("2.5*3", "2.5*3");
    doTest.accept("x = .5", "x = .5");
    doTest.accept("[1.5, 2.]", "[1.5, 2.]");
    doTest.accept("2.-3", "2.-3");
    doTest.accept("|2.|", "|2.|");
    doTest.accept("2.5°", "2.5°");
  }

  @Test public void fieldAccess() {
    Expr expr = single("x.2");
    assertTrue(expr instanceof Expr.Binary);
    assertEquals(TokenType.DOT, ((Expr.Binary) expr).getOperator());

    expr = single("(2).5");
    assertTrue(expr instanceof Expr.Binary, "grouped digits are not part of a number");

    expr = single("p.x");
    assertTrue(expr instanceof Expr.Binary);
    assertEquals(new Expr.Identifier(null, "p", false), ((Expr.Binary) expr).left);
  }

  @Test public void missingDotOperand() {
    errorTest("a.", SYNTAX_ERROR, "Missing operand for '.'");
    errorTest(".a", SYNTAX_ERROR, "Missing operand for '.'");
    errorTest("2.;a.", SYNTAX_ERROR, "Missing operand");
    assertEquals(1, CindyScript.parse("2.;a.").getErrors().size());
  }

  @Test public void groupingIsTransparent() {
    Consumer<String> doTest = source -> assertEquals(single(source), single("(" + source + ")"), source);
    doTest.accept("a");
    doTest.accept("a+b*c");
    doTest.accept("f(x,y)");
    doTest.accept("[1,2]");
    doTest.accept("x = 3");
    doTest.accept("2.5");
    assertEquals(single("a+b"), single("((a+b))"));
  }

  @Test public void whitespaceInsensitive() {
    assertEquals(parseClean("abc = 123"), parseClean("a b c = 1 2 3"));
    assertEquals(parseClean("f(x):=x^2"), parseClean(" f ( x ) := x ^ 2 "));
  }

  @Test public void statements() {
    BiConsumer<String,Integer> doTest = (source,count) -> assertEquals(count, parseClean(source).statements.size(), source);
    doTest.accept("", 0);
    doTest.accept(";", 0);
    doTest.accept(";;;", 0);
    doTest.accept("a", 1);
    doTest.accept("a;", 1);
    doTest.accept("a;b", 2);
    doTest.accept("a;;b;", 2);
    doTest.accept("a; b; c", 3);
    doTest.accept("// comment only", 0);
    doTest.accept("x = (a; b); y", 2);
  }

  @Test public void rootSpansWholeSource() {
    String source = "  a; b  ";
    Expr.Sequence root = parseClean(source);
    assertEquals(0, root.location.getOffset());
    assertEquals(source.length(), root.location.getEndOffset());
  }

  @Test public void sequenceInsideBrackets() {
    Expr expr = single("(a; b)");
    assertTrue(expr instanceof Expr.Sequence);
    assertEquals(2, ((Expr.Sequence) expr).statements.size());

    expr = single("[a;b, c]");
    Expr.ListLiteral list = (Expr.ListLiteral) expr;
    assertEquals(2, list.elements.size());
    assertTrue(list.elements.get(0) instanceof Expr.Sequence);

    assertEquals(single("a"), single("(a;)"));
    assertEquals(single("a"), single("(;a)"));
  }

  @Test public void lists() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("()", "()");
    doTest.accept("[]", "[]");
    doTest.accept("(1,2)", "(1, 2)");
    doTest.accept("[1,2,3]", "[1, 2, 3]");
    doTest.accept("(1,2,)", "(1, 2, undefined)");
    doTest.accept("[1,2,]", "[1, 2, undefined]");
    doTest.accept("[1,,3]", "[1, undefined, 3]");
    doTest.accept("[,]", "[undefined, undefined]");
    doTest.accept("[[1,2],[3]]", "[[1, 2], [3]]");
    doTest.accept("(1,)", "(1, undefined)");
  }

  @Test public void listKinds() {
    Expr.ListLiteral round = (Expr.ListLiteral) single("(1,2)");
    assertEquals(Expr.BracketKind.ROUND, round.bracketKind);
    Expr.ListLiteral square = (Expr.ListLiteral) single("[1]");
    assertEquals(Expr.BracketKind.SQUARE, square.bracketKind);
    assertEquals(1, square.elements.size());

    Expr.ListLiteral trailing = (Expr.ListLiteral) single("[1,2,]");
    assertEquals(3, trailing.elements.size());
    Expr.Undefined last = (Expr.Undefined) trailing.elements.get(2);
    assertNull(last.cause);
  }

  @Test public void applications() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("f()", "f()");
    doTest.accept("f(x)", "f(x)");
    doTest.accept("f(x, y+1)", "f(x, y+1)");
    doTest.accept("f(g(x))", "f(g(x))");
    doTest.accept("draw(A, color->red)", "draw(A, color -> red)");
    doTest.accept("f(1,)", "f(1, undefined)");
    doTest.accept("f (x)", "f(x)");

    Expr.Application app = (Expr.Application) single("repeat(3, i, println(i))");
    assertEquals("repeat", app.callee.name);
    assertEquals(3, app.args.size());

    // A digit run followed by '(' is not a function call
    assertFalse(CindyScript.parse("2(x)").getRoot().statements.get(0) instanceof Expr.Application);
  }

  @Test public void strings() {
    Expr expr = single("\"hello world\"");
    assertEquals("hello world", ((Expr.StringLiteral) expr).text);
    assertEquals("s = \"a  b\"", ExprPrinter.print(parseClean("s = \"a  b\"")));
  }

  @Test public void hashIdentifiers() {
    Expr.Identifier hash = (Expr.Identifier) single("#");
    assertTrue(hash.isHash);
    Expr.Identifier hash1 = (Expr.Identifier) single("#1");
    assertTrue(hash1.isHash);
    assertEquals("#1", hash1.name);
    Expr.Identifier other = (Expr.Identifier) single("foo#1");
    assertFalse(other.isHash);
    assertEquals("apply(l, #^2)", ExprPrinter.print(parseClean("apply(l, #^2)")));
  }

  @Test public void absValues() {
    BiConsumer<String,String> doTest = (source,expected) -> assertEquals(expected, ExprPrinter.print(parseClean(source)), source);
    doTest.accept("|x|", "|x|");
    doTest.accept("|a, b|", "|a, b|");
    doTest.accept("|a - b| + 1", "|a-b|+1");
    doTest.accept("|[3, 4]|", "|[3, 4]|");
    doTest.accept("f(|x|)", "f(|x|)");
    doTest.accept("|a;b|", "|a; b|");
    assertTrue(single("|x|") instanceof Expr.AbsValue);
  }

  @Test public void nestedAbsValue() {
    ParseResult result = CindyScript.parse("|[3,|4|]|");
    assertEquals(1, result.getErrors().size());
    assertEquals(SYNTAX_ERROR, result.getDiagnostics().errors().get(0).getKind());
    singleUndefined(result);

    errorTest("|a + |b||", SYNTAX_ERROR, "Nested '|' not allowed");
    assertEquals(1, CindyScript.parse("|a + |b||").getErrors().size());
    errorTest("|(|b|)|", SYNTAX_ERROR, "Nested '|' not allowed");

    result = CindyScript.parse("|[3,|4|]|; x = 1");
    assertEquals(2, result.getRoot().statements.size());
    assertEquals("x = 1", ExprPrinter.print(result.getRoot().statements.get(1)));
  }

  @Test public void absValueArgumentCount() {
    errorTest("||", STRUCTURAL_RESERVED, "Empty");
    errorTest("|a,b,c|", STRUCTURAL_RESERVED, "one or two");
    errorTest("|,a|", SYNTAX_ERROR, "Missing argument");
    errorTest("|a,|", SYNTAX_ERROR, "Missing argument");

    ParseResult result = CindyScript.parse("|a,b,c|");
    Expr.Undefined undefined = singleUndefined(result);
    assertNotNull(undefined.replaced);
  }

  @Test public void curlyBrackets() {
    ParseResult result = CindyScript.parse("{1}");
    assertFalse(result.hasErrors());
    assertEquals(1, result.getDiagnostics().warnings().size());
    assertEquals(DEPRECATION, result.getDiagnostics().warnings().get(0).getKind());
    Expr.ListLiteral curly = (Expr.ListLiteral) result.getRoot().statements.get(0);
    assertEquals(Expr.BracketKind.CURLY, curly.bracketKind);

    ParseResult quiet = CindyScript.parse("{1}", ParserContext.create().deprecationWarnings(false).build());
    assertTrue(quiet.getDiagnostics().isEmpty());

    errorTest("{1,2}", STRUCTURAL_RESERVED, "reserved");
    errorTest("{}", STRUCTURAL_RESERVED, "reserved");
    singleUndefined(CindyScript.parse("{1,2}"));
  }

  @Test public void assignments() {
    BiConsumer<String,Expr.AssignmentKind> doTest = (source,kind) -> {
      Expr expr = single(source);
      assertTrue(expr instanceof Expr.Assignment, source);
      assertEquals(kind, ((Expr.Assignment) expr).kind);
      assertTrue(((Expr.Assignment) expr).isValid());
    };
    doTest.accept("x = 1", Expr.AssignmentKind.ASSIGN);
    doTest.accept("f(x) := x^2", Expr.AssignmentKind.DEFINE);
    doTest.accept("f(x, y) ::= x + y", Expr.AssignmentKind.DEFINE_STATIC);
    doTest.accept("color -> red", Expr.AssignmentKind.BIND);
    doTest.accept("p.x = 3", Expr.AssignmentKind.ASSIGN);
    doTest.accept("l_2 = 3", Expr.AssignmentKind.ASSIGN);
    doTest.accept("[a, b] = [1, 2]", Expr.AssignmentKind.ASSIGN);
    doTest.accept("x = (y = 1)", Expr.AssignmentKind.ASSIGN);
    doTest.accept("f() := 1", Expr.AssignmentKind.DEFINE);
    assertEquals("f(x) := (x^2)", ExprPrinter.print(single("f(x) := x^2")));
  }

  @Test public void chainedAssignmentIsRejected() {
    ParseResult result = CindyScript.parse("x = y = 0");
    assertEquals(1, result.getErrors().size());
    assertEquals(INVALID_LVALUE, result.getDiagnostics().errors().get(0).getKind());
    Expr.Assignment outer = (Expr.Assignment) result.getRoot().statements.get(0);
    assertFalse(outer.isValid());
    Expr.Undefined target = (Expr.Undefined) outer.target;
    assertTrue(target.replaced instanceof Expr.Assignment);
    assertEquals(INVALID_LVALUE, target.cause.getKind());
    assertEquals("undefined = 0", ExprPrinter.print(outer));
  }

  @Test public void invalidLValues() {
    Consumer<String> doTest = source -> errorTest(source, INVALID_LVALUE, "invalid lvalue");
    doTest.accept("1 = 2");
    doTest.accept("\"s\" = 2");
    doTest.accept("a + b = 2");
    doTest.accept("f(x) = 1");
    doTest.accept("f(1) := 2");
    doTest.accept("p.x := 2");
    doTest.accept("#1 = 2");
    doTest.accept("(a, b) = 1");
    doTest.accept("|a| = 1");
    doTest.accept("-a = 1");
    errorTest("x = y = 0", INVALID_LVALUE, "Invalid left-hand side for '='");
  }

  @Test public void userDataColon() {
    errorTest("a:b", SYNTAX_ERROR, "Operator ':' (user data) is not supported");
    errorTest("a:\"key\" = 3", SYNTAX_ERROR, "user data");
    Expr.Undefined undefined = singleUndefined(CindyScript.parse("a:b"));
    assertTrue(undefined.replaced instanceof Expr.Binary);
  }

  @Test public void topLevelComma() {
    ParseResult result = CindyScript.parse("1, 2, 3");
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).getErrorMessage().contains("inside brackets"));
    singleUndefined(result);
  }

  @Test public void misplacedOperators() {
    errorTest("°a", SYNTAX_ERROR, "postfix");
    errorTest("*a", SYNTAX_ERROR, "cannot be used as a prefix operator");
    errorTest("a!", SYNTAX_ERROR, "cannot be used as a postfix operator");
    errorTest("x = / 2", SYNTAX_ERROR, "'/'");
    Expr.Undefined undefined = singleUndefined(CindyScript.parse("*a"));
    assertEquals(new Expr.Identifier(null, "a", false), undefined.replaced);
  }

  @Test public void unknownCharacters() {
    errorTest("a @ b", LEXICAL_PASSTHROUGH, "Unexpected character '@'");
    errorTest("@a", LEXICAL_PASSTHROUGH, "Unexpected character '@'");
    errorTest("x = $", LEXICAL_PASSTHROUGH, "'$'");
  }

  @Test public void unbalancedBrackets() {
    errorTest("(a", SYNTAX_ERROR, "end of input");
    errorTest("a)", SYNTAX_ERROR, "')'");
    errorTest("[1, 2", SYNTAX_ERROR, "end of input");
    errorTest("f(x]", SYNTAX_ERROR, "']'");
    errorTest("|a", SYNTAX_ERROR, "end of input");
  }

  @Test public void recovery() {
    ParseResult result = CindyScript.parse("a = 1; b = ; c = 3");
    List<Expr> statements = result.getRoot().statements;
    assertEquals(3, statements.size());
    assertEquals("a = 1", ExprPrinter.print(statements.get(0)));
    assertTrue(statements.get(1) instanceof Expr.Undefined);
    assertEquals("c = 3", ExprPrinter.print(statements.get(2)));
    assertEquals(1, result.getErrors().size());
  }

  @Test public void recoverySkipsToEndOfBrackets() {
    ParseResult result = CindyScript.parse("f(a!; b); c");
    List<Expr> statements = result.getRoot().statements;
    assertEquals(2, statements.size());
    assertEquals("c", ExprPrinter.print(statements.get(1)));
    assertEquals(1, result.getErrors().size());
  }

  @Test public void multipleErrors() {
    ParseResult result = CindyScript.parse("a:b; 1 = 2; {1,2}; ok");
    assertEquals(3, result.getErrors().size());
    assertEquals(List.of(SYNTAX_ERROR, INVALID_LVALUE, STRUCTURAL_RESERVED),
                 List.of(result.getDiagnostics().errors().get(0).getKind(),
                         result.getDiagnostics().errors().get(1).getKind(),
                         result.getDiagnostics().errors().get(2).getKind()));
    assertEquals(4, result.getRoot().statements.size());
  }

  @Test public void diagnosticLocations() {
    ParseResult result = CindyScript.parse("x = 1;\ny = 2 = 3");
    Diagnostic diagnostic = result.getDiagnostics().errors().get(0);
    assertEquals(2, diagnostic.getLocation().getLineNum());
    assertEquals(1, diagnostic.getLocation().getColumn());
  }

  @Test public void nodeLocations() {
    Expr.Binary binary = (Expr.Binary) single("  a + bc ");
    assertEquals(2, binary.location.getOffset());
    assertEquals(8, binary.location.getEndOffset());
    assertEquals("a + bc", binary.location.getSourceText());
  }

  @Test public void deepNesting() {
    int n = 10000;
    Consumer<String> doTest = source -> {
      ParseResult result = assertDoesNotThrow(() -> CindyScript.parse(source + "; x = 1"));
      assertEquals(1, result.getErrors().size());
      assertTrue(result.getErrors().get(0).getErrorMessage().contains("nested too deeply"));
      assertEquals(2, result.getRoot().statements.size());
      assertEquals("x = 1", ExprPrinter.print(result.getRoot().statements.get(1)));
    };
    doTest.accept("(".repeat(n) + "1" + ")".repeat(n));
    doTest.accept("[".repeat(n) + "1" + "]".repeat(n));
    doTest.accept("{".repeat(n) + "1" + "}".repeat(n));
    doTest.accept("f(".repeat(n) + "1" + ")".repeat(n));
    doTest.accept("!".repeat(n) + "a");
    doTest.accept("- ".repeat(n) + "a");
    doTest.accept("y = " + "(1 + ".repeat(n) + "1" + ")".repeat(n));
  }

  @Test public void nestingUpToLimit() {
    int n = Parser.MAX_NESTING - 1;
    Expr expr = single("(".repeat(n) + "a" + ")".repeat(n));
    assertEquals(new Expr.Identifier(null, "a", false), expr);
    assertEquals("-(-(-a))", ExprPrinter.print(single("- - -a")));
    assertFalse(CindyScript.parse("- ".repeat(Parser.MAX_NESTING / 2) + "a").hasErrors());
  }

  @Test public void longChains() {
    int n = 10000;
    ParseResult sum = CindyScript.parse("a" + "+a".repeat(n));
    assertFalse(sum.hasErrors());
    assertEquals(1, sum.getRoot().statements.size());
    ParseResult result = CindyScript.parse("p" + ".x".repeat(n) + " = 1");
    assertFalse(result.hasErrors(), () -> result.getDiagnostics().toString());
  }

  @Test public void nodesDoNotKeepTokens() {
    Expr.Sequence root = parseClean("a + b; c * d");
    Expr.Binary binary = (Expr.Binary) root.statements.get(0);
    assertEquals(TokenType.PLUS, binary.operator);
    assertFalse(binary.location instanceof Token);
    assertFalse(binary.left.location instanceof Token);
    assertFalse(binary.right.location instanceof Token);
    assertEquals(single("a+b"), binary);

    Expr.Unary unary = (Expr.Unary) single("-2.5");
    assertEquals(TokenType.MINUS, unary.operator);
    assertFalse(unary.operand.location instanceof Token);

    Diagnostic diagnostic = CindyScript.parse("@a").getDiagnostics().all().get(0);
    assertFalse(diagnostic.getLocation() instanceof Token);
    assertEquals(1, diagnostic.getLocation().getColumn());
  }

  @Test public void digitRunsAreNotKeptAfterParse() {
    Diagnostics diagnostics = new Diagnostics();
    Parser parser = new Parser(new Tokeniser("x.5; 3 + 4; 2.5; (7)", diagnostics), ParserContext.defaultContext(), diagnostics);
    assertEquals("x.5; 3+4; 2.5; 7", ExprPrinter.print(parser.parse()));
    assertEquals(0, parser.pendingDigitRuns());
  }

  @Test public void parseNeverThrows() {
    Consumer<String> doTest = source -> assertDoesNotThrow(() -> CindyScript.parse(source), source);
    doTest.accept(")))");
    doTest.accept("(((");
    doTest.accept("|||");
    doTest.accept("= = =");
    doTest.accept(",,,");
    doTest.accept("\"");
    doTest.accept("a.b.c..d...e");
    doTest.accept("°°°");
    doTest.accept("{[(|");
    doTest.accept("f(:=)");
    doTest.accept("😀 + 😀");
  }
}
