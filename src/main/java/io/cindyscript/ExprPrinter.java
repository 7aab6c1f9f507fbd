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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints an AST in a canonical text form. Operator expressions nested inside another
 * operator expression are parenthesised so that the grouping chosen by the Parser is
 * visible: "3^2^4" prints as "(3^2)^4".
 */
public class ExprPrinter implements Expr.Visitor<String> {

  private static final ExprPrinter INSTANCE = new ExprPrinter();

  public static String print(Expr expr) {
    return expr.accept(INSTANCE);
  }

  @Override public String visitNumberLiteral(Expr.NumberLiteral expr) { return expr.text; }
  @Override public String visitStringLiteral(Expr.StringLiteral expr) { return '"' + expr.text + '"'; }
  @Override public String visitIdentifier(Expr.Identifier expr)       { return expr.name; }
  @Override public String visitUndefined(Expr.Undefined expr)         { return "undefined"; }

  @Override
  public String visitApplication(Expr.Application expr) {
    return expr.callee.name + "(" + join(expr.args) + ")";
  }

  @Override
  public String visitUnary(Expr.Unary expr) {
    return expr.fixity == Expr.Fixity.PREFIX ? expr.getOperator() + operand(expr.operand)
                                             : operand(expr.operand) + expr.getOperator();
  }

  @Override
  public String visitBinary(Expr.Binary expr) {
    return operand(expr.left) + expr.getOperator() + operand(expr.right);
  }

  @Override
  public String visitListLiteral(Expr.ListLiteral expr) {
    return expr.bracketKind.open + join(expr.elements) + expr.bracketKind.close;
  }

  @Override
  public String visitAbsValue(Expr.AbsValue expr) {
    return "|" + join(expr.args) + "|";
  }

  @Override
  public String visitSequence(Expr.Sequence expr) {
    return expr.statements.stream().map(ExprPrinter::print).collect(Collectors.joining("; "));
  }

  @Override
  public String visitAssignment(Expr.Assignment expr) {
    return operand(expr.target) + " " + expr.kind.symbol + " " + operand(expr.value);
  }

  ////////////////////////////////////

  private static String join(List<Expr> exprs) {
    return exprs.stream().map(ExprPrinter::print).collect(Collectors.joining(", "));
  }

  private static String operand(Expr expr) {
    boolean compound = expr instanceof Expr.Binary     || expr instanceof Expr.Unary ||
                       expr instanceof Expr.Assignment || expr instanceof Expr.Sequence;
    return compound ? "(" + print(expr) + ")" : print(expr);
  }
}
