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

import io.cindyscript.Expr.AssignmentKind;

/**
 * Decides whether an expression can be the target of an assignment operator.
 * <ul>
 *   <li>a bare identifier (but not '#') for every kind of assignment</li>
 *   <li>for '=': field access x.y and list element x_i where x is itself assignable,
 *       and a square bracket list of assignable targets</li>
 *   <li>for ':=' and '::=': f(x,y,...) where f and every argument are bare identifiers</li>
 * </ul>
 * The check is a visitor so that every node type has to be considered explicitly.
 */
public class LValues implements Expr.Visitor<Boolean> {

  private final AssignmentKind kind;

  private LValues(AssignmentKind kind) {
    this.kind = kind;
  }

  /**
   * Check whether target is admissible as left-hand side of given assignment kind
   * @param kind    the kind of assignment
   * @param target  the already parsed left operand
   * @return true if valid lvalue
   */
  public static boolean isLValue(AssignmentKind kind, Expr target) {
    return target.accept(new LValues(kind));
  }

  private static boolean isPlainIdentifier(Expr expr) {
    return expr instanceof Expr.Identifier && !((Expr.Identifier) expr).isHash;
  }

  @Override
  public Boolean visitIdentifier(Expr.Identifier expr) {
    return !expr.isHash;
  }

  @Override
  public Boolean visitApplication(Expr.Application expr) {
    if (kind != AssignmentKind.DEFINE && kind != AssignmentKind.DEFINE_STATIC) {
      return false;
    }
    return expr.args.stream().allMatch(LValues::isPlainIdentifier);
  }

  @Override
  public Boolean visitBinary(Expr.Binary expr) {
    if (kind != AssignmentKind.ASSIGN) {
      return false;
    }
    // Walk down chains such as a.b.c_1 iteratively
    Expr current = expr;
    while (current instanceof Expr.Binary) {
      Expr.Binary binary = (Expr.Binary) current;
      switch (binary.getOperator()) {
        case DOT:
          if (!isPlainIdentifier(binary.right)) {
            return false;
          }
          break;
        case UNDERSCORE:
          break;
        default:
          return false;
      }
      current = binary.left;
    }
    return current.accept(this);
  }

  @Override
  public Boolean visitListLiteral(Expr.ListLiteral expr) {
    return kind == AssignmentKind.ASSIGN &&
           expr.bracketKind == Expr.BracketKind.SQUARE &&
           !expr.elements.isEmpty() &&
           expr.elements.stream().allMatch(element -> element.accept(this));
  }

  @Override public Boolean visitNumberLiteral(Expr.NumberLiteral expr) { return false; }
  @Override public Boolean visitStringLiteral(Expr.StringLiteral expr) { return false; }
  @Override public Boolean visitUnary(Expr.Unary expr)                 { return false; }
  @Override public Boolean visitAbsValue(Expr.AbsValue expr)           { return false; }
  @Override public Boolean visitSequence(Expr.Sequence expr)           { return false; }
  @Override public Boolean visitAssignment(Expr.Assignment expr)       { return false; }
  @Override public Boolean visitUndefined(Expr.Undefined expr)         { return false; }
}
