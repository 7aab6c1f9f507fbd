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

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Expr classes for our AST.
 *
 * The set of node classes is closed: every consumer goes through the Visitor so that
 * adding a new node type forces every visitor (such as the lvalue check) to deal with it.
 * Nodes are immutable. Equality is structural and ignores source locations so that,
 * for example, "(a+b)" and "a+b" give equal trees.
 */
public abstract class Expr {

  public final Location location;

  Expr(Location location) {
    this.location = Location.detached(location);
  }

  public Location getLocation() {
    return location;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  public interface Visitor<T> {
    T visitNumberLiteral(NumberLiteral expr);
    T visitStringLiteral(StringLiteral expr);
    T visitIdentifier(Identifier expr);
    T visitApplication(Application expr);
    T visitUnary(Unary expr);
    T visitBinary(Binary expr);
    T visitListLiteral(ListLiteral expr);
    T visitAbsValue(AbsValue expr);
    T visitSequence(Sequence expr);
    T visitAssignment(Assignment expr);
    T visitUndefined(Undefined expr);
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }

  ////////////////////////////////////////

  /**
   * Numeric literal. The text is digits with an optional single '.' where either
   * side of the '.' may be empty: "12", "2.5", "2.", ".5" and "." (which is zero).
   */
  public static class NumberLiteral extends Expr {
    public final String text;

    public NumberLiteral(Location location, String text) {
      super(location);
      if (text.isEmpty() || !Utils.isDigits(text.replaceFirst("\\.", ""))) {
        throw new IllegalArgumentException("Invalid number literal '" + text + "'");
      }
      this.text = text;
    }

    /**
     * @return true if literal has no decimal point
     */
    public boolean isDigitRun() {
      return text.indexOf('.') == -1;
    }

    /**
     * Decimal value of literal where missing digits either side of the '.' count as zero
     * @return the value
     */
    public BigDecimal getValue() {
      int dot = text.indexOf('.');
      if (dot == -1) {
        return new BigDecimal(text);
      }
      String whole    = text.substring(0, dot);
      String fraction = text.substring(dot + 1);
      return new BigDecimal((whole.isEmpty() ? "0" : whole) + (fraction.isEmpty() ? "" : "." + fraction));
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitNumberLiteral(this); }
    @Override public boolean equals(Object o)         { return o instanceof NumberLiteral && text.equals(((NumberLiteral) o).text); }
    @Override public int hashCode()                   { return text.hashCode(); }
  }

  /**
   * String literal (text is content between the quotes, taken verbatim)
   */
  public static class StringLiteral extends Expr {
    public final String text;

    public StringLiteral(Location location, String text) {
      super(location);
      this.text = Objects.requireNonNull(text);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitStringLiteral(this); }
    @Override public boolean equals(Object o)         { return o instanceof StringLiteral && text.equals(((StringLiteral) o).text); }
    @Override public int hashCode()                   { return 31 * text.hashCode() + 1; }
  }

  /**
   * Name of a variable or function. Names are opaque at parse time.
   */
  public static class Identifier extends Expr {
    public final String  name;
    public final boolean isHash;    // True for '#' and '#1' .. '#9'

    public Identifier(Location location, String name, boolean isHash) {
      super(location);
      this.name   = Objects.requireNonNull(name);
      this.isHash = isHash;
    }

    public Identifier(Token token) {
      this(token, token.getChars(), token.is(TokenType.HASH_IDENTIFIER));
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIdentifier(this); }
    @Override public boolean equals(Object o) {
      return o instanceof Identifier && name.equals(((Identifier) o).name) && isHash == ((Identifier) o).isHash;
    }
    @Override public int hashCode() { return Objects.hash(name, isHash); }
  }

  /**
   * Function application: name(arg, ...)
   */
  public static class Application extends Expr {
    public final Identifier callee;
    public final List<Expr> args;

    public Application(Location location, Identifier callee, List<Expr> args) {
      super(location);
      this.callee = Objects.requireNonNull(callee);
      this.args   = List.copyOf(args);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitApplication(this); }
    @Override public boolean equals(Object o) {
      return o instanceof Application && callee.equals(((Application) o).callee) && args.equals(((Application) o).args);
    }
    @Override public int hashCode() { return Objects.hash(callee, args); }
  }

  public enum Fixity { PREFIX, POSTFIX }

  /**
   * Prefix '+', '-', '!' or postfix '°'
   */
  public static class Unary extends Expr {
    public final TokenType operator;
    public final Expr      operand;
    public final Fixity    fixity;

    public Unary(Location location, TokenType operator, Expr operand, Fixity fixity) {
      super(location);
      this.operator = Objects.requireNonNull(operator);
      this.operand  = Objects.requireNonNull(operand);
      this.fixity   = Objects.requireNonNull(fixity);
    }

    public TokenType getOperator() { return operator; }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitUnary(this); }
    @Override public boolean equals(Object o) {
      if (!(o instanceof Unary)) { return false; }
      Unary other = (Unary) o;
      return operator == other.operator && fixity == other.fixity && operand.equals(other.operand);
    }
    @Override public int hashCode() { return Objects.hash(operator, operand, fixity); }
  }

  /**
   * Binary operator, including '.' when it is a field access
   */
  public static class Binary extends Expr {
    public final Expr      left;
    public final TokenType operator;
    public final Expr      right;

    public Binary(Location location, Expr left, TokenType operator, Expr right) {
      super(location);
      this.left     = Objects.requireNonNull(left);
      this.operator = Objects.requireNonNull(operator);
      this.right    = Objects.requireNonNull(right);
    }

    public TokenType getOperator() { return operator; }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitBinary(this); }
    @Override public boolean equals(Object o) {
      if (!(o instanceof Binary)) { return false; }
      Binary other = (Binary) o;
      return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }
    @Override public int hashCode() { return Objects.hash(left, operator, right); }
  }

  public enum BracketKind {
    ROUND("(", ")"), SQUARE("[", "]"), CURLY("{", "}");

    public final String open;
    public final String close;

    BracketKind(String open, String close) {
      this.open  = open;
      this.close = close;
    }
  }

  /**
   * List literal. CURLY lists are the deprecated grouping form and always have
   * exactly one element.
   */
  public static class ListLiteral extends Expr {
    public final List<Expr>  elements;
    public final BracketKind bracketKind;

    public ListLiteral(Location location, List<Expr> elements, BracketKind bracketKind) {
      super(location);
      if (bracketKind == BracketKind.CURLY && elements.size() != 1) {
        throw new IllegalArgumentException("'{...}' must have exactly one element but has " + elements.size());
      }
      this.elements    = List.copyOf(elements);
      this.bracketKind = Objects.requireNonNull(bracketKind);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitListLiteral(this); }
    @Override public boolean equals(Object o) {
      return o instanceof ListLiteral && bracketKind == ((ListLiteral) o).bracketKind && elements.equals(((ListLiteral) o).elements);
    }
    @Override public int hashCode() { return Objects.hash(elements, bracketKind); }
  }

  /**
   * |a| is the absolute value (or norm) of a and |a,b| is the distance between a and b
   */
  public static class AbsValue extends Expr {
    public final List<Expr> args;

    public AbsValue(Location location, List<Expr> args) {
      super(location);
      if (args.size() < 1 || args.size() > 2) {
        throw new IllegalArgumentException("'|...|' takes one or two arguments but got " + args.size());
      }
      this.args = List.copyOf(args);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAbsValue(this); }
    @Override public boolean equals(Object o)         { return o instanceof AbsValue && args.equals(((AbsValue) o).args); }
    @Override public int hashCode()                   { return 37 * args.hashCode(); }
  }

  /**
   * Statements separated by ';'. The root of every parse is a Sequence.
   */
  public static class Sequence extends Expr {
    public final List<Expr> statements;

    public Sequence(Location location, List<Expr> statements) {
      super(location);
      this.statements = List.copyOf(statements);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitSequence(this); }
    @Override public boolean equals(Object o)         { return o instanceof Sequence && statements.equals(((Sequence) o).statements); }
    @Override public int hashCode()                   { return 41 * statements.hashCode(); }
  }

  public enum AssignmentKind {
    ASSIGN("="),              // Assign value to variable
    DEFINE(":="),             // Define function
    DEFINE_STATIC("::="),     // Define function with bindings fixed at definition time
    BIND("->");               // Bind name to value (modifiers and named arguments)

    public final String symbol;

    AssignmentKind(String symbol) {
      this.symbol = symbol;
    }

    public static AssignmentKind of(TokenType type) {
      switch (type) {
        case EQUAL:             return ASSIGN;
        case COLON_EQUAL:       return DEFINE;
        case COLON_COLON_EQUAL: return DEFINE_STATIC;
        case ARROW:             return BIND;
        default:                throw new IllegalArgumentException("Not an assignment operator: " + type);
      }
    }
  }

  /**
   * Assignment of any kind. If the target was not a valid lvalue it has been replaced
   * by Undefined (which still holds the original target).
   */
  public static class Assignment extends Expr {
    public final AssignmentKind kind;
    public final Expr           target;
    public final Expr           value;

    public Assignment(Location location, AssignmentKind kind, Expr target, Expr value) {
      super(location);
      this.kind   = Objects.requireNonNull(kind);
      this.target = Objects.requireNonNull(target);
      this.value  = Objects.requireNonNull(value);
    }

    public boolean isValid() {
      return !(target instanceof Undefined);
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAssignment(this); }
    @Override public boolean equals(Object o) {
      if (!(o instanceof Assignment)) { return false; }
      Assignment other = (Assignment) o;
      return kind == other.kind && target.equals(other.target) && value.equals(other.value);
    }
    @Override public int hashCode() { return Objects.hash(kind, target, value); }
  }

  /**
   * The undefined sentinel. Used wherever an element or operand could not legally be
   * produced (missing list elements, rejected expressions). It may carry the diagnostic
   * that caused it and the expression it replaced.
   */
  public static class Undefined extends Expr {
    public final Diagnostic cause;      // may be null
    public final Expr       replaced;   // may be null

    public Undefined(Location location) {
      this(location, null, null);
    }

    public Undefined(Location location, Diagnostic cause, Expr replaced) {
      super(location);
      this.cause    = cause;
      this.replaced = replaced;
    }

    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitUndefined(this); }
    @Override public boolean equals(Object o)         { return o instanceof Undefined; }
    @Override public int hashCode()                   { return 7; }
  }
}
