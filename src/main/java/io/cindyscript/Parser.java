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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static io.cindyscript.Diagnostic.Kind.*;
import static io.cindyscript.TokenType.*;

/**
 * Precedence climbing parser. Every level of the operator table is left-associative.
 *
 * The parser never throws out of parse(). Problems are recorded in the Diagnostics and an
 * Undefined node is put where the problem was. Errors that leave us unable to make sense
 * of the rest of a statement are thrown as CompileError and caught at the top level, where
 * we skip to the next ';' and carry on with the next statement.
 *
 * The '.' needs special handling since it is both the decimal point and the field access
 * operator. The Tokeniser always gives us a DOT token and digit runs as identifiers. When
 * we reduce a '.' we look at what is on either side: if both sides are bare digit runs (or
 * missing) then we have a number, otherwise we have a field access.
 */
public class Parser {
  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private final Tokeniser     tokeniser;
  private final ParserContext context;
  private final Diagnostics   diagnostics;

  // Operands (brackets, '|...|', prefix operators) nested deeper than this are an error
  // rather than a StackOverflowError
  static final int MAX_NESTING = 100;

  private boolean inAbs        = false;   // Whether we are between '|' and its closing '|'
  private int     bracketDepth = 0;       // Nesting of ( [ { within the current statement
  private int     nesting      = 0;       // Nesting of operands within the current statement

  // Number nodes created directly from digit run tokens (and not yet used up by a '.'
  // or wrapped in brackets). These are the only nodes that can be either side of a
  // decimal point.
  private final Set<Expr> bareDigitRuns = Collections.newSetFromMap(new IdentityHashMap<>());

  public Parser(Tokeniser tokeniser, ParserContext context, Diagnostics diagnostics) {
    this.tokeniser   = tokeniser;
    this.context     = context;
    this.diagnostics = diagnostics;
  }

  /**
   *# parse -> statement? ( ";" statement? ) * EOF ;
   */
  public Expr.Sequence parse() {
    List<Expr> statements = new ArrayList<>();
    while (true) {
      while (matchAny(SEMICOLON)) {}
      if (peek().is(EOF)) {
        break;
      }
      statements.add(topLevelStatement());
    }
    bareDigitRuns.clear();
    String source = tokeniser.getSource();
    Expr.Sequence root = new Expr.Sequence(new Location(source, 0, source.length()), statements);
    if (context.debugLevel() > 0) {
      LOG.debug("Parsed tree: {}", root);
    }
    LOG.debug("Parsed {} statement(s) with {} error(s)", statements.size(), diagnostics.errorCount());
    return root;
  }

  ////////////////////////////////////////////

  // = Stmt

  private Expr topLevelStatement() {
    Token start = peek();
    bracketDepth = 0;
    nesting      = 0;
    bareDigitRuns.clear();
    try {
      Expr stmt = statement();
      if (peek().is(COMMA)) {
        throw new CompileError("Unexpected ',': ',' can only separate elements inside brackets", peek());
      }
      if (peek().isNot(SEMICOLON, EOF)) {
        unexpected("expecting ';' or end of input");
      }
      return stmt;
    }
    catch (CompileError e) {
      Diagnostic diagnostic = diagnostics.add(e.toDiagnostic());
      skipStatement();
      return new Expr.Undefined(Location.span(start, e.getLocation()), diagnostic, null);
    }
  }

  /**
   * Skip to the ';' that ends the current statement. If the error was inside brackets
   * we skip until we are back out of them first.
   */
  private void skipStatement() {
    int depth = bracketDepth;
    while (peek().isNot(EOF)) {
      Token token = advance();
      if (token.getType().isOpeningBracket()) {
        depth++;
      }
      else
      if (token.getType().isClosingBracket()) {
        depth = Math.max(0, depth - 1);
      }
      else
      if (token.is(SEMICOLON) && depth == 0) {
        return;
      }
    }
  }

  /**
   *# statement -> expression ;
   */
  private Expr statement() {
    return parseExpression(0);
  }

  /**
   *# element -> statement? ( ";" statement? ) * ;
   * Element of a bracketed list. More than one statement gives a Sequence.
   */
  private Expr element() {
    Token start = peek();
    List<Expr> statements = new ArrayList<>();
    while (true) {
      while (matchAny(SEMICOLON)) {}
      if (isEndOfElement(peek())) {
        break;
      }
      statements.add(statement());
      if (peek().isNot(SEMICOLON)) {
        break;
      }
    }
    if (statements.isEmpty()) {
      return new Expr.Undefined(emptyAt(start));
    }
    return statements.size() == 1 ? statements.get(0)
                                  : new Expr.Sequence(Location.span(start, previous()), statements);
  }

  private boolean isEndOfElement(Token token) {
    return token.is(COMMA, EOF) || token.getType().isClosingBracket() || (inAbs && token.is(PIPE));
  }

  ////////////////////////////////////////////

  // = Expr

  private static final List<TokenType> assignmentOps = List.of(EQUAL, COLON_EQUAL, COLON_COLON_EQUAL, ARROW);
  private static final List<TokenType> additiveOps   = List.of(PLUS, MINUS);
  private static final List<TokenType> prefixOps     = List.of(PLUS, MINUS, BANG);
  private static final List<TokenType> fieldOps      = List.of(DOT, DEGREE);

  // Operators from least precedence to highest precedence. All levels are left-associative.
  // ',' and ';' sit below these and are handled by element() and parse().
  private static final List<List<TokenType>> operatorsByPrecedence =
    List.of(
      assignmentOps,
      List.of(PLUS_PLUS, MINUS_MINUS, TILDE_TILDE, COLON_GREATER_THAN, LESS_THAN_COLON),
      List.of(AMPERSAND, PERCENT, BANG_EQUAL, TILDE_BANG_EQUAL, DOT_DOT),
      List.of(EQUAL_EQUAL, TILDE_EQUAL, TILDE_LESS_THAN, TILDE_GREATER_THAN, EQUAL_COLON_EQUAL,
              GREATER_THAN_EQUAL, LESS_THAN_EQUAL, TILDE_GREATER_THAN_EQUAL, TILDE_LESS_THAN_EQUAL,
              GREATER_THAN, LESS_THAN, LESS_GREATER),
      additiveOps,                   // also prefix + - !
      List.of(STAR, SLASH),
      List.of(UNDERSCORE, ACCENT),
      fieldOps,                      // '°' is postfix only
      List.of(COLON)                 // reserved for user data
    );

  private static final int ADDITIVE_LEVEL = operatorsByPrecedence.indexOf(additiveOps);
  private static final int FIELD_LEVEL    = operatorsByPrecedence.indexOf(fieldOps);

  /**
   *# expr -> expr operator expr
   *#       | expr "°"
   *#       | unary
   *#       | primary;
   * Parse expressions based on operator precedence. If we reach highest level of precedence
   * then we return a primary(). At the level of '+' and '-' the operands can have prefix
   * operators so we use unary() for them.
   */
  private Expr parseExpression(int level) {
    // If we have reached highest precedence
    if (level == operatorsByPrecedence.size()) {
      return primary();
    }

    List<TokenType> operators = operatorsByPrecedence.get(level);
    Expr expr = operators == additiveOps ? unary(level) : parseExpression(level + 1);

    while (matchAny(operators)) {
      Token operator = previous();
      if (operator.is(DEGREE)) {
        expr = new Expr.Unary(Location.span(expr.location, operator), operator.getType(), expr, Expr.Fixity.POSTFIX);
        continue;
      }
      if (operator.is(DOT)) {
        expr = dot(expr, operator);
        continue;
      }
      Expr rhs = operators == additiveOps ? unary(level) : parseExpression(level + 1);
      expr = binary(expr, operator, rhs);
    }
    return expr;
  }

  /**
   *# unary -> ( "!" | "-" | "+" ) unary
   *#        | expression;
   */
  private Expr unary(int level) {
    if (matchAny(prefixOps)) {
      Token operator = previous();
      Expr  operand;
      try {
        enterNesting(operator);
        operand = unary(level);
      }
      finally {
        nesting--;
      }
      return new Expr.Unary(Location.span(operator, operand.location), operator.getType(), operand, Expr.Fixity.PREFIX);
    }
    return parseExpression(level + 1);
  }

  private Expr binary(Expr left, Token operator, Expr right) {
    if (operator.getType().isAssignment()) {
      return assignment(left, operator, right);
    }
    Expr.Binary expr = new Expr.Binary(Location.span(left.location, right.location), left, operator.getType(), right);
    if (operator.is(COLON)) {
      return diagnostics.undefined(SYNTAX_ERROR, "Operator ':' (user data) is not supported", operator, expr);
    }
    return expr;
  }

  /**
   * Reduce a '.' where either side may be missing (null). Bare digit runs (or nothing)
   * on both sides make a number, anything else is a field access.
   */
  private Expr dot(Expr left, Token operator) {
    Expr right = canStartOperand(peek()) ? parseExpression(FIELD_LEVEL + 1) : null;
    if (isBareDigitRun(left) && isBareDigitRun(right)) {
      bareDigitRuns.remove(left);
      bareDigitRuns.remove(right);
      String   text     = digits(left) + "." + digits(right);
      Location location = Location.span(left == null ? operator : left.location, right == null ? operator : right.location);
      return new Expr.NumberLiteral(location, text);
    }
    if (left == null || right == null) {
      Location location = left == null ? Location.span(operator, right.location) : Location.span(left.location, operator);
      return diagnostics.undefined(SYNTAX_ERROR, "Missing operand for '.'", location, left == null ? right : left);
    }
    bareDigitRuns.remove(right);
    return new Expr.Binary(Location.span(left.location, right.location), left, operator.getType(), right);
  }

  private boolean isBareDigitRun(Expr expr) {
    return expr == null || bareDigitRuns.contains(expr);
  }

  private static String digits(Expr expr) {
    return expr == null ? "" : ((Expr.NumberLiteral) expr).text;
  }

  /**
   * Check whether an assignment target is valid. If not, the target is replaced by Undefined
   * so that the Assignment can still be traversed.
   */
  private Expr assignment(Expr target, Token operator, Expr value) {
    Expr.AssignmentKind kind = Expr.AssignmentKind.of(operator.getType());
    Location location = Location.span(target.location, value.location);
    if (!LValues.isLValue(kind, target)) {
      target = diagnostics.undefined(INVALID_LVALUE, "Invalid left-hand side for '" + kind.symbol + "' (invalid lvalue)", target.location, target);
    }
    return new Expr.Assignment(location, kind, target, value);
  }

  /**
   *# primary -> IDENTIFIER | HASH_IDENTIFIER | STRING_CONST | digitRun
   *#          | IDENTIFIER "(" elements ")"
   *#          | "(" elements ")" | "[" elements "]" | "{" element "}" | "|" element ( "," element ) ? "|"
   *#          | "." digitRun ?
   *#          ;
   */
  private Expr primary() {
    Token token = peek();
    try {
      enterNesting(token);
      return operand(token);
    }
    finally {
      nesting--;
    }
  }

  private void enterNesting(Token token) {
    if (++nesting > MAX_NESTING) {
      throw new CompileError("Expression nested too deeply (limit is " + MAX_NESTING + ")", token);
    }
  }

  private Expr operand(Token token) {
    switch (token.getType()) {
      case IDENTIFIER: {
        advance();
        if (token.isDigitRun()) {
          Expr.NumberLiteral number = new Expr.NumberLiteral(token, token.getChars());
          bareDigitRuns.add(number);
          return number;
        }
        if (peek().is(LEFT_PAREN)) {
          advance();
          return application(token);
        }
        return new Expr.Identifier(token);
      }
      case HASH_IDENTIFIER: advance(); return new Expr.Identifier(token);
      case STRING_CONST:    advance(); return new Expr.StringLiteral(token, token.getChars());
      case NUMBER_CONST:    advance(); return new Expr.NumberLiteral(token, token.getChars());
      case LEFT_PAREN:      advance(); return roundBrackets(token);
      case LEFT_SQUARE:     advance(); return squareBrackets(token);
      case LEFT_BRACE:      advance(); return curlyBrackets(token);
      case PIPE:            advance(); return absValue(token);
      case DOT:             advance(); return dot(null, token);
      case PLUS:
      case MINUS:
      case BANG:
        return unary(ADDITIVE_LEVEL);
      case DEGREE:
        return misplacedOperator(token, SYNTAX_ERROR, "Operator '°' can only be used as a postfix operator");
      case UNKNOWN:
        return misplacedOperator(token, LEXICAL_PASSTHROUGH, "Unexpected character '" + token.getChars() + "'");
      default:
        if (token.getKind() == TokenType.Kind.OPERATOR) {
          return misplacedOperator(token, SYNTAX_ERROR, "Operator '" + token.getChars() + "' cannot be used as a prefix operator");
        }
        return unexpected("expecting operand");
    }
  }

  /**
   * Operator (or unknown char) where an operand should be. We report it, skip it, and
   * then parse the operand (if any) that follows so that it can be kept in the Undefined
   * that we return.
   */
  private Expr misplacedOperator(Token token, Diagnostic.Kind kind, String message) {
    advance();
    Diagnostic diagnostic = diagnostics.emit(kind, message, token);
    Token next = peek();
    if (canStartOperand(next) || next.is(PLUS, MINUS, BANG, DOT)) {
      Expr operand = unary(ADDITIVE_LEVEL);
      return new Expr.Undefined(Location.span(token, operand.location), diagnostic, operand);
    }
    return new Expr.Undefined(token, diagnostic, null);
  }

  private boolean canStartOperand(Token token) {
    switch (token.getType()) {
      case IDENTIFIER:
      case HASH_IDENTIFIER:
      case STRING_CONST:
      case NUMBER_CONST:
      case LEFT_PAREN:
      case LEFT_SQUARE:
      case LEFT_BRACE:
        return true;
      case PIPE:
        return !inAbs;
      default:
        return false;
    }
  }

  /**
   *# application -> IDENTIFIER "(" elements ")" ;
   */
  private Expr application(Token name) {
    List<Expr> args = elements(RIGHT_PAREN);
    return new Expr.Application(Location.span(name, previous()), new Expr.Identifier(name), args);
  }

  /**
   *# elements -> ( element ? ( "," element ? ) * ) ? ;
   * Missing elements (including after a trailing comma) are Undefined.
   */
  private List<Expr> elements(TokenType closing) {
    bracketDepth++;
    List<Expr> elements = new ArrayList<>();
    if (!matchAny(closing)) {
      while (true) {
        Token next = peek();
        elements.add(next.is(COMMA, closing) ? new Expr.Undefined(emptyAt(next)) : element());
        if (matchAny(closing)) {
          break;
        }
        if (!matchAny(COMMA)) {
          unexpected("expecting ',' or '" + closing + "'");
        }
      }
    }
    bracketDepth--;
    return elements;
  }

  /**
   * () is the empty list, (x) is just x, and (x,y,...) is a list
   */
  private Expr roundBrackets(Token leftParen) {
    List<Expr> elements = elements(RIGHT_PAREN);
    if (elements.size() == 1) {
      Expr element = elements.get(0);
      bareDigitRuns.remove(element);
      return element;
    }
    return new Expr.ListLiteral(Location.span(leftParen, previous()), elements, Expr.BracketKind.ROUND);
  }

  private Expr squareBrackets(Token leftSquare) {
    List<Expr> elements = elements(RIGHT_SQUARE);
    return new Expr.ListLiteral(Location.span(leftSquare, previous()), elements, Expr.BracketKind.SQUARE);
  }

  /**
   * {x} is a deprecated way of writing (x). Any other number of elements is reserved.
   */
  private Expr curlyBrackets(Token leftBrace) {
    List<Expr> elements = elements(RIGHT_BRACE);
    Location   location = Location.span(leftBrace, previous());
    if (elements.size() != 1) {
      return diagnostics.undefined(STRUCTURAL_RESERVED, "'{...}' with " + elements.size() + " elements is reserved: only '{expr}' is allowed", location);
    }
    if (context.deprecationWarnings()) {
      diagnostics.emit(DEPRECATION, "Use of '{...}' for grouping is deprecated: use '(...)' instead", location);
    }
    bareDigitRuns.remove(elements.get(0));
    return new Expr.ListLiteral(location, elements, Expr.BracketKind.CURLY);
  }

  /**
   *# absValue -> "|" element ( "," element ) ? "|" ;
   * Since the same char opens and closes, '|' cannot be nested: a '|' that appears where
   * an operand is expected inside an open '|' is an error.
   */
  private Expr absValue(Token pipe) {
    if (inAbs) {
      throw new CompileError("Nested '|' not allowed: '|...|' cannot contain another '|...|'", pipe);
    }
    inAbs = true;
    try {
      if (matchAny(PIPE)) {
        return diagnostics.undefined(STRUCTURAL_RESERVED, "Empty '|...|' is not allowed", Location.span(pipe, previous()));
      }
      List<Expr> args = new ArrayList<>();
      while (true) {
        Token next = peek();
        if (next.is(COMMA, PIPE)) {
          args.add(diagnostics.undefined(SYNTAX_ERROR, "Missing argument in '|...|'", emptyAt(next)));
        }
        else {
          args.add(element());
        }
        if (matchAny(PIPE)) {
          break;
        }
        if (!matchAny(COMMA)) {
          unexpected("expecting ',' or closing '|'");
        }
      }
      Location location = Location.span(pipe, previous());
      if (args.size() > 2) {
        return diagnostics.undefined(STRUCTURAL_RESERVED, "'|...|' takes one or two arguments but found " + args.size(), location,
                                     new Expr.ListLiteral(location, args, Expr.BracketKind.ROUND));
      }
      return new Expr.AbsValue(location, args);
    }
    finally {
      inAbs = false;
    }
  }

  /////////////////////////////////////////////////

  // Digit run nodes still waiting to see whether a '.' follows
  int pendingDigitRuns() {
    return bareDigitRuns.size();
  }

  private Token advance() {
    Token token = tokeniser.next();
    if (context.debugLevel() > 1) {
      LOG.debug("Token: {}", token);
    }
    return token;
  }

  private Token peek() {
    return tokeniser.peek();
  }

  private Token previous() {
    return tokeniser.previous();
  }

  /**
   * Check if next token matches any of the given types. If it matches then consume the token and return true.
   * If it does not match one of the types then return false and stay in current position in stream of tokens.
   *
   * @param types the types to match against
   * @return true if next token matches, false if not
   */
  private boolean matchAny(TokenType... types) {
    for (TokenType type : types) {
      if (peek().is(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private boolean matchAny(List<TokenType> types) {
    return matchAny(types.toArray(TokenType[]::new));
  }

  private Location emptyAt(Token token) {
    return new Location(token.getSource(), token.getOffset(), token.getOffset());
  }

  /////////////////////////////////////

  private Expr unexpected(String msg) {
    Token token = peek();
    if (token.is(EOF)) {
      throw new CompileError("Unexpected end of input: " + msg, token);
    }
    if (token.is(UNKNOWN)) {
      throw new CompileError(LEXICAL_PASSTHROUGH, "Unexpected character '" + token.getChars() + "'", token);
    }
    if (token.is(BANG)) {
      throw new CompileError("Operator '!' cannot be used as a postfix operator", token);
    }
    throw new CompileError("Unexpected token '" + token.getChars() + "': " + msg, token);
  }
}
