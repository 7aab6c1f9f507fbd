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

import static io.cindyscript.TokenType.Kind.*;

/**
 * Enum for the different token types. Fixed symbols carry their text so that
 * the Tokeniser can build its lookup table directly from this enum.
 */
public enum TokenType {
  //= Brackets
  LEFT_PAREN("(", BRACKET),
  RIGHT_PAREN(")", BRACKET),
  LEFT_SQUARE("[", BRACKET),
  RIGHT_SQUARE("]", BRACKET),
  LEFT_BRACE("{", BRACKET),
  RIGHT_BRACE("}", BRACKET),
  PIPE("|", BRACKET),

  //= Separators
  COMMA(",", SEPARATOR),
  SEMICOLON(";", SEPARATOR),

  //= Single char operators
  COLON(":"),
  DOT("."),
  DEGREE("°"),
  UNDERSCORE("_"),
  ACCENT("^"),
  STAR("*"),
  SLASH("/"),
  PLUS("+"),
  MINUS("-"),
  BANG("!"),
  GREATER_THAN(">"),
  LESS_THAN("<"),
  AMPERSAND("&"),
  PERCENT("%"),
  EQUAL("="),

  //= Double char operators
  EQUAL_EQUAL("=="),
  TILDE_EQUAL("~="),
  TILDE_LESS_THAN("~<"),
  TILDE_GREATER_THAN("~>"),
  GREATER_THAN_EQUAL(">="),
  LESS_THAN_EQUAL("<="),
  LESS_GREATER("<>"),
  BANG_EQUAL("!="),
  DOT_DOT(".."),
  PLUS_PLUS("++"),
  MINUS_MINUS("--"),
  TILDE_TILDE("~~"),
  COLON_GREATER_THAN(":>"),
  LESS_THAN_COLON("<:"),
  COLON_EQUAL(":="),
  ARROW("->"),

  //= Triple char operators
  EQUAL_COLON_EQUAL("=:="),
  TILDE_GREATER_THAN_EQUAL("~>="),
  TILDE_LESS_THAN_EQUAL("~<="),
  TILDE_BANG_EQUAL("~!="),
  COLON_COLON_EQUAL("::="),

  //= Literals
  IDENTIFIER(Kind.IDENTIFIER),
  HASH_IDENTIFIER(Kind.IDENTIFIER),   // '#' or '#1' .. '#9'
  STRING_CONST(STRING_LITERAL),
  NUMBER_CONST(NUMBER_LITERAL),

  //= Special
  UNKNOWN(OPERATOR),                  // Character not belonging to any class
  EOF(END_OF_INPUT);

  /**
   * Coarse classification of tokens
   */
  public enum Kind {
    NUMBER_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,
    OPERATOR,
    BRACKET,
    SEPARATOR,
    END_OF_INPUT
  }

  final String asString;
  final Kind   kind;

  TokenType(String str, Kind kind) {
    this.asString = str;
    this.kind     = kind;
  }
  TokenType(String str) { this(str, OPERATOR); }
  TokenType(Kind kind)  { this(null, kind); }

  public Kind getKind() { return kind; }

  public boolean is(TokenType... types) {
    for (TokenType type: types) {
      if (this == type) {
        return true;
      }
    }
    return false;
  }

  /**
   * True for operators that assign to their left-hand side
   * @return true if assignment operator
   */
  public boolean isAssignment() {
    return this.is(EQUAL, COLON_EQUAL, COLON_COLON_EQUAL, ARROW);
  }

  public boolean isOpeningBracket() {
    return this.is(LEFT_PAREN, LEFT_SQUARE, LEFT_BRACE);
  }

  public boolean isClosingBracket() {
    return this.is(RIGHT_PAREN, RIGHT_SQUARE, RIGHT_BRACE);
  }

  @Override
  public String toString() {
    return asString != null ? asString : super.toString();
  }
}
