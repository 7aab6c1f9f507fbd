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

/**
 * This class represents a single token parsed from the source code.
 * Each token keeps track of where it is in the source (as a Location) so that
 * diagnostics can show exactly where a problem occurs.
 *
 * Since whitespace and comments are invisible inside identifiers and numbers,
 * the chars of a token (its lexeme) can differ from the source text it covers:
 * "a b c" is a single identifier token whose chars are "abc".
 *
 * Tokens keep a reference to the subsequent token in the parse stream.
 * This makes it easy for the Tokeniser to support peeking at an arbitrary
 * number of tokens ahead in the parse stream and then rewind to the current
 * position and continue parsing from there.
 */
public class Token extends Location {
  private Token     next;       // Next token in the stream of tokens
  private TokenType type;       // Token type
  private String    chars;      // Lexeme with whitespace and comments folded out

  /**
   * Partially construct a token whose type and length is not yet known
   * @param source the source code of the script
   * @param offset the offset in source where token starts
   */
  public Token(String source, int offset) {
    super(source, offset, offset);
  }

  /**
   * Construct a new token of different type from an existing token
   * @param type   the new token type
   * @param token  the token to copy values from
   */
  public Token(TokenType type, Token token) {
    super(token);
    this.type  = type;
    this.chars = token.chars;
  }

  /**
   * Set next token (once we have parsed the following one)
   * @param next  the next token
   */
  public void setNext(Token next) {
    this.next = next;
  }

  /**
   * Get next token (if we have already parsed ahead)
   * @return  the next token or null if we have not parsed any further
   */
  public Token getNext() {
    return next;
  }

  public Token setType(TokenType type) {
    this.type = type;
    return this;
  }

  public TokenType getType() { return type; }

  public TokenType.Kind getKind() { return type.getKind(); }

  /**
   * Check if type of token matches any of the types passed in
   * @param types  the types to check
   * @return true if type matches
   */
  public boolean is(TokenType... types) {
    return type.is(types);
  }

  public boolean isNot(TokenType... types) {
    return !is(types);
  }

  /**
   * Set the end of the token once the scan of it has finished
   * @param endOffset  offset just after last char of the token
   * @return the token
   */
  public Token setEndOffset(int endOffset) {
    this.endOffset = endOffset;
    return this;
  }

  public Token setChars(String chars) {
    this.chars = chars;
    return this;
  }

  /**
   * Return the lexeme of the token. For identifiers and numbers this is the folded
   * text (whitespace and comments removed), for strings it is the content between
   * the quotes.
   * @return the lexeme
   */
  public String getChars() {
    return chars == null ? getSourceText() : chars;
  }

  /**
   * True if this is an identifier made up only of digits. Such tokens become
   * numbers (or halves of a decimal number) in the parser.
   * @return true if digit run
   */
  public boolean isDigitRun() {
    return is(TokenType.IDENTIFIER) && Utils.isDigits(getChars()) && !getChars().isEmpty();
  }

  @Override
  public String toString() {
    return "Token{" +
           "type=" + type +
           ", chars='" + getChars() + '\'' +
           ", span=" + super.toString() +
           '}';
  }
}
