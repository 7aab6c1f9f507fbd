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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.cindyscript.TokenType.*;

/**
 * This class represents the tokeniser for a given script. It is constructed with the source
 * code and then it parses the source into tokens, returning each token one-by-one. Since
 * tokens have a reference to the next token (once the next one has been parsed), clients
 * can rewind by setting the current token to a previously returned token. This allows us
 * to easily support lookahead by arbitrary amounts.
 *
 * Whitespace is not a token boundary inside identifiers and numbers: once we start a run of
 * identifier characters we keep going across any whitespace (and comments) as long as the
 * next non-whitespace character is another identifier character. So "a b c" is the single
 * identifier "abc" and "1 000" is the digit run "1000". Whitespace followed by a character
 * of another class ends the token as normal.
 *
 * Digits are identifier characters. A run made only of digits is flagged by Token.isDigitRun()
 * and it is up to the Parser to turn it into a number. The '.' is always returned as a DOT
 * token since only the Parser knows whether it is a decimal point or a field access.
 *
 * The tokeniser never fails. Characters that belong to no class are returned as UNKNOWN
 * tokens for the Parser to reject and an unterminated string is reported to the diagnostics
 * but still returned as a string token.
 */
public class Tokeniser {
  private       Token       currentToken;      // The current token
  private       Token       previousToken;     // The previous token we parsed
  private final String      source;            // The source code of the script
  private final int         length;            // Length of source code
  private final Diagnostics diagnostics;
  private       int         offset = 0;        // The current position in the source code as offset

  /**
   * Constructor
   * @param source  the source code to tokenise
   */
  public Tokeniser(String source) {
    this(source, new Diagnostics());
  }

  /**
   * Constructor
   * @param source       the source code to tokenise
   * @param diagnostics  where to report problems such as unterminated strings
   */
  public Tokeniser(String source, Diagnostics diagnostics) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null");
    }
    this.source      = source;
    this.length      = source.length();
    this.diagnostics = diagnostics;
  }

  /**
   * Scan the whole source into a list of tokens. The last token is always EOF.
   * Diagnostics (such as an unterminated string) are discarded: use
   * {@link #scan(String, Diagnostics)} to keep them.
   * @param source  the source code
   * @return list of tokens
   */
  public static List<Token> scan(String source) {
    return scan(source, new Diagnostics());
  }

  /**
   * Scan the whole source into a list of tokens. The last token is always EOF.
   * @param source       the source code
   * @param diagnostics  where to record problems found while scanning
   * @return list of tokens
   */
  public static List<Token> scan(String source, Diagnostics diagnostics) {
    return new Tokeniser(source, diagnostics).tokenise();
  }

  /**
   * Return all remaining tokens up to and including EOF
   * @return list of tokens
   */
  public List<Token> tokenise() {
    List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = next();
      tokens.add(token);
    } while (token.isNot(EOF));
    return tokens;
  }

  /**
   * Get the next token. If we have been rewound then we return from that point in
   * the stream of tokens rather than parsing a new one from the source code.
   * @return the next token in the stream of tokens
   */
  public Token next() {
    populateCurrentToken();

    Token result  = currentToken;
    previousToken = currentToken;
    currentToken  = previousToken.getNext();
    return result;
  }

  /**
   * Return the previous token
   * @return the previous token
   */
  public Token previous() {
    return previousToken;
  }

  /**
   * Peek at the next token without advancing
   * @return the next token
   */
  public Token peek() {
    populateCurrentToken();
    return currentToken;
  }

  /**
   * Rewind to an early position in the stream of tokens
   * @param previous  the previous token
   * @param current  the token to rewind to
   */
  public void rewind(Token previous, Token current) {
    previousToken = previous;
    currentToken  = current;
  }

  public String getSource() {
    return source;
  }

  //////////////////////////////////////////////////////////////////

  /**
   * If currentToken already has a value then do nothing. If we don't have a current
   * token then read the next token.
   */
  private void populateCurrentToken() {
    if (currentToken == null) {
      currentToken = parseToken();
      if (previousToken != null) {
        previousToken.setNext(currentToken);
      }
    }
  }

  /**
   * This is the main method that reads chars and decides what type of token to return.
   * @return the next token from the source code
   */
  private Token parseToken() {
    skipSpacesAndComments();

    // Create token before knowing type and length so we can record start position
    Token token = createToken();

    if (!available(1)) {
      return token.setType(EOF);
    }

    char c = charAt(0);

    if (c == '"') {
      return parseString(token);
    }

    if (isRunChar(c)) {
      return parseIdentifier(token);
    }

    // Find list of symbols that match first character and then find longest one that matches
    List<Symbol> symbols = c < symbolLookup.length ? symbolLookup[c] : List.of();
    Optional<Symbol> symbolOptional = symbols.stream()
                                             .filter(this::symbolMatches)
                                             .findFirst();

    if (symbolOptional.isEmpty()) {
      // Unknown character (take whole code point so that surrogate pairs stay together)
      advance(Character.charCount(source.codePointAt(offset)));
      return token.setType(UNKNOWN).setEndOffset(offset);
    }

    Symbol sym = symbolOptional.get();
    advance(sym.length());
    return token.setType(sym.type).setEndOffset(offset);
  }

  private boolean symbolMatches(Symbol sym) {
    if (!available(sym.length())) return false;

    // Check if string at current offset matches symbol
    int i = 1;
    while(i < sym.length() && sym.charAt(i) == charAt(i)) { i++; }

    return i == sym.length();
  }

  /**
   * Parse an identifier (which includes digit runs and '#' identifiers).
   * We consume identifier chars and then skip whitespace/comments. If what follows
   * is another identifier char we keep going, otherwise we back up to the end of the
   * last identifier char so that the token does not cover the trailing whitespace.
   */
  private Token parseIdentifier(Token token) {
    StringBuilder sb = new StringBuilder();
    int end;
    while (true) {
      while (available(1) && isRunChar(charAt(0))) {
        sb.append(charAt(0));
        advance(1);
      }
      end = offset;
      skipSpacesAndComments();
      if (!available(1) || !isRunChar(charAt(0))) {
        offset = end;
        break;
      }
    }

    String chars = sb.toString();
    return token.setType(isHashIdentifier(chars) ? HASH_IDENTIFIER : IDENTIFIER)
                .setChars(chars)
                .setEndOffset(end);
  }

  /**
   * '#' on its own or followed by a single digit 1-9 is the special '#' identifier.
   * Any other run containing '#' is just an ordinary identifier.
   */
  static boolean isHashIdentifier(String chars) {
    if (chars.equals("#")) {
      return true;
    }
    return chars.length() == 2 && chars.charAt(0) == '#' && chars.charAt(1) >= '1' && chars.charAt(1) <= '9';
  }

  /**
   * Strings are taken verbatim up to the next '"'. There are no escape chars and
   * strings can contain new lines and "//".
   */
  private Token parseString(Token token) {
    int start = offset + 1;
    int end   = source.indexOf('"', start);
    if (end == -1) {
      offset = length;
      token.setType(STRING_CONST).setChars(source.substring(start)).setEndOffset(offset);
      diagnostics.emit(Diagnostic.Kind.SYNTAX_ERROR, "Unterminated string", token);
      return token;
    }
    offset = end + 1;
    return token.setType(STRING_CONST)
                .setChars(source.substring(start, end))
                .setEndOffset(offset);
  }

  /**
   * Get character given number of positions ahead of current position
   * @param lookahead  how many characters ahead of current offset
   * @return character at given location
   */
  private char charAt(int lookahead) {
    return source.charAt(offset + lookahead);
  }

  private boolean available(int avail) {
    return offset + avail <= length;
  }

  private void advance(int count) {
    offset += count;
  }

  private static boolean isRunChar(char c) {
    return c == '#' || Utils.isIdentChar(c);
  }

  private void skipSpacesAndComments() {
    boolean inComment = false;
    for (; available(1); advance(1)) {
      char c = charAt(0);
      if (inComment) {
        if (c == '\n' || c == '\r') { inComment = false; }
        continue;
      }
      if (Utils.isWhitespace(c)) { continue; }
      if (c == '/' && available(2) && charAt(1) == '/') {
        inComment = true;
        advance(1);
        continue;
      }
      // If we have reached this far then we are not in a comment and we have something that
      // is not whitespace
      break;
    }
  }

  private Token createToken() {
    return new Token(source, offset);
  }

  //////////////////////////////////////////////////////////////////////

  // = INIT

  private static class Symbol {
    public final String    symbol;
    public final TokenType type;
    public Symbol(String symbol, TokenType type) {
      this.symbol = symbol;
      this.type   = type;
    }
    public int     length()           { return symbol.length(); }
    public char    charAt(int offset) { return symbol.charAt(offset); }
  }

  //
  // Array of symbols keyed on first char for efficient lookup. Each element in the array
  // is a list of symbols sorted with the longest first so that the first match is the
  // longest match. All symbol chars (including the degree sign) are below 256.
  //
  @SuppressWarnings("unchecked")
  private static final List<Symbol>[] symbolLookup = IntStream.range(0, 256)
                                                              .mapToObj(i -> new ArrayList<Symbol>())
                                                              .collect(Collectors.toList())
                                                              .toArray(new List[0]);

  static {
    Arrays.stream(TokenType.values())
          .filter(type -> type.asString != null)
          .map(type -> new Symbol(type.asString, type))
          .forEach(sym -> symbolLookup[sym.charAt(0)].add(sym));

    IntStream.range(0, 256).forEach(i -> symbolLookup[i].sort(Comparator.comparingInt(Symbol::length).reversed()));
  }
}
