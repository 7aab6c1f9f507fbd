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
import java.util.List;

/**
 * A span of source code. Locations are used by tokens, AST nodes and diagnostics.
 * Line and column numbers (both starting at 1) are only calculated when first asked
 * for since most locations are never reported.
 */
public class Location {
  protected String source;       // Source code of the script being parsed
  protected int    offset;       // The position/offset in source where the span starts
  protected int    endOffset;    // Offset just after the last char of the span
  protected String line;         // The source line
  protected int    lineNum = -1; // Line number where span starts
  protected int    column  = -1; // Column where span starts

  public Location(String source, int offset, int endOffset) {
    if (offset < 0 || endOffset < offset) {
      throw new IllegalArgumentException("Invalid span " + offset + ".." + endOffset);
    }
    this.source    = source;
    this.offset    = offset;
    this.endOffset = endOffset;
  }

  public Location(Location location) {
    this(location.source, location.offset, location.endOffset);
    this.line    = location.line;
    this.lineNum = location.lineNum;
    this.column  = location.column;
  }

  /**
   * Create a location spanning from the start of one location to the end of another
   * @param start  the first location
   * @param end    the last location
   * @return the combined span
   */
  public static Location span(Location start, Location end) {
    return new Location(start.source, start.offset, Math.max(start.offset, end.endOffset));
  }

  /**
   * Plain copy of a location that does not keep a Token (and through it the rest of the
   * token stream) alive. Locations that are not Tokens are returned as is.
   * @param location  the location (may be null)
   * @return location that is not a Token
   */
  public static Location detached(Location location) {
    return location instanceof Token ? new Location(location) : location;
  }

  public String  getSource()     { return source; }
  public int     getOffset()     { return offset; }
  public int     getEndOffset()  { return endOffset; }
  public int     getLength()     { return endOffset - offset; }

  /**
   * Raw source text covered by this location (including any whitespace or comments
   * that were folded out of the token)
   * @return the text of the span
   */
  public String getSourceText() {
    return source.substring(offset, endOffset);
  }

  public String getLine() {
    calculateLineAndColumn();
    return line;
  }

  public int getLineNum() {
    calculateLineAndColumn();
    return lineNum;
  }

  public int getColumn() {
    calculateLineAndColumn();
    return column;
  }

  /**
   * Get the line of source code with an additional line showing where the span starts (used for errors)
   * @return the source code showing the location
   */
  public String getMarkedSourceLine() {
    calculateLineAndColumn();
    return String.format("%s%n%s^", line, " ".repeat(column - 1));
  }

  private void calculateLineAndColumn() {
    if (lineNum != -1 || source == null) {
      return;
    }
    List<String> lines = lines(source);
    int pos   = 0;
    int i;
    for (i = 0; i < lines.size(); i++) {
      pos += lines.get(i).length() + 1;  // Include extra char for the newline
      if (offset < pos) {
        break;
      }
    }
    if (i == lines.size()) {
      throw new IllegalStateException("Internal error: offset of " + offset + " too large for source of length " + source.length());
    }

    // Remember the line and the line number/column number (which both start at 1, not 0)
    line    = lines.get(i);
    lineNum = i + 1;
    column  = offset - (pos - line.length() - 1) + 1;
    line    = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }

  static List<String> lines(String str) {
    List<String> lines = new ArrayList<>();
    int offset;
    int lastOffset = 0;
    while ((offset = str.indexOf('\n', lastOffset)) != -1) {
      lines.add(str.substring(lastOffset, offset));
      lastOffset = offset + 1;  // skip new line
    }
    lines.add(str.substring(lastOffset));
    return lines;
  }

  @Override
  public String toString() {
    return "[" + offset + ".." + endOffset + ")";
  }
}
