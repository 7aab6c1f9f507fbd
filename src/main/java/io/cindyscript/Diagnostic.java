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
 * A single problem found while scanning or parsing. Diagnostics never stop a
 * parse: the parser records them and substitutes an Undefined node.
 */
public final class Diagnostic {

  public enum Kind {
    LEXICAL_PASSTHROUGH,   // Character that belongs to no token class
    SYNTAX_ERROR,          // Malformed brackets, bad prefix/postfix use, unsupported operator
    INVALID_LVALUE,        // Assignment target is not assignable
    STRUCTURAL_RESERVED,   // Reserved bracket shapes such as {} or |a,b,c|
    DEPRECATION;           // Still supported but should not be used

    public Severity defaultSeverity() {
      return this == DEPRECATION ? Severity.WARNING : Severity.ERROR;
    }
  }

  public enum Severity { ERROR, WARNING }

  private final Kind     kind;
  private final Severity severity;
  private final String   message;
  private final Location location;

  public Diagnostic(Kind kind, String message, Location location) {
    this(kind, kind.defaultSeverity(), message, location);
  }

  public Diagnostic(Kind kind, Severity severity, String message, Location location) {
    if (kind == null || severity == null || message == null) {
      throw new IllegalArgumentException("Diagnostic requires kind, severity and message");
    }
    this.kind     = kind;
    this.severity = severity;
    this.message  = message;
    this.location = Location.detached(location);
  }

  public Kind     getKind()     { return kind; }
  public Severity getSeverity() { return severity; }
  public String   getMessage()  { return message; }
  public Location getLocation() { return location; }
  public boolean  isError()     { return severity == Severity.ERROR; }

  public String getSingleLineMessage() {
    if (location == null || location.getSource() == null) {
      return String.format("%s @ unknown location", message);
    }
    return String.format("%s @ line %d, column %d", message, location.getLineNum(), location.getColumn());
  }

  @Override
  public String toString() {
    String prefix = severity == Severity.WARNING ? "Warning: " : "";
    if (location == null || location.getSource() == null) {
      return prefix + getSingleLineMessage();
    }
    return prefix + getSingleLineMessage() + "\n" + location.getMarkedSourceLine();
  }
}
