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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only collector of the diagnostics for one parse. Each parse gets its own
 * instance so that concurrent parses never share state.
 *
 * Once the error limit has been reached further errors are counted but not kept
 * and a single "Too many errors" diagnostic is added in their place. Warnings are
 * not subject to the limit.
 */
public class Diagnostics {
  private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final int              maxErrors;
  private       int              errorCount  = 0;

  public Diagnostics() {
    this(ParserContext.DEFAULT_MAX_ERRORS);
  }

  public Diagnostics(int maxErrors) {
    if (maxErrors < 1) {
      throw new IllegalArgumentException("maxErrors must be at least 1 but was " + maxErrors);
    }
    this.maxErrors = maxErrors;
  }

  /**
   * Record a diagnostic
   * @param kind      the kind of problem
   * @param message   human readable message
   * @param location  where in the source the problem is
   * @return the diagnostic created (returned even if dropped due to the error limit)
   */
  public Diagnostic emit(Diagnostic.Kind kind, String message, Location location) {
    return add(new Diagnostic(kind, message, location));
  }

  public Diagnostic warn(Diagnostic.Kind kind, String message, Location location) {
    return add(new Diagnostic(kind, Diagnostic.Severity.WARNING, message, location));
  }

  public Diagnostic add(Diagnostic diagnostic) {
    if (diagnostic.isError()) {
      errorCount++;
      if (errorCount > maxErrors) {
        if (errorCount == maxErrors + 1) {
          diagnostics.add(new Diagnostic(Diagnostic.Kind.SYNTAX_ERROR, "Too many errors (limit is " + maxErrors + ")", diagnostic.getLocation()));
        }
        LOG.trace("Dropping diagnostic beyond error limit: {}", diagnostic.getSingleLineMessage());
        return diagnostic;
      }
    }
    LOG.trace("Diagnostic: {}", diagnostic.getSingleLineMessage());
    diagnostics.add(diagnostic);
    return diagnostic;
  }

  /**
   * Record an error and return the Undefined sentinel that stands in for whatever
   * could not be produced.
   * @param kind      the kind of problem
   * @param message   human readable message
   * @param location  where in the source the problem is
   * @return Undefined node carrying the diagnostic
   */
  public Expr.Undefined undefined(Diagnostic.Kind kind, String message, Location location) {
    return undefined(kind, message, location, null);
  }

  /**
   * Record an error and return Undefined that remembers the expression it replaced
   * so that consumers can still traverse the original shape.
   */
  public Expr.Undefined undefined(Diagnostic.Kind kind, String message, Location location, Expr replaced) {
    return new Expr.Undefined(location, emit(kind, message, location), replaced);
  }

  public List<Diagnostic> all() {
    return Collections.unmodifiableList(diagnostics);
  }

  public List<Diagnostic> errors() {
    return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
  }

  public List<Diagnostic> warnings() {
    return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
  }

  public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
    return diagnostics.stream().filter(d -> d.getKind() == kind).collect(Collectors.toList());
  }

  public boolean hasErrors()  { return errorCount > 0; }
  public int     errorCount() { return errorCount; }
  public boolean isEmpty()    { return diagnostics.isEmpty(); }
  public int     size()       { return diagnostics.size(); }

  @Override
  public String toString() {
    return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
  }
}
