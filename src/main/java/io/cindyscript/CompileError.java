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
 * Error found in source code. Within the Parser this is thrown to abandon a statement
 * and is turned back into a Diagnostic by the statement level recovery. Hosts see it
 * when they ask a ParseResult to throw its errors, in which case it may hold a list
 * of errors.
 */
public class CompileError extends CindyError {

  private final Diagnostic.Kind  kind;
  private final List<CompileError> errors;

  /**
   * Create a compile error
   * @param error   the error message
   * @param location   the location where error occurred
   */
  public CompileError(String error, Location location) {
    this(Diagnostic.Kind.SYNTAX_ERROR, error, location);
  }

  public CompileError(Diagnostic.Kind kind, String error, Location location) {
    super(error, location, false);
    this.kind   = kind;
    this.errors = null;
  }

  public CompileError(Diagnostic diagnostic) {
    this(diagnostic.getKind(), diagnostic.getMessage(), diagnostic.getLocation());
  }

  public CompileError(List<CompileError> errors) {
    super(null, null, true);
    this.kind   = null;
    this.errors = List.copyOf(errors);
  }

  public Diagnostic.Kind getKind() {
    return kind;
  }

  public List<CompileError> getErrors() {
    return errors == null ? List.of(this) : errors;
  }

  /**
   * Convert back into a diagnostic so it can be recorded
   * @return the diagnostic for this error
   */
  public Diagnostic toDiagnostic() {
    if (errors != null) {
      throw new IllegalStateException("Internal error: cannot convert multiple errors into a single diagnostic");
    }
    return new Diagnostic(kind, getErrorMessage(), getLocation());
  }

  @Override
  public String getMessage() {
    if (errors == null) {
      return super.getMessage();
    }
    return String.format("%d error%s found:\n", errors.size(), errors.size() > 1 ? "s" : "") +
           errors.stream().map(CompileError::getMessage).collect(Collectors.joining("\n")) + "\n";
  }
}
