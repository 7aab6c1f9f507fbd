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
 * Result of parsing a script: the root Sequence (always present, even when there were
 * errors) and the diagnostics that were emitted while parsing.
 */
public class ParseResult {
  private final String        source;
  private final Expr.Sequence root;
  private final Diagnostics   diagnostics;

  ParseResult(String source, Expr.Sequence root, Diagnostics diagnostics) {
    this.source      = source;
    this.root        = root;
    this.diagnostics = diagnostics;
  }

  public String        getSource()      { return source; }
  public Expr.Sequence getRoot()        { return root; }
  public Diagnostics   getDiagnostics() { return diagnostics; }

  public boolean hasErrors() {
    return diagnostics.hasErrors();
  }

  /**
   * Errors (not warnings) as CompileErrors in the order they were found
   * @return list of errors which is empty if the parse was clean
   */
  public List<CompileError> getErrors() {
    return diagnostics.errors().stream().map(CompileError::new).collect(Collectors.toList());
  }

  /**
   * For callers that prefer exceptions: throw if there were any errors.
   * A single error is thrown as is, multiple errors are wrapped in one CompileError.
   * @return the root of the tree if there were no errors
   * @throws CompileError if there were errors
   */
  public Expr.Sequence throwIfErrors() {
    List<CompileError> errors = getErrors();
    if (errors.size() == 1) {
      throw errors.get(0);
    }
    if (errors.size() > 1) {
      throw new CompileError(errors);
    }
    return root;
  }

  @Override
  public String toString() {
    return diagnostics.isEmpty() ? ExprPrinter.print(root)
                                 : ExprPrinter.print(root) + "\n" + diagnostics;
  }
}
