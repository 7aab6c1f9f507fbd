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
 * Options controlling a parse. Create with:
 * <pre>
 *   ParserContext context = ParserContext.create()
 *                                        .deprecationWarnings(false)
 *                                        .maxErrors(10)
 *                                        .build();
 * </pre>
 * A context cannot be changed once built so one context can be shared by any number
 * of concurrent parses.
 */
public class ParserContext {

  public static final int DEFAULT_MAX_ERRORS = 100;

  // Level 1 logs the parsed tree, level 2 also logs every token
  int     debugLevel          = 0;
  boolean deprecationWarnings = true;
  int     maxErrors           = DEFAULT_MAX_ERRORS;

  private boolean built = false;

  ///////////////////////////////

  public static ParserContextBuilder create() {
    return new ParserContext().getParserContextBuilder();
  }

  /**
   * Context with all options at their default values
   * @return default context
   */
  public static ParserContext defaultContext() {
    return create().build();
  }

  private ParserContext() {}

  private ParserContextBuilder getParserContextBuilder() {
    return new ParserContextBuilder();
  }

  public class ParserContextBuilder {
    private ParserContextBuilder() {}

    public ParserContextBuilder debug(int value)                  { checkNotBuilt(); debugLevel          = value; return this; }
    public ParserContextBuilder deprecationWarnings(boolean value) { checkNotBuilt(); deprecationWarnings = value; return this; }

    public ParserContextBuilder maxErrors(int value) {
      checkNotBuilt();
      if (value < 1) {
        throw new IllegalArgumentException("maxErrors must be at least 1 but was " + value);
      }
      maxErrors = value;
      return this;
    }

    public ParserContext build() {
      checkNotBuilt();
      built = true;
      return ParserContext.this;
    }

    private void checkNotBuilt() {
      if (built) {
        throw new IllegalStateException("ParserContext has already been built");
      }
    }
  }

  //////////////////////////////////

  public int     debugLevel()          { return debugLevel; }
  public boolean deprecationWarnings() { return deprecationWarnings; }
  public int     maxErrors()           { return maxErrors; }
}
