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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <p>Entry point for parsing CindyScript source code.</p>
 * <p>Parsing never throws for bad input: the returned {@link ParseResult} holds the tree
 * (with Undefined nodes where there were problems) and all diagnostics. Use
 * {@link ParseResult#throwIfErrors()} if an exception is preferred.</p>
 * <p>This class also provides a main() method that parses a script and prints the tree
 * (or the tokens) to stdout and any diagnostics to stderr.</p>
 */
public class CindyScript {

  /**
   * Parse source code with the default context
   * @param source  the source code
   * @return the result of the parse
   */
  public static ParseResult parse(String source) {
    return parse(source, ParserContext.defaultContext());
  }

  /**
   * Parse source code
   * @param source   the source code
   * @param context  the ParserContext
   * @return the result of the parse
   */
  public static ParseResult parse(String source, ParserContext context) {
    Diagnostics diagnostics = new Diagnostics(context.maxErrors());
    Tokeniser   tokeniser   = new Tokeniser(source, diagnostics);
    Parser      parser      = new Parser(tokeniser, context, diagnostics);
    return new ParseResult(source, parser.parse(), diagnostics);
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  ////////////////////////////////////

  final static String usage =
    "Usage: cindyscript [options] [scriptFile]\n" +
    "         -e script : parse script string instead of reading scriptFile (or stdin)\n" +
    "         -t        : print tokens instead of parse tree\n" +
    "         -W        : do not print warnings\n" +
    "         -d        : debug: log parse tree (-dd to log tokens as well)\n" +
    "         -h        : print this help\n";

  /**
   * Run from the command line
   * @return exit code: 0 if no errors, 1 if errors were found or the args were invalid
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    try {
      Map<Character,Object> argMap = Utils.parseArgs(args, "e:tWd*h", usage);
      if (argMap.containsKey('h')) {
        out.print(usage);
        return 0;
      }
      @SuppressWarnings("unchecked")
      List<String> files  = (List<String>) argMap.get('*');
      String       source = readSource(argMap, files, in);

      if (argMap.containsKey('t')) {
        Diagnostics diagnostics = new Diagnostics();
        Tokeniser.scan(source, diagnostics).forEach(token -> out.println(token.getType() + " " + token.getSourceText()));
        printDiagnostics(diagnostics, argMap.containsKey('W'), err);
        return diagnostics.hasErrors() ? 1 : 0;
      }

      ParserContext context = ParserContext.create()
                                           .debug(argMap.containsKey('d') ? (int)argMap.get('d') : 0)
                                           .build();
      ParseResult result = parse(source, context);
      out.println(ExprPrinter.print(result.getRoot()));
      printDiagnostics(result.getDiagnostics(), argMap.containsKey('W'), err);
      return result.hasErrors() ? 1 : 0;
    }
    catch (IllegalArgumentException | IOException e) {
      err.println(e.getMessage());
      return 1;
    }
  }

  private static String readSource(Map<Character,Object> argMap, List<String> files, InputStream in) throws IOException {
    if (argMap.containsKey('e')) {
      if (!files.isEmpty()) {
        throw new IllegalArgumentException("Cannot specify scriptFile with '-e'\n" + usage);
      }
      return (String) argMap.get('e');
    }
    if (files.size() > 1) {
      throw new IllegalArgumentException("Only one scriptFile can be given\n" + usage);
    }
    if (files.size() == 1) {
      return new String(Files.readAllBytes(Paths.get(files.get(0))), StandardCharsets.UTF_8);
    }
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    return reader.lines().collect(Collectors.joining("\n"));
  }

  private static void printDiagnostics(Diagnostics diagnostics, boolean suppressWarnings, PrintStream err) {
    diagnostics.all().stream()
               .filter(d -> d.isError() || !suppressWarnings)
               .forEach(err::println);
  }
}
