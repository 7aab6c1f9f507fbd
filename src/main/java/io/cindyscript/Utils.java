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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public class Utils {

  /**
   * Chars that can make up an identifier: ASCII letters and digits, the apostrophe,
   * and any other letter in the Basic Multilingual Plane.
   * @param c  the char
   * @return true if identifier char
   */
  public static boolean isIdentChar(char c) {
    if (c < 128) {
      return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '\'';
    }
    return !Character.isSurrogate(c) && Character.isLetter(c);
  }

  public static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  /**
   * @param str  the string to check
   * @return true if every char is one of 0-9 (true for the empty string)
   */
  public static boolean isDigits(String str) {
    for (int i = 0; i < str.length(); i++) {
      char c = str.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  /**
   * Parse command line arguments.
   * Descriptor is a string of option letters. Each letter can be followed by ':' to
   * indicate that the option takes a value and '*' to indicate that the option can be
   * given multiple times. Options without values are counted.
   * Remaining (non-option) args are returned as a list under '*'.
   * @param args        the command line args
   * @param descriptor  the option descriptor
   * @param usage       usage message
   * @return map of option to value/count/list of values
   * @throws IllegalArgumentException if options are invalid
   */
  @SuppressWarnings("unchecked")
  public static Map<Character,Object> parseArgs(String[] args, String descriptor, String usage) {
    Consumer<String> error = msg -> {
      throw new IllegalArgumentException(msg + "\n" + usage);
    };
    final int OPT_VALUE = 1;
    final int OPT_MULTI = 2;
    Map<Character,Integer> options = new HashMap<>();
    for (int i = 0; i < descriptor.length();) {
      char opt = descriptor.charAt(i++);
      char c;
      int flags = 0;
      while (i < descriptor.length() && !Character.isAlphabetic(c = descriptor.charAt(i))) {
        switch (c) {
          case ':': flags |= OPT_VALUE;    break;
          case '*': flags |= OPT_MULTI;    break;
          default:  throw new IllegalArgumentException("Bad modifier for " + opt + ": '" + c + "'");
        }
        i++;
      }
      options.put(opt, flags);
    }

    Map<Character,Object> result = new HashMap<>();
    List<String> files = new ArrayList<>();
    int i;
    ARGS: for (i = 0; i < args.length; i++) {
      if (args[i].startsWith("-") && args[i].length() > 1) {
        for (int j = 1; j < args[i].length(); j++) {
          char opt = args[i].charAt(j);
          if (opt == '-') {
            i++;
            break ARGS;
          }
          Integer flags = options.get(opt);
          if (flags == null) {
            error.accept("Unknown option '-" + opt + "'");
          }
          if ((flags & OPT_VALUE) != 0) {
            String value = args[i].length() > j+1 ? args[i].substring(j+1) : i + 1 < args.length ? args[++i] : null;
            if (value == null) {
              error.accept("Missing value for option '-" + opt + "'");
            }
            if ((flags & OPT_MULTI) != 0) {
              List<String> values = (List<String>) result.computeIfAbsent(opt, k -> new ArrayList<String>());
              values.add(value);
            }
            else {
              if (result.containsKey(opt)) {
                error.accept("Multiple values specified for '-" + opt + "'");
              }
              result.put(opt, value);
            }
            break;
          }
          else {
            if (result.containsKey(opt) && (flags & OPT_MULTI) == 0) {
              error.accept("Multiple values specified for '-" + opt + "'");
            }
            // For options without values count how many times they appear
            Integer count = (Integer) result.get(opt);
            result.put(opt, count == null ? 1 : count + 1);
          }
        }
      }
      else {
        files.add(args[i]);
      }
    }
    files.addAll(Arrays.asList(args).subList(i, args.length));
    result.put('*', files);
    return result;
  }
}
