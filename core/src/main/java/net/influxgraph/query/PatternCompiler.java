// This file is part of influxgraph.
// Copyright (C) 2026  The influxgraph Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.influxgraph.query;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.influxgraph.exceptions.PatternException;

/**
 * Translates glob patterns over dotted paths into anchored regular
 * expressions. Wildcards never cross the "." delimiter unless a brace
 * alternative spells one out.
 * <ul>
 * <li>{@code .} the delimiter, matched literally.</li>
 * <li>{@code *} any run of characters within one segment.</li>
 * <li>{@code ?} exactly one character within one segment.</li>
 * <li>{@code [abc]}, {@code [a-z]} a character class. {@code [!abc]} and
 * {@code [^abc]} negate it and never match the delimiter. Neither a
 * member nor a range may include the delimiter.</li>
 * <li>{@code {a,b}} alternation, nestable. Alternatives follow the same
 * rules.</li>
 * <li>{@code \x} the character x literally.</li>
 * </ul>
 * Everything else is matched literally. The translation is a pure function
 * of its input.
 */
public final class PatternCompiler {

  /** The path delimiter. */
  public static final char DELIMITER = '.';

  /** The substitution point in templates. */
  public static final String PLACEHOLDER = "{0}";

  /** Anchors the translated pattern at both ends. */
  public static final String FULL_MATCH = "^" + PLACEHOLDER + "$";

  /** Characters escaped outside of classes. */
  private static final String REGEX_META = "\\^$.|?*+()[]{}";

  /** Characters escaped inside of classes. */
  private static final String CLASS_META = "\\^[]&-";

  /** Characters that end the literal prefix of a glob. */
  private static final String GLOB_META = "*?[]{}\\";

  private static final Joiner ALTERNATION = Joiner.on('|');

  private PatternCompiler() {
    // static helpers only
  }

  /**
   * Compiles the query into a matcher.
   * @param template A template with one {@link #PLACEHOLDER}, e.g.
   * {@link #FULL_MATCH}.
   * @param query A non-null query.
   * @return The compiled pattern. Call {@code matcher(path).matches()}.
   * @throws IllegalArgumentException if the template or query was null or
   * the template lacked the placeholder.
   * @throws PatternException if the glob was malformed.
   */
  public static Pattern compile(final String template, final Query query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    return compile(template, query.pattern());
  }

  /**
   * Compiles the glob into a matcher.
   * @param template A template with one {@link #PLACEHOLDER}.
   * @param glob A non-null glob.
   * @return The compiled pattern.
   * @throws IllegalArgumentException if the template or glob was null or
   * the template lacked the placeholder.
   * @throws PatternException if the glob was malformed.
   */
  public static Pattern compile(final String template, final String glob) {
    if (template == null || !template.contains(PLACEHOLDER)) {
      throw new IllegalArgumentException("Template must contain "
          + PLACEHOLDER + ": " + template);
    }
    if (glob == null) {
      throw new IllegalArgumentException("Glob cannot be null.");
    }
    final String regex = template.replace(PLACEHOLDER, translate(glob));
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new PatternException("Invalid expression " + regex
          + " (" + e.getDescription() + ")", glob, -1);
    }
  }

  /**
   * Translates the glob into an unanchored regular expression body.
   * @param glob A non-null glob.
   * @return The regular expression.
   * @throws PatternException if the glob was malformed.
   */
  public static String translate(final String glob) {
    final Translator translator = new Translator(glob);
    final String regex = translator.sequence(false);
    if (translator.idx < glob.length()) {
      // sequence(false) only stops early on a stray closing brace
      throw new PatternException("Unbalanced '}'", glob, translator.idx);
    }
    return regex;
  }

  /**
   * Escapes the literal so it matches itself. Only regex metacharacters are
   * escaped so the result also works with RE2 based stores.
   * @param literal A non-null literal.
   * @return The escaped string.
   */
  public static String escape(final String literal) {
    final StringBuilder buf = new StringBuilder(literal.length() + 8);
    for (int i = 0; i < literal.length(); i++) {
      final char c = literal.charAt(i);
      if (REGEX_META.indexOf(c) >= 0) {
        buf.append('\\');
      }
      buf.append(c);
    }
    return buf.toString();
  }

  /**
   * @param glob A non-null glob.
   * @return The leading part of the glob up to the first glob
   * metacharacter. The whole glob if it has none.
   */
  public static String literalPrefix(final String glob) {
    for (int i = 0; i < glob.length(); i++) {
      if (GLOB_META.indexOf(glob.charAt(i)) >= 0) {
        return glob.substring(0, i);
      }
    }
    return glob;
  }

  /** Recursive descent over one glob. */
  private static final class Translator {
    private final String glob;
    private int idx;

    Translator(final String glob) {
      this.glob = glob;
    }

    /**
     * Translates until the end of the glob or, inside a brace, until an
     * unconsumed ',' or '}'.
     */
    String sequence(final boolean in_brace) {
      final StringBuilder buf = new StringBuilder();
      while (idx < glob.length()) {
        final char c = glob.charAt(idx);
        switch (c) {
        case DELIMITER:
          buf.append("\\.");
          idx++;
          break;
        case '*':
          buf.append("[^\\.]*");
          idx++;
          break;
        case '?':
          buf.append("[^\\.]");
          idx++;
          break;
        case '[':
          characterClass(buf);
          break;
        case ']':
          throw new PatternException("Unbalanced ']'", glob, idx);
        case '{':
          alternation(buf);
          break;
        case '}':
          // the caller decides if it closes a brace or is stray
          return buf.toString();
        case ',':
          if (in_brace) {
            return buf.toString();
          }
          buf.append(c);
          idx++;
          break;
        case '\\':
          if (idx + 1 >= glob.length()) {
            throw new PatternException("Trailing escape", glob, idx);
          }
          buf.append(escape(String.valueOf(glob.charAt(idx + 1))));
          idx += 2;
          break;
        default:
          buf.append(escape(String.valueOf(c)));
          idx++;
        }
      }
      return buf.toString();
    }

    private void alternation(final StringBuilder buf) {
      final int open = idx++;
      final List<String> alternatives = Lists.newArrayList();
      while (true) {
        alternatives.add(sequence(true));
        if (idx >= glob.length()) {
          throw new PatternException("Unclosed '{'", glob, open);
        }
        final char c = glob.charAt(idx++);
        if (c == '}') {
          break;
        }
      }
      buf.append("(?:")
         .append(ALTERNATION.join(alternatives))
         .append(')');
    }

    private void characterClass(final StringBuilder buf) {
      final int open = idx++;
      boolean negate = false;
      if (idx < glob.length()
          && (glob.charAt(idx) == '!' || glob.charAt(idx) == '^')) {
        negate = true;
        idx++;
      }
      final int body_start = idx;
      final StringBuilder body = new StringBuilder();
      char prev = 0;
      while (true) {
        if (idx >= glob.length()) {
          throw new PatternException("Unclosed '['", glob, open);
        }
        final char c = glob.charAt(idx);
        if (c == ']') {
          break;
        }
        if (c == DELIMITER) {
          throw new PatternException("The delimiter cannot appear in a "
              + "character class", glob, idx);
        }
        if (c == '-' && idx > body_start && idx + 1 < glob.length()
            && glob.charAt(idx + 1) != ']') {
          final int end_idx = glob.charAt(idx + 1) == '\\'
              && idx + 2 < glob.length() ? idx + 2 : idx + 1;
          if (prev < DELIMITER && glob.charAt(end_idx) > DELIMITER) {
            throw new PatternException("A character class range cannot span "
                + "the delimiter", glob, idx);
          }
          body.append('-');
        } else if (c == '\\' && idx + 1 < glob.length()
            && glob.charAt(idx + 1) != DELIMITER) {
          idx++;
          prev = glob.charAt(idx);
          appendClassChar(body, prev);
        } else {
          prev = c;
          appendClassChar(body, c);
        }
        idx++;
      }
      if (body.length() == 0) {
        throw new PatternException("Empty character class", glob, open);
      }
      idx++;
      buf.append('[');
      if (negate) {
        buf.append('^');
      }
      buf.append(body);
      if (negate) {
        buf.append("\\.");
      }
      buf.append(']');
    }

    private static void appendClassChar(final StringBuilder body,
                                        final char c) {
      if (CLASS_META.indexOf(c) >= 0) {
        body.append('\\');
      }
      body.append(c);
    }
  }
}
