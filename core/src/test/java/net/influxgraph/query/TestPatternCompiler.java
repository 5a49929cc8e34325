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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.regex.Pattern;

import org.junit.Test;

import net.influxgraph.exceptions.PatternException;

public class TestPatternCompiler {

  @Test
  public void compileWildcard() throws Exception {
    final Pattern pattern = PatternCompiler.compile("^{0}$",
        new Query("metric_prefix.*"));
    assertEquals("^metric_prefix\\.[^\\.]*$", pattern.pattern());
    assertTrue(pattern.matcher("metric_prefix.leaf").matches());
    assertTrue(pattern.matcher("metric_prefix.").matches());
    assertFalse(pattern.matcher("metric_prefix.leaf.deeper").matches());
    assertFalse(pattern.matcher("metric_prefixXleaf").matches());
    assertFalse(pattern.matcher("other.metric_prefix.leaf").matches());
  }

  @Test
  public void starNeverCrossesDelimiter() throws Exception {
    final String[] globs = new String[] { "*", "a*", "*b", "a*b*c", "??",
        "[ab]*", "a[!b]b", "a[^X]bc", "[!a]", "a[a-z]b", "a[!a-z]b*",
        "[^x]?" };
    final String[] candidates = new String[] {
        "a.b", "ab.c", "a.bc", ".", "a.", ".b", "aXb.c" };
    for (final String glob : globs) {
      final Pattern pattern = PatternCompiler.compile(
          PatternCompiler.FULL_MATCH, glob);
      for (final String candidate : candidates) {
        assertFalse(glob + " matched " + candidate,
            pattern.matcher(candidate).matches());
      }
    }
  }

  @Test
  public void questionMark() throws Exception {
    final Pattern pattern = PatternCompiler.compile("^{0}$", "host?.cpu");
    assertEquals("^host[^\\.]\\.cpu$", pattern.pattern());
    assertTrue(pattern.matcher("host1.cpu").matches());
    assertFalse(pattern.matcher("host.cpu").matches());
    assertFalse(pattern.matcher("host12.cpu").matches());
  }

  @Test
  public void characterClasses() throws Exception {
    Pattern pattern = PatternCompiler.compile("^{0}$", "host[12].cpu");
    assertEquals("^host[12]\\.cpu$", pattern.pattern());
    assertTrue(pattern.matcher("host1.cpu").matches());
    assertFalse(pattern.matcher("host3.cpu").matches());

    pattern = PatternCompiler.compile("^{0}$", "host[a-c]");
    assertTrue(pattern.matcher("hostb").matches());
    assertFalse(pattern.matcher("hostd").matches());

    pattern = PatternCompiler.compile("^{0}$", "host[!a-c]");
    assertEquals("^host[^a-c\\.]$", pattern.pattern());
    assertTrue(pattern.matcher("hostd").matches());
    assertFalse(pattern.matcher("hosta").matches());
    assertFalse(pattern.matcher("host.").matches());

    pattern = PatternCompiler.compile("^{0}$", "host[^1]");
    assertTrue(pattern.matcher("host2").matches());
    assertFalse(pattern.matcher("host.").matches());

    // trailing and leading dashes are literal
    pattern = PatternCompiler.compile("^{0}$", "a[-x]b[y-]");
    assertTrue(pattern.matcher("a-by").matches());
    assertTrue(pattern.matcher("axb-").matches());
  }

  @Test
  public void braces() throws Exception {
    Pattern pattern = PatternCompiler.compile("^{0}$", "cpu.{user,system}");
    assertEquals("^cpu\\.(?:user|system)$", pattern.pattern());
    assertTrue(pattern.matcher("cpu.user").matches());
    assertTrue(pattern.matcher("cpu.system").matches());
    assertFalse(pattern.matcher("cpu.idle").matches());

    // nested with wildcards
    pattern = PatternCompiler.compile("^{0}$", "{a,b{1,2}*}.x");
    assertTrue(pattern.matcher("a.x").matches());
    assertTrue(pattern.matcher("b1.x").matches());
    assertTrue(pattern.matcher("b2foo.x").matches());
    assertFalse(pattern.matcher("b3.x").matches());

    // alternatives may span the delimiter explicitly
    pattern = PatternCompiler.compile("^{0}$", "{a.b,c}.d");
    assertTrue(pattern.matcher("a.b.d").matches());
    assertTrue(pattern.matcher("c.d").matches());

    // empty alternative
    pattern = PatternCompiler.compile("^{0}$", "cpu{,s}");
    assertTrue(pattern.matcher("cpu").matches());
    assertTrue(pattern.matcher("cpus").matches());

    // a comma outside of braces is literal
    pattern = PatternCompiler.compile("^{0}$", "a,b");
    assertTrue(pattern.matcher("a,b").matches());
  }

  @Test
  public void literalsEscaped() throws Exception {
    final Pattern pattern = PatternCompiler.compile("^{0}$",
        "a+b.c(d)|e$f^g");
    assertTrue(pattern.matcher("a+b.c(d)|e$f^g").matches());
    assertFalse(pattern.matcher("aab.cd").matches());

    final Pattern escaped = PatternCompiler.compile("^{0}$", "a\\*b");
    assertTrue(escaped.matcher("a*b").matches());
    assertFalse(escaped.matcher("aXb").matches());
  }

  @Test
  public void templates() throws Exception {
    final Pattern prefix = PatternCompiler.compile("^{0}", "a.b*");
    assertEquals("^a\\.b[^\\.]*", prefix.pattern());
    assertTrue(prefix.matcher("a.bc.d").find());

    try {
      PatternCompiler.compile("^$", "a");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      PatternCompiler.compile(null, "a");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      PatternCompiler.compile("^{0}$", (Query) null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void malformed() throws Exception {
    final String[] globs = new String[] {
        "a.[bc", "a.bc]", "a.{b,c", "a.b}", "a.[]", "a.[!]", "a[b.c]",
        "a.b\\", "a.[z-a]", "{a,{b}", "a[,-/]b", "[+-0]", "a[!,-/]b",
        "a[\\,-\\/]b" };
    for (final String glob : globs) {
      try {
        PatternCompiler.compile(PatternCompiler.FULL_MATCH, glob);
        fail("Expected PatternException for " + glob);
      } catch (PatternException e) {
        assertEquals(glob, e.getPattern());
      }
    }
  }

  @Test
  public void rangeSpanningDelimiter() throws Exception {
    try {
      PatternCompiler.compile(PatternCompiler.FULL_MATCH, "a[,-/]b");
      fail("Expected PatternException");
    } catch (PatternException e) {
      assertEquals("a[,-/]b", e.getPattern());
    }
    // ranges on either side of the delimiter are fine
    final Pattern pattern = PatternCompiler.compile(
        PatternCompiler.FULL_MATCH, "a[/-9]b[!-]");
    assertTrue(pattern.matcher("a5bx").matches());
    assertFalse(pattern.matcher("a.bx").matches());
    assertFalse(pattern.matcher("a5b.").matches());
  }

  @Test
  public void pure() throws Exception {
    final String first = PatternCompiler.translate("a.{b,c*}.[!d]?");
    try {
      PatternCompiler.translate("x.[y");
      fail("Expected PatternException");
    } catch (PatternException e) { }
    assertEquals(first, PatternCompiler.translate("a.{b,c*}.[!d]?"));
  }

  @Test
  public void literalPrefix() throws Exception {
    assertEquals("integration_test.leaf",
        PatternCompiler.literalPrefix("integration_test.leaf*"));
    assertEquals("", PatternCompiler.literalPrefix("*"));
    assertEquals("a.", PatternCompiler.literalPrefix("a.{b,c}"));
    assertEquals("a.b", PatternCompiler.literalPrefix("a.b"));
    assertEquals("a", PatternCompiler.literalPrefix("a[12]"));
  }

  @Test
  public void escape() throws Exception {
    assertEquals("a\\.b_c\\*\\(\\)", PatternCompiler.escape("a.b_c*()"));
  }

  @Test
  public void query() throws Exception {
    assertTrue(new Query("a.*").hasWildcards());
    assertFalse(new Query("a.b").hasWildcards());
    assertEquals(new Query("a.b"), new Query("a.b"));
    try {
      new Query("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
