/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class GlobMatcherTest {

  @Test
  void starMatchesAnySequence() {
    assertThat(GlobMatcher.matches("cpu", "*")).isTrue();
    assertThat(GlobMatcher.matches("", "*")).isTrue();
    assertThat(GlobMatcher.matches("disk.read.bytes", "disk.*")).isTrue();
    assertThat(GlobMatcher.matches("disk", "disk.*")).isFalse();
  }

  @Test
  void questionMarkMatchesSingleCharacter() {
    assertThat(GlobMatcher.matches("cpu1", "cpu?")).isTrue();
    assertThat(GlobMatcher.matches("cpu", "cpu?")).isFalse();
    assertThat(GlobMatcher.matches("cpu12", "cpu?")).isFalse();
  }

  @Test
  void characterClasses() {
    assertThat(GlobMatcher.matches("vm-a", "vm-[abc]")).isTrue();
    assertThat(GlobMatcher.matches("vm-d", "vm-[abc]")).isFalse();
    assertThat(GlobMatcher.matches("vm-d", "vm-[!abc]")).isTrue();
    assertThat(GlobMatcher.matches("vm-7", "vm-[0-9]")).isTrue();
    assertThat(GlobMatcher.matches("a]", "a[]]")).isTrue();
  }

  @Test
  void regexMetacharactersAreLiteral() {
    assertThat(GlobMatcher.matches("disk.read", "disk.read")).isTrue();
    assertThat(GlobMatcher.matches("diskXread", "disk.read")).isFalse();
    assertThat(GlobMatcher.matches("a+b", "a+b")).isTrue();
    assertThat(GlobMatcher.matches("a(b)", "a(b)")).isTrue();
  }

  @Test
  void unclosedBracketIsLiteral() {
    assertThat(GlobMatcher.matches("[abc", "[abc")).isTrue();
    assertThat(GlobMatcher.matches("a", "[abc")).isFalse();
  }

  @Test
  void matchesAnyPattern() {
    GlobMatcher matcher = GlobMatcher.of(Arrays.asList("cpu*", "memory.usage"));

    assertThat(matcher.isEmpty()).isFalse();
    assertThat(matcher.getGlobs()).containsExactly("cpu*", "memory.usage");
    assertThat(matcher.matchesAny("cpu_util")).isTrue();
    assertThat(matcher.matchesAny("memory.usage")).isTrue();
    assertThat(matcher.matchesAny("network.incoming.bytes")).isFalse();
  }

  @Test
  void emptyMatcherMatchesNothing() {
    GlobMatcher matcher = GlobMatcher.of(Collections.emptyList());

    assertThat(matcher.isEmpty()).isTrue();
    assertThat(matcher.matchesAny("cpu")).isFalse();
  }
}
