/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell 风格通配符匹配器。
 *
 * <p>支持 {@code *}、{@code ?}、{@code [abc]} 和 {@code [!abc]}，大小写敏感。
 */
public final class GlobMatcher {

  private final List<String> globs;
  private final List<Pattern> patterns;

  private GlobMatcher(Collection<String> globs) {
    this.globs = Collections.unmodifiableList(new ArrayList<>(globs));
    List<Pattern> compiled = new ArrayList<>(globs.size());
    for (String glob : globs) {
      compiled.add(Pattern.compile(toRegex(glob)));
    }
    this.patterns = compiled;
  }

  /**
   * 创建匹配器
   *
   * @param globs 通配符列表
   * @return 匹配器
   */
  public static GlobMatcher of(Collection<String> globs) {
    return new GlobMatcher(globs);
  }

  /**
   * 判断名称是否匹配任意一个通配符
   *
   * @param name 名称
   * @return 是否匹配
   */
  public boolean matchesAny(String name) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(name).matches()) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return patterns.isEmpty();
  }

  public List<String> getGlobs() {
    return globs;
  }

  /**
   * 单个通配符匹配
   *
   * @param name 名称
   * @param glob 通配符
   * @return 是否匹配
   */
  public static boolean matches(String name, String glob) {
    return Pattern.compile(toRegex(glob)).matcher(name).matches();
  }

  static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    int i = 0;
    int n = glob.length();
    while (i < n) {
      char c = glob.charAt(i++);
      if (c == '*') {
        regex.append(".*");
      } else if (c == '?') {
        regex.append('.');
      } else if (c == '[') {
        int j = i;
        if (j < n && glob.charAt(j) == '!') {
          j++;
        }
        if (j < n && glob.charAt(j) == ']') {
          j++;
        }
        while (j < n && glob.charAt(j) != ']') {
          j++;
        }
        if (j >= n) {
          // 未闭合的 '[' 按字面量处理
          regex.append("\\[");
        } else {
          String body = glob.substring(i, j);
          i = j + 1;
          regex.append('[');
          if (body.startsWith("!")) {
            regex.append('^');
            body = body.substring(1);
          }
          for (int k = 0; k < body.length(); k++) {
            char b = body.charAt(k);
            if (b == '\\' || b == '[' || b == ']' || b == '&' || b == '^') {
              regex.append('\\');
            }
            regex.append(b);
          }
          regex.append(']');
        }
      } else {
        regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return regex.toString();
  }
}
