/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.discovery;

import java.util.Objects;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * 发现 URL 解析结果
 *
 * <p>解析规则：
 *
 * <ul>
 *   <li>{@code instance://} -> name="instance", parameter=""
 *   <li>{@code endpoint:compute} -> name="endpoint", parameter="compute"
 *   <li>{@code tenant://host/path} -> name="tenant", parameter="host/path"
 *   <li>{@code local_instances} -> name="local_instances", parameter=null
 * </ul>
 *
 * <p>查询串和片段会被丢弃。
 */
public final class DiscoveryUrl {

  private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]*");

  private final String name;
  @Nullable private final String parameter;

  private DiscoveryUrl(String name, @Nullable String parameter) {
    this.name = name;
    this.parameter = parameter;
  }

  /**
   * 解析发现 URL
   *
   * @param url 发现 URL
   * @return 解析结果
   */
  public static DiscoveryUrl parse(String url) {
    String rest = stripQueryAndFragment(url);
    int colon = rest.indexOf(':');
    if (colon > 0 && SCHEME.matcher(rest.substring(0, colon)).matches()) {
      String scheme = rest.substring(0, colon);
      String remainder = rest.substring(colon + 1);
      if (remainder.startsWith("//")) {
        remainder = remainder.substring(2);
      }
      return new DiscoveryUrl(scheme, remainder);
    }
    return new DiscoveryUrl(rest, null);
  }

  private static String stripQueryAndFragment(String url) {
    int end = url.length();
    int query = url.indexOf('?');
    if (query >= 0) {
      end = query;
    }
    int fragment = url.indexOf('#');
    if (fragment >= 0 && fragment < end) {
      end = fragment;
    }
    return url.substring(0, end);
  }

  /**
   * 获取 Discoverer 名称
   *
   * @return Discoverer 名称
   */
  public String getName() {
    return name;
  }

  /**
   * 获取传递给 Discoverer 的参数
   *
   * @return 参数，URL 不带 scheme 时为 null
   */
  @Nullable
  public String getParameter() {
    return parameter;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DiscoveryUrl)) {
      return false;
    }
    DiscoveryUrl that = (DiscoveryUrl) o;
    return name.equals(that.name) && Objects.equals(parameter, that.parameter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameter);
  }

  @Override
  public String toString() {
    return "DiscoveryUrl{name=" + name + ", parameter=" + parameter + "}";
  }
}
