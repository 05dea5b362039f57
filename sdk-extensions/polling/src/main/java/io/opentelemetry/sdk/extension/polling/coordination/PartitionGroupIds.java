/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * 分区组命名规则。
 *
 * <p>前缀由排序后的命名空间以 {@code -} 连接而成，配置了额外前缀时追加在后。
 * 例如命名空间 {@code [central, compute]}、额外前缀 {@code dc1} 得到 {@code central-compute-dc1}。
 */
public final class PartitionGroupIds {

  private final String prefix;

  private PartitionGroupIds(String prefix) {
    this.prefix = prefix;
  }

  /**
   * 创建命名规则
   *
   * @param namespaces 插件命名空间
   * @param extraPrefix 额外前缀，可为 null
   * @return 命名规则
   */
  public static PartitionGroupIds create(Collection<String> namespaces, @Nullable String extraPrefix) {
    List<String> sorted = new ArrayList<>(namespaces);
    Collections.sort(sorted);
    String namespacePrefix = String.join("-", sorted);
    if (extraPrefix != null && !extraPrefix.isEmpty()) {
      return new PartitionGroupIds(namespacePrefix + "-" + extraPrefix);
    }
    return new PartitionGroupIds(namespacePrefix);
  }

  public String getPrefix() {
    return prefix;
  }

  /**
   * 构造分区组标识
   *
   * @param id Discoverer 声明的组标识或静态资源哈希
   * @return 分区组标识，id 为空时返回 null（不分区）
   */
  @Nullable
  public String construct(@Nullable String id) {
    if (id == null || id.isEmpty()) {
      return null;
    }
    return prefix + "-" + id;
  }

  /**
   * 构造静态资源集合对应的分区组标识
   *
   * @param resources 静态资源
   * @return 分区组标识，资源为空时返回 null
   */
  @Nullable
  public String forStaticResources(Collection<?> resources) {
    if (resources.isEmpty()) {
      return null;
    }
    return construct(hashOfSet(resources));
  }

  /**
   * 计算与顺序无关的资源集合哈希
   *
   * <p>基于资源字符串形式的 {@link Set#hashCode()}，在不同 JVM 进程间结果一致。
   *
   * @param resources 资源
   * @return 哈希字符串
   */
  public static String hashOfSet(Collection<?> resources) {
    Set<String> members = new HashSet<>();
    for (Object resource : resources) {
      members.add(String.valueOf(resource));
    }
    return Integer.toString(members.hashCode());
  }
}
