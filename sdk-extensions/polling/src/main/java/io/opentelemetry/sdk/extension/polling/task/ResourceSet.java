/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.task;

import io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionGroupIds;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryCache;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryResolver;
import io.opentelemetry.sdk.extension.polling.pipeline.Pipeline;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;

/**
 * 单个 (source, pollster) 配对的资源集合
 *
 * <p>包含三部分：
 *
 * <ul>
 *   <li>静态资源：来自 pipeline，按静态资源集合的哈希对应的分区组切分
 *   <li>发现 URL：每个周期通过 {@link DiscoveryResolver} 解析
 *   <li>黑名单：Pollster 报告永久失败的资源，只增不减，在采集任务中过滤
 * </ul>
 *
 * <p>{@link #resolve(DiscoveryCache)} 返回「分区后的静态资源 + 发现的资源」，两者之间不去重。
 */
public final class ResourceSet {

  private final DiscoveryResolver discoveryResolver;
  private final PartitionCoordinator coordinator;
  private final PartitionGroupIds groupIds;

  private volatile List<Object> staticResources = Collections.emptyList();
  private volatile List<String> discoveryUrls = Collections.emptyList();
  private final List<Object> blacklist = new CopyOnWriteArrayList<>();

  public ResourceSet(
      DiscoveryResolver discoveryResolver,
      PartitionCoordinator coordinator,
      PartitionGroupIds groupIds) {
    this.discoveryResolver = Objects.requireNonNull(discoveryResolver, "discoveryResolver");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.groupIds = Objects.requireNonNull(groupIds, "groupIds");
  }

  /**
   * 从 pipeline 配置资源，重复调用时后一次覆盖前一次
   *
   * @param pipeline pipeline
   */
  public void setup(Pipeline pipeline) {
    this.staticResources = Collections.unmodifiableList(new ArrayList<>(pipeline.getResources()));
    this.discoveryUrls = Collections.unmodifiableList(new ArrayList<>(pipeline.getDiscovery()));
  }

  /**
   * 解析本周期应采集的资源（未过滤黑名单）
   *
   * @param discoveryCache 本周期的发现缓存
   * @return 分区后的静态资源加上发现的资源
   */
  public List<Object> resolve(@Nullable DiscoveryCache discoveryCache) {
    List<Object> discovered =
        discoveryUrls.isEmpty()
            ? Collections.emptyList()
            : discoveryResolver.discover(discoveryUrls, discoveryCache);

    List<Object> resources = new ArrayList<>();
    if (!staticResources.isEmpty()) {
      resources.addAll(
          coordinator.extractMySubset(
              groupIds.forStaticResources(staticResources), staticResources));
    }
    resources.addAll(discovered);
    return resources;
  }

  /**
   * 将资源加入黑名单
   *
   * @param resource 永久失败的资源
   * @return 是否新加入
   */
  boolean addToBlacklist(Object resource) {
    if (blacklist.contains(resource)) {
      return false;
    }
    return blacklist.add(resource);
  }

  public boolean isBlacklisted(Object resource) {
    return blacklist.contains(resource);
  }

  public List<Object> getBlacklist() {
    return Collections.unmodifiableList(blacklist);
  }

  public List<Object> getStaticResources() {
    return staticResources;
  }

  public List<String> getDiscoveryUrls() {
    return discoveryUrls;
  }
}
