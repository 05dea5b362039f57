/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.discovery;

import io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionGroupIds;
import io.opentelemetry.sdk.extension.polling.core.PollingStatistics;
import io.opentelemetry.sdk.extension.polling.core.TimeLimitedCaller;
import io.opentelemetry.sdk.extension.polling.plugin.Discoverer;
import io.opentelemetry.sdk.extension.polling.plugin.PollingContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 发现解析器
 *
 * <p>将发现 URL 解析为已加载的 Discoverer 并调用，再按 Discoverer 声明的分区组切分结果：
 *
 * <ul>
 *   <li>同一周期内命中缓存的 URL 直接复用结果
 *   <li>未知的 Discoverer 记录警告并跳过
 *   <li>单个 Discoverer 调用失败只影响该 URL，其余 URL 照常解析
 * </ul>
 */
public final class DiscoveryResolver {

  private static final Logger logger = Logger.getLogger(DiscoveryResolver.class.getName());

  /** Discoverer 注册表（name -> Discoverer），同名时先加载的生效 */
  private final Map<String, Discoverer> discoverers;

  private final PollingContext context;
  private final PartitionCoordinator coordinator;
  private final PartitionGroupIds groupIds;
  private final TimeLimitedCaller caller;
  private final PollingStatistics statistics;

  /**
   * 创建发现解析器
   *
   * @param discoverers 已加载的 Discoverer
   * @param context 采集上下文
   * @param coordinator 分区协调器
   * @param groupIds 分区组命名规则
   * @param caller 调用时间限制器
   * @param statistics 统计信息
   */
  public DiscoveryResolver(
      Collection<Discoverer> discoverers,
      PollingContext context,
      PartitionCoordinator coordinator,
      PartitionGroupIds groupIds,
      TimeLimitedCaller caller,
      PollingStatistics statistics) {
    Map<String, Discoverer> registry = new LinkedHashMap<>();
    for (Discoverer discoverer : discoverers) {
      Discoverer existing = registry.putIfAbsent(discoverer.getName(), discoverer);
      if (existing != null) {
        logger.log(
            Level.WARNING,
            "Duplicate discovery extension {0}, keeping {1}",
            new Object[] {discoverer.getName(), existing.getClass().getName()});
      }
    }
    this.discoverers = Collections.unmodifiableMap(registry);
    this.context = Objects.requireNonNull(context, "context");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.groupIds = Objects.requireNonNull(groupIds, "groupIds");
    this.caller = Objects.requireNonNull(caller, "caller");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
  }

  /**
   * 按名称查找 Discoverer
   *
   * @param name 名称
   * @return Discoverer 或 null
   */
  @Nullable
  public Discoverer getDiscoverer(String name) {
    return discoverers.get(name);
  }

  public Collection<Discoverer> getDiscoverers() {
    return discoverers.values();
  }

  /**
   * 获取全部 Discoverer 声明的分区组标识
   *
   * @return 分区组标识（已加前缀）
   */
  public Set<String> getPartitionGroups() {
    Set<String> groups = new LinkedHashSet<>();
    for (Discoverer discoverer : discoverers.values()) {
      String groupId = groupIds.construct(discoverer.getGroupId());
      if (groupId != null) {
        groups.add(groupId);
      }
    }
    return groups;
  }

  /**
   * 解析发现 URL
   *
   * @param urls 发现 URL 列表
   * @param cache 本周期的发现缓存，可为 null（不缓存）
   * @return 发现并分区后的资源
   */
  public List<Object> discover(List<String> urls, @Nullable DiscoveryCache cache) {
    List<Object> resources = new ArrayList<>();
    for (String url : urls) {
      if (cache != null) {
        List<Object> cached = cache.get(url);
        if (cached != null) {
          resources.addAll(cached);
          continue;
        }
      }

      DiscoveryUrl parsed = DiscoveryUrl.parse(url);
      Discoverer discoverer = discoverers.get(parsed.getName());
      if (discoverer == null) {
        statistics.recordDiscoveryFailure();
        logger.log(Level.WARNING, "Unknown discovery extension: {0}", parsed.getName());
        continue;
      }

      try {
        List<Object> discovered =
            caller.call(
                "discoverer " + parsed.getName(),
                () -> discoverer.discover(context, parsed.getParameter()));
        List<Object> partitioned =
            coordinator.extractMySubset(
                groupIds.construct(discoverer.getGroupId()),
                discovered != null ? discovered : Collections.emptyList());
        resources.addAll(partitioned);
        if (cache != null) {
          cache.put(url, new ArrayList<>(partitioned));
        }
      } catch (VirtualMachineError e) {
        throw e;
      } catch (RuntimeException | Error e) {
        statistics.recordDiscoveryFailure();
        logger.log(Level.SEVERE, "Unable to discover resources: " + e.getMessage(), e);
      }
    }
    return resources;
  }
}
