/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * 采集插件接口
 *
 * <p>每个 Pollster 负责测量一类指标。调度核心只通过该接口调用插件：
 *
 * <ul>
 *   <li>{@link #getName()} 用于与 pipeline 的 meter 选择规则匹配，并作为资源配对键的一部分
 *   <li>{@link #getDefaultDiscovery()} 在 pipeline 未提供资源时作为兜底的发现来源
 *   <li>{@link #getSamples(PollingContext, Map, List)} 对一批资源执行采样
 * </ul>
 *
 * <p>如果某个资源已永久不可采集，实现应抛出 {@link PollsterPermanentException}，
 * 该资源将被加入对应配对的黑名单；其它异常视为本周期内的临时失败。
 */
public interface Pollster {

  /**
   * 获取插件名称
   *
   * @return 插件名称
   */
  String getName();

  /**
   * 获取默认发现 URL
   *
   * @return 发现 URL，没有时返回 null
   */
  @Nullable
  default String getDefaultDiscovery() {
    return null;
  }

  /**
   * 对给定资源执行采样
   *
   * @param context 采集上下文
   * @param cache 本周期内所有 Pollster 共享的缓存，周期结束后丢弃
   * @param resources 本周期需要采集的资源（已过滤黑名单，非空）
   * @return 采样结果
   */
  Iterable<Sample> getSamples(
      PollingContext context, Map<String, Object> cache, List<Object> resources);
}
