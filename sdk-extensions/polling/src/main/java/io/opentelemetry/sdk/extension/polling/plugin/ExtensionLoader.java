/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import java.util.List;

/**
 * 插件加载器
 *
 * <p>实现必须容忍单个插件加载失败：记录日志并跳过，不得中断整体加载。
 */
public interface ExtensionLoader {

  /**
   * 加载指定命名空间下的全部 Pollster
   *
   * @param namespace 命名空间
   * @return 加载成功的 Pollster
   */
  List<Pollster> loadPollsters(String namespace);

  /**
   * 加载全部 Discoverer
   *
   * @return 加载成功的 Discoverer
   */
  List<Discoverer> loadDiscoverers();
}
