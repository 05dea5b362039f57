/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import java.util.List;
import javax.annotation.Nullable;

/**
 * 资源发现插件接口
 *
 * <p>通过发现 URL 的 scheme（或整个路径）按名称查找。返回的资源会按 {@link #getGroupId()}
 * 对应的分区组在集群内切分。
 */
public interface Discoverer {

  /**
   * 获取插件名称
   *
   * @return 插件名称
   */
  String getName();

  /**
   * 获取分区组标识
   *
   * <p>返回 null 表示发现结果不参与分区，每个 Agent 都会采集全部资源。
   *
   * @return 分区组标识或 null
   */
  @Nullable
  default String getGroupId() {
    return null;
  }

  /**
   * 发现资源
   *
   * @param context 采集上下文
   * @param parameter 发现 URL 中 scheme 之后的部分，URL 不带 scheme 时为 null
   * @return 发现的资源
   */
  List<Object> discover(PollingContext context, @Nullable String parameter);
}
