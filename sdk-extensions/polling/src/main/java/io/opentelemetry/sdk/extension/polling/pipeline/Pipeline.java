/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * 采集 pipeline 定义
 *
 * <p>由配置层提供，调度核心只读。一个 source 描述采集什么（meter 选择规则、资源、发现 URL）和多久采集一次。
 */
public interface Pipeline {

  /**
   * 获取 pipeline 名称
   *
   * @return pipeline 名称
   */
  String getName();

  /**
   * 获取所属 source 名称
   *
   * @return source 名称
   */
  String getSourceName();

  /**
   * 获取采集间隔
   *
   * @return 采集间隔
   */
  Duration getInterval();

  /**
   * 获取静态配置的资源
   *
   * @return 资源列表
   */
  List<Object> getResources();

  /**
   * 获取发现 URL 列表
   *
   * @return 发现 URL
   */
  List<String> getDiscovery();

  /**
   * 判断该 pipeline 是否选中了指定 meter
   *
   * @param meterName meter（Pollster）名称
   * @return 是否选中
   */
  boolean supportsMeter(String meterName);
}
