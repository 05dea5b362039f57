/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

/**
 * Pollster 提供者 SPI
 *
 * <p>通过 {@code META-INF/services/io.opentelemetry.sdk.extension.polling.plugin.PollsterProvider}
 * 注册。实现类必须有无参构造函数。
 */
public interface PollsterProvider {

  /**
   * 获取插件所属的命名空间（例如 "compute"、"central"）
   *
   * @return 命名空间
   */
  String getNamespace();

  /**
   * 创建 Pollster 实例
   *
   * @return Pollster 实例
   * @throws ExtensionLoadException 当前环境无法创建该插件时
   */
  Pollster create();
}
