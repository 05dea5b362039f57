/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

/**
 * Discoverer 提供者 SPI
 *
 * <p>通过 {@code META-INF/services/io.opentelemetry.sdk.extension.polling.plugin.DiscovererProvider}
 * 注册。
 */
public interface DiscovererProvider {

  /**
   * 创建 Discoverer 实例
   *
   * @return Discoverer 实例
   * @throws ExtensionLoadException 当前环境无法创建该插件时
   */
  Discoverer create();
}
