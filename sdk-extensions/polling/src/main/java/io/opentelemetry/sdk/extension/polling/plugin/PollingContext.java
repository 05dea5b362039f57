/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import io.opentelemetry.sdk.extension.polling.config.PollingAgentConfig;
import java.util.List;
import java.util.Objects;

/**
 * 采集上下文
 *
 * <p>传递给 Pollster 和 Discoverer 的只读 Agent 信息。
 */
public final class PollingContext {

  private final PollingAgentConfig config;
  private final String groupPrefix;

  public PollingContext(PollingAgentConfig config, String groupPrefix) {
    this.config = Objects.requireNonNull(config, "config");
    this.groupPrefix = Objects.requireNonNull(groupPrefix, "groupPrefix");
  }

  public PollingAgentConfig getConfig() {
    return config;
  }

  /**
   * 获取当前 Agent 在分区组中的成员标识
   *
   * @return 成员标识
   */
  public String getMemberId() {
    return config.getMemberId();
  }

  public List<String> getNamespaces() {
    return config.getNamespaces();
  }

  /**
   * 获取分区组名前缀
   *
   * @return 分区组名前缀
   */
  public String getGroupPrefix() {
    return groupPrefix;
  }
}
