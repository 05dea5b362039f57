/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling;

/**
 * 同时配置 Pollster 列表和分区协调后端时抛出
 *
 * <p>两者互斥：分区协调已保证各 Agent 的采集互不重叠，再按名称过滤 Pollster 会导致采样重复或丢失。
 * 属于启动期配置错误，不应被捕获。
 */
public class PollsterListForbiddenException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public PollsterListForbiddenException() {
    super(
        "It is forbidden to use pollster-list option of polling agent in case of using "
            + "coordination between multiple agents. Please use either multiple agents being "
            + "coordinated or polling list option for one polling agent.");
  }
}
