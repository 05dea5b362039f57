/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * OpenTelemetry SDK Extension - Polling Agent
 *
 * <p>分布式采集 Agent 的调度与执行核心，包括：
 *
 * <ul>
 *   <li>按采集间隔组装 (source, pollster) 配对
 *   <li>静态资源与动态发现资源的解析、分区与黑名单
 *   <li>单个插件或资源失败不影响整体采集
 *   <li>带随机打散的定时调度
 * </ul>
 *
 * @see io.opentelemetry.sdk.extension.polling.PollingAgentManager
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling;

import javax.annotation.ParametersAreNonnullByDefault;
