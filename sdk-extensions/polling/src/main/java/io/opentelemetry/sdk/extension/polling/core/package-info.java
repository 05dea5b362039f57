/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 采集核心组件
 *
 * <p>定时任务调度、插件调用时间限制、采集统计。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.core;

import javax.annotation.ParametersAreNonnullByDefault;
