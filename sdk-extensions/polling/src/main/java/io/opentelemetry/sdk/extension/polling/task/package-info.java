/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 采集任务
 *
 * <p>{@link io.opentelemetry.sdk.extension.polling.task.PollingTask} 聚合同一采集间隔的配对，
 * 每个配对的资源由 {@link io.opentelemetry.sdk.extension.polling.task.ResourceSet} 解析。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.task;

import javax.annotation.ParametersAreNonnullByDefault;
