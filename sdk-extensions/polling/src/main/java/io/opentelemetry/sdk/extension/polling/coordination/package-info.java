/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 分区协调
 *
 * <p>多个 Agent 加入同一分区组后，各自只采集分配给自己的资源子集：
 * <ul>
 *   <li>{@link io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator} - 协调器接口
 *   <li>{@link io.opentelemetry.sdk.extension.polling.coordination.MembershipPartitionCoordinator} - 基于成员关系后端的实现
 *   <li>{@link io.opentelemetry.sdk.extension.polling.coordination.NoOpPartitionCoordinator} - 单 Agent 时不分区
 * </ul>
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.coordination;

import javax.annotation.ParametersAreNonnullByDefault;
