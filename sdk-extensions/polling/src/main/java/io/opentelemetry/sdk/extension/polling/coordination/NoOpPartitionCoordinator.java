/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import java.util.List;
import javax.annotation.Nullable;

/** 未配置协调后端时使用：单 Agent 采集全部资源。 */
public final class NoOpPartitionCoordinator implements PartitionCoordinator {

  private static final NoOpPartitionCoordinator INSTANCE = new NoOpPartitionCoordinator();

  private NoOpPartitionCoordinator() {}

  public static NoOpPartitionCoordinator getInstance() {
    return INSTANCE;
  }

  @Override
  public void start() {}

  @Override
  public void stop() {}

  @Override
  public boolean isActive() {
    return false;
  }

  @Override
  public void joinGroup(@Nullable String groupId) {}

  @Override
  public void leaveGroup(@Nullable String groupId) {}

  @Override
  public <T> List<T> extractMySubset(@Nullable String groupId, List<T> items) {
    return items;
  }

  @Override
  public void heartbeat() {}
}
