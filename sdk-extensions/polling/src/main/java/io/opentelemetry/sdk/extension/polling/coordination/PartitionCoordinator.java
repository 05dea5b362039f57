/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import java.util.List;
import javax.annotation.Nullable;

/**
 * 分区协调器
 *
 * <p>为集群中每个 Agent 分配某个分区组内资源的确定性、互不重叠的子集。
 *
 * <p>实现必须支持并发调用：各采集任务的资源解析可能并发调用 {@link #extractMySubset}，
 * 同时心跳定时器调用 {@link #heartbeat()}。
 */
public interface PartitionCoordinator {

  /** 启动协调器（连接协调后端） */
  void start();

  /** 停止协调器，退出已加入的分区组 */
  void stop();

  /**
   * 协调是否生效
   *
   * @return 已连接协调后端时返回 true
   */
  boolean isActive();

  /**
   * 加入分区组
   *
   * @param groupId 分区组标识，为 null 时忽略
   */
  void joinGroup(@Nullable String groupId);

  /**
   * 退出分区组，组内其余成员随后接管本 Agent 的份额
   *
   * @param groupId 分区组标识，为 null 或未加入时忽略
   */
  void leaveGroup(@Nullable String groupId);

  /**
   * 提取属于当前 Agent 的子集
   *
   * <p>对于固定的成员快照，结果必须是确定性的：加入同一分区组的所有 Agent 得到的子集互不重叠，且并集等于原列表。
   *
   * @param groupId 分区组标识，为 null 时不分区，原样返回
   * @param items 待分区的资源
   * @param <T> 资源类型
   * @return 属于当前 Agent 的资源
   */
  <T> List<T> extractMySubset(@Nullable String groupId, List<T> items);

  /** 发送心跳，维持成员关系 */
  void heartbeat();
}
