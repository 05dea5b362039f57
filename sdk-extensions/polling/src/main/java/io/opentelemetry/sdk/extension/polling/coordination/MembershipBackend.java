/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import java.util.List;

/**
 * 协调后端的成员关系接口
 *
 * <p>租约、选主等内部协议由后端自行实现。所有方法失败时抛出 {@link CoordinationException}。
 */
public interface MembershipBackend {

  /**
   * 以指定成员身份连接后端
   *
   * @param memberId 成员标识
   */
  void connect(String memberId);

  /**
   * 断开连接
   *
   * @param memberId 成员标识
   */
  void disconnect(String memberId);

  /**
   * 加入分区组，分区组不存在时创建；已是成员时不报错
   *
   * @param groupId 分区组标识
   * @param memberId 成员标识
   */
  void joinGroup(String groupId, String memberId);

  /**
   * 退出分区组
   *
   * @param groupId 分区组标识
   * @param memberId 成员标识
   */
  void leaveGroup(String groupId, String memberId);

  /**
   * 获取分区组当前成员
   *
   * @param groupId 分区组标识
   * @return 成员标识列表
   */
  List<String> getMembers(String groupId);

  /**
   * 续约成员关系
   *
   * @param memberId 成员标识
   */
  void heartbeat(String memberId);
}
