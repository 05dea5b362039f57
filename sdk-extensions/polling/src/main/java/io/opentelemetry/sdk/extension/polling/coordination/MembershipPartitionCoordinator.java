/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 基于成员关系后端的分区协调器。
 *
 * <p>资源归属采用 rendezvous hashing：对每个资源计算 {@code md5(memberId + "/" + resource)}，
 * 取值最大的成员为该资源的负责者。只要各 Agent 看到相同的成员列表，分配结果就一致且互不重叠；
 * 成员变化时只有部分资源迁移。
 *
 * <p>后端异常处理策略：
 *
 * <ul>
 *   <li>启动/心跳失败：记录日志，下次心跳时重连
 *   <li>加入分区组失败：记录日志，下次提取子集时重试
 *   <li>获取成员失败：本次返回空子集，避免多个 Agent 重复采集
 * </ul>
 */
public final class MembershipPartitionCoordinator implements PartitionCoordinator {

  private static final Logger logger =
      Logger.getLogger(MembershipPartitionCoordinator.class.getName());

  private final String memberId;
  private final MembershipBackend backend;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final Set<String> joinedGroups = ConcurrentHashMap.newKeySet();

  public MembershipPartitionCoordinator(String memberId, MembershipBackend backend) {
    this.memberId = Objects.requireNonNull(memberId, "memberId");
    this.backend = Objects.requireNonNull(backend, "backend");
  }

  public String getMemberId() {
    return memberId;
  }

  @Override
  public void start() {
    if (started.get()) {
      return;
    }
    try {
      backend.connect(memberId);
      started.set(true);
      logger.log(Level.INFO, "Partition coordinator started, memberId: {0}", memberId);
    } catch (CoordinationException e) {
      logger.log(Level.SEVERE, "Error connecting to coordination backend: " + e.getMessage(), e);
    }
  }

  @Override
  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    for (String groupId : new ArrayList<>(joinedGroups)) {
      try {
        backend.leaveGroup(groupId, memberId);
      } catch (CoordinationException e) {
        logger.log(Level.WARNING, "Error leaving partition group " + groupId, e);
      }
    }
    joinedGroups.clear();
    try {
      backend.disconnect(memberId);
    } catch (CoordinationException e) {
      logger.log(Level.WARNING, "Error disconnecting from coordination backend", e);
    }
    logger.log(Level.INFO, "Partition coordinator stopped, memberId: {0}", memberId);
  }

  @Override
  public boolean isActive() {
    return started.get();
  }

  @Override
  public void heartbeat() {
    if (!started.get()) {
      // 尝试重连
      start();
      if (!started.get()) {
        return;
      }
      for (String groupId : new ArrayList<>(joinedGroups)) {
        joinGroup(groupId);
      }
    }
    try {
      backend.heartbeat(memberId);
    } catch (CoordinationException e) {
      logger.log(Level.WARNING, "Error sending a heartbeat to coordination backend", e);
    }
  }

  @Override
  public void joinGroup(@Nullable String groupId) {
    if (groupId == null || !started.get()) {
      return;
    }
    try {
      backend.joinGroup(groupId, memberId);
      joinedGroups.add(groupId);
      logger.log(
          Level.INFO,
          "Joined partitioning group {0} as member {1}",
          new Object[] {groupId, memberId});
    } catch (CoordinationException e) {
      logger.log(Level.SEVERE, "Error joining partitioning group " + groupId, e);
    }
  }

  @Override
  public void leaveGroup(@Nullable String groupId) {
    if (groupId == null || !joinedGroups.remove(groupId)) {
      return;
    }
    if (!started.get()) {
      return;
    }
    try {
      backend.leaveGroup(groupId, memberId);
      logger.log(
          Level.INFO,
          "Left partitioning group {0} as member {1}",
          new Object[] {groupId, memberId});
    } catch (CoordinationException e) {
      logger.log(Level.WARNING, "Error leaving partitioning group " + groupId, e);
    }
  }

  /**
   * 获取当前已加入的分区组
   *
   * @return 分区组标识
   */
  public Set<String> getJoinedGroups() {
    return Collections.unmodifiableSet(joinedGroups);
  }

  @Override
  public <T> List<T> extractMySubset(@Nullable String groupId, List<T> items) {
    if (groupId == null || !started.get()) {
      return items;
    }
    if (!joinedGroups.contains(groupId)) {
      joinGroup(groupId);
    }

    List<String> members;
    try {
      members = new ArrayList<>(backend.getMembers(groupId));
    } catch (CoordinationException e) {
      logger.log(Level.SEVERE, "Error getting members of partitioning group " + groupId, e);
      return Collections.emptyList();
    }
    // 成员列表可能滞后于本 Agent 的加入
    if (!members.contains(memberId)) {
      members.add(memberId);
    }
    Collections.sort(members);

    List<T> mine = new ArrayList<>();
    for (T item : items) {
      if (memberId.equals(ownerOf(String.valueOf(item), members))) {
        mine.add(item);
      }
    }
    logger.log(
        Level.FINE,
        "Member {0} owns {1}/{2} items of group {3} ({4} members)",
        new Object[] {memberId, mine.size(), items.size(), groupId, members.size()});
    return mine;
  }

  /**
   * 计算资源的负责成员
   *
   * @param key 资源的字符串形式
   * @param members 排序后的成员列表（非空）
   * @return 负责成员
   */
  static String ownerOf(String key, List<String> members) {
    String owner = members.get(0);
    long best = weight(owner, key);
    for (int i = 1; i < members.size(); i++) {
      String member = members.get(i);
      long weight = weight(member, key);
      // 权重相同时取排序靠前的成员（members 已排序）
      if (Long.compareUnsigned(weight, best) > 0) {
        best = weight;
        owner = member;
      }
    }
    return owner;
  }

  private static long weight(String member, String key) {
    byte[] digest = md5().digest((member + "/" + key).getBytes(StandardCharsets.UTF_8));
    long value = 0;
    for (int i = 0; i < 8; i++) {
      value = (value << 8) | (digest[i] & 0xFF);
    }
    return value;
  }

  private static MessageDigest md5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 is not available", e);
    }
  }
}
