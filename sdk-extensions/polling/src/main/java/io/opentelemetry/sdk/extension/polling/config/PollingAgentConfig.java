/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 采集 Agent 配置
 *
 * <p>复用 OpenTelemetry 自动配置的 {@link ConfigProperties}，所有配置键均以 {@code otel.polling.} 开头。
 */
public final class PollingAgentConfig {

  private static final Logger logger = Logger.getLogger(PollingAgentConfig.class.getName());

  // ===== 配置键常量 =====

  // 插件配置
  private static final String NAMESPACES = "otel.polling.namespaces";
  private static final String POLLSTER_LIST = "otel.polling.pollster.list";

  // 调度配置
  private static final String SHUFFLE_TIME_BEFORE_POLLING_TASK =
      "otel.polling.shuffle.time.before.polling.task";
  private static final String CALL_TIMEOUT = "otel.polling.call.timeout";
  private static final String SCHEDULER_THREADS = "otel.polling.scheduler.threads";

  // 分区协调配置
  private static final String PARTITIONING_GROUP_PREFIX = "otel.polling.partitioning.group.prefix";
  private static final String COORDINATION_BACKEND_URL = "otel.polling.coordination.backend.url";
  private static final String COORDINATION_HEARTBEAT = "otel.polling.coordination.heartbeat";
  private static final String COORDINATION_MEMBER_ID = "otel.polling.coordination.member.id";

  // ===== 默认值常量 =====
  private static final List<String> DEFAULT_NAMESPACES = Arrays.asList("compute", "central");
  private static final int DEFAULT_SHUFFLE_TIME_SECONDS = 0;
  // 打散窗口上限为一天，random.nextInt(shuffle + 1) 不会溢出
  static final int MAX_SHUFFLE_TIME_SECONDS = 86400;
  private static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(1);
  private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ZERO; // 不限时
  private static final int DEFAULT_SCHEDULER_THREADS = 4;

  // ===== 配置字段 =====
  private final List<String> namespaces;
  private final List<String> pollsterList;
  private final int shuffleTimeBeforePollingTask;
  private final Duration callTimeout;
  private final int schedulerThreads;
  @Nullable private final String partitioningGroupPrefix;
  @Nullable private final String coordinationBackendUrl;
  private final Duration coordinationHeartbeat;
  private final String memberId;

  private PollingAgentConfig(Builder builder) {
    this.namespaces = Collections.unmodifiableList(new ArrayList<>(builder.namespaces));
    this.pollsterList = Collections.unmodifiableList(new ArrayList<>(builder.pollsterList));
    this.shuffleTimeBeforePollingTask = builder.shuffleTimeBeforePollingTask;
    this.callTimeout = builder.callTimeout;
    this.schedulerThreads = builder.schedulerThreads;
    this.partitioningGroupPrefix = builder.partitioningGroupPrefix;
    this.coordinationBackendUrl = builder.coordinationBackendUrl;
    this.coordinationHeartbeat = builder.coordinationHeartbeat;
    this.memberId = builder.memberId != null ? builder.memberId : UUID.randomUUID().toString();
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 采集 Agent 配置
   */
  public static PollingAgentConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /**
   * 创建构建器
   *
   * @return 构建器实例
   */
  public static Builder builder() {
    return new Builder();
  }

  // ===== Getters =====

  public List<String> getNamespaces() {
    return namespaces;
  }

  public List<String> getPollsterList() {
    return pollsterList;
  }

  /**
   * 获取采集任务启动前的随机打散窗口上限（秒）
   *
   * @return 秒数
   */
  public int getShuffleTimeBeforePollingTask() {
    return shuffleTimeBeforePollingTask;
  }

  /**
   * 获取单次插件调用的超时时间
   *
   * @return 超时时间，{@link Duration#ZERO} 表示不限时
   */
  public Duration getCallTimeout() {
    return callTimeout;
  }

  public boolean isCallTimeoutEnabled() {
    return !callTimeout.isZero();
  }

  public int getSchedulerThreads() {
    return schedulerThreads;
  }

  @Nullable
  public String getPartitioningGroupPrefix() {
    return partitioningGroupPrefix;
  }

  @Nullable
  public String getCoordinationBackendUrl() {
    return coordinationBackendUrl;
  }

  /**
   * 是否配置了分区协调后端
   *
   * @return 是否启用协调
   */
  public boolean isCoordinationEnabled() {
    return coordinationBackendUrl != null && !coordinationBackendUrl.isEmpty();
  }

  public Duration getCoordinationHeartbeat() {
    return coordinationHeartbeat;
  }

  public String getMemberId() {
    return memberId;
  }

  @Override
  public String toString() {
    return "PollingAgentConfig{namespaces=" + namespaces
        + ", pollsterList=" + pollsterList
        + ", shuffleTimeBeforePollingTask=" + shuffleTimeBeforePollingTask
        + ", callTimeout=" + callTimeout
        + ", coordinationBackendUrl=" + coordinationBackendUrl
        + ", memberId=" + memberId + "}";
  }

  /** 构建器 */
  public static final class Builder {
    private List<String> namespaces = DEFAULT_NAMESPACES;
    private List<String> pollsterList = Collections.emptyList();
    private int shuffleTimeBeforePollingTask = DEFAULT_SHUFFLE_TIME_SECONDS;
    private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    @Nullable private String partitioningGroupPrefix;
    @Nullable private String coordinationBackendUrl;
    private Duration coordinationHeartbeat = DEFAULT_HEARTBEAT;
    @Nullable private String memberId;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置
     *
     * @param properties 配置属性
     * @return 构建器
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      List<String> configuredNamespaces = properties.getList(NAMESPACES);
      if (configuredNamespaces != null && !configuredNamespaces.isEmpty()) {
        this.namespaces = configuredNamespaces;
      }

      List<String> configuredPollsters = properties.getList(POLLSTER_LIST);
      if (configuredPollsters != null) {
        this.pollsterList = configuredPollsters;
      }

      Integer shuffle = properties.getInt(SHUFFLE_TIME_BEFORE_POLLING_TASK);
      if (shuffle != null) {
        this.shuffleTimeBeforePollingTask = shuffle;
      }

      Duration timeout = properties.getDuration(CALL_TIMEOUT);
      if (timeout != null) {
        this.callTimeout = timeout;
      }

      Integer threads = properties.getInt(SCHEDULER_THREADS);
      if (threads != null) {
        this.schedulerThreads = threads;
      }

      this.partitioningGroupPrefix = properties.getString(PARTITIONING_GROUP_PREFIX);
      this.coordinationBackendUrl = properties.getString(COORDINATION_BACKEND_URL);

      Duration heartbeat = properties.getDuration(COORDINATION_HEARTBEAT);
      if (heartbeat != null) {
        this.coordinationHeartbeat = heartbeat;
      }

      String member = properties.getString(COORDINATION_MEMBER_ID);
      if (member != null && !member.isEmpty()) {
        this.memberId = member;
      }

      logger.log(
          Level.FINE,
          "Loaded polling config, namespaces: {0}, coordination backend: {1}",
          new Object[] {namespaces, coordinationBackendUrl});
      return this;
    }

    public Builder setNamespaces(List<String> namespaces) {
      this.namespaces = Objects.requireNonNull(namespaces, "namespaces");
      return this;
    }

    public Builder setPollsterList(List<String> pollsterList) {
      this.pollsterList = Objects.requireNonNull(pollsterList, "pollsterList");
      return this;
    }

    public Builder setShuffleTimeBeforePollingTask(int seconds) {
      this.shuffleTimeBeforePollingTask = seconds;
      return this;
    }

    public Builder setCallTimeout(Duration callTimeout) {
      this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
      return this;
    }

    public Builder setSchedulerThreads(int schedulerThreads) {
      this.schedulerThreads = schedulerThreads;
      return this;
    }

    public Builder setPartitioningGroupPrefix(@Nullable String partitioningGroupPrefix) {
      this.partitioningGroupPrefix = partitioningGroupPrefix;
      return this;
    }

    public Builder setCoordinationBackendUrl(@Nullable String coordinationBackendUrl) {
      this.coordinationBackendUrl = coordinationBackendUrl;
      return this;
    }

    public Builder setCoordinationHeartbeat(Duration coordinationHeartbeat) {
      this.coordinationHeartbeat =
          Objects.requireNonNull(coordinationHeartbeat, "coordinationHeartbeat");
      return this;
    }

    public Builder setMemberId(String memberId) {
      this.memberId = Objects.requireNonNull(memberId, "memberId");
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     */
    public PollingAgentConfig build() {
      validate();
      return new PollingAgentConfig(this);
    }

    private void validate() {
      if (namespaces.isEmpty()) {
        throw new IllegalArgumentException("namespaces must not be empty");
      }
      if (shuffleTimeBeforePollingTask < 0) {
        throw new IllegalArgumentException("shuffleTimeBeforePollingTask must not be negative");
      }
      if (shuffleTimeBeforePollingTask > MAX_SHUFFLE_TIME_SECONDS) {
        throw new IllegalArgumentException(
            "shuffleTimeBeforePollingTask must not exceed " + MAX_SHUFFLE_TIME_SECONDS + " seconds");
      }
      if (callTimeout.isNegative()) {
        throw new IllegalArgumentException("callTimeout must not be negative");
      }
      if (schedulerThreads < 1) {
        throw new IllegalArgumentException("schedulerThreads must be at least 1");
      }
      if (coordinationHeartbeat.isNegative() || coordinationHeartbeat.isZero()) {
        throw new IllegalArgumentException("coordinationHeartbeat must be positive");
      }
    }
  }
}
