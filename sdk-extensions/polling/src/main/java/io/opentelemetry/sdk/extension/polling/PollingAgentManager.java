/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling;

import io.opentelemetry.sdk.extension.polling.config.PollingAgentConfig;
import io.opentelemetry.sdk.extension.polling.coordination.MembershipBackend;
import io.opentelemetry.sdk.extension.polling.coordination.MembershipPartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.NoOpPartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionGroupIds;
import io.opentelemetry.sdk.extension.polling.core.GlobMatcher;
import io.opentelemetry.sdk.extension.polling.core.PollingStatistics;
import io.opentelemetry.sdk.extension.polling.core.ScheduledTaskManager;
import io.opentelemetry.sdk.extension.polling.core.TimeLimitedCaller;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryCache;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryResolver;
import io.opentelemetry.sdk.extension.polling.pipeline.Pipeline;
import io.opentelemetry.sdk.extension.polling.pipeline.PipelineManager;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishContextFactory;
import io.opentelemetry.sdk.extension.polling.plugin.ExtensionLoader;
import io.opentelemetry.sdk.extension.polling.plugin.PollingContext;
import io.opentelemetry.sdk.extension.polling.plugin.Pollster;
import io.opentelemetry.sdk.extension.polling.plugin.ServiceLoaderExtensionLoader;
import io.opentelemetry.sdk.extension.polling.task.PollingTask;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Polling agent manager.
 *
 * <p>Coordinates polling components including:
 *
 * <ul>
 *   <li>加载 Pollster 与 Discoverer 插件
 *   <li>按采集间隔组装采集任务
 *   <li>加入分区组并维持心跳
 *   <li>带随机打散的定时调度
 * </ul>
 *
 * <p>Pollster 列表过滤与分区协调互斥，同时配置时 {@link Builder#build()} 抛出 {@link
 * PollsterListForbiddenException}。
 */
public final class PollingAgentManager implements Closeable {

  private static final Logger logger = Logger.getLogger(PollingAgentManager.class.getName());

  static final String POLLING_TASK_PREFIX = "polling-task-";
  static final String HEARTBEAT_TASK = "coordination-heartbeat";

  private final PollingAgentConfig config;
  private final PartitionCoordinator coordinator;
  private final PipelineManager pipelineManager;
  private final PublishContextFactory publishContextFactory;
  private final Random random;
  private final ScheduledTaskManager taskManager;
  private final PollingStatistics statistics;
  private final TimeLimitedCaller caller;
  private final PartitionGroupIds groupIds;
  private final PollingContext context;
  private final List<Pollster> pollsters;
  private final DiscoveryResolver discoveryResolver;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  // 当前调度中的采集任务（interval -> task），重新加载时整体替换
  private volatile Map<Duration, PollingTask> pollingTasks = Collections.emptyMap();

  // 当前加入的分区组，重新加载时据此退出不再需要的组
  private volatile Set<String> partitionGroups = Collections.emptySet();

  private PollingAgentManager(Builder builder, PollingAgentConfig config) {
    this.config = config;
    this.coordinator = resolveCoordinator(builder, config);
    this.pipelineManager =
        Objects.requireNonNull(builder.pipelineManager, "pipelineManager is required");
    this.publishContextFactory =
        Objects.requireNonNull(builder.publishContextFactory, "publishContextFactory is required");
    this.random = builder.random != null ? builder.random : new Random();
    this.taskManager =
        builder.taskManager != null
            ? builder.taskManager
            : new ScheduledTaskManager(config.getSchedulerThreads(), "otel-polling");
    this.statistics = builder.statistics != null ? builder.statistics : new PollingStatistics();
    this.caller = TimeLimitedCaller.create(config.getCallTimeout());

    this.groupIds =
        PartitionGroupIds.create(config.getNamespaces(), config.getPartitioningGroupPrefix());
    this.context = new PollingContext(config, groupIds.getPrefix());

    ExtensionLoader extensionLoader =
        builder.extensionLoader != null
            ? builder.extensionLoader
            : new ServiceLoaderExtensionLoader();
    this.pollsters =
        loadExtensions(extensionLoader, config.getNamespaces(), config.getPollsterList());
    this.discoveryResolver =
        new DiscoveryResolver(
            extensionLoader.loadDiscoverers(),
            context,
            coordinator,
            groupIds,
            caller,
            statistics);

    logger.log(
        Level.INFO,
        "Polling agent manager created, pollsters: {0}, discoverers: {1}, group prefix: {2}",
        new Object[] {
          pollsters.size(), discoveryResolver.getDiscoverers().size(), groupIds.getPrefix()
        });
  }

  /**
   * Creates a new builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private static PartitionCoordinator resolveCoordinator(
      Builder builder, PollingAgentConfig config) {
    if (builder.coordinator != null) {
      return builder.coordinator;
    }
    if (!config.isCoordinationEnabled()) {
      return NoOpPartitionCoordinator.getInstance();
    }
    if (builder.membershipBackend == null) {
      throw new IllegalStateException(
          "No membership backend supplied for coordination backend "
              + config.getCoordinationBackendUrl());
    }
    return new MembershipPartitionCoordinator(config.getMemberId(), builder.membershipBackend);
  }

  /**
   * 加载各命名空间下的 Pollster，并按名称通配符过滤
   *
   * @param loader 插件加载器
   * @param namespaces 命名空间
   * @param pollsterList 名称通配符，为空时不过滤
   * @return Pollster 列表
   */
  static List<Pollster> loadExtensions(
      ExtensionLoader loader, List<String> namespaces, List<String> pollsterList) {
    GlobMatcher filter = GlobMatcher.of(pollsterList);
    List<Pollster> loaded = new ArrayList<>();
    for (String namespace : namespaces) {
      for (Pollster pollster : loader.loadPollsters(namespace)) {
        if (filter.isEmpty() || filter.matchesAny(pollster.getName())) {
          loaded.add(pollster);
        } else {
          logger.log(
              Level.FINE,
              "Pollster {0} does not match pollster list {1}",
              new Object[] {pollster.getName(), pollsterList});
        }
      }
    }
    return Collections.unmodifiableList(loaded);
  }

  /** Starts the polling agent manager. */
  public void start() {
    if (closed.get()) {
      logger.log(Level.WARNING, "Polling agent manager is closed");
      return;
    }
    if (!started.compareAndSet(false, true)) {
      logger.log(Level.WARNING, "Polling agent manager already started");
      return;
    }

    logger.log(
        Level.INFO,
        "Starting polling agent manager, memberId: {0}, namespaces: {1}",
        new Object[] {config.getMemberId(), config.getNamespaces()});

    List<Pipeline> pipelines = pipelineManager.getPipelines();

    coordinator.start();
    joinPartitioningGroups(pipelines);
    schedulePollingTasks(pipelines);

    taskManager.scheduleTask(
        ScheduledTaskManager.TaskConfig.create(
            HEARTBEAT_TASK, coordinator::heartbeat, config.getCoordinationHeartbeat()));
  }

  /**
   * 重新读取 pipeline 定义并重建采集任务
   *
   * <p>旧任务的定时器被取消，黑名单随任务一起重置；分区组重新加入，不再需要的分区组被退出，
   * 打散时间重新计算。
   */
  public synchronized void reloadPipelines() {
    if (!started.get() || closed.get()) {
      logger.log(Level.WARNING, "Cannot reload pipelines, polling agent manager is not running");
      return;
    }
    for (String taskName : taskManager.getTaskNames()) {
      if (taskName.startsWith(POLLING_TASK_PREFIX)) {
        taskManager.cancelTask(taskName);
      }
    }
    List<Pipeline> pipelines = pipelineManager.getPipelines();
    Set<String> previous = partitionGroups;
    Set<String> current = joinPartitioningGroups(pipelines);
    for (String group : previous) {
      if (!current.contains(group)) {
        coordinator.leaveGroup(group);
        logger.log(Level.INFO, "Left stale partitioning group {0}", group);
      }
    }
    schedulePollingTasks(pipelines);
    logger.log(Level.INFO, "Reloaded {0} pipelines", pipelines.size());
  }

  private synchronized void schedulePollingTasks(List<Pipeline> pipelines) {
    // 协调生效时推迟一个间隔，等待分区组成员稳定
    boolean delayStart = coordinator.isActive();
    Duration jitter =
        Duration.ofSeconds(random.nextInt(config.getShuffleTimeBeforePollingTask() + 1));

    Map<Duration, PollingTask> tasks = setupPollingTasks(pipelines);
    for (Map.Entry<Duration, PollingTask> entry : tasks.entrySet()) {
      Duration interval = entry.getKey();
      PollingTask task = entry.getValue();
      Duration initialDelay = delayStart ? interval.plus(jitter) : jitter;
      taskManager.scheduleTask(
          ScheduledTaskManager.TaskConfig.create(
              pollingTaskName(interval), task::pollAndPublish, initialDelay, interval));
    }
    this.pollingTasks = Collections.unmodifiableMap(tasks);

    logger.log(
        Level.INFO,
        "Scheduled {0} polling tasks, jitter: {1}s, delayed start: {2}",
        new Object[] {tasks.size(), jitter.getSeconds(), delayStart});
  }

  /**
   * 加入分区组：全部 Discoverer 声明的组，以及每个带静态资源的 pipeline 对应的组
   *
   * @param pipelines pipeline 列表
   * @return 加入的分区组
   */
  Set<String> joinPartitioningGroups(List<Pipeline> pipelines) {
    Set<String> groups = new LinkedHashSet<>(discoveryResolver.getPartitionGroups());
    for (Pipeline pipeline : pipelines) {
      if (pipeline.getResources().isEmpty()) {
        continue;
      }
      String groupId = groupIds.forStaticResources(pipeline.getResources());
      if (groupId != null) {
        groups.add(groupId);
      }
    }
    for (String group : groups) {
      coordinator.joinGroup(group);
    }
    partitionGroups = Collections.unmodifiableSet(groups);
    return partitionGroups;
  }

  /**
   * 按采集间隔组装采集任务
   *
   * @param pipelines pipeline 列表
   * @return interval -> 采集任务
   */
  Map<Duration, PollingTask> setupPollingTasks(List<Pipeline> pipelines) {
    Map<Duration, PollingTask> tasks = new LinkedHashMap<>();
    for (Pipeline pipeline : pipelines) {
      for (Pollster pollster : pollsters) {
        if (pipeline.supportsMeter(pollster.getName())) {
          tasks.computeIfAbsent(pipeline.getInterval(), k -> createPollingTask())
              .add(pollster, pipeline);
        }
      }
    }
    return tasks;
  }

  /**
   * 创建一个空的采集任务
   *
   * @return 采集任务
   */
  PollingTask createPollingTask() {
    return PollingTask.builder()
        .setContext(context)
        .setDiscoveryResolver(discoveryResolver)
        .setCoordinator(coordinator)
        .setGroupIds(groupIds)
        .setPublishContextFactory(publishContextFactory)
        .setCaller(caller)
        .setStatistics(statistics)
        .build();
  }

  /**
   * 解析发现 URL
   *
   * @param urls 发现 URL
   * @param discoveryCache 发现缓存，可为 null
   * @return 发现并分区后的资源
   */
  public List<Object> discover(List<String> urls, @Nullable DiscoveryCache discoveryCache) {
    return discoveryResolver.discover(urls, discoveryCache);
  }

  /**
   * 构造分区组标识
   *
   * @param id Discoverer 组标识或静态资源哈希
   * @return 分区组标识，id 为空时返回 null
   */
  @Nullable
  public String constructGroupId(@Nullable String id) {
    return groupIds.construct(id);
  }

  static String pollingTaskName(Duration interval) {
    return POLLING_TASK_PREFIX + interval.toMillis() + "ms";
  }

  /** Stops polling and leaves the partition groups. */
  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    logger.log(Level.INFO, "Stopping polling agent manager...");
    taskManager.cancelAllTasks();
    coordinator.stop();
    pollingTasks = Collections.emptyMap();
    partitionGroups = Collections.emptySet();
    statistics.logStatus();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    stop();
    taskManager.close();
    caller.close();
    logger.log(Level.INFO, "Polling agent manager closed");
  }

  // ===== Getters =====

  public PollingAgentConfig getConfig() {
    return config;
  }

  public PartitionCoordinator getCoordinator() {
    return coordinator;
  }

  public List<Pollster> getPollsters() {
    return pollsters;
  }

  public DiscoveryResolver getDiscoveryResolver() {
    return discoveryResolver;
  }

  public String getGroupPrefix() {
    return groupIds.getPrefix();
  }

  public PollingContext getContext() {
    return context;
  }

  /**
   * 获取当前调度中的采集任务
   *
   * @return interval -> 采集任务
   */
  public Map<Duration, PollingTask> getPollingTasks() {
    return pollingTasks;
  }

  /**
   * 获取最近一次加入的分区组
   *
   * @return 分区组标识
   */
  public Set<String> getPartitionGroups() {
    return partitionGroups;
  }

  public PollingStatistics getStatistics() {
    return statistics;
  }

  public boolean isStarted() {
    return started.get();
  }

  /** Builder for {@link PollingAgentManager}. */
  public static final class Builder {
    @Nullable private PollingAgentConfig config;
    @Nullable private ExtensionLoader extensionLoader;
    @Nullable private PartitionCoordinator coordinator;
    @Nullable private MembershipBackend membershipBackend;
    @Nullable private PipelineManager pipelineManager;
    @Nullable private PublishContextFactory publishContextFactory;
    @Nullable private Random random;
    @Nullable private ScheduledTaskManager taskManager;
    @Nullable private PollingStatistics statistics;

    private Builder() {}

    public Builder setConfig(PollingAgentConfig config) {
      this.config = config;
      return this;
    }

    public Builder setExtensionLoader(ExtensionLoader extensionLoader) {
      this.extensionLoader = extensionLoader;
      return this;
    }

    /**
     * 指定分区协调器，优先于 {@link #setMembershipBackend(MembershipBackend)}
     *
     * @param coordinator 分区协调器
     * @return 构建器
     */
    public Builder setCoordinator(PartitionCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    /**
     * 指定成员关系后端，配置了协调后端地址时用于创建分区协调器
     *
     * @param membershipBackend 成员关系后端
     * @return 构建器
     */
    public Builder setMembershipBackend(MembershipBackend membershipBackend) {
      this.membershipBackend = membershipBackend;
      return this;
    }

    public Builder setPipelineManager(PipelineManager pipelineManager) {
      this.pipelineManager = pipelineManager;
      return this;
    }

    public Builder setPublishContextFactory(PublishContextFactory publishContextFactory) {
      this.publishContextFactory = publishContextFactory;
      return this;
    }

    /**
     * 指定随机数源，用于计算调度打散时间
     *
     * @param random 随机数源
     * @return 构建器
     */
    public Builder setRandom(Random random) {
      this.random = random;
      return this;
    }

    public Builder setTaskManager(ScheduledTaskManager taskManager) {
      this.taskManager = taskManager;
      return this;
    }

    public Builder setStatistics(PollingStatistics statistics) {
      this.statistics = statistics;
      return this;
    }

    /**
     * 构建管理器
     *
     * @return 管理器
     * @throws PollsterListForbiddenException 同时配置了 Pollster 列表和协调后端
     */
    public PollingAgentManager build() {
      PollingAgentConfig resolved = Objects.requireNonNull(config, "config is required");
      if (!resolved.getPollsterList().isEmpty() && resolved.isCoordinationEnabled()) {
        throw new PollsterListForbiddenException();
      }
      return new PollingAgentManager(this, resolved);
    }
  }
}
