/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.task;

import io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionGroupIds;
import io.opentelemetry.sdk.extension.polling.core.PollingStatistics;
import io.opentelemetry.sdk.extension.polling.core.TimeLimitedCaller;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryCache;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryResolver;
import io.opentelemetry.sdk.extension.polling.pipeline.Pipeline;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishBatch;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishContext;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishContextFactory;
import io.opentelemetry.sdk.extension.polling.plugin.PollingContext;
import io.opentelemetry.sdk.extension.polling.plugin.Pollster;
import io.opentelemetry.sdk.extension.polling.plugin.Sample;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 采集任务
 *
 * <p>聚合采集间隔相同的全部 (source, pollster) 配对，由调度器按间隔周期性调用 {@link #pollAndPublish()}。
 *
 * <p>每个周期：
 *
 * <ol>
 *   <li>为每个 source 打开一个发布批次，无论其中的 Pollster 成功与否，批次都只 flush 一次
 *   <li>source 内的 Pollster 顺序执行，共享该 source 的发布批次
 *   <li>资源优先取自配对的 {@link ResourceSet}，为空时才使用 Pollster 的默认发现
 *   <li>黑名单中的资源被过滤；没有资源时跳过该 Pollster
 *   <li>永久失败的资源加入黑名单，其它失败只记录日志
 * </ol>
 *
 * <p>采样缓存与发现缓存每个周期新建，周期结束即丢弃。
 */
public final class PollingTask {

  private static final Logger logger = Logger.getLogger(PollingTask.class.getName());

  private final PollingContext context;
  private final DiscoveryResolver discoveryResolver;
  private final PartitionCoordinator coordinator;
  private final PartitionGroupIds groupIds;
  private final PublishContextFactory publishContextFactory;
  private final TimeLimitedCaller caller;
  private final PollingStatistics statistics;

  /** source -> (pollster name -> pollster) */
  private final Map<String, Map<String, Pollster>> pollsters = new LinkedHashMap<>();

  /** source -> 发布上下文 */
  private final Map<String, PublishContext> publishers = new LinkedHashMap<>();

  /** 配对键 -> 资源集合 */
  private final Map<PairingKey, ResourceSet> resources = new ConcurrentHashMap<>();

  private PollingTask(Builder builder) {
    this.context = Objects.requireNonNull(builder.context, "context is required");
    this.discoveryResolver =
        Objects.requireNonNull(builder.discoveryResolver, "discoveryResolver is required");
    this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator is required");
    this.groupIds = Objects.requireNonNull(builder.groupIds, "groupIds is required");
    this.publishContextFactory =
        Objects.requireNonNull(builder.publishContextFactory, "publishContextFactory is required");
    this.caller = builder.caller != null ? builder.caller : TimeLimitedCaller.unlimited();
    this.statistics = builder.statistics != null ? builder.statistics : new PollingStatistics();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * 注册 (pipeline, pollster) 配对
   *
   * <p>同一 source 重复注册同名 Pollster 不会产生重复项，但配对的资源集合总是按最新的 pipeline 重新配置。
   *
   * @param pollster Pollster
   * @param pipeline pipeline
   */
  public synchronized void add(Pollster pollster, Pipeline pipeline) {
    String sourceName = pipeline.getSourceName();
    publishers
        .computeIfAbsent(sourceName, publishContextFactory::create)
        .addPipelines(Collections.singletonList(pipeline));
    pollsters.computeIfAbsent(sourceName, k -> new LinkedHashMap<>())
        .putIfAbsent(pollster.getName(), pollster);
    resources
        .computeIfAbsent(
            PairingKey.of(sourceName, pollster.getName()),
            k -> new ResourceSet(discoveryResolver, coordinator, groupIds))
        .setup(pipeline);
  }

  /** 执行一个采集周期，所有失败都在内部处理，不向调用方抛出 */
  public void pollAndPublish() {
    long cycle = statistics.recordCycle();
    // 周期内各 Pollster 顺序执行，允许缓存 null 值
    Map<String, Object> cache = Collections.synchronizedMap(new HashMap<>());
    DiscoveryCache discoveryCache = new DiscoveryCache();

    Map<String, List<Pollster>> snapshot = snapshotPollsters();
    logger.log(
        Level.FINE,
        "Starting polling cycle {0} for {1} sources",
        new Object[] {cycle, snapshot.size()});

    for (Map.Entry<String, List<Pollster>> entry : snapshot.entrySet()) {
      String sourceName = entry.getKey();
      PublishBatch batch;
      try {
        batch = publisherFor(sourceName).openBatch();
      } catch (VirtualMachineError e) {
        throw e;
      } catch (RuntimeException | Error e) {
        logger.log(Level.SEVERE, "Unable to open publish batch for source " + sourceName, e);
        continue;
      }
      try {
        for (Pollster pollster : entry.getValue()) {
          poll(sourceName, pollster, batch, cache, discoveryCache);
        }
      } finally {
        flush(sourceName, batch);
      }
    }
    statistics.logPeriodicStatusIfNeeded();
  }

  /**
   * 在一个发布批次内执行单个 Pollster
   *
   * @return 执行结果
   */
  PollOutcome poll(
      String sourceName,
      Pollster pollster,
      PublishBatch batch,
      Map<String, Object> cache,
      DiscoveryCache discoveryCache) {
    logger.log(
        Level.INFO,
        "Polling pollster {0} in the context of {1}",
        new Object[] {pollster.getName(), sourceName});

    ResourceSet resourceSet = getResourceSet(PairingKey.of(sourceName, pollster.getName()));
    if (resourceSet == null) {
      return PollOutcome.skipped();
    }

    List<Object> targets;
    try {
      targets = resolveTargets(pollster, resourceSet, discoveryCache);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (RuntimeException | Error e) {
      PollOutcome outcome = PollOutcome.transientFailure(e);
      handle(sourceName, pollster, resourceSet, outcome);
      return outcome;
    }

    if (targets.isEmpty()) {
      logger.log(Level.INFO, "Skip polling pollster {0}, no resources found", pollster.getName());
      PollOutcome outcome = PollOutcome.skipped();
      handle(sourceName, pollster, resourceSet, outcome);
      return outcome;
    }

    PollOutcome outcome =
        PollOutcome.capture(
            () -> {
              List<Sample> samples =
                  caller.call(
                      "pollster " + pollster.getName(),
                      () -> drain(pollster.getSamples(context, cache, targets)));
              batch.add(samples);
              return samples;
            });
    handle(sourceName, pollster, resourceSet, outcome);
    return outcome;
  }

  private List<Object> resolveTargets(
      Pollster pollster, ResourceSet resourceSet, DiscoveryCache discoveryCache) {
    List<Object> candidates = resourceSet.resolve(discoveryCache);
    if (candidates.isEmpty()) {
      String defaultDiscovery = pollster.getDefaultDiscovery();
      if (defaultDiscovery != null && !defaultDiscovery.isEmpty()) {
        candidates =
            discoveryResolver.discover(
                Collections.singletonList(defaultDiscovery), discoveryCache);
      }
    }

    List<Object> targets = new ArrayList<>(candidates.size());
    for (Object candidate : candidates) {
      if (!resourceSet.isBlacklisted(candidate)) {
        targets.add(candidate);
      }
    }
    return targets;
  }

  private void handle(
      String sourceName, Pollster pollster, ResourceSet resourceSet, PollOutcome outcome) {
    switch (outcome.getKind()) {
      case SUCCESS:
        statistics.recordPoll(outcome.getSamples().size());
        logger.log(
            Level.FINE,
            "Pollster {0} produced {1} samples for source {2}",
            new Object[] {pollster.getName(), outcome.getSamples().size(), sourceName});
        break;
      case SKIPPED:
        statistics.recordSkip();
        break;
      case PERMANENT_FAILURE:
        statistics.recordPermanentFailure();
        Object failed = Objects.requireNonNull(outcome.getFailedResource());
        resourceSet.addToBlacklist(failed);
        logger.log(
            Level.SEVERE,
            "Prevent pollster {0} for polling source {1} on resource {2} anymore!",
            new Object[] {pollster.getName(), sourceName, failed});
        break;
      case TRANSIENT_FAILURE:
        statistics.recordTransientFailure();
        Throwable cause = outcome.getCause();
        logger.log(
            Level.WARNING,
            "Continue after error from " + pollster.getName() + ": "
                + (cause != null ? cause.getMessage() : "unknown"),
            cause);
        break;
    }
  }

  private static void flush(String sourceName, PublishBatch batch) {
    try {
      batch.flush();
    } catch (VirtualMachineError e) {
      throw e;
    } catch (RuntimeException | Error e) {
      logger.log(Level.SEVERE, "Unable to publish samples for source " + sourceName, e);
    }
  }

  private static List<Sample> drain(@Nullable Iterable<Sample> samples) {
    List<Sample> collected = new ArrayList<>();
    if (samples != null) {
      for (Sample sample : samples) {
        collected.add(sample);
      }
    }
    return collected;
  }

  private synchronized Map<String, List<Pollster>> snapshotPollsters() {
    Map<String, List<Pollster>> snapshot = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Pollster>> entry : pollsters.entrySet()) {
      snapshot.put(entry.getKey(), new ArrayList<>(entry.getValue().values()));
    }
    return snapshot;
  }

  private synchronized PublishContext publisherFor(String sourceName) {
    return Objects.requireNonNull(publishers.get(sourceName), sourceName);
  }

  // ===== 查询方法 =====

  /**
   * 获取已注册的 source 名称
   *
   * @return source 名称
   */
  public synchronized Set<String> getSourceNames() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(pollsters.keySet()));
  }

  /**
   * 获取某个 source 下注册的 Pollster
   *
   * @param sourceName source 名称
   * @return Pollster 列表
   */
  public synchronized Collection<Pollster> getPollsters(String sourceName) {
    Map<String, Pollster> registered = pollsters.get(sourceName);
    return registered == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(registered.values()));
  }

  @Nullable
  public ResourceSet getResourceSet(PairingKey key) {
    return resources.get(key);
  }

  @Nullable
  public synchronized PublishContext getPublishContext(String sourceName) {
    return publishers.get(sourceName);
  }

  /** 构建器 */
  public static final class Builder {
    @Nullable private PollingContext context;
    @Nullable private DiscoveryResolver discoveryResolver;
    @Nullable private PartitionCoordinator coordinator;
    @Nullable private PartitionGroupIds groupIds;
    @Nullable private PublishContextFactory publishContextFactory;
    @Nullable private TimeLimitedCaller caller;
    @Nullable private PollingStatistics statistics;

    private Builder() {}

    public Builder setContext(PollingContext context) {
      this.context = context;
      return this;
    }

    public Builder setDiscoveryResolver(DiscoveryResolver discoveryResolver) {
      this.discoveryResolver = discoveryResolver;
      return this;
    }

    public Builder setCoordinator(PartitionCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    public Builder setGroupIds(PartitionGroupIds groupIds) {
      this.groupIds = groupIds;
      return this;
    }

    public Builder setPublishContextFactory(PublishContextFactory publishContextFactory) {
      this.publishContextFactory = publishContextFactory;
      return this;
    }

    public Builder setCaller(TimeLimitedCaller caller) {
      this.caller = caller;
      return this;
    }

    public Builder setStatistics(PollingStatistics statistics) {
      this.statistics = statistics;
      return this;
    }

    public PollingTask build() {
      return new PollingTask(this);
    }
  }
}
