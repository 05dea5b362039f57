/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 采集统计信息。
 *
 * <p>进程内所有采集任务共享一个实例，计数器均为线程安全：
 *
 * <ul>
 *   <li>采集周期数、Pollster 调用数、采样数
 *   <li>无资源跳过数
 *   <li>永久失败、临时失败、发现失败次数
 *   <li>周期性状态日志
 * </ul>
 */
public final class PollingStatistics {

  private static final Logger logger = Logger.getLogger(PollingStatistics.class.getName());

  /** 默认状态日志输出间隔（毫秒） */
  private static final long DEFAULT_STATUS_LOG_INTERVAL_MS = 60_000;

  private final AtomicLong cycleCount = new AtomicLong(0);
  private final AtomicLong pollCount = new AtomicLong(0);
  private final AtomicLong sampleCount = new AtomicLong(0);
  private final AtomicLong skipCount = new AtomicLong(0);
  private final AtomicLong permanentFailureCount = new AtomicLong(0);
  private final AtomicLong transientFailureCount = new AtomicLong(0);
  private final AtomicLong discoveryFailureCount = new AtomicLong(0);
  private final AtomicLong lastStatusLogTime = new AtomicLong(0);
  private final long statusLogIntervalMs;

  public PollingStatistics() {
    this(DEFAULT_STATUS_LOG_INTERVAL_MS);
  }

  /**
   * 创建统计信息（自定义日志间隔）
   *
   * @param statusLogIntervalMs 状态日志间隔（毫秒）
   */
  public PollingStatistics(long statusLogIntervalMs) {
    this.statusLogIntervalMs = statusLogIntervalMs;
  }

  public long recordCycle() {
    return cycleCount.incrementAndGet();
  }

  /**
   * 记录一次成功的 Pollster 调用
   *
   * @param samples 本次产生的采样数
   */
  public void recordPoll(int samples) {
    pollCount.incrementAndGet();
    sampleCount.addAndGet(samples);
  }

  public void recordSkip() {
    skipCount.incrementAndGet();
  }

  public void recordPermanentFailure() {
    pollCount.incrementAndGet();
    permanentFailureCount.incrementAndGet();
  }

  public void recordTransientFailure() {
    pollCount.incrementAndGet();
    transientFailureCount.incrementAndGet();
  }

  public void recordDiscoveryFailure() {
    discoveryFailureCount.incrementAndGet();
  }

  public long getCycleCount() {
    return cycleCount.get();
  }

  public long getPollCount() {
    return pollCount.get();
  }

  public long getSampleCount() {
    return sampleCount.get();
  }

  public long getSkipCount() {
    return skipCount.get();
  }

  public long getPermanentFailureCount() {
    return permanentFailureCount.get();
  }

  public long getTransientFailureCount() {
    return transientFailureCount.get();
  }

  public long getDiscoveryFailureCount() {
    return discoveryFailureCount.get();
  }

  /** 周期性输出状态日志（如果满足时间间隔条件） */
  public void logPeriodicStatusIfNeeded() {
    long now = System.currentTimeMillis();
    long lastLog = lastStatusLogTime.get();
    if (now - lastLog >= statusLogIntervalMs && lastStatusLogTime.compareAndSet(lastLog, now)) {
      logStatus();
    }
  }

  /** 强制输出状态日志 */
  public void logStatus() {
    logger.log(
        Level.INFO,
        "Polling status - cycles: {0}, polls: {1}, samples: {2}, skipped: {3}, "
            + "permanentFailures: {4}, transientFailures: {5}, discoveryFailures: {6}",
        new Object[] {
          cycleCount.get(),
          pollCount.get(),
          sampleCount.get(),
          skipCount.get(),
          permanentFailureCount.get(),
          transientFailureCount.get(),
          discoveryFailureCount.get()
        });
  }
}
