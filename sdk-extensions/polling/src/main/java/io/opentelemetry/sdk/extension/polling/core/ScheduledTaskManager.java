/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 定时器注册表。
 *
 * <p>采集 Agent 的所有周期性定时器（每个采集间隔一个，以及协调心跳）都经由此类注册：
 *
 * <ul>
 *   <li>定时器按名称注册，同名定时器先取消再重新调度
 *   <li>以固定频率执行；同一定时器的两次执行不会重叠，执行超时会推迟下一次
 *   <li>执行体抛出的异常被记录并计数，不会终止后续执行
 * </ul>
 */
public final class ScheduledTaskManager implements Closeable {

  private static final Logger logger = Logger.getLogger(ScheduledTaskManager.class.getName());

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  /** 定时器定义 */
  public static final class TaskConfig {
    private final String name;
    private final Runnable task;
    private final Duration initialDelay;
    private final Duration interval;

    private TaskConfig(String name, Runnable task, Duration initialDelay, Duration interval) {
      this.name = name;
      this.task = task;
      this.initialDelay = initialDelay;
      this.interval = interval;
    }

    /**
     * 创建定时器定义
     *
     * @param name 定时器名称
     * @param task 执行体
     * @param initialDelay 首次执行前的延迟
     * @param interval 执行间隔，必须为正
     * @return 定时器定义
     */
    public static TaskConfig create(
        String name, Runnable task, Duration initialDelay, Duration interval) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(task, "task");
      if (interval.isNegative() || interval.isZero()) {
        throw new IllegalArgumentException("interval must be positive: " + name);
      }
      if (initialDelay.isNegative()) {
        throw new IllegalArgumentException("initialDelay must not be negative: " + name);
      }
      return new TaskConfig(name, task, initialDelay, interval);
    }

    /** 立即开始执行的定时器。 */
    @SuppressWarnings("InconsistentOverloads")
    public static TaskConfig create(String name, Runnable task, Duration interval) {
      return create(name, task, Duration.ZERO, interval);
    }

    public String getName() {
      return name;
    }

    public Runnable getTask() {
      return task;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public Duration getInterval() {
      return interval;
    }

    @Override
    public String toString() {
      return "TaskConfig{name="
          + name
          + ", initialDelay="
          + initialDelay
          + ", interval="
          + interval
          + "}";
    }
  }

  private final ScheduledExecutorService scheduler;
  private final Map<String, Timer> timers = new LinkedHashMap<>();
  private volatile boolean closed;

  /**
   * 创建定时器注册表
   *
   * @param threadPoolSize 调度线程数
   * @param threadNamePrefix 线程名前缀
   */
  public ScheduledTaskManager(int threadPoolSize, String threadNamePrefix) {
    AtomicInteger threadIndex = new AtomicInteger();
    this.scheduler =
        Executors.newScheduledThreadPool(
            threadPoolSize,
            r -> {
              Thread t = new Thread(r, threadNamePrefix + "-" + threadIndex.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * 注册并启动定时器，同名定时器会被替换
   *
   * @param config 定时器定义
   * @return 注册表已关闭时返回 false
   */
  public synchronized boolean scheduleTask(TaskConfig config) {
    if (closed) {
      logger.log(Level.WARNING, "Cannot schedule timer {0}, scheduler is closed", config.getName());
      return false;
    }
    Timer previous = timers.remove(config.getName());
    if (previous != null) {
      previous.cancel();
    }

    Timer timer = new Timer(config);
    timer.future =
        scheduler.scheduleAtFixedRate(
            timer,
            config.getInitialDelay().toMillis(),
            config.getInterval().toMillis(),
            TimeUnit.MILLISECONDS);
    timers.put(config.getName(), timer);

    logger.log(
        Level.INFO,
        "Scheduled timer {0}, first run in {1}ms, then every {2}ms",
        new Object[] {
          config.getName(), config.getInitialDelay().toMillis(), config.getInterval().toMillis()
        });
    return true;
  }

  /**
   * 取消定时器，正在进行的执行会完成
   *
   * @param taskName 定时器名称
   * @return 定时器存在且被取消时返回 true
   */
  public synchronized boolean cancelTask(String taskName) {
    Timer timer = timers.remove(taskName);
    if (timer == null) {
      return false;
    }
    boolean cancelled = timer.cancel();
    logger.log(
        Level.INFO,
        "Cancelled timer {0} after {1} runs",
        new Object[] {taskName, timer.runs.get()});
    return cancelled;
  }

  public synchronized void cancelAllTasks() {
    for (String taskName : new ArrayList<>(timers.keySet())) {
      cancelTask(taskName);
    }
  }

  public synchronized boolean isTaskRunning(String taskName) {
    Timer timer = timers.get(taskName);
    return timer != null && timer.isActive();
  }

  /**
   * 获取已注册的定时器名称
   *
   * @return 定时器名称，按注册顺序
   */
  public synchronized List<String> getTaskNames() {
    return new ArrayList<>(timers.keySet());
  }

  public synchronized int getRunningTaskCount() {
    int count = 0;
    for (Timer timer : timers.values()) {
      if (timer.isActive()) {
        count++;
      }
    }
    return count;
  }

  /**
   * 获取定时器的执行次数（含失败的执行）
   *
   * @param taskName 定时器名称
   * @return 执行次数，定时器不存在时为 0
   */
  public long getRunCount(String taskName) {
    Timer timer = findTimer(taskName);
    return timer == null ? 0 : timer.runs.get();
  }

  public long getFailureCount(String taskName) {
    Timer timer = findTimer(taskName);
    return timer == null ? 0 : timer.failures.get();
  }

  /**
   * 获取执行耗时超过间隔的次数
   *
   * @param taskName 定时器名称
   * @return 超时次数，定时器不存在时为 0
   */
  public long getOverrunCount(String taskName) {
    Timer timer = findTimer(taskName);
    return timer == null ? 0 : timer.overruns.get();
  }

  public boolean isClosed() {
    return closed;
  }

  @Nullable
  private synchronized Timer findTimer(String taskName) {
    return timers.get(taskName);
  }

  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      cancelAllTasks();
    }

    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Timers still running after shutdown timeout, interrupting");
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
    logger.log(Level.INFO, "Scheduler closed");
  }

  private static final class Timer implements Runnable {
    private final TaskConfig config;
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong overruns = new AtomicLong();
    @Nullable private volatile ScheduledFuture<?> future;

    private Timer(TaskConfig config) {
      this.config = config;
    }

    @Override
    public void run() {
      long start = System.nanoTime();
      try {
        config.getTask().run();
      } catch (Throwable t) {
        // 异常逃逸会让 ScheduledExecutorService 静默停止后续执行
        failures.incrementAndGet();
        logger.log(Level.WARNING, "Timer " + config.getName() + " failed: " + t.getMessage(), t);
      } finally {
        runs.incrementAndGet();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (elapsedMillis > config.getInterval().toMillis()) {
          overruns.incrementAndGet();
          logger.log(
              Level.WARNING,
              "Timer {0} took {1}ms, longer than its {2}ms interval",
              new Object[] {config.getName(), elapsedMillis, config.getInterval().toMillis()});
        }
      }
    }

    private boolean cancel() {
      ScheduledFuture<?> current = future;
      return current != null && current.cancel(false);
    }

    private boolean isActive() {
      ScheduledFuture<?> current = future;
      return current != null && !current.isCancelled() && !current.isDone();
    }
  }
}
