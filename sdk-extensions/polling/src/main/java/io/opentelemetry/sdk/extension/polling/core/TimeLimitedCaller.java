/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 插件调用时间限制器。
 *
 * <p>超时为 {@link Duration#ZERO} 时直接在调用线程执行；否则在独立线程池中执行并等待至多
 * 指定时长，超时后取消调用并抛出 {@link CallTimeoutException}。调用本身抛出的运行时异常原样抛出。
 */
public final class TimeLimitedCaller implements Closeable {

  private static final Logger logger = Logger.getLogger(TimeLimitedCaller.class.getName());

  private final Duration timeout;
  @Nullable private final ExecutorService executor;

  private TimeLimitedCaller(Duration timeout) {
    this.timeout = timeout;
    if (timeout.isZero()) {
      this.executor = null;
    } else {
      this.executor =
          Executors.newCachedThreadPool(
              r -> {
                Thread t = new Thread(r, "otel-polling-call");
                t.setDaemon(true);
                return t;
              });
    }
  }

  /**
   * 创建不限时的调用器
   *
   * @return 调用器
   */
  public static TimeLimitedCaller unlimited() {
    return new TimeLimitedCaller(Duration.ZERO);
  }

  /**
   * 创建调用器
   *
   * @param timeout 单次调用超时时间，ZERO 表示不限时
   * @return 调用器
   */
  public static TimeLimitedCaller create(Duration timeout) {
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    return new TimeLimitedCaller(timeout);
  }

  public Duration getTimeout() {
    return timeout;
  }

  /**
   * 执行调用
   *
   * @param callName 调用名称（用于日志和异常信息）
   * @param call 调用体
   * @param <T> 返回值类型
   * @return 调用结果
   */
  public <T> T call(String callName, Supplier<T> call) {
    if (executor == null) {
      return call.get();
    }

    Future<T> future = executor.submit(call::get);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.log(
          Level.WARNING,
          "Call {0} exceeded time budget of {1}ms, cancelled",
          new Object[] {callName, timeout.toMillis()});
      throw new CallTimeoutException(callName, timeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Call " + callName + " failed", cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for call " + callName, e);
    }
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }
}
