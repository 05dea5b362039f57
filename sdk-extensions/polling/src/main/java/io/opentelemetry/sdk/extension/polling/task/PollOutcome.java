/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.task;

import io.opentelemetry.sdk.extension.polling.plugin.PollsterPermanentException;
import io.opentelemetry.sdk.extension.polling.plugin.Sample;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * 单个 Pollster 在一个周期内的执行结果
 *
 * <p>采集任务根据 {@link Kind} 决定后续处理，而不是根据异常类型：
 *
 * <ul>
 *   <li>{@link Kind#SUCCESS}：采样已交给发布批次
 *   <li>{@link Kind#SKIPPED}：没有可采集的资源
 *   <li>{@link Kind#PERMANENT_FAILURE}：{@link #getFailedResource()} 需加入黑名单
 *   <li>{@link Kind#TRANSIENT_FAILURE}：仅记录，下个周期自然重试
 * </ul>
 */
public final class PollOutcome {

  /** 结果类型 */
  public enum Kind {
    SUCCESS,
    SKIPPED,
    PERMANENT_FAILURE,
    TRANSIENT_FAILURE
  }

  private static final PollOutcome SKIPPED = new PollOutcome(Kind.SKIPPED, null, null, null);

  private final Kind kind;
  @Nullable private final List<Sample> samples;
  @Nullable private final Object failedResource;
  @Nullable private final Throwable cause;

  private PollOutcome(
      Kind kind,
      @Nullable List<Sample> samples,
      @Nullable Object failedResource,
      @Nullable Throwable cause) {
    this.kind = kind;
    this.samples = samples;
    this.failedResource = failedResource;
    this.cause = cause;
  }

  // ===== 工厂方法 =====

  public static PollOutcome success(List<Sample> samples) {
    return new PollOutcome(
        Kind.SUCCESS, Collections.unmodifiableList(samples), null, null);
  }

  public static PollOutcome skipped() {
    return SKIPPED;
  }

  public static PollOutcome permanentFailure(Object failedResource, @Nullable Throwable cause) {
    return new PollOutcome(
        Kind.PERMANENT_FAILURE,
        null,
        Objects.requireNonNull(failedResource, "failedResource"),
        cause);
  }

  public static PollOutcome transientFailure(Throwable cause) {
    return new PollOutcome(
        Kind.TRANSIENT_FAILURE, null, null, Objects.requireNonNull(cause, "cause"));
  }

  /**
   * 执行采样并将异常归类为结果
   *
   * @param poll 采样调用
   * @return 执行结果
   */
  public static PollOutcome capture(Supplier<List<Sample>> poll) {
    try {
      return success(poll.get());
    } catch (PollsterPermanentException e) {
      return permanentFailure(e.getFailedResource(), e);
    } catch (RuntimeException e) {
      return transientFailure(e);
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Error e) {
      // 插件缺少可选依赖等链接错误只影响本次采样
      return transientFailure(e);
    }
  }

  public Kind getKind() {
    return kind;
  }

  public List<Sample> getSamples() {
    return samples != null ? samples : Collections.emptyList();
  }

  /**
   * 获取永久失败的资源
   *
   * @return 失败资源，非 {@link Kind#PERMANENT_FAILURE} 时为 null
   */
  @Nullable
  public Object getFailedResource() {
    return failedResource;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  @Override
  public String toString() {
    switch (kind) {
      case SUCCESS:
        return "PollOutcome{SUCCESS, samples=" + getSamples().size() + "}";
      case PERMANENT_FAILURE:
        return "PollOutcome{PERMANENT_FAILURE, resource=" + failedResource + "}";
      case TRANSIENT_FAILURE:
        return "PollOutcome{TRANSIENT_FAILURE, cause=" + cause + "}";
      case SKIPPED:
      default:
        return "PollOutcome{SKIPPED}";
    }
  }
}
