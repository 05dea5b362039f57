/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

/**
 * Pollster 永久失败异常
 *
 * <p>表示某个资源永远无法被该 Pollster 采集（例如资源类型不受支持）。
 * 抛出后该资源会从对应配对的后续采集中排除。
 */
public class PollsterPermanentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final transient Object failedResource;

  public PollsterPermanentException(Object failedResource) {
    this(failedResource, "Permanent failure polling resource: " + failedResource);
  }

  public PollsterPermanentException(Object failedResource, String message) {
    super(message);
    this.failedResource = failedResource;
  }

  /**
   * 获取失败的资源
   *
   * @return 失败的资源
   */
  public Object getFailedResource() {
    return failedResource;
  }
}
