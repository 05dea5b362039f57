/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

import io.opentelemetry.sdk.extension.polling.plugin.Sample;
import java.util.List;

/**
 * 发布批次
 *
 * <p>由 {@link PublishContext#openBatch()} 打开，收集一个 source 在一个采集周期内的全部采样，
 * 在 {@link #flush()} 时统一发布。不支持并发写入。
 */
public interface PublishBatch {

  /**
   * 追加采样
   *
   * @param samples 采样
   */
  void add(List<Sample> samples);

  /** 发布并关闭批次，每个批次只调用一次 */
  void flush();
}
