/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

import java.util.List;

/**
 * 发布上下文
 *
 * <p>每个 source 一个，聚合该 source 下所有 pipeline 的发布目标。
 */
public interface PublishContext {

  /**
   * 关联 pipeline
   *
   * @param pipelines pipeline 列表
   */
  void addPipelines(List<Pipeline> pipelines);

  /**
   * 打开一个发布批次
   *
   * @return 发布批次
   */
  PublishBatch openBatch();
}
