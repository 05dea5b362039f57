/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

/** 为每个 source 创建发布上下文。 */
@FunctionalInterface
public interface PublishContextFactory {

  /**
   * 创建发布上下文
   *
   * @param sourceName source 名称
   * @return 发布上下文
   */
  PublishContext create(String sourceName);
}
