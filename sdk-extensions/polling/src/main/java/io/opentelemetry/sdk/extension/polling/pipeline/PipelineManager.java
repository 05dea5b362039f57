/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

import java.util.List;

/** pipeline 定义来源，每次调用返回当前生效的定义。 */
@FunctionalInterface
public interface PipelineManager {

  List<Pipeline> getPipelines();
}
