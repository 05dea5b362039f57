/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** Pipeline 与发布批次接口 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.pipeline;

import javax.annotation.ParametersAreNonnullByDefault;
