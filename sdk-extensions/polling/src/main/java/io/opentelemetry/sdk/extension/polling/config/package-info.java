/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 采集 Agent 配置 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.config;

import javax.annotation.ParametersAreNonnullByDefault;
