/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 发现 URL 解析与资源发现 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.discovery;

import javax.annotation.ParametersAreNonnullByDefault;
