/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * 采集插件接口与加载
 *
 * <p>Pollster 与 Discoverer 通过 {@link java.util.ServiceLoader} 注册的 Provider 加载。
 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.polling.plugin;

import javax.annotation.ParametersAreNonnullByDefault;
