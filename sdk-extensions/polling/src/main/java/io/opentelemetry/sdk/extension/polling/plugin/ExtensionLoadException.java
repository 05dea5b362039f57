/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import javax.annotation.Nullable;

/**
 * 插件加载异常
 *
 * <p>插件提供者在当前环境下无法创建插件实例时抛出（例如依赖的本地库不存在）。
 * 加载器会记录并跳过该插件，不影响其它插件的加载。
 */
public class ExtensionLoadException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ExtensionLoadException(String message) {
    super(message);
  }

  public ExtensionLoadException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
