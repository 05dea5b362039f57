/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.coordination;

import javax.annotation.Nullable;

/** 协调后端操作失败。 */
public class CoordinationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public CoordinationException(String message) {
    super(message);
  }

  public CoordinationException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
