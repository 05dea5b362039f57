/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.core;

import java.time.Duration;

/** 插件调用超过时间预算。 */
public class CallTimeoutException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String callName;
  private final Duration timeout;

  public CallTimeoutException(String callName, Duration timeout) {
    super("Call " + callName + " timed out after " + timeout.toMillis() + "ms");
    this.callName = callName;
    this.timeout = timeout;
  }

  public String getCallName() {
    return callName;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
