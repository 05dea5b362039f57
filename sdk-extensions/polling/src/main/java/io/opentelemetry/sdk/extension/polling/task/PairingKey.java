/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.task;

import java.util.Objects;
import javax.annotation.Nullable;

/** (source, pollster) 配对键，在一个采集任务内唯一标识一个 {@link ResourceSet}。 */
public final class PairingKey {

  private final String sourceName;
  private final String pollsterName;

  private PairingKey(String sourceName, String pollsterName) {
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    this.pollsterName = Objects.requireNonNull(pollsterName, "pollsterName");
  }

  public static PairingKey of(String sourceName, String pollsterName) {
    return new PairingKey(sourceName, pollsterName);
  }

  public String getSourceName() {
    return sourceName;
  }

  public String getPollsterName() {
    return pollsterName;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PairingKey)) {
      return false;
    }
    PairingKey that = (PairingKey) o;
    return sourceName.equals(that.sourceName) && pollsterName.equals(that.pollsterName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceName, pollsterName);
  }

  @Override
  public String toString() {
    return sourceName + "-" + pollsterName;
  }
}
