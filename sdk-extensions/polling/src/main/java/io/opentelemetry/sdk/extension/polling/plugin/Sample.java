/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 采样数据
 *
 * <p>Pollster 针对单个资源产生的一次测量结果。核心调度逻辑只负责收集并交给发布批次，不解析其内容。
 */
public final class Sample {

  /** 采样类型 */
  public enum Type {
    /** 瞬时值 */
    GAUGE,
    /** 单调累计值 */
    CUMULATIVE,
    /** 与上次采样的差值 */
    DELTA
  }

  private final String name;
  private final Type type;
  private final String unit;
  private final double volume;
  private final String resourceId;
  private final Instant timestamp;
  private final Map<String, String> attributes;

  private Sample(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name is required");
    this.type = builder.type;
    this.unit = builder.unit;
    this.volume = builder.volume;
    this.resourceId = Objects.requireNonNull(builder.resourceId, "resourceId is required");
    this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getName() {
    return name;
  }

  public Type getType() {
    return type;
  }

  public String getUnit() {
    return unit;
  }

  public double getVolume() {
    return volume;
  }

  public String getResourceId() {
    return resourceId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    Sample that = (Sample) o;
    return Double.compare(volume, that.volume) == 0
        && name.equals(that.name)
        && type == that.type
        && unit.equals(that.unit)
        && resourceId.equals(that.resourceId)
        && timestamp.equals(that.timestamp)
        && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, unit, volume, resourceId, timestamp, attributes);
  }

  @Override
  public String toString() {
    return "Sample{name=" + name + ", type=" + type + ", volume=" + volume + unit
        + ", resourceId=" + resourceId + ", timestamp=" + timestamp + "}";
  }

  /** 构建器 */
  public static final class Builder {
    @Nullable private String name;
    private Type type = Type.GAUGE;
    private String unit = "";
    private double volume;
    @Nullable private String resourceId;
    @Nullable private Instant timestamp;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    private Builder() {}

    public Builder setName(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    public Builder setType(Type type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    public Builder setUnit(String unit) {
      this.unit = Objects.requireNonNull(unit, "unit");
      return this;
    }

    public Builder setVolume(double volume) {
      this.volume = volume;
      return this;
    }

    public Builder setResourceId(String resourceId) {
      this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
      return this;
    }

    public Builder setTimestamp(Instant timestamp) {
      this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
      return this;
    }

    public Builder putAttribute(String key, String value) {
      this.attributes.put(key, value);
      return this;
    }

    public Sample build() {
      return new Sample(this);
    }
  }
}
