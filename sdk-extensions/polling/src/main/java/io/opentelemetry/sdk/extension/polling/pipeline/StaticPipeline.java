/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.pipeline;

import io.opentelemetry.sdk.extension.polling.core.GlobMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * 不可变的 pipeline 定义
 *
 * <p>meter 选择规则：
 *
 * <ul>
 *   <li>{@code *} 选中全部 meter
 *   <li>{@code disk.*} 等通配符选中匹配的 meter
 *   <li>{@code !disk.*} 排除匹配的 meter；只有排除规则时，未被排除的 meter 默认选中
 *   <li>同一 pipeline 不能同时包含选中规则和排除规则
 * </ul>
 */
public final class StaticPipeline implements Pipeline {

  private final String name;
  private final String sourceName;
  private final Duration interval;
  private final List<Object> resources;
  private final List<String> discovery;
  private final List<String> meters;
  private final GlobMatcher includes;
  private final GlobMatcher excludes;
  private final boolean defaultSupported;

  private StaticPipeline(Builder builder) {
    this.sourceName = Objects.requireNonNull(builder.sourceName, "sourceName is required");
    this.name = builder.name != null ? builder.name : sourceName;
    this.interval = Objects.requireNonNull(builder.interval, "interval is required");
    this.resources = Collections.unmodifiableList(new ArrayList<>(builder.resources));
    this.discovery = Collections.unmodifiableList(new ArrayList<>(builder.discovery));
    this.meters = Collections.unmodifiableList(new ArrayList<>(builder.meters));

    List<String> included = new ArrayList<>();
    List<String> excluded = new ArrayList<>();
    for (String meter : meters) {
      if (meter.startsWith("!")) {
        excluded.add(meter.substring(1));
      } else {
        included.add(meter);
      }
    }
    this.includes = GlobMatcher.of(included);
    this.excludes = GlobMatcher.of(excluded);
    this.defaultSupported = included.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getSourceName() {
    return sourceName;
  }

  @Override
  public Duration getInterval() {
    return interval;
  }

  @Override
  public List<Object> getResources() {
    return resources;
  }

  @Override
  public List<String> getDiscovery() {
    return discovery;
  }

  public List<String> getMeters() {
    return meters;
  }

  @Override
  public boolean supportsMeter(String meterName) {
    if (excludes.matchesAny(meterName)) {
      return false;
    }
    if (includes.matchesAny(meterName)) {
      return true;
    }
    return defaultSupported;
  }

  @Override
  public String toString() {
    return "StaticPipeline{name=" + name + ", source=" + sourceName + ", interval=" + interval
        + ", meters=" + meters + ", resources=" + resources + ", discovery=" + discovery + "}";
  }

  /** 构建器 */
  public static final class Builder {
    @Nullable private String name;
    @Nullable private String sourceName;
    @Nullable private Duration interval;
    private List<Object> resources = Collections.emptyList();
    private List<String> discovery = Collections.emptyList();
    private List<String> meters = Collections.singletonList("*");

    private Builder() {}

    public Builder setName(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    public Builder setSourceName(String sourceName) {
      this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
      return this;
    }

    public Builder setInterval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    public Builder setResources(List<?> resources) {
      this.resources = new ArrayList<>(Objects.requireNonNull(resources, "resources"));
      return this;
    }

    public Builder setDiscovery(List<String> discovery) {
      this.discovery = Objects.requireNonNull(discovery, "discovery");
      return this;
    }

    public Builder setDiscovery(String... discovery) {
      return setDiscovery(Arrays.asList(discovery));
    }

    public Builder setMeters(List<String> meters) {
      this.meters = Objects.requireNonNull(meters, "meters");
      return this;
    }

    public Builder setMeters(String... meters) {
      return setMeters(Arrays.asList(meters));
    }

    /**
     * 构建 pipeline
     *
     * @return pipeline
     */
    public StaticPipeline build() {
      validate();
      return new StaticPipeline(this);
    }

    private void validate() {
      if (sourceName == null || sourceName.isEmpty()) {
        throw new IllegalArgumentException("sourceName is required");
      }
      if (interval == null || interval.isNegative() || interval.isZero()) {
        throw new IllegalArgumentException("interval must be positive for source " + sourceName);
      }
      if (meters.isEmpty()) {
        throw new IllegalArgumentException("no meters specified for source " + sourceName);
      }
      boolean hasExcluded = false;
      boolean hasIncluded = false;
      for (String meter : meters) {
        if (meter.startsWith("!")) {
          hasExcluded = true;
        } else {
          hasIncluded = true;
        }
      }
      if (hasExcluded && hasIncluded) {
        throw new IllegalArgumentException(
            "both included and excluded meters specified for source " + sourceName);
      }
    }
  }
}
