/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.discovery;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * 单个采集周期内的发现结果缓存（发现 URL -> 分区后的资源）。
 *
 * <p>每次 {@code pollAndPublish} 新建一个，周期结束即丢弃，保证同一周期内每个发现 URL 最多调用一次 Discoverer。
 */
public final class DiscoveryCache {

  private final Map<String, List<Object>> entries = new ConcurrentHashMap<>();

  @Nullable
  public List<Object> get(String url) {
    return entries.get(url);
  }

  public void put(String url, List<Object> resources) {
    entries.put(url, Collections.unmodifiableList(resources));
  }

  public boolean contains(String url) {
    return entries.containsKey(url);
  }

  public int size() {
    return entries.size();
  }
}
