/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.testing;

import io.opentelemetry.sdk.extension.polling.pipeline.Pipeline;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishBatch;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishContext;
import io.opentelemetry.sdk.extension.polling.pipeline.PublishContextFactory;
import io.opentelemetry.sdk.extension.polling.plugin.Sample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;

/** Publish context factory that keeps every flushed batch in memory, per source. */
public final class RecordingPublishContextFactory implements PublishContextFactory {

  private final Map<String, RecordingPublishContext> contexts = new ConcurrentHashMap<>();
  private final List<String> created = new CopyOnWriteArrayList<>();
  private volatile boolean failFlush;

  @Override
  public PublishContext create(String sourceName) {
    created.add(sourceName);
    return contexts.computeIfAbsent(sourceName, RecordingPublishContext::new);
  }

  public void setFailFlush(boolean failFlush) {
    this.failFlush = failFlush;
  }

  /** Names passed to {@link #create(String)}, in call order. */
  public List<String> getCreated() {
    return created;
  }

  @Nullable
  public RecordingPublishContext get(String sourceName) {
    return contexts.get(sourceName);
  }

  /** Publish context of one source. */
  public final class RecordingPublishContext implements PublishContext {
    private final String sourceName;
    private final List<Pipeline> pipelines = new CopyOnWriteArrayList<>();
    private final List<List<Sample>> flushed = new CopyOnWriteArrayList<>();
    private volatile int openedBatches;

    RecordingPublishContext(String sourceName) {
      this.sourceName = sourceName;
    }

    @Override
    public void addPipelines(List<Pipeline> pipelines) {
      this.pipelines.addAll(pipelines);
    }

    @Override
    public synchronized PublishBatch openBatch() {
      openedBatches++;
      return new PublishBatch() {
        private final List<Sample> pending = new ArrayList<>();

        @Override
        public void add(List<Sample> samples) {
          pending.addAll(samples);
        }

        @Override
        public void flush() {
          flushed.add(Collections.unmodifiableList(new ArrayList<>(pending)));
          if (failFlush) {
            throw new IllegalStateException("publish failed for " + sourceName);
          }
        }
      };
    }

    public List<Pipeline> getPipelines() {
      return pipelines;
    }

    /** One entry per flushed batch. */
    public List<List<Sample>> getFlushed() {
      return flushed;
    }

    public int getOpenedBatches() {
      return openedBatches;
    }
  }
}
