/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.opentelemetry.sdk.extension.polling.config.PollingAgentConfig;
import io.opentelemetry.sdk.extension.polling.coordination.NoOpPartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionCoordinator;
import io.opentelemetry.sdk.extension.polling.coordination.PartitionGroupIds;
import io.opentelemetry.sdk.extension.polling.core.PollingStatistics;
import io.opentelemetry.sdk.extension.polling.core.TimeLimitedCaller;
import io.opentelemetry.sdk.extension.polling.discovery.DiscoveryResolver;
import io.opentelemetry.sdk.extension.polling.pipeline.StaticPipeline;
import io.opentelemetry.sdk.extension.polling.plugin.Discoverer;
import io.opentelemetry.sdk.extension.polling.plugin.PollingContext;
import io.opentelemetry.sdk.extension.polling.plugin.PollsterPermanentException;
import io.opentelemetry.sdk.extension.polling.plugin.Sample;
import io.opentelemetry.sdk.extension.polling.testing.RecordingPublishContextFactory;
import io.opentelemetry.sdk.extension.polling.testing.RecordingPublishContextFactory.RecordingPublishContext;
import io.opentelemetry.sdk.extension.polling.testing.TestDiscoverer;
import io.opentelemetry.sdk.extension.polling.testing.TestPollster;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PollingTaskTest {

  private static final Duration INTERVAL = Duration.ofSeconds(600);

  private PollingContext context;
  private PartitionGroupIds groupIds;
  private PollingStatistics statistics;
  private RecordingPublishContextFactory publishers;
  private TimeLimitedCaller caller;

  @BeforeEach
  void setUp() {
    PollingAgentConfig config = PollingAgentConfig.builder().build();
    groupIds = PartitionGroupIds.create(config.getNamespaces(), null);
    context = new PollingContext(config, groupIds.getPrefix());
    statistics = new PollingStatistics();
    publishers = new RecordingPublishContextFactory();
    caller = TimeLimitedCaller.unlimited();
  }

  @AfterEach
  void tearDown() {
    caller.close();
  }

  private PollingTask task(Discoverer... discoverers) {
    PartitionCoordinator coordinator = NoOpPartitionCoordinator.getInstance();
    DiscoveryResolver resolver =
        new DiscoveryResolver(
            Arrays.asList(discoverers), context, coordinator, groupIds, caller, statistics);
    return PollingTask.builder()
        .setContext(context)
        .setDiscoveryResolver(resolver)
        .setCoordinator(coordinator)
        .setGroupIds(groupIds)
        .setPublishContextFactory(publishers)
        .setCaller(caller)
        .setStatistics(statistics)
        .build();
  }

  private static StaticPipeline.Builder pipeline(String source) {
    return StaticPipeline.builder().setSourceName(source).setInterval(INTERVAL);
  }

  private RecordingPublishContext published(String source) {
    RecordingPublishContext publishContext = publishers.get(source);
    assertThat(publishContext).isNotNull();
    return publishContext;
  }

  @Test
  void pollsStaticResourcesAndFlushesOneBatch() {
    TestPollster cpu = new TestPollster("cpu");
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Arrays.asList("r1", "r2")).build());

    task.pollAndPublish();

    assertThat(cpu.getInvocations()).containsExactly(Arrays.asList("r1", "r2"));
    RecordingPublishContext publishContext = published("src1");
    assertThat(publishContext.getOpenedBatches()).isEqualTo(1);
    assertThat(publishContext.getFlushed()).hasSize(1);
    assertThat(publishContext.getFlushed().get(0))
        .extracting(Sample::getResourceId)
        .containsExactly("r1", "r2");
    assertThat(statistics.getPollCount()).isEqualTo(1);
    assertThat(statistics.getSampleCount()).isEqualTo(2);
  }

  @Test
  void permanentFailureBlacklistsOnlyTheFailedResource() {
    AtomicInteger calls = new AtomicInteger();
    TestPollster cpu =
        new TestPollster("cpu")
            .setBehavior(
                resources -> {
                  if (calls.incrementAndGet() == 1) {
                    throw new PollsterPermanentException("r1");
                  }
                  return TestPollster.samplesFor(resources);
                });
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Arrays.asList("r1", "r2")).build());

    task.pollAndPublish();
    task.pollAndPublish();
    task.pollAndPublish();

    assertThat(cpu.getInvocations())
        .containsExactly(
            Arrays.asList("r1", "r2"),
            Collections.singletonList("r2"),
            Collections.singletonList("r2"));
    ResourceSet resourceSet = task.getResourceSet(PairingKey.of("src1", "cpu"));
    assertThat(resourceSet).isNotNull();
    assertThat(resourceSet.getBlacklist()).containsExactly("r1");
    assertThat(published("src1").getFlushed()).hasSize(3);
    assertThat(published("src1").getFlushed().get(0)).isEmpty();
    assertThat(statistics.getPermanentFailureCount()).isEqualTo(1);
  }

  @Test
  void everyResourceBlacklistedSkipsPollster() {
    TestPollster cpu =
        new TestPollster("cpu")
            .setBehavior(
                resources -> {
                  throw new PollsterPermanentException(resources.get(0));
                });
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("r1")).build());

    task.pollAndPublish();
    task.pollAndPublish();

    assertThat(cpu.getInvocationCount()).isEqualTo(1);
    assertThat(statistics.getSkipCount()).isEqualTo(1);
  }

  @Test
  void transientFailureIsRetriedNextCycle() {
    AtomicInteger calls = new AtomicInteger();
    TestPollster flaky =
        new TestPollster("flaky")
            .setBehavior(
                resources -> {
                  if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("hypervisor busy");
                  }
                  return TestPollster.samplesFor(resources);
                });
    TestPollster memory = new TestPollster("memory");
    PollingTask task = task();
    StaticPipeline pipeline = pipeline("src1").setResources(Arrays.asList("r1", "r2")).build();
    task.add(flaky, pipeline);
    task.add(memory, pipeline);

    task.pollAndPublish();

    assertThat(memory.getInvocationCount()).isEqualTo(1);
    assertThat(published("src1").getFlushed()).hasSize(1);
    assertThat(published("src1").getFlushed().get(0)).hasSize(2);
    ResourceSet resourceSet = task.getResourceSet(PairingKey.of("src1", "flaky"));
    assertThat(resourceSet).isNotNull();
    assertThat(resourceSet.getBlacklist()).isEmpty();

    task.pollAndPublish();

    assertThat(flaky.getInvocations()).hasSize(2);
    assertThat(flaky.getInvocations().get(1)).containsExactly("r1", "r2");
    assertThat(statistics.getTransientFailureCount()).isEqualTo(1);
  }

  @Test
  void addingSamePollsterTwiceKeepsOneEntryAndLatestResources() {
    TestPollster cpu = new TestPollster("cpu");
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("old")).build());
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("new")).build());

    assertThat(task.getPollsters("src1")).containsExactly(cpu);
    ResourceSet resourceSet = task.getResourceSet(PairingKey.of("src1", "cpu"));
    assertThat(resourceSet).isNotNull();
    assertThat(resourceSet.getStaticResources()).containsExactly("new");

    task.pollAndPublish();

    assertThat(cpu.getInvocations()).containsExactly(Collections.singletonList("new"));
  }

  @Test
  void publishContextIsCreatedOncePerSource() {
    PollingTask task = task();
    StaticPipeline first = pipeline("src1").setName("first").build();
    StaticPipeline second = pipeline("src1").setName("second").build();
    task.add(new TestPollster("cpu"), first);
    task.add(new TestPollster("memory"), second);

    assertThat(publishers.getCreated()).containsExactly("src1");
    assertThat(published("src1").getPipelines()).containsExactly(first, second);
    assertThat(task.getSourceNames()).containsExactly("src1");
    assertThat(task.getPublishContext("src1")).isSameAs(publishers.get("src1"));
  }

  @Test
  void emptyTargetsSkipPollsterWithoutError() {
    TestPollster cpu = new TestPollster("cpu");
    PollingTask task = task();
    task.add(cpu, pipeline("src1").build());

    assertThatCode(task::pollAndPublish).doesNotThrowAnyException();

    assertThat(cpu.getInvocationCount()).isZero();
    assertThat(published("src1").getFlushed()).containsExactly(Collections.<Sample>emptyList());
    assertThat(statistics.getSkipCount()).isEqualTo(1);
  }

  @Test
  void sourceResourcesTakePriorityOverDefaultDiscovery() {
    TestDiscoverer local = new TestDiscoverer("local_instances", "vm1");
    TestPollster cpu = new TestPollster("cpu", "local_instances");
    PollingTask task = task(local);
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("r1")).build());

    task.pollAndPublish();

    assertThat(cpu.getInvocations()).containsExactly(Collections.singletonList("r1"));
    assertThat(local.getInvocationCount()).isZero();
  }

  @Test
  void defaultDiscoveryIsUsedWhenSourceHasNoResources() {
    TestDiscoverer local = new TestDiscoverer("local_instances", "vm1", "vm2");
    TestPollster cpu = new TestPollster("cpu", "local_instances");
    PollingTask task = task(local);
    task.add(cpu, pipeline("src1").build());

    task.pollAndPublish();

    assertThat(cpu.getInvocations()).containsExactly(Arrays.asList("vm1", "vm2"));
  }

  @Test
  void discoveryUrlIsResolvedOncePerCycleAcrossPairings() {
    TestDiscoverer local = new TestDiscoverer("local_instances", "vm1");
    TestPollster cpu = new TestPollster("cpu");
    TestPollster disk = new TestPollster("disk");
    PollingTask task = task(local);
    task.add(cpu, pipeline("src1").setDiscovery("local_instances").build());
    task.add(disk, pipeline("src2").setDiscovery("local_instances").build());

    task.pollAndPublish();
    assertThat(local.getInvocationCount()).isEqualTo(1);

    task.pollAndPublish();
    assertThat(local.getInvocationCount()).isEqualTo(2);

    assertThat(cpu.getInvocations()).allSatisfy(targets -> assertThat(targets).containsExactly("vm1"));
    assertThat(disk.getInvocations()).allSatisfy(targets -> assertThat(targets).containsExactly("vm1"));
  }

  @Test
  void sampleCacheIsSharedWithinCycleOnly() {
    TestPollster cpu = new TestPollster("cpu");
    TestPollster disk = new TestPollster("disk");
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("r1")).build());
    task.add(disk, pipeline("src2").setResources(Collections.singletonList("r1")).build());

    task.pollAndPublish();
    task.pollAndPublish();

    assertThat(cpu.getCaches().get(0)).isSameAs(disk.getCaches().get(0));
    assertThat(cpu.getCaches().get(1)).isNotSameAs(cpu.getCaches().get(0));
  }

  @Test
  void flushFailureDoesNotAffectOtherSources() {
    TestPollster cpu = new TestPollster("cpu");
    PollingTask task = task();
    task.add(cpu, pipeline("src1").setResources(Collections.singletonList("r1")).build());
    task.add(cpu, pipeline("src2").setResources(Collections.singletonList("r2")).build());
    publishers.setFailFlush(true);

    assertThatCode(task::pollAndPublish).doesNotThrowAnyException();

    assertThat(published("src1").getFlushed()).hasSize(1);
    assertThat(published("src2").getFlushed()).hasSize(1);
  }

  @Test
  void linkageErrorFromPollsterIsTransientAndIsolated() {
    TestPollster broken =
        new TestPollster("broken")
            .setBehavior(
                resources -> {
                  throw new NoClassDefFoundError("org/libvirt/Connect");
                });
    TestPollster healthy = new TestPollster("healthy");
    PollingTask task = task();
    task.add(broken, pipeline("src1").setResources(Collections.singletonList("r1")).build());
    task.add(healthy, pipeline("src2").setResources(Collections.singletonList("r2")).build());

    assertThatCode(task::pollAndPublish).doesNotThrowAnyException();
    assertThatCode(task::pollAndPublish).doesNotThrowAnyException();

    assertThat(broken.getInvocationCount()).isEqualTo(2);
    assertThat(healthy.getInvocationCount()).isEqualTo(2);
    assertThat(statistics.getTransientFailureCount()).isEqualTo(2);
    assertThat(task.getResourceSet(PairingKey.of("src1", "broken")).getBlacklist()).isEmpty();
    assertThat(published("src1").getFlushed()).hasSize(2);
    assertThat(published("src2").getFlushed().get(0))
        .extracting(Sample::getResourceId)
        .containsExactly("r2");
  }

  @Test
  void pollsterMayCacheNullValues() {
    TestPollster first = new TestPollster("first");
    TestPollster second = new TestPollster("second");
    PollingTask task = task();
    StaticPipeline pipeline = pipeline("src1").setResources(Collections.singletonList("r1")).build();
    task.add(first, pipeline);
    task.add(second, pipeline);
    first.setBehavior(
        resources -> {
          first.getCaches().get(0).put("hypervisor.stats", null);
          return Collections.<Sample>emptyList();
        });

    task.pollAndPublish();

    assertThat(statistics.getTransientFailureCount()).isZero();
    assertThat(second.getCaches().get(0)).containsEntry("hypervisor.stats", null);
  }

  @Test
  void hangingPollsterTimesOutAsTransientFailure() {
    caller = TimeLimitedCaller.create(Duration.ofMillis(100));
    CountDownLatch release = new CountDownLatch(1);
    TestPollster hanging =
        new TestPollster("hanging")
            .setBehavior(
                resources -> {
                  try {
                    release.await(10, TimeUnit.SECONDS);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return TestPollster.samplesFor(resources);
                });
    TestPollster cpu = new TestPollster("cpu");
    PollingTask task = task();
    StaticPipeline pipeline = pipeline("src1").setResources(Collections.singletonList("r1")).build();
    task.add(hanging, pipeline);
    task.add(cpu, pipeline);

    try {
      task.pollAndPublish();
    } finally {
      release.countDown();
    }

    assertThat(cpu.getInvocationCount()).isEqualTo(1);
    assertThat(statistics.getTransientFailureCount()).isEqualTo(1);
    List<Sample> flushed = published("src1").getFlushed().get(0);
    assertThat(flushed).extracting(Sample::getResourceId).containsExactly("r1");
  }
}
