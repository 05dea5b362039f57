/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class PollingAgentConfigTest {

  @Test
  void defaultValues() {
    PollingAgentConfig config = PollingAgentConfig.builder().build();

    assertThat(config.getNamespaces()).containsExactly("compute", "central");
    assertThat(config.getPollsterList()).isEmpty();
    assertThat(config.getShuffleTimeBeforePollingTask()).isZero();
    assertThat(config.getCallTimeout()).isEqualTo(Duration.ZERO);
    assertThat(config.isCallTimeoutEnabled()).isFalse();
    assertThat(config.getSchedulerThreads()).isEqualTo(4);
    assertThat(config.getPartitioningGroupPrefix()).isNull();
    assertThat(config.getCoordinationBackendUrl()).isNull();
    assertThat(config.isCoordinationEnabled()).isFalse();
    assertThat(config.getCoordinationHeartbeat()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.getMemberId()).isNotEmpty();
  }

  @Test
  void builderSetsValues() {
    PollingAgentConfig config =
        PollingAgentConfig.builder()
            .setNamespaces(Collections.singletonList("central"))
            .setPollsterList(Arrays.asList("cpu*", "disk.*"))
            .setShuffleTimeBeforePollingTask(30)
            .setCallTimeout(Duration.ofSeconds(5))
            .setSchedulerThreads(2)
            .setPartitioningGroupPrefix("dc1")
            .setCoordinationBackendUrl("memory://")
            .setCoordinationHeartbeat(Duration.ofMillis(500))
            .setMemberId("agent-1")
            .build();

    assertThat(config.getNamespaces()).containsExactly("central");
    assertThat(config.getPollsterList()).containsExactly("cpu*", "disk.*");
    assertThat(config.getShuffleTimeBeforePollingTask()).isEqualTo(30);
    assertThat(config.isCallTimeoutEnabled()).isTrue();
    assertThat(config.getCallTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.getSchedulerThreads()).isEqualTo(2);
    assertThat(config.getPartitioningGroupPrefix()).isEqualTo("dc1");
    assertThat(config.isCoordinationEnabled()).isTrue();
    assertThat(config.getCoordinationHeartbeat()).isEqualTo(Duration.ofMillis(500));
    assertThat(config.getMemberId()).isEqualTo("agent-1");
  }

  @Test
  void memberIdIsGeneratedPerInstance() {
    PollingAgentConfig first = PollingAgentConfig.builder().build();
    PollingAgentConfig second = PollingAgentConfig.builder().build();

    assertThat(first.getMemberId()).isNotEqualTo(second.getMemberId());
  }

  @Test
  void emptyBackendUrlDisablesCoordination() {
    PollingAgentConfig config = PollingAgentConfig.builder().setCoordinationBackendUrl("").build();

    assertThat(config.isCoordinationEnabled()).isFalse();
  }

  @Test
  void createFromConfigProperties() {
    ConfigProperties properties = mock(ConfigProperties.class, invocation -> null);
    when(properties.getList("otel.polling.namespaces")).thenReturn(Arrays.asList("ipmi"));
    when(properties.getList("otel.polling.pollster.list"))
        .thenReturn(Collections.singletonList("hardware.*"));
    when(properties.getInt("otel.polling.shuffle.time.before.polling.task")).thenReturn(10);
    when(properties.getDuration("otel.polling.call.timeout")).thenReturn(Duration.ofSeconds(3));
    when(properties.getInt("otel.polling.scheduler.threads")).thenReturn(8);
    when(properties.getString("otel.polling.partitioning.group.prefix")).thenReturn("rack7");
    when(properties.getDuration("otel.polling.coordination.heartbeat"))
        .thenReturn(Duration.ofSeconds(2));
    when(properties.getString("otel.polling.coordination.member.id")).thenReturn("host-a");

    PollingAgentConfig config = PollingAgentConfig.create(properties);

    assertThat(config.getNamespaces()).containsExactly("ipmi");
    assertThat(config.getPollsterList()).containsExactly("hardware.*");
    assertThat(config.getShuffleTimeBeforePollingTask()).isEqualTo(10);
    assertThat(config.getCallTimeout()).isEqualTo(Duration.ofSeconds(3));
    assertThat(config.getSchedulerThreads()).isEqualTo(8);
    assertThat(config.getPartitioningGroupPrefix()).isEqualTo("rack7");
    assertThat(config.getCoordinationBackendUrl()).isNull();
    assertThat(config.getCoordinationHeartbeat()).isEqualTo(Duration.ofSeconds(2));
    assertThat(config.getMemberId()).isEqualTo("host-a");
  }

  @Test
  void createFromEmptyConfigPropertiesUsesDefaults() {
    ConfigProperties properties = mock(ConfigProperties.class, invocation -> null);
    when(properties.getList("otel.polling.namespaces")).thenReturn(Collections.emptyList());

    PollingAgentConfig config = PollingAgentConfig.create(properties);

    assertThat(config.getNamespaces()).containsExactly("compute", "central");
    assertThat(config.getPollsterList()).isEmpty();
    assertThat(config.getShuffleTimeBeforePollingTask()).isZero();
    assertThat(config.getCoordinationHeartbeat()).isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  void shuffleWindowIsBounded() {
    assertThat(
            PollingAgentConfig.builder()
                .setShuffleTimeBeforePollingTask(PollingAgentConfig.MAX_SHUFFLE_TIME_SECONDS)
                .build()
                .getShuffleTimeBeforePollingTask())
        .isEqualTo(86400);
    assertThatThrownBy(
            () ->
                PollingAgentConfig.builder()
                    .setShuffleTimeBeforePollingTask(Integer.MAX_VALUE)
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("shuffleTimeBeforePollingTask");
  }

  @Test
  void rejectsInvalidValues() {
    assertThatThrownBy(
            () -> PollingAgentConfig.builder().setNamespaces(Collections.emptyList()).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("namespaces");
    assertThatThrownBy(() -> PollingAgentConfig.builder().setShuffleTimeBeforePollingTask(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> PollingAgentConfig.builder().setCallTimeout(Duration.ofSeconds(-1)).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PollingAgentConfig.builder().setSchedulerThreads(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> PollingAgentConfig.builder().setCoordinationHeartbeat(Duration.ZERO).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("coordinationHeartbeat");
  }
}
