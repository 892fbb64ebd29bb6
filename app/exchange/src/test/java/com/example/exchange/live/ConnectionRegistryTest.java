package com.example.exchange.live;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.exchange.service.ExchangeMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

  private SimpleMeterRegistry meterRegistry;
  private ConnectionRegistry registry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    registry = new ConnectionRegistry(new ExchangeMetrics(meterRegistry));
  }

  @Test
  void registerKeepsEveryConnectionOfAUser() {
    final LiveConnection phone = connection("c-1", "user-1");
    final LiveConnection laptop = connection("c-2", "user-1");
    final LiveConnection other = connection("c-3", "user-2");

    assertThat(registry.register(phone)).isTrue();
    assertThat(registry.register(laptop)).isTrue();
    assertThat(registry.register(other)).isTrue();
    assertThat(registry.register(phone)).isFalse();

    assertThat(registry.connectionsOf("user-1")).containsExactlyInAnyOrder(phone, laptop);
    assertThat(registry.connectionCount()).isEqualTo(3);
    assertThat(registry.userCount()).isEqualTo(2);
    assertThat(meterRegistry.get("exchange.live.connections").gauge().value()).isEqualTo(3.0);
  }

  @Test
  void unregisterRemovesUserWithLastConnection() {
    final LiveConnection phone = connection("c-1", "user-1");
    registry.register(phone);

    assertThat(registry.unregister(phone)).isTrue();
    assertThat(registry.unregister(phone)).isFalse();

    assertThat(registry.connectionsOf("user-1")).isEmpty();
    assertThat(registry.userCount()).isZero();
    assertThat(meterRegistry.get("exchange.live.connections").gauge().value()).isZero();
  }

  @Test
  void snapshotIsNotAffectedByLaterChanges() {
    final LiveConnection phone = connection("c-1", "user-1");
    registry.register(phone);
    final var snapshot = registry.connectionsOf("user-1");

    registry.register(connection("c-2", "user-1"));
    registry.unregister(phone);

    assertThat(snapshot).containsExactly(phone);
  }

  @Test
  void concurrentRegisterAndUnregisterKeepCountsConsistent() throws Exception {
    final int threads = 8;
    final int perThread = 200;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perThread; i++) {
                    final LiveConnection connection =
                        connection("c-" + thread + "-" + i, "user-" + (i % 4));
                    registry.register(connection);
                    if (i % 2 == 0) {
                      registry.unregister(connection);
                    }
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    final int expected = threads * perThread / 2;
    assertThat(registry.connectionCount()).isEqualTo(expected);
    int listed = 0;
    for (int user = 0; user < 4; user++) {
      listed += registry.connectionsOf("user-" + user).size();
    }
    assertThat(listed).isEqualTo(expected);
  }

  private static LiveConnection connection(String connectionId, String userId) {
    return new LiveConnection(
        connectionId,
        userId,
        Instant.parse("2025-06-01T08:00:00Z"),
        new RecordingTransport(),
        new LiveFrames(new ObjectMapper()),
        (user, since, limit) -> List.of(),
        10,
        Duration.ofSeconds(3));
  }
}
