/*
 * どこで: Exchange サービス層
 * 何を: マッチング、状態遷移、通知配信のアプリケーションメトリクス
 * なぜ: マッチ件数とライブ配信の健全性を Prometheus で見えるようにするため
 */
package com.example.exchange.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class ExchangeMetrics {

  static final String METRIC_MATCH_CREATED = "exchange.match.created.total";
  static final String METRIC_MATCH_TRANSITION = "exchange.match.transition.total";
  static final String METRIC_MATCHING_RETRY = "exchange.matching.retry.total";
  static final String METRIC_NOTIFICATION_APPENDED = "exchange.notification.appended.total";
  static final String METRIC_LIVE_PUSH = "exchange.live.push.total";
  static final String METRIC_LIVE_CONNECTIONS = "exchange.live.connections";

  private final MeterRegistry meterRegistry;
  private final Counter matchCreatedCounter;
  private final Counter matchingRetryCounter;
  private final AtomicInteger liveConnections = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> appendedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> pushCounters = new ConcurrentHashMap<>();

  public ExchangeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.matchCreatedCounter =
        Counter.builder(METRIC_MATCH_CREATED)
            .description("Pending matches created")
            .register(meterRegistry);
    this.matchingRetryCounter =
        Counter.builder(METRIC_MATCHING_RETRY)
            .description("Candidate scans restarted after a transient datastore failure")
            .register(meterRegistry);
    Gauge.builder(METRIC_LIVE_CONNECTIONS, liveConnections, AtomicInteger::get)
        .description("Open live connections in this instance")
        .register(meterRegistry);
  }

  public void recordMatchCreated() {
    matchCreatedCounter.increment();
  }

  public void recordMatchingRetry() {
    matchingRetryCounter.increment();
  }

  /** {@code result} は success / forbidden / stale のいずれか。 */
  public void recordTransition(String action, String result) {
    transitionCounters
        .computeIfAbsent(
            action + "|" + result,
            ignored ->
                Counter.builder(METRIC_MATCH_TRANSITION)
                    .description("Match lifecycle transition attempts")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordNotificationAppended(String type) {
    appendedCounters
        .computeIfAbsent(
            type,
            ignored ->
                Counter.builder(METRIC_NOTIFICATION_APPENDED)
                    .description("Notifications appended to user logs")
                    .tags(Tags.of("type", type))
                    .register(meterRegistry))
        .increment();
  }

  /** {@code result} は sent / skipped / failed / rejected のいずれか。 */
  public void recordPush(String result) {
    pushCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LIVE_PUSH)
                    .description("Live push outcomes per connection")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateLiveConnections(int count) {
    liveConnections.set(Math.max(count, 0));
  }
}
