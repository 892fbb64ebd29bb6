/*
 * どこで: Exchange 設定バインドのテスト
 * 何を: exchange.* の各 record の Duration/リスト/サイズ項目、既定値、不正値での起動失敗を確認する
 * なぜ: application.yml の書き損じを本番起動時ではなくここで検出するため
 */
package com.example.exchange.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ExchangePropertiesBindingTest {

  private final ApplicationContextRunner bareRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  private final ApplicationContextRunner contextRunner =
      bareRunner.withPropertyValues(
              "exchange.matching.max-attempts=3",
              "exchange.matching.backoff-base=100ms",
              "exchange.matching.backoff-max=2s",
              "exchange.live.path=/ws/notifications",
              "exchange.live.allowed-origins=https://a.example,https://b.example",
              "exchange.live.send-time-limit=2500ms",
              "exchange.live.buffer-size-limit=524288",
              "exchange.live.backfill-page-size=100",
              "exchange.live.dispatch-pool-size=8",
              "exchange.live.dispatch-queue-capacity=10000",
              "exchange.expiry.enabled=true",
              "exchange.expiry.interval=5m",
              "exchange.feed.default-limit=50",
              "exchange.feed.max-limit=200",
              "exchange.feed.max-page-size=100",
              "exchange.feed.conversation-limit=100");

  @Test
  void contextStartsAndBindsEveryField() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final ExchangeMatchingProperties matching =
              context.getBean(ExchangeMatchingProperties.class);
          final ExchangeLiveProperties live = context.getBean(ExchangeLiveProperties.class);
          final ExchangeExpiryProperties expiry = context.getBean(ExchangeExpiryProperties.class);
          final ExchangeFeedProperties feed = context.getBean(ExchangeFeedProperties.class);

          assertThat(matching.maxAttempts()).isEqualTo(3);
          assertThat(matching.backoffBase()).isEqualTo(Duration.ofMillis(100));
          assertThat(matching.backoffMax()).isEqualTo(Duration.ofSeconds(2));
          assertThat(live.allowedOrigins())
              .containsExactly("https://a.example", "https://b.example");
          assertThat(live.sendTimeLimit()).isEqualTo(Duration.ofMillis(2500));
          assertThat(live.dispatchQueueCapacity()).isEqualTo(10_000);
          assertThat(expiry.interval()).isEqualTo(Duration.ofMinutes(5));
          assertThat(expiry.grace()).isEqualTo(Duration.ZERO);
          assertThat(feed.maxLimit()).isEqualTo(200);
          assertThat(feed.conversationLimit()).isEqualTo(100);
        });
  }

  @Test
  void missingKeysFallBackToDefaults() {
    bareRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final ExchangeLiveProperties live = context.getBean(ExchangeLiveProperties.class);
          final ExchangeMatchingProperties matching =
              context.getBean(ExchangeMatchingProperties.class);
          final ExchangeExpiryProperties expiry = context.getBean(ExchangeExpiryProperties.class);
          final ExchangeFeedProperties feed = context.getBean(ExchangeFeedProperties.class);

          assertThat(live.path()).isEqualTo("/ws/notifications");
          assertThat(live.allowedOrigins()).isEmpty();
          assertThat(live.sendTimeLimit()).isEqualTo(Duration.ofSeconds(3));
          assertThat(live.bufferSizeLimit()).isEqualTo(512 * 1024);
          assertThat(live.backfillPageSize()).isEqualTo(100);
          assertThat(live.dispatchPoolSize()).isEqualTo(8);
          assertThat(live.dispatchQueueCapacity()).isEqualTo(10_000);
          assertThat(matching.maxAttempts()).isEqualTo(3);
          assertThat(matching.backoffBase()).isEqualTo(Duration.ofMillis(100));
          assertThat(expiry.enabled()).isFalse();
          assertThat(expiry.interval()).isEqualTo(Duration.ofMinutes(5));
          assertThat(feed.defaultLimit()).isEqualTo(50);
          assertThat(feed.maxLimit()).isEqualTo(200);
        });
  }

  @Test
  void zeroDispatchPoolFailsStartup() {
    assertStartupFails("exchange.live.dispatch-pool-size=0");
  }

  @Test
  void nonPositiveSendTimeLimitFailsStartup() {
    assertStartupFails("exchange.live.send-time-limit=0s");
    assertStartupFails("exchange.live.send-time-limit=-1s");
  }

  @Test
  void invalidLiveSizesFailStartup() {
    assertStartupFails("exchange.live.backfill-page-size=0");
    assertStartupFails("exchange.live.buffer-size-limit=0");
    assertStartupFails("exchange.live.dispatch-queue-capacity=-1");
  }

  @Test
  void invalidMatchingExpiryAndFeedValuesFailStartup() {
    assertStartupFails("exchange.matching.max-attempts=0");
    assertStartupFails("exchange.matching.backoff-max=10ms");
    assertStartupFails("exchange.expiry.interval=0s");
    assertStartupFails("exchange.feed.default-limit=0");
    // 既定の default-limit 50 を下回る上限
    assertStartupFails("exchange.feed.max-limit=10");
  }

  private void assertStartupFails(String property) {
    bareRunner
        .withPropertyValues(property)
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .hasRootCauseInstanceOf(IllegalArgumentException.class);
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    ExchangeMatchingProperties.class,
    ExchangeLiveProperties.class,
    ExchangeExpiryProperties.class,
    ExchangeFeedProperties.class
  })
  static class TestConfiguration {}
}
