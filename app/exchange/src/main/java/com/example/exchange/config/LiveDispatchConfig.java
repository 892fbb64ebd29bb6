/*
 * どこで: Exchange ライブ配信設定
 * 何を: コミット後のライブ送信を行うスレッドプールと、送信期限を監視するスケジューラを用意する
 * なぜ: リクエストスレッドはコミット直後に返し、止まった送信は期限で打ち切るため
 */
package com.example.exchange.config;

import org.springframework.boot.task.ThreadPoolTaskSchedulerBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration(proxyBeanMethods = false)
public class LiveDispatchConfig {

  public static final String DISPATCH_EXECUTOR = "dispatchExecutor";
  public static final String SEND_WATCHDOG = "liveSendWatchdog";

  @Bean(name = DISPATCH_EXECUTOR)
  public ThreadPoolTaskExecutor dispatchExecutor(ExchangeLiveProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("live-dispatch-");
    executor.setCorePoolSize(properties.dispatchPoolSize());
    executor.setMaxPoolSize(properties.dispatchPoolSize());
    executor.setQueueCapacity(properties.dispatchQueueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }

  /** 送信ごとに期限タスクを登録し、完了時に取り消す。取り消し済みタスクはキューから外す。 */
  @Bean(name = SEND_WATCHDOG)
  public ThreadPoolTaskScheduler liveSendWatchdog() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setThreadNamePrefix("live-send-watchdog-");
    scheduler.setPoolSize(2);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  // TaskScheduler を 1 つでも定義すると Boot の既定 taskScheduler が作られないため、
  // @Scheduled ワーカー用を明示して watchdog と共有しない
  @Bean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(ThreadPoolTaskSchedulerBuilder builder) {
    return builder.threadNamePrefix("scheduling-").build();
  }
}
