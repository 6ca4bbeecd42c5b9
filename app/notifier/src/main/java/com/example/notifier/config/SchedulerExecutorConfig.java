/*
 * どこで: Notifier アプリのインフラ設定
 * 何を: tick 用スケジューラとジョブ実行用の有界ワーカープールを定義する
 * なぜ: tick スレッドをブロックせず、同時実行数を pool-size で上限管理するため
 */
package com.example.notifier.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerExecutorConfig {

  public static final String JOB_EXECUTOR = "jobExecutor";
  public static final String SCHEDULER_TASK_SCHEDULER = "schedulerTaskScheduler";

  @Bean(name = JOB_EXECUTOR)
  public ThreadPoolTaskExecutor jobExecutor(SchedulerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("job-worker-");
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    // キュー満杯時は RejectedExecutionException を投げ、呼び出し側で running を戻す
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  // tick とタイムアウト監視で共有する。ジョブ本体はここで動かさない。
  @Bean(name = SCHEDULER_TASK_SCHEDULER)
  public ThreadPoolTaskScheduler schedulerTaskScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setThreadNamePrefix("job-scheduler-");
    scheduler.setPoolSize(2);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
