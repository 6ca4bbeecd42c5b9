/*
 * どこで: Notifier スケジューラ
 * 何を: アプリ起動完了で tick を開始し、終了時に停止する
 * なぜ: scheduler.enabled=false の環境 (テスト等) でループを動かさないため
 */
package com.example.notifier.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class UnifiedSchedulerLifecycle {

  private final UnifiedScheduler scheduler;

  // 初期ジョブの登録後に開始する
  @EventListener(ApplicationReadyEvent.class)
  @Order(JobBootstrapSeeder.ORDER + 1)
  public void onApplicationReady() {
    scheduler.start();
  }

  @PreDestroy
  public void shutdown() {
    scheduler.stop();
  }
}
