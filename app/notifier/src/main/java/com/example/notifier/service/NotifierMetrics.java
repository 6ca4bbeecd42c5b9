/*
 * どこで: Notifier サービス層
 * 何を: enqueue 判定/配信結果/backlog/ジョブ実行のアプリ固有メトリクスを記録する
 * なぜ: 設定不整合や連続失敗を Prometheus から直接観測できるようにするため
 */
package com.example.notifier.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotifierMetrics {

  static final String METRIC_ENQUEUE_TOTAL = "notification.enqueue.total";
  static final String METRIC_PREFERENCE_MISSING = "notification.preference.missing";
  static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  static final String METRIC_JOB_RUNS_TOTAL = "scheduler.job.runs.total";
  static final String METRIC_JOB_DURATION = "scheduler.job.duration";
  static final String METRIC_JOB_CONSECUTIVE_FAILURES = "scheduler.job.consecutive.failures";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final Counter preferenceMissingCounter;
  private final ConcurrentMap<String, Counter> enqueueCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> jobRunCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> jobDurationTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

  public NotifierMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending notifications")
        .register(meterRegistry);
    this.preferenceMissingCounter =
        Counter.builder(METRIC_PREFERENCE_MISSING)
            .description("Enqueue attempts rejected because a preference row was missing")
            .register(meterRegistry);
  }

  public void recordEnqueueResult(String result) {
    enqueueCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_ENQUEUE_TOTAL)
                    .description("Notification enqueue decisions")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPreferenceMissing() {
    preferenceMissingCounter.increment();
  }

  public void recordDeliveryResult(String channel, String result) {
    deliveryCounters
        .computeIfAbsent(
            channel + ":" + result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("channel", channel, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  public void recordJobRun(String templateType, String status, Duration duration) {
    jobRunCounters
        .computeIfAbsent(
            templateType + ":" + status,
            ignored ->
                Counter.builder(METRIC_JOB_RUNS_TOTAL)
                    .description("Scheduled job runs by outcome")
                    .tags(Tags.of("template", templateType, "status", status))
                    .register(meterRegistry))
        .increment();
    if (duration != null && !duration.isNegative()) {
      jobDurationTimers
          .computeIfAbsent(
              templateType,
              ignored ->
                  Timer.builder(METRIC_JOB_DURATION)
                      .description("Scheduled job run duration")
                      .tags(Tags.of("template", templateType))
                      .register(meterRegistry))
          .record(duration);
    }
  }

  /** 成功で 0 に戻る。ジョブ名ごとに 1 本の gauge を持つ。 */
  public void updateConsecutiveFailures(String jobName, int failures) {
    consecutiveFailures
        .computeIfAbsent(
            jobName,
            name -> {
              final AtomicInteger holder = new AtomicInteger(0);
              Gauge.builder(METRIC_JOB_CONSECUTIVE_FAILURES, holder, AtomicInteger::get)
                  .description("Consecutive failed runs per job")
                  .tags(Tags.of("job", name))
                  .register(meterRegistry);
              return holder;
            })
        .set(Math.max(failures, 0));
  }
}
