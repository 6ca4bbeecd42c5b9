package com.example.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotifierMetricsTest {

  private SimpleMeterRegistry registry;
  private NotifierMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new NotifierMetrics(registry);
  }

  @Test
  void enqueueCounterIsTaggedByResult() {
    metrics.recordEnqueueResult("enqueued");
    metrics.recordEnqueueResult("enqueued");
    metrics.recordEnqueueResult("rate_limited");

    assertThat(registry.get(NotifierMetrics.METRIC_ENQUEUE_TOTAL).tag("result", "enqueued").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get(NotifierMetrics.METRIC_ENQUEUE_TOTAL).tag("result", "rate_limited").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void deliveryCounterIsTaggedByChannelAndResult() {
    metrics.recordDeliveryResult("email", "sent");
    metrics.recordDeliveryResult("sms", "sent");

    assertThat(
            registry
                .get(NotifierMetrics.METRIC_DELIVERY_TOTAL)
                .tags("channel", "email", "result", "sent")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void backlogGaugeNeverGoesNegative() {
    metrics.updateBacklogCurrent(12);
    assertThat(registry.get(NotifierMetrics.METRIC_BACKLOG_CURRENT).gauge().value()).isEqualTo(12.0);

    metrics.updateBacklogCurrent(-3);
    assertThat(registry.get(NotifierMetrics.METRIC_BACKLOG_CURRENT).gauge().value()).isZero();
  }

  @Test
  void jobRunRecordsCounterAndTimer() {
    metrics.recordJobRun("EMAIL_NOTIFIER", "success", Duration.ofMillis(250));

    assertThat(
            registry
                .get(NotifierMetrics.METRIC_JOB_RUNS_TOTAL)
                .tags("template", "EMAIL_NOTIFIER", "status", "success")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(registry.get(NotifierMetrics.METRIC_JOB_DURATION).tag("template", "EMAIL_NOTIFIER").timer().count())
        .isEqualTo(1L);
  }

  @Test
  void consecutiveFailuresGaugeIsUpdatedInPlace() {
    metrics.updateConsecutiveFailures("email-notifier", 2);
    metrics.updateConsecutiveFailures("email-notifier", 0);

    assertThat(registry.find(NotifierMetrics.METRIC_JOB_CONSECUTIVE_FAILURES).gauges()).hasSize(1);
    assertThat(
            registry
                .get(NotifierMetrics.METRIC_JOB_CONSECUTIVE_FAILURES)
                .tag("job", "email-notifier")
                .gauge()
                .value())
        .isZero();
  }
}
