/*
 * Where: Notifier application configuration binding
 * What: Holds dedup window, default send schedule and per-channel rate limits for enqueue
 * Why: Keep enqueue policy tunable per environment
 */
package com.example.notifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.enqueue")
@Validated
public record NotificationEnqueueProperties(
    @NotNull Duration dedupWindow,
    @NotNull LocalTime defaultSendTime,
    @NotNull DayOfWeek defaultDayOfWeek,
    Map<String, RateLimit> rateLimits) {

  public NotificationEnqueueProperties {
    rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
  }

  @AssertTrue(message = "notification.enqueue.dedup-window must be positive")
  public boolean isDedupWindowPositive() {
    return dedupWindow != null && !dedupWindow.isZero() && !dedupWindow.isNegative();
  }

  /** Channel key is the lower-case channel name, e.g. {@code email}. */
  public Optional<RateLimit> rateLimitFor(String channelKey) {
    return Optional.ofNullable(rateLimits.get(channelKey));
  }

  public record RateLimit(int max, Duration period) {}
}
