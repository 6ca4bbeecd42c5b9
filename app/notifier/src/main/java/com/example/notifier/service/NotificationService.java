/*
 * どこで: Notifier サービス層
 * 何を: 管理者上書き/ユーザー設定/レート制限/重複判定を経て通知キューへ登録する
 * なぜ: 通知を作るかどうかの判断を 1 か所に集約し、全結果をメトリクスで観測するため
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationEnqueueProperties;
import com.example.notifier.model.AdminOverrideRecord;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationPreferences;
import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.model.TriggerPreference;
import com.example.notifier.repository.AdminOverrideRepository;
import com.example.notifier.repository.NotificationPreferenceRepository;
import com.example.notifier.repository.NotificationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final AdminOverrideRepository overrideRepository;
  private final NotificationPreferenceRepository preferenceRepository;
  private final NotificationQueueRepository queueRepository;
  private final DeliveryTimeResolver deliveryTimeResolver;
  private final DedupKeyGenerator dedupKeyGenerator;
  private final NotificationEnqueueProperties properties;
  private final NotifierMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * 呼び出し元のトランザクションとは独立にコミットする。1 件の enqueue 失敗で同じイベントの他の通知や
   * 呼び出し元の処理が巻き戻らない。
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public EnqueueResult enqueue(NotificationRequest request) {
    final AdminOverrideRecord triggerOverride =
        overrideRepository
            .find(OverrideTarget.trigger(request.username(), request.trigger()))
            .orElse(null);
    final AdminOverrideRecord relatedOverride =
        request.relatedTarget() == null
            ? null
            : overrideRepository.find(request.relatedTarget()).orElse(null);
    if (isDisabled(triggerOverride) || isDisabled(relatedOverride)) {
      logger.info(
          "notification suppressed by admin override username={} trigger={} relatedTarget={}",
          request.username(),
          request.trigger(),
          request.relatedTarget());
      return record(EnqueueResult.rejected(RejectionReason.ADMIN_DISABLED));
    }
    return enqueueWithOverrides(request, triggerOverride, relatedOverride);
  }

  /** 管理者による停止の説明通知。停止そのものに阻まれないよう上書き判定を行わない。 */
  @Transactional
  public EnqueueResult enqueueAdminNotice(OverrideTarget disabledTarget, String reason) {
    final Map<String, Object> event = new LinkedHashMap<>();
    event.put("target", describe(disabledTarget));
    event.put("targetType", disabledTarget.type().name());
    event.put("targetKey", disabledTarget.targetKey());
    event.put("reason", reason);
    final Map<String, Object> templateData = new LinkedHashMap<>();
    templateData.put("event", event);
    templateData.put("eventType", "admin_notice");
    final NotificationRequest request =
        new NotificationRequest(
            disabledTarget.username(),
            NotificationTrigger.ADMIN_NOTICE,
            null,
            templateData,
            NotificationPriority.HIGH,
            null,
            null);
    return enqueueWithOverrides(request, null, null);
  }

  private EnqueueResult enqueueWithOverrides(
      NotificationRequest request,
      AdminOverrideRecord triggerOverride,
      AdminOverrideRecord relatedOverride) {
    final Optional<NotificationPreferences> preferences =
        preferenceRepository.findByUsername(request.username());
    final Optional<TriggerPreference> preference =
        preferences.flatMap(found -> found.find(request.trigger()));
    if (preference.isEmpty()) {
      // 作成時に全トリガー分の行を書くため、欠落は設定不整合として扱う
      logger.error(
          "notification preference missing username={} trigger={} userExists={}",
          request.username(),
          request.trigger(),
          preferences.isPresent());
      metrics.recordPreferenceMissing();
      return record(EnqueueResult.rejected(RejectionReason.NO_PREFERENCE_CONFIGURED));
    }

    final Set<NotificationChannel> allowed = channelsOf(request.requestedChannels());
    allowed.retainAll(configuredChannels(preference.get(), triggerOverride, relatedOverride));
    if (allowed.isEmpty()) {
      return record(EnqueueResult.rejected(RejectionReason.NO_CHANNELS_ENABLED));
    }
    final Instant now = Instant.now(clock);
    final Set<NotificationChannel> effective = withinRateLimits(request.username(), allowed, now);
    if (effective.isEmpty()) {
      logger.info(
          "notification rate limited username={} trigger={} channels={}",
          request.username(),
          request.trigger(),
          allowed);
      return record(EnqueueResult.rejected(RejectionReason.RATE_LIMITED));
    }

    final String dedupKey = dedupKeyGenerator.keyFor(request);
    queueRepository.lockDedupKey(
        dedupKeyGenerator.lockKey(request.username(), request.trigger(), dedupKey));
    if (queueRepository.existsActiveDuplicate(
        request.username(), request.trigger(), dedupKey, now.minus(properties.dedupWindow()))) {
      logger.debug(
          "notification duplicate skipped username={} trigger={} dedupKey={}",
          request.username(),
          request.trigger(),
          dedupKey);
      return record(EnqueueResult.rejected(RejectionReason.DUPLICATE));
    }

    final EffectiveSchedule schedule =
        EffectiveSchedule.from(preference.get())
            .withOverride(triggerOverride)
            .withOverride(relatedOverride);
    final NotificationPreferences userPreferences = preferences.get();
    final Instant scheduledFor =
        deliveryTimeResolver.resolve(
            schedule,
            userPreferences.timezone(),
            userPreferences.quietHours(),
            request.priority(),
            now);
    final String templateDataJson = serialize(request.templateData());
    final List<UUID> ids = new ArrayList<>();
    for (NotificationChannel channel : effective) {
      // チャネルごとに 1 行。各配信ワーカーが自分の行の状態だけを持つ
      ids.add(
          queueRepository.insert(
              NotificationQueueRecord.pending(
                  UUID.randomUUID(),
                  request.username(),
                  request.trigger(),
                  channel,
                  templateDataJson,
                  request.priority(),
                  scheduledFor,
                  dedupKey,
                  now)));
    }
    logger.info(
        "notification enqueued username={} trigger={} channels={} scheduledFor={}",
        request.username(),
        request.trigger(),
        effective,
        scheduledFor);
    return record(EnqueueResult.enqueued(ids));
  }

  private Set<NotificationChannel> configuredChannels(
      TriggerPreference preference,
      AdminOverrideRecord triggerOverride,
      AdminOverrideRecord relatedOverride) {
    if (relatedOverride != null && relatedOverride.overrideChannels() != null) {
      return relatedOverride.overrideChannels();
    }
    if (triggerOverride != null && triggerOverride.overrideChannels() != null) {
      return triggerOverride.overrideChannels();
    }
    return preference.channels();
  }

  private Set<NotificationChannel> withinRateLimits(
      String username, Set<NotificationChannel> channels, Instant now) {
    final Set<NotificationChannel> result = EnumSet.noneOf(NotificationChannel.class);
    for (NotificationChannel channel : channels) {
      final Optional<NotificationEnqueueProperties.RateLimit> limit =
          properties.rateLimitFor(channel.key());
      if (limit.isEmpty()) {
        result.add(channel);
        continue;
      }
      final int recent =
          queueRepository.countRecentForChannel(username, channel, now.minus(limit.get().period()));
      if (recent < limit.get().max()) {
        result.add(channel);
      } else {
        logger.debug(
            "channel over rate limit username={} channel={} recent={} max={}",
            username,
            channel.key(),
            recent,
            limit.get().max());
      }
    }
    return result;
  }

  private Set<NotificationChannel> channelsOf(Set<NotificationChannel> channels) {
    return channels.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : EnumSet.copyOf(channels);
  }

  private boolean isDisabled(AdminOverrideRecord override) {
    return override != null && override.disabled();
  }

  private String describe(OverrideTarget target) {
    return switch (target.type()) {
      case TRIGGER -> "notifications for " + target.targetKey();
      case SAVED_SEARCH -> "notifications for saved search " + target.targetKey();
    };
  }

  private String serialize(Map<String, Object> templateData) {
    try {
      return objectMapper.writeValueAsString(templateData);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("templateData is not serializable", ex);
    }
  }

  private EnqueueResult record(EnqueueResult result) {
    metrics.recordEnqueueResult(result.resultCode());
    return result;
  }
}
