/*
 * どこで: Notifier 管理機能
 * 何を: 通知の管理者上書き/停止/再開/テスト送信を行い、監査ログを残す
 * なぜ: ユーザー設定を書き換えずに運用側で通知を制御し、操作履歴を追跡するため
 */
package com.example.notifier.service;

import com.example.notifier.model.AdminAuditAction;
import com.example.notifier.model.AdminAuditLogRecord;
import com.example.notifier.model.AdminOverrideRecord;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.NotificationTrigger;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.model.OverrideTargetType;
import com.example.notifier.repository.AdminAuditLogRepository;
import com.example.notifier.repository.AdminOverrideRepository;
import com.example.notifier.service.pii.DecryptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AdminOverrideService {

  private static final Logger logger = LoggerFactory.getLogger(AdminOverrideService.class);

  public static final String DEFAULT_DISABLE_REASON = "Admin disabled";
  static final String USER_RECIPIENT = "user";
  private static final int MAX_AUDIT_LIMIT = 200;

  private final AdminOverrideRepository overrideRepository;
  private final AdminAuditLogRepository auditLogRepository;
  private final NotificationService notificationService;
  private final NotificationDeliveryService deliveryService;
  private final RecipientResolver recipientResolver;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** 既存の上書きに項目をマージする。ユーザー設定の行は変更しない。 */
  @Transactional
  public AdminOverrideRecord override(
      OverrideTarget target, OverrideFields fields, String reason, String actor) {
    requireActor(actor);
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException(
          "at least one of time, frequency, day_of_week or channels is required");
    }
    final Optional<AdminOverrideRecord> existing = overrideRepository.find(target);
    final Instant now = Instant.now(clock);
    final AdminOverrideRecord merged =
        new AdminOverrideRecord(
            target,
            existing.map(AdminOverrideRecord::disabled).orElse(false),
            fields.time() != null
                ? fields.time()
                : existing.map(AdminOverrideRecord::overrideTime).orElse(null),
            fields.frequency() != null
                ? fields.frequency()
                : existing.map(AdminOverrideRecord::overrideFrequency).orElse(null),
            fields.dayOfWeek() != null
                ? fields.dayOfWeek()
                : existing.map(AdminOverrideRecord::overrideDayOfWeek).orElse(null),
            fields.channels() != null
                ? fields.channels()
                : existing.map(AdminOverrideRecord::overrideChannels).orElse(null),
            reason != null ? reason : existing.map(AdminOverrideRecord::reason).orElse(null),
            existing.map(AdminOverrideRecord::notifyUser).orElse(false),
            actor,
            now);
    overrideRepository.upsert(merged);

    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("time", merged.overrideTime() == null ? null : merged.overrideTime().toString());
    details.put("frequency", merged.overrideFrequency());
    details.put("day_of_week", merged.overrideDayOfWeek());
    details.put(
        "channels",
        merged.overrideChannels() == null
            ? null
            : merged.overrideChannels().stream().map(NotificationChannel::key).toList());
    writeAudit(actor, AdminAuditAction.OVERRIDE_NOTIFICATION, target, reason, details, now);
    logger.info(
        "notification override saved actor={} targetType={} username={} targetKey={}",
        actor,
        target.type(),
        target.username(),
        target.targetKey());
    return merged;
  }

  @Transactional
  public AdminOverrideRecord disable(
      OverrideTarget target, String reason, boolean notifyUser, String actor) {
    requireActor(actor);
    final String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_DISABLE_REASON : reason;
    final Optional<AdminOverrideRecord> existing = overrideRepository.find(target);
    final Instant now = Instant.now(clock);
    final AdminOverrideRecord disabled =
        new AdminOverrideRecord(
            target,
            true,
            existing.map(AdminOverrideRecord::overrideTime).orElse(null),
            existing.map(AdminOverrideRecord::overrideFrequency).orElse(null),
            existing.map(AdminOverrideRecord::overrideDayOfWeek).orElse(null),
            existing.map(AdminOverrideRecord::overrideChannels).orElse(null),
            effectiveReason,
            notifyUser,
            actor,
            now);
    overrideRepository.upsert(disabled);

    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("notify_user", notifyUser);
    if (notifyUser) {
      final EnqueueResult notice = notificationService.enqueueAdminNotice(target, effectiveReason);
      details.put("notice_result", notice.resultCode());
    }
    writeAudit(actor, AdminAuditAction.DISABLE_NOTIFICATION, target, effectiveReason, details, now);
    logger.info(
        "notification disabled by admin actor={} targetType={} username={} targetKey={} notifyUser={}",
        actor,
        target.type(),
        target.username(),
        target.targetKey(),
        notifyUser);
    return disabled;
  }

  /** 上書きを削除してユーザー設定どおりの動作に戻す。 */
  @Transactional
  public void enable(OverrideTarget target, String actor) {
    requireActor(actor);
    final int deleted = overrideRepository.delete(target);
    if (deleted == 0) {
      throw new AdminOverrideNotFoundException(target);
    }
    writeAudit(actor, AdminAuditAction.ENABLE_NOTIFICATION, target, null, Map.of(), Instant.now(clock));
    logger.info(
        "notification override removed actor={} targetType={} username={} targetKey={}",
        actor,
        target.type(),
        target.username(),
        target.targetKey());
  }

  /**
   * 合成した通知を同期送信する。キューにもスケジュールにも書き込まない。
   *
   * <p>送信 IO の間は DB 接続を保持しない。書き込みは最後の監査行 1 件だけ。
   *
   * @param recipientOverride 宛先。{@code "user"} の場合は対象ユーザーの連絡先を使う
   */
  public TestDeliveryResult test(
      OverrideTarget target, NotificationChannel channel, String recipientOverride, String actor) {
    requireActor(actor);
    if (channel == null) {
      throw new IllegalArgumentException("channel is required");
    }
    if (recipientOverride == null || recipientOverride.isBlank()) {
      throw new IllegalArgumentException("recipient is required");
    }
    final NotificationTrigger trigger = triggerOf(target);
    TestDeliveryResult result;
    try {
      final String recipient =
          USER_RECIPIENT.equals(recipientOverride)
              ? recipientResolver.resolveAddress(target.username(), channel)
              : recipientOverride;
      result =
          deliveryService.sendTest(
              channel, recipient, target.username(), trigger, sampleTemplateData(target));
    } catch (DecryptionException | RecipientNotFoundException ex) {
      logger.warn(
          "test notification recipient unavailable username={} channel={}",
          target.username(),
          channel.key(),
          ex);
      result = new TestDeliveryResult(false, channel, null, null, null, ex.getMessage());
    }

    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("channel", channel.key());
    details.put("recipient", USER_RECIPIENT.equals(recipientOverride) ? USER_RECIPIENT : "override");
    details.put("success", result.success());
    details.put("error", result.error());
    writeAudit(actor, AdminAuditAction.TEST_NOTIFICATION, target, null, details, Instant.now(clock));
    return result;
  }

  public Optional<AdminOverrideRecord> find(OverrideTarget target) {
    return overrideRepository.find(target);
  }

  public List<AdminOverrideRecord> listByUsername(String username) {
    return overrideRepository.findByUsername(username);
  }

  /** 新しい順。 */
  public List<AdminAuditLogRecord> auditLog(int limit, int offset) {
    if (limit <= 0 || limit > MAX_AUDIT_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_AUDIT_LIMIT);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    return auditLogRepository.findRecent(limit, offset);
  }

  private NotificationTrigger triggerOf(OverrideTarget target) {
    if (target.type() == OverrideTargetType.TRIGGER) {
      return NotificationTrigger.valueOf(target.targetKey());
    }
    return NotificationTrigger.SAVED_SEARCH_MATCHES;
  }

  private Map<String, Object> sampleTemplateData(OverrideTarget target) {
    final Map<String, Object> match = new LinkedHashMap<>();
    match.put("username", "sample-match");
    match.put("displayName", "Sample Match");
    final Map<String, Object> recipient = new LinkedHashMap<>();
    recipient.put("username", target.username());
    recipient.put("displayName", target.username());
    final Map<String, Object> event = new LinkedHashMap<>();
    event.put("searchId", target.targetKey());
    event.put("searchName", target.targetKey());
    event.put("count", 3);
    event.put("field", "email");
    event.put("test", true);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("match", match);
    data.put("recipient", recipient);
    data.put("event", event);
    data.put("eventType", "admin_test");
    return data;
  }

  private void writeAudit(
      String actor,
      AdminAuditAction action,
      OverrideTarget target,
      String reason,
      Map<String, Object> details,
      Instant now) {
    auditLogRepository.insert(
        new AdminAuditLogRecord(
            UUID.randomUUID(),
            actor,
            action,
            target.type(),
            target.username(),
            target.targetKey(),
            reason,
            createDetailsJson(details),
            now));
  }

  private String createDetailsJson(Map<String, Object> details) {
    try {
      return objectMapper.writeValueAsString(details);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit details", e);
    }
  }

  private void requireActor(String actor) {
    if (actor == null || actor.isBlank()) {
      throw new IllegalArgumentException("actor_user_id is required");
    }
  }
}
