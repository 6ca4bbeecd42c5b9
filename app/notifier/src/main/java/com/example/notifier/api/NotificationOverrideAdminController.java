/*
 * どこで: Notifier 管理 API
 * 何を: 管理者による通知の上書き/停止/再開/テスト送信と監査ログ参照を提供する
 * なぜ: ユーザー設定を書き換えずに運用側で通知を制御し、その操作を必ず記録するため
 */
package com.example.notifier.api;

import com.example.notifier.api.request.DisableOverrideRequest;
import com.example.notifier.api.request.OverrideRequest;
import com.example.notifier.api.request.TestNotificationRequest;
import com.example.notifier.api.response.AuditLogEntryResponse;
import com.example.notifier.api.response.OverrideResponse;
import com.example.notifier.api.response.TestDeliveryResponse;
import com.example.notifier.model.AdminAuditLogRecord;
import com.example.notifier.model.NotificationChannel;
import com.example.notifier.model.OverrideTarget;
import com.example.notifier.model.OverrideTargetType;
import com.example.notifier.service.AdminOverrideNotFoundException;
import com.example.notifier.service.AdminOverrideService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/notification-overrides")
@RequiredArgsConstructor
public class NotificationOverrideAdminController {

  private static final String HEADER_ACTOR_USER_ID = JobAdminController.HEADER_ACTOR_USER_ID;
  private static final String TARGET_PATH = "/{targetType}/{username}/{targetKey}";

  private final AdminOverrideService overrideService;
  private final ObjectMapper objectMapper;

  @GetMapping
  public List<OverrideResponse> listByUsername(@RequestParam("username") String username) {
    return overrideService.listByUsername(username).stream().map(OverrideResponse::from).toList();
  }

  @GetMapping(TARGET_PATH)
  public OverrideResponse get(
      @PathVariable("targetType") String targetType,
      @PathVariable("username") String username,
      @PathVariable("targetKey") String targetKey) {
    final OverrideTarget target = target(targetType, username, targetKey);
    return overrideService
        .find(target)
        .map(OverrideResponse::from)
        .orElseThrow(() -> new AdminOverrideNotFoundException(target));
  }

  @PostMapping(TARGET_PATH + ":override")
  public OverrideResponse override(
      @PathVariable("targetType") String targetType,
      @PathVariable("username") String username,
      @PathVariable("targetKey") String targetKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId,
      @Valid @RequestBody OverrideRequest request) {
    return OverrideResponse.from(
        overrideService.override(
            target(targetType, username, targetKey),
            request.toFields(),
            request.reason(),
            actorUserId));
  }

  @PostMapping(TARGET_PATH + ":disable")
  public OverrideResponse disable(
      @PathVariable("targetType") String targetType,
      @PathVariable("username") String username,
      @PathVariable("targetKey") String targetKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId,
      @RequestBody(required = false) DisableOverrideRequest request) {
    final DisableOverrideRequest body =
        request == null ? new DisableOverrideRequest(null, false) : request;
    return OverrideResponse.from(
        overrideService.disable(
            target(targetType, username, targetKey),
            body.reason(),
            body.notifyUser(),
            actorUserId));
  }

  @PostMapping(TARGET_PATH + ":enable")
  public ResponseEntity<Void> enable(
      @PathVariable("targetType") String targetType,
      @PathVariable("username") String username,
      @PathVariable("targetKey") String targetKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId) {
    overrideService.enable(target(targetType, username, targetKey), actorUserId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping(TARGET_PATH + ":test")
  public TestDeliveryResponse test(
      @PathVariable("targetType") String targetType,
      @PathVariable("username") String username,
      @PathVariable("targetKey") String targetKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId,
      @Valid @RequestBody TestNotificationRequest request) {
    return TestDeliveryResponse.from(
        overrideService.test(
            target(targetType, username, targetKey),
            NotificationChannel.fromKey(request.channel()),
            request.recipient(),
            actorUserId));
  }

  @GetMapping("/audit-log")
  public List<AuditLogEntryResponse> auditLog(
      @RequestParam(value = "limit", defaultValue = "50") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return overrideService.auditLog(limit, offset).stream().map(this::toAuditEntry).toList();
  }

  private OverrideTarget target(String targetType, String username, String targetKey) {
    return new OverrideTarget(OverrideTargetType.fromPath(targetType), username, targetKey);
  }

  private AuditLogEntryResponse toAuditEntry(AdminAuditLogRecord record) {
    try {
      final JsonNode details =
          record.detailsJson() == null ? null : objectMapper.readTree(record.detailsJson());
      return AuditLogEntryResponse.from(record, details);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("audit log details parse failure id=" + record.id(), ex);
    }
  }
}
