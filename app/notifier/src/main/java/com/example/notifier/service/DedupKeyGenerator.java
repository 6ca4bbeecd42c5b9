/*
 * どこで: Notifier enqueue 処理
 * 何を: 重複判定キーと advisory lock キーを生成する
 * なぜ: 同じ内容の通知をキー未指定でも同一視し、同一キーの enqueue を直列化するため
 */
package com.example.notifier.service;

import com.example.notifier.model.NotificationTrigger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DedupKeyGenerator {

  /** notification_queue.dedup_key の列幅。 */
  static final int MAX_KEY_LENGTH = 128;

  private final ObjectMapper canonicalMapper;

  public DedupKeyGenerator(ObjectMapper objectMapper) {
    // キー順を固定した JSON を正規形とする
    this.canonicalMapper =
        objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  public String keyFor(NotificationRequest request) {
    if (request.dedupKey() != null && !request.dedupKey().isBlank()) {
      final String key = request.dedupKey();
      // 外部 ID 由来のキーは列幅を超えうる。超えたキーだけ SHA-256 に置き換える
      return key.length() <= MAX_KEY_LENGTH
          ? key
          : Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
    }
    return contentKey(request.templateData());
  }

  public String contentKey(Map<String, Object> templateData) {
    try {
      final String canonical = canonicalMapper.writeValueAsString(templateData);
      return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("templateData is not serializable", ex);
    }
  }

  /** SHA-256 の先頭 8 byte を pg_advisory_xact_lock の 64-bit キーにする。 */
  public long lockKey(String username, NotificationTrigger trigger, String dedupKey) {
    final byte[] digest =
        Hashing.sha256()
            .hashString(username + "|" + trigger.name() + "|" + dedupKey, StandardCharsets.UTF_8)
            .asBytes();
    return Longs.fromByteArray(digest);
  }
}
