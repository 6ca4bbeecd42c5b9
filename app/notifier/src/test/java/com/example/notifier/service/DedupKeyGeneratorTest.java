/*
 * どこで: DedupKeyGenerator の単体テスト
 * 何を: 呼び出し元キーの扱いと内容ハッシュの決定性を検証する
 * なぜ: 重複判定キーが常に dedup_key 列に収まり、同じ内容で同じキーになることを保証するため
 */
package com.example.notifier.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.notifier.model.NotificationPriority;
import com.example.notifier.model.NotificationTrigger;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DedupKeyGeneratorTest {

  private final DedupKeyGenerator generator = new DedupKeyGenerator(new ObjectMapper());

  @Test
  void keyForKeepsShortCallerKey() {
    assertThat(generator.keyFor(request("conv-1:msg-9"))).isEqualTo("conv-1:msg-9");
  }

  @Test
  void keyForHashesCallerKeyLongerThanColumn() {
    final String longKey = "conversation-" + "x".repeat(200) + ":message-1";

    final String key = generator.keyFor(request(longKey));

    assertThat(key).hasSizeLessThanOrEqualTo(DedupKeyGenerator.MAX_KEY_LENGTH);
    assertThat(key).isEqualTo(generator.keyFor(request(longKey)));
    assertThat(key).isNotEqualTo(generator.keyFor(request(longKey + "2")));
  }

  @Test
  void contentKeyIgnoresMapOrder() {
    final Map<String, Object> first = new LinkedHashMap<>();
    first.put("a", 1);
    first.put("b", "two");
    final Map<String, Object> second = new LinkedHashMap<>();
    second.put("b", "two");
    second.put("a", 1);

    assertThat(generator.contentKey(first)).isEqualTo(generator.contentKey(second));
  }

  private static NotificationRequest request(String dedupKey) {
    return new NotificationRequest(
        "alice",
        NotificationTrigger.NEW_MESSAGE,
        null,
        Map.of(),
        NotificationPriority.HIGH,
        dedupKey,
        null);
  }
}
