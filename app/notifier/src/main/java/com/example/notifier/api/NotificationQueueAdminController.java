package com.example.notifier.api;

import com.example.notifier.api.response.QueueEntryResponse;
import com.example.notifier.model.NotificationQueueRecord;
import com.example.notifier.repository.NotificationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** ユーザー単位のキュー状態を新しい順に返す。調査用で書き込みは行わない。 */
@RestController
@RequestMapping("/admin/notifications")
@RequiredArgsConstructor
public class NotificationQueueAdminController {

  private static final int MAX_LIMIT = 200;

  private final NotificationQueueRepository queueRepository;
  private final ObjectMapper objectMapper;

  @GetMapping("/queue")
  public List<QueueEntryResponse> queue(
      @RequestParam("username") String username,
      @RequestParam(value = "limit", defaultValue = "50") int limit) {
    if (username.isBlank()) {
      throw new IllegalArgumentException("username is required");
    }
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return queueRepository.findByUsername(username, limit).stream().map(this::toEntry).toList();
  }

  private QueueEntryResponse toEntry(NotificationQueueRecord record) {
    try {
      return QueueEntryResponse.from(record, objectMapper.readTree(record.templateDataJson()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("queue template data parse failure id=" + record.id(), ex);
    }
  }
}
