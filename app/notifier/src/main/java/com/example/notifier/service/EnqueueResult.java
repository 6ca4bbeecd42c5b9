package com.example.notifier.service;

import java.util.List;
import java.util.UUID;

public record EnqueueResult(boolean enqueued, List<UUID> entryIds, RejectionReason reason) {

  public static final String RESULT_ENQUEUED = "enqueued";

  public EnqueueResult {
    entryIds = entryIds == null ? List.of() : List.copyOf(entryIds);
  }

  public static EnqueueResult enqueued(List<UUID> entryIds) {
    return new EnqueueResult(true, entryIds, null);
  }

  public static EnqueueResult rejected(RejectionReason reason) {
    return new EnqueueResult(false, List.of(), reason);
  }

  public String resultCode() {
    return enqueued ? RESULT_ENQUEUED : reason.code();
  }
}
