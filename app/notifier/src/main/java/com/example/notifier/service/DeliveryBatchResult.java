package com.example.notifier.service;

import java.util.List;

public record DeliveryBatchResult(
    int claimed, int sent, int retried, int failed, int lockLost, List<String> errors) {

  public DeliveryBatchResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public boolean hasFailures() {
    return retried > 0 || failed > 0;
  }
}
