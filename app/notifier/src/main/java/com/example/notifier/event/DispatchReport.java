package com.example.notifier.event;

public record DispatchReport(
    String eventType, boolean handled, int requestsBuilt, int enqueued, int rejected, int failed) {

  public static DispatchReport unhandled(String eventType) {
    return new DispatchReport(eventType, false, 0, 0, 0, 0);
  }
}
