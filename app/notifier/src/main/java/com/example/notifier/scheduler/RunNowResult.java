package com.example.notifier.scheduler;

import java.util.UUID;

/** executionId は STARTED の場合だけ設定される。 */
public record RunNowResult(RunNowOutcome outcome, UUID executionId) {

  public static RunNowResult started(UUID executionId) {
    return new RunNowResult(RunNowOutcome.STARTED, executionId);
  }

  public static RunNowResult of(RunNowOutcome outcome) {
    return new RunNowResult(outcome, null);
  }
}
