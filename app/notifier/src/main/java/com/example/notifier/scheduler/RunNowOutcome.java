package com.example.notifier.scheduler;

public enum RunNowOutcome {
  STARTED,
  BUSY,
  DISABLED,
  NOT_FOUND
}
