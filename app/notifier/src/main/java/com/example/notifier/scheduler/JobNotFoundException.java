package com.example.notifier.scheduler;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(UUID jobId) {
    super("job not found id=" + jobId);
  }
}
