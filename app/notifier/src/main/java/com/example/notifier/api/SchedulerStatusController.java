package com.example.notifier.api;

import com.example.notifier.api.response.SchedulerStatusResponse;
import com.example.notifier.scheduler.UnifiedScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SchedulerStatusController {

  private final UnifiedScheduler scheduler;

  @GetMapping("/admin/scheduler/status")
  public SchedulerStatusResponse status() {
    return SchedulerStatusResponse.from(scheduler.status());
  }
}
