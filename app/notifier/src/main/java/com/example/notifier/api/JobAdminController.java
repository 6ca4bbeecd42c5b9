/*
 * どこで: Notifier 管理 API
 * 何を: ジョブ定義の CRUD、即時実行、有効/無効切り替え、実行履歴の参照を提供する
 * なぜ: 再デプロイせずにスケジュールとパラメータを運用で変更できるようにするため
 */
package com.example.notifier.api;

import com.example.notifier.api.request.JobDefinitionRequest;
import com.example.notifier.api.response.JobDefinitionResponse;
import com.example.notifier.api.response.JobExecutionResponse;
import com.example.notifier.api.response.RunNowResponse;
import com.example.notifier.scheduler.JobDefinitionService;
import com.example.notifier.scheduler.RunNowResult;
import com.example.notifier.scheduler.UnifiedScheduler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/jobs")
@RequiredArgsConstructor
@Validated
public class JobAdminController {

  static final String HEADER_ACTOR_USER_ID = "X-Actor-User-Id";

  private final JobDefinitionService jobDefinitionService;
  private final UnifiedScheduler scheduler;

  @GetMapping
  public List<JobDefinitionResponse> list() {
    return jobDefinitionService.list().stream().map(JobDefinitionResponse::from).toList();
  }

  @PostMapping
  public ResponseEntity<JobDefinitionResponse> create(
      @Valid @RequestBody JobDefinitionRequest request) {
    final JobDefinitionResponse response =
        JobDefinitionResponse.from(jobDefinitionService.create(request.toCommand()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{jobId}")
  public JobDefinitionResponse get(@PathVariable("jobId") UUID jobId) {
    return JobDefinitionResponse.from(jobDefinitionService.get(jobId));
  }

  @PutMapping("/{jobId}")
  public JobDefinitionResponse update(
      @PathVariable("jobId") UUID jobId, @Valid @RequestBody JobDefinitionRequest request) {
    return JobDefinitionResponse.from(jobDefinitionService.update(jobId, request.toCommand()));
  }

  @DeleteMapping("/{jobId}")
  public ResponseEntity<Void> delete(@PathVariable("jobId") UUID jobId) {
    jobDefinitionService.delete(jobId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{jobId}:enable")
  public JobDefinitionResponse enable(@PathVariable("jobId") UUID jobId) {
    return JobDefinitionResponse.from(jobDefinitionService.enable(jobId));
  }

  @PostMapping("/{jobId}:disable")
  public JobDefinitionResponse disable(@PathVariable("jobId") UUID jobId) {
    return JobDefinitionResponse.from(jobDefinitionService.disable(jobId));
  }

  /** STARTED は 202、実行中/無効は 409、未登録は 404。 */
  @PostMapping("/{jobId}:run")
  public ResponseEntity<RunNowResponse> run(
      @PathVariable("jobId") UUID jobId,
      @RequestHeader(HEADER_ACTOR_USER_ID)
          @NotBlank(message = "X-Actor-User-Id is required")
          String actorUserId) {
    final RunNowResult result = scheduler.runNow(jobId, actorUserId);
    final HttpStatus status =
        switch (result.outcome()) {
          case STARTED -> HttpStatus.ACCEPTED;
          case BUSY, DISABLED -> HttpStatus.CONFLICT;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    return ResponseEntity.status(status)
        .body(new RunNowResponse(jobId, result.outcome(), result.executionId()));
  }

  @GetMapping("/{jobId}/executions")
  public List<JobExecutionResponse> executions(
      @PathVariable("jobId") UUID jobId,
      @RequestParam(value = "limit", defaultValue = "20") int limit) {
    return jobDefinitionService.history(jobId, limit).stream()
        .map(JobExecutionResponse::from)
        .toList();
  }
}
