package com.example.notifier.api;

import com.example.notifier.api.response.JobTemplateResponse;
import com.example.notifier.job.JobTemplateRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/job-templates")
@RequiredArgsConstructor
public class JobTemplateController {

  private final JobTemplateRegistry registry;

  @GetMapping
  public List<JobTemplateResponse> list(
      @RequestParam(value = "category", required = false) String category) {
    return (category == null ? registry.list() : registry.listByCategory(category)).stream()
        .map(JobTemplateResponse::from)
        .toList();
  }

  @GetMapping("/{templateType}")
  public JobTemplateResponse get(@PathVariable("templateType") String templateType) {
    return JobTemplateResponse.from(registry.resolve(templateType));
  }
}
