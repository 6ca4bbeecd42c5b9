package com.example.notifier.job;

import java.util.List;

public class JobParameterValidationException extends JobValidationException {

  public JobParameterValidationException(String templateType, List<String> violations) {
    super("invalid parameters for " + templateType + ": " + String.join(", ", violations), violations);
  }
}
