package com.example.notifier.job;

public class DuplicateTemplateTypeException extends JobValidationException {

  public DuplicateTemplateTypeException(String templateType) {
    super("duplicate template type: " + templateType);
  }
}
