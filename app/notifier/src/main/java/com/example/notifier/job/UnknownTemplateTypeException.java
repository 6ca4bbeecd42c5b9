package com.example.notifier.job;

public class UnknownTemplateTypeException extends JobValidationException {

  public UnknownTemplateTypeException(String templateType) {
    super("unknown template type: " + templateType);
  }
}
