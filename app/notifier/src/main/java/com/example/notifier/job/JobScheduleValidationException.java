package com.example.notifier.job;

public class JobScheduleValidationException extends JobValidationException {

  public JobScheduleValidationException(String message) {
    super(message);
  }

  public JobScheduleValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
