package com.example.notifier.model;

public enum JobRunStatus {
  NEVER_RUN,
  SUCCESS,
  FAILURE
}
