package com.example.notifier.model;

public enum JobExecutionStatus {
  RUNNING,
  SUCCESS,
  FAILED,
  TIMEOUT,
  PARTIAL
}
